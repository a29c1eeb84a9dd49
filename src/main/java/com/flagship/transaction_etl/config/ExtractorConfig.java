package com.flagship.transaction_etl.config;

import com.flagship.transaction_etl.extract.PageFetchException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Wiring for the transaction source: HTTP timeouts and the bounded page retry.
 *
 * <p>Only {@link PageFetchException} is retried. The client wraps every transport,
 * status and payload failure in it, so anything else reaching the retry is a bug
 * and propagates immediately.
 */
@Slf4j
@Configuration
public class ExtractorConfig {

    @Value("${extractor.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${extractor.retry.wait-duration:500ms}")
    private Duration waitDuration;

    @Value("${extractor.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${extractor.read-timeout:30s}")
    private Duration readTimeout;

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean("pageFetchRetry")
    public Retry pageFetchRetry(RetryRegistry registry) {
        Retry retry = registry.retry("pageFetchRetry", pageFetchRetryConfig(maxAttempts, waitDuration));
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying page fetch (attempt {} of {}) in {}: {}",
                event.getNumberOfRetryAttempts() + 1, maxAttempts, event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
        log.info("Retry 'pageFetchRetry' created: maxAttempts={}, waitDuration={}", maxAttempts, waitDuration);
        return retry;
    }

    public static RetryConfig pageFetchRetryConfig(int maxAttempts, Duration waitDuration) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(waitDuration)
                .retryExceptions(PageFetchException.class)
                .build();
    }

    @Bean
    public RestClientCustomizer transactionSourceTimeouts() {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout((int) connectTimeout.toMillis());
            factory.setReadTimeout((int) readTimeout.toMillis());
            builder.requestFactory(factory);
        };
    }
}
