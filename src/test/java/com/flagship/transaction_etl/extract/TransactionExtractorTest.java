package com.flagship.transaction_etl.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.transaction_etl.config.ExtractorConfig;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Extraction tests against a mocked transaction source.
 *
 * Verifies pagination, the bounded page retry and that a failed page
 * never takes records of other pages with it.
 */
class TransactionExtractorTest {

    private static final String API_URL = "http://source.test/transactions";
    private static final ExtractionRequest JANUARY =
            new ExtractionRequest(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

    private MockRestServiceServer server;
    private TransactionApiClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new TransactionApiClient(builder, new ObjectMapper(), API_URL, "secret-key");
    }

    private TransactionExtractor extractor(int pageSize, int maxConsecutiveFailures) {
        Retry retry = Retry.of("test", ExtractorConfig.pageFetchRetryConfig(3, Duration.ofMillis(1)));
        return new TransactionExtractor(client, retry, pageSize, 100, maxConsecutiveFailures,
                "2023-01-01", "2023-01-31");
    }

    private static String page(String... customers) {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < customers.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"customer_id\":\"").append(customers[i])
                    .append("\",\"product_id\":\"P1\",\"transaction_date\":\"2024-01-05\",\"transaction_amount\":10.5}");
        }
        return json.append(']').toString();
    }

    private void expectPage(int page, String body) {
        server.expect(requestTo(API_URL))
                .andExpect(content().json("{\"page\":" + page + "}"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
    }

    private void expectFailingPage(int page, int times) {
        server.expect(ExpectedCount.times(times), requestTo(API_URL))
                .andExpect(content().json("{\"page\":" + page + "}"))
                .andRespond(withServerError());
    }

    @Nested
    @DisplayName("Pagination")
    class Pagination {

        @Test
        @DisplayName("Fetches pages until a short page")
        void fetchesUntilShortPage() {
            expectPage(1, page("C1", "C2"));
            expectPage(2, "{\"data\":" + page("C3") + "}");

            ExtractionResult result = extractor(2, 3).extract(JANUARY);

            server.verify();
            assertEquals(3, result.getRecords().size());
            assertEquals(2, result.getPagesFetched());
            assertFalse(result.hasPageFailures());
            assertEquals("C3", result.getRecords().get(2).get("customer_id"));
        }

        @Test
        @DisplayName("An empty page ends extraction")
        void emptyPageEnds() {
            expectPage(1, page("C1", "C2"));
            expectPage(2, "[]");

            ExtractionResult result = extractor(2, 3).extract(JANUARY);

            server.verify();
            assertEquals(2, result.getRecords().size());
        }

        @Test
        @DisplayName("Sends the date window, page and API key")
        void sendsRequestShape() {
            server.expect(requestTo(API_URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header(TransactionApiClient.API_KEY_HEADER, "secret-key"))
                    .andExpect(content().json(
                            "{\"start_date\":\"2024-01-01\",\"end_date\":\"2024-01-31\",\"page\":1,\"page_size\":500}", true))
                    .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

            extractor(500, 3).extract(JANUARY);

            server.verify();
        }
    }

    @Nested
    @DisplayName("Page failures")
    class PageFailures {

        @Test
        @DisplayName("A transient failure is retried and recovers")
        void transientFailureRecovers() {
            expectFailingPage(1, 1);
            expectPage(1, page("C1"));

            ExtractionResult result = extractor(2, 3).extract(JANUARY);

            server.verify();
            assertEquals(1, result.getRecords().size());
            assertFalse(result.hasPageFailures());
        }

        @Test
        @DisplayName("A page failing every attempt is recorded and skipped")
        void exhaustedPageSkipped() {
            expectFailingPage(1, 3);
            expectPage(2, page("C3"));

            ExtractionResult result = extractor(2, 3).extract(JANUARY);

            server.verify();
            assertEquals(List.of("C3"), result.getRecords().stream().map(r -> r.get("customer_id")).toList());
            assertEquals(1, result.getPageFailures().size());
            PageFailure failure = result.getPageFailures().get(0);
            assertEquals(1, failure.getPage());
            assertEquals(3, failure.getAttempts());
        }

        @Test
        @DisplayName("Too many consecutive failed pages stop extraction")
        void consecutiveFailuresStop() {
            expectPage(1, page("C1", "C2"));
            expectFailingPage(2, 3);
            expectFailingPage(3, 3);

            ExtractionResult result = extractor(2, 2).extract(JANUARY);

            server.verify();
            assertEquals(2, result.getRecords().size());
            assertEquals(List.of(2, 3), result.getPageFailures().stream().map(PageFailure::getPage).toList());
        }

        @Test
        @DisplayName("An unreadable payload is a page failure")
        void unreadablePayload() {
            server.expect(ExpectedCount.times(3), requestTo(API_URL))
                    .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

            ExtractionResult result = extractor(2, 1).extract(JANUARY);

            server.verify();
            assertTrue(result.getRecords().isEmpty());
            assertTrue(result.getPageFailures().get(0).getMessage().contains("unreadable payload"));
        }
    }

    @Test
    @DisplayName("Array elements that are not objects become empty records")
    void nonObjectElements() {
        expectPage(1, "[{\"customer_id\":\"C1\"}, 42, \"text\"]");

        List<Map<String, Object>> records = client.fetchPage(JANUARY, 1, 10);

        server.verify();
        assertEquals(3, records.size());
        assertEquals("C1", records.get(0).get("customer_id"));
        assertTrue(records.get(1).isEmpty());
        assertTrue(records.get(2).isEmpty());
    }

    @Test
    @DisplayName("End date before start date is refused")
    void invalidWindow() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExtractionRequest(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
    }
}
