package com.flagship.transaction_etl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST client for the remote transaction source.
 *
 * Each page is requested with {@code POST {extractor.api.url}} and a JSON body
 * {@code {"start_date", "end_date", "page", "page_size"}}; the API key, when
 * configured, travels in the {@code x-api-key} header.
 *
 * The response is either a JSON array of records or an object whose
 * {@code data} field holds that array. Array elements that are not JSON
 * objects are passed on as empty records so the cleaner counts them.
 */
@Slf4j
@Component
public class TransactionApiClient {

    static final String API_KEY_HEADER = "x-api-key";

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String apiKey;

    public TransactionApiClient(
            RestClient.Builder builder,
            ObjectMapper objectMapper,
            @Value("${extractor.api.url}") String apiUrl,
            @Value("${extractor.api.key:}") String apiKey) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
    }

    /**
     * Fetches one page of raw records.
     *
     * @param request Date window of the run
     * @param page 1-based page number
     * @param pageSize Requested records per page
     * @return Raw records of the page, empty when the source has no more data
     * @throws PageFetchException on any transport, status or payload failure
     */
    public List<Map<String, Object>> fetchPage(ExtractionRequest request, int page, int pageSize) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("start_date", request.getStartDate().toString());
        payload.put("end_date", request.getEndDate().toString());
        payload.put("page", page);
        payload.put("page_size", pageSize);

        String body;
        try {
            body = restClient.post()
                    .uri(apiUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            headers.set(API_KEY_HEADER, apiKey);
                        }
                    })
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new PageFetchException(page, e.getMessage(), e);
        }

        List<Map<String, Object>> records = parseRecords(page, body);
        log.debug("Fetched page {} with {} records", page, records.size());
        return records;
    }

    private List<Map<String, Object>> parseRecords(int page, String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PageFetchException(page, "unreadable payload: " + e.getOriginalMessage(), e);
        }

        JsonNode items = root.isObject() ? root.path("data") : root;
        if (!items.isArray()) {
            throw new PageFetchException(page, "payload is neither an array nor an object with a data array", null);
        }

        List<Map<String, Object>> records = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            records.add(item.isObject() ? objectMapper.convertValue(item, RECORD_TYPE) : new LinkedHashMap<>());
        }
        return records;
    }
}
