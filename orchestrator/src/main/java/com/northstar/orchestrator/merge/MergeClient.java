package com.northstar.orchestrator.merge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.northstar.orchestrator.merge.MergeException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the Fast-Apply merge service (Morph).
 *
 * merge(instruction, original, update) is treated as an opaque text
 * transformation: we send the three parts in the service's tagged prompt
 * format and take back whatever merged file it produces. The service speaks
 * the chat-completions protocol, so the result is in choices[0].message.content.
 *
 * Raw java.net.http like the other outbound clients; every call is bounded
 * by the configured timeout (30 s by default).
 */
@Component
public class MergeClient {

    private static final Logger log = LoggerFactory.getLogger(MergeClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(ChoiceMessage message) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record ChoiceMessage(String role, String content) {}

        String firstContent() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                return null;
            }
            return choices.get(0).message().content();
        }
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final Duration     timeout;

    @Autowired
    public MergeClient(@Value("${northstar.merge.base-url}") String baseUrl,
                       @Value("${northstar.merge.api-key:}") String apiKey,
                       @Value("${northstar.merge.model:morph-v3-fast}") String model,
                       @Value("${northstar.merge.timeout:30s}") Duration timeout,
                       ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                baseUrl, apiKey, model, timeout, objectMapper);
    }

    MergeClient(HttpClient http, String baseUrl, String apiKey, String model,
                Duration timeout, ObjectMapper objectMapper) {
        this.http    = http;
        this.baseUrl = baseUrl;
        this.apiKey  = apiKey;
        this.model   = model;
        this.timeout = timeout;
        this.json    = objectMapper;
    }

    /**
     * Merge an update block into the original file contents.
     *
     * @param instruction what the change is meant to do, in plain language
     * @param original    the current file contents
     * @param updateBlock Fast-Apply excerpt with "... existing code ..." markers
     * @return the full merged file; never blank
     * @throws MergeException SERVICE_ERROR, TIMEOUT or EMPTY_RESULT
     */
    public String merge(String instruction, String original, String updateBlock) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MergeException(Kind.SERVICE_ERROR,
                    "Merge service API key is not configured (northstar.merge.api-key / MORPH_API_KEY)");
        }

        String content = "<instruction>" + instruction + "</instruction>\n"
                       + "<code>" + original + "</code>\n"
                       + "<update>" + updateBlock + "</update>";
        String body = toJson(Map.of(
                "model",    model,
                "messages", List.of(Map.of("role", "user", "content", content))));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(timeout)
                .header("Content-Type",  "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            log.info("Requesting merge ({} chars original, {} chars update)",
                    original.length(), updateBlock.length());
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new MergeException(Kind.TIMEOUT,
                    "Merge service timed out after " + timeout.toSeconds() + " seconds", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MergeException(Kind.TIMEOUT, "Merge request interrupted", e);
        } catch (Exception e) {
            throw new MergeException(Kind.SERVICE_ERROR, "Merge service request failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new MergeException(Kind.SERVICE_ERROR,
                    "Merge service returned HTTP " + status + ": " + response.body(),
                    status, response.body(), null);
        }

        String merged;
        try {
            merged = json.readValue(response.body(), CompletionResponse.class).firstContent();
        } catch (JsonProcessingException e) {
            throw new MergeException(Kind.SERVICE_ERROR,
                    "Unexpected merge service response format: " + e.getOriginalMessage(),
                    status, response.body(), e);
        }

        if (merged == null || merged.isBlank()) {
            throw new MergeException(Kind.EMPTY_RESULT,
                    "Merge service returned empty content. Full response: " + response.body(),
                    status, response.body(), null);
        }
        log.info("Merge succeeded ({} chars)", merged.length());
        return merged;
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new MergeException(Kind.SERVICE_ERROR, "JSON serialization failed", e);
        }
    }
}
