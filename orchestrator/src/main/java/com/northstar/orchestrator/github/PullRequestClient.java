package com.northstar.orchestrator.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.northstar.orchestrator.github.PullRequestException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Opens pull requests through the GitHub REST API.
 *
 * {@link #open} is idempotent per (repository, head, base): if an open PR
 * already exists for the head branch its URL is returned and nothing is
 * created. Re-running an execution after a partial failure therefore never
 * produces a duplicate PR.
 */
@Component
public class PullRequestClient {

    private static final Logger log = LoggerFactory.getLogger(PullRequestClient.class);

    private static final String API_VERSION = "2022-11-28";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PullRequest(@JsonProperty("html_url") String htmlUrl, int number) {}

    private static final TypeReference<List<PullRequest>> PR_LIST_TYPE = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       token;
    private final Duration     timeout;

    @Autowired
    public PullRequestClient(@Value("${northstar.github.api-url:https://api.github.com}") String apiUrl,
                             @Value("${northstar.github.token:}") String token,
                             @Value("${northstar.github.timeout:60s}") Duration timeout,
                             ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                apiUrl, token, timeout, objectMapper);
    }

    PullRequestClient(HttpClient http, String apiUrl, String token, Duration timeout, ObjectMapper objectMapper) {
        this.http    = http;
        this.apiUrl  = apiUrl;
        this.token   = token;
        this.timeout = timeout;
        this.json    = objectMapper;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Return the URL of the open PR for {@code head} into {@code base}, creating it if needed.
     *
     * @param repoFullname "owner/name"
     * @throws PullRequestException UNAUTHORIZED, REPO_NOT_FOUND, INVALID_REFS or UPSTREAM_ERROR
     */
    public String open(String repoFullname, String head, String base, String title, String body) {
        if (head == null || head.isBlank() || base == null || base.isBlank() || head.equals(base)) {
            throw new PullRequestException(Kind.INVALID_REFS,
                    "Head and base must be two different branches (head='" + head + "', base='" + base + "')");
        }
        if (token == null || token.isBlank()) {
            throw new PullRequestException(Kind.UNAUTHORIZED,
                    "GitHub token is not configured (northstar.github.token / GITHUB_TOKEN)");
        }
        String owner = ownerOf(repoFullname);

        List<PullRequest> existing = findOpen(repoFullname, owner, head, base);
        if (!existing.isEmpty()) {
            String url = existing.get(0).htmlUrl();
            log.info("Open PR already exists for {}:{} -> {}: {}", repoFullname, head, base, url);
            return url;
        }

        String payload = toJson(Map.of("title", title, "body", body, "head", head, "base", base));
        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(apiUrl + "/repos/" + repoFullname + "/pulls"))
                        .POST(HttpRequest.BodyPublishers.ofString(payload)),
                "create PR for " + repoFullname);
        PullRequest created = read(respBody, PullRequest.class);
        log.info("Created PR #{} for {}:{} -> {}: {}", created.number(), repoFullname, head, base, created.htmlUrl());
        return created.htmlUrl();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private List<PullRequest> findOpen(String repoFullname, String owner, String head, String base) {
        String query = "state=open"
                + "&head=" + encode(owner + ":" + head)
                + "&base=" + encode(base);
        String respBody = send(HttpRequest.newBuilder()
                        .uri(URI.create(apiUrl + "/repos/" + repoFullname + "/pulls?" + query))
                        .GET(),
                "list open PRs for " + repoFullname);
        return read(respBody, PR_LIST_TYPE);
    }

    /** Send with the common headers; non-2xx responses become typed exceptions. */
    private String send(HttpRequest.Builder builder, String opName) {
        HttpRequest request = builder
                .timeout(timeout)
                .header("Accept",               "application/vnd.github+json")
                .header("Authorization",        "Bearer " + token)
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("Content-Type",         "application/json")
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new PullRequestException(Kind.UPSTREAM_ERROR,
                    opName + " timed out after " + timeout.toSeconds() + " seconds", null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PullRequestException(Kind.UPSTREAM_ERROR, opName + " interrupted", null, e);
        } catch (Exception e) {
            throw new PullRequestException(Kind.UPSTREAM_ERROR, opName + " failed: " + e.getMessage(), null, e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            Kind kind = PullRequestException.kindFor(status);
            throw new PullRequestException(kind,
                    "GitHub API error (" + opName + ", HTTP " + status + "): "
                    + providerMessage(resp.body()) + hint(kind),
                    status, null);
        }
        return resp.body();
    }

    private String providerMessage(String body) {
        if (body == null || body.isBlank()) return "(empty response)";
        try {
            JsonNode node = json.readTree(body);
            StringBuilder sb = new StringBuilder(node.path("message").asText(body));
            JsonNode errors = node.path("errors");
            if (errors.isArray()) {
                errors.forEach(err -> {
                    String msg = err.path("message").asText(null);
                    if (msg != null) sb.append("; ").append(msg);
                });
            }
            return sb.toString();
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static String hint(Kind kind) {
        return switch (kind) {
            case UNAUTHORIZED   -> ". Hint: the GitHub token may be invalid, expired or missing repo scope.";
            case REPO_NOT_FOUND -> ". Hint: the repository does not exist or the token cannot see it.";
            case INVALID_REFS   -> ". Hint: check that base and head branches are different and exist.";
            case UPSTREAM_ERROR -> "";
        };
    }

    static String ownerOf(String repoFullname) {
        int slash = repoFullname == null ? -1 : repoFullname.indexOf('/');
        if (slash <= 0 || slash == repoFullname.length() - 1) {
            throw new PullRequestException(Kind.REPO_NOT_FOUND,
                    "Repository must be given as owner/name, got '" + repoFullname + "'");
        }
        return repoFullname.substring(0, slash);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new PullRequestException(Kind.UPSTREAM_ERROR,
                    "Unexpected GitHub response: " + e.getOriginalMessage(), null, e);
        }
    }

    private <T> T read(String body, TypeReference<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new PullRequestException(Kind.UPSTREAM_ERROR,
                    "Unexpected GitHub response: " + e.getOriginalMessage(), null, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new PullRequestException(Kind.UPSTREAM_ERROR, "JSON serialization failed", null, e);
        }
    }
}
