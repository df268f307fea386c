package com.northstar.orchestrator.merge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.northstar.orchestrator.merge.MergeException.Kind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MergeClient. The HttpClient is a Mockito mock, so no
 * request ever leaves the JVM.
 */
@ExtendWith(MockitoExtension.class)
class MergeClientTest {

    private static final String BASE_URL = "http://merge.test/v1";

    @Mock HttpClient           http;
    @Mock HttpResponse<String> response;

    private MergeClient client(String apiKey) {
        return new MergeClient(http, BASE_URL, apiKey, "morph-v3-fast", Duration.ofSeconds(30), new ObjectMapper());
    }

    private void respond(int status, String body) throws Exception {
        when(response.statusCode()).thenReturn(status);
        lenient().when(response.body()).thenReturn(body);
        doReturn(response).when(http).send(any(HttpRequest.class), any());
    }

    @Test
    void merge_success_returnsMergedContent() throws Exception {
        respond(200, """
                {"id":"c1","choices":[{"index":0,"message":{"role":"assistant","content":"const bg = '#1a1a1a';"}}]}
                """);

        String merged = client("key-123").merge("darken button", "const bg = '#eee';", "const bg = '#1a1a1a';");

        assertThat(merged).isEqualTo("const bg = '#1a1a1a';");
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        HttpRequest sent = captor.getValue();
        assertThat(sent.uri().toString()).isEqualTo(BASE_URL + "/chat/completions");
        assertThat(sent.method()).isEqualTo("POST");
        assertThat(sent.headers().firstValue("Authorization")).contains("Bearer key-123");
    }

    @Test
    void merge_missingApiKey_failsWithoutCallingService() {
        assertThatThrownBy(() -> client(" ").merge("i", "a", "b"))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).getKind()).isEqualTo(Kind.SERVICE_ERROR));
        verifyNoInteractions(http);
    }

    @Test
    void merge_non2xx_isServiceErrorWithUpstreamDetails() throws Exception {
        respond(503, "{\"error\":\"overloaded\"}");

        assertThatThrownBy(() -> client("k").merge("i", "a", "b"))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> {
                    MergeException ex = (MergeException) e;
                    assertThat(ex.getKind()).isEqualTo(Kind.SERVICE_ERROR);
                    assertThat(ex.getStatusCode()).isEqualTo(503);
                    assertThat(ex.getUpstreamBody()).contains("overloaded");
                });
    }

    @Test
    void merge_httpTimeout_isTimeout() throws Exception {
        doThrow(new HttpTimeoutException("request timed out")).when(http).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> client("k").merge("i", "a", "b"))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).getKind()).isEqualTo(Kind.TIMEOUT));
    }

    @Test
    void merge_blankContent_isEmptyResult() throws Exception {
        respond(200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  \"}}]}");

        assertThatThrownBy(() -> client("k").merge("i", "a", "b"))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).getKind()).isEqualTo(Kind.EMPTY_RESULT));
    }

    @Test
    void merge_noChoices_isEmptyResult() throws Exception {
        respond(200, "{\"choices\":[]}");

        assertThatThrownBy(() -> client("k").merge("i", "a", "b"))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).getKind()).isEqualTo(Kind.EMPTY_RESULT));
    }

    @Test
    void merge_unparseableBody_isServiceError() throws Exception {
        respond(200, "<html>gateway</html>");

        assertThatThrownBy(() -> client("k").merge("i", "a", "b"))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).getKind()).isEqualTo(Kind.SERVICE_ERROR));
    }
}
