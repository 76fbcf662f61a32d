package com.lineage.sync.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("HttpQueryTransport Tests")
class HttpQueryTransportTest {

    // ========== Classification ==========

    @Nested
    @DisplayName("Response classification")
    class Classification {

        @Test
        @DisplayName("2xx is success")
        void success() {
            assertNull(HttpQueryTransport.classify(200, "{}"));
        }

        @Test
        @DisplayName("Conflict marker wins over status")
        void conflict() {
            String body = "{\"code\":\"ConcurrentModificationException\",\"detailedMessage\":\"Operation failed\"}";
            assertInstanceOf(ConcurrentModificationConflictException.class, HttpQueryTransport.classify(400, body));
            assertInstanceOf(ConcurrentModificationConflictException.class, HttpQueryTransport.classify(500, body));
        }

        @Test
        @DisplayName("Other 4xx is a rejection carrying the status")
        void rejection() {
            GraphQueryException e = HttpQueryTransport.classify(400, "{\"code\":\"MalformedQueryException\"}");
            assertInstanceOf(QueryRejectedException.class, e);
            assertEquals(400, ((QueryRejectedException) e).getStatusCode());
        }

        @Test
        @DisplayName("5xx is transient and long bodies are abbreviated")
        void transientFailure() {
            GraphQueryException e = HttpQueryTransport.classify(503, "x".repeat(2000));
            assertInstanceOf(TransientQueryException.class, e);
            assertTrue(e.getMessage().length() < 600);
        }
    }

    // ========== Requests ==========

    @Nested
    @DisplayName("Requests")
    class Requests {

        private HttpClient httpClient;
        private HttpResponse<String> response;
        private EndpointOptions options;

        @BeforeEach
        @SuppressWarnings("unchecked")
        void setUp() {
            httpClient = mock(HttpClient.class);
            response = mock(HttpResponse.class);
            options = EndpointOptions.builder()
                    .endpoint("graph.example.com")
                    .requestTimeout(Duration.ofSeconds(7))
                    .build();
        }

        @Test
        @DisplayName("Posts the rendered query with signed headers")
        void postsSignedQuery() throws Exception {
            AtomicReference<String> signedBody = new AtomicReference<>();
            RequestSigner signer = (method, uri, headers, body) -> {
                signedBody.set(body);
                Map<String, List<String>> signed = new LinkedHashMap<>(headers);
                signed.put("Authorization", List.of("AWS4-HMAC-SHA256 test"));
                signed.put("Host", List.of(uri.getHost()));
                return signed;
            };
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"result\":{\"data\":[]}}");
            doReturn(response).when(httpClient).send(any(), any());

            HttpQueryTransport transport = new HttpQueryTransport(options, signer, httpClient);
            String body = transport.submit(GremlinQueries.countVertices());

            assertEquals("{\"result\":{\"data\":[]}}", body);
            assertEquals("{\"gremlin\":\"g.V().count()\"}", signedBody.get());

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest request = captor.getValue();
            assertEquals("POST", request.method());
            assertEquals(URI.create("https://graph.example.com:8182/gremlin"), request.uri());
            assertEquals(Duration.ofSeconds(7), request.timeout().orElseThrow());
            assertEquals("AWS4-HMAC-SHA256 test", request.headers().firstValue("Authorization").orElseThrow());
            assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());
            assertTrue(request.headers().firstValue("Host").isEmpty());
        }

        @Test
        @DisplayName("Error responses are thrown as classified failures")
        void errorResponse() throws Exception {
            when(response.statusCode()).thenReturn(400);
            when(response.body()).thenReturn("{\"code\":\"ConcurrentModificationException\"}");
            doReturn(response).when(httpClient).send(any(), any());

            HttpQueryTransport transport = new HttpQueryTransport(options, RequestSigner.UNSIGNED, httpClient);

            assertThrows(ConcurrentModificationConflictException.class,
                    () -> transport.submit(GremlinQueries.countEdges()));
        }

        @Test
        @DisplayName("Timeouts and I/O failures are transient")
        void timeoutsAreTransient() throws Exception {
            HttpQueryTransport transport = new HttpQueryTransport(options, RequestSigner.UNSIGNED, httpClient);

            doThrow(new HttpTimeoutException("timed out")).when(httpClient).send(any(), any());
            assertThrows(TransientQueryException.class, () -> transport.submit(GremlinQueries.countEdges()));

            doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());
            assertThrows(TransientQueryException.class, () -> transport.submit(GremlinQueries.countEdges()));
        }

        @Test
        @DisplayName("Describes its endpoint")
        void describe() {
            HttpQueryTransport transport = new HttpQueryTransport(options, RequestSigner.UNSIGNED, httpClient);
            assertEquals("https://graph.example.com:8182/gremlin", transport.describe());
        }
    }
}
