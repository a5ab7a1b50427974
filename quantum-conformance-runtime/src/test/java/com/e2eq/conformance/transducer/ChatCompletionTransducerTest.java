package com.e2eq.conformance.transducer;

import com.e2eq.conformance.exceptions.TransducerException;
import com.e2eq.conformance.io.ConformanceDefaults;
import com.e2eq.conformance.spi.PromptPayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ChatCompletionTransducerTest {

    private static final String REPLY = """
            {"choices":[{"index":0,"message":{"role":"assistant","content":"@prefix ex: <http://example.com/> ."}}]}
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final PromptTemplates templates = new PromptTemplates("generate ${policyId}: ${requestText}",
            "fix ${feedback}", Clock.systemUTC(), ConformanceDefaults.operands());

    private HttpServer server;
    private final AtomicReference<HttpExchange> lastExchange = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = REPLY;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastExchange.set(exchange);
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private ChatCompletionTransducer transducer(EndpointKind kind) {
        return transducer(kind, "secret");
    }

    private ChatCompletionTransducer transducer(EndpointKind kind, String apiKey) {
        return new ChatCompletionTransducer(new ChatCompletionTransducer.Endpoint(kind, baseUrl() + "/", apiKey,
                "gpt-test", 0.0, "2024-02-15-preview", Duration.ofSeconds(5)), templates, mapper);
    }

    @Test
    void testOpenAiCompatibleRequest() throws IOException {
        String out = transducer(EndpointKind.OPENAI_COMPATIBLE)
                .transduce(PromptPayload.generation("read access", "abcd1234"));

        assertEquals("@prefix ex: <http://example.com/> .", out);
        HttpExchange exchange = lastExchange.get();
        assertEquals("POST", exchange.getRequestMethod());
        assertEquals("/chat/completions", exchange.getRequestURI().getPath());
        assertEquals("Bearer secret", exchange.getRequestHeaders().getFirst("Authorization"));

        JsonNode body = mapper.readTree(lastBody.get());
        assertEquals("gpt-test", body.get("model").asText());
        assertEquals(0.0, body.get("temperature").asDouble());
        assertEquals(1, body.get("messages").size());
        assertEquals("user", body.get("messages").get(0).get("role").asText());
        assertEquals("generate abcd1234: read access", body.get("messages").get(0).get("content").asText());
    }

    @Test
    void testAzureRequestUsesDeploymentPathAndApiKeyHeader() throws IOException {
        transducer(EndpointKind.AZURE).transduce(PromptPayload.regeneration("req", "doc", "missing uid", 1));

        HttpExchange exchange = lastExchange.get();
        assertEquals("/openai/deployments/gpt-test/chat/completions", exchange.getRequestURI().getPath());
        assertEquals("api-version=2024-02-15-preview", exchange.getRequestURI().getQuery());
        assertEquals("secret", exchange.getRequestHeaders().getFirst("api-key"));
        assertNull(exchange.getRequestHeaders().getFirst("Authorization"));

        JsonNode body = mapper.readTree(lastBody.get());
        assertFalse(body.has("model"));
        assertEquals("fix missing uid", body.get("messages").get(0).get("content").asText());
    }

    @Test
    void testNoAuthHeaderWithoutApiKey() {
        transducer(EndpointKind.OPENAI_COMPATIBLE, null).transduce(PromptPayload.generation("r", "id"));
        assertNull(lastExchange.get().getRequestHeaders().getFirst("Authorization"));

        transducer(EndpointKind.AZURE, " ").transduce(PromptPayload.generation("r", "id"));
        assertNull(lastExchange.get().getRequestHeaders().getFirst("api-key"));
        assertNull(lastExchange.get().getRequestHeaders().getFirst("Authorization"));
    }

    @Test
    void testNon2xxCarriesStatusCode() {
        status = 503;
        responseBody = "{\"error\":\"overloaded\"}";
        TransducerException e = assertThrows(TransducerException.class,
                () -> transducer(EndpointKind.OPENAI_COMPATIBLE).transduce(PromptPayload.generation("r", "id")));
        assertEquals(503, e.getStatusCode());
        assertTrue(e.getMessage().contains("overloaded"), e.getMessage());
    }

    @Test
    void testMissingContentIsTransducerFailure() {
        responseBody = "{\"choices\":[]}";
        assertThrows(TransducerException.class,
                () -> transducer(EndpointKind.OPENAI_COMPATIBLE).transduce(PromptPayload.generation("r", "id")));
    }

    @Test
    void testNonJsonResponseIsTransducerFailure() {
        responseBody = "<html>gateway</html>";
        assertThrows(TransducerException.class,
                () -> transducer(EndpointKind.OPENAI_COMPATIBLE).transduce(PromptPayload.generation("r", "id")));
    }

    @Test
    void testConnectionFailureIsTransducerFailure() throws IOException {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        ChatCompletionTransducer unreachable = new ChatCompletionTransducer(new ChatCompletionTransducer.Endpoint(
                EndpointKind.OPENAI_COMPATIBLE, "http://127.0.0.1:" + port, null, "m", 0.0, null,
                Duration.ofSeconds(5)), templates, mapper);
        assertThrows(TransducerException.class, () -> unreachable.transduce(PromptPayload.generation("r", "id")));
    }
}
