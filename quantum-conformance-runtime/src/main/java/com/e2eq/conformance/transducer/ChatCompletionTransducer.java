package com.e2eq.conformance.transducer;

import com.e2eq.conformance.exceptions.TransducerException;
import com.e2eq.conformance.spi.PromptPayload;
import com.e2eq.conformance.spi.TextTransducer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.logging.Log;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Text transducer backed by a chat-completion HTTP endpoint. The rendered prompt is sent as a
 * single user message and the first choice's message content is returned.
 */
public class ChatCompletionTransducer implements TextTransducer {

    /** Connection settings of the endpoint. */
    public record Endpoint(EndpointKind kind, String baseUrl, String apiKey, String model, double temperature,
                           String apiVersion, Duration requestTimeout) {
        public Endpoint {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(baseUrl, "baseUrl");
            Objects.requireNonNull(model, "model");
            requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(60);
        }
    }

    private final Endpoint endpoint;
    private final PromptTemplates templates;
    private final ObjectMapper mapper;
    private final HttpClient client;

    public ChatCompletionTransducer(Endpoint endpoint, PromptTemplates templates, ObjectMapper mapper) {
        this(endpoint, templates, mapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public ChatCompletionTransducer(Endpoint endpoint, PromptTemplates templates, ObjectMapper mapper, HttpClient client) {
        this.endpoint = endpoint;
        this.templates = templates;
        this.mapper = mapper;
        this.client = client;
    }

    @Override
    public String transduce(PromptPayload payload) {
        String prompt = templates.render(payload);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url()))
                .timeout(endpoint.requestTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body(prompt), StandardCharsets.UTF_8));
        String key = endpoint.apiKey();
        if (key != null && !key.isBlank()) {
            if (endpoint.kind() == EndpointKind.AZURE) {
                builder.header("api-key", key);
            } else {
                builder.header("Authorization", "Bearer " + key);
            }
        }
        HttpRequest request = builder.build();

        Log.infof("[%s] %s request, attempt %d, prompt %d chars", endpoint.kind(), payload.kind(),
                payload.attemptIndex(), prompt.length());
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransducerException("Chat completion call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransducerException("Interrupted during chat completion call", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new TransducerException("Chat completion endpoint returned HTTP " + response.statusCode()
                    + ": " + abbreviate(response.body()), response.statusCode());
        }
        return content(response.body());
    }

    String url() {
        String base = endpoint.baseUrl().trim();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        switch (endpoint.kind()) {
            case AZURE:
                return base + "/openai/deployments/" + URLEncoder.encode(endpoint.model(), StandardCharsets.UTF_8)
                        + "/chat/completions?api-version="
                        + URLEncoder.encode(endpoint.apiVersion() != null ? endpoint.apiVersion() : "", StandardCharsets.UTF_8);
            default:
                return base + "/chat/completions";
        }
    }

    private String body(String prompt) {
        ObjectNode root = mapper.createObjectNode();
        if (endpoint.kind() != EndpointKind.AZURE) {
            root.put("model", endpoint.model());
        }
        root.put("temperature", endpoint.temperature());
        ObjectNode message = root.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new TransducerException("Cannot serialize chat completion request", e);
        }
    }

    private String content(String responseBody) {
        JsonNode root;
        try {
            root = mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new TransducerException("Chat completion response is not JSON: " + abbreviate(responseBody), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new TransducerException("Chat completion response carries no message content");
        }
        return content.asText();
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
