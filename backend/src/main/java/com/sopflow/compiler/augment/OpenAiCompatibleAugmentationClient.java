package com.sopflow.compiler.augment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link AugmentationClient} backed by an OpenAI-compatible {@code /chat/completions} endpoint.
 */
public class OpenAiCompatibleAugmentationClient implements AugmentationClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleAugmentationClient.class);

    static final String SYSTEM_PROMPT = """
            You restructure the body of one task of an SOP workflow DSL.
            Keep every directive line (@tool, @agent, @if, @else, @next) and every {{name}} placeholder.
            Turn free-form sentences that describe tool use or decisions into @tool or @if/@else lines,
            indenting branch bodies by four spaces. Do not add @task, @var or @lang lines.
            Answer with the DSL body only, without explanations or code fences.
            """;

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public OpenAiCompatibleAugmentationClient(ObjectMapper objectMapper, String baseUrl, String apiKey, String model) {
        this(objectMapper, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                baseUrl, apiKey, model);
    }

    OpenAiCompatibleAugmentationClient(ObjectMapper objectMapper, HttpClient httpClient,
                                       String baseUrl, String apiKey, String model) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public AugmentationResponse augment(AugmentationRequest request) throws IOException, InterruptedException {
        String requestJson = objectMapper.writeValueAsString(buildPayload(request));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(chatCompletionsUrl()))
                .timeout(request.timeout())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestJson, StandardCharsets.UTF_8));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        long startedAt = System.currentTimeMillis();
        HttpResponse<String> response = httpClient.send(builder.build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        logger.debug("Augmentation of '{}' answered {} in {} ms",
                request.key(), response.statusCode(), System.currentTimeMillis() - startedAt);

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("Chat completion failed (http=" + response.statusCode()
                    + ", model=" + model + ", error=" + shorten(response.body()) + ")");
        }
        return parseResponse(request, response.body());
    }

    ObjectNode buildPayload(AugmentationRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        payload.put("temperature", 0);
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", request.text());
        return payload;
    }

    AugmentationResponse parseResponse(AugmentationRequest request, String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new IOException("Chat completion response has no message content: " + shorten(body));
        }

        String fragment = stripCodeFence(content.asText()).strip();
        if (fragment.isEmpty() || fragment.equals(request.text().strip())) {
            return AugmentationResponse.unchanged();
        }
        return AugmentationResponse.rewritten(fragment);
    }

    static String stripCodeFence(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("```")) {
            return text;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return trimmed.substring(firstNewline + 1, closing);
    }

    private String chatCompletionsUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base.endsWith("/chat/completions") ? base : base + "/chat/completions";
    }

    private static String shorten(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 300 ? value : value.substring(0, 300) + "...";
    }
}
