package com.ai.tutoring.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link LlmClient} over plain HTTP. Supports OpenAI, Anthropic Claude,
 * Google Gemini and a local Ollama server; the provider is selected with
 * the {@code llm.provider} property.
 */
@Slf4j
@Component
public class HttpLlmClient implements LlmClient {

    private static final String SYSTEM_PROMPT =
            "You are an educational assistant for a tutoring platform. Always answer with a single JSON object.";

    @Value("${llm.provider:gemini}")
    private String provider;

    @Value("${llm.max-tokens:2000}")
    private int maxTokens;

    @Value("${llm.request-timeout:PT60S}")
    private Duration requestTimeout;

    @Value("${openai.api.key:}")
    private String openAiApiKey;
    @Value("${openai.api.url:https://api.openai.com/v1/chat/completions}")
    private String openAiApiUrl;
    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    @Value("${claude.api.key:}")
    private String claudeApiKey;
    @Value("${claude.api.url:https://api.anthropic.com/v1/messages}")
    private String claudeApiUrl;
    @Value("${claude.model:claude-sonnet-4-6}")
    private String claudeModel;

    @Value("${gemini.api.key:}")
    private String geminiApiKey;
    @Value("${gemini.api.url:https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:generateContent}")
    private String geminiApiUrl;

    @Value("${ollama.api.url:http://localhost:11434/api/generate}")
    private String ollamaApiUrl;
    @Value("${ollama.model:llama3.2}")
    private String ollamaModel;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    @Override
    public String sendPrompt(String prompt) throws IOException, InterruptedException {
        log.info("Sending prompt to LLM provider: {} ({} chars)", provider, prompt.length());
        return switch (provider.toLowerCase()) {
            case "openai" -> call("OpenAI", openAiRequest(prompt), "/choices/0/message/content");
            case "claude" -> call("Claude", claudeRequest(prompt), "/content/0/text");
            case "ollama" -> call("Ollama", ollamaRequest(prompt), "/response");
            default -> call("Gemini", geminiRequest(prompt), "/candidates/0/content/parts/0/text");
        };
    }

    @Override
    public String getActiveProvider() {
        return provider;
    }

    private String call(String name, HttpRequest request, String textPointer)
            throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        log.debug("{} response status: {}", name, response.statusCode());

        if (response.statusCode() != 200) {
            throw new IOException(name + " API error [" + response.statusCode() + "]: " + response.body());
        }

        JsonNode text = objectMapper.readTree(response.body()).at(textPointer);
        if (text.isMissingNode() || text.isNull()) {
            throw new IOException(name + " response did not contain generated text");
        }
        return text.asText();
    }

    private HttpRequest openAiRequest(String prompt) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", openAiModel);
        body.put("max_tokens", maxTokens);
        body.putArray("messages")
                .add(message("system", SYSTEM_PROMPT))
                .add(message("user", prompt));
        return jsonPost(openAiApiUrl, body)
                .header("Authorization", "Bearer " + openAiApiKey)
                .build();
    }

    private HttpRequest claudeRequest(String prompt) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", claudeModel);
        body.put("max_tokens", maxTokens);
        body.put("system", SYSTEM_PROMPT);
        body.putArray("messages").add(message("user", prompt));
        return jsonPost(claudeApiUrl, body)
                .header("x-api-key", claudeApiKey)
                .header("anthropic-version", "2023-06-01")
                .build();
    }

    private HttpRequest geminiRequest(String prompt) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", SYSTEM_PROMPT + "\n\n" + prompt);
        return jsonPost(geminiApiUrl + "?key=" + geminiApiKey, body).build();
    }

    private HttpRequest ollamaRequest(String prompt) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", ollamaModel);
        body.put("system", SYSTEM_PROMPT);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("format", "json");
        return jsonPost(ollamaApiUrl, body).build();
    }

    private ObjectNode message(String role, String content) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("role", role);
        msg.put("content", content);
        return msg;
    }

    private HttpRequest.Builder jsonPost(String url, ObjectNode body) throws IOException {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
    }
}
