package com.agentorchestra.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Backs the default agent capabilities: each capability sends one
 * conversation with a role-specific system prompt and reads back the text.
 *
 * {@link HttpClient#send} is interruptible, so when the task executor
 * cancels a capability on deadline the in-flight request is abandoned and
 * the call ends with {@link ClaudeApiException}.
 */
@Component
public class ClaudeClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final String        apiKey;
    private final String        apiUrl;

    public ClaudeClient(@Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.api-url:https://api.anthropic.com/v1/messages}") String apiUrl,
                        ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param messages the conversation so far
     * @param system   system prompt, or null for none
     * @return the assistant's text content
     * @throws ClaudeApiException on a non-200 answer, a transport failure or an interrupt
     */
    public String complete(String model, List<Message> messages, String system) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ClaudeApiException("anthropic.api-key is not configured");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", MAX_TOKENS);
            if (system != null && !system.isBlank()) {
                body.put("system", system);
            }
            body.put("messages",   messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",          apiKey)
                    .header("anthropic-version",  API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            // { id, type, role, content: [{type, text}], ... }
            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return parsed.firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException("Claude API call interrupted");
        } catch (Exception e) {
            throw new ClaudeApiException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;

        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }

        public ClaudeApiException(String message) {
            this(message, null);
        }

        public ClaudeApiException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = -1;
        }

        /** HTTP status, or -1 when the call never got an answer. */
        public int statusCode() { return statusCode; }
    }
}
