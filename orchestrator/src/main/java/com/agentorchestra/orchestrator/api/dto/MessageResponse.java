package com.agentorchestra.orchestrator.api.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for POST /copilotkit/messages: the assistant's reply and
 * the context the client should send back with its next message.
 */
public record MessageResponse(List<Map<String, Object>> messages,
                              Map<String, Object> context,
                              Instant timestamp) {

    public static MessageResponse assistant(String content, Map<String, Object> context) {
        Instant now = Instant.now();
        return new MessageResponse(
                List.of(Map.of("role", "assistant",
                               "content", content,
                               "timestamp", now.toString())),
                context,
                now);
    }
}
