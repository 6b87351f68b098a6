package com.agentorchestra.orchestrator.api.dto;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request body for POST /copilotkit/messages.
 *
 * messages: chat history as {role, content} objects, oldest first
 * context:  optional hints such as repository_path, constraints, architecture
 */
public record MessageRequest(List<Map<String, Object>> messages, Map<String, Object> context) {

    public MessageRequest {
        if (messages == null) messages = List.of();
        if (context == null)  context  = Map.of();
    }

    public boolean hasUserMessage() {
        return messages.stream().anyMatch(m -> "user".equals(m.get("role")));
    }

    /** Content of the most recent user message, if it has non-blank text. */
    public Optional<String> latestUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Map<String, Object> m = messages.get(i);
            if ("user".equals(m.get("role"))) {
                Object content = m.get("content");
                return content instanceof String s && !s.isBlank()
                        ? Optional.of(s)
                        : Optional.empty();
            }
        }
        return Optional.empty();
    }
}
