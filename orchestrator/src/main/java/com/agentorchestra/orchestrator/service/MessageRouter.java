package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.AgentType;
import com.agentorchestra.orchestrator.model.RequestValidationException;
import com.agentorchestra.orchestrator.model.TaskRequest;
import com.agentorchestra.orchestrator.model.TaskResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Routes a free-text chat message to one agent by keyword and runs it as
 * an ordinary task, so chat requests get the same quota check, deadline
 * and error classification as executeAgentTask.
 *
 * Routing, first match wins:
 *   "analyze" and "repository"   → repository_analyzer
 *   "architecture" or "design"   → architecture_designer
 *   "implement" or "plan"        → implementation_planner
 *   anything else                → requirements_extractor
 */
@Service
public class MessageRouter {

    static final String NO_SUMMARY = "No summary available";

    private final TaskExecutor taskExecutor;

    public MessageRouter(TaskExecutor taskExecutor) {
        this.taskExecutor = taskExecutor;
    }

    /**
     * @throws RequestValidationException if the message is blank
     */
    public TaskResult route(String userMessage, Map<String, Object> context, String tenantId) {
        Map<String, Object> ctx = context == null ? Map.of() : context;
        String message = userMessage == null ? "" : userMessage.strip();
        AgentType type = classify(message);
        return taskExecutor.execute(buildRequest(type, message, ctx), tenantId);
    }

    static AgentType classify(String message) {
        String text = message.toLowerCase(Locale.ROOT);
        if (text.contains("analyze") && text.contains("repository")) {
            return AgentType.REPOSITORY_ANALYZER;
        }
        if (text.contains("architecture") || text.contains("design")) {
            return AgentType.ARCHITECTURE_DESIGNER;
        }
        if (text.contains("implement") || text.contains("plan")) {
            return AgentType.IMPLEMENTATION_PLANNER;
        }
        return AgentType.REQUIREMENTS_EXTRACTOR;
    }

    /** Assistant reply for a successful task: a per-agent lead-in plus the summary. */
    public static String replyText(AgentType type, AgentOutput output) {
        String summary = output == null ? NO_SUMMARY : output.summary().orElse(NO_SUMMARY);
        return switch (type) {
            case REPOSITORY_ANALYZER    -> "Repository analysis complete. Key findings: " + summary;
            case ARCHITECTURE_DESIGNER  -> "Architecture design complete. Recommended approach: " + summary;
            case IMPLEMENTATION_PLANNER -> "Implementation plan created. Key steps: " + summary;
            case REQUIREMENTS_EXTRACTOR -> "Requirements extracted: " + summary;
            case VALIDATOR              -> "Validation complete: " + summary;
        };
    }

    private static TaskRequest buildRequest(AgentType type, String message, Map<String, Object> context) {
        Map<String, Object> params = new LinkedHashMap<>();
        switch (type) {
            case REPOSITORY_ANALYZER -> params.put("repository_path",
                    context.getOrDefault("repository_path", "."));
            case ARCHITECTURE_DESIGNER -> {
                params.put("requirements", Map.of("description", message));
                params.put("constraints", context.getOrDefault("constraints", Map.of()));
            }
            case IMPLEMENTATION_PLANNER -> {
                params.put("requirements", Map.of("description", message));
                params.put("architecture", context.getOrDefault("architecture", Map.of()));
            }
            case REQUIREMENTS_EXTRACTOR, VALIDATOR -> params.put("context", context);
        }
        String description = message.length() > TaskRequest.MAX_DESCRIPTION_LENGTH
                ? message.substring(0, TaskRequest.MAX_DESCRIPTION_LENGTH)
                : message;
        return new TaskRequest(type, description, params);
    }
}
