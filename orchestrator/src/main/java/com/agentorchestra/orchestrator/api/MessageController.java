package com.agentorchestra.orchestrator.api;

import com.agentorchestra.orchestrator.api.dto.MessageRequest;
import com.agentorchestra.orchestrator.api.dto.MessageResponse;
import com.agentorchestra.orchestrator.model.AgentType;
import com.agentorchestra.orchestrator.model.RequestValidationException;
import com.agentorchestra.orchestrator.model.TaskResult;
import com.agentorchestra.orchestrator.service.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for the chat sidebar.
 *
 * POST /copilotkit/messages: answer the latest user message with one agent
 *
 * Status codes:
 *   200: the agent answered
 *   400: no user message in the request, or one that is not a valid task
 *   401: no X-Tenant-Id header
 *   502: the agent task failed (quota, timeout, agent error)
 */
@RestController
@RequestMapping("/copilotkit")
public class MessageController {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);

    private final MessageRouter messageRouter;

    public MessageController(MessageRouter messageRouter) {
        this.messageRouter = messageRouter;
    }

    @PostMapping("/messages")
    public MessageResponse handleMessages(
            @RequestHeader(name = TenantHeader.NAME, required = false) String tenantHeader,
            @RequestBody MessageRequest request) {
        String tenantId = TenantHeader.require(tenantHeader);

        if (!request.hasUserMessage()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At least one user message is required");
        }
        String userMessage = request.latestUserMessage().orElseThrow(() ->
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "No user message found"));

        TaskResult result;
        try {
            result = messageRouter.route(userMessage, request.context(), tenantId);
        } catch (RequestValidationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (!result.success()) {
            log.warn("Chat message for tenant {} failed: {}", tenantId, result.error());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY,
                    "Failed to process message: " + result.error());
        }
        String reply = MessageRouter.replyText(AgentType.fromWire(result.agentType()), result.result());
        return MessageResponse.assistant(reply, request.context());
    }
}
