package com.agentorchestra.orchestrator.api;

import com.agentorchestra.orchestrator.api.dto.ActionRequest;
import com.agentorchestra.orchestrator.model.ActionOutcome;
import com.agentorchestra.orchestrator.service.ActionNotImplementedException;
import com.agentorchestra.orchestrator.service.ActionRouter;
import com.agentorchestra.orchestrator.service.UnknownActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for frontend actions.
 *
 * POST /copilotkit/actions: run executeAgentTask or executeWorkflow
 *
 * Status codes:
 *   200: the action ran; success or failure is in the body
 *   400: action name not on the allow-list
 *   401: no X-Tenant-Id header
 *   501: allow-listed action with no server-side handler
 */
@RestController
@RequestMapping("/copilotkit")
public class ActionController {

    private static final Logger log = LoggerFactory.getLogger(ActionController.class);

    private final ActionRouter router;

    public ActionController(ActionRouter router) {
        this.router = router;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/copilotkit/actions \
     *     -H "Content-Type: application/json" -H "X-Tenant-Id: acme" \
     *     -d '{"name":"executeWorkflow","parameters":{"workflow_type":"architecture_only","repository_path":"src"}}'
     */
    @PostMapping("/actions")
    public ActionOutcome handleAction(
            @RequestHeader(name = TenantHeader.NAME, required = false) String tenantHeader,
            @RequestBody ActionRequest request) {
        String tenantId = TenantHeader.require(tenantHeader);
        try {
            return router.dispatch(request.name(), request.parameters(), tenantId);
        } catch (UnknownActionException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (ActionNotImplementedException e) {
            throw new ResponseStatusException(HttpStatus.NOT_IMPLEMENTED, e.getMessage());
        } catch (Exception e) {
            log.error("Action {} failed for tenant {}", request.name(), tenantId, e);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to execute action " + request.name() + ": " + e.getMessage());
        }
    }
}
