package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.model.ActionName;
import com.agentorchestra.orchestrator.model.ActionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point for client actions.
 *
 * The action name is checked against the {@link ActionName} allow-list
 * before anything runs. executeAgentTask goes to the {@link TaskExecutor},
 * executeWorkflow to the {@link PipelineExecutor}. The returned outcome
 * carries an execution_time_ms covering routing plus execution.
 */
@Service
public class ActionRouter {

    private static final Logger log = LoggerFactory.getLogger(ActionRouter.class);

    private final TaskExecutor     taskExecutor;
    private final PipelineExecutor pipelineExecutor;

    public ActionRouter(TaskExecutor taskExecutor, PipelineExecutor pipelineExecutor) {
        this.taskExecutor     = taskExecutor;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * @throws UnknownActionException        if the name is not on the allow-list
     * @throws ActionNotImplementedException if the action has no handler here
     */
    public ActionOutcome dispatch(String actionName, Map<String, Object> parameters, String tenantId) {
        long start = System.nanoTime();
        ActionName action = ActionName.fromWire(actionName)
                .orElseThrow(() -> new UnknownActionException(actionName));

        MDC.put("tenantId", String.valueOf(tenantId));
        MDC.put("action",   action.wireValue());
        try {
            log.info("Dispatching action {} for tenant {}", action.wireValue(), tenantId);
            ActionOutcome outcome = switch (action) {
                case EXECUTE_AGENT_TASK -> taskExecutor.execute(parameters, tenantId);
                case EXECUTE_WORKFLOW   -> pipelineExecutor.run(parameters, tenantId);
                case REQUEST_HUMAN_APPROVAL, REQUEST_HUMAN_INPUT ->
                        throw new ActionNotImplementedException(action.wireValue());
            };
            return outcome.withExecutionTimeMs(TaskExecutor.elapsedMs(start));
        } finally {
            MDC.remove("action");
            MDC.remove("tenantId");
        }
    }
}
