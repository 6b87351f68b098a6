package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.capability.input.AgentInput;
import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.QuotaStatus;
import com.agentorchestra.orchestrator.model.RequestValidationException;
import com.agentorchestra.orchestrator.model.Stage;
import com.agentorchestra.orchestrator.model.WorkflowRequest;
import com.agentorchestra.orchestrator.model.WorkflowResult;
import com.agentorchestra.orchestrator.model.WorkflowType;
import com.agentorchestra.orchestrator.quota.QuotaGate;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a workflow: the fixed stage sequence of its shape, one stage at a time.
 *
 * Order of checks:
 *   1. request shape, workflow name, and that the shape has a stage sequence
 *   2. quota gate, once for the whole run
 *   3. stages in order, each through {@link TaskExecutor#invoke} with its own deadline
 *
 * Stage i+1 only starts after stage i succeeded, and its input is built from
 * earlier outputs by {@link StageInputs}. The first failing stage ends the run:
 * the result keeps the outputs and names of the stages that finished before it.
 * Completed stages are never rolled back.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final TaskExecutor  taskExecutor;
    private final QuotaGate     quotaGate;
    private final MeterRegistry meterRegistry;

    public PipelineExecutor(TaskExecutor taskExecutor,
                            QuotaGate quotaGate,
                            MeterRegistry meterRegistry) {
        this.taskExecutor  = taskExecutor;
        this.quotaGate     = quotaGate;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Parse the raw {@code parameters} of an executeWorkflow action and run it. */
    public WorkflowResult run(Map<String, Object> parameters, String tenantId) {
        long start = System.nanoTime();
        WorkflowRequest request;
        try {
            request = WorkflowRequest.fromParameters(parameters);
        } catch (RequestValidationException e) {
            log.info("Rejected workflow: {}", e.getMessage());
            return WorkflowResult.failed(TaskExecutor.rawString(parameters, "workflow_type"),
                    Map.of(), List.of(), "Validation error: " + e.getMessage(),
                    TaskExecutor.elapsedMs(start));
        }
        return run(request, tenantId, start);
    }

    public WorkflowResult run(WorkflowRequest request, String tenantId) {
        return run(request, tenantId, System.nanoTime());
    }

    private WorkflowResult run(WorkflowRequest request, String tenantId, long start) {
        WorkflowType type = request.workflowType();
        String       name = type.wireValue();

        Map<Stage, AgentOutput>  outputs   = new EnumMap<>(Stage.class);
        Map<String, AgentOutput> results   = new LinkedHashMap<>();
        List<String>             completed = new ArrayList<>();

        MDC.put("workflowType", name);
        try {
            List<Stage> stages = type.stages().orElseThrow(() -> new RequestValidationException(
                    "Workflow type '" + name + "' has no defined stage sequence"));

            QuotaStatus quota = quotaGate.checkBudget(tenantId);
            if (!quota.canExecute()) {
                log.warn("Workflow {} denied by quota gate (tenant={}, used={}, limit={})",
                        name, tenantId, quota.used(), quota.limit());
                count(name, "quota_exceeded");
                return WorkflowResult.failed(name, Map.of(), List.of(),
                        "Budget limit exceeded for workflow execution", TaskExecutor.elapsedMs(start));
            }

            log.info("Starting workflow {} ({} stages)", name, stages.size());
            for (Stage stage : stages) {
                MDC.put("stage", stage.stageName());
                AgentInput input  = StageInputs.forStage(stage, request, outputs);
                Invocation outcome = taskExecutor.invoke(stage.agentType(), input);

                if (!outcome.isOk()) {
                    String error = describeFailure(stage, outcome);
                    log.warn("Workflow {} stopped at stage {} after {}: {}",
                            name, stage, completed, error);
                    count(name, "failed");
                    return WorkflowResult.failed(name, results, completed, error,
                            TaskExecutor.elapsedMs(start));
                }

                outputs.put(stage, outcome.output());
                results.put(stage.stageName(), outcome.output());
                completed.add(stage.stageName());
                log.info("Workflow {} completed stage {} ({}/{})",
                        name, stage, completed.size(), stages.size());
            }

            long elapsed = TaskExecutor.elapsedMs(start);
            log.info("Workflow {} completed in {} ms", name, elapsed);
            count(name, "ok");
            return WorkflowResult.succeeded(type, results, completed, elapsed);

        } catch (RequestValidationException e) {
            log.info("Rejected workflow {}: {}", name, e.getMessage());
            count(name, "rejected");
            return WorkflowResult.failed(name, Map.of(), List.of(),
                    "Validation error: " + e.getMessage(), TaskExecutor.elapsedMs(start));
        } catch (Exception e) {
            log.error("Unexpected error in workflow {} after {}", name, completed, e);
            count(name, "failed");
            return WorkflowResult.failed(name, results, completed,
                    "Workflow execution error: " + TaskExecutor.messageOf(e), TaskExecutor.elapsedMs(start));
        } finally {
            MDC.remove("stage");
            MDC.remove("workflowType");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String describeFailure(Stage stage, Invocation outcome) {
        return switch (outcome.kind()) {
            case TIMED_OUT -> "Workflow stage '" + stage.stageName() + "' timed out";
            case UNAVAILABLE, FAILED, OK ->
                    "Workflow stage '" + stage.stageName() + "' failed: " + outcome.errorMessage();
        };
    }

    /** orchestra.workflow.calls{workflow, outcome} */
    private void count(String workflow, String outcome) {
        meterRegistry.counter("orchestra.workflow.calls",
                "workflow", workflow, "outcome", outcome).increment();
    }
}
