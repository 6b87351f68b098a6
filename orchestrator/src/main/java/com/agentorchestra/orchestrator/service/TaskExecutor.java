package com.agentorchestra.orchestrator.service;

import com.agentorchestra.orchestrator.capability.Capability;
import com.agentorchestra.orchestrator.capability.CapabilityRegistry;
import com.agentorchestra.orchestrator.capability.input.AgentInput;
import com.agentorchestra.orchestrator.capability.input.ArchitectureInput;
import com.agentorchestra.orchestrator.capability.input.PlanningInput;
import com.agentorchestra.orchestrator.capability.input.RepositoryAnalysisInput;
import com.agentorchestra.orchestrator.capability.input.RequirementsInput;
import com.agentorchestra.orchestrator.capability.input.ValidationInput;
import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.AgentType;
import com.agentorchestra.orchestrator.model.QuotaStatus;
import com.agentorchestra.orchestrator.model.RequestValidationException;
import com.agentorchestra.orchestrator.model.TaskRequest;
import com.agentorchestra.orchestrator.model.TaskResult;
import com.agentorchestra.orchestrator.quota.QuotaGate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one agent task.
 *
 * Steps, in order:
 *   1. validate the request and build its input → "Validation error: ..."
 *   2. ask the quota gate for the tenant        → "Budget limit exceeded"
 *   3. resolve the capability                   → "Agent <type> not available"
 *   4. invoke it with a hard deadline           → "Agent execution timed out"
 *   5. classify any exception it throws         → "Execution error: ..."
 *   6. otherwise success with the agent output
 *
 * The deadline counts from the moment a worker starts the capability, not
 * from submission. An invocation that waits in the worker queue longer than
 * {@code queueTimeout} is withdrawn and reported as "no worker available".
 *
 * {@link #execute} never throws: every path ends in a {@link TaskResult}.
 * Steps 3-5 are also exposed as {@link #invoke} for the pipeline, which
 * checks the quota once per run rather than once per stage.
 */
@Service
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String UNKNOWN   = "unknown";
    static final String NO_WORKER = "no worker available";

    private final CapabilityRegistry registry;
    private final QuotaGate          quotaGate;
    private final ExecutorService    workers;
    private final MeterRegistry      meterRegistry;
    private final Duration           taskTimeout;
    private final Duration           queueTimeout;

    @Autowired
    public TaskExecutor(CapabilityRegistry registry,
                        QuotaGate quotaGate,
                        @Qualifier("agentWorkers") ExecutorService workers,
                        MeterRegistry meterRegistry,
                        @Value("${orchestra.execution.task-timeout:300s}") Duration taskTimeout,
                        @Value("${orchestra.execution.queue-timeout:30s}") Duration queueTimeout) {
        this.registry      = registry;
        this.quotaGate     = quotaGate;
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
        this.taskTimeout   = taskTimeout;
        this.queueTimeout  = queueTimeout;
    }

    /** Queue wait bounded by the task deadline. */
    TaskExecutor(CapabilityRegistry registry,
                 QuotaGate quotaGate,
                 ExecutorService workers,
                 MeterRegistry meterRegistry,
                 Duration taskTimeout) {
        this(registry, quotaGate, workers, meterRegistry, taskTimeout, taskTimeout);
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Parse the raw {@code parameters} of an executeAgentTask action and run it.
     * When parsing fails the result echoes whatever agent type and
     * description the caller sent, or "unknown".
     */
    public TaskResult execute(Map<String, Object> parameters, String tenantId) {
        long start = System.nanoTime();
        TaskRequest request;
        try {
            request = TaskRequest.fromParameters(parameters);
        } catch (RequestValidationException e) {
            log.info("Rejected agent task: {}", e.getMessage());
            return TaskResult.failed(
                    rawString(parameters, "agent_type"),
                    rawString(parameters, "task_description"),
                    "Validation error: " + e.getMessage(),
                    elapsedMs(start));
        }
        return execute(request, tenantId, start);
    }

    public TaskResult execute(TaskRequest request, String tenantId) {
        return execute(request, tenantId, System.nanoTime());
    }

    private TaskResult execute(TaskRequest request, String tenantId, long start) {
        AgentType type        = request.agentType();
        String    description = request.taskDescription();
        MDC.put("agentType", type.wireValue());
        try {
            AgentInput input = inputFor(request);

            QuotaStatus quota = quotaGate.checkBudget(tenantId);
            if (!quota.canExecute()) {
                log.warn("Task for agent {} denied by quota gate (tenant={}, used={}, limit={})",
                        type, tenantId, quota.used(), quota.limit());
                return TaskResult.failed(type.wireValue(), description,
                        "Budget limit exceeded", elapsedMs(start));
            }

            Optional<Capability<?>> capability = registry.resolve(type);
            if (capability.isEmpty()) {
                log.warn("No capability registered for agent {}", type);
                return TaskResult.failed(type.wireValue(), description,
                        Invocation.unavailable(type).errorMessage(), elapsedMs(start));
            }

            Invocation outcome = invoke(capability.get(), type, input);
            if (outcome.isOk()) {
                long elapsed = elapsedMs(start);
                log.info("Task for agent {} completed in {} ms", type, elapsed);
                return TaskResult.succeeded(type, description, outcome.output(), elapsed);
            }
            log.warn("Task for agent {} failed: {}", type, outcome.errorMessage());
            return TaskResult.failed(type.wireValue(), description, outcome.errorMessage(), elapsedMs(start));

        } catch (RequestValidationException e) {
            log.info("Rejected agent task for {}: {}", type, e.getMessage());
            return TaskResult.failed(type.wireValue(), description,
                    "Validation error: " + e.getMessage(), elapsedMs(start));
        } catch (Exception e) {
            log.error("Unexpected error running task for agent {}", type, e);
            return TaskResult.failed(type.wireValue(), description,
                    "Execution error: " + messageOf(e), elapsedMs(start));
        } finally {
            MDC.remove("agentType");
        }
    }

    /**
     * Resolve and invoke one capability under the task deadline.
     * Used by the pipeline for each stage; performs no quota check.
     */
    public Invocation invoke(AgentType type, AgentInput input) {
        Optional<Capability<?>> capability = registry.resolve(type);
        if (capability.isEmpty()) {
            return Invocation.unavailable(type);
        }
        return invoke(capability.get(), type, input);
    }

    // ------------------------------------------------------------------
    // Deadline enforcement
    // ------------------------------------------------------------------

    /**
     * Run the capability on the worker pool. The caller first waits up to
     * {@code queueTimeout} for a worker to pick the call up, then at most
     * {@code taskTimeout} from that moment. On deadline expiry the future is
     * cancelled with interrupt, which is the only cancellation this class
     * performs on a running capability.
     *
     * Every call is timed and counted:
     * <pre>
     *   orchestra.task.calls{agent, outcome="ok|timed_out|failed"}
     *   orchestra.task.duration{agent}
     * </pre>
     */
    private Invocation invoke(Capability<?> capability, AgentType type, AgentInput input) {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        CountDownLatch started = new CountDownLatch(1);
        Timer.Sample sample = Timer.start(meterRegistry);
        Invocation outcome;
        Future<AgentOutput> future = null;
        try {
            future = workers.submit(() -> {
                started.countDown();
                if (callerContext != null) {
                    MDC.setContextMap(callerContext);
                }
                try {
                    return capability.invokeWith(input);
                } finally {
                    MDC.clear();
                }
            });
            if (!started.await(queueTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                future.cancel(true);
                log.warn("Agent {} waited {} ms for a worker, withdrawn", type, queueTimeout.toMillis());
                outcome = Invocation.failed(NO_WORKER);
            } else {
                AgentOutput output = future.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
                outcome = output != null
                        ? Invocation.ok(output)
                        : Invocation.failed("Agent " + type.wireValue() + " returned no output");
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Agent {} exceeded its {} ms deadline, cancelled", type, taskTimeout.toMillis());
            outcome = Invocation.timedOut();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Agent {} raised {}: {}", type, cause.getClass().getSimpleName(), cause.getMessage());
            outcome = Invocation.failed(messageOf(cause));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool full, rejected invocation of agent {}", type);
            outcome = Invocation.failed(NO_WORKER);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            outcome = Invocation.failed("interrupted while waiting for agent");
        } finally {
            sample.stop(meterRegistry.timer("orchestra.task.duration", "agent", type.wireValue()));
        }
        meterRegistry.counter("orchestra.task.calls",
                "agent", type.wireValue(), "outcome", outcome.kind().name().toLowerCase()).increment();
        return outcome;
    }

    // ------------------------------------------------------------------
    // Input construction
    // ------------------------------------------------------------------

    /**
     * Map task parameters onto the agent's typed input.
     * requirements_extractor takes the task description as its project description.
     */
    static AgentInput inputFor(TaskRequest request) {
        return switch (request.agentType()) {
            case REPOSITORY_ANALYZER -> new RepositoryAnalysisInput(
                    stringParameter(request, "repository_path", "."),
                    focusAreas(request.parameter("focus_areas", null)));
            case REQUIREMENTS_EXTRACTOR -> new RequirementsInput(
                    request.taskDescription(),
                    AgentOutput.asObject(request.parameter("context", null)));
            case ARCHITECTURE_DESIGNER -> new ArchitectureInput(
                    AgentOutput.asObject(request.parameter("requirements", null)),
                    AgentOutput.asObject(request.parameter("constraints", null)));
            case IMPLEMENTATION_PLANNER -> new PlanningInput(
                    AgentOutput.asObject(request.parameter("architecture", null)),
                    AgentOutput.asObject(request.parameter("requirements", null)));
            case VALIDATOR -> new ValidationInput(
                    AgentOutput.asObject(request.parameter("implementation", null)),
                    AgentOutput.asObject(request.parameter("requirements", null)));
        };
    }

    private static String stringParameter(TaskRequest request, String name, String fallback) {
        Object v = request.parameter(name, fallback);
        if (!(v instanceof String s)) {
            throw new RequestValidationException(name + " must be a string");
        }
        return s;
    }

    private static List<String> focusAreas(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String s) {
            return List.of(s);
        }
        if (value instanceof Collection<?> items) {
            List<String> areas = new ArrayList<>();
            for (Object item : items) {
                if (item != null) areas.add(String.valueOf(item));
            }
            return areas;
        }
        throw new RequestValidationException("focus_areas must be a list of strings");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String rawString(Map<String, Object> parameters, String field) {
        if (parameters == null) return UNKNOWN;
        Object v = parameters.get(field);
        return v != null ? String.valueOf(v) : UNKNOWN;
    }

    static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
