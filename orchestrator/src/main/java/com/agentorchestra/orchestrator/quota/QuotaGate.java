package com.agentorchestra.orchestrator.quota;

import com.agentorchestra.orchestrator.model.QuotaStatus;

/**
 * Consumption check consulted before any task or workflow runs.
 *
 * Implementations must be safe to call from many request threads at once.
 * The executors only look at {@link QuotaStatus#canExecute()}.
 */
public interface QuotaGate {

    QuotaStatus checkBudget(String tenantId);
}
