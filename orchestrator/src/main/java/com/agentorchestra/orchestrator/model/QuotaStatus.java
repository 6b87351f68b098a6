package com.agentorchestra.orchestrator.model;

/**
 * Answer of the quota gate for one tenant.
 *
 * Only canExecute is interpreted by the executors; used and limit are
 * accounting detail for logs.
 *
 * @param limit  maximum executions per window, or 0 for unlimited
 */
public record QuotaStatus(boolean canExecute, long used, long limit) {

    public static QuotaStatus unlimited(long used) {
        return new QuotaStatus(true, used, 0);
    }
}
