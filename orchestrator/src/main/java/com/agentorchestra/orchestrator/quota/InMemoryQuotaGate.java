package com.agentorchestra.orchestrator.quota;

import com.agentorchestra.orchestrator.model.QuotaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local quota gate: a fixed number of admitted executions per
 * tenant per time window.
 *
 * Every allowed check consumes one unit. A limit of 0 (the default) lets
 * every tenant through. Counters live in memory only and reset on restart.
 */
@Component
public class InMemoryQuotaGate implements QuotaGate {

    private static final Logger log = LoggerFactory.getLogger(InMemoryQuotaGate.class);

    private final long     maxExecutions;
    private final Duration window;
    private final Clock    clock;

    private final Map<String, Usage> usage = new ConcurrentHashMap<>();

    /** Executions admitted for one tenant since windowStart. */
    private record Usage(Instant windowStart, long used) {}

    @Autowired
    public InMemoryQuotaGate(@Value("${orchestra.quota.max-executions-per-tenant:0}") long maxExecutions,
                             @Value("${orchestra.quota.window:24h}") Duration window) {
        this(maxExecutions, window, Clock.systemUTC());
    }

    InMemoryQuotaGate(long maxExecutions, Duration window, Clock clock) {
        this.maxExecutions = maxExecutions;
        this.window        = window;
        this.clock         = clock;
    }

    @Override
    public QuotaStatus checkBudget(String tenantId) {
        Instant now = clock.instant();
        boolean[] admitted = new boolean[1];

        // compute() runs atomically per tenant, so check-and-consume cannot race.
        Usage current = usage.compute(tenantId, (tenant, u) -> {
            if (u == null || !now.isBefore(u.windowStart().plus(window))) {
                u = new Usage(now, 0);
            }
            if (maxExecutions <= 0 || u.used() < maxExecutions) {
                admitted[0] = true;
                return new Usage(u.windowStart(), u.used() + 1);
            }
            return u;
        });

        if (maxExecutions <= 0) {
            return QuotaStatus.unlimited(current.used());
        }
        if (!admitted[0]) {
            log.warn("Tenant '{}' over quota: {}/{} executions in the current window",
                    tenantId, current.used(), maxExecutions);
        }
        return new QuotaStatus(admitted[0], current.used(), maxExecutions);
    }
}
