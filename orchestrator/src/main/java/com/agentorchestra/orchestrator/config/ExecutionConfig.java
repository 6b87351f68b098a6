package com.agentorchestra.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool that capability invocations run on.
 *
 * The request thread submits the invocation here and waits on the future
 * with the task deadline; on expiry the future is cancelled with interrupt.
 * A fixed pool caps how many agent calls are in flight at once, and the
 * bounded queue caps how many wait for a worker. Once both are full,
 * submission is rejected and the task reports that no worker is available.
 */
@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentWorkers(@Value("${orchestra.execution.worker-threads:8}") int workerThreads,
                                        @Value("${orchestra.execution.queue-capacity:16}") int queueCapacity) {
        return workerPool(workerThreads, queueCapacity);
    }

    /**
     * @param queueCapacity waiting slots; 0 hands off directly and rejects
     *                      when every worker is busy
     */
    public static ExecutorService workerPool(int workerThreads, int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = r -> {
            Thread t = new Thread(r, "agent-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        BlockingQueue<Runnable> queue = queueCapacity > 0
                ? new ArrayBlockingQueue<>(queueCapacity)
                : new SynchronousQueue<>();
        return new ThreadPoolExecutor(workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
                queue, threads, new ThreadPoolExecutor.AbortPolicy());
    }
}
