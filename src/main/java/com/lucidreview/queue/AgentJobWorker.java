package com.lucidreview.queue;

import com.lucidreview.config.ReviewAgentProperties;
import com.lucidreview.orchestration.service.BestEffort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pulls jobs off the {@link JobQueue} and runs them on a fixed pool. A single scheduler thread
 * polls the queue; it only claims a job when a pool slot is free, so at most
 * {@code concurrency} jobs are active in this process.
 * <p>
 * The same thread renews the lease of every job running here. Jobs whose lease ran out on
 * another process are treated as a failed attempt: retried while attempts remain, otherwise
 * failed through the {@link JobFailureHook}.
 */
@Slf4j
public class AgentJobWorker implements SmartLifecycle {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
    static final String STALLED_ERROR = "Job stalled: lease expired before it finished";

    private final JobQueue queue;
    private final AgentJobHandler handler;
    private final JobFailureHook failureHook;
    private final JobRetryPolicy retryPolicy;
    private final int concurrency;
    private final Duration pollInterval;
    private final Duration leaseRenewal;
    private final boolean autoStartup;
    private final Semaphore slots;
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private ScheduledExecutorService poller;
    private ExecutorService workers;

    public AgentJobWorker(JobQueue queue,
                          AgentJobHandler handler,
                          JobFailureHook failureHook,
                          JobRetryPolicy retryPolicy,
                          ReviewAgentProperties.QueueConfig config) {
        this.queue = queue;
        this.handler = handler;
        this.failureHook = failureHook;
        this.retryPolicy = retryPolicy;
        this.concurrency = config.getConcurrency();
        this.pollInterval = config.getPollInterval();
        this.leaseRenewal = Duration.ofMillis(Math.max(1, config.getLockDuration().toMillis() / 3));
        this.autoStartup = config.isWorkerEnabled();
        this.slots = new Semaphore(concurrency);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        AtomicInteger workerIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(concurrency,
                runnable -> new Thread(runnable, "agent-worker-" + workerIndex.incrementAndGet()));
        poller = Executors.newSingleThreadScheduledExecutor(runnable -> new Thread(runnable, "agent-queue-poller"));
        poller.scheduleWithFixedDelay(this::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        poller.scheduleWithFixedDelay(this::renewLeases, leaseRenewal.toMillis(), leaseRenewal.toMillis(),
                TimeUnit.MILLISECONDS);
        running = true;
        log.info("Agent job worker started with concurrency {}.", concurrency);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        poller.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Agent jobs still running after {}s; interrupting.", SHUTDOWN_GRACE.toSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Agent job worker stopped.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * Recovers stalled jobs, then claims jobs while pool slots are free. Queue errors are logged
     * and retried on the next tick.
     */
    void poll() {
        try {
            BestEffort.run("stalled job recovery", this::recoverStalled);
            while (running && slots.tryAcquire()) {
                Optional<AgentJob> claimed;
                try {
                    claimed = queue.claim();
                } catch (RuntimeException ex) {
                    slots.release();
                    throw ex;
                }
                if (claimed.isEmpty()) {
                    slots.release();
                    return;
                }
                AgentJob job = claimed.get();
                try {
                    workers.execute(() -> {
                        try {
                            process(job);
                        } finally {
                            slots.release();
                        }
                    });
                } catch (RuntimeException ex) {
                    slots.release();
                    throw ex;
                }
            }
        } catch (Exception ex) {
            log.warn("Polling queue failed: {}", ex.getMessage());
        }
    }

    void recoverStalled() {
        for (AgentJob job : queue.reclaimStalled()) {
            if (inFlight.contains(job.runId())) {
                queue.extendLease(job.runId());
                continue;
            }
            log.warn("Agent job {} for case {} stalled on attempt {}.", job.runId(), job.caseNumber(),
                    job.attemptsMade() + 1);
            handleFailure(job, STALLED_ERROR);
        }
    }

    void renewLeases() {
        for (UUID runId : inFlight) {
            BestEffort.run("lease renewal of job " + runId, () -> queue.extendLease(runId));
        }
    }

    void process(AgentJob job) {
        inFlight.add(job.runId());
        try {
            handler.handle(job);
            BestEffort.run("completion of job " + job.runId(), () -> queue.complete(job));
        } catch (Exception ex) {
            handleFailure(job, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        } finally {
            inFlight.remove(job.runId());
        }
    }

    private void handleFailure(AgentJob job, String error) {
        AgentJob failed = job.withFailure(error);
        if (retryPolicy.shouldRetry(failed.attemptsMade())) {
            Duration delay = retryPolicy.delayFor(failed.attemptsMade());
            log.warn("Agent job {} failed on attempt {}, retrying in {} ms: {}", job.runId(),
                    failed.attemptsMade(), delay.toMillis(), error);
            BestEffort.run("retry of job " + job.runId(), () -> queue.retry(failed, delay));
        } else {
            BestEffort.run("failure of job " + job.runId(), () -> queue.fail(failed));
            failureHook.onFinalFailure(failed, error);
        }
    }
}
