package com.sysmon.collector.transmission;

import com.sysmon.dto.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers snapshots one at a time with bounded retries.
 * <p>
 * Snapshots wait in a hand-off queue of fixed depth; when it overflows the oldest waiting
 * snapshot is dropped so the pipeline always carries the latest state. Retryable failures
 * are attempted again after an exponential backoff scheduled on the transmission thread, so
 * {@link #deliver} never blocks the caller.
 */
public class TransmissionClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransmissionClient.class);
    static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    private final IngestTransport transport;
    private final RetryPolicy retryPolicy;
    private final int queueDepth;
    private final Random random;
    private final DeliveryStats stats = new DeliveryStats();
    private final ScheduledThreadPoolExecutor executor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<DeliveryAttempt> queue = new ArrayDeque<>();
    private DeliveryAttempt current;
    private ScheduledFuture<?> pendingBackoff;
    private boolean busy;
    private boolean closed;

    public TransmissionClient(IngestTransport transport, RetryPolicy retryPolicy, int queueDepth) {
        this(transport, retryPolicy, queueDepth, new Random());
    }

    TransmissionClient(IngestTransport transport, RetryPolicy retryPolicy, int queueDepth, Random random) {
        if (queueDepth < 1) {
            throw new IllegalArgumentException("queueDepth must be >= 1");
        }
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.queueDepth = queueDepth;
        this.random = random;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "metric-transmission");
            t.setDaemon(true);
            return t;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public CompletableFuture<DeliveryResult> deliver(MetricSnapshot snapshot) {
        DeliveryAttempt attempt = new DeliveryAttempt(snapshot);
        DeliveryAttempt dropped = null;
        boolean startWorker = false;
        lock.lock();
        try {
            if (closed) {
                attempt.finish(DeliveryPhase.ABANDONED, "client closed");
                stats.record(DeliveryResult.Status.ABANDONED);
                return attempt.result();
            }
            queue.addLast(attempt);
            if (queue.size() > queueDepth) {
                dropped = queue.pollFirst();
            }
            if (!busy) {
                busy = true;
                startWorker = true;
            }
        } finally {
            lock.unlock();
        }
        if (dropped != null && dropped.drop()) {
            stats.record(DeliveryResult.Status.DROPPED);
            log.warn("Hand-off queue full, dropped snapshot {} at {}",
                dropped.snapshot().hostname(), dropped.snapshot().timestamp());
        }
        if (startWorker) {
            submit(this::processQueue);
        }
        return attempt.result();
    }

    public DeliveryStats stats() {
        return stats;
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void processQueue() {
        while (true) {
            DeliveryAttempt next;
            lock.lock();
            try {
                next = closed ? null : queue.pollFirst();
                current = next;
                if (next == null) {
                    busy = false;
                    return;
                }
            } finally {
                lock.unlock();
            }
            if (attempt(next)) {
                // backoff scheduled; the retry task resumes the queue
                return;
            }
        }
    }

    private void retry(DeliveryAttempt attempt) {
        lock.lock();
        try {
            pendingBackoff = null;
            if (closed) {
                return;
            }
        } finally {
            lock.unlock();
        }
        if (!attempt(attempt)) {
            processQueue();
        }
    }

    private boolean attempt(DeliveryAttempt attempt) {
        if (!attempt.begin()) {
            return false;
        }
        stats.recordAttempt();
        MetricSnapshot snapshot = attempt.snapshot();
        try {
            transport.send(snapshot);
            complete(attempt, DeliveryPhase.SUCCEEDED, null);
            log.debug("Delivered snapshot {} at {} after {} attempt(s)",
                snapshot.hostname(), snapshot.timestamp(), attempt.attemptCount());
            return false;
        } catch (DeliveryException e) {
            if (Thread.currentThread().isInterrupted() || isClosed()) {
                complete(attempt, DeliveryPhase.ABANDONED, e.getMessage());
                return false;
            }
            if (!e.isRetryable()) {
                complete(attempt, DeliveryPhase.REJECTED, e.getMessage());
                log.atWarn()
                    .addKeyValue("error_type", "DeliveryError")
                    .addKeyValue("hostname", snapshot.hostname())
                    .addKeyValue("status_code", e.getStatusCode())
                    .log("Snapshot at {} rejected by endpoint: {}", snapshot.timestamp(), e.getMessage());
                return false;
            }
            if (attempt.attemptCount() >= retryPolicy.maxAttempts()) {
                complete(attempt, DeliveryPhase.EXHAUSTED, e.getMessage());
                log.atError()
                    .addKeyValue("error_type", "DeliveryError")
                    .addKeyValue("hostname", snapshot.hostname())
                    .addKeyValue("attempts", attempt.attemptCount())
                    .addKeyValue("failed_total", stats.failed())
                    .log("Dropping snapshot at {} after {} attempts: {}",
                        snapshot.timestamp(), attempt.attemptCount(), e.getMessage());
                return false;
            }
            Duration delay = retryPolicy.backoffFor(attempt.attemptCount(), random);
            attempt.backoff(delay, e.getMessage());
            log.debug("Attempt {}/{} for {} failed ({}), retrying in {} ms", attempt.attemptCount(),
                retryPolicy.maxAttempts(), snapshot.hostname(), e.getMessage(), delay.toMillis());
            return scheduleRetry(attempt);
        } catch (RuntimeException e) {
            complete(attempt, DeliveryPhase.REJECTED, e.toString());
            log.error("Unexpected error delivering snapshot {} at {}", snapshot.hostname(), snapshot.timestamp(), e);
            return false;
        }
    }

    private boolean scheduleRetry(DeliveryAttempt attempt) {
        Duration delay = attempt.nextBackoff();
        if (delay == null) {
            // finished by close() in the meantime
            return false;
        }
        lock.lock();
        try {
            if (!closed) {
                try {
                    pendingBackoff = executor.schedule(() -> retry(attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
                    return true;
                } catch (RejectedExecutionException e) {
                    log.debug("Transmission executor shut down, abandoning retry");
                }
            }
        } finally {
            lock.unlock();
        }
        complete(attempt, DeliveryPhase.ABANDONED, attempt.lastError());
        return false;
    }

    private void complete(DeliveryAttempt attempt, DeliveryPhase phase, String error) {
        if (attempt.finish(phase, error)) {
            stats.record(attempt.result().join().status());
        }
    }

    private boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Transmission executor shut down");
            abandonAll();
        }
    }

    @Override
    public void close() {
        close(DEFAULT_GRACE);
    }

    public void close(Duration grace) {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            if (pendingBackoff != null) {
                pendingBackoff.cancel(false);
                pendingBackoff = null;
            }
        } finally {
            lock.unlock();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight delivery did not finish within {} ms, abandoning", grace.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        abandonAll();
        log.info("Transmission client closed (delivered={}, failed={}, dropped={}, abandoned={})",
            stats.delivered(), stats.failed(), stats.dropped(), stats.abandoned());
    }

    private void abandonAll() {
        List<DeliveryAttempt> open = new ArrayList<>();
        lock.lock();
        try {
            open.addAll(queue);
            queue.clear();
            if (current != null) {
                open.add(current);
            }
            busy = false;
        } finally {
            lock.unlock();
        }
        for (DeliveryAttempt attempt : open) {
            complete(attempt, DeliveryPhase.ABANDONED, "client closed");
        }
    }
}
