package com.phillippitts.voicetutor.service.resilience;

import com.phillippitts.voicetutor.config.properties.CircuitBreakerProperties;
import com.phillippitts.voicetutor.exception.BackendException;
import com.phillippitts.voicetutor.exception.BackendTimeoutException;
import com.phillippitts.voicetutor.exception.CircuitOpenException;
import com.phillippitts.voicetutor.service.resilience.event.CircuitStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Guards calls to the generation backend with retry, per-attempt timeout and fail-fast rejection.
 *
 * <p>State model:
 * <ul>
 *   <li>CLOSED: calls run; after {@code minimumRequests} the circuit opens once the failure rate reaches
 *       {@code failureRateThreshold}</li>
 *   <li>OPEN: calls are rejected with {@link CircuitOpenException} without touching the backend; a timer
 *       moves the circuit to HALF_OPEN after {@code cooldownMs}</li>
 *   <li>HALF_OPEN: calls run; one success closes the circuit, one failure re-opens it and restarts
 *       the cooldown</li>
 * </ul>
 * Independently of the rate, a 429/5xx/quota failure opens the circuit once {@code distressFailureThreshold}
 * such failures have accumulated (see {@link FailureClassifier}). A successful probe clears that count.
 *
 * <p>Each attempt runs on {@code backendExecutor} and is awaited for at most the attempt timeout. A
 * timed-out attempt is abandoned, not interrupted: its thread finishes on its own and the result is
 * dropped. Attempts are separated by the configured retry delays, so a failing call blocks its caller
 * for the sum of those delays.
 *
 * <p>Thread-safe. State and counters are guarded by a single lock that is never held while the backend
 * runs or while events are published.
 */
@Component
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureRateThreshold;
    private final int minimumRequests;
    private final int distressFailureThreshold;
    private final Duration defaultTimeout;
    private final Duration cooldown;
    private final int maxAttempts;
    private final List<Long> retryDelaysMs;

    private final Executor backendExecutor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;

    private final ReentrantLock lock = new ReentrantLock();
    private CircuitState state = CircuitState.CLOSED;
    private long requests;
    private long failures;
    private long successes;
    private long timeouts;
    private long rejected;
    private long distressFailures;
    private Instant lastFailureTime;
    private ScheduledFuture<?> halfOpenTask;

    public CircuitBreaker(CircuitBreakerProperties properties,
                          @Qualifier("backendExecutor") Executor backendExecutor,
                          @Qualifier("circuitScheduler") TaskScheduler scheduler,
                          ApplicationEventPublisher publisher) {
        Objects.requireNonNull(properties, "properties");
        this.backendExecutor = Objects.requireNonNull(backendExecutor, "backendExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.name = properties.getName();
        this.failureRateThreshold = properties.getFailureRateThreshold();
        this.minimumRequests = properties.getMinimumRequests();
        this.distressFailureThreshold = properties.getDistressFailureThreshold();
        this.defaultTimeout = Duration.ofMillis(properties.getTimeoutMs());
        this.cooldown = Duration.ofMillis(properties.getCooldownMs());
        this.maxAttempts = properties.getMaxAttempts();
        this.retryDelaysMs = List.copyOf(properties.getRetryDelaysMs());
        LOG.info("Circuit breaker '{}' initialized: failureRate={}%, minRequests={}, distressThreshold={}, "
                        + "timeout={}ms, cooldown={}ms, attempts={}, delays={}",
                name, failureRateThreshold, minimumRequests, distressFailureThreshold,
                defaultTimeout.toMillis(), cooldown.toMillis(), maxAttempts, retryDelaysMs);
    }

    /**
     * Runs {@code operation} under the default attempt timeout.
     *
     * @see #execute(Supplier, Duration)
     */
    public <T> T execute(Supplier<T> operation) {
        return execute(operation, defaultTimeout);
    }

    /**
     * Runs {@code operation} with retries, each attempt bounded by {@code attemptTimeout}.
     *
     * @param operation      blocking backend call
     * @param attemptTimeout per-attempt timeout
     * @return the first successful attempt's result
     * @throws CircuitOpenException when the circuit is OPEN
     * @throws RuntimeException     the last attempt's error once all attempts failed
     *                              ({@link BackendTimeoutException} for a timeout)
     */
    public <T> T execute(Supplier<T> operation, Duration attemptTimeout) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null");

        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                rejected++;
                throw new CircuitOpenException(name);
            }
            requests++;
        } finally {
            lock.unlock();
        }

        RuntimeException lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                T result = runAttempt(operation, attemptTimeout);
                onSuccess();
                return result;
            } catch (RuntimeException e) {
                lastError = e;
                if (attempt == maxAttempts - 1) {
                    break;
                }
                long delay = retryDelay(attempt);
                LOG.warn("Circuit '{}': attempt {}/{} failed, retrying in {}ms: {}",
                        name, attempt + 1, maxAttempts, delay, e.getMessage());
                if (!sleep(delay)) {
                    lastError = new BackendException("Interrupted while waiting to retry", e);
                    break;
                }
            }
        }

        onFailure(lastError);
        throw lastError;
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return state == CircuitState.OPEN;
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerMetrics getMetrics() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the circuit, zeroes all counters and cancels a pending cooldown.
     */
    public void reset() {
        CircuitStateChangedEvent event;
        lock.lock();
        try {
            cancelHalfOpenTask();
            CircuitState previous = state;
            state = CircuitState.CLOSED;
            requests = 0;
            failures = 0;
            successes = 0;
            timeouts = 0;
            rejected = 0;
            distressFailures = 0;
            lastFailureTime = null;
            event = new CircuitStateChangedEvent(name, previous, CircuitState.CLOSED, snapshot(), Instant.now());
        } finally {
            lock.unlock();
        }
        LOG.info("Circuit '{}' reset", name);
        publisher.publishEvent(event);
    }

    /** Cooldown callback; a no-op unless the circuit is still OPEN. Visible for tests. */
    void transitionToHalfOpen() {
        CircuitStateChangedEvent event = null;
        lock.lock();
        try {
            halfOpenTask = null;
            if (state == CircuitState.OPEN) {
                state = CircuitState.HALF_OPEN;
                event = new CircuitStateChangedEvent(name, CircuitState.OPEN, CircuitState.HALF_OPEN,
                        snapshot(), Instant.now());
            }
        } finally {
            lock.unlock();
        }
        if (event != null) {
            LOG.info("Circuit '{}' HALF_OPEN - probing backend recovery", name);
            publisher.publishEvent(event);
        }
    }

    private <T> T runAttempt(Supplier<T> operation, Duration attemptTimeout) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(operation, backendExecutor);
        } catch (RejectedExecutionException e) {
            throw new BackendException("Backend executor saturated", e);
        }
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendTimeoutException(attemptTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new BackendException("Backend call failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BackendException("Interrupted while awaiting backend", e);
        }
    }

    private void onSuccess() {
        CircuitStateChangedEvent event = null;
        lock.lock();
        try {
            successes++;
            if (state == CircuitState.HALF_OPEN) {
                state = CircuitState.CLOSED;
                distressFailures = 0;
                event = new CircuitStateChangedEvent(name, CircuitState.HALF_OPEN, CircuitState.CLOSED,
                        snapshot(), Instant.now());
            }
        } finally {
            lock.unlock();
        }
        if (event != null) {
            LOG.info("Circuit '{}' CLOSED after successful probe", name);
            publisher.publishEvent(event);
        }
    }

    private void onFailure(RuntimeException error) {
        CircuitStateChangedEvent event = null;
        lock.lock();
        try {
            failures++;
            lastFailureTime = Instant.now();
            if (FailureClassifier.isTimeout(error)) {
                timeouts++;
            }
            boolean distressError = FailureClassifier.isDistress(error);
            if (distressError) {
                distressFailures++;
            }

            boolean rateExceeded = state == CircuitState.CLOSED
                    && requests >= minimumRequests
                    && failureRate() >= failureRateThreshold;
            boolean distress = distressError && distressFailures >= distressFailureThreshold;
            boolean probeFailed = state == CircuitState.HALF_OPEN;

            if (state != CircuitState.OPEN && (rateExceeded || distress || probeFailed)) {
                CircuitState previous = state;
                state = CircuitState.OPEN;
                scheduleHalfOpen();
                event = new CircuitStateChangedEvent(name, previous, CircuitState.OPEN, snapshot(), Instant.now());
                LOG.warn("Circuit '{}' OPEN (from {}): failureRate={}%, distressFailures={}, cooldown={}ms",
                        name, previous, String.format("%.1f", failureRate()), distressFailures, cooldown.toMillis());
            }
        } finally {
            lock.unlock();
        }
        if (event != null) {
            publisher.publishEvent(event);
        }
    }

    // Must be called with lock held
    private void scheduleHalfOpen() {
        cancelHalfOpenTask();
        halfOpenTask = scheduler.schedule(this::transitionToHalfOpen, Instant.now().plus(cooldown));
    }

    // Must be called with lock held
    private void cancelHalfOpenTask() {
        if (halfOpenTask != null) {
            halfOpenTask.cancel(false);
            halfOpenTask = null;
        }
    }

    // Must be called with lock held
    private double failureRate() {
        return requests > 0 ? (failures * 100.0) / requests : 0.0;
    }

    // Must be called with lock held
    private CircuitBreakerMetrics snapshot() {
        return new CircuitBreakerMetrics(name, state, requests, failures, successes, timeouts, rejected,
                distressFailures, lastFailureTime, failureRate());
    }

    private long retryDelay(int attempt) {
        if (retryDelaysMs.isEmpty()) {
            return 0L;
        }
        return retryDelaysMs.get(Math.min(attempt, retryDelaysMs.size() - 1));
    }

    private static boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
