package com.phillippitts.blast.service.recovery;

import com.phillippitts.blast.config.properties.RecoveryProperties;
import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.events.EventKind;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.RecordSink;
import com.phillippitts.blast.service.router.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Retry-with-backoff and per-category circuit breaking for transient operational errors.
 *
 * <p><b>Retry:</b> {@link #retryWithBackoff} invokes an operation up to the category's
 * {@code maxAttempts}, sleeping on the calling thread between attempts. When every attempt
 * fails the last error is routed into {@link #recover} and a failed {@link RetryResult} is
 * returned.
 *
 * <p><b>Circuit breaking:</b> {@link #recover} fails fast while a category's circuit is
 * open. Otherwise it runs the category's {@link RecoveryStrategy}. A success resets the
 * circuit; a failure counts towards {@code failureThreshold}, which opens the circuit for
 * the action's cooldown.
 *
 * <p><b>Escalation:</b> once consecutive failures reach {@code maxAttempts} every further
 * failed recovery invokes the category's {@link EscalationHook}.
 *
 * <p>Actions are registered once at construction. Categories without an action use the
 * {@link ErrorCategory#GENERIC} action, which is therefore mandatory.
 */
public class ErrorRecoveryEngine {

    private static final Logger LOG = LogManager.getLogger(ErrorRecoveryEngine.class);

    static final int MAX_CRITICAL_ESCALATIONS = 5;
    static final int MAX_CATEGORY_ESCALATIONS = 3;
    static final double MIN_SUCCESS_RATE = 0.5;

    private final int failureThreshold;
    private final Map<ErrorCategory, RecoveryAction> actions;
    private final Map<ErrorCategory, CircuitBreaker> breakers = new EnumMap<>(ErrorCategory.class);
    private final Map<ErrorCategory, Counters> counters = new EnumMap<>(ErrorCategory.class);
    private final RecordSink sink;
    private final EventRecorder events;
    private final TelemetryMetricsPublisher metrics;
    private final Sleeper sleeper;
    private final DoubleSupplier jitterSource;
    private final Clock clock;

    public ErrorRecoveryEngine(RecoveryProperties properties,
                               Collection<RecoveryAction> actions,
                               RecordSink sink,
                               EventRecorder events,
                               TelemetryMetricsPublisher metrics,
                               Sleeper sleeper,
                               DoubleSupplier jitterSource,
                               Clock clock) {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(actions, "actions");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.metrics = metrics == null ? TelemetryMetricsPublisher.NOOP : metrics;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.jitterSource = jitterSource == null ? () -> ThreadLocalRandom.current().nextDouble() : jitterSource;
        this.clock = Objects.requireNonNull(clock, "clock");
        if (properties.getFailureThreshold() <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        this.failureThreshold = properties.getFailureThreshold();

        Map<ErrorCategory, RecoveryAction> registered = new EnumMap<>(ErrorCategory.class);
        for (RecoveryAction action : actions) {
            if (registered.put(action.category(), action) != null) {
                throw new IllegalArgumentException("Duplicate recovery action for " + action.category());
            }
            if (action.strategy().category() != action.category()) {
                throw new IllegalArgumentException("Strategy for " + action.strategy().category()
                        + " registered under " + action.category());
            }
        }
        if (!registered.containsKey(ErrorCategory.GENERIC)) {
            throw new IllegalArgumentException("A GENERIC recovery action is required");
        }
        this.actions = Map.copyOf(registered);
        for (ErrorCategory category : ErrorCategory.values()) {
            breakers.put(category, new CircuitBreaker(category));
            counters.put(category, new Counters());
        }
        LOG.info("Error recovery engine ready (threshold={}, categories={})", failureThreshold, registered.keySet());
    }

    public <T> RetryResult<T> retryWithBackoff(Callable<T> operation, ErrorCategory category) {
        return retryWithBackoff(operation, category, RecoveryContext.empty());
    }

    /**
     * Invokes the operation until it succeeds or the category's attempt budget is spent.
     * Blocks the calling thread during backoff.
     *
     * @param context handed to {@link #recover} if every attempt fails
     */
    public <T> RetryResult<T> retryWithBackoff(Callable<T> operation, ErrorCategory category,
                                               RecoveryContext context) {
        Objects.requireNonNull(operation, "operation");
        RecoveryAction action = actionFor(category);
        int maxAttempts = action.maxAttempts();
        Exception lastError = null;
        int attempts = 0;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            attempts++;
            try {
                T value = operation.call();
                if (attempt > 0) {
                    LOG.info("{} operation succeeded on attempt {}/{}", category, attempts, maxAttempts);
                }
                return RetryResult.succeeded(value, attempts, category);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = e;
                LOG.warn("{} operation interrupted on attempt {}/{}", category, attempts, maxAttempts);
                break;
            } catch (Exception e) {
                lastError = e;
                LOG.warn("{} operation failed on attempt {}/{}: {}", category, attempts, maxAttempts, e.toString());
            }
            if (attempt < maxAttempts - 1) {
                Duration delay = computeDelay(category, attempt);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Backoff for {} interrupted; giving up after {} attempt(s)", category, attempts);
                    break;
                }
            }
        }
        LOG.error("{} operation failed after {} attempt(s)", category, attempts);
        recover(lastError, category, context);
        return RetryResult.failed(lastError, attempts, category);
    }

    /**
     * Delay after the given zero-based failed attempt.
     */
    public Duration computeDelay(ErrorCategory category, int attempt) {
        return actionFor(category).backoff().delayFor(attempt, jitterSource.getAsDouble());
    }

    /**
     * Runs the category's recovery strategy unless its circuit is open.
     *
     * @param context host hooks for the strategy (nullable)
     * @return true if the strategy reported success
     */
    public boolean recover(Throwable error, ErrorCategory category, RecoveryContext context) {
        Objects.requireNonNull(category, "category");
        RecoveryContext ctx = context == null ? RecoveryContext.empty() : context;
        RecoveryAction action = actionFor(category);
        CircuitBreaker breaker = breakers.get(category);
        Counters counter = counters.get(category);
        String message = describe(error);

        if (breaker.isOpen(clock.instant())) {
            counter.shortCircuits.incrementAndGet();
            metrics.recordRecovery(category.label(), "short_circuit");
            LOG.warn("Circuit open for {}; skipping recovery of: {}", category, message);
            return false;
        }

        counter.attempts.incrementAndGet();
        logError(category, error, message, ctx);

        boolean recovered;
        try {
            recovered = action.strategy().recover(error, ctx);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Recovery strategy for {} interrupted", category);
            recovered = false;
        } catch (Exception e) {
            LOG.error("Recovery strategy for {} threw: {}", category, e.toString(), e);
            recovered = false;
        }

        if (recovered) {
            breaker.recordSuccess();
            counter.successes.incrementAndGet();
            metrics.recordRecovery(category.label(), "success");
            LOG.info("Recovered from {} error: {}", category, message);
            recordOutcome(category, true, message);
            return true;
        }

        counter.failures.incrementAndGet();
        metrics.recordRecovery(category.label(), "failure");
        Instant now = clock.instant();
        if (breaker.recordFailure(now, failureThreshold, action.cooldown())) {
            metrics.recordCircuitOpen(category.label());
            LOG.error("Circuit breaker opened for {} after {} consecutive failures; cooling down {} s",
                    category, failureThreshold, action.cooldown().toSeconds());
        }
        recordOutcome(category, false, message);
        int consecutive = breaker.snapshot(now).consecutiveFailures();
        if (consecutive >= action.maxAttempts() && action.hasEscalation()) {
            escalate(action, message, consecutive);
        }
        return false;
    }

    private void escalate(RecoveryAction action, String message, int consecutive) {
        ErrorCategory category = action.category();
        counters.get(category).escalations.incrementAndGet();
        metrics.recordEscalation(category.label());
        LOG.fatal("Escalating {} after {} consecutive failed recoveries: {}", category, consecutive, message);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", category.label());
        details.put("consecutive_failures", consecutive);
        details.put("message", message);
        recordEventQuietly(EventKind.ERROR_ESCALATION, details, Severity.CRITICAL);
        try {
            action.escalation().escalate(category, message);
        } catch (RuntimeException e) {
            LOG.error("Escalation hook for {} failed: {}", category, e.toString(), e);
        }
    }

    private void logError(ErrorCategory category, Throwable error, String message, RecoveryContext ctx) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("error_category", category.label());
        fields.put("error_type", error == null ? "none" : error.getClass().getSimpleName());
        fields.put("error_message", message);
        fields.put("consecutive_failures", breakers.get(category).snapshot(clock.instant()).consecutiveFailures());
        fields.put("context", ctx.attributes());
        try {
            sink.enqueue(new LogRecord(LogCategory.ERRORS, clock.instant(), Severity.ERROR,
                    "Recovering from " + category.label() + " error", fields));
        } catch (LogRecordRejectedException e) {
            LOG.debug("Dropped error record for {}: {}", category, e.getMessage());
        }
    }

    private void recordOutcome(ErrorCategory category, boolean success, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", category.label());
        details.put("success", success);
        details.put("message", message);
        recordEventQuietly(EventKind.ERROR_RECOVERY, details, success ? Severity.INFO : Severity.WARNING);
    }

    private void recordEventQuietly(EventKind kind, Map<String, Object> details, Severity severity) {
        try {
            events.record(kind, details, severity);
        } catch (LogRecordRejectedException e) {
            LOG.debug("Dropped {} event: {}", kind, e.getMessage());
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * The action used for a category; falls back to GENERIC for unregistered categories.
     */
    public RecoveryAction actionFor(ErrorCategory category) {
        Objects.requireNonNull(category, "category");
        RecoveryAction action = actions.get(category);
        return action != null ? action : actions.get(ErrorCategory.GENERIC);
    }

    public CircuitBreakerState getCircuitState(ErrorCategory category) {
        return breakers.get(category).snapshot(clock.instant());
    }

    public boolean isCircuitOpen(ErrorCategory category) {
        return getCircuitState(category).isOpen();
    }

    public RecoveryStats getStatistics() {
        Instant now = clock.instant();
        Map<ErrorCategory, CategoryStats> perCategory = new EnumMap<>(ErrorCategory.class);
        long attempts = 0;
        long successes = 0;
        long failures = 0;
        long escalations = 0;
        long shortCircuits = 0;
        for (ErrorCategory category : ErrorCategory.values()) {
            Counters c = counters.get(category);
            CategoryStats stats = new CategoryStats(category, c.attempts.get(), c.successes.get(),
                    c.failures.get(), c.escalations.get(), c.shortCircuits.get(),
                    breakers.get(category).snapshot(now));
            perCategory.put(category, stats);
            attempts += stats.attempts();
            successes += stats.successes();
            failures += stats.failures();
            escalations += stats.escalations();
            shortCircuits += stats.shortCircuits();
        }
        double successRate = attempts == 0 ? 1.0 : (double) successes / attempts;
        return new RecoveryStats(attempts, successes, failures, escalations, shortCircuits, successRate,
                Map.copyOf(perCategory));
    }

    /**
     * Healthy while escalations stay below their limits and, once recoveries have been
     * attempted, more than half of them succeeded.
     */
    public boolean isHealthy() {
        RecoveryStats stats = getStatistics();
        if (stats.escalations() >= MAX_CRITICAL_ESCALATIONS) {
            return false;
        }
        for (CategoryStats c : stats.categories().values()) {
            if (c.escalations() >= MAX_CATEGORY_ESCALATIONS) {
                return false;
            }
        }
        return stats.totalAttempts() == 0 || stats.successRate() > MIN_SUCCESS_RATE;
    }

    private static final class Counters {
        final AtomicLong attempts = new AtomicLong();
        final AtomicLong successes = new AtomicLong();
        final AtomicLong failures = new AtomicLong();
        final AtomicLong escalations = new AtomicLong();
        final AtomicLong shortCircuits = new AtomicLong();
    }
}
