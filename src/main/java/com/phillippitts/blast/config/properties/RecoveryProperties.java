package com.phillippitts.blast.config.properties;

import com.phillippitts.blast.service.recovery.ErrorCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for the error recovery engine: circuit breaking and per-category
 * retry policies.
 */
@ConfigurationProperties(prefix = "telemetry.recovery")
@Validated
public class RecoveryProperties {

    /** Consecutive failed recoveries that open a category's circuit. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 10;

    /** Retry and cooldown policy per category. Missing categories use their built-in defaults. */
    @Valid
    @NotNull
    private Map<ErrorCategory, CategoryPolicy> categories = defaultPolicies();

    private static Map<ErrorCategory, CategoryPolicy> defaultPolicies() {
        Map<ErrorCategory, CategoryPolicy> policies = new EnumMap<>(ErrorCategory.class);
        for (ErrorCategory category : ErrorCategory.values()) {
            policies.put(category, CategoryPolicy.defaultsFor(category));
        }
        return policies;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public Map<ErrorCategory, CategoryPolicy> getCategories() {
        return categories;
    }

    public void setCategories(Map<ErrorCategory, CategoryPolicy> categories) {
        this.categories = categories;
    }

    /**
     * Policy for a category, falling back to the built-in defaults when not configured.
     */
    public CategoryPolicy policyFor(ErrorCategory category) {
        CategoryPolicy policy = categories.get(category);
        return policy != null ? policy : CategoryPolicy.defaultsFor(category);
    }

    /** Retry budget, backoff shape and circuit cooldown of one category. */
    public static class CategoryPolicy {

        @Positive(message = "Max attempts must be positive")
        private int maxAttempts = 3;

        @Positive(message = "Initial delay must be positive")
        private long initialDelayMs = 100;

        @Positive(message = "Max delay must be positive")
        private long maxDelayMs = 10_000;

        @DecimalMin(value = "1.0", message = "Exponential base must be >= 1.0")
        private double exponentialBase = 2.0;

        private boolean jitter = true;

        @Positive(message = "Cooldown must be positive")
        private double cooldownSeconds = 60.0;

        public static CategoryPolicy defaultsFor(ErrorCategory category) {
            CategoryPolicy policy = new CategoryPolicy();
            policy.setMaxAttempts(category.defaultMaxAttempts());
            policy.setInitialDelayMs(category.defaultInitialDelayMs());
            return policy;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getExponentialBase() {
            return exponentialBase;
        }

        public void setExponentialBase(double exponentialBase) {
            this.exponentialBase = exponentialBase;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public double getCooldownSeconds() {
            return cooldownSeconds;
        }

        public void setCooldownSeconds(double cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
        }
    }
}
