package com.phillippitts.blast.service.recovery.strategy;

import com.phillippitts.blast.config.properties.RecoveryProperties;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.recovery.BackoffPolicy;
import com.phillippitts.blast.service.recovery.ErrorCategory;
import com.phillippitts.blast.service.recovery.EscalationHook;
import com.phillippitts.blast.service.recovery.RecoveryAction;
import com.phillippitts.blast.service.recovery.RecoveryStrategy;
import com.phillippitts.blast.util.TimeUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the standard action set: one strategy per {@link ErrorCategory} with the
 * configured retry policy and a shared escalation hook.
 */
public final class RecoveryActions {

    private RecoveryActions() {
    }

    public static List<RecoveryAction> defaults(RecoveryProperties properties, EventRecorder events,
                                                EscalationHook escalation) {
        List<RecoveryAction> actions = new ArrayList<>();
        for (ErrorCategory category : ErrorCategory.values()) {
            RecoveryProperties.CategoryPolicy policy = properties.policyFor(category);
            BackoffPolicy backoff = new BackoffPolicy(Duration.ofMillis(policy.getInitialDelayMs()),
                    Duration.ofMillis(policy.getMaxDelayMs()), policy.getExponentialBase(), policy.isJitter());
            actions.add(new RecoveryAction(category, policy.getMaxAttempts(),
                    TimeUtils.secondsToDuration(policy.getCooldownSeconds()),
                    strategyFor(category, events), escalation, backoff));
        }
        return actions;
    }

    public static RecoveryStrategy strategyFor(ErrorCategory category, EventRecorder events) {
        return switch (category) {
            case CONNECTION_LOSS -> new ConnectionLossStrategy(events);
            case TIMEOUT -> new TimeoutStrategy(events);
            case PARSE_FAILURE -> new ParseFailureStrategy(events);
            case FILE_WRITE -> new FileWriteStrategy(events);
            case NETWORK -> new NetworkStrategy(events);
            case RESOURCE_EXHAUSTION -> new ResourceExhaustionStrategy(events);
            case GENERIC -> new GenericStrategy(events);
        };
    }
}
