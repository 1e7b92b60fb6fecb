package com.phillippitts.blast.service.watchdog;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable state for one watched component. Every transition synchronizes on the entry so
 * freeze and recovery are serialized per component.
 */
final class WatchdogEntry {

    private final String component;
    private final Duration timeout;
    private final FreezeCallback callback;
    private Instant lastHeartbeat;
    private boolean active = true;
    private boolean frozen;
    private long freezeEpisodes;

    WatchdogEntry(String component, Duration timeout, FreezeCallback callback, Instant registeredAt) {
        this.component = component;
        this.timeout = timeout;
        this.callback = callback;
        this.lastHeartbeat = registeredAt;
    }

    String component() {
        return component;
    }

    Duration timeout() {
        return timeout;
    }

    FreezeCallback callback() {
        return callback;
    }

    /**
     * Records a heartbeat.
     *
     * @return how long the component was frozen if this heartbeat ends a freeze episode, else null
     */
    synchronized Duration beat(Instant now) {
        Instant previous = lastHeartbeat;
        lastHeartbeat = now;
        if (!frozen) {
            return null;
        }
        frozen = false;
        return Duration.between(previous, now);
    }

    /**
     * Transitions NORMAL to FROZEN when the timeout has been exceeded.
     *
     * @return the last heartbeat before the freeze if this call started a freeze episode, else null
     */
    synchronized Instant tryFreeze(Instant now) {
        if (!active || frozen) {
            return null;
        }
        if (Duration.between(lastHeartbeat, now).compareTo(timeout) <= 0) {
            return null;
        }
        frozen = true;
        freezeEpisodes++;
        return lastHeartbeat;
    }

    synchronized void setActive(boolean active, Instant now) {
        if (active && !this.active) {
            // Fresh start so a long deactivation is not reported as a freeze
            lastHeartbeat = now;
            frozen = false;
        }
        this.active = active;
    }

    synchronized boolean isFrozen() {
        return frozen;
    }

    synchronized WatchdogStatus status(Instant now) {
        double since = Duration.between(lastHeartbeat, now).toNanos() / 1_000_000_000d;
        return new WatchdogStatus(component, timeout.toNanos() / 1_000_000_000d, since, active,
                frozen ? WatchdogState.FROZEN : WatchdogState.NORMAL, freezeEpisodes);
    }
}
