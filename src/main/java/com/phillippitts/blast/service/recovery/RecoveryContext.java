package com.phillippitts.blast.service.recovery;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Host-supplied hooks and attributes handed to a recovery strategy. Every hook is optional;
 * a strategy whose hook is absent reports failure.
 */
public final class RecoveryContext {

    private static final RecoveryContext EMPTY = builder().build();

    private final Runnable reconnect;
    private final Runnable fallback;
    private final Runnable cleanup;
    private final Runnable reset;
    private final Runnable buffer;
    private final Map<String, String> attributes;

    private RecoveryContext(Builder builder) {
        this.reconnect = builder.reconnect;
        this.fallback = builder.fallback;
        this.cleanup = builder.cleanup;
        this.reset = builder.reset;
        this.buffer = builder.buffer;
        this.attributes = Map.copyOf(builder.attributes);
    }

    public static RecoveryContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Re-establishes a lost connection; throws if reconnecting fails. */
    public Optional<Runnable> reconnect() {
        return Optional.ofNullable(reconnect);
    }

    /** Switches to a degraded source (for example the simulator). */
    public Optional<Runnable> fallback() {
        return Optional.ofNullable(fallback);
    }

    /** Frees disk space or memory. */
    public Optional<Runnable> cleanup() {
        return Optional.ofNullable(cleanup);
    }

    /** Resets parser or framing state. */
    public Optional<Runnable> reset() {
        return Optional.ofNullable(reset);
    }

    /** Holds pending data in memory until writes succeed again. */
    public Optional<Runnable> buffer() {
        return Optional.ofNullable(buffer);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public static final class Builder {
        private Runnable reconnect;
        private Runnable fallback;
        private Runnable cleanup;
        private Runnable reset;
        private Runnable buffer;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder reconnect(Runnable reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder fallback(Runnable fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder cleanup(Runnable cleanup) {
            this.cleanup = cleanup;
            return this;
        }

        public Builder reset(Runnable reset) {
            this.reset = reset;
            return this;
        }

        public Builder buffer(Runnable buffer) {
            this.buffer = buffer;
            return this;
        }

        public Builder attribute(String key, String value) {
            if (key != null && value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public RecoveryContext build() {
            return new RecoveryContext(this);
        }
    }
}
