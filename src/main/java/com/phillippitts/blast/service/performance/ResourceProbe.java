package com.phillippitts.blast.service.performance;

import org.apache.logging.log4j.LogManager;

/**
 * Capability for reading process resource usage. The implementation is chosen once via
 * {@link #select(boolean)}; callers never probe for support per sample.
 */
public interface ResourceProbe {

    ResourceSnapshot sample();

    /** False for the no-op probe; the sampler does not run without a real probe. */
    boolean isAvailable();

    /**
     * Picks the JVM management probe when enabled and supported, otherwise the no-op probe.
     */
    static ResourceProbe select(boolean enabled) {
        if (!enabled) {
            return NoopResourceProbe.INSTANCE;
        }
        try {
            return new JvmResourceProbe();
        } catch (RuntimeException | LinkageError e) {
            LogManager.getLogger(ResourceProbe.class)
                    .warn("JVM management beans unavailable, resource sampling disabled: {}", e.toString());
            return NoopResourceProbe.INSTANCE;
        }
    }
}
