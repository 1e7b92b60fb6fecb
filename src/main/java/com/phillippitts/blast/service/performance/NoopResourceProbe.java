package com.phillippitts.blast.service.performance;

/** Resource probe used when sampling is disabled or unsupported. */
public final class NoopResourceProbe implements ResourceProbe {

    public static final NoopResourceProbe INSTANCE = new NoopResourceProbe();

    private NoopResourceProbe() {
    }

    @Override
    public ResourceSnapshot sample() {
        return ResourceSnapshot.UNAVAILABLE;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
