package com.questrail.coverage.observability;

/**
 * No-op implementation of CoverageObservabilitySink.
 */
public final class NullCoverageObservabilitySink implements CoverageObservabilitySink {
    public static final NullCoverageObservabilitySink INSTANCE = new NullCoverageObservabilitySink();

    private NullCoverageObservabilitySink() {}

    @Override
    public void onMeasurementLifecycle(MeasurementLifecycleEvent event) {}

    @Override
    public void onSubSessionStarted(SubSessionStartedEvent event) {}

    @Override
    public void onFenceClosed(FenceClosedEvent event) {}

    @Override
    public void onError(CoverageErrorEvent event) {}
}
