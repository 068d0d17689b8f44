package com.questrail.coverage.observability;

/**
 * Receives coverage measurement observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CoverageObservabilitySink {

    /**
     * Called when a measurement run starts or stops.
     */
    void onMeasurementLifecycle(MeasurementLifecycleEvent event);

    /**
     * Called when a new sub-session token has been obtained.
     */
    void onSubSessionStarted(SubSessionStartedEvent event);

    /**
     * Called when a fence is closed.
     */
    void onFenceClosed(FenceClosedEvent event);

    /**
     * Called when an error is absorbed somewhere in the measurement pipeline.
     */
    void onError(CoverageErrorEvent event);
}
