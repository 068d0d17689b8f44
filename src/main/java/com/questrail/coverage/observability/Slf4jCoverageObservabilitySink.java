package com.questrail.coverage.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CoverageObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCoverageObservabilitySink implements CoverageObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCoverageObservabilitySink.class);

    @Override
    public void onMeasurementLifecycle(MeasurementLifecycleEvent event) {
        log.info("Coverage measurement {} at {} ({} fences)", event.phase(), event.timestamp(), event.fenceCount());
    }

    @Override
    public void onSubSessionStarted(SubSessionStartedEvent event) {
        if (event.loopUuid() == null) {
            log.info("Coverage sub-session {} started", event.testUuid());
        } else {
            log.info("Coverage sub-session {} started, continuing {} (#{})",
                    event.testUuid(), event.loopUuid(), event.subSessionCount());
        }
    }

    @Override
    public void onFenceClosed(FenceClosedEvent event) {
        var fence = event.fence();
        log.debug("Fence {} closed: {} pings, avg {} ms, technology {}",
                fence.id(),
                fence.pings().size(),
                fence.averagePingMillis().isPresent() ? fence.averagePingMillis().getAsInt() : "-",
                fence.significantTechnology().map(t -> t.code()).orElse("-"));
    }

    @Override
    public void onError(CoverageErrorEvent event) {
        log.error("Coverage error: {}", event.message(), event.cause());
    }
}
