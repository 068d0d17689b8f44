package com.questrail.coverage.engine;

import com.questrail.coverage.model.LocationSample;
import com.questrail.coverage.model.NetworkTypeSample;
import com.questrail.coverage.model.PingOutcome;

import java.time.Instant;
import java.util.Objects;

/**
 * MeasurementEvent
 * -----------------------------------------------------------------------------
 * Everything that enters the fence segmentation engine.
 *
 * <p>Producers (location source, ping pacer, network-type monitor, session
 * controller, the run owner) submit events into the {@link EventMerger}; the
 * engine consumes them one at a time on a single thread.</p>
 *
 * <p>Events are immutable and carry only the data needed to advance the
 * engine's state.</p>
 */
public sealed interface MeasurementEvent {

    Instant timestamp();

    record LocationUpdate(LocationSample sample) implements MeasurementEvent {
        public LocationUpdate {
            Objects.requireNonNull(sample, "sample");
        }

        @Override
        public Instant timestamp() {
            return sample.timestamp();
        }
    }

    record PingUpdate(PingOutcome outcome) implements MeasurementEvent {
        public PingUpdate {
            Objects.requireNonNull(outcome, "outcome");
        }

        @Override
        public Instant timestamp() {
            return outcome.timestamp();
        }
    }

    record NetworkTypeUpdate(NetworkTypeSample sample) implements MeasurementEvent {
        public NetworkTypeUpdate {
            Objects.requireNonNull(sample, "sample");
        }

        @Override
        public Instant timestamp() {
            return sample.timestamp();
        }
    }

    /**
     * A sub-session token was confirmed at {@code timestamp}, its anchor.
     */
    record SessionInitialized(Instant timestamp, String testUuid, String loopUuid) implements MeasurementEvent {
        public SessionInitialized {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(testUuid, "testUuid");
        }
    }

    /**
     * The insufficient-accuracy interval has passed since the run started.
     */
    record AccuracyCheckDue(Instant timestamp) implements MeasurementEvent {
        public AccuracyCheckDue {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * Ends the run; events queued before it are still processed.
     */
    record StopRequested(Instant timestamp) implements MeasurementEvent {
        public StopRequested {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
