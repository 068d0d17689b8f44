package com.questrail.coverage.engine;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * KeepMeasuringToken
 * -----------------------------------------------------------------------------
 * Reference-counted resource held while at least one measurement run is active,
 * e.g. a background-execution grant of the host platform.
 *
 * <p>{@code onActivated} runs when the count leaves zero and
 * {@code onDeactivated} when it returns to zero. The count is shared by all runs
 * of a process and updated atomically.</p>
 */
public final class KeepMeasuringToken {

    private final AtomicInteger holders = new AtomicInteger();
    private final Runnable onActivated;
    private final Runnable onDeactivated;

    public KeepMeasuringToken(Runnable onActivated, Runnable onDeactivated) {
        this.onActivated = Objects.requireNonNull(onActivated, "onActivated");
        this.onDeactivated = Objects.requireNonNull(onDeactivated, "onDeactivated");
    }

    public static KeepMeasuringToken noop() {
        return new KeepMeasuringToken(() -> {}, () -> {});
    }

    public void acquire() {
        if (holders.getAndIncrement() == 0) {
            onActivated.run();
        }
    }

    /**
     * @throws IllegalStateException if released more often than acquired
     */
    public void release() {
        while (true) {
            int current = holders.get();
            if (current == 0) {
                throw new IllegalStateException("KeepMeasuringToken released without being acquired");
            }
            if (holders.compareAndSet(current, current - 1)) {
                if (current == 1) {
                    onDeactivated.run();
                }
                return;
            }
        }
    }

    public int holders() {
        return holders.get();
    }
}
