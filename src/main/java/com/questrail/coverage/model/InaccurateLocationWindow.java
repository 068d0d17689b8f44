package com.questrail.coverage.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [begin, end)} during which location fixes were too
 * inaccurate to use. An open window has no {@code end} yet.
 */
public record InaccurateLocationWindow(Instant begin, Instant end) {

    public InaccurateLocationWindow {
        Objects.requireNonNull(begin, "begin");
        if (end != null && end.isBefore(begin)) {
            throw new IllegalArgumentException("end must not precede begin");
        }
    }

    public static InaccurateLocationWindow openAt(Instant begin) {
        return new InaccurateLocationWindow(begin, null);
    }

    public boolean isOpen() {
        return end == null;
    }

    public InaccurateLocationWindow closedAt(Instant end) {
        return new InaccurateLocationWindow(begin, end);
    }

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(begin) && (end == null || timestamp.isBefore(end));
    }
}
