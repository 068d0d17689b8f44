package com.questrail.coverage.observability;

import com.questrail.coverage.model.Fence;

import java.time.Instant;

public record FenceClosedEvent(
        Instant timestamp,
        Fence fence
) {
}
