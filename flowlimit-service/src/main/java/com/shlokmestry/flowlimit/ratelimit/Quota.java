package com.shlokmestry.flowlimit.ratelimit;

import java.util.Objects;

/**
 * Window configuration for one rate limit on a path.
 *
 * <p>The name is a human readable label for the window ("daily", "weekly", ...)
 * and identifies the quota inside its path's list. Send and receive caps are
 * independent.
 */
public record Quota(
        String name,
        Amount maxSend,
        Amount maxReceive,
        long durationSeconds
) {

    public Quota {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(maxSend, "maxSend");
        Objects.requireNonNull(maxReceive, "maxReceive");
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, got: " + durationSeconds);
        }
    }

    /**
     * Caps per direction: receiving is bounded by {@code maxReceive}, sending by {@code maxSend}.
     */
    public DirectionalAmount capacity() {
        return new DirectionalAmount(maxReceive, maxSend);
    }

    public Amount capacityOn(FlowDirection direction) {
        return capacity().on(direction);
    }
}
