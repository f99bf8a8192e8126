package com.shlokmestry.flowlimit.ratelimit;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shlokmestry.flowlimit.paths.Path;

/**
 * One configured window on a path: its quota and the value that has moved in
 * the current period. This is the unit stored per path.
 *
 * <p>Operations never mutate the receiver. Each returns a new instance built
 * on a copy of the flow, so a rejected attempt leaves nothing behind.
 */
public final class RateLimit {

    private final Quota quota;
    private final Flow flow;

    @JsonCreator
    public RateLimit(@JsonProperty("quota") Quota quota, @JsonProperty("flow") Flow flow) {
        this.quota = Objects.requireNonNull(quota, "quota");
        this.flow = Objects.requireNonNull(flow, "flow");
    }

    /**
     * A fresh rate limit whose first window starts at {@code now}.
     */
    public static RateLimit start(Quota quota, Instant now) {
        return new RateLimit(quota, Flow.startingAt(now, quota.durationSeconds()));
    }

    public Quota getQuota() {
        return quota;
    }

    /**
     * Returns a copy; the stored flow cannot be changed through this accessor.
     */
    public Flow getFlow() {
        return flow.copy();
    }

    /**
     * Counts a transfer against this quota.
     *
     * @return the updated rate limit to persist
     * @throws RateLimitExceededException if the netted balance in {@code direction}
     *         would pass the quota's cap; the error reports the balance before this transfer
     */
    public RateLimit allowTransfer(Path path, FlowDirection direction, Amount amount, Instant now) {
        Amount used = flow.balanceOn(direction);

        Flow updated = flow.copy();
        updated.applyTransfer(direction, amount, now, quota);

        DirectionalAmount max = quota.capacity();
        if (updated.exceeds(direction, max.in(), max.out())) {
            throw new RateLimitExceededException(
                    path,
                    amount,
                    quota.name(),
                    used,
                    quota.capacityOn(direction),
                    updated.getPeriodEnd()
            );
        }
        return new RateLimit(quota, updated);
    }

    public RateLimit undoFlow(FlowDirection direction, Amount amount) {
        Flow updated = flow.copy();
        updated.undoFlow(direction, amount);
        return new RateLimit(quota, updated);
    }

    /**
     * Starts a new window at {@code now}, discarding the counted value.
     */
    public RateLimit resetWindow(Instant now) {
        Flow updated = flow.copy();
        updated.expire(now, quota.durationSeconds());
        return new RateLimit(quota, updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateLimit other)) return false;
        return quota.equals(other.quota) && flow.equals(other.flow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quota, flow);
    }

    @Override
    public String toString() {
        return "RateLimit[quota=" + quota + ", flow=" + flow + "]";
    }
}
