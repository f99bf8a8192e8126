package com.shlokmestry.flowlimit.ratelimit;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Value moved through a path during one window, which ends at {@code periodEnd}.
 *
 * <p>Windows are not aligned to a fixed grid. A window only starts when a call
 * touches an expired flow, so after an idle stretch the next window runs from
 * the time of that call for the quota's full duration. No empty windows are
 * replayed.
 *
 * <p>Inflow and outflow are netted against each other: see {@link #balance()}.
 * Not thread-safe; callers work on a {@link #copy()} and persist the result.
 */
public final class Flow {

    private Amount inflow;
    private Amount outflow;
    private Instant periodEnd;

    @JsonCreator
    public Flow(
            @JsonProperty("inflow") Amount inflow,
            @JsonProperty("outflow") Amount outflow,
            @JsonProperty("periodEnd") Instant periodEnd
    ) {
        this.inflow = Objects.requireNonNull(inflow, "inflow");
        this.outflow = Objects.requireNonNull(outflow, "outflow");
        this.periodEnd = Objects.requireNonNull(periodEnd, "periodEnd");
    }

    /**
     * Starts an empty flow whose window ends {@code durationSeconds} after {@code now}.
     */
    public static Flow startingAt(Instant now, long durationSeconds) {
        return new Flow(Amount.ZERO, Amount.ZERO, windowEnd(now, durationSeconds));
    }

    public Amount getInflow() {
        return inflow;
    }

    public Amount getOutflow() {
        return outflow;
    }

    public Instant getPeriodEnd() {
        return periodEnd;
    }

    /**
     * Netted value per direction: (inflow - outflow, outflow - inflow), each
     * floored at zero. At most one side is non-zero.
     */
    public DirectionalAmount balance() {
        return new DirectionalAmount(inflow.saturatingSub(outflow), outflow.saturatingSub(inflow));
    }

    public Amount balanceOn(FlowDirection direction) {
        return balance().on(direction);
    }

    public boolean exceeds(FlowDirection direction, Amount maxIn, Amount maxOut) {
        Amount max = direction == FlowDirection.IN ? maxIn : maxOut;
        return balanceOn(direction).compareTo(max) > 0;
    }

    /**
     * A transfer at exactly {@code periodEnd} still belongs to the current window.
     */
    public boolean isExpired(Instant now) {
        return periodEnd.isBefore(now);
    }

    // Mutating methods

    /**
     * Discards the counters and starts a new window at {@code now}.
     */
    public void expire(Instant now, long durationSeconds) {
        inflow = Amount.ZERO;
        outflow = Amount.ZERO;
        periodEnd = windowEnd(now, durationSeconds);
    }

    public void addFlow(FlowDirection direction, Amount amount) {
        switch (direction) {
            case IN -> inflow = inflow.saturatingAdd(amount);
            case OUT -> outflow = outflow.saturatingAdd(amount);
        }
    }

    /**
     * Removes previously counted value. Never checks expiry or moves the window,
     * so undoing a transfer from an already rolled window only drains the new one
     * down to zero.
     */
    public void undoFlow(FlowDirection direction, Amount amount) {
        switch (direction) {
            case IN -> inflow = inflow.saturatingSub(amount);
            case OUT -> outflow = outflow.saturatingSub(amount);
        }
    }

    /**
     * Counts a transfer, first rolling the window if it has ended. Never rejects.
     *
     * @return true if the window was rolled over before counting
     */
    public boolean applyTransfer(FlowDirection direction, Amount amount, Instant now, Quota quota) {
        boolean expired = false;
        if (isExpired(now)) {
            expire(now, quota.durationSeconds());
            expired = true;
        }
        addFlow(direction, amount);
        return expired;
    }

    public Flow copy() {
        return new Flow(inflow, outflow, periodEnd);
    }

    private static Instant windowEnd(Instant now, long durationSeconds) {
        long remaining = Instant.MAX.getEpochSecond() - now.getEpochSecond();
        if (durationSeconds > remaining) {
            return Instant.MAX;
        }
        return now.plusSeconds(durationSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Flow other)) return false;
        return inflow.equals(other.inflow)
                && outflow.equals(other.outflow)
                && periodEnd.equals(other.periodEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inflow, outflow, periodEnd);
    }

    @Override
    public String toString() {
        return "Flow[inflow=" + inflow + ", outflow=" + outflow + ", periodEnd=" + periodEnd + "]";
    }
}
