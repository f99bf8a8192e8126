package com.shlokmestry.flowlimit.ratelimit;

/**
 * A pair of amounts, one per flow direction. Used for both netted balances and caps.
 */
public record DirectionalAmount(Amount in, Amount out) {

    public Amount on(FlowDirection direction) {
        return switch (direction) {
            case IN -> in;
            case OUT -> out;
        };
    }
}
