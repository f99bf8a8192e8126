package com.shlokmestry.flowlimit.ratelimit;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Unsigned 128-bit quantity of value moved through a path.
 *
 * <p>Arithmetic saturates at both ends of the range: adding past {@link #MAX}
 * yields {@code MAX} and subtracting below zero yields {@link #ZERO}.
 * Serialized as a decimal string so values above {@code Long.MAX_VALUE}
 * survive JSON round trips.
 */
public final class Amount implements Comparable<Amount> {

    private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public static final Amount ZERO = new Amount(BigInteger.ZERO);
    public static final Amount MAX = new Amount(MAX_VALUE);

    private final BigInteger value;

    private Amount(BigInteger value) {
        this.value = value;
    }

    public static Amount of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static Amount of(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + value);
        }
        if (value.compareTo(MAX_VALUE) > 0) {
            throw new IllegalArgumentException("amount exceeds 128 bits: " + value);
        }
        return value.signum() == 0 ? ZERO : new Amount(value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Amount parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("amount must not be blank");
        }
        try {
            return of(new BigInteger(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("amount is not an integer: " + text, e);
        }
    }

    public Amount saturatingAdd(Amount other) {
        BigInteger sum = value.add(other.value);
        return sum.compareTo(MAX_VALUE) > 0 ? MAX : new Amount(sum);
    }

    public Amount saturatingSub(Amount other) {
        BigInteger diff = value.subtract(other.value);
        return diff.signum() <= 0 ? ZERO : new Amount(diff);
    }

    public BigInteger toBigInteger() {
        return value;
    }

    @Override
    public int compareTo(Amount other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Amount other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }
}
