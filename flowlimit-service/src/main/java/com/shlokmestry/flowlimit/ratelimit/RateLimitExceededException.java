package com.shlokmestry.flowlimit.ratelimit;

import java.time.Instant;

import com.shlokmestry.flowlimit.paths.Path;

/**
 * A transfer would push a window's netted balance past its cap. Callers may
 * retry once {@link #getReset()} has passed.
 */
public class RateLimitExceededException extends RuntimeException {

    private final Path path;
    private final Amount amount;
    private final String quotaName;
    private final Amount used;
    private final Amount max;
    private final Instant reset;

    public RateLimitExceededException(Path path, Amount amount, String quotaName, Amount used, Amount max, Instant reset) {
        super("Rate limit exceeded for " + path + ". Tried to transfer " + amount
                + " which exceeds capacity on the '" + quotaName + "' quota (" + used + "/" + max
                + "). Try again after " + reset);
        this.path = path;
        this.amount = amount;
        this.quotaName = quotaName;
        this.used = used;
        this.max = max;
        this.reset = reset;
    }

    public Path getPath() {
        return path;
    }

    public Amount getAmount() {
        return amount;
    }

    public String getQuotaName() {
        return quotaName;
    }

    public Amount getUsed() {
        return used;
    }

    public Amount getMax() {
        return max;
    }

    public Instant getReset() {
        return reset;
    }
}
