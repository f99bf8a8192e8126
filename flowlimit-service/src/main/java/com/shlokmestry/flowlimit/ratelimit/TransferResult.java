package com.shlokmestry.flowlimit.ratelimit;

import java.util.List;

import com.shlokmestry.flowlimit.paths.Path;

/**
 * Outcome of an accepted transfer or reversal.
 *
 * @param limits the rate limits as stored after the call; empty when the path is not rate limited
 */
public record TransferResult(Path path, boolean rateLimited, List<RateLimit> limits) {

    public static TransferResult unrestricted(Path path) {
        return new TransferResult(path, false, List.of());
    }

    public static TransferResult limited(Path path, List<RateLimit> limits) {
        return new TransferResult(path, !limits.isEmpty(), List.copyOf(limits));
    }
}
