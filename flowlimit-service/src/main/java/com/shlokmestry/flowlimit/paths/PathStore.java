package com.shlokmestry.flowlimit.paths;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.shlokmestry.flowlimit.ratelimit.RateLimit;

/**
 * Durable mapping from a path to its ordered list of rate limits.
 */
public interface PathStore {

    Optional<List<RateLimit>> load(Path path);

    void save(Path path, List<RateLimit> limits);

    /**
     * Stores {@code limits} only if nothing is stored for {@code path} yet.
     *
     * @return true if the limits were written
     */
    boolean saveIfAbsent(Path path, List<RateLimit> limits);

    void remove(Path path);

    /**
     * Atomically replaces the limits stored for {@code path} with the updater's result.
     *
     * <p>When the path is not registered the updater is not called and nothing is
     * written. An exception thrown by the updater propagates and leaves the stored
     * value untouched.
     *
     * @return the value written, or empty if the path is not registered
     */
    Optional<List<RateLimit>> update(Path path, UnaryOperator<List<RateLimit>> updater);
}
