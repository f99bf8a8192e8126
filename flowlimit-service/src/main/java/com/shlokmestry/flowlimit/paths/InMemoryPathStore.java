package com.shlokmestry.flowlimit.paths;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.shlokmestry.flowlimit.ratelimit.RateLimit;

/**
 * Process-local store. State is lost on restart; meant for tests and single-node setups.
 */
@Repository
@ConditionalOnProperty(name = "flowlimit.store.type", havingValue = "memory")
public class InMemoryPathStore implements PathStore {

    private final ConcurrentHashMap<Path, List<RateLimit>> paths = new ConcurrentHashMap<>();

    @Override
    public Optional<List<RateLimit>> load(Path path) {
        return Optional.ofNullable(paths.get(path));
    }

    @Override
    public void save(Path path, List<RateLimit> limits) {
        paths.put(path, List.copyOf(limits));
    }

    @Override
    public boolean saveIfAbsent(Path path, List<RateLimit> limits) {
        return paths.putIfAbsent(path, List.copyOf(limits)) == null;
    }

    @Override
    public void remove(Path path) {
        paths.remove(path);
    }

    @Override
    public Optional<List<RateLimit>> update(Path path, UnaryOperator<List<RateLimit>> updater) {
        return Optional.ofNullable(paths.computeIfPresent(path, (key, limits) -> List.copyOf(updater.apply(limits))));
    }
}
