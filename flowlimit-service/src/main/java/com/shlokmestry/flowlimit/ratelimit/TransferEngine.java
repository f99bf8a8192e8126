package com.shlokmestry.flowlimit.ratelimit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shlokmestry.flowlimit.paths.Path;
import com.shlokmestry.flowlimit.paths.PathStore;

/**
 * Applies transfers to every rate limit configured on a path.
 *
 * <p>A path without limits is unrestricted. Otherwise each limit in the list is
 * evaluated in order and the first one that would be exceeded rejects the whole
 * transfer. The list is written back in one store update only when every limit
 * accepted, so a rejection never moves any stored counter or window.
 *
 * <p>The engine never reads a clock: callers pass {@code now} on every call.
 */
@Service
public class TransferEngine {

    private static final Logger log = LoggerFactory.getLogger(TransferEngine.class);

    private final PathStore store;

    public TransferEngine(PathStore store) {
        this.store = store;
    }

    /**
     * Counts a transfer of {@code amount} in {@code direction} through {@code path}.
     *
     * @throws RateLimitExceededException from the first limit that would be exceeded
     */
    public TransferResult tryTransfer(Path path, FlowDirection direction, Amount amount, Instant now) {
        Optional<List<RateLimit>> stored = store.update(path, limits -> {
            if (limits.isEmpty()) {
                return limits;
            }
            List<RateLimit> results = new ArrayList<>(limits.size());
            for (RateLimit limit : limits) {
                results.add(limit.allowTransfer(path, direction, amount, now));
            }
            return results;
        });

        return stored
                .map(limits -> TransferResult.limited(path, limits))
                .orElseGet(() -> TransferResult.unrestricted(path));
    }

    /**
     * Takes back an outbound transfer that did not complete. No limit is checked
     * and no window moves.
     */
    public TransferResult undoSend(Path path, Amount amount) {
        Optional<List<RateLimit>> stored = store.update(path, limits -> limits.stream()
                .map(limit -> limit.undoFlow(FlowDirection.OUT, amount))
                .toList());

        return stored
                .map(limits -> TransferResult.limited(path, limits))
                .orElseGet(() -> TransferResult.unrestricted(path));
    }

    /**
     * Registers {@code path} with one fresh window per quota, replacing any existing
     * configuration and counters.
     *
     * @throws IllegalArgumentException if two quotas share a name
     */
    public List<RateLimit> registerPath(Path path, List<Quota> quotas, Instant now) {
        List<RateLimit> limits = start(path, quotas, now);
        store.save(path, limits);

        log.info("flowlimit path registered path={} quotas={}", path, names(quotas));
        return limits;
    }

    /**
     * Registers each path that is not stored yet. Paths already in the store keep
     * their configuration and counters.
     *
     * @return the number of paths written
     * @throws IllegalArgumentException if two quotas of one path share a name
     */
    public int registerPaths(Map<Path, List<Quota>> paths, Instant now) {
        int registered = 0;
        for (Map.Entry<Path, List<Quota>> entry : paths.entrySet()) {
            Path path = entry.getKey();
            if (store.saveIfAbsent(path, start(path, entry.getValue(), now))) {
                log.info("flowlimit path registered path={} quotas={}", path, names(entry.getValue()));
                registered++;
            } else {
                log.info("flowlimit path already registered path={}", path);
            }
        }
        return registered;
    }

    public void deregisterPath(Path path) {
        store.remove(path);
        log.info("flowlimit path removed path={}", path);
    }

    /**
     * Starts a new window at {@code now} for the first limit named {@code quotaName},
     * leaving the other limits on the path alone.
     *
     * @throws QuotaNotFoundException if the path is not registered or has no such quota
     */
    public List<RateLimit> resetQuota(Path path, String quotaName, Instant now) {
        List<RateLimit> updated = store.update(path, limits -> {
            List<RateLimit> results = new ArrayList<>(limits);
            for (int i = 0; i < results.size(); i++) {
                if (results.get(i).getQuota().name().equals(quotaName)) {
                    results.set(i, results.get(i).resetWindow(now));
                    return results;
                }
            }
            throw new QuotaNotFoundException(path, quotaName);
        }).orElseThrow(() -> new QuotaNotFoundException(path, quotaName));

        log.info("flowlimit quota reset path={} quota={}", path, quotaName);
        return updated;
    }

    public Optional<List<RateLimit>> state(Path path) {
        return store.load(path);
    }

    private static List<RateLimit> start(Path path, List<Quota> quotas, Instant now) {
        Set<String> names = new HashSet<>();
        for (Quota quota : quotas) {
            if (!names.add(quota.name())) {
                throw new IllegalArgumentException("duplicate quota name '" + quota.name() + "' for path " + path);
            }
        }
        return quotas.stream()
                .map(quota -> RateLimit.start(quota, now))
                .toList();
    }

    private static List<String> names(List<Quota> quotas) {
        return quotas.stream().map(Quota::name).toList();
    }
}
