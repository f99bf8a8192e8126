package com.shlokmestry.flowlimit.config;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.shlokmestry.flowlimit.paths.Path;
import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.Quota;
import com.shlokmestry.flowlimit.ratelimit.TransferEngine;

/**
 * Registers the paths listed under {@code flowlimit.paths} on startup. Only paths
 * missing from the store are written, so a restart keeps the running counters.
 * Changing a live path goes through {@code PUT /v1/paths}.
 */
@Component
public class PathBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PathBootstrap.class);

    private final FlowLimitProperties properties;
    private final TransferEngine engine;
    private final Clock clock;

    public PathBootstrap(FlowLimitProperties properties, TransferEngine engine, Clock clock) {
        this.properties = properties;
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.paths().isEmpty()) {
            return;
        }

        Map<Path, List<Quota>> paths = new LinkedHashMap<>();
        for (FlowLimitProperties.PathDefinition def : properties.paths()) {
            List<Quota> quotas = def.quotas().stream()
                    .map(q -> new Quota(q.name(), amount(q.maxSend()), amount(q.maxReceive()), duration(q)))
                    .toList();
            paths.put(new Path(def.owner(), def.channel(), def.asset()), quotas);
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        int registered = engine.registerPaths(paths, now);
        log.info("flowlimit bootstrap registered={} configured={}", registered, paths.size());
    }

    private static Amount amount(BigInteger value) {
        if (value == null) {
            throw new IllegalStateException("flowlimit.paths quotas need both maxSend and maxReceive");
        }
        return Amount.of(value);
    }

    private static long duration(FlowLimitProperties.QuotaDefinition quota) {
        if (quota.durationSeconds() == null) {
            throw new IllegalStateException("flowlimit.paths quota '" + quota.name() + "' needs durationSeconds");
        }
        return quota.durationSeconds();
    }
}
