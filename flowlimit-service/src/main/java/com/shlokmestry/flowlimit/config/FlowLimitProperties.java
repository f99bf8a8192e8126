package com.shlokmestry.flowlimit.config;

import java.math.BigInteger;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under {@code flowlimit.*}.
 *
 * @param store where path state lives
 * @param paths paths registered when the service starts
 */
@ConfigurationProperties("flowlimit")
public record FlowLimitProperties(
        @DefaultValue Store store,
        List<PathDefinition> paths
) {

    public FlowLimitProperties {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    /**
     * @param type {@code redis} or {@code memory}
     * @param keyPrefix prefix of every Redis key holding path state
     * @param maxUpdateAttempts compare-and-set attempts before an update gives up
     */
    public record Store(
            @DefaultValue("redis") String type,
            @DefaultValue("flowlimit:path:") String keyPrefix,
            @DefaultValue("5") int maxUpdateAttempts
    ) {}

    public record PathDefinition(
            String owner,
            String channel,
            String asset,
            List<QuotaDefinition> quotas
    ) {
        public PathDefinition {
            quotas = quotas == null ? List.of() : List.copyOf(quotas);
        }
    }

    public record QuotaDefinition(
            String name,
            Long durationSeconds,
            BigInteger maxSend,
            BigInteger maxReceive
    ) {}
}
