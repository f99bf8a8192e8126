package com.shlokmestry.flowlimit.config;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import com.shlokmestry.flowlimit.paths.Path;
import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.RateLimit;
import com.shlokmestry.flowlimit.ratelimit.TransferEngine;

@SpringBootTest
@TestPropertySource(properties = {
        "flowlimit.store.type=memory",
        "flowlimit.paths[0].owner=bridge",
        "flowlimit.paths[0].channel=channel-0",
        "flowlimit.paths[0].asset=transfer/channel-0/uatom",
        "flowlimit.paths[0].quotas[0].name=daily",
        "flowlimit.paths[0].quotas[0].duration-seconds=86400",
        "flowlimit.paths[0].quotas[0].max-send=1000",
        "flowlimit.paths[0].quotas[0].max-receive=340282366920938463463374607431768211455",
        "flowlimit.paths[0].quotas[1].name=weekly",
        "flowlimit.paths[0].quotas[1].duration-seconds=604800",
        "flowlimit.paths[0].quotas[1].max-send=5000",
        "flowlimit.paths[0].quotas[1].max-receive=5000"
})
class PathBootstrapTest {

    @Autowired
    TransferEngine engine;

    @Autowired
    FlowLimitProperties properties;

    @Test
    void configuredPathsAreRegisteredOnStartup() {
        List<RateLimit> limits = engine.state(new Path("bridge", "channel-0", "transfer/channel-0/uatom"))
                .orElseThrow();

        assertThat(limits).extracting(l -> l.getQuota().name()).containsExactly("daily", "weekly");
        assertThat(limits.get(0).getQuota().maxSend()).isEqualTo(Amount.of(1000));
        assertThat(limits.get(0).getQuota().maxReceive()).isEqualTo(Amount.MAX);
        assertThat(limits.get(1).getQuota().durationSeconds()).isEqualTo(604_800);
        assertThat(limits.get(0).getFlow().getOutflow()).isEqualTo(Amount.ZERO);
    }

    @Test
    void storeSettingsAreBound() {
        assertThat(properties.store().type()).isEqualTo("memory");
        assertThat(properties.store().keyPrefix()).isEqualTo("flowlimit:path:");
        assertThat(properties.store().maxUpdateAttempts()).isEqualTo(5);
    }
}
