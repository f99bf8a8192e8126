package com.shlokmestry.flowlimit.observability;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.shlokmestry.flowlimit.ratelimit.FlowDirection;
import com.shlokmestry.flowlimit.ratelimit.RateLimitExceededException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

@Component
public class RateLimitMetrics {

    private final MeterRegistry registry;

    public RateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code allowed}, {@code rejected} or {@code unrestricted}
     */
    public void transfer(FlowDirection direction, String outcome) {
        Counter.builder("flowlimit.transfers.total")
                .description("Total transfer decisions per direction and outcome")
                .tag("direction", direction.name().toLowerCase(Locale.ROOT))
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void rejected(FlowDirection direction, RateLimitExceededException e) {
        transfer(direction, "rejected");
        Counter.builder("flowlimit.rejections.total")
                .description("Total rejected transfers per quota")
                .tag("quota", e.getQuotaName())
                .register(registry)
                .increment();
    }

    public void undoSend() {
        Counter.builder("flowlimit.undo.total")
                .description("Total reverted outbound transfers")
                .register(registry)
                .increment();
    }

    public void quotaReset(String quotaName) {
        Counter.builder("flowlimit.resets.total")
                .description("Total administrative quota resets")
                .tag("quota", quotaName)
                .register(registry)
                .increment();
    }
}
