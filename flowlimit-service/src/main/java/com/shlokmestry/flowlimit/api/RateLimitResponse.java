package com.shlokmestry.flowlimit.api;

import java.time.Instant;

import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.Flow;
import com.shlokmestry.flowlimit.ratelimit.Quota;
import com.shlokmestry.flowlimit.ratelimit.RateLimit;

public record RateLimitResponse(
        String name,
        Amount maxSend,
        Amount maxReceive,
        long durationSeconds,
        Amount inflow,
        Amount outflow,
        Instant periodEnd
) {
    static RateLimitResponse from(RateLimit limit) {
        Quota quota = limit.getQuota();
        Flow flow = limit.getFlow();
        return new RateLimitResponse(
                quota.name(),
                quota.maxSend(),
                quota.maxReceive(),
                quota.durationSeconds(),
                flow.getInflow(),
                flow.getOutflow(),
                flow.getPeriodEnd()
        );
    }
}
