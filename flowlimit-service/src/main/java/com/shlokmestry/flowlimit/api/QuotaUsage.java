package com.shlokmestry.flowlimit.api;

import java.time.Instant;

import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.DirectionalAmount;
import com.shlokmestry.flowlimit.ratelimit.Flow;
import com.shlokmestry.flowlimit.ratelimit.RateLimit;

/**
 * Netted usage of one quota after a transfer.
 */
public record QuotaUsage(
        String quota,
        Amount usedIn,
        Amount usedOut,
        Amount maxIn,
        Amount maxOut,
        Instant periodEnd
) {
    static QuotaUsage from(RateLimit limit) {
        Flow flow = limit.getFlow();
        DirectionalAmount used = flow.balance();
        DirectionalAmount max = limit.getQuota().capacity();
        return new QuotaUsage(
                limit.getQuota().name(),
                used.in(),
                used.out(),
                max.in(),
                max.out(),
                flow.getPeriodEnd()
        );
    }
}
