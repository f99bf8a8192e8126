package com.shlokmestry.flowlimit.api;

import java.util.List;

import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.TransferResult;

public record TransferResponse(
        String method,
        String owner,
        String channel,
        String asset,
        Amount amount,
        boolean rateLimited,
        List<QuotaUsage> quotas
) {
    static TransferResponse from(String method, Amount amount, TransferResult result) {
        return new TransferResponse(
                method,
                result.path().owner(),
                result.path().channel(),
                result.path().asset(),
                amount,
                result.rateLimited(),
                result.limits().stream().map(QuotaUsage::from).toList()
        );
    }
}
