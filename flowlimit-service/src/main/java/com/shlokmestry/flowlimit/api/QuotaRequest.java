package com.shlokmestry.flowlimit.api;

import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.Quota;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record QuotaRequest(
        @NotBlank String name,            // e.g. "daily", "weekly"
        @NotNull @Min(0) Long durationSeconds,
        @NotNull Amount maxSend,
        @NotNull Amount maxReceive
) {
    Quota toQuota() {
        return new Quota(name, maxSend, maxReceive, durationSeconds);
    }
}
