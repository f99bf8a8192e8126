package com.shlokmestry.flowlimit.api;

import com.shlokmestry.flowlimit.ratelimit.Amount;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TransferRequest(
        @NotBlank String owner,
        @NotBlank String channel,
        @NotBlank String asset,          // denomination as seen on this side of the channel
        @NotNull Amount amount           // value already computed by the caller
) {}
