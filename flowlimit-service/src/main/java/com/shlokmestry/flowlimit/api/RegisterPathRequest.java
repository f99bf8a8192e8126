package com.shlokmestry.flowlimit.api;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RegisterPathRequest(
        @NotBlank String owner,
        @NotBlank String channel,
        @NotBlank String asset,
        @NotNull List<@Valid @NotNull QuotaRequest> quotas
) {}
