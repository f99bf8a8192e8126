package com.shlokmestry.flowlimit.api;

import jakarta.validation.constraints.NotBlank;

public record ResetQuotaRequest(
        @NotBlank String owner,
        @NotBlank String channel,
        @NotBlank String asset,
        @NotBlank String quotaName
) {}
