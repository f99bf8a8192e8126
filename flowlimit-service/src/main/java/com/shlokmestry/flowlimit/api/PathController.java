package com.shlokmestry.flowlimit.api;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.flowlimit.observability.RateLimitMetrics;
import com.shlokmestry.flowlimit.paths.Path;
import com.shlokmestry.flowlimit.ratelimit.Quota;
import com.shlokmestry.flowlimit.ratelimit.RateLimit;
import com.shlokmestry.flowlimit.ratelimit.TransferEngine;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * Path administration. Components travel as query parameters or body fields
 * because assets such as {@code transfer/channel-0/uatom} contain slashes.
 */
@Validated
@RestController
@RequestMapping("/v1/paths")
public class PathController {

    private final TransferEngine engine;
    private final RateLimitMetrics metrics;
    private final Clock clock;

    public PathController(TransferEngine engine, RateLimitMetrics metrics, Clock clock) {
        this.engine = engine;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PutMapping
    @ResponseStatus(HttpStatus.OK)
    public List<RateLimitResponse> register(@Valid @RequestBody RegisterPathRequest req) {
        Path path = new Path(req.owner(), req.channel(), req.asset());
        List<Quota> quotas = req.quotas().stream().map(QuotaRequest::toQuota).toList();
        return toResponse(engine.registerPath(path, quotas, now()));
    }

    @GetMapping
    public List<RateLimitResponse> get(
            @RequestParam @NotBlank String owner,
            @RequestParam @NotBlank String channel,
            @RequestParam @NotBlank String asset
    ) {
        Path path = new Path(owner, channel, asset);
        return engine.state(path)
                .map(PathController::toResponse)
                .orElseThrow(() -> new PathNotFoundException(path));
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deregister(
            @RequestParam @NotBlank String owner,
            @RequestParam @NotBlank String channel,
            @RequestParam @NotBlank String asset
    ) {
        engine.deregisterPath(new Path(owner, channel, asset));
    }

    @PostMapping("/reset")
    public List<RateLimitResponse> reset(@Valid @RequestBody ResetQuotaRequest req) {
        Path path = new Path(req.owner(), req.channel(), req.asset());
        List<RateLimit> limits = engine.resetQuota(path, req.quotaName(), now());
        metrics.quotaReset(req.quotaName());
        return toResponse(limits);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static List<RateLimitResponse> toResponse(List<RateLimit> limits) {
        return limits.stream().map(RateLimitResponse::from).toList();
    }
}
