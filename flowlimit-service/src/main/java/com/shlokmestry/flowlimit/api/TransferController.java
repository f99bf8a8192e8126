package com.shlokmestry.flowlimit.api;

import java.time.Clock;
import java.time.temporal.ChronoUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.flowlimit.observability.RateLimitMetrics;
import com.shlokmestry.flowlimit.paths.Path;
import com.shlokmestry.flowlimit.ratelimit.FlowDirection;
import com.shlokmestry.flowlimit.ratelimit.RateLimitExceededException;
import com.shlokmestry.flowlimit.ratelimit.TransferEngine;
import com.shlokmestry.flowlimit.ratelimit.TransferResult;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1/transfers")
public class TransferController {

    private static final Logger log = LoggerFactory.getLogger(TransferController.class);

    private final TransferEngine engine;
    private final RateLimitMetrics metrics;
    private final Clock clock;

    public TransferController(TransferEngine engine, RateLimitMetrics metrics, Clock clock) {
        this.engine = engine;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostMapping("/send")
    public TransferResponse send(@Valid @RequestBody TransferRequest req) {
        return transfer("send", FlowDirection.OUT, req);
    }

    @PostMapping("/receive")
    public TransferResponse receive(@Valid @RequestBody TransferRequest req) {
        return transfer("receive", FlowDirection.IN, req);
    }

    @PostMapping("/undo-send")
    public TransferResponse undoSend(@Valid @RequestBody TransferRequest req) {
        Path path = new Path(req.owner(), req.channel(), req.asset());
        TransferResult result = engine.undoSend(path, req.amount());
        metrics.undoSend();

        log.info("flowlimit undo_send owner={} channel={} asset={} amount={} rateLimited={}",
                path.owner(), path.channel(), path.asset(), req.amount(), result.rateLimited());

        return TransferResponse.from("undo_send", req.amount(), result);
    }

    private TransferResponse transfer(String method, FlowDirection direction, TransferRequest req) {
        Path path = new Path(req.owner(), req.channel(), req.asset());

        final TransferResult result;
        try {
            result = engine.tryTransfer(path, direction, req.amount(), clock.instant().truncatedTo(ChronoUnit.SECONDS));
        } catch (RateLimitExceededException e) {
            metrics.rejected(direction, e);
            log.info("flowlimit decision owner={} channel={} asset={} direction={} amount={} allowed=false quota={} used={} max={} reset={}",
                    path.owner(), path.channel(), path.asset(), direction, req.amount(),
                    e.getQuotaName(), e.getUsed(), e.getMax(), e.getReset());
            throw e;
        }

        metrics.transfer(direction, result.rateLimited() ? "allowed" : "unrestricted");
        log.info("flowlimit decision owner={} channel={} asset={} direction={} amount={} allowed=true rateLimited={}",
                path.owner(), path.channel(), path.asset(), direction, req.amount(), result.rateLimited());

        return TransferResponse.from(method, req.amount(), result);
    }
}
