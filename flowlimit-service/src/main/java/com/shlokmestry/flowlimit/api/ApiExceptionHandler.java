package com.shlokmestry.flowlimit.api;

import java.time.Clock;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.shlokmestry.flowlimit.paths.PathStoreException;
import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.QuotaNotFoundException;
import com.shlokmestry.flowlimit.ratelimit.RateLimitExceededException;

import jakarta.validation.ConstraintViolationException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final long STORE_UNAVAILABLE_RETRY_AFTER_SECONDS = 1;

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<RateLimitedBody> rateLimited(RateLimitExceededException e) {
        // a transfer at exactly `reset` still lands in the old window
        long retryAfterSeconds = Math.max(1, Duration.between(clock.instant(), e.getReset()).getSeconds() + 1);

        HttpHeaders h = new HttpHeaders();
        h.set("RateLimit-Limit", e.getMax().toString());
        h.set("RateLimit-Remaining", e.getMax().saturatingSub(e.getUsed()).toString());
        h.set("RateLimit-Reset", String.valueOf(retryAfterSeconds));
        h.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(h)
                .body(new RateLimitedBody(
                        "rate_limit_exceeded",
                        e.getMessage(),
                        e.getPath().owner(),
                        e.getPath().channel(),
                        e.getPath().asset(),
                        e.getAmount(),
                        e.getQuotaName(),
                        e.getUsed(),
                        e.getMax(),
                        e.getReset().toString()
                ));
    }

    @ExceptionHandler(QuotaNotFoundException.class)
    public ResponseEntity<ErrorBody> quotaNotFound(QuotaNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorBody("quota_not_found", e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorBody> invalid(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorBody("invalid_request", e.getMessage()));
    }

    @ExceptionHandler({PathStoreException.class, DataAccessException.class})
    public ResponseEntity<ErrorBody> storeUnavailable(RuntimeException e) {
        log.warn("flowlimit store_unavailable reason={}", e.getClass().getSimpleName(), e);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(STORE_UNAVAILABLE_RETRY_AFTER_SECONDS))
                .body(new ErrorBody("store_unavailable", "Path store unavailable"));
    }

    public record ErrorBody(String code, String message) {}

    public record RateLimitedBody(
            String code,
            String message,
            String owner,
            String channel,
            String asset,
            Amount amount,
            String quota,
            Amount used,
            Amount max,
            String reset
    ) {}
}
