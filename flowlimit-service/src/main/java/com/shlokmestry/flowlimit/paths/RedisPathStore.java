package com.shlokmestry.flowlimit.paths;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlokmestry.flowlimit.config.FlowLimitProperties;
import com.shlokmestry.flowlimit.ratelimit.RateLimit;

/**
 * Keeps each path's limits as one JSON string value. Updates go through a Lua
 * compare-and-set so a read-modify-write never interleaves with another writer.
 */
@Repository
@ConditionalOnProperty(name = "flowlimit.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisPathStore implements PathStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPathStore.class);
    private static final TypeReference<List<RateLimit>> LIMITS_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final RedisScript<Long> compareAndSet;
    private final String keyPrefix;
    private final int maxUpdateAttempts;

    public RedisPathStore(StringRedisTemplate redis, ObjectMapper objectMapper, FlowLimitProperties properties) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.compareAndSet = RedisScript.of(new ClassPathResource("lua/compare_and_set.lua"), Long.class);
        this.keyPrefix = properties.store().keyPrefix();
        this.maxUpdateAttempts = Math.max(1, properties.store().maxUpdateAttempts());
    }

    String key(Path path) {
        return keyPrefix + encode(path.owner()) + "/" + encode(path.channel()) + "/" + encode(path.asset());
    }

    private static String encode(String component) {
        return URLEncoder.encode(component, StandardCharsets.UTF_8);
    }

    @Override
    public Optional<List<RateLimit>> load(Path path) {
        String json = redis.opsForValue().get(key(path));
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(decode(path, json));
    }

    @Override
    public void save(Path path, List<RateLimit> limits) {
        redis.opsForValue().set(key(path), encode(path, limits));
    }

    @Override
    public boolean saveIfAbsent(Path path, List<RateLimit> limits) {
        return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key(path), encode(path, limits)));
    }

    @Override
    public void remove(Path path) {
        redis.delete(key(path));
    }

    @Override
    public Optional<List<RateLimit>> update(Path path, UnaryOperator<List<RateLimit>> updater) {
        String key = key(path);
        for (int attempt = 1; attempt <= maxUpdateAttempts; attempt++) {
            String current = redis.opsForValue().get(key);
            if (current == null) {
                return Optional.empty();
            }

            List<RateLimit> updated = List.copyOf(updater.apply(decode(path, current)));
            String next = encode(path, updated);
            if (next.equals(current)) {
                return Optional.of(updated);
            }

            Long swapped = redis.execute(compareAndSet, List.of(key), current, next);
            if (swapped != null && swapped == 1L) {
                return Optional.of(updated);
            }
            log.debug("path update conflict path={} attempt={}", path, attempt);
        }
        throw new PathStoreException("Gave up updating " + path + " after " + maxUpdateAttempts + " conflicting writes");
    }

    private List<RateLimit> decode(Path path, String json) {
        try {
            return List.copyOf(objectMapper.readValue(json, LIMITS_TYPE));
        } catch (JsonProcessingException e) {
            throw new PathStoreException("Failed to deserialize rate limits for " + path, e);
        }
    }

    private String encode(Path path, List<RateLimit> limits) {
        try {
            return objectMapper.writeValueAsString(limits);
        } catch (JsonProcessingException e) {
            throw new PathStoreException("Failed to serialize rate limits for " + path, e);
        }
    }
}
