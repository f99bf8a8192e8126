package com.shlokmestry.flowlimit.paths;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

import com.shlokmestry.flowlimit.ratelimit.Amount;
import com.shlokmestry.flowlimit.ratelimit.FlowDirection;
import com.shlokmestry.flowlimit.ratelimit.Quota;
import com.shlokmestry.flowlimit.ratelimit.RateLimit;

class InMemoryPathStoreTest {

    private static final Instant T0 = Instant.ofEpochSecond(1_700_000_000);
    private static final Path PATH = new Path("bridge", "channel", "denom");

    private final InMemoryPathStore store = new InMemoryPathStore();

    private static RateLimit daily() {
        return RateLimit.start(new Quota("daily", Amount.of(100), Amount.of(100), 86_400), T0);
    }

    @Test
    void pathsAreKeyedOnAllThreeComponents() {
        store.save(PATH, List.of(daily()));

        assertThat(store.load(new Path("bridge", "channel", "denom"))).isPresent();
        assertThat(store.load(new Path("bridge", "channel", "other"))).isEmpty();
        assertThat(store.load(new Path("other", "channel", "denom"))).isEmpty();
    }

    @Test
    void save_copiesTheList() {
        List<RateLimit> limits = new ArrayList<>(List.of(daily()));
        store.save(PATH, limits);
        limits.clear();

        assertThat(store.load(PATH).orElseThrow()).hasSize(1);
    }

    @Test
    void update_onMissingPath_doesNotCallUpdater() {
        AtomicBoolean called = new AtomicBoolean();

        assertThat(store.update(PATH, limits -> {
            called.set(true);
            return limits;
        })).isEmpty();

        assertThat(called).isFalse();
        assertThat(store.load(PATH)).isEmpty();
    }

    @Test
    void update_failingUpdater_keepsStoredValue() {
        store.save(PATH, List.of(daily()));
        List<RateLimit> before = store.load(PATH).orElseThrow();

        assertThatThrownBy(() -> store.update(PATH, limits -> {
            limits.get(0).allowTransfer(PATH, FlowDirection.OUT, Amount.of(10), T0);
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.load(PATH).orElseThrow()).isEqualTo(before);
    }

    @Test
    void saveIfAbsent_neverReplacesStoredLimits() {
        RateLimit used = daily().allowTransfer(PATH, FlowDirection.OUT, Amount.of(60), T0);
        store.save(PATH, List.of(used));

        assertThat(store.saveIfAbsent(PATH, List.of(daily()))).isFalse();
        assertThat(store.load(PATH).orElseThrow()).containsExactly(used);

        Path other = new Path("bridge", "channel", "other");
        assertThat(store.saveIfAbsent(other, List.of(daily()))).isTrue();
        assertThat(store.load(other).orElseThrow()).containsExactly(daily());
    }

    @Test
    void remove_dropsThePath() {
        store.save(PATH, List.of(daily()));
        store.remove(PATH);
        store.remove(PATH);

        assertThat(store.load(PATH)).isEmpty();
    }
}
