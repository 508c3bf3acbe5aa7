package com.fitjourney.backend.journey.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private ProgressCache cache;

    @BeforeEach
    void setUp() {
        cache = new ProgressCache(Duration.ofMinutes(5), 1000, ticker);
    }

    @Test
    void entries_expire_after_ttl() {
        cache.set("progress:1:10", "v");
        nanos.addAndGet(Duration.ofMinutes(4).toNanos());
        assertThat(cache.get("progress:1:10", String.class)).contains("v");

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(cache.get("progress:1:10", String.class)).isEmpty();
    }

    @Test
    void get_with_wrong_type_is_a_miss() {
        cache.set("journey:1:2", 42);
        assertThat(cache.get("journey:1:2", String.class)).isEmpty();
        assertThat(cache.get("journey:1:2", Integer.class)).contains(42);
    }

    @Test
    void invalidate_pattern_removes_only_matching_prefix() {
        cache.set("progress:1:10", "a");
        cache.set("progress:1:11", "b");
        cache.set("progress:2:10", "c");

        int removed = cache.invalidatePattern("progress:1:");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("progress:2:10", String.class)).contains("c");
        assertThat(cache.get("progress:1:10", String.class)).isEmpty();
    }

    @Test
    void invalidate_user_does_not_touch_user_with_longer_id() {
        cache.set("journey:1:5", "a");
        cache.set("progress:1:7", "b");
        cache.set("progress:10:7", "c");

        int removed = cache.invalidateUser(1L);

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("progress:10:7", String.class)).contains("c");
    }

    @Test
    void invalidate_and_clear() {
        cache.set("a", 1);
        cache.set("b", 2);

        cache.invalidate("a");
        assertThat(cache.get("a", Integer.class)).isEmpty();
        assertThat(cache.get("b", Integer.class)).contains(2);

        cache.clear();
        assertThat(cache.estimatedSize()).isZero();
    }
}
