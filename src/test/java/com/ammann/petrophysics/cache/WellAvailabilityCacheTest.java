/* (C)2026 */
package com.ammann.petrophysics.cache;

import com.ammann.petrophysics.cache.WellAvailabilityCache.WellAvailability;
import com.ammann.petrophysics.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WellAvailabilityCacheTest {

    private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

    private MutableClock clock;
    private WellAvailabilityCache cache;
    private AtomicInteger loads;
    private Supplier<WellAvailability> loader;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new WellAvailabilityCache(clock, Duration.ofMinutes(5));
        loads = new AtomicInteger();
        loader = () -> new WellAvailability(List.of("W-" + loads.incrementAndGet()), clock.instant());
    }

    @Test
    void loadsOnFirstRead() {
        assertThat(cache.isFresh()).isFalse();

        WellAvailability snapshot = cache.get(loader);

        assertThat(snapshot.wellNames()).containsExactly("W-1");
        assertThat(snapshot.asOf()).isEqualTo(START);
        assertThat(cache.isFresh()).isTrue();
    }

    @Test
    void servesCachedSnapshotWithinTtl() {
        cache.get(loader);
        clock.advance(Duration.ofMinutes(4).plusSeconds(59));

        assertThat(cache.get(loader).wellNames()).containsExactly("W-1");
        assertThat(loads).hasValue(1);
    }

    @Test
    void reloadsOnceTtlHasElapsed() {
        cache.get(loader);
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.isFresh()).isFalse();
        assertThat(cache.get(loader).wellNames()).containsExactly("W-2");
        assertThat(cache.get(loader).asOf()).isEqualTo(START.plus(Duration.ofMinutes(5)));
    }

    @Test
    void invalidateForcesReload() {
        cache.get(loader);
        cache.invalidate();

        assertThat(cache.isFresh()).isFalse();
        assertThat(cache.get(loader).wellNames()).containsExactly("W-2");
    }

    @Test
    void zeroTtlReloadsEveryRead() {
        WellAvailabilityCache uncached = new WellAvailabilityCache(clock, Duration.ZERO);

        uncached.get(loader);
        uncached.get(loader);

        assertThat(loads).hasValue(2);
    }

    @Test
    void rejectsNegativeTtl() {
        assertThatThrownBy(() -> new WellAvailabilityCache(clock, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cache.getTtl()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void snapshotListIsImmutable() {
        WellAvailability snapshot = cache.get(loader);

        assertThatThrownBy(() -> snapshot.wellNames().add("X"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
