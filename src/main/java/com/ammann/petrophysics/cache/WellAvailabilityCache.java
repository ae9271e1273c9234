/* (C)2026 */
package com.ammann.petrophysics.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Time-bounded snapshot of which wells are available for analysis.
 *
 * <p>The snapshot is reloaded on the first read after {@code ttl} has elapsed or after
 * {@link #invalidate()}. Time comes from the supplied {@link Clock}.
 */
public class WellAvailabilityCache {

    private static final Logger LOG = Logger.getLogger(WellAvailabilityCache.class);

    private final Clock clock;
    private final Duration ttl;

    private WellAvailability snapshot;
    private Instant loadedAt;

    public WellAvailabilityCache(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive, got " + ttl);
        }
        this.ttl = ttl;
    }

    /**
     * Returns the cached snapshot, loading it through {@code loader} when empty or stale.
     */
    public synchronized WellAvailability get(Supplier<WellAvailability> loader) {
        Instant now = clock.instant();
        if (snapshot == null || isExpired(now)) {
            snapshot = loader.get();
            loadedAt = now;
            LOG.debugf("Well availability reloaded: %d wells", snapshot.wellNames().size());
        }
        return snapshot;
    }

    /** Drops the snapshot so the next read reloads it. */
    public synchronized void invalidate() {
        snapshot = null;
        loadedAt = null;
    }

    public synchronized boolean isFresh() {
        return snapshot != null && !isExpired(clock.instant());
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isExpired(Instant now) {
        return !now.isBefore(loadedAt.plus(ttl));
    }

    /**
     * @param wellNames registered wells, sorted
     * @param asOf      when the snapshot was taken
     */
    public record WellAvailability(List<String> wellNames, Instant asOf) {

        public WellAvailability {
            wellNames = List.copyOf(wellNames);
        }
    }
}
