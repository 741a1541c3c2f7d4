package org.javai.shuuten.dedup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide, time-windowed store of recently dispatched fingerprints.
 *
 * <p>Updates to one fingerprint are atomic; different fingerprints never contend on a shared
 * lock. Entries older than the window count as absent and are purged lazily, either on access
 * or in a sweep once the map grows past {@link #PURGE_THRESHOLD} entries.
 *
 * <p>This is a best-effort filter, not a lock: two callers racing on the same fingerprint may
 * both be allowed through if one checks before the other's entry is written.
 */
public final class DedupCache {

    static final int PURGE_THRESHOLD = 1024;

    private final Duration window;
    private final Clock clock;
    private final ConcurrentMap<Fingerprint, Instant> lastSent = new ConcurrentHashMap<>();

    public DedupCache(Duration window) {
        this(window, Clock.systemUTC());
    }

    public DedupCache(Duration window, Clock clock) {
        this.window = Objects.requireNonNull(window, "window must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must not be negative");
        }
    }

    public Duration window() {
        return window;
    }

    public boolean isEnabled() {
        return !window.isZero();
    }

    /**
     * Records a dispatch for the fingerprint unless one was recorded within the window.
     *
     * @return true if the caller should dispatch, false if the event is a duplicate
     */
    public boolean tryAcquire(Fingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        if (!isEnabled()) {
            return true;
        }
        Instant now = clock.instant();
        boolean[] acquired = {false};
        lastSent.compute(fingerprint, (key, previous) -> {
            if (previous != null && !isExpired(previous, now)) {
                return previous;
            }
            acquired[0] = true;
            return now;
        });
        if (acquired[0] && lastSent.size() > PURGE_THRESHOLD) {
            purgeExpired();
        }
        return acquired[0];
    }

    /**
     * Returns true if an unexpired entry exists for the fingerprint.
     */
    public boolean contains(Fingerprint fingerprint) {
        Instant sentAt = lastSent.get(fingerprint);
        return sentAt != null && !isExpired(sentAt, clock.instant());
    }

    /**
     * Removes every expired entry.
     */
    public void purgeExpired() {
        Instant now = clock.instant();
        lastSent.entrySet().removeIf(e -> isExpired(e.getValue(), now));
    }

    public void clear() {
        lastSent.clear();
    }

    /**
     * Number of stored entries, including expired ones not yet purged.
     */
    public int size() {
        return lastSent.size();
    }

    private boolean isExpired(Instant sentAt, Instant now) {
        return !sentAt.plus(window).isAfter(now);
    }
}
