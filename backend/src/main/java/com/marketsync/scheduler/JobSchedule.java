package com.marketsync.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Tick grid {@code startAt + k·interval} for k ≥ 0, optionally bounded by endAt (inclusive).
 */
public record JobSchedule(Duration interval, Instant startAt, Instant endAt) {

    /**
     * Latest grid slot at or before {@code now}; null before the first slot.
     */
    public Instant latestSlotAtOrBefore(Instant now) {
        Instant bound = endAt != null && now.isAfter(endAt) ? endAt : now;
        if (bound.isBefore(startAt)) {
            return null;
        }
        long k = Duration.between(startAt, bound).toMillis() / interval.toMillis();
        return startAt.plusMillis(k * interval.toMillis());
    }

    /**
     * First grid slot strictly after {@code after} (the first slot when {@code after} is null); null past endAt.
     */
    public Instant nextSlotAfter(Instant after) {
        Instant next;
        if (after == null || after.isBefore(startAt)) {
            next = startAt;
        } else {
            long k = Duration.between(startAt, after).toMillis() / interval.toMillis() + 1;
            next = startAt.plusMillis(k * interval.toMillis());
        }
        return endAt != null && next.isAfter(endAt) ? null : next;
    }
}
