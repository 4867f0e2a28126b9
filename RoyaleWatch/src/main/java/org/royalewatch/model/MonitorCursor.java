package org.royalewatch.model;

import java.time.Instant;

/**
 * Marker of the newest battle already processed for a subject.
 * {@code lastProcessedId} is null until the first successful poll.
 */
public record MonitorCursor(
        String lastProcessedId,
        Instant lastProcessedAt,
        long fetchSequence
) {

    public static MonitorCursor initial() {
        return new MonitorCursor(null, null, 0);
    }

    public boolean hasBaseline() {
        return lastProcessedId != null;
    }

    public MonitorCursor advanceTo(BattleRecord newest) {
        return new MonitorCursor(newest.id(), newest.timestamp(), fetchSequence + 1);
    }

    public MonitorCursor nextFetch() {
        return new MonitorCursor(lastProcessedId, lastProcessedAt, fetchSequence + 1);
    }
}
