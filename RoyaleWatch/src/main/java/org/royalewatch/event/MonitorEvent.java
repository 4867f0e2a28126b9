package org.royalewatch.event;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.RivalEntry;

/**
 * Notification raised by the monitor once a cycle has been committed.
 */
public interface MonitorEvent {

    String subjectTag();

    /**
     * @param subjectName display name of the subject at detection time
     * @param totalWins   subject totals after this battle was counted
     * @param headToHead  record against this battle's opponent after it was counted, null for unknown opponents
     */
    record NewBattleDetected(
            String subjectTag,
            String subjectName,
            BattleRecord battle,
            int totalBattles,
            int totalWins,
            int totalLosses,
            RivalEntry headToHead
    ) implements MonitorEvent {}

    record RivalPromoted(
            String subjectTag,
            String opponentTag,
            String opponentName,
            int encounterCount
    ) implements MonitorEvent {}

    record LogDiscontinuityDetected(
            String subjectTag,
            int unseenCount
    ) implements MonitorEvent {}

    record ArenaChanged(
            String subjectTag,
            String subjectName,
            String previousArena,
            String currentArena,
            int trophies
    ) implements MonitorEvent {}

    /**
     * @param kind stable error kind, e.g. {@code TRANSIENT} or {@code STATE_STORE}
     */
    record PersistentFailure(
            String subjectTag,
            String kind,
            int consecutiveFailures,
            String detail
    ) implements MonitorEvent {}
}
