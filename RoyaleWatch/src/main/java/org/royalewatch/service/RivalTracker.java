package org.royalewatch.service;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.OpponentStats;
import org.royalewatch.model.RivalEntry;
import org.royalewatch.model.SubjectAggregate;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read view over the opponent buckets of a {@link SubjectAggregate}.
 * Being a rival is a predicate on the stored counts, there is no flag to keep in sync.
 */
public class RivalTracker {

    public static final int DEFAULT_MIN_ENCOUNTERS = 2;

    private static final Comparator<RivalEntry> ORDER = Comparator
            .comparingInt(RivalEntry::encounters).reversed()
            .thenComparing(RivalEntry::lastSeen, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(RivalEntry::opponentTag);

    private final int minEncounters;

    public RivalTracker() {
        this(DEFAULT_MIN_ENCOUNTERS);
    }

    public RivalTracker(int minEncounters) {
        this.minEncounters = Math.max(1, minEncounters);
    }

    public List<RivalEntry> listRivals(SubjectAggregate aggregate) {
        return listRivals(aggregate, minEncounters);
    }

    public List<RivalEntry> listRivals(SubjectAggregate aggregate, int threshold) {
        return aggregate.byOpponent().entrySet().stream()
                .filter(e -> !BattleRecord.Opponent.UNKNOWN_TAG.equals(e.getKey()))
                .filter(e -> e.getValue().getBattles() >= threshold)
                .map(e -> RivalEntry.of(e.getKey(), e.getValue()))
                .sorted(ORDER)
                .toList();
    }

    public Optional<RivalEntry> headToHead(SubjectAggregate aggregate, String opponentTag) {
        OpponentStats stats = aggregate.byOpponent().get(opponentTag);
        if (stats == null || BattleRecord.Opponent.UNKNOWN_TAG.equals(opponentTag)) return Optional.empty();
        return Optional.of(RivalEntry.of(opponentTag, stats));
    }

    public boolean isRival(SubjectAggregate aggregate, String opponentTag) {
        return headToHead(aggregate, opponentTag).map(r -> r.encounters() >= minEncounters).orElse(false);
    }

    /** True when going from {@code before} to {@code after} encounters crosses the rival threshold. */
    public boolean isPromotion(int before, int after) {
        return before < minEncounters && after >= minEncounters;
    }

    public int getMinEncounters() {
        return minEncounters;
    }
}
