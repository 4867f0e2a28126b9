package org.royalewatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running statistics of one subject. Only {@code StatisticsAggregator} mutates it.
 * Opponent buckets are keyed by normalized opponent tag.
 */
public class SubjectAggregate {
    private final ModeStats total;
    private final Map<String, ModeStats> byMode;
    private final Map<String, OpponentStats> byOpponent;

    public SubjectAggregate() {
        this(new ModeStats(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public SubjectAggregate(ModeStats total, Map<String, ModeStats> byMode, Map<String, OpponentStats> byOpponent) {
        this.total = total;
        this.byMode = byMode;
        this.byOpponent = byOpponent;
    }

    public ModeStats total() {
        return total;
    }

    public int getTotalBattles() { return total.getBattles(); }
    public int getTotalWins() { return total.getWins(); }
    public int getTotalLosses() { return total.getLosses(); }
    public int getTotalDraws() { return total.getDraws(); }

    public double winRate() {
        return total.winRate();
    }

    public Map<String, ModeStats> byMode() {
        return Collections.unmodifiableMap(byMode);
    }

    public Map<String, OpponentStats> byOpponent() {
        return Collections.unmodifiableMap(byOpponent);
    }

    /** Folds one battle into every bucket. */
    public void add(BattleRecord battle) {
        total.record(battle.outcome());
        byMode.computeIfAbsent(battle.mode(), m -> new ModeStats()).record(battle.outcome());
        BattleRecord.Opponent opponent = battle.opponent();
        byOpponent.computeIfAbsent(opponent.tag(), t -> new OpponentStats(opponent.name()))
                .record(battle.outcome(), opponent.name(), battle.timestamp());
    }

    /** Deep copy, so a cycle can work on a scratch version and drop it on failure. */
    public SubjectAggregate copy() {
        Map<String, ModeStats> modes = new LinkedHashMap<>();
        byMode.forEach((k, v) -> modes.put(k, v.copy()));
        Map<String, OpponentStats> opponents = new LinkedHashMap<>();
        byOpponent.forEach((k, v) -> opponents.put(k, v.copy()));
        return new SubjectAggregate(total.copy(), modes, opponents);
    }

    public boolean isConsistent() {
        int modeSum = byMode.values().stream().mapToInt(ModeStats::getBattles).sum();
        int opponentSum = byOpponent.values().stream().mapToInt(ModeStats::getBattles).sum();
        return modeSum == total.getBattles() && opponentSum == total.getBattles();
    }
}
