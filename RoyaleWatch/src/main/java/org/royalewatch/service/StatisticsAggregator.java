package org.royalewatch.service;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.SubjectAggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Folds battles into a {@link SubjectAggregate}. Counters only ever grow; rates are computed on read.
 */
public class StatisticsAggregator {

    public SubjectAggregate apply(SubjectAggregate aggregate, BattleRecord battle) {
        aggregate.add(battle);
        return aggregate;
    }

    /**
     * Applies the battles whose id is not in {@code countedIds}, in the given order, and adds them to it.
     *
     * @return the battles actually counted
     */
    public List<BattleRecord> applyNew(SubjectAggregate aggregate, Set<String> countedIds, List<BattleRecord> battles) {
        List<BattleRecord> counted = new ArrayList<>();
        for (BattleRecord battle : battles) {
            if (countedIds.add(battle.id())) {
                apply(aggregate, battle);
                counted.add(battle);
            }
        }
        return counted;
    }

    /** Recomputes an aggregate from the full battle history. */
    public SubjectAggregate rebuild(List<BattleRecord> history) {
        SubjectAggregate aggregate = new SubjectAggregate();
        history.stream()
                .sorted(Comparator.comparing(BattleRecord::timestamp))
                .forEach(b -> apply(aggregate, b));
        return aggregate;
    }
}
