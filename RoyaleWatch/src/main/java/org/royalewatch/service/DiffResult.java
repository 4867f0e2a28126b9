package org.royalewatch.service;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.MonitorCursor;

import java.util.List;

/**
 * @param unseen        battles not covered by the previous cursor, oldest first
 * @param newCursor     cursor to persist once the unseen battles are folded in
 * @param discontinuity true when the previous cursor no longer appears in the fetched log
 */
public record DiffResult(
        List<BattleRecord> unseen,
        MonitorCursor newCursor,
        boolean discontinuity
) {

    public DiffResult {
        unseen = List.copyOf(unseen);
    }
}
