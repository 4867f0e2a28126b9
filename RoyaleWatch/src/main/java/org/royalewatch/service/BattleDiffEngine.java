package org.royalewatch.service;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.MonitorCursor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Isolates the battles of a fresh fetch that come after the cursor.
 */
public class BattleDiffEngine {

    /**
     * @param cursor   last persisted cursor of the subject
     * @param freshLog normalized battle log, newest first
     */
    public DiffResult diff(MonitorCursor cursor, List<BattleRecord> freshLog) {
        if (freshLog.isEmpty()) {
            return new DiffResult(List.of(), cursor.nextFetch(), false);
        }

        BattleRecord newest = freshLog.get(0);

        // First poll: the existing log is history, not news
        if (!cursor.hasBaseline()) {
            return new DiffResult(List.of(), cursor.advanceTo(newest), false);
        }

        List<BattleRecord> collected = new ArrayList<>();
        boolean cursorFound = false;
        for (BattleRecord battle : freshLog) {
            if (battle.id().equals(cursor.lastProcessedId())) {
                cursorFound = true;
                break;
            }
            collected.add(battle);
        }
        Collections.reverse(collected);

        MonitorCursor next = collected.isEmpty() ? cursor.nextFetch() : cursor.advanceTo(newest);
        return new DiffResult(collected, next, !cursorFound);
    }
}
