package org.royalewatch.store;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.MonitorCursor;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.model.SubjectStatus;

import java.util.List;
import java.util.Map;

/**
 * Durable per-subject state. Each write is all-or-nothing: after a crash, either the whole
 * update is visible or none of it is.
 */
public interface StateStore {

    /** Every persisted subject keyed by normalized tag. */
    Map<String, SubjectState> loadAll() throws StateStoreException;

    /** Creates subject, empty cursor and empty aggregate together. */
    SubjectState createSubject(Subject subject) throws StateStoreException;

    /** Removes subject, cursor, aggregate and battle history together. */
    void deleteSubject(String tag) throws StateStoreException;

    void updateStatus(String tag, SubjectStatus status) throws StateStoreException;

    /** Refreshes display name and arena. Cursor and aggregate are left untouched. */
    void updateProfile(String tag, String name, String arena) throws StateStoreException;

    /** Status message id per subject tag, for subjects that have one. */
    Map<String, String> loadStatusMessages() throws StateStoreException;

    void saveStatusMessage(String tag, String messageId) throws StateStoreException;

    /**
     * Replaces cursor and aggregate snapshot of a subject and records the battles counted by this cycle.
     */
    void commit(String tag, MonitorCursor cursor, SubjectAggregate aggregate, List<BattleRecord> countedBattles)
            throws StateStoreException;

    /** Counted battles of a subject, newest first. */
    List<BattleRecord> recentBattles(String tag, int limit) throws StateStoreException;
}
