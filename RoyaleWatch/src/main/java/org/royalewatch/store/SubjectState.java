package org.royalewatch.store;

import org.royalewatch.model.MonitorCursor;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;

import java.util.Set;

/**
 * Everything persisted for one subject, as loaded at startup.
 *
 * @param countedIds ids of every battle already folded into the aggregate
 */
public record SubjectState(
        Subject subject,
        MonitorCursor cursor,
        SubjectAggregate aggregate,
        Set<String> countedIds
) {}
