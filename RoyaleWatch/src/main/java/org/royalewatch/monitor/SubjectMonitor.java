package org.royalewatch.monitor;

import org.royalewatch.model.MonitorCursor;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.model.SubjectStatus;
import org.royalewatch.store.SubjectState;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scheduling state machine and committed in-memory state of one subject.
 * <p>
 * {@code IDLE -> POLLING -> (IDLE | BACKOFF)}, {@code BACKOFF -> IDLE} once the delay has elapsed.
 * {@code PAUSED} subjects are never dispatched. A subject is dispatched only from IDLE, so at most
 * one cycle exists at a time; {@link #cycleLock()} additionally serializes the cycle against
 * maintenance operations such as a stats rebuild.
 */
public class SubjectMonitor {

    private final String tag;
    private final ReentrantLock cycleLock = new ReentrantLock();

    private Subject subject;
    private MonitorCursor cursor;
    private SubjectAggregate aggregate;
    private Set<String> countedIds;

    private MonitorState state;
    private Instant nextDueAt;
    private boolean pauseRequested;
    private int consecutiveFailures;
    private int consecutiveStoreFailures;
    private boolean failureReported;

    public SubjectMonitor(SubjectState loaded, Instant now) {
        this.tag = loaded.subject().tag();
        this.subject = loaded.subject();
        this.cursor = loaded.cursor();
        this.aggregate = loaded.aggregate();
        this.countedIds = new HashSet<>(loaded.countedIds());
        this.state = subject.isActive() ? MonitorState.IDLE : MonitorState.PAUSED;
        this.nextDueAt = now;
    }

    public String tag() {
        return tag;
    }

    ReentrantLock cycleLock() {
        return cycleLock;
    }

    // --- TRANSITIONS ---

    /**
     * Moves to POLLING if the subject is due (or {@code force} is set) and no cycle is in flight.
     *
     * @return true when the caller now owns the cycle
     */
    public synchronized boolean tryBeginCycle(Instant now, boolean force) {
        if (state == MonitorState.BACKOFF && !now.isBefore(nextDueAt)) {
            state = MonitorState.IDLE;
        }
        if (state != MonitorState.IDLE) return false;
        if (!force && now.isBefore(nextDueAt)) return false;
        state = MonitorState.POLLING;
        return true;
    }

    public synchronized void completeSuccess(Instant nextRun) {
        consecutiveFailures = 0;
        consecutiveStoreFailures = 0;
        failureReported = false;
        finishCycle(MonitorState.IDLE, nextRun);
    }

    /** Fetch failure: back off until {@code now + delay}. Returns the updated failure count. */
    public synchronized int completeFetchFailure(Instant now, Duration delay) {
        consecutiveFailures++;
        finishCycle(MonitorState.BACKOFF, now.plus(delay));
        return consecutiveFailures;
    }

    /** Commit failure: the cycle is dropped and retried at {@code nextRun}. Returns the updated failure count. */
    public synchronized int completeStoreFailure(Instant nextRun) {
        consecutiveStoreFailures++;
        finishCycle(MonitorState.IDLE, nextRun);
        return consecutiveStoreFailures;
    }

    /** Cycle ended without an outcome (interrupted, rejected). */
    public synchronized void abortCycle(Instant nextRun) {
        finishCycle(MonitorState.IDLE, nextRun);
    }

    private void finishCycle(MonitorState next, Instant nextRun) {
        if (pauseRequested) {
            pauseRequested = false;
            state = MonitorState.PAUSED;
        } else if (state == MonitorState.POLLING) {
            state = next;
        }
        nextDueAt = nextRun;
    }

    /** Stops scheduling. An in-flight cycle still completes and commits. */
    public synchronized void pause() {
        subject = subject.withStatus(SubjectStatus.PAUSED);
        if (state == MonitorState.POLLING) {
            pauseRequested = true;
        } else {
            state = MonitorState.PAUSED;
        }
    }

    public synchronized void resume(Instant now) {
        subject = subject.withStatus(SubjectStatus.ACTIVE);
        pauseRequested = false;
        if (state != MonitorState.POLLING) {
            state = MonitorState.IDLE;
        }
        nextDueAt = now;
        consecutiveFailures = 0;
        consecutiveStoreFailures = 0;
        failureReported = false;
    }

    /** Marks the persistent failure as reported; true only the first time since the last success. */
    public synchronized boolean markFailureReported() {
        if (failureReported) return false;
        failureReported = true;
        return true;
    }

    // --- COMMITTED STATE ---

    public synchronized CycleSnapshot snapshot() {
        return new CycleSnapshot(subject, cursor, aggregate.copy(), new HashSet<>(countedIds));
    }

    public synchronized void applyCommitted(MonitorCursor newCursor, SubjectAggregate newAggregate, Set<String> newIds) {
        this.cursor = newCursor;
        this.aggregate = newAggregate;
        this.countedIds = newIds;
    }

    public synchronized Subject applyProfile(String name, String arena) {
        subject = subject.withProfile(name, arena);
        return subject;
    }

    public synchronized Subject subject() {
        return subject;
    }

    public synchronized MonitorCursor cursor() {
        return cursor;
    }

    public synchronized SubjectAggregate aggregateCopy() {
        return aggregate.copy();
    }

    public synchronized MonitorState state() {
        return state;
    }

    public synchronized Instant nextDueAt() {
        return nextDueAt;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Consistent copy of a subject's committed state, worked on by one cycle. Nothing in it is
     * visible to others until the cycle commits.
     */
    public record CycleSnapshot(
            Subject subject,
            MonitorCursor cursor,
            SubjectAggregate aggregate,
            Set<String> countedIds
    ) {}
}
