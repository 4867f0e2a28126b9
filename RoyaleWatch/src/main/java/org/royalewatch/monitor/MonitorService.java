package org.royalewatch.monitor;

import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.PlayerProfile;
import org.royalewatch.model.RivalEntry;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.model.SubjectStatus;
import org.royalewatch.service.ApiException;
import org.royalewatch.service.BattleLogSource;
import org.royalewatch.store.StateStore;
import org.royalewatch.store.StateStoreException;
import org.royalewatch.store.SubjectState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * Operations offered to command handlers: start and stop monitoring, and read the statistics.
 */
public class MonitorService {
    private static final Logger log = LoggerFactory.getLogger(MonitorService.class);

    private final MonitorScheduler scheduler;
    private final StateStore store;
    private final BattleLogSource source;

    public MonitorService(MonitorScheduler scheduler, StateStore store, BattleLogSource source) {
        this.scheduler = scheduler;
        this.store = store;
        this.source = source;
    }

    // --- MONITORING ---

    /**
     * Starts monitoring a player, or resumes a paused one. The first poll only records a baseline,
     * so existing history is not reported as new battles.
     */
    public Subject startMonitoring(String rawTag) {
        String tag = normalize(rawTag);
        SubjectMonitor existing = scheduler.get(tag);
        if (existing != null) {
            if (existing.subject().isActive()) {
                throw new MonitorException(MonitorException.Kind.ALREADY_MONITORED, tag, "is already monitored");
            }
            persistStatus(tag, SubjectStatus.ACTIVE);
            existing.resume(scheduler.clock().instant());
            scheduler.triggerNow(tag);
            log.info("Resumed monitoring of #{}", tag);
            return existing.subject();
        }

        PlayerProfile profile;
        try (RateLimiter.Permit ignored = scheduler.rateLimiter().acquire()) {
            profile = source.fetchProfile(tag);
        } catch (ApiException e) {
            if (e.getKind() == ApiException.Kind.NOT_FOUND) {
                throw new MonitorException(MonitorException.Kind.PROFILE_NOT_FOUND, tag, "no such player");
            }
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "player API unavailable (" + e.getKind() + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "interrupted", e);
        }

        Subject subject = Subject.create(tag, profile.name(), scheduler.clock().instant()).withProfile(null, profile.arena());
        SubjectState state;
        try {
            state = store.createSubject(subject);
        } catch (StateStoreException e) {
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "could not save subject", e);
        }
        scheduler.register(state);
        scheduler.triggerNow(tag);
        log.info("Started monitoring {} (#{})", subject.name(), tag);
        return subject;
    }

    /** Pauses a subject. Its statistics are kept and frozen; an in-flight cycle still commits. */
    public void stopMonitoring(String rawTag) {
        String tag = normalize(rawTag);
        SubjectMonitor monitor = scheduler.get(tag);
        if (monitor == null || !monitor.subject().isActive()) {
            throw new MonitorException(MonitorException.Kind.NOT_MONITORED, tag, "is not monitored");
        }
        persistStatus(tag, SubjectStatus.PAUSED);
        monitor.pause();
        log.info("Stopped monitoring #{}", tag);
    }

    /** Deletes a subject and everything recorded about it. */
    public void forgetSubject(String rawTag) {
        String tag = normalize(rawTag);
        SubjectMonitor monitor = scheduler.unregister(tag);
        if (monitor == null) {
            throw new MonitorException(MonitorException.Kind.NOT_MONITORED, tag, "is not monitored");
        }
        monitor.pause();
        // Waits out an in-flight cycle so its commit cannot land after the delete
        monitor.cycleLock().lock();
        try {
            store.deleteSubject(tag);
        } catch (StateStoreException e) {
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "could not delete subject", e);
        } finally {
            monitor.cycleLock().unlock();
        }
        log.info("Deleted subject #{}", tag);
    }

    public List<Subject> listMonitored() {
        return scheduler.all().stream()
                .map(SubjectMonitor::subject)
                .sorted(Comparator.comparing(Subject::createdAt).thenComparing(Subject::tag))
                .toList();
    }

    // --- STATS ---

    public SubjectAggregate getStats(String rawTag) {
        return monitor(rawTag).aggregateCopy();
    }

    public List<RivalEntry> getRivals(String rawTag) {
        return scheduler.rivalTracker().listRivals(monitor(rawTag).aggregateCopy());
    }

    public RivalEntry getRival(String rawTag, String rawOpponentTag) {
        SubjectMonitor monitor = monitor(rawTag);
        String opponentTag = normalize(rawOpponentTag);
        return scheduler.rivalTracker().headToHead(monitor.aggregateCopy(), opponentTag)
                .orElseThrow(() -> new MonitorException(MonitorException.Kind.OPPONENT_NOT_FOUND, monitor.tag(),
                        "has never played " + Subject.displayTag(opponentTag)));
    }

    public Subject getSubject(String rawTag) {
        return monitor(rawTag).subject();
    }

    public List<BattleRecord> recentBattles(String rawTag, int limit) {
        SubjectMonitor monitor = monitor(rawTag);
        try {
            return store.recentBattles(monitor.tag(), limit);
        } catch (StateStoreException e) {
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, monitor.tag(), "could not read history", e);
        }
    }

    public List<BattleRecord> headToHeadHistory(String rawTag, String rawOpponentTag, int limit) {
        String opponentTag = normalize(rawOpponentTag);
        return recentBattles(rawTag, Integer.MAX_VALUE).stream()
                .filter(b -> opponentTag.equals(b.opponent().tag()))
                .limit(limit)
                .toList();
    }

    /**
     * Recomputes the statistics of a subject from its recorded battles and saves them.
     * Runs under the subject's cycle lock, so no poll interleaves.
     */
    public SubjectAggregate rebuildStats(String rawTag) {
        SubjectMonitor monitor = monitor(rawTag);
        String tag = monitor.tag();
        monitor.cycleLock().lock();
        try {
            List<BattleRecord> history = store.recentBattles(tag, Integer.MAX_VALUE);
            SubjectAggregate rebuilt = scheduler.aggregator().rebuild(history);
            SubjectMonitor.CycleSnapshot snapshot = monitor.snapshot();
            store.commit(tag, snapshot.cursor(), rebuilt, List.of());
            monitor.applyCommitted(snapshot.cursor(), rebuilt, snapshot.countedIds());
            log.info("Rebuilt statistics of #{} from {} battle(s)", tag, history.size());
            return rebuilt.copy();
        } catch (StateStoreException e) {
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "could not rebuild statistics", e);
        } finally {
            monitor.cycleLock().unlock();
        }
    }

    // --- UTILS ---

    private SubjectMonitor monitor(String rawTag) {
        String tag = normalize(rawTag);
        SubjectMonitor monitor = scheduler.get(tag);
        if (monitor == null) {
            throw new MonitorException(MonitorException.Kind.NOT_MONITORED, tag, "is not monitored");
        }
        return monitor;
    }

    private void persistStatus(String tag, SubjectStatus status) {
        try {
            store.updateStatus(tag, status);
        } catch (StateStoreException e) {
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "could not save status", e);
        }
    }

    static String normalize(String rawTag) {
        try {
            return Subject.normalizeTag(rawTag);
        } catch (IllegalArgumentException e) {
            String shown = rawTag == null ? "" : rawTag.replace("#", "").trim();
            throw new MonitorException(MonitorException.Kind.INVALID_TAG, shown, e.getMessage());
        }
    }
}
