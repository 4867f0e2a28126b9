package org.royalewatch.monitor;

import org.json.JSONObject;
import org.royalewatch.event.MonitorEvent;
import org.royalewatch.event.MonitorEventListener;
import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.OpponentStats;
import org.royalewatch.model.PlayerProfile;
import org.royalewatch.model.RivalEntry;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.service.ApiException;
import org.royalewatch.service.BattleDiffEngine;
import org.royalewatch.service.BattleLogSource;
import org.royalewatch.service.BattleNormalizer;
import org.royalewatch.service.DiffResult;
import org.royalewatch.service.MalformedRecordException;
import org.royalewatch.service.RivalTracker;
import org.royalewatch.service.StatisticsAggregator;
import org.royalewatch.store.StateStore;
import org.royalewatch.store.StateStoreException;
import org.royalewatch.store.SubjectState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one polling cycle per due subject: fetch, normalize, diff, aggregate, commit, notify.
 * <p>
 * A ticker walks the subjects round-robin and hands due ones to the worker executor. Fetches
 * of every subject go through the shared {@link RateLimiter}.
 */
public class MonitorScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    private final StateStore store;
    private final BattleLogSource source;
    private final RateLimiter rateLimiter;
    private final Executor workers;
    private final Clock clock;
    private final Settings settings;

    private final BattleNormalizer normalizer = new BattleNormalizer();
    private final BattleDiffEngine diffEngine = new BattleDiffEngine();
    private final StatisticsAggregator aggregator = new StatisticsAggregator();
    private final RivalTracker rivalTracker;

    private final Map<String, Registration> monitors = new ConcurrentHashMap<>();
    private final AtomicLong registrationSeq = new AtomicLong();
    private final AtomicInteger rotation = new AtomicInteger();
    private final List<MonitorEventListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService ticker;

    public record Settings(
            Duration checkInterval,
            BackoffPolicy backoff,
            int maxConsecutiveFailures,
            int maxStoreFailures,
            int rivalThreshold
    ) {}

    private record Registration(SubjectMonitor monitor, long order) {}

    public MonitorScheduler(StateStore store, BattleLogSource source, RateLimiter rateLimiter,
                            Executor workers, Clock clock, Settings settings) {
        this.store = store;
        this.source = source;
        this.rateLimiter = rateLimiter;
        this.workers = workers;
        this.clock = clock;
        this.settings = settings;
        this.rivalTracker = new RivalTracker(settings.rivalThreshold());
    }

    public void addListener(MonitorEventListener listener) {
        listeners.add(listener);
    }

    // --- LIFECYCLE ---

    /** Registers every persisted subject. */
    public void loadPersisted() throws StateStoreException {
        for (SubjectState state : store.loadAll().values()) {
            register(state);
        }
    }

    public synchronized void start(Duration tickEvery) {
        if (ticker != null) return;
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "monitor-ticker");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleWithFixedDelay(this::safeTick, 0, tickEvery.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Monitor scheduler started ({} subject(s), tick {}s, interval {}s)",
                monitors.size(), tickEvery.toSeconds(), settings.checkInterval().toSeconds());
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }
    }

    // --- REGISTRY ---

    public SubjectMonitor register(SubjectState state) {
        SubjectMonitor monitor = new SubjectMonitor(state, clock.instant());
        monitors.put(monitor.tag(), new Registration(monitor, registrationSeq.incrementAndGet()));
        return monitor;
    }

    /** Drops a subject from scheduling. An in-flight cycle is left to finish. */
    public SubjectMonitor unregister(String tag) {
        Registration removed = monitors.remove(tag);
        return removed != null ? removed.monitor() : null;
    }

    public SubjectMonitor get(String tag) {
        Registration registration = monitors.get(tag);
        return registration != null ? registration.monitor() : null;
    }

    public List<SubjectMonitor> all() {
        return monitors.values().stream()
                .sorted(Comparator.comparingLong(Registration::order))
                .map(Registration::monitor)
                .toList();
    }

    // --- DISPATCH ---

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Monitor tick failed", e);
        }
    }

    /**
     * Dispatches every due subject. The starting subject rotates on each tick so no subject is
     * always first in line for the rate limiter.
     */
    public void tick() {
        List<SubjectMonitor> ordered = all();
        if (ordered.isEmpty()) return;
        Instant now = clock.instant();
        int start = Math.floorMod(rotation.getAndIncrement(), ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            SubjectMonitor monitor = ordered.get((start + i) % ordered.size());
            if (monitor.tryBeginCycle(now, false)) {
                dispatch(monitor);
            }
        }
    }

    /** Runs a cycle for the subject as soon as possible, unless paused, backing off or already polling. */
    public boolean triggerNow(String tag) {
        SubjectMonitor monitor = get(tag);
        if (monitor == null || !monitor.tryBeginCycle(clock.instant(), true)) return false;
        dispatch(monitor);
        return true;
    }

    private void dispatch(SubjectMonitor monitor) {
        try {
            workers.execute(() -> runCycle(monitor));
        } catch (RejectedExecutionException e) {
            log.warn("Cycle for #{} rejected by worker pool: {}", monitor.tag(), e.getMessage());
            monitor.abortCycle(clock.instant().plus(settings.checkInterval()));
        }
    }

    // --- CYCLE ---

    void runCycle(SubjectMonitor monitor) {
        String tag = monitor.tag();
        monitor.cycleLock().lock();
        try {
            SubjectMonitor.CycleSnapshot snapshot = monitor.snapshot();

            List<JSONObject> rawLog;
            try (RateLimiter.Permit ignored = rateLimiter.acquire()) {
                rawLog = source.fetchBattleLog(tag);
            } catch (ApiException e) {
                onFetchFailure(monitor, e);
                return;
            }

            List<BattleRecord> freshLog = normalizeAll(tag, rawLog);
            DiffResult diff = diffEngine.diff(snapshot.cursor(), freshLog);
            if (diff.discontinuity()) {
                log.warn("Battle log of #{} no longer contains cursor {}; treating {} battle(s) as unseen",
                        tag, snapshot.cursor().lastProcessedId(), diff.unseen().size());
            }

            List<MonitorEvent> events = new ArrayList<>();
            if (diff.discontinuity()) {
                events.add(new MonitorEvent.LogDiscontinuityDetected(tag, diff.unseen().size()));
            }
            List<BattleRecord> counted = fold(snapshot, diff.unseen(), events);

            try {
                store.commit(tag, diff.newCursor(), snapshot.aggregate(), counted);
            } catch (StateStoreException e) {
                onStoreFailure(monitor, e);
                return;
            }
            monitor.applyCommitted(diff.newCursor(), snapshot.aggregate(), snapshot.countedIds());
            if (!counted.isEmpty()) {
                log.info("#{}: {} new battle(s) counted, {} total", tag, counted.size(),
                        snapshot.aggregate().getTotalBattles());
            }

            // Committed battles are announced before anything else can fail
            publish(events);

            List<MonitorEvent> profileEvents = new ArrayList<>();
            refreshProfile(monitor, profileEvents);
            monitor.completeSuccess(clock.instant().plus(settings.checkInterval()));
            publish(profileEvents);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            monitor.abortCycle(clock.instant().plus(settings.checkInterval()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure in cycle for #{}", tag, e);
            monitor.abortCycle(clock.instant().plus(settings.checkInterval()));
        } finally {
            monitor.cycleLock().unlock();
        }
    }

    private List<BattleRecord> normalizeAll(String tag, List<JSONObject> rawLog) {
        List<BattleRecord> records = new ArrayList<>(rawLog.size());
        for (JSONObject raw : rawLog) {
            try {
                records.add(normalizer.normalize(tag, raw));
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed battle for #{}: {}", tag, e.getMessage());
            }
        }
        return records;
    }

    /** Counts unseen battles oldest first, skipping any already in the ledger, and builds their events. */
    private List<BattleRecord> fold(SubjectMonitor.CycleSnapshot snapshot, List<BattleRecord> unseen,
                                    List<MonitorEvent> events) {
        String tag = snapshot.subject().tag();
        SubjectAggregate aggregate = snapshot.aggregate();
        Set<String> ids = snapshot.countedIds();
        List<BattleRecord> counted = new ArrayList<>();

        for (BattleRecord battle : unseen) {
            if (ids.contains(battle.id())) {
                log.debug("Battle {} of #{} already counted, skipping", battle.id(), tag);
                continue;
            }
            String opponentTag = battle.opponent().tag();
            int before = encounters(aggregate, opponentTag);
            counted.addAll(aggregator.applyNew(aggregate, ids, List.of(battle)));
            int after = encounters(aggregate, opponentTag);

            RivalEntry headToHead = rivalTracker.headToHead(aggregate, opponentTag).orElse(null);
            events.add(new MonitorEvent.NewBattleDetected(tag, snapshot.subject().name(), battle,
                    aggregate.getTotalBattles(), aggregate.getTotalWins(), aggregate.getTotalLosses(), headToHead));
            if (battle.opponent().isKnown() && rivalTracker.isPromotion(before, after)) {
                events.add(new MonitorEvent.RivalPromoted(tag, opponentTag, battle.opponent().name(), after));
            }
        }
        return counted;
    }

    private static int encounters(SubjectAggregate aggregate, String opponentTag) {
        OpponentStats stats = aggregate.byOpponent().get(opponentTag);
        return stats != null ? stats.getBattles() : 0;
    }

    private void refreshProfile(SubjectMonitor monitor, List<MonitorEvent> events) throws InterruptedException {
        String tag = monitor.tag();
        PlayerProfile profile;
        try (RateLimiter.Permit ignored = rateLimiter.acquire()) {
            profile = source.fetchProfile(tag);
        } catch (ApiException e) {
            log.warn("Profile refresh failed for #{} ({}): {}", tag, e.getKind(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Profile refresh failed for #{}", tag, e);
            return;
        }

        Subject previous = monitor.subject();
        if (Objects.equals(previous.name(), profile.name()) && Objects.equals(previous.lastArena(), profile.arena())) {
            return;
        }
        try {
            store.updateProfile(tag, profile.name(), profile.arena());
        } catch (StateStoreException e) {
            log.warn("Could not persist profile of #{}: {}", tag, e.getMessage());
            return;
        }
        Subject current = monitor.applyProfile(profile.name(), profile.arena());
        if (previous.lastArena() != null && profile.arena() != null && !previous.lastArena().equals(profile.arena())) {
            events.add(new MonitorEvent.ArenaChanged(tag, current.name(), previous.lastArena(), profile.arena(),
                    profile.trophies()));
        }
    }

    // --- FAILURES ---

    private void onFetchFailure(SubjectMonitor monitor, ApiException e) {
        Instant now = clock.instant();
        int failures = monitor.consecutiveFailures() + 1;
        Duration delay = settings.backoff().delayFor(failures, e.getRetryAfter());
        failures = monitor.completeFetchFailure(now, delay);
        log.warn("Fetch failed for #{} ({}, attempt {}): {}; backing off {}s",
                monitor.tag(), e.getKind(), failures, e.getMessage(), delay.toSeconds());

        if (failures >= settings.maxConsecutiveFailures() && monitor.markFailureReported()) {
            log.error("#{} has failed {} consecutive polls", monitor.tag(), failures);
            publish(List.of(new MonitorEvent.PersistentFailure(monitor.tag(), e.getKind().name(), failures,
                    e.getMessage())));
        }
    }

    private void onStoreFailure(SubjectMonitor monitor, StateStoreException e) {
        int failures = monitor.completeStoreFailure(clock.instant().plus(settings.checkInterval()));
        log.warn("Commit failed for #{} (attempt {}); cycle discarded: {}", monitor.tag(), failures, e.getMessage());
        if (failures >= settings.maxStoreFailures() && monitor.markFailureReported()) {
            log.error("State store keeps failing for #{} ({} consecutive commits)", monitor.tag(), failures, e);
            publish(List.of(new MonitorEvent.PersistentFailure(monitor.tag(), "STATE_STORE", failures,
                    e.getMessage())));
        }
    }

    // --- EVENTS ---

    private void publish(List<MonitorEvent> events) {
        for (MonitorEvent event : events) {
            for (MonitorEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Listener failed on {} for #{}", event.getClass().getSimpleName(), event.subjectTag(), e);
                }
            }
        }
    }

    public RivalTracker rivalTracker() {
        return rivalTracker;
    }

    public StatisticsAggregator aggregator() {
        return aggregator;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public Clock clock() {
        return clock;
    }
}
