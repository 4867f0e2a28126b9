package org.royalewatch.monitor;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.royalewatch.FakeBattleLogSource;
import org.royalewatch.MutableClock;
import org.royalewatch.TestBattles;
import org.royalewatch.event.MonitorEvent;
import org.royalewatch.model.MonitorCursor;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.service.ApiException;
import org.royalewatch.service.BattleNormalizer;
import org.royalewatch.store.SqliteStateStore;
import org.royalewatch.store.StateStore;
import org.royalewatch.store.StateStoreException;
import org.royalewatch.store.SubjectState;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.royalewatch.TestBattles.T0;

class MonitorSchedulerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(60);
    private static final MonitorScheduler.Settings SETTINGS = new MonitorScheduler.Settings(
            INTERVAL, new BackoffPolicy(Duration.ofSeconds(5), Duration.ofMinutes(10)), 3, 2, 2);

    @TempDir
    Path dir;

    private String dbPath;
    private MutableClock clock;
    private FakeBattleLogSource source;
    private AtomicBoolean failCommits;
    private SqliteStateStore store;
    private List<MonitorEvent> events;
    private MonitorScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        dbPath = dir.resolve("monitor.db").toString();
        clock = new MutableClock(T0.plus(Duration.ofDays(1)));
        source = new FakeBattleLogSource().profile("AAA", "Alice", "Legendary Arena");
        failCommits = new AtomicBoolean();
        store = new SqliteStateStore(dbPath) {
            @Override
            protected void writeCursor(Connection conn, String tag, MonitorCursor cursor) throws SQLException {
                if (failCommits.get()) throw new SQLException("database is locked");
                super.writeCursor(conn, tag, cursor);
            }
        };
        events = new CopyOnWriteArrayList<>();
        scheduler = newScheduler(store, Runnable::run);
    }

    private MonitorScheduler newScheduler(StateStore stateStore, Executor executor) {
        MonitorScheduler s = new MonitorScheduler(stateStore, source,
                new RateLimiter(1000, 10_000, clock), executor, clock, SETTINGS);
        s.addListener(events::add);
        return s;
    }

    private SubjectMonitor monitorAlice() throws StateStoreException {
        return scheduler.register(store.createSubject(Subject.create("AAA", "Alice", T0)));
    }

    private static JSONObject win(String opponent, int minute) {
        return TestBattles.win("AAA", opponent, T0.plusSeconds(60L * minute), "Ladder");
    }

    private static JSONObject loss(String opponent, int minute) {
        return TestBattles.loss("AAA", opponent, T0.plusSeconds(60L * minute), "Ladder");
    }

    private void nextInterval() {
        clock.advance(INTERVAL);
        scheduler.tick();
    }

    private <T extends MonitorEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Nested
    @DisplayName("Polling")
    class Polling {

        @Test
        @DisplayName("first poll records a baseline and reports nothing")
        void baseline() throws Exception {
            source.log("AAA", win("BBB", 2), loss("CCC", 1));
            SubjectMonitor monitor = monitorAlice();

            scheduler.tick();

            assertEquals(1, source.fetchCount("AAA"));
            assertTrue(eventsOf(MonitorEvent.NewBattleDetected.class).isEmpty());
            assertEquals(0, monitor.aggregateCopy().getTotalBattles());
            assertTrue(monitor.cursor().hasBaseline());
            assertEquals(MonitorState.IDLE, monitor.state());
            assertEquals(monitor.cursor(), store.loadAll().get("AAA").cursor());
        }

        @Test
        @DisplayName("subjects are not polled before their interval is up")
        void respectsInterval() throws Exception {
            source.log("AAA", win("BBB", 1));
            monitorAlice();

            scheduler.tick();
            clock.advance(Duration.ofSeconds(30));
            scheduler.tick();
            assertEquals(1, source.fetchCount("AAA"));

            clock.advance(Duration.ofSeconds(30));
            scheduler.tick();
            assertEquals(2, source.fetchCount("AAA"));
        }

        @Test
        @DisplayName("new battles are counted once and reported oldest first")
        void newBattles() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();

            source.log("AAA", loss("DDD", 3), win("CCC", 2), win("BBB", 1));
            nextInterval();

            List<MonitorEvent.NewBattleDetected> detected = eventsOf(MonitorEvent.NewBattleDetected.class);
            assertEquals(2, detected.size());
            assertEquals("CCC", detected.get(0).battle().opponent().tag());
            assertEquals("DDD", detected.get(1).battle().opponent().tag());
            assertEquals(2, detected.get(1).totalBattles());
            assertEquals(1, detected.get(1).totalWins());
            assertEquals("Alice", detected.get(1).subjectName());

            SubjectAggregate aggregate = monitor.aggregateCopy();
            assertEquals(2, aggregate.getTotalBattles());
            assertEquals(1, aggregate.getTotalLosses());
        }

        @Test
        @DisplayName("repeated fetches of the same log change nothing")
        void idempotent() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();
            source.log("AAA", win("CCC", 2), win("BBB", 1));
            nextInterval();
            events.clear();

            for (int i = 0; i < 5; i++) nextInterval();

            assertEquals(7, source.fetchCount("AAA"));
            assertTrue(events.isEmpty());
            assertEquals(1, monitor.aggregateCopy().getTotalBattles());
            assertEquals(1, store.loadAll().get("AAA").aggregate().getTotalBattles());
        }

        @Test
        @DisplayName("second encounter with an opponent promotes them to rival")
        void rivalPromotion() throws Exception {
            source.log("AAA", win("BBB", 1));
            monitorAlice();
            scheduler.tick();

            source.log("AAA", loss("RRR", 3), win("RRR", 2), win("BBB", 1));
            nextInterval();

            assertEquals(3, events.size());
            assertInstanceOf(MonitorEvent.NewBattleDetected.class, events.get(0));
            assertInstanceOf(MonitorEvent.NewBattleDetected.class, events.get(1));
            MonitorEvent.RivalPromoted promoted = assertInstanceOf(MonitorEvent.RivalPromoted.class, events.get(2));
            assertEquals("RRR", promoted.opponentTag());
            assertEquals(2, promoted.encounterCount());

            MonitorEvent.NewBattleDetected second = (MonitorEvent.NewBattleDetected) events.get(1);
            assertEquals(2, second.headToHead().encounters());
            assertEquals(1, second.headToHead().wins());
        }

        @Test
        @DisplayName("cursor gone from the log: discontinuity reported, whole log counted")
        void discontinuity() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();

            source.log("AAA", win("DDD", 30), loss("CCC", 20));
            nextInterval();

            MonitorEvent.LogDiscontinuityDetected gap =
                    assertInstanceOf(MonitorEvent.LogDiscontinuityDetected.class, events.get(0));
            assertEquals(2, gap.unseenCount());
            assertEquals(2, eventsOf(MonitorEvent.NewBattleDetected.class).size());
            assertEquals(2, monitor.aggregateCopy().getTotalBattles());
        }

        @Test
        @DisplayName("malformed entries are skipped, the rest of the log is processed")
        void malformedSkipped() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();

            JSONObject broken = win("XXX", 3);
            broken.remove("battleTime");
            source.log("AAA", broken, win("CCC", 2), win("BBB", 1));
            nextInterval();

            assertEquals(1, monitor.aggregateCopy().getTotalBattles());
            assertEquals(MonitorState.IDLE, monitor.state());
        }

        @Test
        @DisplayName("arena change is reported after the profile refresh")
        void arenaChange() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();
            assertEquals("Legendary Arena", monitor.subject().lastArena());
            assertTrue(events.isEmpty());

            source.profile("AAA", "Alice", "Royal Crypt");
            nextInterval();

            MonitorEvent.ArenaChanged change = assertInstanceOf(MonitorEvent.ArenaChanged.class, events.get(0));
            assertEquals("Legendary Arena", change.previousArena());
            assertEquals("Royal Crypt", change.currentArena());
            assertEquals("Royal Crypt", store.loadAll().get("AAA").subject().lastArena());
        }

        @Test
        @DisplayName("a throwing listener does not break the cycle or other listeners")
        void listenerFailureIsolated() throws Exception {
            scheduler.addListener(e -> {
                throw new IllegalStateException("discord down");
            });
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();
            source.log("AAA", win("CCC", 2), win("BBB", 1));

            nextInterval();

            assertEquals(1, events.size());
            assertEquals(MonitorState.IDLE, monitor.state());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("fetch failures back off exponentially and report once at the threshold")
        void backoff() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            for (int i = 0; i < 4; i++) {
                source.failNext("AAA", new ApiException(ApiException.Kind.TRANSIENT, "HTTP 503"));
            }

            scheduler.tick();
            assertEquals(MonitorState.BACKOFF, monitor.state());
            Instant firstRetry = clock.instant().plusSeconds(5);
            assertEquals(firstRetry, monitor.nextDueAt());

            clock.advance(Duration.ofSeconds(4));
            scheduler.tick();
            assertEquals(1, source.fetchCount("AAA"));

            clock.advance(Duration.ofSeconds(1));
            scheduler.tick();
            clock.advance(Duration.ofSeconds(10));
            scheduler.tick();
            assertEquals(3, source.fetchCount("AAA"));

            List<MonitorEvent.PersistentFailure> failures = eventsOf(MonitorEvent.PersistentFailure.class);
            assertEquals(1, failures.size());
            assertEquals("TRANSIENT", failures.get(0).kind());
            assertEquals(3, failures.get(0).consecutiveFailures());

            clock.advance(Duration.ofSeconds(20));
            scheduler.tick();
            assertEquals(1, eventsOf(MonitorEvent.PersistentFailure.class).size());

            clock.advance(Duration.ofSeconds(40));
            scheduler.tick();
            assertEquals(MonitorState.IDLE, monitor.state());
            assertEquals(0, monitor.consecutiveFailures());
            assertTrue(monitor.cursor().hasBaseline());
        }

        @Test
        @DisplayName("rate limiting honours Retry-After")
        void retryAfter() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            source.failNext("AAA", new ApiException(ApiException.Kind.RATE_LIMITED, "slow down",
                    Duration.ofSeconds(90), null));

            scheduler.tick();

            assertEquals(clock.instant().plusSeconds(90), monitor.nextDueAt());
        }

        @Test
        @DisplayName("an unexpected profile error does not swallow the committed battle's announcement")
        void profileBugAfterCommit() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();

            source.breakProfiles(new IllegalArgumentException("Invalid player tag: "));
            source.log("AAA", win("CCC", 2), win("BBB", 1));
            nextInterval();

            assertEquals(1, eventsOf(MonitorEvent.NewBattleDetected.class).size());
            assertEquals(MonitorState.IDLE, monitor.state());
            assertEquals(0, monitor.consecutiveFailures());
            assertEquals(clock.instant().plus(INTERVAL), monitor.nextDueAt());
            assertEquals(1, new SqliteStateStore(dbPath).loadAll().get("AAA").aggregate().getTotalBattles());

            source.breakProfiles(null);
            nextInterval();

            assertEquals(1, eventsOf(MonitorEvent.NewBattleDetected.class).size());
            assertEquals(1, monitor.aggregateCopy().getTotalBattles());
        }

        @Test
        @DisplayName("failed commit keeps the previous state and the battles are counted on retry")
        void storeFailure() throws Exception {
            source.log("AAA", win("BBB", 1));
            SubjectMonitor monitor = monitorAlice();
            scheduler.tick();
            MonitorCursor baseline = monitor.cursor();

            failCommits.set(true);
            source.log("AAA", win("DDD", 3), win("CCC", 2), win("BBB", 1));
            nextInterval();

            assertTrue(events.isEmpty());
            assertEquals(baseline, monitor.cursor());
            assertEquals(0, monitor.aggregateCopy().getTotalBattles());
            SubjectState persisted = new SqliteStateStore(dbPath).loadAll().get("AAA");
            assertEquals(baseline, persisted.cursor());
            assertEquals(0, persisted.aggregate().getTotalBattles());
            assertTrue(persisted.countedIds().isEmpty());

            nextInterval();
            List<MonitorEvent.PersistentFailure> failures = eventsOf(MonitorEvent.PersistentFailure.class);
            assertEquals(1, failures.size());
            assertEquals("STATE_STORE", failures.get(0).kind());

            failCommits.set(false);
            events.clear();
            nextInterval();

            assertEquals(2, eventsOf(MonitorEvent.NewBattleDetected.class).size());
            assertEquals(2, monitor.aggregateCopy().getTotalBattles());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("after a restart no battle is counted twice")
        void restartContinuity() throws Exception {
            source.log("AAA", win("BBB", 1));
            monitorAlice();
            scheduler.tick();
            source.log("AAA", win("CCC", 2), win("BBB", 1));
            nextInterval();
            events.clear();

            MonitorScheduler restarted = newScheduler(new SqliteStateStore(dbPath), Runnable::run);
            restarted.loadPersisted();
            restarted.tick();

            assertTrue(events.isEmpty());
            SubjectMonitor monitor = restarted.get("AAA");
            assertEquals(1, monitor.aggregateCopy().getTotalBattles());

            source.log("AAA", loss("DDD", 3), win("CCC", 2), win("BBB", 1));
            clock.advance(INTERVAL);
            restarted.tick();

            assertEquals(1, eventsOf(MonitorEvent.NewBattleDetected.class).size());
            assertEquals(2, monitor.aggregateCopy().getTotalBattles());
        }

        @Test
        @DisplayName("the first subject in line rotates on each tick")
        void rotation() throws Exception {
            source.profile("BBB", "Bob", "Arena 2").profile("CCC", "Carol", "Arena 3");
            for (String tag : List.of("AAA", "BBB", "CCC")) {
                source.log(tag, TestBattles.win(tag, "ZZZ", T0, "Ladder"));
                scheduler.register(store.createSubject(Subject.create(tag, tag, T0)));
            }

            scheduler.tick();
            nextInterval();

            assertEquals(List.of("AAA", "BBB", "CCC", "BBB", "CCC", "AAA"), source.fetchOrder());
        }

        @Test
        @DisplayName("pausing mid-cycle lets the cycle commit, then nothing more is fetched")
        void pauseDuringCycle() throws Exception {
            JSONObject base = win("BBB", 1);
            store.createSubject(Subject.create("AAA", "Alice", T0));
            MonitorCursor baseline = MonitorCursor.initial().advanceTo(new BattleNormalizer().normalize("AAA", base));
            store.commit("AAA", baseline, new SubjectAggregate(), List.of());

            ExecutorService workers = Executors.newSingleThreadExecutor();
            MonitorScheduler threaded = newScheduler(store, workers);
            MonitorService service = new MonitorService(threaded, store, source);
            threaded.register(store.loadAll().get("AAA"));

            CountDownLatch fetching = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            source.onFetch(() -> {
                fetching.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            source.log("AAA", win("CCC", 2), base);

            threaded.tick();
            assertTrue(fetching.await(5, TimeUnit.SECONDS));
            service.stopMonitoring("AAA");
            release.countDown();
            workers.shutdown();
            assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS));

            SubjectMonitor monitor = threaded.get("AAA");
            assertEquals(MonitorState.PAUSED, monitor.state());
            assertEquals(1, eventsOf(MonitorEvent.NewBattleDetected.class).size());
            SubjectState persisted = store.loadAll().get("AAA");
            assertEquals(1, persisted.aggregate().getTotalBattles());
            assertFalse(persisted.subject().isActive());

            clock.advance(Duration.ofHours(1));
            threaded.tick();
            assertEquals(1, source.fetchCount("AAA"));
        }
    }
}
