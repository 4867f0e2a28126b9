package org.royalewatch.notify;

import org.royalewatch.event.MonitorEvent;
import org.royalewatch.event.MonitorEventListener;
import org.royalewatch.model.PlayerReport;
import org.royalewatch.model.Subject;
import org.royalewatch.monitor.MonitorException;
import org.royalewatch.monitor.MonitorService;
import org.royalewatch.monitor.PlayerLookupService;
import org.royalewatch.store.StateStore;
import org.royalewatch.store.StateStoreException;
import org.royalewatch.util.BattleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Keeps one pinned status message per actively monitored player. Messages are refreshed on a fixed
 * delay and after every new battle; the message id survives restarts.
 */
public class StatusBoard implements MonitorEventListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StatusBoard.class);

    // Discord rejects messages above 2000 characters
    private static final int MESSAGE_LIMIT = 1900;

    private final MonitorService monitorService;
    private final PlayerLookupService lookupService;
    private final StateStore store;
    private final StatusChannel channel;
    private final Clock clock;
    private final Map<String, String> messageIds = new ConcurrentHashMap<>();
    private final Object renderLock = new Object();

    private volatile ScheduledExecutorService timer;

    public StatusBoard(MonitorService monitorService, PlayerLookupService lookupService, StateStore store,
                       StatusChannel channel, Clock clock) throws StateStoreException {
        this.monitorService = monitorService;
        this.lookupService = lookupService;
        this.store = store;
        this.channel = channel;
        this.clock = clock;
        messageIds.putAll(store.loadStatusMessages());
    }

    /** Starts periodic refreshes. A zero or negative period leaves the board disabled. */
    public synchronized void start(Duration every) {
        if (timer != null) return;
        if (every.isZero() || every.isNegative()) {
            log.info("Status messages disabled");
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "status-board");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleWithFixedDelay(this::safeRefreshAll, 0, every.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Status board started (every {}s)", every.toSeconds());
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }

    @Override
    public void onEvent(MonitorEvent event) {
        if (event instanceof MonitorEvent.NewBattleDetected) {
            refreshSoon(event.subjectTag());
        }
    }

    /** Queues a refresh on the board's own thread; ignored while the board is stopped. */
    public void refreshSoon(String tag) {
        ScheduledExecutorService current = timer;
        if (current == null || current.isShutdown()) return;
        try {
            current.execute(() -> {
                try {
                    refresh(tag);
                } catch (RuntimeException e) {
                    log.error("Status refresh failed for #{}", tag, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Status board stopped, refresh of #{} dropped", tag);
        }
    }

    private void safeRefreshAll() {
        try {
            refreshAll();
        } catch (RuntimeException e) {
            log.error("Status board refresh failed", e);
        }
    }

    public void refreshAll() {
        Set<String> active = monitorService.listMonitored().stream()
                .filter(Subject::isActive)
                .map(Subject::tag)
                .collect(Collectors.toSet());
        messageIds.keySet().retainAll(active);
        for (String tag : active) {
            refresh(tag);
        }
    }

    /**
     * Edits the subject's status message, or posts and pins a new one when there is none yet or it
     * was deleted. Returns the message id, null when nothing could be shown.
     */
    public String refresh(String tag) {
        synchronized (renderLock) {
            return render(tag);
        }
    }

    private String render(String tag) {
        PlayerReport report;
        try {
            report = lookupService.lookup(tag);
        } catch (MonitorException e) {
            log.warn("No status update for #{}: {}", tag, e.getMessage());
            return null;
        }
        String text = BattleFormatter.split(BattleFormatter.formatStatusMessage(report, clock.instant()), MESSAGE_LIMIT).get(0);

        String current = messageIds.get(tag);
        if (current != null && channel.edit(current, text)) {
            return current;
        }
        String posted = channel.post(text);
        if (posted == null) return null;
        messageIds.put(tag, posted);
        try {
            store.saveStatusMessage(tag, posted);
        } catch (StateStoreException e) {
            log.warn("Could not persist status message of #{}: {}", tag, e.getMessage());
        }
        log.info("Posted status message {} for #{}", posted, tag);
        return posted;
    }

    /** Current status message id of a subject, if any. */
    public String messageId(String tag) {
        return messageIds.get(tag);
    }
}
