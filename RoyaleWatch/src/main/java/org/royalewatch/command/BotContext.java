package org.royalewatch.command;

import org.royalewatch.monitor.MonitorService;
import org.royalewatch.monitor.PlayerLookupService;
import org.royalewatch.notify.StatusBoard;

import java.util.concurrent.ExecutorService;

public record BotContext(
    MonitorService monitorService,
    PlayerLookupService lookupService,
    StatusBoard statusBoard,
    ExecutorService executor
) {}
