package org.royalewatch;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import org.royalewatch.command.BotContext;
import org.royalewatch.command.CommandManager;
import org.royalewatch.command.HelpCommand;
import org.royalewatch.command.ListMonitorsCommand;
import org.royalewatch.command.MonitorCommand;
import org.royalewatch.command.RivalsCommand;
import org.royalewatch.command.SearchCommand;
import org.royalewatch.command.StatsCommand;
import org.royalewatch.command.UnmonitorCommand;
import org.royalewatch.config.MonitorConfig;
import org.royalewatch.monitor.BackoffPolicy;
import org.royalewatch.monitor.MonitorScheduler;
import org.royalewatch.monitor.MonitorService;
import org.royalewatch.monitor.PlayerLookupService;
import org.royalewatch.monitor.RateLimiter;
import org.royalewatch.notify.DiscordNotifier;
import org.royalewatch.notify.DiscordStatusChannel;
import org.royalewatch.notify.StatusBoard;
import org.royalewatch.service.ClashRoyaleService;
import org.royalewatch.store.SqliteStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point: wires the monitor engine to the Clash Royale API and to Discord.
 */
public class RoyaleWatchBot {
    private static final Logger log = LoggerFactory.getLogger(RoyaleWatchBot.class);

    public static void main(String[] args) throws Exception {
        MonitorConfig config = MonitorConfig.load();
        Clock clock = Clock.systemUTC();

        ClashRoyaleService clashService = new ClashRoyaleService(
                MonitorConfig.require(config.clashApiKey(), "CLASH_API_KEY"),
                config.clashApiBaseUrl(),
                config.fetchTimeout());
        SqliteStateStore store = new SqliteStateStore(config.databasePath());
        RateLimiter rateLimiter = new RateLimiter(config.requestsPerSecond(), config.requestBurst(), clock);

        ExecutorService workers = Executors.newFixedThreadPool(config.workerThreads());
        MonitorScheduler scheduler = new MonitorScheduler(store, clashService, rateLimiter, workers, clock,
                new MonitorScheduler.Settings(
                        config.checkInterval(),
                        new BackoffPolicy(config.backoffBase(), config.backoffMax()),
                        config.maxConsecutiveFailures(),
                        config.maxStoreFailures(),
                        config.rivalThreshold()));
        scheduler.loadPersisted();
        MonitorService monitorService = new MonitorService(scheduler, store, clashService);

        PlayerLookupService lookupService = new PlayerLookupService(scheduler, clashService);

        JDA jda = JDABuilder.createDefault(MonitorConfig.require(config.discordToken(), "DISCORD_TOKEN")).build();
        jda.awaitReady();

        String notifyChannelId = MonitorConfig.require(config.notifyChannelId(), "NOTIFY_CHANNEL_ID");
        String statusChannelId = config.statusChannelId() != null && !config.statusChannelId().isBlank()
                ? config.statusChannelId() : notifyChannelId;
        StatusBoard statusBoard = new StatusBoard(monitorService, lookupService, store,
                new DiscordStatusChannel(jda, statusChannelId), clock);

        ExecutorService commandExecutor = Executors.newFixedThreadPool(4);
        CommandManager commandManager = new CommandManager(
                new BotContext(monitorService, lookupService, statusBoard, commandExecutor));
        commandManager.addCommand(new MonitorCommand());
        commandManager.addCommand(new UnmonitorCommand());
        commandManager.addCommand(new ListMonitorsCommand());
        commandManager.addCommand(new StatsCommand());
        commandManager.addCommand(new RivalsCommand());
        commandManager.addCommand(new SearchCommand());
        commandManager.addCommand(new HelpCommand());

        jda.addEventListener(commandManager);
        jda.updateCommands().addCommands(commandManager.getCommandDataList()).queue();

        scheduler.addListener(new DiscordNotifier(jda, notifyChannelId));
        scheduler.addListener(statusBoard);
        scheduler.start(config.tick());
        statusBoard.start(config.statusRefresh());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            scheduler.close();
            statusBoard.close();
            workers.shutdown();
            commandExecutor.shutdown();
            jda.shutdown();
        }, "shutdown"));

        log.info("RoyaleWatch started, monitoring {} player(s)", monitorService.listMonitored().size());
    }
}
