package org.royalewatch.config;

import io.github.cdimascio.dotenv.Dotenv;

import java.time.Duration;

/**
 * Runtime settings, read from {@code .env} with the process environment as fallback.
 */
public record MonitorConfig(
        String discordToken,
        String clashApiKey,
        String clashApiBaseUrl,
        String notifyChannelId,
        String databasePath,
        Duration checkInterval,
        Duration tick,
        double requestsPerSecond,
        int requestBurst,
        Duration fetchTimeout,
        Duration backoffBase,
        Duration backoffMax,
        int maxConsecutiveFailures,
        int maxStoreFailures,
        int rivalThreshold,
        int workerThreads,
        String statusChannelId,
        Duration statusRefresh
) {

    public static MonitorConfig defaults() {
        return new MonitorConfig(
                null,
                null,
                "https://api.clashroyale.com/v1",
                null,
                "royalewatch.db",
                Duration.ofSeconds(60),
                Duration.ofSeconds(5),
                2.0,
                5,
                Duration.ofSeconds(20),
                Duration.ofSeconds(5),
                Duration.ofSeconds(600),
                5,
                3,
                2,
                4,
                null,
                Duration.ofSeconds(300)
        );
    }

    public static MonitorConfig load() {
        return fromEnv(Dotenv.configure().ignoreIfMissing().load());
    }

    public static MonitorConfig fromEnv(Dotenv env) {
        MonitorConfig d = defaults();
        return new MonitorConfig(
                env.get("DISCORD_TOKEN"),
                env.get("CLASH_API_KEY"),
                env.get("CLASH_API_BASE_URL", d.clashApiBaseUrl()),
                env.get("NOTIFY_CHANNEL_ID"),
                env.get("MONITOR_DB_PATH", d.databasePath()),
                seconds(env, "CHECK_INTERVAL_SECONDS", d.checkInterval()),
                seconds(env, "TICK_SECONDS", d.tick()),
                Double.parseDouble(env.get("REQUESTS_PER_SECOND", String.valueOf(d.requestsPerSecond()))),
                integer(env, "REQUEST_BURST", d.requestBurst()),
                seconds(env, "FETCH_TIMEOUT_SECONDS", d.fetchTimeout()),
                seconds(env, "BACKOFF_BASE_SECONDS", d.backoffBase()),
                seconds(env, "BACKOFF_MAX_SECONDS", d.backoffMax()),
                integer(env, "MAX_CONSECUTIVE_FAILURES", d.maxConsecutiveFailures()),
                integer(env, "MAX_STORE_FAILURES", d.maxStoreFailures()),
                integer(env, "RIVAL_THRESHOLD", d.rivalThreshold()),
                integer(env, "WORKER_THREADS", d.workerThreads()),
                env.get("STATUS_CHANNEL_ID"),
                seconds(env, "STATUS_REFRESH_SECONDS", d.statusRefresh())
        );
    }

    public static String require(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " is not set (check your .env file)");
        }
        return value;
    }

    private static Duration seconds(Dotenv env, String key, Duration fallback) {
        return Duration.ofSeconds(integer(env, key, (int) fallback.toSeconds()));
    }

    private static int integer(Dotenv env, String key, int fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got '" + raw + "'", e);
        }
    }
}
