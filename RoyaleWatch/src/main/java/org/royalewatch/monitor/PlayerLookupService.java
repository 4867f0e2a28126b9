package org.royalewatch.monitor;

import org.json.JSONObject;
import org.royalewatch.model.PlayerReport;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.service.ApiException;
import org.royalewatch.service.PlayerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One-off player lookups. Requests share the monitor's rate limit; only the player itself is
 * required, clan and chests are shown when available.
 */
public class PlayerLookupService {
    private static final Logger log = LoggerFactory.getLogger(PlayerLookupService.class);

    private final MonitorScheduler scheduler;
    private final PlayerDirectory directory;

    public PlayerLookupService(MonitorScheduler scheduler, PlayerDirectory directory) {
        this.scheduler = scheduler;
        this.directory = directory;
    }

    public PlayerReport lookup(String rawTag) {
        String tag = MonitorService.normalize(rawTag);
        JSONObject player;
        try (RateLimiter.Permit ignored = scheduler.rateLimiter().acquire()) {
            player = directory.fetchPlayer(tag);
        } catch (ApiException e) {
            if (e.getKind() == ApiException.Kind.NOT_FOUND) {
                throw new MonitorException(MonitorException.Kind.PROFILE_NOT_FOUND, tag, "no such player");
            }
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "player API unavailable (" + e.getKind() + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "interrupted", e);
        }

        List<JSONObject> chests = fetchChests(tag);
        JSONObject clan = fetchClan(tag, player);
        SubjectMonitor monitor = scheduler.get(tag);
        SubjectAggregate stats = monitor != null ? monitor.aggregateCopy() : null;
        return new PlayerReport(tag, player, clan, chests, stats);
    }

    private List<JSONObject> fetchChests(String tag) {
        try (RateLimiter.Permit ignored = scheduler.rateLimiter().acquire()) {
            return directory.fetchUpcomingChests(tag);
        } catch (ApiException e) {
            log.warn("Upcoming chests of #{} unavailable ({}): {}", tag, e.getKind(), e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "interrupted", e);
        }
    }

    private JSONObject fetchClan(String tag, JSONObject player) {
        JSONObject membership = player.optJSONObject("clan");
        String clanTag = membership != null ? membership.optString("tag", "") : "";
        if (clanTag.isBlank()) return null;
        try (RateLimiter.Permit ignored = scheduler.rateLimiter().acquire()) {
            return directory.fetchClan(clanTag);
        } catch (ApiException e) {
            log.warn("Clan {} of #{} unavailable ({}): {}", clanTag, tag, e.getKind(), e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitorException(MonitorException.Kind.UNAVAILABLE, tag, "interrupted", e);
        }
    }
}
