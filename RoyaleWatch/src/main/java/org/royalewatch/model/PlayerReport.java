package org.royalewatch.model;

import org.json.JSONObject;

import java.util.List;

/**
 * Everything shown by {@code /search} and on a status message.
 *
 * @param clan           null when the player has no clan or the clan could not be fetched
 * @param monitoredStats null when the player is not monitored
 */
public record PlayerReport(
        String tag,
        JSONObject player,
        JSONObject clan,
        List<JSONObject> upcomingChests,
        SubjectAggregate monitoredStats
) {
}
