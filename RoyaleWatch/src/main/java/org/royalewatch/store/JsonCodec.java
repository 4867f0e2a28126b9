package org.royalewatch.store;

import org.json.JSONArray;
import org.json.JSONObject;
import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.ModeStats;
import org.royalewatch.model.OpponentStats;
import org.royalewatch.model.Outcome;
import org.royalewatch.model.SubjectAggregate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON snapshots of aggregates and battles, as stored in the database.
 */
final class JsonCodec {

    private JsonCodec() {
    }

    // --- AGGREGATE ---
    static String encodeAggregate(SubjectAggregate aggregate) {
        JSONObject modes = new JSONObject();
        aggregate.byMode().forEach((mode, stats) -> modes.put(mode, encodeCounters(stats)));

        JSONObject opponents = new JSONObject();
        aggregate.byOpponent().forEach((tag, stats) -> {
            JSONObject o = encodeCounters(stats);
            o.put("name", stats.getName());
            if (stats.getLastSeen() != null) o.put("lastSeen", stats.getLastSeen().toEpochMilli());
            opponents.put(tag, o);
        });

        return new JSONObject()
                .put("total", encodeCounters(aggregate.total()))
                .put("byMode", modes)
                .put("byOpponent", opponents)
                .toString();
    }

    static SubjectAggregate decodeAggregate(String json) {
        JSONObject root = new JSONObject(json);
        ModeStats total = decodeCounters(root.getJSONObject("total"));

        Map<String, ModeStats> modes = new LinkedHashMap<>();
        JSONObject byMode = root.optJSONObject("byMode");
        if (byMode != null) {
            for (String mode : byMode.keySet()) modes.put(mode, decodeCounters(byMode.getJSONObject(mode)));
        }

        Map<String, OpponentStats> opponents = new LinkedHashMap<>();
        JSONObject byOpponent = root.optJSONObject("byOpponent");
        if (byOpponent != null) {
            for (String tag : byOpponent.keySet()) {
                JSONObject o = byOpponent.getJSONObject(tag);
                opponents.put(tag, new OpponentStats(
                        o.optString("name", "Unknown"),
                        o.getInt("battles"), o.getInt("wins"), o.getInt("losses"), o.getInt("draws"),
                        o.has("lastSeen") ? Instant.ofEpochMilli(o.getLong("lastSeen")) : null));
            }
        }
        return new SubjectAggregate(total, modes, opponents);
    }

    private static JSONObject encodeCounters(ModeStats stats) {
        return new JSONObject()
                .put("battles", stats.getBattles())
                .put("wins", stats.getWins())
                .put("losses", stats.getLosses())
                .put("draws", stats.getDraws());
    }

    private static ModeStats decodeCounters(JSONObject o) {
        return new ModeStats(o.getInt("battles"), o.getInt("wins"), o.getInt("losses"), o.getInt("draws"));
    }

    // --- BATTLE ---
    static String encodeBattle(BattleRecord battle) {
        BattleRecord.Opponent opp = battle.opponent();
        JSONObject opponent = new JSONObject()
                .put("tag", opp.tag())
                .put("name", opp.name())
                .put("deck", new JSONArray(opp.deck()));
        if (opp.startingTrophies() != null) opponent.put("startingTrophies", opp.startingTrophies());

        JSONObject json = new JSONObject()
                .put("id", battle.id())
                .put("time", battle.timestamp().toEpochMilli())
                .put("mode", battle.mode())
                .put("rawMode", battle.rawMode())
                .put("deck", new JSONArray(battle.deck()))
                .put("opponent", opponent)
                .put("outcome", battle.outcome().name());
        if (battle.type() != null) json.put("type", battle.type());
        if (battle.arena() != null) json.put("arena", battle.arena());
        if (battle.crowns() != null) json.put("crowns", battle.crowns());
        if (battle.opponentCrowns() != null) json.put("opponentCrowns", battle.opponentCrowns());
        if (battle.trophyChange() != null) json.put("trophyChange", battle.trophyChange());
        return json.toString();
    }

    static BattleRecord decodeBattle(String payload) {
        JSONObject json = new JSONObject(payload);
        JSONObject opp = json.getJSONObject("opponent");
        return new BattleRecord(
                json.getString("id"),
                Instant.ofEpochMilli(json.getLong("time")),
                json.getString("mode"),
                json.getString("rawMode"),
                json.optString("type", null),
                json.optString("arena", null),
                strings(json.optJSONArray("deck")),
                new BattleRecord.Opponent(
                        opp.optString("tag", null),
                        opp.optString("name", "Unknown"),
                        strings(opp.optJSONArray("deck")),
                        opp.has("startingTrophies") ? opp.getInt("startingTrophies") : null),
                Outcome.valueOf(json.getString("outcome")),
                json.has("crowns") ? json.getInt("crowns") : null,
                json.has("opponentCrowns") ? json.getInt("opponentCrowns") : null,
                json.has("trophyChange") ? json.getInt("trophyChange") : null
        );
    }

    private static List<String> strings(JSONArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) return values;
        for (int i = 0; i < array.length(); i++) values.add(array.getString(i));
        return values;
    }
}
