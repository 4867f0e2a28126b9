package org.royalewatch.service;

import org.json.JSONArray;
import org.json.JSONObject;
import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.Outcome;
import org.royalewatch.model.Subject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Turns one raw battle-log entry into a {@link BattleRecord} seen from the monitored player.
 * Pure: no I/O and no shared state.
 */
public class BattleNormalizer {

    public static final DateTimeFormatter BATTLE_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final int DECK_SIZE = 8;

    public BattleRecord normalize(String subjectTag, JSONObject raw) throws MalformedRecordException {
        String tag = Subject.normalizeTag(subjectTag);
        Instant timestamp = parseTime(raw.optString("battleTime", ""));

        String type = raw.optString("type", "");
        JSONObject gameMode = raw.optJSONObject("gameMode");
        String rawMode = gameMode != null ? gameMode.optString("name", "") : "";
        if (rawMode.isBlank() && type.isBlank()) {
            throw new MalformedRecordException("Battle at " + timestamp + " has no game mode");
        }
        if (rawMode.isBlank()) rawMode = type;

        JSONArray team = raw.optJSONArray("team");
        JSONArray opponents = raw.optJSONArray("opponent");
        JSONObject self = findPlayer(team, tag);
        JSONObject enemy;
        if (self != null) {
            enemy = first(opponents);
        } else {
            self = findPlayer(opponents, tag);
            enemy = first(team);
        }
        if (self == null) {
            throw new MalformedRecordException("Player #" + tag + " is not part of battle at " + timestamp);
        }
        if (enemy == null) enemy = new JSONObject();

        Integer crowns = optInt(self, "crowns");
        Integer enemyCrowns = optInt(enemy, "crowns");
        Integer trophyChange = optInt(self, "trophyChange");
        Outcome outcome = resolveOutcome(crowns, enemyCrowns, trophyChange);
        if (outcome == null) {
            throw new MalformedRecordException("Cannot determine the result of battle at " + timestamp);
        }

        BattleRecord.Opponent opponent = new BattleRecord.Opponent(
                opponentTag(enemy),
                enemy.optString("name", "Unknown"),
                deckOf(enemy),
                optInt(enemy, "startingTrophies")
        );

        JSONObject arena = raw.optJSONObject("arena");
        return new BattleRecord(
                battleId(tag, opponent.tag(), timestamp, rawMode),
                timestamp,
                categorize(type, rawMode),
                rawMode,
                type.isBlank() ? null : type,
                arena != null ? arena.optString("name", null) : null,
                deckOf(self),
                opponent,
                outcome,
                crowns,
                enemyCrowns,
                trophyChange
        );
    }

    /**
     * Stable identifier of a match. The API has no battle id, so the id is a hash of
     * (subject tag, opponent tag, battle time, mode), which repeated fetches reproduce.
     */
    public static String battleId(String subjectTag, String opponentTag, Instant timestamp, String rawMode) {
        String key = subjectTag + "|" + opponentTag + "|" + timestamp.toEpochMilli() + "|" + rawMode;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /** Groups raw modes into the categories used for statistics. */
    public static String categorize(String type, String rawMode) {
        String t = type == null ? "" : type.toLowerCase(Locale.ROOT);
        String m = rawMode == null ? "" : rawMode.toLowerCase(Locale.ROOT);

        if (m.contains("2v2") || t.contains("2v2")) return "2v2";
        if (t.contains("friendly") || m.contains("friendly")) return "Friendly";
        if (t.contains("challenge") || m.contains("challenge")) return "Challenge";
        if (t.contains("tournament") || m.contains("tournament")) return "Tournament";
        if (t.contains("clanwar") || m.contains("war") || m.contains("clanwar")) return "Clan War";
        if (m.contains("party")) return "Party Mode";
        if (t.contains("pathoflegend") || t.contains("ladder")) return "Ladder";
        if (!m.isBlank()) return rawMode;
        return "1v1";
    }

    private static Instant parseTime(String battleTime) throws MalformedRecordException {
        try {
            return Instant.from(BATTLE_TIME.parse(battleTime));
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("Unparsable battleTime '" + battleTime + "'", e);
        }
    }

    private static Outcome resolveOutcome(Integer crowns, Integer enemyCrowns, Integer trophyChange) {
        if (crowns != null && enemyCrowns != null) return Outcome.fromCrowns(crowns, enemyCrowns);
        if (trophyChange != null && trophyChange != 0) return trophyChange > 0 ? Outcome.WIN : Outcome.LOSS;
        return null;
    }

    private static JSONObject findPlayer(JSONArray side, String tag) {
        if (side == null) return null;
        for (int i = 0; i < side.length(); i++) {
            JSONObject p = side.optJSONObject(i);
            if (p == null) continue;
            String candidate = p.optString("tag", "").replace("#", "");
            if (candidate.equalsIgnoreCase(tag)) return p;
        }
        return null;
    }

    private static String opponentTag(JSONObject enemy) {
        try {
            return Subject.normalizeTag(enemy.optString("tag", ""));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static JSONObject first(JSONArray side) {
        return (side != null && side.length() > 0) ? side.optJSONObject(0) : null;
    }

    private static Integer optInt(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) return null;
        Object value = json.opt(key);
        return value instanceof Number n ? n.intValue() : null;
    }

    private static List<String> deckOf(JSONObject player) {
        JSONArray cards = player.optJSONArray("cards");
        List<String> deck = new ArrayList<>();
        if (cards == null) return deck;
        for (int i = 0; i < cards.length() && deck.size() < DECK_SIZE; i++) {
            JSONObject card = cards.optJSONObject(i);
            if (card != null) deck.add(card.optString("name", "?"));
        }
        return deck;
    }
}
