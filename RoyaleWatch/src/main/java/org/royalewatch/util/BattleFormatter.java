package org.royalewatch.util;

import org.json.JSONArray;
import org.json.JSONObject;
import org.royalewatch.event.MonitorEvent;
import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.ModeStats;
import org.royalewatch.model.Outcome;
import org.royalewatch.model.PlayerReport;
import org.royalewatch.model.RivalEntry;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.model.WinRate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of battles, statistics and rivalries for chat messages.
 */
public class BattleFormatter {

    public static final int MAX_RIVALS_SHOWN = 15;
    public static final int MAX_CHESTS_SHOWN = 12;
    public static final int MAX_MODES_SHOWN = 5;

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public static String formatTime(Instant instant) {
        return instant == null ? "Unknown" : TIME.format(instant);
    }

    public static String outcomeLabel(Outcome outcome) {
        return switch (outcome) {
            case WIN -> "🏆 VICTORY";
            case LOSS -> "💀 DEFEAT";
            case DRAW -> "🤝 DRAW";
        };
    }

    public static String outcomeLetter(Outcome outcome) {
        return switch (outcome) {
            case WIN -> "W";
            case LOSS -> "L";
            case DRAW -> "D";
        };
    }

    /** "Dominating" / "Struggling" / "Even" depending on the head-to-head balance. */
    public static String rivalryStatus(RivalEntry rival) {
        if (rival.wins() > rival.losses()) return "Dominating";
        if (rival.losses() > rival.wins()) return "Struggling";
        return "Even";
    }

    // --- EVENTS ---

    public static String formatNewBattle(MonitorEvent.NewBattleDetected event) {
        BattleRecord battle = event.battle();
        BattleRecord.Opponent opponent = battle.opponent();
        StringBuilder sb = new StringBuilder();
        sb.append("NEW BATTLE - ").append(event.subjectName())
                .append(" (").append(Subject.displayTag(event.subjectTag())).append(")\n");
        sb.append("Time: ").append(formatTime(battle.timestamp())).append("\n\n");

        sb.append(outcomeLabel(battle.outcome()));
        if (battle.trophyChange() != null && battle.trophyChange() != 0) {
            sb.append(battle.trophyChange() > 0 ? " (+" : " (").append(battle.trophyChange()).append(")");
        }
        sb.append("\nMode: ").append(battle.rawMode());
        if (battle.crowns() != null && battle.opponentCrowns() != null) {
            sb.append("\nScore: ").append(battle.crowns()).append(" - ").append(battle.opponentCrowns());
        }

        sb.append("\n\nOpponent: ").append(opponent.name());
        if (opponent.isKnown()) sb.append(" (").append(Subject.displayTag(opponent.tag())).append(")");
        if (opponent.startingTrophies() != null) sb.append("\nTrophies: ").append(opponent.startingTrophies());

        if (!battle.deck().isEmpty()) sb.append("\n\nYour Deck:\n").append(String.join(", ", battle.deck()));
        if (!opponent.deck().isEmpty()) sb.append("\n\nEnemy Deck:\n").append(String.join(", ", opponent.deck()));

        RivalEntry h2h = event.headToHead();
        if (h2h != null && h2h.encounters() >= 2) {
            sb.append("\n\n🎯 RIVAL MATCH! ").append(h2h.encounters()).append(" total matches vs ").append(h2h.name())
                    .append("\nRecord: ").append(h2h.wins()).append("W/").append(h2h.losses()).append("L (")
                    .append(WinRate.percent(h2h.wins(), h2h.encounters())).append("% WR)");
        }

        if (event.totalBattles() > 0) {
            sb.append("\n\n📊 Session: ").append(event.totalWins()).append("W/").append(event.totalLosses())
                    .append("L (").append(WinRate.percent(event.totalWins(), event.totalBattles())).append("% WR)");
        }
        return sb.toString();
    }

    public static String formatEvent(MonitorEvent event) {
        if (event instanceof MonitorEvent.NewBattleDetected e) {
            return formatNewBattle(e);
        }
        if (event instanceof MonitorEvent.RivalPromoted e) {
            return "⚔️ NEW RIVAL for " + Subject.displayTag(e.subjectTag()) + ": " + e.opponentName()
                    + " (" + Subject.displayTag(e.opponentTag()) + ") has now been faced " + e.encounterCount() + " times.";
        }
        if (event instanceof MonitorEvent.LogDiscontinuityDetected e) {
            return "ℹ️ Battle log of " + Subject.displayTag(e.subjectTag()) + " skipped ahead; "
                    + e.unseenCount() + " battle(s) were processed from the full log.";
        }
        if (event instanceof MonitorEvent.ArenaChanged e) {
            return "🎉 ARENA CHANGE!\n\n" + e.subjectName() + " has reached a new arena!\n\n"
                    + e.previousArena() + " ➡️ " + e.currentArena() + "\n\nCurrent Trophies: " + e.trophies() + " 🏆";
        }
        if (event instanceof MonitorEvent.PersistentFailure e) {
            return "⚠️ Monitoring of " + Subject.displayTag(e.subjectTag()) + " is failing (" + e.kind() + ", "
                    + e.consecutiveFailures() + " attempts in a row).";
        }
        return event.toString();
    }

    // --- STATS ---

    public static String formatStats(Subject subject, SubjectAggregate stats) {
        if (stats.getTotalBattles() == 0) {
            return "No battle data recorded yet for " + subject.name() + " (" + Subject.displayTag(subject.tag()) + ").";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("📊 MONITORED BATTLE STATISTICS - ").append(subject.name()).append("\n");
        sb.append("========================================\n");
        sb.append(counters(stats.total())).append("\n");
        sb.append("Win Rate: ").append(WinRate.percent(stats.getTotalWins(), stats.getTotalBattles())).append("%\n\n");
        sb.append("📋 BY GAME MODE:\n");

        stats.byMode().entrySet().stream()
                .sorted(Map.Entry.<String, ModeStats>comparingByValue(Comparator.comparingInt(ModeStats::getBattles)).reversed())
                .forEach(e -> sb.append("\n").append(e.getKey()).append(":\n")
                        .append("  ").append(e.getValue().getWins()).append("W / ").append(e.getValue().getLosses())
                        .append("L / ").append(e.getValue().getDraws()).append("D\n")
                        .append("  Win Rate: ").append(WinRate.percent(e.getValue().getWins(), e.getValue().getBattles()))
                        .append("% (").append(e.getValue().getBattles()).append(" games)\n"));
        return sb.toString();
    }

    private static String counters(ModeStats stats) {
        return "Total: " + stats.getWins() + "W / " + stats.getLosses() + "L / " + stats.getDraws() + "D ("
                + stats.getBattles() + " games)";
    }

    // --- RIVALS ---

    public static String formatRivals(Subject subject, List<RivalEntry> rivals) {
        if (rivals.isEmpty()) {
            return "No repeat opponents found for " + subject.name() + " (" + Subject.displayTag(subject.tag())
                    + ").\nKeep playing to track your rivalries!";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("========================================\n");
        sb.append("RIVALS - Repeat Opponents for ").append(subject.name()).append("\n");
        sb.append("========================================\n\n");
        int shown = Math.min(MAX_RIVALS_SHOWN, rivals.size());
        for (int i = 0; i < shown; i++) {
            RivalEntry r = rivals.get(i);
            sb.append(i + 1).append(". ").append(r.name()).append(" (").append(Subject.displayTag(r.opponentTag())).append(")\n");
            sb.append("   Matches: ").append(r.encounters()).append(" | Record: ").append(r.wins()).append("W/")
                    .append(r.losses()).append("L/").append(r.draws()).append("D\n");
            sb.append("   Win Rate: ").append(WinRate.percent(r.wins(), r.encounters())).append("% | Status: ")
                    .append(rivalryStatus(r)).append("\n\n");
        }
        if (rivals.size() > shown) {
            sb.append("... and ").append(rivals.size() - shown).append(" more rivals\n");
        }
        return sb.toString();
    }

    public static String formatHeadToHead(RivalEntry rival, List<BattleRecord> history) {
        StringBuilder sb = new StringBuilder();
        sb.append("========================================\n");
        sb.append("HEAD-TO-HEAD: vs ").append(rival.name()).append("\n");
        sb.append("========================================\n\n");
        sb.append("Opponent Tag: ").append(Subject.displayTag(rival.opponentTag())).append("\n");
        sb.append("Total Matches: ").append(rival.encounters()).append("\n\n");
        sb.append("Record: ").append(rival.wins()).append("W / ").append(rival.losses()).append("L / ")
                .append(rival.draws()).append("D\n");
        sb.append("Win Rate: ").append(WinRate.percent(rival.wins(), rival.encounters())).append("%\n");

        if (!history.isEmpty()) {
            sb.append("\nRECENT MATCH HISTORY:\n--------------------\n");
            for (BattleRecord b : history) {
                sb.append("[").append(outcomeLetter(b.outcome())).append("] ");
                if (b.crowns() != null && b.opponentCrowns() != null) {
                    sb.append(b.crowns()).append("-").append(b.opponentCrowns()).append(" | ");
                }
                sb.append(b.mode()).append(" | ").append(formatTime(b.timestamp())).append("\n");
            }
        }
        return sb.toString();
    }

    // --- PLAYER INFO ---

    public static final String STATUS_HEADER = "🔔 MONITORING ACTIVE";

    private static final String RULE = "========================================\n";

    public static String formatStatusMessage(PlayerReport report, Instant now) {
        return STATUS_HEADER + "\n\n" + formatPlayerInfo(report, now);
    }

    /** Profile, clan, upcoming chests and, for monitored players, the recorded statistics. */
    public static String formatPlayerInfo(PlayerReport report, Instant now) {
        JSONObject p = report.player();
        int battles = p.optInt("battleCount", 0);
        int wins = p.optInt("wins", 0);
        JSONObject arena = p.optJSONObject("arena");
        StringBuilder sb = new StringBuilder();
        sb.append(RULE);
        sb.append("Player: ").append(p.optString("name", "Unknown")).append(" (")
                .append(p.optString("tag", Subject.displayTag(report.tag()))).append(")\n");
        sb.append("Last Updated: ").append(formatTime(now)).append("\n");
        sb.append(RULE).append("\n");
        sb.append("Trophies: ").append(number(p, "trophies")).append(" (Best: ").append(number(p, "bestTrophies")).append(")\n");
        sb.append("Level: ").append(p.optInt("expLevel", 0)).append("\n");
        sb.append("Arena: ").append(arena != null ? arena.optString("name", "Unknown Arena") : "Unknown Arena").append("\n\n");

        sb.append("Battle Stats (All Time):\n");
        sb.append("- Wins: ").append(number(p, "wins")).append("\n");
        sb.append("- Losses: ").append(number(p, "losses")).append("\n");
        sb.append("- Total Battles: ").append(number(p, "battleCount")).append("\n");
        sb.append("- Win Rate: ").append(String.format(Locale.ROOT, "%.1f", battles > 0 ? wins * 100.0 / battles : 0.0)).append("%\n");
        sb.append("- 3-Crown Wins: ").append(number(p, "threeCrownWins")).append("\n\n");

        sb.append("Challenge Stats:\n");
        sb.append("- Max Wins: ").append(p.optInt("challengeMaxWins", 0)).append("\n");
        sb.append("- Cards Won: ").append(number(p, "challengeCardsWon")).append("\n\n");
        sb.append("Tournament Stats:\n");
        sb.append("- Battles: ").append(number(p, "tournamentBattleCount")).append("\n");
        sb.append("- Cards Won: ").append(number(p, "tournamentCardsWon")).append("\n\n");

        JSONArray cards = p.optJSONArray("cards");
        sb.append("Cards Found: ").append(cards != null ? cards.length() : 0).append("\n\n");

        sb.append("Donations:\n");
        sb.append("- Given: ").append(number(p, "donations")).append("\n");
        sb.append("- Received: ").append(number(p, "donationsReceived")).append("\n");
        sb.append("- Total Given: ").append(number(p, "totalDonations")).append("\n\n");
        sb.append("War Stats:\n");
        sb.append("- War Day Wins: ").append(number(p, "warDayWins")).append("\n");
        sb.append("- Clan Cards Collected: ").append(number(p, "clanCardsCollected")).append("\n\n");

        sb.append("Current Deck:\n").append(deck(p.optJSONArray("currentDeck"))).append("\n");

        appendClan(sb, p, report.clan());
        appendChests(sb, report.upcomingChests());
        appendMonitored(sb, report.monitoredStats());
        return sb.toString();
    }

    private static void appendClan(StringBuilder sb, JSONObject player, JSONObject clan) {
        JSONObject membership = player.optJSONObject("clan");
        if (membership == null) return;
        sb.append("\n").append(RULE);
        sb.append("Clan: ").append(membership.optString("name", "Unknown")).append(" (")
                .append(membership.optString("tag", "")).append(")\n");
        sb.append("Role: ").append(roleLabel(player.optString("role", "member"))).append("\n");
        if (clan == null) return;
        sb.append("- Clan Score: ").append(number(clan, "clanScore")).append("\n");
        sb.append("- War Trophies: ").append(number(clan, "clanWarTrophies")).append("\n");
        sb.append("- Members: ").append(clan.optInt("members", 0)).append("/50\n");
        sb.append("- Required Trophies: ").append(number(clan, "requiredTrophies")).append("\n");
        sb.append("- Weekly Donations: ").append(number(clan, "donationsPerWeek")).append("\n");
    }

    private static void appendChests(StringBuilder sb, List<JSONObject> chests) {
        if (chests == null || chests.isEmpty()) return;
        sb.append("\n").append(RULE).append("Upcoming Chests:\n");
        for (JSONObject chest : chests.subList(0, Math.min(MAX_CHESTS_SHOWN, chests.size()))) {
            sb.append("  +").append(chest.optInt("index", 0)).append(": ")
                    .append(chest.optString("name", "Unknown Chest")).append("\n");
        }
    }

    private static void appendMonitored(StringBuilder sb, SubjectAggregate stats) {
        if (stats == null || stats.getTotalBattles() == 0) return;
        sb.append("\n").append(RULE).append("MONITORED SESSION STATS:\n");
        sb.append(counters(stats.total())).append("\n");
        sb.append("Session Win Rate: ").append(WinRate.percent(stats.getTotalWins(), stats.getTotalBattles())).append("%\n");
        if (stats.byMode().isEmpty()) return;
        sb.append("\nBy Game Mode:\n");
        stats.byMode().entrySet().stream()
                .sorted(Map.Entry.<String, ModeStats>comparingByValue(Comparator.comparingInt(ModeStats::getBattles)).reversed())
                .limit(MAX_MODES_SHOWN)
                .forEach(e -> sb.append("  ").append(e.getKey()).append(": ")
                        .append(e.getValue().getWins()).append("W/").append(e.getValue().getLosses()).append("L (")
                        .append(WinRate.percent(e.getValue().getWins(), e.getValue().getBattles())).append("%)\n"));
    }

    public static String roleLabel(String role) {
        return switch (role) {
            case "elder" -> "Elder";
            case "coLeader" -> "Co-Leader";
            case "leader" -> "Leader";
            case "member" -> "Member";
            default -> role;
        };
    }

    private static String deck(JSONArray cards) {
        if (cards == null) return "";
        List<String> names = new ArrayList<>();
        for (int i = 0; i < Math.min(8, cards.length()); i++) {
            JSONObject card = cards.optJSONObject(i);
            names.add(card != null ? card.optString("name", "?") : "?");
        }
        return String.join(", ", names);
    }

    private static String number(JSONObject json, String key) {
        return String.format(Locale.ROOT, "%,d", json.optLong(key, 0));
    }

    /** Splits a message into chunks that fit a chat message limit, preferring line breaks. */
    public static List<String> split(String message, int limit) {
        List<String> parts = new ArrayList<>();
        String rest = message;
        while (rest.length() > limit) {
            int cut = rest.lastIndexOf('\n', limit);
            if (cut <= 0) cut = limit;
            parts.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) parts.add(rest);
        return parts;
    }
}
