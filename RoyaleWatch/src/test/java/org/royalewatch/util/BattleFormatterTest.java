package org.royalewatch.util;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.royalewatch.TestBattles;
import org.royalewatch.event.MonitorEvent;
import org.royalewatch.model.BattleRecord;
import org.royalewatch.model.PlayerReport;
import org.royalewatch.model.RivalEntry;
import org.royalewatch.model.Subject;
import org.royalewatch.model.SubjectAggregate;
import org.royalewatch.service.BattleNormalizer;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.royalewatch.TestBattles.T0;

class BattleFormatterTest {

    private final BattleNormalizer normalizer = new BattleNormalizer();
    private final Subject alice = Subject.create("AAA", "Alice", T0);

    @Test
    @DisplayName("new battle message carries outcome, score, decks and rival record")
    void newBattle() throws Exception {
        BattleRecord battle = normalizer.normalize("AAA", TestBattles.win("AAA", "RRR", T0, "Ladder"));
        RivalEntry h2h = new RivalEntry("RRR", "Opp RRR", 3, 2, 1, 0, T0);

        String text = BattleFormatter.formatNewBattle(
                new MonitorEvent.NewBattleDetected("AAA", "Alice", battle, 10, 6, 4, h2h));

        assertTrue(text.contains("NEW BATTLE - Alice (#AAA)"));
        assertTrue(text.contains("VICTORY (+30)"));
        assertTrue(text.contains("Score: 3 - 1"));
        assertTrue(text.contains("Opponent: Opp RRR (#RRR)"));
        assertTrue(text.contains("Your Deck:\nHog Rider"));
        assertTrue(text.contains("RIVAL MATCH! 3 total matches"));
        assertTrue(text.contains("Record: 2W/1L (66.7% WR)"));
        assertTrue(text.contains("Session: 6W/4L (60.0% WR)"));
    }

    @Test
    @DisplayName("first meeting shows no rival block")
    void firstMeeting() throws Exception {
        BattleRecord battle = normalizer.normalize("AAA", TestBattles.loss("AAA", "RRR", T0, "Ladder"));
        RivalEntry h2h = new RivalEntry("RRR", "Opp RRR", 1, 0, 1, 0, T0);

        String text = BattleFormatter.formatEvent(
                new MonitorEvent.NewBattleDetected("AAA", "Alice", battle, 1, 0, 1, h2h));

        assertTrue(text.contains("DEFEAT (-30)"));
        assertFalse(text.contains("RIVAL MATCH"));
    }

    @Test
    @DisplayName("stats list modes by games played")
    void stats() throws Exception {
        SubjectAggregate aggregate = new SubjectAggregate();
        aggregate.add(normalizer.normalize("AAA", TestBattles.win("AAA", "X", T0, "2v2")));
        aggregate.add(normalizer.normalize("AAA", TestBattles.win("AAA", "Y", T0.plusSeconds(60), "Ladder")));
        aggregate.add(normalizer.normalize("AAA", TestBattles.loss("AAA", "Z", T0.plusSeconds(120), "Ladder")));

        String text = BattleFormatter.formatStats(alice, aggregate);

        assertTrue(text.contains("Total: 2W / 1L / 0D (3 games)"));
        assertTrue(text.contains("Win Rate: 66.7%"));
        assertTrue(text.indexOf("\nLadder:") < text.indexOf("\n2v2:"), text);
    }

    @Test
    @DisplayName("empty stats and rivals have friendly messages")
    void empty() {
        assertTrue(BattleFormatter.formatStats(alice, new SubjectAggregate()).startsWith("No battle data"));
        assertTrue(BattleFormatter.formatRivals(alice, List.of()).startsWith("No repeat opponents"));
    }

    @Test
    @DisplayName("rival list is capped and says how many are hidden")
    void rivalsCapped() {
        List<RivalEntry> rivals = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rivals.add(new RivalEntry("R" + i, "Rival " + i, 2, 1, 1, 0, T0));
        }

        String text = BattleFormatter.formatRivals(alice, rivals);

        assertTrue(text.contains("15. Rival 14"));
        assertFalse(text.contains("Rival 15 "));
        assertTrue(text.contains("... and 5 more rivals"));
        assertTrue(text.contains("Status: Even"));
    }

    @Test
    @DisplayName("rivalry status follows the head-to-head balance")
    void rivalryStatus() {
        assertEquals("Dominating", BattleFormatter.rivalryStatus(new RivalEntry("R", "R", 3, 2, 1, 0, T0)));
        assertEquals("Struggling", BattleFormatter.rivalryStatus(new RivalEntry("R", "R", 3, 1, 2, 0, T0)));
    }

    @Test
    @DisplayName("head-to-head lists recent matches")
    void headToHead() throws Exception {
        List<BattleRecord> history = List.of(
                normalizer.normalize("AAA", TestBattles.loss("AAA", "RRR", T0.plusSeconds(60), "Ladder")),
                normalizer.normalize("AAA", TestBattles.win("AAA", "RRR", T0, "Ladder")));

        String text = BattleFormatter.formatHeadToHead(new RivalEntry("RRR", "Opp RRR", 2, 1, 1, 0, T0), history);

        assertTrue(text.contains("[L] 0-2 | Ladder | 2024-03-01 12:01:00 UTC"));
        assertTrue(text.contains("[W] 3-1 | Ladder | 2024-03-01 12:00:00 UTC"));
    }

    @Test
    @DisplayName("split keeps chunks under the limit and cuts on line breaks")
    void split() {
        String message = "a".repeat(30) + "\n" + "b".repeat(30) + "\n" + "c".repeat(10);

        List<String> parts = BattleFormatter.split(message, 50);

        assertEquals(List.of("a".repeat(30), "b".repeat(30) + "\n" + "c".repeat(10)), parts);
        assertEquals(List.of("xx", "xx", "x"), BattleFormatter.split("xxxxx", 2));
    }

    @Test
    @DisplayName("events other than battles render as one-liners")
    void otherEvents() {
        assertTrue(BattleFormatter.formatEvent(new MonitorEvent.RivalPromoted("AAA", "RRR", "Rex", 2))
                .contains("Rex (#RRR) has now been faced 2 times"));
        assertTrue(BattleFormatter.formatEvent(new MonitorEvent.ArenaChanged("AAA", "Alice", "A1", "A2", 5000))
                .contains("A1 ➡️ A2"));
        assertTrue(BattleFormatter.formatEvent(new MonitorEvent.PersistentFailure("AAA", "TRANSIENT", 5, "503"))
                .contains("TRANSIENT, 5 attempts"));
    }

    private static JSONObject searchedPlayer() {
        JSONArray deck = new JSONArray();
        for (String card : List.of("Hog Rider", "Musketeer", "Fireball", "The Log", "Ice Spirit", "Skeletons",
                "Cannon", "Ice Golem", "Knight")) {
            deck.put(new JSONObject().put("name", card));
        }
        return new JSONObject()
                .put("tag", "#AAA")
                .put("name", "Alice")
                .put("trophies", 7421)
                .put("bestTrophies", 7600)
                .put("expLevel", 14)
                .put("arena", new JSONObject().put("name", "Legendary Arena"))
                .put("wins", 3000)
                .put("losses", 1000)
                .put("battleCount", 4500)
                .put("threeCrownWins", 1200)
                .put("cards", new JSONArray().put(new JSONObject()).put(new JSONObject()))
                .put("currentDeck", deck)
                .put("role", "coLeader")
                .put("clan", new JSONObject().put("tag", "#C0FFEE").put("name", "Night Owls"));
    }

    @Test
    @DisplayName("player info covers profile, clan, chests and monitored stats")
    void playerInfo() throws Exception {
        JSONObject clan = new JSONObject().put("clanScore", 52000).put("members", 41).put("requiredTrophies", 5000);
        List<JSONObject> chests = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            chests.add(new JSONObject().put("index", i).put("name", i == 0 ? "Golden Chest" : "Silver Chest"));
        }
        SubjectAggregate aggregate = new SubjectAggregate();
        aggregate.add(normalizer.normalize("AAA", TestBattles.win("AAA", "X", T0, "Ladder")));
        aggregate.add(normalizer.normalize("AAA", TestBattles.loss("AAA", "Y", T0.plusSeconds(60), "Ladder")));

        String text = BattleFormatter.formatPlayerInfo(
                new PlayerReport("AAA", searchedPlayer(), clan, chests, aggregate), T0);

        assertTrue(text.contains("Player: Alice (#AAA)\nLast Updated: 2024-03-01 12:00:00 UTC"));
        assertTrue(text.contains("Trophies: 7,421 (Best: 7,600)"));
        assertTrue(text.contains("Arena: Legendary Arena"));
        assertTrue(text.contains("- Win Rate: 66.7%"));
        assertTrue(text.contains("Cards Found: 2"));
        assertTrue(text.contains("Hog Rider, Musketeer, Fireball, The Log, Ice Spirit, Skeletons, Cannon, Ice Golem\n"));
        assertFalse(text.contains("Knight"));
        assertTrue(text.contains("Clan: Night Owls (#C0FFEE)\nRole: Co-Leader"));
        assertTrue(text.contains("- Clan Score: 52,000"));
        assertTrue(text.contains("- Members: 41/50"));
        assertTrue(text.contains("  +0: Golden Chest"));
        assertTrue(text.contains("  +11: Silver Chest"));
        assertFalse(text.contains("  +12:"));
        assertTrue(text.contains("MONITORED SESSION STATS:\nTotal: 1W / 1L / 0D (2 games)\nSession Win Rate: 50.0%"));
        assertTrue(text.contains("  Ladder: 1W/1L (50.0%)"));
    }

    @Test
    @DisplayName("clanless, unmonitored players get only the profile part")
    void playerInfoMinimal() {
        JSONObject player = new JSONObject().put("tag", "#BBB").put("name", "Bob");

        String text = BattleFormatter.formatPlayerInfo(new PlayerReport("BBB", player, null, List.of(), null), T0);

        assertTrue(text.contains("Arena: Unknown Arena"));
        assertTrue(text.contains("- Win Rate: 0.0%"));
        assertFalse(text.contains("Clan:"));
        assertFalse(text.contains("Upcoming Chests"));
        assertFalse(text.contains("MONITORED SESSION STATS"));
        assertTrue(BattleFormatter.formatStatusMessage(new PlayerReport("BBB", player, null, List.of(), null), T0)
                .startsWith("🔔 MONITORING ACTIVE\n\n===="));
    }

    @Test
    @DisplayName("clan roles read like the game shows them")
    void roles() {
        assertEquals("Elder", BattleFormatter.roleLabel("elder"));
        assertEquals("Co-Leader", BattleFormatter.roleLabel("coLeader"));
        assertEquals("Leader", BattleFormatter.roleLabel("leader"));
        assertEquals("Member", BattleFormatter.roleLabel("member"));
    }
}
