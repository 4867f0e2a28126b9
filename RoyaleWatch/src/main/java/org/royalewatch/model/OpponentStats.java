package org.royalewatch.model;

import java.time.Instant;

/**
 * Head-to-head counters against one opponent.
 */
public class OpponentStats extends ModeStats {
    private String name;
    private Instant lastSeen;

    public OpponentStats(String name) {
        this.name = name;
    }

    public OpponentStats(String name, int battles, int wins, int losses, int draws, Instant lastSeen) {
        super(battles, wins, losses, draws);
        this.name = name;
        this.lastSeen = lastSeen;
    }

    public void record(Outcome outcome, String latestName, Instant seenAt) {
        record(outcome);
        if (latestName != null && !latestName.isBlank()) name = latestName;
        if (lastSeen == null || (seenAt != null && seenAt.isAfter(lastSeen))) lastSeen = seenAt;
    }

    public String getName() { return name; }
    public Instant getLastSeen() { return lastSeen; }

    @Override
    public OpponentStats copy() {
        return new OpponentStats(name, getBattles(), getWins(), getLosses(), getDraws(), lastSeen);
    }
}
