package org.royalewatch.model;

import java.time.Instant;

public record RivalEntry(
        String opponentTag,
        String name,
        int encounters,
        int wins,
        int losses,
        int draws,
        Instant lastSeen
) {

    public static RivalEntry of(String opponentTag, OpponentStats stats) {
        return new RivalEntry(opponentTag, stats.getName(), stats.getBattles(),
                stats.getWins(), stats.getLosses(), stats.getDraws(), stats.getLastSeen());
    }

    public double winRate() {
        return WinRate.of(wins, encounters);
    }
}
