package org.royalewatch.model;

/**
 * Win/loss/draw counters for one bucket. Rates are derived on read.
 */
public class ModeStats {
    private int battles;
    private int wins;
    private int losses;
    private int draws;

    public ModeStats() {
    }

    public ModeStats(int battles, int wins, int losses, int draws) {
        this.battles = battles;
        this.wins = wins;
        this.losses = losses;
        this.draws = draws;
    }

    public void record(Outcome outcome) {
        battles++;
        switch (outcome) {
            case WIN -> wins++;
            case LOSS -> losses++;
            case DRAW -> draws++;
        }
    }

    public int getBattles() { return battles; }
    public int getWins() { return wins; }
    public int getLosses() { return losses; }
    public int getDraws() { return draws; }

    public double winRate() {
        return WinRate.of(wins, battles);
    }

    public ModeStats copy() {
        return new ModeStats(battles, wins, losses, draws);
    }
}
