package org.royalewatch.model;

public final class WinRate {

    private WinRate() {
    }

    /** wins / battles, 0 when no battle was played. */
    public static double of(int wins, int battles) {
        return battles == 0 ? 0.0 : (double) wins / battles;
    }

    /** Percentage rounded to one decimal, as shown to users. */
    public static double percent(int wins, int battles) {
        return Math.round(of(wins, battles) * 1000.0) / 10.0;
    }
}
