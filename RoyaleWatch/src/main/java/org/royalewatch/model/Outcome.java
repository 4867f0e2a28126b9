package org.royalewatch.model;

public enum Outcome {
    WIN,
    LOSS,
    DRAW;

    public static Outcome fromCrowns(int own, int other) {
        if (own > other) return WIN;
        if (own < other) return LOSS;
        return DRAW;
    }
}
