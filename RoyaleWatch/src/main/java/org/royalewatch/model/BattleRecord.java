package org.royalewatch.model;

import java.time.Instant;
import java.util.List;
import java.util.OptionalInt;

/**
 * Canonical form of one played match, seen from the monitored subject.
 * Crown and trophy fields are null when the API did not send them.
 */
public record BattleRecord(
        String id,
        Instant timestamp,
        String mode,
        String rawMode,
        String type,
        String arena,
        List<String> deck,
        Opponent opponent,
        Outcome outcome,
        Integer crowns,
        Integer opponentCrowns,
        Integer trophyChange
) {

    public BattleRecord {
        deck = deck == null ? List.of() : List.copyOf(deck);
    }

    public OptionalInt crownDifferential() {
        if (crowns == null || opponentCrowns == null) return OptionalInt.empty();
        return OptionalInt.of(crowns - opponentCrowns);
    }

    public record Opponent(
            String tag,
            String name,
            List<String> deck,
            Integer startingTrophies
    ) {
        /** Opponent key used when the log does not identify the opponent. */
        public static final String UNKNOWN_TAG = "?";

        public Opponent {
            tag = (tag == null || tag.isBlank()) ? UNKNOWN_TAG : tag;
            deck = deck == null ? List.of() : List.copyOf(deck);
        }

        public boolean isKnown() {
            return !UNKNOWN_TAG.equals(tag);
        }
    }
}
