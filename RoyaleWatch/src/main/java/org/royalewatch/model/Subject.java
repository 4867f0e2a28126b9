package org.royalewatch.model;

import java.time.Instant;
import java.util.Locale;

/**
 * A monitored player. The tag is always stored normalized, see {@link #normalizeTag(String)}.
 */
public record Subject(
        String tag,
        String name,
        SubjectStatus status,
        Instant createdAt,
        String lastArena
) {

    public static Subject create(String tag, String name, Instant now) {
        return new Subject(normalizeTag(tag), name, SubjectStatus.ACTIVE, now, null);
    }

    public boolean isActive() {
        return status == SubjectStatus.ACTIVE;
    }

    public Subject withStatus(SubjectStatus newStatus) {
        return new Subject(tag, name, newStatus, createdAt, lastArena);
    }

    public Subject withProfile(String newName, String newArena) {
        return new Subject(tag, newName != null ? newName : name, status, createdAt, newArena != null ? newArena : lastArena);
    }

    /**
     * Strips every '#', surrounding blanks, and upper-cases the tag.
     * Tags are made of letters and digits only.
     *
     * @throws IllegalArgumentException if nothing usable remains
     */
    public static String normalizeTag(String rawTag) {
        if (rawTag == null) throw new IllegalArgumentException("Tag is missing");
        String clean = rawTag.replace("#", "").trim().toUpperCase(Locale.ROOT);
        if (clean.isEmpty() || !clean.chars().allMatch(Character::isLetterOrDigit)) {
            throw new IllegalArgumentException("Invalid player tag: " + rawTag);
        }
        return clean;
    }

    /** Display form used by the API and in messages. */
    public static String displayTag(String normalizedTag) {
        return "#" + normalizedTag;
    }
}
