package org.royalewatch.model;

public record PlayerProfile(
        String tag,
        String name,
        String arena,
        int trophies
) {}
