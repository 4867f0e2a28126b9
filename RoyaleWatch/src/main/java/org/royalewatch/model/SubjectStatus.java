package org.royalewatch.model;

public enum SubjectStatus {
    ACTIVE,
    PAUSED
}
