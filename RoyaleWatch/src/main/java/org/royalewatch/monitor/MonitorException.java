package org.royalewatch.monitor;

import org.royalewatch.model.Subject;

/**
 * Error returned to a command caller. Always names the subject and a stable kind, never a raw
 * transport error.
 */
public class MonitorException extends RuntimeException {

    public enum Kind {
        INVALID_TAG,
        ALREADY_MONITORED,
        PROFILE_NOT_FOUND,
        NOT_MONITORED,
        OPPONENT_NOT_FOUND,
        UNAVAILABLE
    }

    private final Kind kind;
    private final String subjectTag;

    public MonitorException(Kind kind, String subjectTag, String message) {
        this(kind, subjectTag, message, null);
    }

    public MonitorException(Kind kind, String subjectTag, String message, Throwable cause) {
        super(kind + " [" + Subject.displayTag(subjectTag) + "] " + message, cause);
        this.kind = kind;
        this.subjectTag = subjectTag;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSubjectTag() {
        return subjectTag;
    }
}
