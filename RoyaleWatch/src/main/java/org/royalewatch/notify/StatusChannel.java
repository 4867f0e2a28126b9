package org.royalewatch.notify;

/**
 * Where status messages live. Implementations report failures through their return values.
 */
public interface StatusChannel {

    /** Posts and pins a new message. Returns its id, or null when nothing was posted. */
    String post(String text);

    /** Replaces the text of a posted message. False when the message no longer exists. */
    boolean edit(String messageId, String text);
}
