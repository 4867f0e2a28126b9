package org.royalewatch.store;

/**
 * The store could not read or write a subject's state. Nothing of the failed operation is visible.
 */
public class StateStoreException extends Exception {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
