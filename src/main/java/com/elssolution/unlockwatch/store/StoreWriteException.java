package com.elssolution.unlockwatch.store;

/** The state file could not be replaced; the previous file is left as it was. */
public class StoreWriteException extends RuntimeException {
    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
