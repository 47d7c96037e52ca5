package com.ninesync.storage;

/**
 * Failure of the local mail store
 */
public class MailStoreException extends RuntimeException {

    public MailStoreException(String message) {
        super(message);
    }

    public MailStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
