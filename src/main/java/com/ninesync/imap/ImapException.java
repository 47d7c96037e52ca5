package com.ninesync.imap;

import lombok.Getter;

/**
 * Failure raised by the IMAP connection, codec and client layers.
 * The {@link ErrorKind} tells callers whether reconnecting or retrying can help.
 */
@Getter
public class ImapException extends Exception {

    public enum ErrorKind {
        /** Socket, DNS or TLS failure - recoverable by reconnecting */
        CONNECTION(true),
        /** Bad credentials or unsupported mechanism */
        AUTHENTICATION(false),
        /** Malformed command or response */
        PROTOCOL(false),
        /** Explicit NO from the server - may be transient */
        SERVER_REFUSAL(true),
        /** Read, connect or authentication deadline expired */
        TIMEOUT(true),
        /** Capability absent on the server */
        NOT_SUPPORTED(false),
        /** Folder or message absent */
        NOT_FOUND(false),
        /** Command issued in the wrong connection phase */
        INVALID_STATE(true);

        private final boolean recoverable;

        ErrorKind(boolean recoverable) {
            this.recoverable = recoverable;
        }
    }

    private final ErrorKind kind;

    public ImapException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ImapException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRecoverable() {
        return kind.recoverable;
    }

    public static ImapException connection(String message) {
        return new ImapException(ErrorKind.CONNECTION, message);
    }

    public static ImapException connection(String message, Throwable cause) {
        return new ImapException(ErrorKind.CONNECTION, message, cause);
    }

    public static ImapException authentication(String message) {
        return new ImapException(ErrorKind.AUTHENTICATION, message);
    }

    public static ImapException protocol(String message) {
        return new ImapException(ErrorKind.PROTOCOL, message);
    }

    public static ImapException serverRefusal(String message) {
        return new ImapException(ErrorKind.SERVER_REFUSAL, message);
    }

    public static ImapException timeout(String message) {
        return new ImapException(ErrorKind.TIMEOUT, message);
    }

    public static ImapException notSupported(String message) {
        return new ImapException(ErrorKind.NOT_SUPPORTED, message);
    }

    public static ImapException notFound(String message) {
        return new ImapException(ErrorKind.NOT_FOUND, message);
    }

    public static ImapException invalidState(String message) {
        return new ImapException(ErrorKind.INVALID_STATE, message);
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
