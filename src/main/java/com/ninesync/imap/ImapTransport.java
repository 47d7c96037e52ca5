package com.ninesync.imap;

import java.time.Duration;

/**
 * Line oriented byte pipe to one IMAP server.
 * A response line that announced a literal ({n}) is delivered together with
 * the literal text as one logical line.
 */
public interface ImapTransport {

    /**
     * Write one line; CRLF is appended
     */
    void writeLine(String line) throws ImapException;

    /**
     * Next logical response line.
     *
     * @throws ImapException TIMEOUT when nothing arrives in time,
     *                       CONNECTION when the peer closed the socket
     */
    String readLine(Duration timeout) throws ImapException;

    /**
     * Upgrade the open socket to TLS after a successful STARTTLS
     */
    void startTls() throws ImapException;

    boolean isTlsActive();

    boolean isOpen();

    void close();
}
