package com.ninesync.imap;

import com.ninesync.config.SyncProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One IMAP connection: tagging, the greeting, and the command/response exchange.
 *
 * <p>The connection never retries. A read timeout surfaces as a TIMEOUT error
 * and leaves the state untouched; the caller decides whether to reconnect.
 * Not thread safe: callers serialize access (the client holds a lock).</p>
 */
@Slf4j
public class ImapConnection {

    private final String accountId;
    private final SyncProperties.Account account;
    private final ImapTransportFactory transportFactory;
    @Getter
    private final ImapSession session = new ImapSession();

    private ImapTransport transport;
    private int tagCounter = 0;
    @Getter
    private String greeting;
    private Duration readTimeout;

    public ImapConnection(String accountId, SyncProperties.Account account, ImapTransportFactory transportFactory) {
        this.accountId = accountId;
        this.account = account;
        this.transportFactory = transportFactory;
        this.readTimeout = Duration.ofSeconds(account.getTimeoutSeconds());
    }

    public String getAccountId() {
        return accountId;
    }

    public SyncProperties.Account getAccount() {
        return account;
    }

    public ImapState getState() {
        return session.getState();
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public boolean isOpen() {
        return transport != null && transport.isOpen() && session.getState() != ImapState.DISCONNECTED;
    }

    /**
     * Open the socket and read the greeting.
     * {@code * OK} leads to CONNECTED, {@code * PREAUTH} to AUTHENTICATED.
     */
    public void connect() throws ImapException {
        if (session.getState() != ImapState.DISCONNECTED) {
            throw ImapException.invalidState("Already connected (" + session.getState() + ")");
        }
        log.info("[{}] Connecting to {}:{}", accountId, account.getHost(), account.getPort());
        ImapTransport opened = transportFactory.open(account);
        try {
            String line = opened.readLine(readTimeout);
            log.debug("IMAP << {}", line);
            String upper = line.toUpperCase(Locale.ROOT);
            boolean preAuth;
            if (upper.startsWith("* OK")) {
                preAuth = false;
            } else if (upper.startsWith("* PREAUTH")) {
                preAuth = true;
            } else {
                throw ImapException.protocol("Unexpected greeting: " + line);
            }
            this.transport = opened;
            this.greeting = line;
            this.tagCounter = 0;
            session.connected(preAuth);
            session.setTlsActive(opened.isTlsActive());
            log.info("[{}] Connected ({})", accountId, session.getState());
        } catch (ImapException e) {
            opened.close();
            throw e;
        }
    }

    /**
     * Send one tagged command and collect its response
     */
    public ImapResponse send(String command) throws ImapException {
        return send(command, null);
    }

    /**
     * Send one tagged command. A continuation request ({@code +}) is answered with
     * {@code continuation} once; any further request, or one without a prepared
     * answer, is answered with an empty line, which cancels SASL exchanges.
     */
    public ImapResponse send(String command, String continuation) throws ImapException {
        ensureOpen();
        String tag = nextTag();
        write(tag + " " + command);

        List<String> untagged = new ArrayList<>();
        boolean continued = false;
        while (true) {
            String line = transport.readLine(readTimeout);
            log.debug("IMAP << {}", line);
            if (line.startsWith("+")) {
                if (continuation != null && !continued) {
                    continued = true;
                    write(continuation, true);
                } else {
                    write("", true);
                }
                continue;
            }
            ImapResponse response = ImapResponse.completion(tag, line, untagged);
            if (response == null) {
                untagged.add(line);
                continue;
            }
            return switch (response.getStatus()) {
                case OK -> response;
                case NO -> throw ImapException.serverRefusal(response.getText());
                case BAD -> throw ImapException.protocol("Command rejected: " + response.getText());
            };
        }
    }

    /**
     * Upgrade to TLS (STARTTLS, RFC 3501 §6.2.1)
     */
    public void startTls() throws ImapException {
        if (session.getState() != ImapState.CONNECTED) {
            throw ImapException.invalidState("STARTTLS only allowed before authentication");
        }
        send(ImapCommands.starttls());
        transport.startTls();
        session.setTlsActive(true);
        log.info("[{}] TLS negotiated via STARTTLS", accountId);
    }

    /**
     * Issue IDLE and wait for the continuation.
     *
     * @param untaggedSink receives untagged lines that arrive before the continuation
     * @return the tag of the IDLE command, completed after DONE
     */
    public String beginIdle(List<String> untaggedSink) throws ImapException {
        ensureOpen();
        if (session.getState() != ImapState.SELECTED) {
            throw ImapException.invalidState("IDLE requires a selected folder");
        }
        String tag = nextTag();
        write(tag + " " + ImapCommands.idle());
        List<String> untagged = new ArrayList<>();
        while (true) {
            String line = transport.readLine(readTimeout);
            log.debug("IMAP << {}", line);
            if (line.startsWith("+")) {
                untaggedSink.addAll(untagged);
                return tag;
            }
            ImapResponse response = ImapResponse.completion(tag, line, untagged);
            if (response != null) {
                if (response.getStatus() == ImapResponse.Status.BAD) {
                    throw ImapException.protocol("IDLE rejected: " + response.getText());
                }
                throw ImapException.serverRefusal("IDLE refused: " + response.getText());
            }
            untagged.add(line);
        }
    }

    /**
     * Terminate IDLE. The tagged completion is read by whoever is reading the connection.
     */
    public void sendDone() throws ImapException {
        ensureOpen();
        write(ImapCommands.done());
    }

    /**
     * Raw read used while idling
     */
    public String readLine(Duration timeout) throws ImapException {
        ensureOpen();
        String line = transport.readLine(timeout);
        log.debug("IMAP << {}", line);
        return line;
    }

    /**
     * LOGOUT best effort, then close. The state always ends DISCONNECTED.
     */
    public void disconnect() {
        try {
            if (isOpen()) {
                send(ImapCommands.logout());
            }
        } catch (ImapException e) {
            log.debug("[{}] LOGOUT failed: {}", accountId, e.getMessage());
        } finally {
            if (transport != null) {
                transport.close();
            }
            transport = null;
            session.disconnected();
            log.info("[{}] Disconnected", accountId);
        }
    }

    /**
     * Drop the socket without LOGOUT (used after the connection is known to be dead)
     */
    public void abort() {
        if (transport != null) {
            transport.close();
        }
        transport = null;
        session.disconnected();
    }

    /**
     * A000N, incremented before use
     */
    String nextTag() {
        tagCounter++;
        return String.format("A%04d", tagCounter);
    }

    private void ensureOpen() throws ImapException {
        if (transport == null || session.getState() == ImapState.DISCONNECTED) {
            throw ImapException.invalidState("Not connected");
        }
    }

    private void write(String line) throws ImapException {
        write(line, false);
    }

    private void write(String line, boolean sensitive) throws ImapException {
        if (log.isDebugEnabled()) {
            log.debug("IMAP >> {}", sensitive ? "***" : maskCredentials(line));
        }
        transport.writeLine(line);
    }

    /**
     * Hide LOGIN and AUTHENTICATE arguments in wire logs
     */
    static String maskCredentials(String line) {
        String[] parts = line.split(" ", 3);
        if (parts.length < 2) {
            return line;
        }
        String verb = parts[1].toUpperCase(Locale.ROOT);
        if ("LOGIN".equals(verb)) {
            return parts[0] + " LOGIN ***";
        }
        if ("AUTHENTICATE".equals(verb) && parts.length == 3) {
            int space = parts[2].indexOf(' ');
            String mechanism = space < 0 ? parts[2] : parts[2].substring(0, space);
            return parts[0] + " AUTHENTICATE " + mechanism + (space < 0 ? "" : " ***");
        }
        return line;
    }
}
