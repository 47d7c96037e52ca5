package com.ninesync.client;

import com.ninesync.domain.AccountCredentials;
import com.ninesync.domain.Capability;
import com.ninesync.domain.CapabilitySet;
import com.ninesync.domain.ImapFolder;
import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.SearchCriteria;
import com.ninesync.imap.ImapCommands;
import com.ninesync.imap.ImapConnection;
import com.ninesync.imap.ImapException;
import com.ninesync.imap.ImapResponse;
import com.ninesync.imap.ImapResponseParser;
import com.ninesync.imap.ImapState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Request scoped IMAP API over one connection.
 *
 * <p>Every public command runs under the client's lock, so two callers never
 * interleave on the socket. {@link #withLock(ImapOperation)} groups several
 * commands (a SELECT followed by a FETCH) into one critical section.</p>
 */
@Slf4j
public class ImapClient {

    private static final Pattern EXPUNGE = Pattern.compile("^\\* (\\d+) EXPUNGE", Pattern.CASE_INSENSITIVE);

    /**
     * Unit of work executed while holding the client lock
     */
    @FunctionalInterface
    public interface ImapOperation<T> {
        T execute() throws ImapException;
    }

    private final ImapConnection connection;
    private final AccountCredentials credentials;
    private final TokenProvider tokenProvider;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ImapFolder> folderCache = new LinkedHashMap<>();
    private ImapFolder currentFolder;
    // Mode requested for currentFolder; a server may still answer SELECT with [READ-ONLY]
    private boolean examined;

    public ImapClient(ImapConnection connection, AccountCredentials credentials, TokenProvider tokenProvider) {
        this.connection = connection;
        this.credentials = credentials;
        this.tokenProvider = tokenProvider;
    }

    public String getAccountId() {
        return connection.getAccountId();
    }

    public <T> T withLock(ImapOperation<T> operation) throws ImapException {
        lock.lock();
        try {
            return operation.execute();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Connect, negotiate STARTTLS when configured, and load capabilities.
     * No-op when already connected.
     */
    public void connect() throws ImapException {
        withLock(() -> {
            if (connection.getState() != ImapState.DISCONNECTED) {
                if (connection.isOpen()) {
                    return null;
                }
                log.info("[{}] Connection was lost, reconnecting", getAccountId());
                connection.abort();
                currentFolder = null;
            }
            connection.connect();
            refreshCapabilities(List.of(connection.getGreeting()));

            if (connection.getAccount().isUseStartTls() && !connection.getSession().isTlsActive()) {
                if (!getCapabilities().has(Capability.STARTTLS)) {
                    connection.disconnect();
                    throw ImapException.notSupported("Server does not advertise STARTTLS");
                }
                connection.startTls();
                // Capabilities before TLS must be discarded (RFC 3501 §6.2.1)
                capability();
            }
            return null;
        });
    }

    /**
     * Authenticate with the account's credentials. No-op when already authenticated
     * (including PREAUTH greetings).
     */
    public void authenticate() throws ImapException {
        withLock(() -> {
            ImapState state = connection.getState();
            if (state.isAuthenticated()) {
                return null;
            }
            if (state != ImapState.CONNECTED) {
                throw ImapException.invalidState("Cannot authenticate in state " + state);
            }
            CapabilitySet caps = getCapabilities();
            ImapResponse response;
            try {
                response = credentials.isToken() ? authenticateToken(caps) : authenticatePassword(caps);
            } catch (ImapException e) {
                if (e.getKind() == ImapException.ErrorKind.SERVER_REFUSAL) {
                    throw ImapException.authentication("Authentication failed for "
                            + credentials.getUsername() + ": " + e.getMessage());
                }
                throw e;
            }
            connection.getSession().authenticated();
            log.info("[{}] Authenticated as {}", getAccountId(), credentials.getUsername());

            // Servers may change capabilities after login
            List<String> lines = new ArrayList<>(response.getUntagged());
            lines.add(response.getText());
            refreshCapabilities(lines);
            return null;
        });
    }

    private ImapResponse authenticateToken(CapabilitySet caps) throws ImapException {
        if (!caps.has(Capability.AUTH_XOAUTH2)) {
            throw ImapException.notSupported("Server does not advertise AUTH=XOAUTH2");
        }
        String token = tokenProvider.getAccessToken(credentials.getSecret());
        return connection.send(ImapCommands.authenticateXoauth2(credentials.getUsername(), token));
    }

    private ImapResponse authenticatePassword(CapabilitySet caps) throws ImapException {
        String user = credentials.getUsername();
        String password = credentials.getSecret();
        if (caps.has(Capability.AUTH_PLAIN)) {
            if (caps.has(Capability.SASL_IR)) {
                return connection.send(ImapCommands.authenticatePlain(user, password));
            }
            return connection.send("AUTHENTICATE PLAIN", ImapCommands.plainBlob(user, password));
        }
        if (caps.has(Capability.LOGINDISABLED)) {
            throw ImapException.authentication("LOGIN is disabled and no supported SASL mechanism is advertised");
        }
        return connection.send(ImapCommands.login(user, password));
    }

    /**
     * LOGOUT and close; the client can connect again afterwards
     */
    public void disconnect() {
        lock.lock();
        try {
            connection.disconnect();
            currentFolder = null;
        } finally {
            lock.unlock();
        }
    }

    public boolean isConnected() {
        return connection.isOpen();
    }

    public boolean isAuthenticated() {
        return connection.isOpen() && connection.getState().isAuthenticated();
    }

    public ImapState getState() {
        return connection.getState();
    }

    public ImapConnection getConnection() {
        return connection;
    }

    // ---------------------------------------------------------------- capabilities

    /**
     * Explicit CAPABILITY query; refreshes the cache
     */
    public CapabilitySet capability() throws ImapException {
        return withLock(() -> {
            ImapResponse response = connection.send(ImapCommands.capability());
            CapabilitySet caps = ImapResponseParser.parseCapabilities(response.getUntagged());
            connection.getSession().setCapabilities(caps);
            return getCapabilities();
        });
    }

    public CapabilitySet getCapabilities() {
        return connection.getSession().getCapabilities();
    }

    public boolean hasCapability(Capability capability) {
        return getCapabilities().has(capability);
    }

    private void refreshCapabilities(List<String> lines) throws ImapException {
        CapabilitySet caps = ImapResponseParser.parseCapabilities(lines);
        if (caps != null) {
            connection.getSession().setCapabilities(caps);
        } else {
            capability();
        }
        log.debug("[{}] Capabilities: {}", getAccountId(), getCapabilities());
    }

    // ---------------------------------------------------------------- folders

    public List<ImapFolder> listFolders(String reference, String pattern) throws ImapException {
        return withLock(() -> {
            requireAuthenticated();
            ImapResponse response = connection.send(ImapCommands.list(reference, pattern));
            List<ImapFolder> folders = ImapResponseParser.parseFolders(response.getUntagged());
            for (ImapFolder folder : folders) {
                folderCache.put(folder.getFullName(), folder);
            }
            return folders;
        });
    }

    public List<ImapFolder> listFolders() throws ImapException {
        return listFolders("", "*");
    }

    public List<ImapFolder> listSubscribed(String reference, String pattern) throws ImapException {
        return withLock(() -> {
            requireAuthenticated();
            ImapResponse response = connection.send(ImapCommands.lsub(reference, pattern));
            return ImapResponseParser.parseFolders(response.getUntagged());
        });
    }

    public ImapFolder selectFolder(String folder) throws ImapException {
        return open(folder, false);
    }

    public ImapFolder examineFolder(String folder) throws ImapException {
        return open(folder, true);
    }

    /**
     * Select the folder unless it is already selected
     */
    public ImapFolder ensureSelected(String folder) throws ImapException {
        return withLock(() -> {
            if (connection.getSession().isSelected(folder) && !examined && currentFolder != null) {
                return currentFolder;
            }
            return selectFolder(folder);
        });
    }

    private ImapFolder open(String folder, boolean readOnly) throws ImapException {
        return withLock(() -> {
            requireAuthenticated();
            ImapResponse response;
            try {
                response = connection.send(readOnly ? ImapCommands.examine(folder) : ImapCommands.select(folder));
            } catch (ImapException e) {
                // A failed SELECT leaves no folder selected (RFC 3501 §6.3.1)
                connection.getSession().closeMailbox();
                currentFolder = null;
                throw mapNotFound(e, folder);
            }
            ImapFolder info = ImapResponseParser.parseSelect(folder, response.getUntagged(), response.getText());
            ImapFolder listed = folderCache.get(folder);
            if (listed != null) {
                info.setName(listed.getName());
                info.setDelimiter(listed.getDelimiter());
                info.setAttributes(listed.getAttributes());
            }
            info.setReadOnly(info.isReadOnly() || readOnly);
            connection.getSession().selectMailbox(folder, info.isReadOnly());
            currentFolder = info;
            examined = readOnly;
            log.debug("[{}] {} {} (exists={}, uidValidity={})", getAccountId(),
                    readOnly ? "Examined" : "Selected", folder, info.getExists(), info.getUidValidity());
            return info;
        });
    }

    public ImapFolder status(String folder, String... items) throws ImapException {
        return withLock(() -> {
            requireAuthenticated();
            String[] requested = items.length > 0 ? items
                    : new String[]{"MESSAGES", "RECENT", "UIDNEXT", "UIDVALIDITY", "UNSEEN"};
            ImapResponse response;
            try {
                response = connection.send(ImapCommands.status(folder, requested));
            } catch (ImapException e) {
                throw mapNotFound(e, folder);
            }
            List<String> lines = response.untaggedWith("STATUS");
            if (lines.isEmpty()) {
                throw ImapException.protocol("STATUS returned no data for " + folder);
            }
            return ImapResponseParser.parseStatus(lines.get(0));
        });
    }

    public void createFolder(String folder) throws ImapException {
        simple(ImapCommands.create(folder), folder);
        log.info("[{}] Created folder {}", getAccountId(), folder);
    }

    public void deleteFolder(String folder) throws ImapException {
        withLock(() -> {
            if (connection.getSession().isSelected(folder)) {
                connection.getSession().closeMailbox();
                currentFolder = null;
            }
            simple(ImapCommands.delete(folder), folder);
            folderCache.remove(folder);
            return null;
        });
        log.info("[{}] Deleted folder {}", getAccountId(), folder);
    }

    public void renameFolder(String from, String to) throws ImapException {
        withLock(() -> {
            simple(ImapCommands.rename(from, to), from);
            folderCache.remove(from);
            return null;
        });
    }

    public void subscribe(String folder) throws ImapException {
        simple(ImapCommands.subscribe(folder), folder);
    }

    public void unsubscribe(String folder) throws ImapException {
        simple(ImapCommands.unsubscribe(folder), folder);
    }

    public ImapFolder getCurrentFolder() {
        return currentFolder;
    }

    public String getSelectedFolder() {
        return connection.getSession().getSelectedFolder();
    }

    // ---------------------------------------------------------------- messages

    public List<ImapMessage> fetch(String sequenceSet, String items) throws ImapException {
        return withLock(() -> {
            requireSelected();
            ImapResponse response = connection.send(ImapCommands.fetch(sequenceSet, items));
            return ImapResponseParser.parseFetch(response.getUntagged());
        });
    }

    public List<ImapMessage> uidFetch(String uidSet, String items) throws ImapException {
        return withLock(() -> {
            requireSelected();
            ImapResponse response = connection.send(ImapCommands.uidFetch(uidSet, items));
            return ImapResponseParser.parseFetch(response.getUntagged());
        });
    }

    public List<Long> search(SearchCriteria criteria) throws ImapException {
        return withLock(() -> {
            requireSelected();
            return ImapResponseParser.parseSearch(connection.send(ImapCommands.search(criteria)).getUntagged());
        });
    }

    public List<Long> uidSearch(SearchCriteria criteria) throws ImapException {
        return withLock(() -> {
            requireSelected();
            return ImapResponseParser.parseSearch(connection.send(ImapCommands.uidSearch(criteria)).getUntagged());
        });
    }

    public List<ImapMessage> store(String sequenceSet, ImapCommands.StoreAction action, Collection<String> flags)
            throws ImapException {
        return withLock(() -> {
            requireWritable();
            ImapResponse response = connection.send(ImapCommands.store(sequenceSet, action, flags));
            return ImapResponseParser.parseFetch(response.getUntagged());
        });
    }

    public List<ImapMessage> uidStore(String uidSet, ImapCommands.StoreAction action, Collection<String> flags)
            throws ImapException {
        return withLock(() -> {
            requireWritable();
            ImapResponse response = connection.send(ImapCommands.uidStore(uidSet, action, flags));
            return ImapResponseParser.parseFetch(response.getUntagged());
        });
    }

    public void copy(String sequenceSet, String destination) throws ImapException {
        withLock(() -> {
            requireSelected();
            connection.send(ImapCommands.copy(sequenceSet, destination));
            return null;
        });
    }

    public void uidCopy(String uidSet, String destination) throws ImapException {
        withLock(() -> {
            requireSelected();
            connection.send(ImapCommands.uidCopy(uidSet, destination));
            return null;
        });
    }

    public void move(String sequenceSet, String destination) throws ImapException {
        withLock(() -> {
            requireMove();
            connection.send(ImapCommands.move(sequenceSet, destination));
            return null;
        });
    }

    public void uidMove(String uidSet, String destination) throws ImapException {
        withLock(() -> {
            requireMove();
            connection.send(ImapCommands.uidMove(uidSet, destination));
            return null;
        });
    }

    /**
     * EXPUNGE; returns the sequence numbers reported as expunged
     */
    public List<Long> expunge() throws ImapException {
        return withLock(() -> {
            requireWritable();
            ImapResponse response = connection.send(ImapCommands.expunge());
            List<Long> expunged = new ArrayList<>();
            for (String line : response.getUntagged()) {
                Matcher m = EXPUNGE.matcher(line);
                if (m.find()) {
                    expunged.add(Long.parseLong(m.group(1)));
                }
            }
            return expunged;
        });
    }

    /**
     * NOOP; returns any untagged updates the server flushed
     */
    public List<String> noop() throws ImapException {
        return withLock(() -> connection.send(ImapCommands.noop()).getUntagged());
    }

    // ---------------------------------------------------------------- guards

    private void simple(String command, String folder) throws ImapException {
        withLock(() -> {
            requireAuthenticated();
            try {
                connection.send(command);
            } catch (ImapException e) {
                throw mapNotFound(e, folder);
            }
            return null;
        });
    }

    private void requireAuthenticated() throws ImapException {
        if (!connection.getState().isAuthenticated()) {
            throw ImapException.invalidState("Not authenticated (" + connection.getState() + ")");
        }
    }

    private void requireSelected() throws ImapException {
        if (connection.getState() != ImapState.SELECTED) {
            throw ImapException.invalidState("No folder selected");
        }
    }

    private void requireWritable() throws ImapException {
        requireSelected();
        if (connection.getSession().isReadOnly()) {
            throw ImapException.invalidState("Folder " + getSelectedFolder() + " is opened read-only");
        }
    }

    private void requireMove() throws ImapException {
        requireSelected();
        if (!hasCapability(Capability.MOVE)) {
            throw ImapException.notSupported("Server does not advertise MOVE");
        }
    }

    /**
     * NO [NONEXISTENT] (RFC 5530) or a "does not exist" text means the folder is absent
     */
    private static ImapException mapNotFound(ImapException e, String folder) {
        if (e.getKind() != ImapException.ErrorKind.SERVER_REFUSAL) {
            return e;
        }
        String text = e.getMessage() == null ? "" : e.getMessage();
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.contains("[NONEXISTENT]") || upper.contains("NOT EXIST") || upper.contains("NO SUCH")
                || upper.contains("DOESN'T EXIST")) {
            return ImapException.notFound("Folder not found: " + folder);
        }
        return e;
    }
}
