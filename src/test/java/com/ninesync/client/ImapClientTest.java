package com.ninesync.client;

import com.ninesync.config.SyncProperties;
import com.ninesync.domain.AccountCredentials;
import com.ninesync.domain.Capability;
import com.ninesync.domain.ImapFolder;
import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.SearchCriteria;
import com.ninesync.imap.ImapCommands;
import com.ninesync.imap.ImapConnection;
import com.ninesync.imap.ImapException;
import com.ninesync.imap.ImapState;
import com.ninesync.support.FakeImapServer;
import com.ninesync.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ImapClient tests against the in-memory server
 */
class ImapClientTest {

    private FakeImapServer server;
    private SyncProperties.Account account;

    @BeforeEach
    void setUp() {
        server = new FakeImapServer();
        account = TestAccounts.account();
        server.folder("INBOX").add("Hello", "First message");
        server.folder("INBOX").add("Again", "Second message", "\\Seen");
    }

    private ImapClient client() {
        return client(AccountCredentials.password(TestAccounts.USERNAME, TestAccounts.PASSWORD));
    }

    private ImapClient client(AccountCredentials credentials) {
        TokenProvider tokens = reference -> "token-123";
        return new ImapClient(new ImapConnection("acme", account, server), credentials, tokens);
    }

    private ImapClient authenticated() throws ImapException {
        ImapClient client = client();
        client.connect();
        client.authenticate();
        return client;
    }

    private static ImapException.ErrorKind kindOf(Throwable e) {
        return ((ImapException) e).getKind();
    }

    @Test
    @DisplayName("SASL-IR servers get AUTHENTICATE PLAIN with an initial response")
    void testAuthenticatePlainWithInitialResponse() throws Exception {
        ImapClient client = authenticated();

        assertThat(client.isAuthenticated()).isTrue();
        assertThat(server.count("AUTHENTICATE")).isEqualTo(1);
        assertThat(server.count("LOGIN")).isZero();
        assertThat(server.getCommandLog()).noneMatch(c -> c.equals("AUTHENTICATE PLAIN"));
    }

    @Test
    @DisplayName("AUTH=PLAIN without SASL-IR answers the continuation")
    void testAuthenticatePlainWithContinuation() throws Exception {
        server.capabilities("IMAP4rev1 AUTH=PLAIN IDLE");

        ImapClient client = authenticated();

        assertThat(client.getState()).isEqualTo(ImapState.AUTHENTICATED);
        assertThat(server.getCommandLog()).contains("AUTHENTICATE PLAIN");
    }

    @Test
    @DisplayName("Without AUTH=PLAIN the client falls back to LOGIN")
    void testLoginFallback() throws Exception {
        server.capabilities("IMAP4rev1 IDLE");

        authenticated();

        assertThat(server.count("LOGIN")).isEqualTo(1);
        assertThat(server.count("AUTHENTICATE")).isZero();
    }

    @Test
    @DisplayName("LOGINDISABLED without a SASL mechanism fails authentication")
    void testLoginDisabled() throws Exception {
        server.capabilities("IMAP4rev1 LOGINDISABLED");
        ImapClient client = client();
        client.connect();

        assertThatThrownBy(client::authenticate)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.AUTHENTICATION));
        assertThat(server.count("LOGIN")).isZero();
    }

    @Test
    @DisplayName("Rejected credentials are an AUTHENTICATION error")
    void testWrongPassword() throws Exception {
        ImapClient client = client(AccountCredentials.password(TestAccounts.USERNAME, "wrong"));
        client.connect();

        assertThatThrownBy(client::authenticate)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.AUTHENTICATION));
        assertThat(client.isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("XOAUTH2 with a token from the provider")
    void testXoauth2() throws Exception {
        server.capabilities("IMAP4rev1 AUTH=XOAUTH2 IDLE");
        ImapClient client = client(AccountCredentials.token(TestAccounts.USERNAME, "acme-token"));
        client.connect();

        client.authenticate();

        assertThat(client.isAuthenticated()).isTrue();
        assertThat(server.getCommandLog()).anyMatch(c -> c.startsWith("AUTHENTICATE XOAUTH2 "));
    }

    @Test
    @DisplayName("XOAUTH2 without the capability is NOT_SUPPORTED")
    void testXoauth2NotAdvertised() throws Exception {
        ImapClient client = client(AccountCredentials.token(TestAccounts.USERNAME, "acme-token"));
        client.connect();

        assertThatThrownBy(client::authenticate)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_SUPPORTED));
        assertThat(server.count("AUTHENTICATE")).isZero();
    }

    @Test
    @DisplayName("STARTTLS upgrades and reloads capabilities")
    void testStartTls() throws Exception {
        server.capabilities("IMAP4rev1 STARTTLS AUTH=PLAIN SASL-IR");
        account.setUseStartTls(true);
        ImapClient client = client();

        client.connect();

        assertThat(client.getConnection().getSession().isTlsActive()).isTrue();
        assertThat(server.count("STARTTLS")).isEqualTo(1);
        assertThat(server.count("CAPABILITY")).isEqualTo(1);
    }

    @Test
    @DisplayName("STARTTLS required but not advertised")
    void testStartTlsNotAdvertised() {
        account.setUseStartTls(true);
        ImapClient client = client();

        assertThatThrownBy(client::connect)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_SUPPORTED));
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    @DisplayName("PREAUTH makes authenticate a no-op")
    void testPreAuth() throws Exception {
        server.preAuth(true);

        authenticated();

        assertThat(server.count("LOGIN") + server.count("AUTHENTICATE")).isZero();
    }

    @Test
    @DisplayName("Capabilities come from the greeting without an extra round trip")
    void testCapabilitiesFromGreeting() throws Exception {
        ImapClient client = authenticated();

        assertThat(client.hasCapability(Capability.IDLE)).isTrue();
        assertThat(client.hasCapability(Capability.CONDSTORE)).isFalse();
        assertThat(server.count("CAPABILITY")).isZero();
    }

    @Test
    @DisplayName("LIST and SELECT")
    void testListAndSelect() throws Exception {
        server.folder("Archive");
        ImapClient client = authenticated();

        List<ImapFolder> folders = client.listFolders();
        ImapFolder inbox = client.selectFolder("INBOX");

        assertThat(folders).extracting(ImapFolder::getFullName).containsExactly("INBOX", "Archive");
        assertThat(inbox.getExists()).isEqualTo(2L);
        assertThat(inbox.getUidValidity()).isEqualTo(1L);
        assertThat(inbox.getUidNext()).isEqualTo(3L);
        assertThat(inbox.getDelimiter()).isEqualTo("/");
        assertThat(client.getState()).isEqualTo(ImapState.SELECTED);
        assertThat(client.getSelectedFolder()).isEqualTo("INBOX");
    }

    @Test
    @DisplayName("SELECT of a missing folder is NOT_FOUND and leaves nothing selected")
    void testSelectMissing() throws Exception {
        ImapClient client = authenticated();
        client.selectFolder("INBOX");

        assertThatThrownBy(() -> client.selectFolder("Nope"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_FOUND));
        assertThat(client.getState()).isEqualTo(ImapState.AUTHENTICATED);
        assertThat(client.getSelectedFolder()).isNull();
    }

    @Test
    @DisplayName("ensureSelected does not re-select the current folder")
    void testEnsureSelected() throws Exception {
        ImapClient client = authenticated();
        client.selectFolder("INBOX");

        client.ensureSelected("INBOX");

        assertThat(server.count("SELECT")).isEqualTo(1);
    }

    @Test
    @DisplayName("ensureSelected keeps a folder the server selected read-only")
    void testEnsureSelectedReadOnlyServer() throws Exception {
        server.readOnlySelect(true);
        ImapClient client = authenticated();

        client.ensureSelected("INBOX");
        ImapFolder folder = client.ensureSelected("INBOX");

        assertThat(folder.isReadOnly()).isTrue();
        assertThat(server.count("SELECT")).isEqualTo(1);
    }

    @Test
    @DisplayName("ensureSelected upgrades an examined folder with SELECT")
    void testEnsureSelectedAfterExamine() throws Exception {
        ImapClient client = authenticated();
        client.examineFolder("INBOX");

        client.ensureSelected("INBOX");
        client.ensureSelected("INBOX");

        assertThat(server.count("SELECT")).isEqualTo(1);
        assertThat(server.count("EXAMINE")).isEqualTo(1);
    }

    @Test
    @DisplayName("UID SEARCH and UID FETCH with body")
    void testSearchAndFetch() throws Exception {
        ImapClient client = authenticated();
        client.selectFolder("INBOX");

        List<Long> uids = client.uidSearch(SearchCriteria.all());
        List<ImapMessage> messages = client.uidFetch(ImapCommands.sequenceSet(uids), ImapCommands.FULL_ITEMS);

        assertThat(uids).containsExactly(1L, 2L);
        assertThat(messages).hasSize(2);
        assertThat(messages.get(1).getFlags()).containsExactly("\\Seen");
        assertThat(messages.get(0).getEnvelope().getSubject()).isEqualTo("Hello");
        assertThat(messages.get(0).getBody()).contains("First message");
    }

    @Test
    @DisplayName("STATUS does not change the selection")
    void testStatus() throws Exception {
        ImapClient client = authenticated();

        ImapFolder status = client.status("INBOX");

        assertThat(status.getExists()).isEqualTo(2L);
        assertThat(status.getUnseen()).isEqualTo(1L);
        assertThat(client.getState()).isEqualTo(ImapState.AUTHENTICATED);
    }

    @Test
    @DisplayName("Message commands need a selected folder")
    void testFetchWithoutSelect() throws Exception {
        ImapClient client = authenticated();

        assertThatThrownBy(() -> client.uidFetch("1", ImapCommands.HEADER_ITEMS))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.INVALID_STATE));
    }

    @Test
    @DisplayName("STORE on an EXAMINEd folder is rejected locally")
    void testStoreReadOnly() throws Exception {
        ImapClient client = authenticated();
        client.examineFolder("INBOX");

        assertThatThrownBy(() -> client.uidStore("1", ImapCommands.StoreAction.ADD, List.of("\\Seen")))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.INVALID_STATE));
        assertThat(server.count("UID STORE")).isZero();
    }

    @Test
    @DisplayName("MOVE without the capability is NOT_SUPPORTED")
    void testMoveNotSupported() throws Exception {
        server.capabilities("IMAP4rev1 AUTH=PLAIN SASL-IR");
        ImapClient client = authenticated();
        client.selectFolder("INBOX");

        assertThatThrownBy(() -> client.uidMove("1", "Archive"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_SUPPORTED));
        assertThat(server.count("UID MOVE")).isZero();
    }

    @Test
    @DisplayName("Delete of a missing folder is NOT_FOUND")
    void testDeleteMissingFolder() throws Exception {
        ImapClient client = authenticated();

        assertThatThrownBy(() -> client.deleteFolder("Ghost"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("connect after a dropped socket opens a new connection")
    void testReconnectAfterDrop() throws Exception {
        ImapClient client = authenticated();
        server.lastSession().drop();
        assertThat(client.isConnected()).isFalse();

        client.connect();
        client.authenticate();

        assertThat(server.getSessions()).hasSize(2);
        assertThat(client.isAuthenticated()).isTrue();
    }

    @Test
    @DisplayName("disconnect then connect again")
    void testDisconnect() throws Exception {
        ImapClient client = authenticated();

        client.disconnect();
        assertThat(client.getState()).isEqualTo(ImapState.DISCONNECTED);

        client.connect();
        assertThat(client.getState()).isEqualTo(ImapState.CONNECTED);
    }
}
