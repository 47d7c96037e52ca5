package com.ninesync.client;

import com.ninesync.config.SyncProperties;
import com.ninesync.domain.Capability;
import com.ninesync.domain.CapabilitySet;
import com.ninesync.imap.ImapException;
import com.ninesync.support.FakeImapServer;
import com.ninesync.support.TestAccounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AccountManager pool tests
 */
class AccountManagerTest {

    private FakeImapServer server;
    private SyncProperties properties;
    private AccountManager accountManager;

    @BeforeEach
    void setUp() {
        server = new FakeImapServer();
        properties = TestAccounts.properties("a", "b", "c");
        properties.getPool().setMaxConnections(2);
        ImapClientFactory factory = new ImapClientFactory(properties, server, reference -> "token");
        accountManager = new AccountManager(factory, properties);
    }

    @AfterEach
    void tearDown() {
        accountManager.disconnectAll();
    }

    private static ImapException.ErrorKind kindOf(Throwable e) {
        return ((ImapException) e).getKind();
    }

    @Test
    @DisplayName("First use connects and authenticates; later uses reuse the client")
    void testGetClient() throws Exception {
        ImapClient first = accountManager.getClient("a");
        ImapClient second = accountManager.getClient("a");

        assertThat(first).isSameAs(second);
        assertThat(first.isAuthenticated()).isTrue();
        assertThat(server.getSessions()).hasSize(1);
        assertThat(accountManager.isPooled("a")).isTrue();
    }

    @Test
    @DisplayName("Least recently used client is evicted when the pool is full")
    void testLruEviction() throws Exception {
        ImapClient a = accountManager.getClient("a");
        ImapClient b = accountManager.getClient("b");
        accountManager.getClient("a");

        accountManager.getClient("c");

        assertThat(accountManager.isPooled("a")).isTrue();
        assertThat(accountManager.isPooled("b")).isFalse();
        assertThat(accountManager.isPooled("c")).isTrue();
        assertThat(b.isConnected()).isFalse();
        assertThat(a.isConnected()).isTrue();
        assertThat(server.count("LOGOUT")).isEqualTo(1);
        assertThat(accountManager.getStats().getActiveConnections()).isEqualTo(2);
    }

    @Test
    @DisplayName("A dropped pooled client is reconnected on the next use")
    void testReconnect() throws Exception {
        ImapClient client = accountManager.getClient("a");
        server.lastSession().drop();

        ImapClient again = accountManager.getClient("a");

        assertThat(again).isSameAs(client);
        assertThat(again.isAuthenticated()).isTrue();
        assertThat(server.getSessions()).hasSize(2);
    }

    @Test
    @DisplayName("Authentication slower than its deadline is a TIMEOUT")
    void testAuthTimeout() {
        properties.getPool().setAuthTimeoutSeconds(1);
        server.commandDelay(3000);

        assertThatThrownBy(() -> accountManager.getClient("a"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.TIMEOUT))
                .hasMessageContaining("Authentication for a timed out");
    }

    @Test
    @DisplayName("Authentication failure is reported as is")
    void testAuthFailure() {
        properties.getAccounts().get("a").setPassword("wrong");

        assertThatThrownBy(() -> accountManager.getClient("a"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.AUTHENTICATION));
    }

    @Test
    @DisplayName("Unknown account is NOT_FOUND")
    void testUnknownAccount() {
        assertThatThrownBy(() -> accountManager.getClient("zzz"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("Unknown account on a full pool leaves the pooled clients alone")
    void testUnknownAccountOnFullPool() throws Exception {
        properties.getPool().setMaxConnections(1);
        ImapClient a = accountManager.getClient("a");

        assertThatThrownBy(() -> accountManager.getClient("nope"))
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(ImapException.ErrorKind.NOT_FOUND));

        assertThat(accountManager.isPooled("a")).isTrue();
        assertThat(a.isConnected()).isTrue();
        assertThat(server.count("LOGOUT")).isZero();
        assertThat(accountManager.getClient("a")).isSameAs(a);
        assertThat(server.getSessions()).hasSize(1);
        assertThat(server.count("AUTHENTICATE")).isEqualTo(1);
    }

    @Test
    @DisplayName("testConnection uses a throwaway client")
    void testTestConnection() throws Exception {
        CapabilitySet caps = accountManager.testConnection("a");

        assertThat(caps.has(Capability.IDLE)).isTrue();
        assertThat(accountManager.isPooled("a")).isFalse();
        assertThat(server.count("LOGOUT")).isEqualTo(1);
    }

    @Test
    @DisplayName("disconnect removes the client from the pool")
    void testDisconnect() throws Exception {
        accountManager.getClient("a");

        accountManager.disconnect("a");

        assertThat(accountManager.isPooled("a")).isFalse();
        assertThat(accountManager.getStats().getEntries()).isEmpty();
        assertThat(accountManager.listAccounts()).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Pool stats list state and selected folder")
    void testStats() throws Exception {
        accountManager.getClient("a").selectFolder("INBOX");

        PoolStats stats = accountManager.getStats();

        assertThat(stats.getMaxConnections()).isEqualTo(2);
        assertThat(stats.getEntries()).hasSize(1);
        assertThat(stats.getEntries().get(0).getState()).isEqualTo("SELECTED");
        assertThat(stats.getEntries().get(0).getSelectedFolder()).isEqualTo("INBOX");
    }
}
