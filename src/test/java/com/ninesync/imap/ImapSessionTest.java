package com.ninesync.imap;

import com.ninesync.domain.CapabilitySet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ImapSession unit tests
 */
class ImapSessionTest {

    private ImapSession session;

    @BeforeEach
    void setUp() {
        session = new ImapSession();
    }

    @Test
    @DisplayName("Initial state")
    void testInitialState() {
        assertThat(session.getState()).isEqualTo(ImapState.DISCONNECTED);
        assertThat(session.getSelectedFolder()).isNull();
        assertThat(session.getCapabilities().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("OK greeting, then authentication, then SELECT")
    void testStateTransitions() {
        session.connected(false);
        assertThat(session.getState()).isEqualTo(ImapState.CONNECTED);
        assertThat(session.getState().isAuthenticated()).isFalse();

        session.authenticated();
        assertThat(session.getState()).isEqualTo(ImapState.AUTHENTICATED);

        session.selectMailbox("INBOX", false);
        assertThat(session.getState()).isEqualTo(ImapState.SELECTED);
        assertThat(session.isSelected("INBOX")).isTrue();
        assertThat(session.isSelected("Sent")).isFalse();
        assertThat(session.getState().isAuthenticated()).isTrue();
    }

    @Test
    @DisplayName("PREAUTH greeting skips authentication")
    void testPreAuth() {
        session.connected(true);
        assertThat(session.getState()).isEqualTo(ImapState.AUTHENTICATED);
    }

    @Test
    @DisplayName("Selected folder is cleared when leaving SELECTED")
    void testCloseMailbox() {
        session.connected(false);
        session.authenticated();
        session.selectMailbox("Archive", true);
        assertThat(session.isReadOnly()).isTrue();

        session.closeMailbox();
        assertThat(session.getState()).isEqualTo(ImapState.AUTHENTICATED);
        assertThat(session.getSelectedFolder()).isNull();
        assertThat(session.isReadOnly()).isFalse();
    }

    @Test
    @DisplayName("Disconnect resets everything")
    void testDisconnected() {
        session.connected(false);
        session.setTlsActive(true);
        session.setCapabilities(CapabilitySet.of(List.of("IMAP4rev1", "IDLE")));
        session.authenticated();
        session.selectMailbox("INBOX", false);

        session.disconnected();

        assertThat(session.getState()).isEqualTo(ImapState.DISCONNECTED);
        assertThat(session.getSelectedFolder()).isNull();
        assertThat(session.isTlsActive()).isFalse();
        assertThat(session.getCapabilities().isEmpty()).isTrue();
    }
}
