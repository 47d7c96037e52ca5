package com.ninesync.imap;

import com.ninesync.domain.Capability;
import com.ninesync.domain.CapabilitySet;
import com.ninesync.domain.FolderAttribute;
import com.ninesync.domain.ImapFolder;
import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.MessageEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ImapResponseParser unit tests
 */
class ImapResponseParserTest {

    @Test
    @DisplayName("LIST line gives name, delimiter and attributes")
    void testParseFolder() throws Exception {
        ImapFolder folder = ImapResponseParser.parseFolder("* LIST (\\HasNoChildren) \"/\" \"INBOX\"");

        assertThat(folder.getName()).isEqualTo("INBOX");
        assertThat(folder.getFullName()).isEqualTo("INBOX");
        assertThat(folder.getDelimiter()).isEqualTo("/");
        assertThat(folder.getAttributes()).containsExactly(FolderAttribute.HAS_NO_CHILDREN);
        assertThat(folder.isSelectable()).isTrue();
    }

    @Test
    @DisplayName("Nested folder, NIL delimiter and custom attributes")
    void testParseFolders() throws Exception {
        List<ImapFolder> folders = ImapResponseParser.parseFolders(List.of(
                "* LIST (\\Noselect \\HasChildren) \".\" \"Archive.2023\"",
                "* LIST (\\Marked $Custom) NIL Flat",
                "* OK something else"));

        assertThat(folders).hasSize(2);
        assertThat(folders.get(0).getName()).isEqualTo("2023");
        assertThat(folders.get(0).isSelectable()).isFalse();
        assertThat(folders.get(1).getDelimiter()).isNull();
        assertThat(folders.get(1).getName()).isEqualTo("Flat");
        assertThat(folders.get(1).getCustomAttributes()).containsExactly("$Custom");
    }

    @Test
    @DisplayName("SELECT untagged data and READ-ONLY completion")
    void testParseSelect() throws Exception {
        ImapFolder folder = ImapResponseParser.parseSelect("INBOX", List.of(
                "* FLAGS (\\Answered \\Seen)",
                "* 172 EXISTS",
                "* 1 RECENT",
                "* OK [UNSEEN 12] Message 12 is first unseen",
                "* OK [UIDVALIDITY 3857529045] UIDs valid",
                "* OK [UIDNEXT 4392] Predicted next UID",
                "* OK [HIGHESTMODSEQ 715194045007]",
                "* OK [PERMANENTFLAGS (\\Deleted \\Seen \\*)] Limited"),
                "[READ-ONLY] EXAMINE completed");

        assertThat(folder.getExists()).isEqualTo(172L);
        assertThat(folder.getRecent()).isEqualTo(1L);
        assertThat(folder.getUnseen()).isEqualTo(12L);
        assertThat(folder.getUidValidity()).isEqualTo(3857529045L);
        assertThat(folder.getUidNext()).isEqualTo(4392L);
        assertThat(folder.getHighestModSeq()).isEqualTo(715194045007L);
        assertThat(folder.getFlags()).containsExactly("\\Answered", "\\Seen");
        assertThat(folder.getPermanentFlags()).contains("\\Deleted", "\\*");
        assertThat(folder.isReadOnly()).isTrue();
    }

    @Test
    @DisplayName("STATUS response")
    void testParseStatus() throws Exception {
        ImapFolder folder = ImapResponseParser.parseStatus(
                "* STATUS \"Sent Items\" (MESSAGES 3 RECENT 0 UIDNEXT 4 UIDVALIDITY 1 UNSEEN 1)");

        assertThat(folder.getFullName()).isEqualTo("Sent Items");
        assertThat(folder.getExists()).isEqualTo(3L);
        assertThat(folder.getUidNext()).isEqualTo(4L);
        assertThat(folder.getUnseen()).isEqualTo(1L);
    }

    @Test
    @DisplayName("SEARCH numbers, ignoring a MODSEQ suffix")
    void testParseSearch() throws Exception {
        assertThat(ImapResponseParser.parseSearch(List.of("* SEARCH 2 5 9 (MODSEQ 917162500)")))
                .containsExactly(2L, 5L, 9L);
        assertThat(ImapResponseParser.parseSearch(List.of("* SEARCH"))).isEmpty();
    }

    @Test
    @DisplayName("FETCH with envelope and inline body literal")
    void testParseFetch() throws Exception {
        String line = "* 12 FETCH (UID 4827 FLAGS (\\seen $Work) RFC822.SIZE 44827 "
                + "INTERNALDATE \"17-Jul-1996 02:44:25 -0700\" MODSEQ (65402) "
                + "ENVELOPE (\"Wed, 17 Jul 1996 02:23:25 -0700 (PDT)\" \"IMAP4rev1 WG mtg summary\" "
                + "((\"Terry Gray\" NIL \"gray\" \"cac.washington.edu\")) NIL NIL "
                + "((NIL NIL \"imap\" \"cac.washington.edu\")) NIL NIL NIL \"<B27397-0100000@cac.washington.edu>\") "
                + "BODY[] {11}\r\nhello world)";

        List<ImapMessage> messages = ImapResponseParser.parseFetch(List.of(line, "* 3 EXISTS"));

        assertThat(messages).hasSize(1);
        ImapMessage message = messages.get(0);
        assertThat(message.getSequenceNumber()).isEqualTo(12);
        assertThat(message.getUid()).isEqualTo(4827L);
        assertThat(message.getFlags()).containsExactly("\\Seen", "$Work");
        assertThat(message.getSize()).isEqualTo(44827L);
        assertThat(message.getModSeq()).isEqualTo(65402L);
        assertThat(message.getInternalDate()).isNotNull();
        assertThat(message.getInternalDate().getOffset().getTotalSeconds()).isEqualTo(-7 * 3600);
        assertThat(message.getBody()).isEqualTo("hello world");

        MessageEnvelope envelope = message.getEnvelope();
        assertThat(envelope.getSubject()).isEqualTo("IMAP4rev1 WG mtg summary");
        assertThat(envelope.getFrom()).hasSize(1);
        assertThat(envelope.getFrom().get(0).getEmail()).isEqualTo("gray@cac.washington.edu");
        assertThat(envelope.getTo().get(0).getName()).isNull();
        assertThat(envelope.getMessageId()).isEqualTo("<B27397-0100000@cac.washington.edu>");
    }

    @Test
    @DisplayName("Envelope must have exactly ten fields")
    void testEnvelopeFieldCount() {
        assertThatThrownBy(() -> ImapResponseParser.parseEnvelope("(\"date\" \"subject\" NIL)"))
                .isInstanceOf(ImapException.class)
                .hasMessageContaining("expected 10");
    }

    @Test
    @DisplayName("Unbalanced envelope is a protocol error")
    void testEnvelopeUnbalanced() {
        assertThatThrownBy(() -> ImapResponseParser.parseEnvelope("(NIL NIL NIL NIL NIL NIL NIL NIL NIL NIL"))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
    }

    @Test
    @DisplayName("Group markers without a host are dropped from address lists")
    void testGroupSyntax() throws Exception {
        MessageEnvelope envelope = ImapResponseParser.parseEnvelope("(NIL NIL NIL NIL NIL "
                + "((NIL NIL \"team\" NIL)(NIL NIL \"ann\" \"example.com\")(NIL NIL NIL NIL)) NIL NIL NIL NIL)");

        assertThat(envelope.getTo()).hasSize(1);
        assertThat(envelope.getTo().get(0).getEmail()).isEqualTo("ann@example.com");
    }

    @Test
    @DisplayName("Capabilities from CAPABILITY lines and response codes round-trip")
    void testCapabilities() {
        CapabilitySet caps = ImapResponseParser.parseCapabilities(
                "* OK [CAPABILITY IMAP4rev1 IDLE AUTH=PLAIN X-CUSTOM] Ready");

        assertThat(caps.has(Capability.IDLE)).isTrue();
        assertThat(caps.has(Capability.AUTH_PLAIN)).isTrue();
        assertThat(caps.has(Capability.MOVE)).isFalse();
        assertThat(caps.getOther()).containsExactly("X-CUSTOM");

        CapabilitySet reparsed = ImapResponseParser.parseCapabilities(ImapCommands.formatCapabilities(caps));
        assertThat(reparsed).isEqualTo(caps);
        assertThat(ImapResponseParser.parseCapabilities("* OK no codes here")).isNull();
    }

    @Test
    @DisplayName("Non-numeric or overflowing server numbers are protocol errors")
    void testMalformedNumbers() {
        assertThatThrownBy(() -> ImapResponseParser.parseSearch(List.of("* SEARCH 1 x")))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
        assertThatThrownBy(() -> ImapResponseParser.parseFetch(List.of("* 99999999999999999999 FETCH (UID 1)")))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
    }

    @Test
    @DisplayName("Envelope with a negative literal size is a protocol error")
    void testEnvelopeNegativeLiteral() {
        assertThatThrownBy(() -> ImapResponseParser.parseEnvelope("({-1}\r\nx NIL NIL NIL NIL NIL NIL NIL NIL NIL)"))
                .isInstanceOf(ImapException.class)
                .satisfies(e -> assertThat(((ImapException) e).getKind()).isEqualTo(ImapException.ErrorKind.PROTOCOL));
    }
}
