package com.ninesync.storage;

import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.MailAddress;
import com.ninesync.domain.MessageEnvelope;
import com.ninesync.domain.StoredMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MessageConverter unit tests
 */
class MessageConverterTest {

    private final MessageConverter converter = new MessageConverter();

    private static final String RAW = "Message-ID: <raw@example.com>\r\n"
            + "From: Carol <carol@example.com>\r\n"
            + "Subject: From the body\r\n"
            + "Date: Tue, 02 Jan 2024 08:00:00 +0000\r\n"
            + "Content-Type: text/plain; charset=UTF-8\r\n"
            + "\r\n"
            + "Line one\r\n"
            + "  line   two\r\n";

    @Test
    @DisplayName("Envelope fields win over the MIME headers")
    void testEnvelopeWins() {
        MailAddress alice = MailAddress.builder().name("Alice").mailbox("alice").host("example.com").build();
        MessageEnvelope envelope = MessageEnvelope.builder()
                .messageId("<env@example.com>")
                .subject("=?UTF-8?B?SMOpbGxv?=")
                .date("Mon, 01 Jan 2024 10:00:00 +0000")
                .from(List.of(alice))
                .to(List.of(MailAddress.of("bob", "example.com"), MailAddress.of("dan", "example.com")))
                .build();
        ImapMessage message = ImapMessage.builder()
                .uid(7L)
                .size(512L)
                .flags(Set.of("\\Seen"))
                .internalDate(OffsetDateTime.of(2024, 1, 1, 10, 0, 5, 0, ZoneOffset.UTC))
                .envelope(envelope)
                .body(RAW)
                .build();

        StoredMessage stored = converter.convert("acme", "INBOX", message);

        assertThat(stored.getUid()).isEqualTo(7);
        assertThat(stored.getMessageId()).isEqualTo("<env@example.com>");
        assertThat(stored.getSubject()).isEqualTo("Héllo");
        assertThat(stored.getFromAddress()).isEqualTo("Alice <alice@example.com>");
        assertThat(stored.getToAddresses()).isEqualTo("bob@example.com, dan@example.com");
        assertThat(stored.getCcAddresses()).isNull();
        assertThat(stored.getSentDate()).isEqualTo(LocalDateTime.ofInstant(
                OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC).toInstant(), ZoneId.systemDefault()));
        assertThat(stored.getSize()).isEqualTo(512);
        assertThat(stored.isSeen()).isTrue();
        assertThat(stored.isHeadersOnly()).isFalse();
        assertThat(stored.getBodyText()).contains("Line one");
        assertThat(stored.getPreview()).isEqualTo("Line one line two");
    }

    @Test
    @DisplayName("MIME headers fill in a missing envelope")
    void testBodyOnly() {
        ImapMessage message = ImapMessage.builder().uid(3L).body(RAW).build();

        StoredMessage stored = converter.convert("acme", "INBOX", message);

        assertThat(stored.getMessageId()).isEqualTo("<raw@example.com>");
        assertThat(stored.getSubject()).isEqualTo("From the body");
        assertThat(stored.getFromAddress()).isEqualTo("Carol <carol@example.com>");
        assertThat(stored.getSentDate()).isNotNull();
        assertThat(stored.getSize()).isZero();
    }

    @Test
    @DisplayName("No body: headers only, no text")
    void testHeadersOnly() {
        ImapMessage message = ImapMessage.builder()
                .uid(4L)
                .envelope(MessageEnvelope.builder().subject("Just headers").date("not a date").build())
                .build();

        StoredMessage stored = converter.convert("acme", "INBOX", message);

        assertThat(stored.isHeadersOnly()).isTrue();
        assertThat(stored.getBodyText()).isNull();
        assertThat(stored.getPreview()).isNull();
        assertThat(stored.getSentDate()).isNull();
        assertThat(stored.getFromAddress()).isNull();
    }

    @Test
    @DisplayName("Message without UID is rejected")
    void testMissingUid() {
        ImapMessage message = ImapMessage.builder().sequenceNumber(5).build();

        assertThatThrownBy(() -> converter.convert("acme", "INBOX", message))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("5");
    }
}
