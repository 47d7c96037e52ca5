package com.ninesync.util;

import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EmlParser unit tests
 */
class EmlParserTest {

    private static final String MULTIPART = "From: alice@example.com\r\n"
            + "Subject: Report\r\n"
            + "MIME-Version: 1.0\r\n"
            + "Content-Type: multipart/mixed; boundary=\"b1\"\r\n"
            + "\r\n"
            + "--b1\r\n"
            + "Content-Type: text/html; charset=UTF-8\r\n"
            + "\r\n"
            + "<p>Hello &amp; <b>welcome</b></p><style>p {}</style>\r\n"
            + "--b1\r\n"
            + "Content-Type: text/plain; charset=UTF-8\r\n"
            + "Content-Disposition: attachment; filename=\"notes.txt\"\r\n"
            + "\r\n"
            + "attached notes\r\n"
            + "--b1--\r\n";

    @Test
    @DisplayName("HTML part is used when there is no inline text/plain; attachments are skipped")
    void testExtractHtmlFallback() throws Exception {
        MimeMessage mime = EmlParser.parse(MULTIPART);

        String text = EmlParser.extractText(mime);

        assertThat(mime.getSubject()).isEqualTo("Report");
        assertThat(text).contains("Hello & ").contains("welcome").doesNotContain("<").doesNotContain("p {}")
                .doesNotContain("attached notes");
    }

    @Test
    @DisplayName("Encoded words are decoded, plain text is returned unchanged")
    void testDecodeHeader() {
        assertThat(EmlParser.decodeHeader("=?UTF-8?B?SMOpbGxv?=")).isEqualTo("Héllo");
        assertThat(EmlParser.decodeHeader("Plain subject")).isEqualTo("Plain subject");
        assertThat(EmlParser.decodeHeader(null)).isNull();
    }

    @Test
    @DisplayName("Preview collapses whitespace and truncates")
    void testPreview() {
        assertThat(EmlParser.preview(" one\r\n\ttwo  three ", 100)).isEqualTo("one two three");
        assertThat(EmlParser.preview("abcdef", 3)).isEqualTo("abc");
        assertThat(EmlParser.preview(null, 3)).isNull();
    }
}
