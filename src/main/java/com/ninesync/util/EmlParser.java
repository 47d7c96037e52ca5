package com.ninesync.util;

import jakarta.mail.BodyPart;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * EML parsing utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from the raw RFC 822 text
     */
    public static MimeMessage parse(String raw) throws MessagingException {
        try (InputStream is = new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8))) {
            return new MimeMessage(SESSION, is);
        } catch (IOException e) {
            throw new MessagingException("Cannot read message", e);
        }
    }

    /**
     * First text/plain part; falls back to text/html with tags stripped
     */
    public static String extractText(Part part) throws MessagingException, IOException {
        if (part.isMimeType("text/plain")) {
            return String.valueOf(part.getContent());
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            String html = null;
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                if (Part.ATTACHMENT.equalsIgnoreCase(bodyPart.getDisposition())) {
                    continue;
                }
                if (bodyPart.isMimeType("text/html") && html == null) {
                    html = stripHtml(String.valueOf(bodyPart.getContent()));
                    continue;
                }
                String text = extractText(bodyPart);
                if (text != null) {
                    return text;
                }
            }
            return html;
        }
        if (part.isMimeType("text/html")) {
            return stripHtml(String.valueOf(part.getContent()));
        }
        return null;
    }

    /**
     * Decode RFC 2047 encoded words (=?UTF-8?B?...?=); undecodable text is returned unchanged
     */
    public static String decodeHeader(String value) {
        if (value == null) {
            return null;
        }
        try {
            return MimeUtility.decodeText(value);
        } catch (UnsupportedEncodingException e) {
            log.debug("Cannot decode header '{}': {}", value, e.getMessage());
            return value;
        }
    }

    /**
     * Whitespace collapsed prefix of the text
     */
    public static String preview(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.length() <= maxLength ? collapsed : collapsed.substring(0, maxLength);
    }

    private static String stripHtml(String html) {
        return html.replaceAll("(?is)<(script|style)[^>]*>.*?</\\1>", " ")
                .replaceAll("<[^>]+>", " ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">");
    }

    /**
     * Return the mail Session
     */
    public static Session getSession() {
        return SESSION;
    }
}
