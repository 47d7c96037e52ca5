package com.ninesync.storage;

import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.MailAddress;
import com.ninesync.domain.MessageEnvelope;
import com.ninesync.domain.StoredMessage;
import com.ninesync.util.EmlParser;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MailDateFormat;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.text.ParseException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts fetched messages into the store's representation.
 * Envelope data wins; the MIME body fills in what the envelope lacks.
 */
@Slf4j
@Component
public class MessageConverter {

    static final int PREVIEW_LENGTH = 200;

    public StoredMessage convert(String accountId, String folderName, ImapMessage message) {
        if (message.getUid() == null) {
            throw new IllegalArgumentException("Message " + message.getSequenceNumber() + " has no UID");
        }
        StoredMessage stored = StoredMessage.builder()
                .accountId(accountId)
                .folderName(folderName)
                .uid(message.getUid())
                .size(message.getSize() == null ? 0 : message.getSize())
                .flags(new LinkedHashSet<>(message.getFlags()))
                .headersOnly(message.getBody() == null)
                .receivedDate(message.getInternalDate() == null ? null
                        : message.getInternalDate().atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime())
                .build();

        MessageEnvelope envelope = message.getEnvelope();
        if (envelope != null) {
            stored.setMessageId(envelope.getMessageId());
            stored.setSubject(EmlParser.decodeHeader(envelope.getSubject()));
            stored.setFromAddress(joinAddresses(envelope.getFrom()));
            stored.setToAddresses(joinAddresses(envelope.getTo()));
            stored.setCcAddresses(joinAddresses(envelope.getCc()));
            stored.setSentDate(parseDate(envelope.getDate()));
        }

        if (message.getBody() != null) {
            applyBody(stored, message.getBody());
        }
        return stored;
    }

    private void applyBody(StoredMessage stored, String body) {
        try {
            MimeMessage mime = EmlParser.parse(body);
            if (stored.getMessageId() == null) {
                stored.setMessageId(mime.getMessageID());
            }
            if (stored.getSubject() == null) {
                stored.setSubject(mime.getSubject());
            }
            if (stored.getFromAddress() == null && mime.getFrom() != null) {
                stored.setFromAddress(joinInternet(mime.getFrom()));
            }
            if (stored.getSentDate() == null && mime.getSentDate() != null) {
                stored.setSentDate(toLocal(mime.getSentDate()));
            }
            String text = EmlParser.extractText(mime);
            stored.setBodyText(text);
            stored.setPreview(EmlParser.preview(text, PREVIEW_LENGTH));
        } catch (MessagingException | IOException e) {
            // Keep the raw text so nothing is lost
            log.warn("[{}] MIME parsing failed for uid {} in {}: {}", stored.getAccountId(), stored.getUid(),
                    stored.getFolderName(), e.getMessage());
            stored.setBodyText(body);
            stored.setPreview(EmlParser.preview(body, PREVIEW_LENGTH));
        }
    }

    static String joinAddresses(List<MailAddress> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return null;
        }
        return addresses.stream()
                .map(a -> a.getName() == null ? a.getEmail()
                        : EmlParser.decodeHeader(a.getName()) + " <" + a.getEmail() + ">")
                .collect(Collectors.joining(", "));
    }

    private static String joinInternet(Address[] addresses) {
        StringBuilder sb = new StringBuilder();
        for (Address address : addresses) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(address instanceof InternetAddress ia ? ia.toUnicodeString() : address.toString());
        }
        return sb.toString();
    }

    static LocalDateTime parseDate(String rfc822Date) {
        if (rfc822Date == null || rfc822Date.isBlank()) {
            return null;
        }
        try {
            return toLocal(new MailDateFormat().parse(rfc822Date));
        } catch (ParseException e) {
            log.debug("Unparseable Date header '{}'", rfc822Date);
            return null;
        }
    }

    private static LocalDateTime toLocal(Date date) {
        return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
    }
}
