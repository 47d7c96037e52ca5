package com.ninesync.imap;

import com.ninesync.domain.CapabilitySet;
import com.ninesync.domain.FolderAttribute;
import com.ninesync.domain.ImapFolder;
import com.ninesync.domain.ImapMessage;
import com.ninesync.domain.MailAddress;
import com.ninesync.domain.MessageEnvelope;
import com.ninesync.domain.MessageFlag;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for server responses. Stateless; every method is a pure function
 * of the response text.
 */
@Slf4j
public final class ImapResponseParser {

    private static final Pattern NUMERIC_UNTAGGED = Pattern.compile("^\\* (\\d+) ([A-Za-z]+)(?: (.*))?$", Pattern.DOTALL);
    private static final Pattern CODE = Pattern.compile("\\[([A-Za-z-]+)(?: ([^\\]]*))?]");
    private static final DateTimeFormatter INTERNAL_DATE =
            DateTimeFormatter.ofPattern("d-MMM-yyyy HH:mm:ss Z", Locale.ENGLISH);

    private ImapResponseParser() {
    }

    // ---------------------------------------------------------------- capabilities

    /**
     * Capabilities from untagged CAPABILITY lines and [CAPABILITY ...] response codes
     * (the greeting or an authentication completion). Returns null when none is present.
     */
    public static CapabilitySet parseCapabilities(List<String> lines) {
        List<String> tokens = null;
        for (String line : lines) {
            List<String> found = capabilityTokens(line);
            if (found != null) {
                tokens = tokens == null ? new ArrayList<>() : tokens;
                tokens.addAll(found);
            }
        }
        return tokens == null ? null : CapabilitySet.of(tokens);
    }

    public static CapabilitySet parseCapabilities(String line) {
        return parseCapabilities(List.of(line));
    }

    private static List<String> capabilityTokens(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        String data = null;
        if (upper.startsWith("* CAPABILITY")) {
            data = line.substring("* CAPABILITY".length());
        } else {
            int code = upper.indexOf("[CAPABILITY");
            if (code >= 0) {
                int end = line.indexOf(']', code);
                data = line.substring(code + "[CAPABILITY".length(), end < 0 ? line.length() : end);
            }
        }
        if (data == null) {
            return null;
        }
        List<String> tokens = new ArrayList<>();
        for (String token : data.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    // ---------------------------------------------------------------- LIST / LSUB

    /**
     * Folders from {@code * LIST (attrs) "delim" name} (or LSUB) lines; other lines are skipped
     */
    public static List<ImapFolder> parseFolders(List<String> lines) throws ImapException {
        List<ImapFolder> folders = new ArrayList<>();
        for (String line : lines) {
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith("* LIST ") || upper.startsWith("* LSUB ")) {
                folders.add(parseFolder(line));
            }
        }
        return folders;
    }

    public static ImapFolder parseFolder(String line) throws ImapException {
        List<Object> tokens = ImapTokenizer.tokenize(line.substring(7));
        if (tokens.size() < 3) {
            throw ImapException.protocol("Malformed LIST response: " + line);
        }
        String delimiter = ImapTokenizer.string(tokens.get(1));
        String fullName = ImapTokenizer.string(tokens.get(2));
        if (fullName == null) {
            throw ImapException.protocol("LIST response without a folder name: " + line);
        }

        ImapFolder folder = ImapFolder.builder()
                .fullName(fullName)
                .name(lastComponent(fullName, delimiter))
                .delimiter(delimiter)
                .build();
        for (Object attr : ImapTokenizer.list(tokens.get(0))) {
            String token = ImapTokenizer.string(attr);
            FolderAttribute known = FolderAttribute.fromToken(token);
            if (known != null) {
                folder.getAttributes().add(known);
            } else {
                folder.getCustomAttributes().add(token);
            }
        }
        return folder;
    }

    private static String lastComponent(String fullName, String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            return fullName;
        }
        int idx = fullName.lastIndexOf(delimiter);
        return idx < 0 ? fullName : fullName.substring(idx + delimiter.length());
    }

    // ---------------------------------------------------------------- SELECT / EXAMINE / STATUS

    /**
     * Folder counters from the untagged data of SELECT/EXAMINE.
     * {@code completionText} carries [READ-ONLY] / [READ-WRITE].
     */
    public static ImapFolder parseSelect(String folderName, List<String> untagged, String completionText)
            throws ImapException {
        ImapFolder folder = ImapFolder.named(folderName);
        for (String line : untagged) {
            Matcher numeric = NUMERIC_UNTAGGED.matcher(line);
            if (numeric.matches()) {
                long n = parseNumber(numeric.group(1));
                switch (numeric.group(2).toUpperCase(Locale.ROOT)) {
                    case "EXISTS" -> folder.setExists(n);
                    case "RECENT" -> folder.setRecent(n);
                    default -> { }
                }
                continue;
            }
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith("* FLAGS ")) {
                folder.setFlags(flagSet(ImapTokenizer.tokenize(line.substring(8))));
                continue;
            }
            Matcher code = CODE.matcher(line);
            if (upper.startsWith("* OK ") && code.find()) {
                String arg = code.group(2);
                switch (code.group(1).toUpperCase(Locale.ROOT)) {
                    case "UNSEEN" -> folder.setUnseen(parseNumber(arg));
                    case "UIDVALIDITY" -> folder.setUidValidity(parseNumber(arg));
                    case "UIDNEXT" -> folder.setUidNext(parseNumber(arg));
                    case "HIGHESTMODSEQ" -> folder.setHighestModSeq(parseNumber(arg));
                    case "PERMANENTFLAGS" -> folder.setPermanentFlags(flagSet(ImapTokenizer.tokenize(arg == null ? "" : arg)));
                    default -> { }
                }
            }
        }
        String completionCode = ImapResponse.responseCode(completionText);
        folder.setReadOnly(completionCode != null && completionCode.equalsIgnoreCase("READ-ONLY"));
        return folder;
    }

    /**
     * {@code * STATUS "INBOX" (MESSAGES 3 RECENT 0 UIDNEXT 4 UIDVALIDITY 1 UNSEEN 1)}
     */
    public static ImapFolder parseStatus(String line) throws ImapException {
        if (!line.toUpperCase(Locale.ROOT).startsWith("* STATUS ")) {
            throw ImapException.protocol("Not a STATUS response: " + line);
        }
        List<Object> tokens = ImapTokenizer.tokenize(line.substring(9));
        if (tokens.size() != 2) {
            throw ImapException.protocol("Malformed STATUS response: " + line);
        }
        ImapFolder folder = ImapFolder.named(ImapTokenizer.string(tokens.get(0)));
        List<Object> items = ImapTokenizer.list(tokens.get(1));
        for (int i = 0; i + 1 < items.size(); i += 2) {
            String key = ImapTokenizer.string(items.get(i)).toUpperCase(Locale.ROOT);
            Long value = parseNumber(ImapTokenizer.string(items.get(i + 1)));
            switch (key) {
                case "MESSAGES" -> folder.setExists(value);
                case "RECENT" -> folder.setRecent(value);
                case "UNSEEN" -> folder.setUnseen(value);
                case "UIDNEXT" -> folder.setUidNext(value);
                case "UIDVALIDITY" -> folder.setUidValidity(value);
                case "HIGHESTMODSEQ" -> folder.setHighestModSeq(value);
                default -> log.debug("Ignoring STATUS item {}", key);
            }
        }
        return folder;
    }

    // ---------------------------------------------------------------- SEARCH

    /**
     * Numbers from {@code * SEARCH 2 5 9}, ignoring a CONDSTORE {@code (MODSEQ n)} suffix
     */
    public static List<Long> parseSearch(List<String> lines) throws ImapException {
        List<Long> result = new ArrayList<>();
        for (String line : lines) {
            if (!line.toUpperCase(Locale.ROOT).startsWith("* SEARCH")) {
                continue;
            }
            String data = line.substring("* SEARCH".length());
            int modSeq = data.indexOf('(');
            if (modSeq >= 0) {
                data = data.substring(0, modSeq);
            }
            for (String token : data.trim().split("\\s+")) {
                if (!token.isEmpty()) {
                    result.add(parseNumber(token));
                }
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- FETCH

    /**
     * Messages from {@code * n FETCH (...)} lines; other lines are skipped
     */
    public static List<ImapMessage> parseFetch(List<String> lines) throws ImapException {
        List<ImapMessage> messages = new ArrayList<>();
        for (String line : lines) {
            Matcher m = NUMERIC_UNTAGGED.matcher(line);
            if (m.matches() && "FETCH".equalsIgnoreCase(m.group(2))) {
                messages.add(parseFetchItems(parseNumber(m.group(1)), m.group(3)));
            }
        }
        return messages;
    }

    static ImapMessage parseFetchItems(long sequence, String data) throws ImapException {
        List<Object> tokens = ImapTokenizer.tokenize(data == null ? "" : data);
        if (tokens.size() != 1) {
            throw ImapException.protocol("Malformed FETCH data: " + data);
        }
        List<Object> items = ImapTokenizer.list(tokens.get(0));
        if (items.size() % 2 != 0) {
            throw ImapException.protocol("FETCH items are not name/value pairs");
        }

        ImapMessage message = ImapMessage.builder().sequenceNumber(sequence).build();
        for (int i = 0; i < items.size(); i += 2) {
            String name = ImapTokenizer.string(items.get(i)).toUpperCase(Locale.ROOT);
            Object value = items.get(i + 1);
            switch (name) {
                case "UID" -> message.setUid(parseNumber(ImapTokenizer.string(value)));
                case "FLAGS" -> message.setFlags(flagSet(ImapTokenizer.list(value)));
                case "RFC822.SIZE" -> message.setSize(parseNumber(ImapTokenizer.string(value)));
                case "INTERNALDATE" -> message.setInternalDate(parseInternalDate(ImapTokenizer.string(value)));
                case "ENVELOPE" -> message.setEnvelope(parseEnvelope(value));
                case "MODSEQ" -> {
                    List<Object> modSeq = ImapTokenizer.list(value);
                    if (!modSeq.isEmpty()) {
                        message.setModSeq(parseNumber(ImapTokenizer.string(modSeq.get(0))));
                    }
                }
                case "BODY[]", "RFC822", "BODY.PEEK[]" -> message.setBody(ImapTokenizer.string(value));
                case "BODY[HEADER]", "RFC822.HEADER" -> {
                    String headers = ImapTokenizer.string(value);
                    if (headers != null) {
                        message.getHeaders().putAll(parseHeaderBlock(headers));
                    }
                }
                default -> log.debug("Ignoring FETCH item {}", name);
            }
        }
        return message;
    }

    private static Map<String, String> parseHeaderBlock(String block) {
        Map<String, String> headers = new LinkedHashMap<>();
        String lastName = null;
        for (String line : block.split("\r?\n")) {
            if (line.isEmpty()) {
                break;
            }
            if ((line.startsWith(" ") || line.startsWith("\t")) && lastName != null) {
                headers.put(lastName, headers.get(lastName) + " " + line.trim());
                continue;
            }
            int colon = line.indexOf(':');
            if (colon > 0) {
                lastName = line.substring(0, colon).trim();
                headers.put(lastName, line.substring(colon + 1).trim());
            }
        }
        return headers;
    }

    // ---------------------------------------------------------------- ENVELOPE

    /**
     * Envelope from its parenthesized text. Exactly ten fields are required.
     */
    public static MessageEnvelope parseEnvelope(String text) throws ImapException {
        List<Object> tokens = ImapTokenizer.tokenize(text);
        if (tokens.size() != 1 || !(tokens.get(0) instanceof List)) {
            throw ImapException.protocol("Envelope must be a single parenthesized list");
        }
        return parseEnvelope(tokens.get(0));
    }

    static MessageEnvelope parseEnvelope(Object token) throws ImapException {
        List<Object> fields = ImapTokenizer.list(token);
        if (fields.size() != 10) {
            throw ImapException.protocol("Envelope has " + fields.size() + " fields, expected 10");
        }
        return MessageEnvelope.builder()
                .date(ImapTokenizer.string(fields.get(0)))
                .subject(ImapTokenizer.string(fields.get(1)))
                .from(parseAddressList(fields.get(2)))
                .sender(parseAddressList(fields.get(3)))
                .replyTo(parseAddressList(fields.get(4)))
                .to(parseAddressList(fields.get(5)))
                .cc(parseAddressList(fields.get(6)))
                .bcc(parseAddressList(fields.get(7)))
                .inReplyTo(ImapTokenizer.string(fields.get(8)))
                .messageId(ImapTokenizer.string(fields.get(9)))
                .build();
    }

    /**
     * Address list; entries without mailbox or host (group markers) are dropped
     */
    public static List<MailAddress> parseAddressList(Object token) throws ImapException {
        List<MailAddress> addresses = new ArrayList<>();
        for (Object entry : ImapTokenizer.list(token)) {
            List<Object> parts = ImapTokenizer.list(entry);
            if (parts.size() != 4) {
                throw ImapException.protocol("Address has " + parts.size() + " fields, expected 4");
            }
            MailAddress address = MailAddress.builder()
                    .name(ImapTokenizer.string(parts.get(0)))
                    .route(ImapTokenizer.string(parts.get(1)))
                    .mailbox(ImapTokenizer.string(parts.get(2)))
                    .host(ImapTokenizer.string(parts.get(3)))
                    .build();
            if (address.isValid()) {
                addresses.add(address);
            }
        }
        return addresses;
    }

    // ---------------------------------------------------------------- helpers

    /**
     * INTERNALDATE such as " 1-Jan-2024 10:00:00 +0000"; null when absent or unparseable
     */
    public static OffsetDateTime parseInternalDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim(), INTERNAL_DATE);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable INTERNALDATE '{}'", value);
            return null;
        }
    }

    private static Set<String> flagSet(List<Object> tokens) throws ImapException {
        Set<String> flags = new LinkedHashSet<>();
        for (Object token : tokens) {
            if (token instanceof List<?>) {
                flags.addAll(flagSet(ImapTokenizer.list(token)));
            } else {
                String flag = ImapTokenizer.string(token);
                if (flag != null) {
                    flags.add(MessageFlag.normalize(flag));
                }
            }
        }
        return flags;
    }

    private static Long parseNumber(String value) throws ImapException {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw ImapException.protocol("Expected a number but got '" + value + "'");
        }
    }
}
