package com.ninesync.imap;

import com.ninesync.domain.CapabilitySet;
import com.ninesync.domain.SearchCriteria;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Command formatters. Each returns the command text without tag and CRLF.
 */
public final class ImapCommands {

    /** Items for header-only fetches */
    public static final String HEADER_ITEMS = "UID FLAGS ENVELOPE INTERNALDATE RFC822.SIZE";
    /** Items for full fetches (body is peeked so \Seen is not set) */
    public static final String FULL_ITEMS = HEADER_ITEMS + " BODY.PEEK[]";

    public enum StoreAction {
        ADD("+FLAGS"),
        REMOVE("-FLAGS"),
        REPLACE("FLAGS");

        private final String token;

        StoreAction(String token) {
            this.token = token;
        }

        public String getToken() {
            return token;
        }
    }

    private ImapCommands() {
    }

    public static String capability() {
        return "CAPABILITY";
    }

    public static String noop() {
        return "NOOP";
    }

    public static String logout() {
        return "LOGOUT";
    }

    public static String starttls() {
        return "STARTTLS";
    }

    public static String login(String username, String password) {
        return "LOGIN " + quote(username) + " " + quote(password);
    }

    /**
     * AUTHENTICATE PLAIN with initial response: base64(NUL user NUL password)
     */
    public static String authenticatePlain(String username, String password) {
        return "AUTHENTICATE PLAIN " + plainBlob(username, password);
    }

    public static String plainBlob(String username, String password) {
        return base64("\0" + username + "\0" + password);
    }

    /**
     * AUTHENTICATE XOAUTH2 carrying base64(NUL identity NUL token)
     */
    public static String authenticateXoauth2(String identity, String token) {
        return "AUTHENTICATE XOAUTH2 " + base64("\0" + identity + "\0" + token);
    }

    public static String select(String folder) {
        return "SELECT " + quote(folder);
    }

    public static String examine(String folder) {
        return "EXAMINE " + quote(folder);
    }

    public static String list(String reference, String pattern) {
        return "LIST " + quote(reference) + " " + quote(pattern);
    }

    public static String lsub(String reference, String pattern) {
        return "LSUB " + quote(reference) + " " + quote(pattern);
    }

    public static String status(String folder, String... items) {
        return "STATUS " + quote(folder) + " (" + String.join(" ", items) + ")";
    }

    public static String fetch(String sequenceSet, String items) {
        return "FETCH " + sequenceSet + " (" + items + ")";
    }

    public static String uidFetch(String uidSet, String items) {
        return "UID " + fetch(uidSet, items);
    }

    public static String search(SearchCriteria criteria) {
        return "SEARCH " + criteria.toImapString();
    }

    public static String uidSearch(SearchCriteria criteria) {
        return "UID " + search(criteria);
    }

    public static String store(String sequenceSet, StoreAction action, Collection<String> flags) {
        return "STORE " + sequenceSet + " " + action.getToken() + " (" + String.join(" ", flags) + ")";
    }

    public static String uidStore(String uidSet, StoreAction action, Collection<String> flags) {
        return "UID " + store(uidSet, action, flags);
    }

    public static String copy(String sequenceSet, String destination) {
        return "COPY " + sequenceSet + " " + quote(destination);
    }

    public static String uidCopy(String uidSet, String destination) {
        return "UID " + copy(uidSet, destination);
    }

    public static String move(String sequenceSet, String destination) {
        return "MOVE " + sequenceSet + " " + quote(destination);
    }

    public static String uidMove(String uidSet, String destination) {
        return "UID " + move(uidSet, destination);
    }

    public static String expunge() {
        return "EXPUNGE";
    }

    public static String create(String folder) {
        return "CREATE " + quote(folder);
    }

    public static String delete(String folder) {
        return "DELETE " + quote(folder);
    }

    public static String rename(String from, String to) {
        return "RENAME " + quote(from) + " " + quote(to);
    }

    public static String subscribe(String folder) {
        return "SUBSCRIBE " + quote(folder);
    }

    public static String unsubscribe(String folder) {
        return "UNSUBSCRIBE " + quote(folder);
    }

    public static String idle() {
        return "IDLE";
    }

    public static String done() {
        return "DONE";
    }

    /**
     * Untagged CAPABILITY line as a server would send it
     */
    public static String formatCapabilities(CapabilitySet capabilities) {
        return capabilities.isEmpty() ? "* CAPABILITY" : "* CAPABILITY " + capabilities;
    }

    /**
     * Compact sequence set: 1,2,3,7 becomes 1:3,7
     */
    public static String sequenceSet(Collection<Long> numbers) {
        StringBuilder sb = new StringBuilder();
        Long start = null;
        Long prev = null;
        for (Long n : numbers.stream().sorted().distinct().collect(Collectors.toList())) {
            if (start == null) {
                start = n;
            } else if (n != prev + 1) {
                appendRange(sb, start, prev);
                start = n;
            }
            prev = n;
        }
        if (start != null) {
            appendRange(sb, start, prev);
        }
        return sb.toString();
    }

    private static void appendRange(StringBuilder sb, long start, long end) {
        if (sb.length() > 0) {
            sb.append(',');
        }
        sb.append(start);
        if (end != start) {
            sb.append(':').append(end);
        }
    }

    /**
     * Quoted string with backslash and double quote escaped
     */
    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
