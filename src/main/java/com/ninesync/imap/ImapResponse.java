package com.ninesync.imap;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Result of one tagged command: the untagged lines received before the
 * tagged completion, plus the completion itself.
 */
@Getter
public class ImapResponse {

    public enum Status {
        OK,
        NO,
        BAD
    }

    private final String tag;
    private final Status status;
    private final String text;          // Completion text after the status word
    private final List<String> untagged;

    public ImapResponse(String tag, Status status, String text, List<String> untagged) {
        this.tag = tag;
        this.status = status;
        this.text = text;
        this.untagged = Collections.unmodifiableList(new ArrayList<>(untagged));
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Response code of the completion ("[READ-ONLY] ..." gives "READ-ONLY"), or null
     */
    public String getResponseCode() {
        return responseCode(text);
    }

    /**
     * Untagged lines whose data starts with the given keyword,
     * e.g. {@code "LIST"} matches {@code * LIST (...) "/" INBOX}
     */
    public List<String> untaggedWith(String keyword) {
        String prefix = "* " + keyword.toUpperCase(Locale.ROOT);
        List<String> result = new ArrayList<>();
        for (String line : untagged) {
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith(prefix)
                    && (upper.length() == prefix.length() || upper.charAt(prefix.length()) == ' ')) {
                result.add(line);
            }
        }
        return result;
    }

    /**
     * Parses "tag OK text" for the given tag, or returns null when the line is not that completion
     */
    static ImapResponse completion(String tag, String line, List<String> untagged) throws ImapException {
        if (!line.startsWith(tag + " ")) {
            return null;
        }
        String rest = line.substring(tag.length() + 1);
        int space = rest.indexOf(' ');
        String word = (space < 0 ? rest : rest.substring(0, space)).toUpperCase(Locale.ROOT);
        String text = space < 0 ? "" : rest.substring(space + 1);
        Status status = switch (word) {
            case "OK" -> Status.OK;
            case "NO" -> Status.NO;
            case "BAD" -> Status.BAD;
            default -> throw ImapException.protocol("Unexpected completion: " + line);
        };
        return new ImapResponse(tag, status, text, untagged);
    }

    public static String responseCode(String text) {
        if (text == null || !text.startsWith("[")) {
            return null;
        }
        int end = text.indexOf(']');
        return end < 0 ? null : text.substring(1, end);
    }

    @Override
    public String toString() {
        return tag + " " + status + " " + text + " (" + untagged.size() + " untagged)";
    }
}
