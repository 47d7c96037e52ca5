package com.ninesync.domain;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * SEARCH key (RFC 3501 §6.4.4). Instances are immutable and render to the
 * exact text placed after {@code SEARCH} / {@code UID SEARCH}.
 */
public abstract class SearchCriteria {

    /** Date format used by SEARCH date keys: 01-Jan-2024 */
    public static final DateTimeFormatter SEARCH_DATE = DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);

    private SearchCriteria() {
    }

    public abstract String toImapString();

    @Override
    public String toString() {
        return toImapString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SearchCriteria other && toImapString().equals(other.toImapString());
    }

    @Override
    public int hashCode() {
        return toImapString().hashCode();
    }

    public static SearchCriteria all() {
        return keyword("ALL");
    }

    public static SearchCriteria seen() {
        return keyword("SEEN");
    }

    public static SearchCriteria unseen() {
        return keyword("UNSEEN");
    }

    public static SearchCriteria flagged() {
        return keyword("FLAGGED");
    }

    public static SearchCriteria deleted() {
        return keyword("DELETED");
    }

    public static SearchCriteria since(LocalDate date) {
        return dated("SINCE", date);
    }

    public static SearchCriteria before(LocalDate date) {
        return dated("BEFORE", date);
    }

    public static SearchCriteria on(LocalDate date) {
        return dated("ON", date);
    }

    public static SearchCriteria from(String address) {
        return text("FROM", address);
    }

    public static SearchCriteria subject(String subject) {
        return text("SUBJECT", subject);
    }

    public static SearchCriteria text(String value) {
        return text("TEXT", value);
    }

    /**
     * {@code UID first:*}
     */
    public static SearchCriteria uidFrom(long first) {
        return keyword("UID " + first + ":*");
    }

    /**
     * {@code UID first:last}
     */
    public static SearchCriteria uidRange(long first, long last) {
        return keyword("UID " + first + ":" + last);
    }

    /**
     * CONDSTORE {@code MODSEQ n}: messages whose mod-sequence is at least n
     */
    public static SearchCriteria modSeq(long modSeq) {
        return keyword("MODSEQ " + modSeq);
    }

    public static SearchCriteria not(SearchCriteria criteria) {
        Objects.requireNonNull(criteria);
        return keyword("NOT " + criteria.toImapString());
    }

    public static SearchCriteria or(SearchCriteria left, SearchCriteria right) {
        Objects.requireNonNull(left);
        Objects.requireNonNull(right);
        return keyword("OR " + left.toImapString() + " " + right.toImapString());
    }

    /**
     * Conjunction: search keys separated by spaces are ANDed by the server
     */
    public static SearchCriteria and(SearchCriteria... criteria) {
        StringBuilder sb = new StringBuilder();
        for (SearchCriteria c : criteria) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(c.toImapString());
        }
        return keyword(sb.length() == 0 ? "ALL" : sb.toString());
    }

    private static SearchCriteria dated(String key, LocalDate date) {
        return keyword(key + " \"" + SEARCH_DATE.format(date) + "\"");
    }

    private static SearchCriteria text(String key, String value) {
        return keyword(key + " " + quote(value));
    }

    private static SearchCriteria keyword(String text) {
        return new Raw(text);
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static final class Raw extends SearchCriteria {
        private final String text;

        private Raw(String text) {
            this.text = text;
        }

        @Override
        public String toImapString() {
            return text;
        }
    }
}
