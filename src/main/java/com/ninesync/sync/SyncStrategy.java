package com.ninesync.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * How a folder is synchronized: FULL, INCREMENTAL, HEADERS_ONLY or RECENT(days)
 */
public final class SyncStrategy {

    public enum Kind {
        FULL,
        INCREMENTAL,
        HEADERS_ONLY,
        RECENT
    }

    public static final SyncStrategy FULL = new SyncStrategy(Kind.FULL, 0);
    public static final SyncStrategy INCREMENTAL = new SyncStrategy(Kind.INCREMENTAL, 0);
    public static final SyncStrategy HEADERS_ONLY = new SyncStrategy(Kind.HEADERS_ONLY, 0);

    private final Kind kind;
    private final int days;

    private SyncStrategy(Kind kind, int days) {
        this.kind = kind;
        this.days = days;
    }

    public static SyncStrategy recent(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        return new SyncStrategy(Kind.RECENT, days);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Look-back window of RECENT, 0 otherwise
     */
    public int getDays() {
        return days;
    }

    public boolean fetchesBody() {
        return kind != Kind.HEADERS_ONLY;
    }

    /**
     * FULL, INCREMENTAL, HEADERS_ONLY, RECENT:7 (case-insensitive)
     */
    @JsonCreator
    public static SyncStrategy parse(String value) {
        String upper = value.trim().toUpperCase(Locale.ROOT);
        if (upper.startsWith("RECENT")) {
            String arg = upper.substring("RECENT".length()).replaceAll("[:()\\s]", "");
            return recent(arg.isEmpty() ? 7 : Integer.parseInt(arg));
        }
        return switch (upper) {
            case "FULL" -> FULL;
            case "INCREMENTAL" -> INCREMENTAL;
            case "HEADERS_ONLY", "HEADERS" -> HEADERS_ONLY;
            default -> throw new IllegalArgumentException("Unknown sync strategy: " + value);
        };
    }

    @JsonValue
    @Override
    public String toString() {
        return kind == Kind.RECENT ? "RECENT:" + days : kind.name();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SyncStrategy other && kind == other.kind && days == other.days;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, days);
    }
}
