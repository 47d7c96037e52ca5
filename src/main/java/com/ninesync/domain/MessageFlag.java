package com.ninesync.domain;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * System flags. Keywords and other flags travel as plain strings.
 */
public enum MessageFlag {
    SEEN("\\Seen"),
    ANSWERED("\\Answered"),
    FLAGGED("\\Flagged"),
    DELETED("\\Deleted"),
    DRAFT("\\Draft"),
    RECENT("\\Recent");

    private final String token;

    MessageFlag(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Canonical spelling for system flags, unchanged text for keywords
     */
    public static String normalize(String flag) {
        String upper = flag.toUpperCase(Locale.ROOT);
        for (MessageFlag f : values()) {
            if (f.token.toUpperCase(Locale.ROOT).equals(upper)) {
                return f.token;
            }
        }
        return flag;
    }

    public static Set<String> tokens(Collection<MessageFlag> flags) {
        Set<String> tokens = new LinkedHashSet<>();
        for (MessageFlag flag : flags) {
            tokens.add(flag.token);
        }
        return tokens;
    }
}
