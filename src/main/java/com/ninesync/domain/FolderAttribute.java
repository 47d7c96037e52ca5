package com.ninesync.domain;

import java.util.Locale;

/**
 * LIST attributes, including the special-use markers
 */
public enum FolderAttribute {
    NOINFERIORS("\\Noinferiors"),
    NOSELECT("\\Noselect"),
    MARKED("\\Marked"),
    UNMARKED("\\Unmarked"),
    HAS_CHILDREN("\\HasChildren"),
    HAS_NO_CHILDREN("\\HasNoChildren"),
    ALL("\\All"),
    ARCHIVE("\\Archive"),
    DRAFTS("\\Drafts"),
    FLAGGED("\\Flagged"),
    JUNK("\\Junk"),
    SENT("\\Sent"),
    TRASH("\\Trash");

    private final String token;

    FolderAttribute(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Attribute name without the leading backslash, e.g. {@code HasNoChildren}
     */
    public String getName() {
        return token.substring(1);
    }

    public boolean isSpecialUse() {
        return switch (this) {
            case ALL, ARCHIVE, DRAFTS, FLAGGED, JUNK, SENT, TRASH -> true;
            default -> false;
        };
    }

    public static FolderAttribute fromToken(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        for (FolderAttribute attribute : values()) {
            if (attribute.token.toUpperCase(Locale.ROOT).equals(upper)) {
                return attribute;
            }
        }
        return null;
    }
}
