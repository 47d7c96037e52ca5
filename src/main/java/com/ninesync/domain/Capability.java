package com.ninesync.domain;

import java.util.Locale;

/**
 * Server capabilities recognized by the client.
 * Tokens not listed here are kept verbatim in {@link CapabilitySet}.
 */
public enum Capability {
    IMAP4REV1("IMAP4rev1"),
    STARTTLS("STARTTLS"),
    LOGINDISABLED("LOGINDISABLED"),
    SASL_IR("SASL-IR"),
    AUTH_PLAIN("AUTH=PLAIN"),
    AUTH_LOGIN("AUTH=LOGIN"),
    AUTH_XOAUTH2("AUTH=XOAUTH2"),
    IDLE("IDLE"),
    NAMESPACE("NAMESPACE"),
    UNSELECT("UNSELECT"),
    CHILDREN("CHILDREN"),
    UIDPLUS("UIDPLUS"),
    CONDSTORE("CONDSTORE"),
    QRESYNC("QRESYNC"),
    MOVE("MOVE"),
    SPECIAL_USE("SPECIAL-USE");

    private final String token;

    Capability(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * @return the matching capability, or null for an unrecognized token
     */
    public static Capability fromToken(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        for (Capability capability : values()) {
            if (capability.token.toUpperCase(Locale.ROOT).equals(upper)) {
                return capability;
            }
        }
        return null;
    }
}
