package com.ninesync.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Either a password or a reference to an externally issued access token.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AccountCredentials {

    public enum Kind {
        PASSWORD,
        TOKEN
    }

    private final Kind kind;
    private final String username;
    private final String secret;    // Password or token reference

    public static AccountCredentials password(String username, String password) {
        return new AccountCredentials(Kind.PASSWORD, username, password);
    }

    public static AccountCredentials token(String username, String tokenReference) {
        return new AccountCredentials(Kind.TOKEN, username, tokenReference);
    }

    public boolean isToken() {
        return kind == Kind.TOKEN;
    }

    @Override
    public String toString() {
        return "AccountCredentials(" + kind + ", " + username + ")";
    }
}
