package com.ninesync.client;

import com.ninesync.imap.ImapException;

/**
 * Source of OAuth2 access tokens for XOAUTH2 accounts
 */
public interface TokenProvider {

    /**
     * @param tokenReference account's configured token reference
     * @return a currently valid access token
     * @throws ImapException AUTHENTICATION when no token can be obtained
     */
    String getAccessToken(String tokenReference) throws ImapException;
}
