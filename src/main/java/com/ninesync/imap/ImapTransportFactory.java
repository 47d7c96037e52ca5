package com.ninesync.imap;

import com.ninesync.config.SyncProperties;

/**
 * Opens transports to an account's server
 */
@FunctionalInterface
public interface ImapTransportFactory {

    ImapTransport open(SyncProperties.Account account) throws ImapException;
}
