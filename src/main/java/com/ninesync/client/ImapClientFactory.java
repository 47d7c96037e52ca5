package com.ninesync.client;

import com.ninesync.config.SyncProperties;
import com.ninesync.imap.ImapConnection;
import com.ninesync.imap.ImapException;
import com.ninesync.imap.ImapTransportFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds clients from the configured accounts
 */
@Component
@RequiredArgsConstructor
public class ImapClientFactory {

    private final SyncProperties properties;
    private final ImapTransportFactory transportFactory;
    private final TokenProvider tokenProvider;

    public ImapClient create(String accountId) throws ImapException {
        SyncProperties.Account account = getAccount(accountId);
        ImapConnection connection = new ImapConnection(accountId, account, transportFactory);
        return new ImapClient(connection, account.toCredentials(), tokenProvider);
    }

    /**
     * Client on its own connection for IDLE; reads while idling use the IDLE read timeout
     */
    public ImapClient createIdleClient(String accountId) throws ImapException {
        ImapClient client = create(accountId);
        client.getConnection().setReadTimeout(Duration.ofMillis(properties.getIdle().getReadTimeoutMs()));
        return client;
    }

    public SyncProperties.Account getAccount(String accountId) throws ImapException {
        SyncProperties.Account account = properties.getAccounts().get(accountId);
        if (account == null) {
            throw ImapException.notFound("Unknown account: " + accountId);
        }
        return account;
    }
}
