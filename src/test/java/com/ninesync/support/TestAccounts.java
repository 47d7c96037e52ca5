package com.ninesync.support;

import com.ninesync.config.SyncProperties;

/**
 * Configuration fixtures pointing at a {@link FakeImapServer}
 */
public final class TestAccounts {

    public static final String USERNAME = "user@example.com";
    public static final String PASSWORD = "secret";

    private TestAccounts() {
    }

    public static SyncProperties.Account account() {
        SyncProperties.Account account = new SyncProperties.Account();
        account.setHost("imap.example.com");
        account.setPort(143);
        account.setUsername(USERNAME);
        account.setPassword(PASSWORD);
        account.setTimeoutSeconds(5);
        return account;
    }

    /**
     * Properties with the given accounts and test friendly timings
     */
    public static SyncProperties properties(String... accountIds) {
        SyncProperties properties = new SyncProperties();
        for (String accountId : accountIds) {
            properties.getAccounts().put(accountId, account());
        }
        properties.getSync().setBatchPauseMs(0);
        properties.getPool().setConnectTimeoutSeconds(5);
        properties.getPool().setAuthTimeoutSeconds(5);
        properties.getScheduler().setTickIntervalMs(10);
        return properties;
    }
}
