package com.ninesync.client;

import com.ninesync.imap.ImapException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Resolves token references against the Spring environment
 * (system properties, environment variables, ninesync.tokens.* entries).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentTokenProvider implements TokenProvider {

    private final Environment environment;

    @Override
    public String getAccessToken(String tokenReference) throws ImapException {
        String token = environment.getProperty("ninesync.tokens." + tokenReference);
        if (token == null) {
            token = environment.getProperty(tokenReference);
        }
        if (token == null || token.isBlank()) {
            log.warn("No access token available for reference {}", tokenReference);
            throw ImapException.authentication("No access token for reference " + tokenReference);
        }
        return token;
    }
}
