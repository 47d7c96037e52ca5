package com.ninesync.imap;

import com.ninesync.config.SyncProperties;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.ssl.SslContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Opens Netty transports on the shared client event loop
 */
@Slf4j
@Component
public class NettyImapTransportFactory implements ImapTransportFactory {

    private final EventLoopGroup group;
    private final SslContext verifyingSslContext;
    private final SslContext insecureSslContext;
    private final SyncProperties properties;

    public NettyImapTransportFactory(EventLoopGroup group,
                                     @Qualifier("verifyingSslContext") SslContext verifyingSslContext,
                                     @Qualifier("insecureSslContext") SslContext insecureSslContext,
                                     SyncProperties properties) {
        this.group = group;
        this.verifyingSslContext = verifyingSslContext;
        this.insecureSslContext = insecureSslContext;
        this.properties = properties;
    }

    @Override
    public ImapTransport open(SyncProperties.Account account) throws ImapException {
        SslContext ctx = account.isValidateCertificates() ? verifyingSslContext : insecureSslContext;
        if (!account.isValidateCertificates()) {
            log.warn("Certificate validation disabled for {}", account.getHost());
        }
        return NettyImapTransport.connect(group, account.getHost(), account.getPort(), account.isImplicitTls(),
                ctx, account.isValidateCertificates(),
                Duration.ofSeconds(account.getTimeoutSeconds()),
                properties.getPool().getMaxLineLength(), properties.getPool().getMaxLiteralLength());
    }
}
