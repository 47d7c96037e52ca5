package com.ninesync.config;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.net.ssl.SSLException;

/**
 * Netty client event loop and TLS contexts
 */
@Slf4j
@Configuration
public class NettyConfig {

    @Bean(destroyMethod = "shutdownGracefully")
    public EventLoopGroup imapEventLoopGroup() {
        return new NioEventLoopGroup();
    }

    /**
     * Context validating the server certificate against the default trust roots
     */
    @Bean
    public SslContext verifyingSslContext() {
        return buildClientContext(true);
    }

    /**
     * Context accepting any certificate (validateCertificates: false)
     */
    @Bean
    public SslContext insecureSslContext() {
        return buildClientContext(false);
    }

    static SslContext buildClientContext(boolean validateCertificates) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient()
                    .protocols("TLSv1.2", "TLSv1.3");
            if (!validateCertificates) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            SslContext ctx = builder.build();
            log.info("Client SSL/TLS context initialized (validate certificates: {})", validateCertificates);
            return ctx;
        } catch (SSLException e) {
            log.error("Failed to initialize client SSL context: {}", e.getMessage());
            throw new IllegalStateException("SSL context initialization failed", e);
        }
    }
}
