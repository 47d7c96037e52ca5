package com.ninesync;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * 9Sync IMAP synchronization service
 *
 * Keeps a local copy of remote IMAP mailboxes
 * - Netty-based IMAP client with STARTTLS / implicit TLS
 * - IDLE push notifications on dedicated connections
 * - Priority background task scheduler (Reactor)
 * - MyBatis + SQLite local store with full-text search
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.ninesync.mapper")
@EnableConfigurationProperties
public class NineSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(NineSyncApplication.class, args);
    }
}
