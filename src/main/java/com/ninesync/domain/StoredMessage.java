package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Local copy of a message, as handed to the mail store
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StoredMessage {

    private Long id;                // Store generated key
    private String accountId;
    private String folderName;
    private long uid;
    private String messageId;       // Message-ID header
    private String subject;
    private String fromAddress;
    private String toAddresses;     // Comma separated
    private String ccAddresses;
    private LocalDateTime sentDate;
    private LocalDateTime receivedDate;
    private long size;
    @Builder.Default
    private Set<String> flags = new LinkedHashSet<>();
    private String bodyText;
    private String preview;
    private boolean headersOnly;    // true when synced without body
    private long syncVersion;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isSeen() {
        return flags.contains(MessageFlag.SEEN.getToken());
    }
}
