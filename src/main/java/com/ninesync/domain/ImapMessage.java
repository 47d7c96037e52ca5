package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Message as produced by one FETCH response.
 * The sequence number is session scoped; the UID is stable within one UIDVALIDITY epoch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImapMessage {

    private long sequenceNumber;
    private Long uid;
    @Builder.Default
    private Set<String> flags = new LinkedHashSet<>();
    private Long size;
    private OffsetDateTime internalDate;
    private Long modSeq;
    private MessageEnvelope envelope;
    private String body;                 // BODY[] / RFC822 literal, null when not fetched
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    public boolean hasFlag(MessageFlag flag) {
        return flags.contains(flag.getToken());
    }

    public boolean isSeen() {
        return hasFlag(MessageFlag.SEEN);
    }

    public boolean isDeleted() {
        return hasFlag(MessageFlag.DELETED);
    }
}
