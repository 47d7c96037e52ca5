package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Folder (mailbox) as seen from LIST, SELECT/EXAMINE and STATUS responses.
 * Counts stay null when the server did not report them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImapFolder {

    private String name;            // Last hierarchy component
    private String fullName;        // Full path as sent to the server
    private String delimiter;       // null when the server answered NIL

    @Builder.Default
    private Set<FolderAttribute> attributes = EnumSet.noneOf(FolderAttribute.class);
    @Builder.Default
    private Set<String> customAttributes = new LinkedHashSet<>();

    private Long exists;
    private Long recent;
    private Long unseen;
    private Long uidValidity;
    private Long uidNext;
    private Long highestModSeq;
    private boolean readOnly;
    @Builder.Default
    private Set<String> flags = new LinkedHashSet<>();             // FLAGS from SELECT
    @Builder.Default
    private Set<String> permanentFlags = new LinkedHashSet<>();

    public static ImapFolder named(String fullName) {
        return ImapFolder.builder().name(fullName).fullName(fullName).build();
    }

    public boolean isSelectable() {
        return !attributes.contains(FolderAttribute.NOSELECT);
    }

    public boolean hasChildren() {
        return attributes.contains(FolderAttribute.HAS_CHILDREN);
    }

    public boolean isInbox() {
        return "INBOX".equalsIgnoreCase(fullName);
    }
}
