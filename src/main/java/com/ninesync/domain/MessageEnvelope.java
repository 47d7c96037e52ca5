package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ENVELOPE structure (RFC 3501 §7.4.2):
 * (date subject from sender reply-to to cc bcc in-reply-to message-id)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEnvelope {

    private String date;
    private String subject;
    @Builder.Default
    private List<MailAddress> from = new ArrayList<>();
    @Builder.Default
    private List<MailAddress> sender = new ArrayList<>();
    @Builder.Default
    private List<MailAddress> replyTo = new ArrayList<>();
    @Builder.Default
    private List<MailAddress> to = new ArrayList<>();
    @Builder.Default
    private List<MailAddress> cc = new ArrayList<>();
    @Builder.Default
    private List<MailAddress> bcc = new ArrayList<>();
    private String inReplyTo;
    private String messageId;
}
