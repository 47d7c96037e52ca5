package com.ninesync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of an envelope address list: (name route mailbox host)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailAddress {

    private String name;
    private String route;
    private String mailbox;
    private String host;

    public static MailAddress of(String mailbox, String host) {
        return MailAddress.builder().mailbox(mailbox).host(host).build();
    }

    /**
     * An address is usable only with both mailbox and host present
     */
    public boolean isValid() {
        return mailbox != null && host != null;
    }

    public String getEmail() {
        return isValid() ? mailbox + "@" + host : null;
    }

    public String toDisplayString() {
        String email = getEmail();
        if (name != null) {
            return email != null ? name + " <" + email + ">" : name;
        }
        return email != null ? email : "Unknown";
    }
}
