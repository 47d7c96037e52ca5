package com.ninesync.imap;

import com.ninesync.idle.IdleNotification;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns untagged lines received during IDLE into notifications.
 * BYE becomes CONNECTION_LOST; lines that are not EXISTS, RECENT, EXPUNGE or FETCH yield nothing.
 */
@Slf4j
public final class IdleResponseParser {

    private static final Pattern NUMERIC = Pattern.compile("^\\* (\\d+) ([A-Za-z]+)(?: (.*))?$", Pattern.DOTALL);
    private static final Pattern FETCH_UID = Pattern.compile("\\bUID (\\d+)", Pattern.CASE_INSENSITIVE);

    private IdleResponseParser() {
    }

    public static List<IdleNotification> parse(List<String> lines) {
        List<IdleNotification> notifications = new ArrayList<>();
        for (String line : lines) {
            IdleNotification notification = parseLine(line);
            if (notification != null) {
                notifications.add(notification);
            }
        }
        return notifications;
    }

    public static IdleNotification parseLine(String line) {
        if (line.regionMatches(true, 0, "* BYE", 0, 5)) {
            return IdleNotification.connectionLost(line.substring(2));
        }
        Matcher m = NUMERIC.matcher(line);
        if (!m.matches()) {
            return null;
        }
        long n;
        try {
            n = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            log.debug("Ignoring untagged line with an out of range number: {}", line);
            return null;
        }
        return switch (m.group(2).toUpperCase(Locale.ROOT)) {
            case "EXISTS" -> IdleNotification.newMessageCount(n);
            case "RECENT" -> IdleNotification.recentCount(n);
            case "EXPUNGE" -> IdleNotification.expunge(n);
            case "FETCH" -> {
                Matcher uid = FETCH_UID.matcher(m.group(3) == null ? "" : m.group(3));
                yield IdleNotification.fetchUpdate(n, uid.find() ? Long.valueOf(uid.group(1)) : null);
            }
            default -> {
                log.debug("Ignoring untagged {} during IDLE", m.group(2));
                yield null;
            }
        };
    }
}
