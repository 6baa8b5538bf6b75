package com.autodev.coordinator.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises a provider rate limit in CLI output and works out when it lifts.
 *
 * Example output: "You've hit your limit · resets 5pm (UTC)". A clock time
 * that has already passed today means the same time tomorrow. Output that
 * signals a limit without a parseable time gets the fallback duration.
 */
public final class RateLimitDetector {

    private static final String[] MARKERS = { "hit your limit", "rate limit", "429" };

    private static final Pattern RESET_AT = Pattern.compile(
            "resets?\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)\\s*\\(?\\s*UTC\\s*\\)?",
            Pattern.CASE_INSENSITIVE);

    private RateLimitDetector() {}

    public static boolean isRateLimited(String output) {
        if (output == null || output.isEmpty()) {
            return false;
        }
        String lower = output.toLowerCase(Locale.ROOT);
        for (String marker : MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the instant the limit resets, or empty if the output shows no limit
     */
    public static Optional<Instant> detect(String output, Instant now, Duration fallback) {
        if (!isRateLimited(output)) {
            return Optional.empty();
        }
        Matcher m = RESET_AT.matcher(output);
        if (!m.find()) {
            return Optional.of(now.plus(fallback));
        }
        int hour   = Integer.parseInt(m.group(1));
        int minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        boolean pm = m.group(3).equalsIgnoreCase("pm");
        if (hour < 1 || hour > 12 || minute > 59) {
            return Optional.of(now.plus(fallback));
        }
        if (pm && hour != 12) {
            hour += 12;
        } else if (!pm && hour == 12) {
            hour = 0;
        }

        ZonedDateTime utcNow = now.atZone(ZoneOffset.UTC);
        ZonedDateTime reset  = utcNow.with(LocalTime.of(hour, minute));
        if (!reset.isAfter(utcNow)) {
            reset = reset.plusDays(1);
        }
        return Optional.of(reset.toInstant());
    }
}
