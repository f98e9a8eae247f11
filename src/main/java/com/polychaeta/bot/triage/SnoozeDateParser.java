package com.polychaeta.bot.triage;

import com.joestelmach.natty.DateGroup;
import com.joestelmach.natty.Parser;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Turns the free text after a snooze command into a future instant.
 *
 * <p>Parsing is delegated to natty, relative to the supplied {@code now}, so
 * {@code in 3 days}, {@code December 1st}, {@code next friday at noon} and the like
 * all work. Expressions without a time keep the current time of day. Only the
 * first non-blank line is read, and the first date found in it wins.
 */
public final class SnoozeDateParser {

    // natty swaps the JVM default time zone while it parses
    private static final Object PARSE_LOCK = new Object();

    /**
     * @return the instant, or empty if the text holds no date or the date is not after {@code now}
     */
    public Optional<Instant> parse(String text, ZonedDateTime now) {
        String expr = firstLine(text);
        if (expr.isEmpty()) return Optional.empty();

        List<DateGroup> groups;
        synchronized (PARSE_LOCK) {
            groups = new Parser(TimeZone.getTimeZone(now.getZone())).parse(expr, Date.from(now.toInstant()));
        }

        return groups.stream()
                .flatMap(g -> g.getDates().stream())
                .findFirst()
                .map(Date::toInstant)
                .filter(at -> at.isAfter(now.toInstant()));
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) return line.trim();
        }
        return "";
    }
}
