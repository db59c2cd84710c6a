package com.bbthechange.matchtracker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the year-less dates used by the match feed and by subscriptions.
 * A resolved date more than {@value #ROLLOVER_DAYS} days in the past is taken to mean next year.
 */
public final class TrackerDateParser {

    private static final Logger logger = LoggerFactory.getLogger(TrackerDateParser.class);

    static final int ROLLOVER_DAYS = 30;
    private static final Pattern MONTH_DAY = Pattern.compile("^\\s*(\\d{1,2})[-/](\\d{1,2})\\s*$");
    private static final Pattern HOUR_MINUTE = Pattern.compile("^\\s*(\\d{1,2}):(\\d{2})\\s*$");
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private TrackerDateParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Start of the given MM-DD day, or null when the text is not a valid month-day.
     */
    public static Instant parseStartOfDay(String monthDay, ZoneId zone, Instant now) {
        return resolve(monthDay, LocalTime.MIDNIGHT, zone, now);
    }

    /**
     * Last second of the given MM-DD day, or null when the text is not a valid month-day.
     */
    public static Instant parseEndOfDay(String monthDay, ZoneId zone, Instant now) {
        return resolve(monthDay, END_OF_DAY, zone, now);
    }

    /**
     * Combines a MM-DD date and an HH:MM time. Returns null for "LIVE", blanks and anything unparsable.
     */
    public static Instant parseMatchTime(String monthDay, String hourMinute, ZoneId zone, Instant now) {
        if (hourMinute == null) {
            return null;
        }
        Matcher matcher = HOUR_MINUTE.matcher(hourMinute);
        if (!matcher.matches()) {
            return null;
        }
        try {
            LocalTime time = LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
            return resolve(monthDay, time, zone, now);
        } catch (DateTimeException e) {
            logger.debug("Invalid match time {} {}", monthDay, hourMinute);
            return null;
        }
    }

    private static Instant resolve(String monthDay, LocalTime time, ZoneId zone, Instant now) {
        if (monthDay == null) {
            return null;
        }
        Matcher matcher = MONTH_DAY.matcher(monthDay);
        if (!matcher.matches()) {
            return null;
        }
        int month = Integer.parseInt(matcher.group(1));
        int day = Integer.parseInt(matcher.group(2));
        int year = now.atZone(zone).getYear();

        try {
            ZonedDateTime candidate = LocalDate.of(year, month, day).atTime(time).atZone(zone);
            if (candidate.toInstant().isBefore(now.minus(ROLLOVER_DAYS, ChronoUnit.DAYS))) {
                candidate = LocalDate.of(year + 1, month, day).atTime(time).atZone(zone);
            }
            return candidate.toInstant();
        } catch (DateTimeException e) {
            // e.g. 02-30, or 02-29 outside a leap year
            logger.debug("Invalid month-day {}", monthDay);
            return null;
        }
    }
}
