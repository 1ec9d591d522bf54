package com.conveyal.schedule.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between clock strings and minutes after midnight. Schedules hold times as integer minutes; values of
 * 1440 and above denote service running past midnight on the same service day, as in GTFS.
 */
public abstract class TimeUtil {

    private static final Logger LOG = LoggerFactory.getLogger(TimeUtil.class);

    /** Sentinel for a time that is absent or could not be parsed. */
    public static final int INT_MISSING = Integer.MIN_VALUE;

    public static final int MINUTES_PER_DAY = 24 * 60;

    /** Width of the analysis windows travel times are reported in. */
    public static final int PERIOD_MINUTES = 30;

    private static final String PERIOD_SEPARATOR = " - ";

    /**
     * Parse H:MM, HH:MM or HH:MM:SS into minutes after midnight. Seconds are dropped. Malformed input is logged and
     * yields {@link #INT_MISSING} so callers can skip whatever derivation depended on the value.
     */
    public static int parseMinutes (String hhmm) {
        if (hhmm == null || hhmm.trim().isEmpty()) {
            LOG.warn("Empty time value, treating as missing.");
            return INT_MISSING;
        }
        String[] fields = hhmm.trim().split(":");
        if (fields.length != 2 && fields.length != 3) {
            LOG.warn("Time value '{}' should be formatted HH:MM, treating as missing.", hhmm);
            return INT_MISSING;
        }
        try {
            int h = Integer.parseInt(fields[0]);
            int m = Integer.parseInt(fields[1]);
            if (h < 0 || m < 0 || m > 59) {
                LOG.warn("Time value '{}' is out of range, treating as missing.", hhmm);
                return INT_MISSING;
            }
            return h * 60 + m;
        } catch (NumberFormatException e) {
            LOG.warn("Time value '{}' has non-numeric parts, treating as missing.", hhmm);
            return INT_MISSING;
        }
    }

    /** Render minutes as HH:MM. Hours are not wrapped at midnight. Missing times render as the empty string. */
    public static String formatMinutes (int minutes) {
        if (isMissing(minutes) || minutes < 0) return "";
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }

    public static boolean isMissing (int minutes) {
        return minutes == INT_MISSING;
    }

    /** Add an interval to a time, leaving missing times missing. */
    public static int addMinutes (int time, int delta) {
        if (isMissing(time)) return INT_MISSING;
        return time + delta;
    }

    /**
     * Elapsed minutes from start to end. An end before the start is taken to be on the following day.
     */
    public static int timeDifference (int start, int end) {
        if (isMissing(start) || isMissing(end)) return INT_MISSING;
        int diff = end - start;
        if (diff < 0) diff += MINUTES_PER_DAY;
        return diff;
    }

    /** The start of the 30 minute analysis window containing the given time, within a single day. */
    public static int periodStart (int minutes) {
        if (isMissing(minutes)) return INT_MISSING;
        int timeOfDay = Math.floorMod(minutes, MINUTES_PER_DAY);
        return timeOfDay - (timeOfDay % PERIOD_MINUTES);
    }

    /** A window label in the form used by travel time analysis tables, e.g. "07:00 - 07:29". */
    public static String periodLabel (int minutes) {
        int start = periodStart(minutes);
        if (isMissing(start)) return "";
        return formatMinutes(start) + PERIOD_SEPARATOR + formatMinutes(start + PERIOD_MINUTES - 1);
    }

    /** The first minute of a period label such as "07:00 - 07:29". */
    public static int parsePeriodStart (String timePeriod) {
        if (timePeriod == null) return INT_MISSING;
        return parseMinutes(timePeriod.split(PERIOD_SEPARATOR)[0]);
    }

    /** The last minute of a period label, or the end of its 30 minute window when the label has no end half. */
    public static int parsePeriodEnd (String timePeriod) {
        if (timePeriod == null) return INT_MISSING;
        String[] halves = timePeriod.split(PERIOD_SEPARATOR);
        if (halves.length < 2) {
            int start = parseMinutes(halves[0]);
            return addMinutes(start, PERIOD_MINUTES - 1);
        }
        return parseMinutes(halves[1]);
    }

}
