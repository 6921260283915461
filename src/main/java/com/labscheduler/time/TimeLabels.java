package com.labscheduler.time;

import com.labscheduler.exception.InputParseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between human-readable time labels and minutes since midnight.
 *
 * <p>Accepted time-of-day forms:
 * <ul>
 *   <li>{@code 9:00}, {@code 13:30}, {@code 24:00}: 24-hour clock</li>
 *   <li>{@code 9am}, {@code 9:30 PM}, {@code 12 a.m.}: 12-hour clock, hour 1-12</li>
 * </ul>
 * A bare hour such as {@code 9} is ambiguous and rejected by {@link #toMinutes(String)}.
 */
public final class TimeLabels {

    private static final Pattern TIME = Pattern.compile(
        "^(\\d{1,2})(?::(\\d{2}))?\\s*(?:([ap])\\.?\\s*m\\.?)?$", Pattern.CASE_INSENSITIVE);

    // "<time> to <time>" or "<time> - <time>"
    private static final Pattern RANGE = Pattern.compile(
        "^(.+?)\\s*(?:\\bto\\b|-|–)\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern MARKER_SUFFIX = Pattern.compile("([ap])\\.?\\s*m\\.?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DECIMAL_HOUR = Pattern.compile("^\\d{1,2}(?:\\.\\d+)?$");

    private TimeLabels() {}

    /**
     * Parses a time-of-day label into minutes since midnight.
     *
     * @throws InputParseException on non-numeric text, out-of-range hour or minute,
     *         or a bare hour without an AM/PM marker
     */
    public static int toMinutes(String label) {
        if (label == null || label.isBlank()) {
            throw new InputParseException("Empty time label");
        }
        String text = label.trim();
        Matcher m = TIME.matcher(text);
        if (!m.matches()) {
            throw new InputParseException("Malformed time label '" + label + "'");
        }
        int hour = Integer.parseInt(m.group(1));
        String minutePart = m.group(2);
        String marker = m.group(3);
        int minute = minutePart != null ? Integer.parseInt(minutePart) : 0;

        if (minute > 59) {
            throw new InputParseException("Minute out of range in time label '" + label + "'");
        }
        if (marker == null) {
            if (minutePart == null) {
                throw new InputParseException("Time label '" + label + "' needs an AM/PM marker or a minute part");
            }
            if (hour > 24 || (hour == 24 && minute != 0)) {
                throw new InputParseException("Hour out of range in time label '" + label + "'");
            }
            return hour * 60 + minute;
        }
        if (hour < 1 || hour > 12) {
            throw new InputParseException("Hour out of range for a 12-hour time label '" + label + "'");
        }
        boolean pm = marker.equalsIgnoreCase("p");
        int hour24 = hour % 12 + (pm ? 12 : 0);
        return hour24 * 60 + minute;
    }

    /**
     * Parses a range label such as {@code "1am to 2am"}, {@code "9:00-10:30"} or
     * {@code "1-2pm"} (a marker written only on the end applies to both ends).
     *
     * @return {@code {startMinute, endMinute}}
     */
    public static int[] parseRange(String label) {
        if (label == null || label.isBlank()) {
            throw new InputParseException("Empty time range label");
        }
        Matcher m = RANGE.matcher(label.trim());
        if (!m.matches()) {
            throw new InputParseException("Malformed time range label '" + label + "'");
        }
        String startText = m.group(1).trim();
        String endText = m.group(2).trim();

        int end = toMinutes(endText);
        int start;
        Matcher endMarker = MARKER_SUFFIX.matcher(endText);
        if (endMarker.find() && !MARKER_SUFFIX.matcher(startText).find() && !startText.contains(":")) {
            String marker = endMarker.group(1).toLowerCase(Locale.ROOT);
            start = toMinutes(startText + marker + "m");
            // "11-12pm" means 11am to 12pm
            if (start >= end) {
                start = toMinutes(startText + (marker.equals("a") ? "pm" : "am"));
            }
        } else {
            start = toMinutes(startText);
        }
        // "11pm to 12am" ends at midnight
        if (end == 0 && start > 0) {
            end = TimeRange.MINUTES_PER_DAY;
        }
        if (start >= end) {
            throw new InputParseException("Time range '" + label + "' does not end after it starts");
        }
        return new int[] {start, end};
    }

    /**
     * Requirement-file form: the strict labels of {@link #toMinutes(String)} plus a bare
     * 24-hour number such as {@code 11} or {@code 13.5}.
     */
    public static int hourCellToMinutes(String cell) {
        if (cell == null || cell.isBlank()) {
            throw new InputParseException("Empty time cell");
        }
        String text = cell.trim();
        if (DECIMAL_HOUR.matcher(text).matches()) {
            BigDecimal minutes = new BigDecimal(text).multiply(BigDecimal.valueOf(60));
            int value = minutes.setScale(0, RoundingMode.HALF_UP).intValueExact();
            if (value > TimeRange.MINUTES_PER_DAY) {
                throw new InputParseException("Hour out of range in time cell '" + cell + "'");
            }
            return value;
        }
        return toMinutes(text);
    }

    /**
     * Parses a day name: full English name or its first three letters, any case.
     */
    public static DayOfWeek parseDay(String token) {
        if (token == null || token.isBlank()) {
            throw new InputParseException("Empty day name");
        }
        String text = token.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            String name = day.name();
            if (name.equals(text) || (text.length() >= 3 && name.startsWith(text))) {
                return day;
            }
        }
        throw new InputParseException("Unrecognized day '" + token.trim() + "'");
    }

    /** {@code 540 -> "9:00"}, {@code 1440 -> "24:00"}. */
    public static String format(int minutes) {
        return (minutes / 60) + ":" + String.format("%02d", minutes % 60);
    }

    public static String formatDay(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /** Minutes as decimal hours, e.g. {@code 90 -> 1.5}. */
    public static BigDecimal toHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(BigDecimal.valueOf(60), 2, RoundingMode.HALF_UP).stripTrailingZeros();
    }
}
