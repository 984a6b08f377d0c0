package com.harbour.jobfeed.feed.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class JobDates {
    private static final Pattern LONG_DATE = Pattern.compile(
        "(January|February|March|April|May|June|July|August|September|October|November|December)\\s+(\\d{1,2}),\\s+(\\d{4})"
    );
    private static final DateTimeFormatter LONG_DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d, uuuu", Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);

    /** Unknown dates sort after every known date. */
    public static final Comparator<LocalDate> KNOWN_FIRST = Comparator.nullsLast(Comparator.naturalOrder());

    private JobDates() {
    }

    /**
     * Parses a stored {@code yyyy-MM-dd} value; blank or malformed input yields {@code null}.
     */
    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    /**
     * Finds the first "Month d, yyyy" date in free text. Impossible calendar dates yield {@code null}.
     */
    public static LocalDate findLongDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = LONG_DATE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String normalized = matcher.group(1) + " " + Integer.parseInt(matcher.group(2)) + ", " + matcher.group(3);
        try {
            return LocalDate.parse(normalized, LONG_DATE_FORMAT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
