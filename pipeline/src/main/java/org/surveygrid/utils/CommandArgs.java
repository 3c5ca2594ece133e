package org.surveygrid.utils;

import org.surveygrid.models.YearRange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of positional command-line arguments.
 */
public final class CommandArgs {

    private static final Pattern YEAR_PATTERN = Pattern.compile("(?<start>\\d{4})-(?<end>\\d{4})");

    private CommandArgs() {}

    /**
     * Parse an inclusive range such as {@code 2000-2023}.
     */
    public static YearRange parseYearRange(String value) {
        Matcher matcher = YEAR_PATTERN.matcher(value == null ? "" : value.trim());
        if (!matcher.matches()) {
            throw new ConfigurationException(ConfigurationException.INVALID_YEAR_RANGE);
        }
        int start = Integer.parseInt(matcher.group("start"));
        int end = Integer.parseInt(matcher.group("end"));
        if (start > end) {
            throw new ConfigurationException(ConfigurationException.INVALID_YEAR_RANGE);
        }
        return new YearRange(start, end);
    }

    public static int parsePrecision(String value) {
        int precision;
        try {
            precision = Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(ConfigurationException.INVALID_PRECISION, e);
        }
        GeoUtils.requireValidPrecision(precision);
        return precision;
    }
}
