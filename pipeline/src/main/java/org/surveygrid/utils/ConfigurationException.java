package org.surveygrid.utils;

/**
 * Raised for invalid user or environment configuration. Always reported before
 * the store or the upstream source is touched.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final String INVALID_PRECISION =
            "Expected geohash size to be an integer between 1 - 12.";
    public static final String INVALID_YEAR_RANGE =
            "Year range should be like 2000-2023.";

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
