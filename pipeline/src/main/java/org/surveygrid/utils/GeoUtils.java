package org.surveygrid.utils;

import ch.hsr.geohash.GeoHash;

/**
 * Geographic utilities for spatial binning.
 */
public final class GeoUtils {

    public static final int MIN_PRECISION = 1;
    public static final int MAX_PRECISION = 12;

    private GeoUtils() {}

    /**
     * Encode a coordinate as a geohash with the given number of characters.
     * Longer hashes name smaller cells nested inside the shorter ones.
     *
     * @return geohash of exactly {@code precision} characters
     * @throws ConfigurationException if precision is outside [1, 12]
     * @throws IllegalArgumentException if the coordinate is off the globe
     */
    public static String geohash(double latitude, double longitude, int precision) {
        requireValidPrecision(precision);
        if (!isValidCoordinate(latitude, longitude)) {
            throw new IllegalArgumentException(
                    "Coordinate out of range: lat=" + latitude + ", lon=" + longitude);
        }
        return GeoHash.withCharacterPrecision(latitude, longitude, precision).toBase32();
    }

    public static boolean isValidCoordinate(double latitude, double longitude) {
        return latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    public static boolean isValidPrecision(int precision) {
        return precision >= MIN_PRECISION && precision <= MAX_PRECISION;
    }

    public static void requireValidPrecision(int precision) {
        if (!isValidPrecision(precision)) {
            throw new ConfigurationException(ConfigurationException.INVALID_PRECISION);
        }
    }
}
