package org.surveygrid.utils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Configuration loader from environment variables.
 * Fails fast with {@link ConfigurationException} on malformed values.
 */
public final class ConfigLoader {

    private ConfigLoader() {}

    // --- Survey Settings ---
    public static List<String> surveys() {
        List<String> surveys = Arrays.stream(getOrDefault("SURVEYGRID_SURVEYS", "NBS,EBS,BSS,GOA").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (surveys.isEmpty()) {
            throw new ConfigurationException("SURVEYGRID_SURVEYS must name at least one survey");
        }
        return surveys;
    }

    public static long fetchPauseSeconds() {
        return parseLong("FETCH_PAUSE_SECONDS", "5");
    }

    // --- Upstream API Settings ---
    public static String fossApiUrl() {
        return getOrDefault("FOSS_API_URL",
                "https://apps-st.fisheries.noaa.gov/ods/foss/afsc_groundfish_survey/");
    }

    public static int fossPageSize() {
        return parseInt("FOSS_PAGE_SIZE", "10000");
    }

    public static long fossTimeoutSeconds() {
        return parseLong("FOSS_TIMEOUT_SECONDS", "60");
    }

    public static int fossMaxRetries() {
        return parseInt("FOSS_MAX_RETRIES", "3");
    }

    public static long fossRetryDelayMs() {
        return parseLong("FOSS_RETRY_DELAY_MS", "5000");
    }

    // --- Store Settings ---
    public static Optional<String> storeUser() {
        return getOptional("STORE_USER");
    }

    public static Optional<String> storePassword() {
        return getOptional("STORE_PASSWORD");
    }

    // --- Helper Methods ---
    private static Optional<String> getOptional(String key) {
        return Optional.ofNullable(System.getenv(key)).filter(s -> !s.isEmpty());
    }

    private static String getOrDefault(String key, String defaultValue) {
        return getOptional(key).orElse(defaultValue);
    }

    private static int parseInt(String key, String defaultValue) {
        String value = getOrDefault(key, defaultValue);
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new ConfigurationException(key + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    private static long parseLong(String key, String defaultValue) {
        String value = getOrDefault(key, defaultValue);
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0) {
                throw new ConfigurationException(key + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }
}
