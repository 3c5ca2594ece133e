package org.surveygrid.sinks;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads SQL from {@code /sql/<name>.sql} on the classpath.
 */
public final class SqlScripts {

    public static final String CREATE_TABLE = "create_table";
    public static final String INSERT_RECORD = "insert_record";
    public static final String COUNT_EXISTING = "count_existing";

    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlScripts() {}

    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlScripts::read);
    }

    /**
     * Split a script into its non-blank {@code ;}-separated statements.
     */
    public static List<String> statements(String name) {
        return Arrays.stream(load(name).split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String read(String name) {
        String resource = "/sql/" + name + ".sql";
        try (InputStream in = SqlScripts.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException(resource + " not found in resources");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }
}
