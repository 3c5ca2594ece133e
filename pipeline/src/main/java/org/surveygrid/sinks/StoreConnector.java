package org.surveygrid.sinks;

import org.surveygrid.utils.ConfigLoader;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Opens a JDBC connection for a store location given on the command line.
 */
@FunctionalInterface
public interface StoreConnector {

    Connection connect(String location) throws SQLException;

    /**
     * Plain paths resolve to SQLite files; anything starting with {@code jdbc:} is used as is.
     * Credentials come from {@code STORE_USER} / {@code STORE_PASSWORD} when set.
     */
    static StoreConnector jdbc() {
        return location -> {
            String url = toJdbcUrl(location);
            Optional<String> user = ConfigLoader.storeUser();
            if (user.isPresent()) {
                return DriverManager.getConnection(url, user.get(), ConfigLoader.storePassword().orElse(""));
            }
            return DriverManager.getConnection(url);
        };
    }

    static String toJdbcUrl(String location) {
        return location.startsWith("jdbc:") ? location : "jdbc:sqlite:" + location;
    }
}
