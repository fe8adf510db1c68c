package org.keel.introspect;

import lombok.extern.slf4j.Slf4j;
import org.keel.exception.ConnectivityException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens one JDBC connection per call. Drivers are found through {@link DriverManager}.
 */
@Slf4j
public class ConnectionFactory {

    public Connection open(String url) {
        return open(ConnectionUrl.parse(url));
    }

    public Connection open(ConnectionUrl url) {
        log.debug("Connecting to {}", url.jdbcUrl());
        try {
            if (url.user() == null) {
                return DriverManager.getConnection(url.jdbcUrl());
            }
            return DriverManager.getConnection(url.jdbcUrl(), url.user(), url.password());
        } catch (SQLException e) {
            throw new ConnectivityException(
                    "Can't reach database server at " + ConnectionUrl.redact(url.jdbcUrl()) + ": " + e.getMessage(), e);
        }
    }
}
