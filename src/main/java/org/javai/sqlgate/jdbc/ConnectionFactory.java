package org.javai.sqlgate.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Source of fresh JDBC connections to the store being validated against.
 *
 * <p>Every call must return a new connection owned by the caller, so concurrent
 * validations never share a transaction.</p>
 */
@FunctionalInterface
public interface ConnectionFactory {

	Connection open() throws SQLException;

	static ConnectionFactory of(DataSource dataSource) {
		Objects.requireNonNull(dataSource, "dataSource must not be null");
		return dataSource::getConnection;
	}

	/**
	 * Connections through {@link DriverManager}; the JDBC driver must be on the classpath.
	 */
	static ConnectionFactory of(String url, String username, String password) {
		Objects.requireNonNull(url, "url must not be null");
		if (username == null || username.isEmpty()) {
			return () -> DriverManager.getConnection(url);
		}
		return () -> DriverManager.getConnection(url, username, password);
	}
}
