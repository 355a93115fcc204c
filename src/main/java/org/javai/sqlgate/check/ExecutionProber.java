package org.javai.sqlgate.check;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.javai.sqlgate.jdbc.QueryTimeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trial-runs a statement inside a transaction that is always rolled back.
 *
 * <p>The statement runs with auto-commit off, a query timeout and a row limit. Rows
 * are read up to that limit because some stores only report errors while stepping
 * through results. The rollback happens on every exit path; if it fails the probe
 * fails, since the store's state can no longer be vouched for.</p>
 */
public class ExecutionProber {

	private static final Logger logger = LoggerFactory.getLogger(ExecutionProber.class);

	public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
	public static final int DEFAULT_MAX_ROWS = 100;

	private final ConnectionFactory connections;
	private final Duration queryTimeout;
	private final int maxRows;

	public ExecutionProber(ConnectionFactory connections) {
		this(connections, DEFAULT_QUERY_TIMEOUT, DEFAULT_MAX_ROWS);
	}

	/**
	 * @param connections source of a fresh connection per probe
	 * @param queryTimeout statement timeout, rounded up to whole seconds; zero disables it
	 * @param maxRows rows to read before stopping; must be positive
	 */
	public ExecutionProber(ConnectionFactory connections, Duration queryTimeout, int maxRows) {
		this.connections = Objects.requireNonNull(connections, "connections must not be null");
		this.queryTimeout = Objects.requireNonNull(queryTimeout, "queryTimeout must not be null");
		if (queryTimeout.isNegative()) {
			throw new IllegalArgumentException("queryTimeout must not be negative");
		}
		if (maxRows <= 0) {
			throw new IllegalArgumentException("maxRows must be positive");
		}
		this.maxRows = maxRows;
	}

	/**
	 * Probes the statement on a connection of its own.
	 */
	public CheckResult probe(String sql) {
		try (Connection connection = connections.open()) {
			return probe(sql, connection);
		} catch (SQLException e) {
			logger.debug("Execution probe could not complete: {}", e.getMessage());
			return CheckResult.fail("Runtime error: " + e.getMessage());
		}
	}

	/**
	 * Probes the statement on a caller-owned connection, which is left open with its
	 * auto-commit setting restored.
	 *
	 * @throws SQLException if the transaction cannot be set up or rolled back
	 */
	public CheckResult probe(String sql, Connection connection) throws SQLException {
		boolean autoCommit = connection.getAutoCommit();
		connection.setAutoCommit(false);
		try {
			return execute(sql, connection);
		} finally {
			try {
				connection.rollback();
			} finally {
				connection.setAutoCommit(autoCommit);
			}
		}
	}

	private CheckResult execute(String sql, Connection connection) {
		try (Statement statement = connection.createStatement()) {
			statement.setQueryTimeout(QueryTimeouts.seconds(queryTimeout));
			statement.setMaxRows(maxRows);
			if (statement.execute(sql)) {
				int rows = drain(statement);
				logger.debug("Execution probe read {} row(s)", rows);
			}
			return CheckResult.pass("Executed successfully");
		} catch (SQLException e) {
			logger.debug("Execution probe failed: {}", e.getMessage());
			return CheckResult.fail("Runtime error: " + e.getMessage());
		}
	}

	private int drain(Statement statement) throws SQLException {
		int rows = 0;
		try (ResultSet resultSet = statement.getResultSet()) {
			while (rows < maxRows && resultSet.next()) {
				rows++;
			}
		}
		return rows;
	}
}
