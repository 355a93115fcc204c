package org.javai.sqlgate.exec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.sqlgate.SqlValidator;
import org.javai.sqlgate.Verdict;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.javai.sqlgate.jdbc.QueryTimeouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes SQL only after the validator has passed it.
 *
 * <p>This is the entry point for callers that want results rather than a verdict. SQL
 * that fails validation is never sent to the store for real.</p>
 */
public class GuardedQueryRunner {

	private static final Logger logger = LoggerFactory.getLogger(GuardedQueryRunner.class);

	public static final int DEFAULT_MAX_ROWS = 1000;

	private final SqlValidator validator;
	private final ConnectionFactory connections;
	private final Duration queryTimeout;
	private final int maxRows;

	public GuardedQueryRunner(SqlValidator validator) {
		this(validator, Duration.ofSeconds(30), DEFAULT_MAX_ROWS);
	}

	/**
	 * @param validator validator whose connections also serve the real execution
	 * @param queryTimeout statement timeout, rounded up to whole seconds; zero disables it
	 * @param maxRows most rows returned; further rows are dropped and the result marked truncated
	 */
	public GuardedQueryRunner(SqlValidator validator, Duration queryTimeout, int maxRows) {
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.connections = validator.connections();
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
	 * Validates and then executes a query.
	 *
	 * @param sql the SQL to run
	 * @return the rows the query produced
	 * @throws QueryRejectedException if validation fails
	 * @throws QueryExecutionException if the store fails the validated query
	 */
	public QueryResult execute(String sql) {
		Verdict verdict = validator.validate(sql);
		if (!verdict.passed()) {
			throw new QueryRejectedException(verdict);
		}

		logger.info("Executing validated SQL: {}", sql);
		try (Connection connection = connections.open();
				Statement statement = connection.createStatement()) {
			statement.setQueryTimeout(QueryTimeouts.seconds(queryTimeout));
			// one extra row tells us whether the result was cut short
			statement.setMaxRows(maxRows == Integer.MAX_VALUE ? 0 : maxRows + 1);
			try (ResultSet resultSet = statement.executeQuery(sql)) {
				return read(resultSet);
			}
		} catch (SQLException e) {
			logger.error("Error executing validated SQL: {}", e.getMessage(), e);
			throw new QueryExecutionException("Query execution failed: " + e.getMessage(), e);
		}
	}

	private QueryResult read(ResultSet resultSet) throws SQLException {
		ResultSetMetaData metaData = resultSet.getMetaData();
		List<String> columns = new ArrayList<>(metaData.getColumnCount());
		for (int i = 1; i <= metaData.getColumnCount(); i++) {
			columns.add(metaData.getColumnLabel(i));
		}

		List<Map<String, Object>> rows = new ArrayList<>();
		boolean truncated = false;
		while (resultSet.next()) {
			if (rows.size() == maxRows) {
				truncated = true;
				break;
			}
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= columns.size(); i++) {
				row.put(columns.get(i - 1), resultSet.getObject(i));
			}
			rows.add(row);
		}
		return new QueryResult(columns, rows, truncated);
	}
}
