package org.javai.sqlgate.config;

import java.time.Duration;
import java.util.List;
import org.javai.sqlgate.catalog.JdbcSchemaReflector;
import org.javai.sqlgate.check.ExecutionProber;
import org.javai.sqlgate.exec.GuardedQueryRunner;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.javai.sqlgate.sql.Dialect;

/**
 * Connection and validation settings for one data source.
 *
 * @param id identifier the data source is selected by
 * @param url JDBC URL
 * @param username user name, empty when the store needs none
 * @param password password, empty when the store needs none
 * @param dialect SQL dialect the store speaks
 * @param queryTimeout timeout for probe and real execution
 * @param maxProbeRows rows the execution probe reads at most
 * @param maxResultRows rows a guarded query returns at most
 * @param tableTypes metadata table types reflected into the catalog
 */
public record DataSourceConfig(
		String id,
		String url,
		String username,
		String password,
		Dialect dialect,
		Duration queryTimeout,
		int maxProbeRows,
		int maxResultRows,
		List<String> tableTypes
) {

	public DataSourceConfig {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Data source id must not be blank");
		}
		if (url == null || url.isBlank()) {
			throw new IllegalArgumentException("Data source '" + id + "' needs a url");
		}
		username = username == null ? "" : username;
		password = password == null ? "" : password;
		dialect = dialect == null ? Dialect.fromJdbcUrl(url) : dialect;
		queryTimeout = queryTimeout == null ? ExecutionProber.DEFAULT_QUERY_TIMEOUT : queryTimeout;
		if (queryTimeout.isNegative()) {
			throw new IllegalArgumentException("Data source '" + id + "': query timeout must not be negative");
		}
		if (maxProbeRows <= 0 || maxResultRows <= 0) {
			throw new IllegalArgumentException("Data source '" + id + "': row limits must be positive");
		}
		tableTypes = tableTypes == null || tableTypes.isEmpty()
				? JdbcSchemaReflector.DEFAULT_TABLE_TYPES
				: List.copyOf(tableTypes);
	}

	/**
	 * Creates a configuration with default limits.
	 */
	public static DataSourceConfig of(String id, String url, String username, String password) {
		return new DataSourceConfig(id, url, username, password, null, null,
				ExecutionProber.DEFAULT_MAX_ROWS, GuardedQueryRunner.DEFAULT_MAX_ROWS, null);
	}

	public ConnectionFactory connectionFactory() {
		return ConnectionFactory.of(url, username, password);
	}

	@Override
	public String toString() {
		return "DataSourceConfig[id=" + id + ", url=" + url + ", username=" + username + ", dialect=" + dialect + "]";
	}
}
