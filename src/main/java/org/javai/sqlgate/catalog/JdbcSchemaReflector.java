package org.javai.sqlgate.catalog;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaReflector} backed by {@link DatabaseMetaData}.
 *
 * <p>Reads the tables of the connection's current catalog and schema. Stores that have
 * no notion of a current schema (SQLite, for instance) report every table.</p>
 */
public class JdbcSchemaReflector implements SchemaReflector {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaReflector.class);

	/**
	 * Metadata table types of base tables. H2 2.x and several other stores report {@code BASE TABLE}.
	 */
	public static final List<String> DEFAULT_TABLE_TYPES = List.of("TABLE", "BASE TABLE");

	private final List<String> tableTypes;

	public JdbcSchemaReflector() {
		this(DEFAULT_TABLE_TYPES);
	}

	/**
	 * @param tableTypes metadata table types to include, e.g. {@code TABLE} and {@code VIEW}
	 */
	public JdbcSchemaReflector(List<String> tableTypes) {
		Objects.requireNonNull(tableTypes, "tableTypes must not be null");
		if (tableTypes.isEmpty()) {
			throw new IllegalArgumentException("At least one table type is required");
		}
		this.tableTypes = List.copyOf(tableTypes);
	}

	@Override
	public SqlCatalog reflect(ConnectionFactory connections) {
		Objects.requireNonNull(connections, "connections must not be null");
		try (Connection connection = connections.open()) {
			return reflect(connection);
		} catch (SQLException e) {
			throw new SchemaUnavailableException("Cannot read database schema: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads the schema through a caller-owned connection, which is left open.
	 *
	 * @throws SchemaUnavailableException if the metadata cannot be read
	 */
	public SqlCatalog reflect(Connection connection) {
		try {
			DatabaseMetaData metaData = connection.getMetaData();
			String catalog = connection.getCatalog();
			String schema = currentSchema(connection);

			InMemorySqlCatalog.Builder builder = InMemorySqlCatalog.builder();
			List<String> tableNames = listTables(metaData, catalog, schema);
			for (String tableName : tableNames) {
				builder.addTable(tableName);
				try (ResultSet columns = metaData.getColumns(catalog, schema,
						escapePattern(tableName, metaData.getSearchStringEscape()), "%")) {
					while (columns.next()) {
						if (tableName.equals(columns.getString("TABLE_NAME"))) {
							builder.addColumn(tableName, columns.getString("COLUMN_NAME"), columns.getString("TYPE_NAME"));
						}
					}
				}
			}
			SqlCatalog result = builder.build();
			logger.info("Reflected {} table(s) and {} distinct column name(s)",
					result.tableNames().size(), result.columnNames().size());
			return result;
		} catch (SQLException e) {
			throw new SchemaUnavailableException("Cannot read database schema: " + e.getMessage(), e);
		}
	}

	private List<String> listTables(DatabaseMetaData metaData, String catalog, String schema) throws SQLException {
		List<String> tableNames = new ArrayList<>();
		try (ResultSet tables = metaData.getTables(catalog, schema, "%", tableTypes.toArray(new String[0]))) {
			while (tables.next()) {
				tableNames.add(tables.getString("TABLE_NAME"));
			}
		}
		return tableNames;
	}

	private static String currentSchema(Connection connection) {
		try {
			return connection.getSchema();
		} catch (SQLException e) {
			logger.debug("Driver does not report a current schema: {}", e.toString());
			return null;
		}
	}

	/**
	 * Escapes LIKE wildcards so a table name such as {@code soil_data} matches only itself.
	 */
	static String escapePattern(String name, String escape) {
		if (escape == null || escape.isEmpty()) {
			return name;
		}
		StringBuilder sb = new StringBuilder(name.length() + 4);
		for (char c : name.toCharArray()) {
			if (c == '_' || c == '%' || escape.indexOf(c) >= 0) {
				sb.append(escape);
			}
			sb.append(c);
		}
		return sb.toString();
	}
}
