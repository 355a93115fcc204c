package org.javai.sqlgate.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the tables and columns a store holds.
 *
 * <p>Name lookups ignore case: unquoted SQL identifiers fold case, and stores differ in
 * which case they report metadata in. Column lookups are flat, i.e. a column name is
 * known if any table has it.</p>
 */
public interface SqlCatalog {

	/**
	 * @return map of table name to table metadata, in reflection order (non-null; may be empty)
	 */
	Map<String, SqlTable> tables();

	/**
	 * @return every table name
	 */
	Set<String> tableNames();

	/**
	 * @return every column name, flattened across tables
	 */
	Set<String> columnNames();

	boolean hasTable(String tableName);

	boolean hasColumn(String columnName);

	default Optional<SqlTable> findTable(String tableName) {
		if (tableName == null) {
			return Optional.empty();
		}
		return tables().values().stream()
				.filter(table -> table.name().equalsIgnoreCase(tableName))
				.findFirst();
	}

	record SqlTable(String name, List<SqlColumn> columns) {

		public SqlTable {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Table name must not be blank");
			}
			columns = columns == null ? List.of() : List.copyOf(columns);
		}

		public Optional<SqlColumn> findColumn(String columnName) {
			if (columnName == null) {
				return Optional.empty();
			}
			return columns.stream()
					.filter(column -> column.name().equalsIgnoreCase(columnName))
					.findFirst();
		}
	}

	/**
	 * @param name column name as the store reports it
	 * @param dataType the store's type name, e.g. {@code VARCHAR}; may be null
	 */
	record SqlColumn(String name, String dataType) {

		public SqlColumn {
			if (name == null || name.isBlank()) {
				throw new IllegalArgumentException("Column name must not be blank");
			}
		}
	}
}
