package org.javai.sqlgate.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable {@link SqlCatalog} snapshot.
 *
 * <p>Built once, either by a {@link SchemaReflector} or by hand:</p>
 *
 * <pre>{@code
 * SqlCatalog catalog = InMemorySqlCatalog.builder()
 *     .addTable("readings")
 *     .addColumn("readings", "country", "VARCHAR")
 *     .addColumn("readings", "concentration", "DOUBLE")
 *     .build();
 * }</pre>
 *
 * <p>Instances are safe to share between threads. A refreshed schema is a new
 * instance, never a modification of an existing one.</p>
 */
public final class InMemorySqlCatalog implements SqlCatalog {

	private final Map<String, SqlTable> tables;
	private final Set<String> tableNames;
	private final Set<String> columnNames;
	private final Set<String> tableKeys;
	private final Set<String> columnKeys;

	private InMemorySqlCatalog(Map<String, SqlTable> tables) {
		this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
		Set<String> names = new LinkedHashSet<>();
		Set<String> columns = new LinkedHashSet<>();
		Set<String> nameKeys = new LinkedHashSet<>();
		Set<String> columnKeySet = new LinkedHashSet<>();
		for (SqlTable table : tables.values()) {
			names.add(table.name());
			nameKeys.add(key(table.name()));
			for (SqlColumn column : table.columns()) {
				if (columnKeySet.add(key(column.name()))) {
					columns.add(column.name());
				}
			}
		}
		this.tableNames = Collections.unmodifiableSet(names);
		this.columnNames = Collections.unmodifiableSet(columns);
		this.tableKeys = Set.copyOf(nameKeys);
		this.columnKeys = Set.copyOf(columnKeySet);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return a catalog with no tables
	 */
	public static InMemorySqlCatalog empty() {
		return new InMemorySqlCatalog(Map.of());
	}

	@Override
	public Map<String, SqlTable> tables() {
		return tables;
	}

	@Override
	public Set<String> tableNames() {
		return tableNames;
	}

	@Override
	public Set<String> columnNames() {
		return columnNames;
	}

	@Override
	public boolean hasTable(String tableName) {
		return tableName != null && tableKeys.contains(key(tableName));
	}

	@Override
	public boolean hasColumn(String columnName) {
		return columnName != null && columnKeys.contains(key(columnName));
	}

	@Override
	public String toString() {
		return "InMemorySqlCatalog" + tables.keySet();
	}

	private static String key(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Fluent builder for {@link InMemorySqlCatalog}.
	 */
	public static final class Builder {

		private final Map<String, List<SqlColumn>> tables = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder addTable(String tableName) {
			if (tableName == null || tableName.isBlank()) {
				throw new IllegalArgumentException("Table name must not be blank");
			}
			tables.computeIfAbsent(tableName, t -> new ArrayList<>());
			return this;
		}

		/**
		 * Adds a column, creating the table if it does not exist yet.
		 */
		public Builder addColumn(String tableName, String columnName, String dataType) {
			addTable(tableName);
			tables.get(tableName).add(new SqlColumn(columnName, dataType));
			return this;
		}

		/**
		 * Adds a table with untyped columns.
		 */
		public Builder addTable(String tableName, String... columnNames) {
			addTable(tableName);
			for (String columnName : columnNames) {
				addColumn(tableName, columnName, null);
			}
			return this;
		}

		public InMemorySqlCatalog build() {
			Map<String, SqlTable> built = new LinkedHashMap<>();
			tables.forEach((name, columns) -> built.put(name, new SqlTable(name, columns)));
			return new InMemorySqlCatalog(built);
		}
	}
}
