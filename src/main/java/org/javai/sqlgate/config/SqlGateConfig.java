package org.javai.sqlgate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data sources known to the application, keyed by id.
 *
 * <p>Resolved once at startup, typically by {@link SqlGateConfigParser}:</p>
 * <pre>{@code
 * SqlGateConfig config = new SqlGateConfigParser().parse(Path.of("sqlgate.yml"));
 * ValidatorRegistry registry = ValidatorRegistry.fromConfig(config);
 * }</pre>
 *
 * @param defaultDataSource id of the data source used when none is named
 * @param dataSources data source settings by id, in declaration order
 */
public record SqlGateConfig(String defaultDataSource, Map<String, DataSourceConfig> dataSources) {

	public SqlGateConfig {
		if (dataSources == null || dataSources.isEmpty()) {
			throw new IllegalArgumentException("At least one data source must be configured");
		}
		dataSources = Collections.unmodifiableMap(new LinkedHashMap<>(dataSources));
		if (defaultDataSource == null || defaultDataSource.isBlank()) {
			defaultDataSource = dataSources.keySet().iterator().next();
		}
		if (!dataSources.containsKey(defaultDataSource)) {
			throw new IllegalArgumentException("Default data source '" + defaultDataSource + "' is not configured");
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public DataSourceConfig dataSource(String id) {
		DataSourceConfig config = dataSources.get(id);
		if (config == null) {
			throw new IllegalArgumentException("Unknown data source: " + id + ". Available: " + dataSources.keySet());
		}
		return config;
	}

	/**
	 * Builder for {@link SqlGateConfig}.
	 */
	public static class Builder {
		private String defaultDataSource;
		private final Map<String, DataSourceConfig> dataSources = new LinkedHashMap<>();

		private Builder() {}

		public Builder defaultDataSource(String id) {
			this.defaultDataSource = id;
			return this;
		}

		public Builder dataSource(DataSourceConfig dataSource) {
			this.dataSources.put(dataSource.id(), dataSource);
			return this;
		}

		public SqlGateConfig build() {
			return new SqlGateConfig(defaultDataSource, dataSources);
		}
	}
}
