package org.javai.sqlgate.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.sqlgate.check.ExecutionProber;
import org.javai.sqlgate.exec.GuardedQueryRunner;
import org.javai.sqlgate.sql.Dialect;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for YAML data source configuration.
 *
 * <pre>
 * default: soil
 * datasources:
 *   soil:
 *     url: jdbc:sqlite:db/soil_pollution.db
 *     dialect: sqlite
 *     query-timeout-seconds: 30
 *     max-probe-rows: 100
 *     max-result-rows: 1000
 *     table-types: [TABLE]
 * </pre>
 */
public class SqlGateConfigParser {

	private final Yaml yaml = new Yaml();

	public SqlGateConfig parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (SqlGateConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new SqlGateConfigException("Failed to read configuration from path: " + path, e);
		}
	}

	public SqlGateConfig parse(InputStream inputStream) {
		Object data;
		try {
			data = yaml.load(inputStream);
		} catch (Exception e) {
			throw new SqlGateConfigException("Failed to read configuration from input stream", e);
		}
		return buildConfig(data);
	}

	public SqlGateConfig parse(Reader reader) {
		Object data;
		try {
			data = yaml.load(reader);
		} catch (Exception e) {
			throw new SqlGateConfigException("Failed to read configuration from reader", e);
		}
		return buildConfig(data);
	}

	public SqlGateConfig parseString(String yamlContent) {
		Object data;
		try {
			data = yaml.load(yamlContent);
		} catch (Exception e) {
			throw new SqlGateConfigException("Failed to read configuration from string", e);
		}
		return buildConfig(data);
	}

	private SqlGateConfig buildConfig(Object data) {
		Map<String, Object> root = asMap(data, "configuration root");
		Map<String, Object> dataSources = asMap(root.get("datasources"), "datasources");
		if (dataSources.isEmpty()) {
			throw new SqlGateConfigException("At least one data source must be configured under 'datasources'");
		}

		SqlGateConfig.Builder builder = SqlGateConfig.builder();
		Object defaultId = root.get("default");
		if (defaultId != null) {
			builder.defaultDataSource(String.valueOf(defaultId));
		}
		dataSources.forEach((id, settings) -> builder.dataSource(buildDataSource(id, asMap(settings, "datasources." + id))));
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new SqlGateConfigException(e.getMessage(), e);
		}
	}

	private DataSourceConfig buildDataSource(String id, Map<String, Object> settings) {
		try {
			Object dialect = settings.get("dialect");
			Object timeout = settings.get("query-timeout-seconds");
			return new DataSourceConfig(
					id,
					string(settings.get("url")),
					string(settings.get("username")),
					string(settings.get("password")),
					dialect != null ? Dialect.fromName(String.valueOf(dialect)) : null,
					timeout != null ? Duration.ofSeconds(integer(timeout, "query-timeout-seconds")) : null,
					integer(settings.getOrDefault("max-probe-rows", ExecutionProber.DEFAULT_MAX_ROWS), "max-probe-rows"),
					integer(settings.getOrDefault("max-result-rows", GuardedQueryRunner.DEFAULT_MAX_ROWS), "max-result-rows"),
					stringList(settings.get("table-types")));
		} catch (IllegalArgumentException e) {
			throw new SqlGateConfigException("Invalid data source '" + id + "': " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String path) {
		if (value instanceof Map<?, ?> map) {
			return (Map<String, Object>) map;
		}
		throw new SqlGateConfigException("Expected a mapping at '" + path + "'");
	}

	private static String string(Object value) {
		return value == null ? null : String.valueOf(value);
	}

	private static int integer(Object value, String key) {
		if (value instanceof Number number) {
			return number.intValue();
		}
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " must be a number, got: " + value);
		}
	}

	private static List<String> stringList(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof List<?> list) {
			List<String> result = new ArrayList<>();
			for (Object element : list) {
				result.add(String.valueOf(element));
			}
			return result;
		}
		return List.of(String.valueOf(value));
	}
}
