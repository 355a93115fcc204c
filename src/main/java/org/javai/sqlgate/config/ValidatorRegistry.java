package org.javai.sqlgate.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.sqlgate.SqlValidator;
import org.javai.sqlgate.catalog.JdbcSchemaReflector;
import org.javai.sqlgate.catalog.SchemaUnavailableException;
import org.javai.sqlgate.exec.GuardedQueryRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validators for every configured data source, resolved at startup.
 *
 * <p>Callers pick a data source by id; nothing is loaded or reflected lazily.</p>
 */
public final class ValidatorRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ValidatorRegistry.class);

	private final String defaultId;
	private final Map<String, SqlValidator> validators;
	private final Map<String, GuardedQueryRunner> runners;

	private ValidatorRegistry(String defaultId, Map<String, SqlValidator> validators,
			Map<String, GuardedQueryRunner> runners) {
		this.defaultId = defaultId;
		this.validators = Collections.unmodifiableMap(validators);
		this.runners = Collections.unmodifiableMap(runners);
	}

	/**
	 * Builds a validator per data source, reflecting each schema.
	 *
	 * @throws SchemaUnavailableException if any data source's schema cannot be read
	 */
	public static ValidatorRegistry fromConfig(SqlGateConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		Map<String, SqlValidator> validators = new LinkedHashMap<>();
		Map<String, GuardedQueryRunner> runners = new LinkedHashMap<>();
		for (DataSourceConfig dataSource : config.dataSources().values()) {
			logger.info("Preparing validator for data source '{}' ({})", dataSource.id(), dataSource.dialect());
			SqlValidator validator = SqlValidator.builder()
					.connections(dataSource.connectionFactory())
					.dialect(dataSource.dialect())
					.reflector(new JdbcSchemaReflector(dataSource.tableTypes()))
					.queryTimeout(dataSource.queryTimeout())
					.maxProbeRows(dataSource.maxProbeRows())
					.build();
			validators.put(dataSource.id(), validator);
			runners.put(dataSource.id(),
					new GuardedQueryRunner(validator, dataSource.queryTimeout(), dataSource.maxResultRows()));
		}
		return new ValidatorRegistry(config.defaultDataSource(), validators, runners);
	}

	public Set<String> ids() {
		return validators.keySet();
	}

	public String defaultId() {
		return defaultId;
	}

	public SqlValidator validator(String id) {
		SqlValidator validator = validators.get(id);
		if (validator == null) {
			throw new IllegalArgumentException("Unknown data source: " + id + ". Available: " + validators.keySet());
		}
		return validator;
	}

	public SqlValidator defaultValidator() {
		return validator(defaultId);
	}

	public GuardedQueryRunner runner(String id) {
		validator(id);
		return runners.get(id);
	}
}
