package org.javai.sqlgate;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.javai.sqlgate.catalog.JdbcSchemaReflector;
import org.javai.sqlgate.catalog.SchemaReflector;
import org.javai.sqlgate.catalog.SchemaUnavailableException;
import org.javai.sqlgate.catalog.SqlCatalog;
import org.javai.sqlgate.check.CheckResult;
import org.javai.sqlgate.check.ExecutionProber;
import org.javai.sqlgate.check.SafetyChecker;
import org.javai.sqlgate.check.SemanticChecker;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.javai.sqlgate.sql.Dialect;
import org.javai.sqlgate.sql.ParsedStatement;
import org.javai.sqlgate.sql.SqlParseException;
import org.javai.sqlgate.sql.SqlStatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether generated SQL may be executed against a store.
 *
 * <p>Each call to {@link #validate(String)} runs three stages in fixed order and stops
 * at the first failure:</p>
 * <ol>
 *   <li><b>Safety</b> - only read-only {@code SELECT} statements are accepted</li>
 *   <li><b>Semantic</b> - every referenced table and column exists in the catalog</li>
 *   <li><b>Execution</b> - the statement runs in a transaction that is rolled back</li>
 * </ol>
 *
 * <pre>{@code
 * SqlValidator validator = SqlValidator.builder()
 *     .connections(ConnectionFactory.of(dataSource))
 *     .dialect(Dialect.SQLITE)
 *     .build();
 *
 * Verdict verdict = validator.validate(sql);
 * if (!verdict.passed()) {
 *     // show verdict.message() instead of results
 * }
 * }</pre>
 *
 * <p>A validator is safe for concurrent use. The catalog is an immutable snapshot;
 * {@link #refreshCatalog()} swaps in a new one atomically, and each probe opens its
 * own connection.</p>
 */
public class SqlValidator {

	private static final Logger logger = LoggerFactory.getLogger(SqlValidator.class);

	private final SqlStatementParser parser;
	private final SafetyChecker safetyChecker;
	private final SemanticChecker semanticChecker;
	private final ExecutionProber executionProber;
	private final ConnectionFactory connections;
	private final SchemaReflector reflector;
	private final AtomicReference<SqlCatalog> catalog;

	private SqlValidator(Builder builder, SqlCatalog initialCatalog) {
		this.parser = new SqlStatementParser(builder.dialect);
		this.safetyChecker = new SafetyChecker();
		this.semanticChecker = new SemanticChecker();
		this.executionProber = new ExecutionProber(builder.connections, builder.queryTimeout, builder.maxProbeRows);
		this.connections = builder.connections;
		this.reflector = builder.reflector;
		this.catalog = new AtomicReference<>(initialCatalog);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Validates a SQL string. Never throws: every failure becomes a failing verdict.
	 *
	 * @param sql the SQL to check
	 * @return the verdict of the first failing stage, or a passing verdict
	 */
	public Verdict validate(String sql) {
		logger.debug("Validating SQL: {}", sql);
		SqlCatalog snapshot = catalog.get();

		ParsedStatement parsed = null;
		SqlParseException parseError = null;
		try {
			parsed = parser.parse(sql);
		} catch (SqlParseException e) {
			parseError = e;
		} catch (RuntimeException e) {
			logger.warn("Unexpected failure while parsing SQL", e);
			return reject(Verdict.failed(Stage.SAFETY, "Parse failed - " + e.getMessage()));
		}

		CheckResult safety;
		try {
			safety = parsed != null ? safetyChecker.check(parsed) : safetyChecker.checkUnparsed(sql, parseError);
		} catch (RuntimeException e) {
			return unexpected(Stage.SAFETY, e);
		}
		if (!safety.passed()) {
			return reject(Verdict.failed(Stage.SAFETY, safety.reason()));
		}
		logger.debug("Safety passed: {}", safety.reason());

		if (parsed == null) {
			return reject(Verdict.failed(Stage.SEMANTIC, "Parse failed - " + parseError.detail()));
		}
		CheckResult semantic;
		try {
			semantic = semanticChecker.check(parsed, snapshot).toCheckResult();
		} catch (RuntimeException e) {
			return unexpected(Stage.SEMANTIC, e);
		}
		if (!semantic.passed()) {
			return reject(Verdict.failed(Stage.SEMANTIC, semantic.reason()));
		}
		logger.debug("Semantic passed: {}", semantic.reason());

		CheckResult execution;
		try {
			execution = executionProber.probe(sql);
		} catch (RuntimeException e) {
			return unexpected(Stage.EXECUTION, e);
		}
		if (!execution.passed()) {
			return reject(Verdict.failed(Stage.EXECUTION, execution.reason()));
		}
		logger.debug("Execution passed: {}", execution.reason());
		return Verdict.passedAll();
	}

	/**
	 * @return the catalog snapshot validations currently run against
	 */
	public SqlCatalog catalog() {
		return catalog.get();
	}

	/**
	 * Re-reads the schema and replaces the catalog. Validations already running keep
	 * the snapshot they started with.
	 *
	 * @return the new catalog
	 * @throws SchemaUnavailableException if the schema cannot be read; the old catalog stays in place
	 */
	public SqlCatalog refreshCatalog() {
		SqlCatalog refreshed = reflector.reflect(connections);
		catalog.set(refreshed);
		logger.info("Catalog refreshed: {} table(s)", refreshed.tableNames().size());
		return refreshed;
	}

	public Dialect dialect() {
		return parser.dialect();
	}

	/**
	 * @return the connections validated queries are probed through
	 */
	public ConnectionFactory connections() {
		return connections;
	}

	private static Verdict reject(Verdict verdict) {
		logger.info("SQL rejected: {}", verdict.message());
		return verdict;
	}

	private static Verdict unexpected(Stage stage, RuntimeException e) {
		logger.warn("Unexpected failure in {} stage", stage.displayName(), e);
		return reject(Verdict.failed(stage, "Unexpected error: " + e.getMessage()));
	}

	/**
	 * Builder for {@link SqlValidator}.
	 */
	public static final class Builder {
		private ConnectionFactory connections;
		private Dialect dialect = Dialect.ANSI;
		private SchemaReflector reflector = new JdbcSchemaReflector();
		private SqlCatalog catalog;
		private Duration queryTimeout = ExecutionProber.DEFAULT_QUERY_TIMEOUT;
		private int maxProbeRows = ExecutionProber.DEFAULT_MAX_ROWS;

		private Builder() {}

		/**
		 * Sets where connections to the validated store come from (required).
		 */
		public Builder connections(ConnectionFactory connections) {
			this.connections = connections;
			return this;
		}

		public Builder dialect(Dialect dialect) {
			this.dialect = dialect;
			return this;
		}

		public Builder reflector(SchemaReflector reflector) {
			this.reflector = reflector;
			return this;
		}

		/**
		 * Uses the given catalog instead of reflecting one when the validator is built.
		 * {@link SqlValidator#refreshCatalog()} still reflects through the reflector.
		 */
		public Builder catalog(SqlCatalog catalog) {
			this.catalog = catalog;
			return this;
		}

		public Builder queryTimeout(Duration queryTimeout) {
			this.queryTimeout = queryTimeout;
			return this;
		}

		public Builder maxProbeRows(int maxProbeRows) {
			this.maxProbeRows = maxProbeRows;
			return this;
		}

		/**
		 * Builds the validator, reflecting the schema unless a catalog was supplied.
		 *
		 * @throws SchemaUnavailableException if the schema cannot be read
		 */
		public SqlValidator build() {
			Objects.requireNonNull(connections, "connections must be set");
			Objects.requireNonNull(dialect, "dialect must not be null");
			Objects.requireNonNull(reflector, "reflector must not be null");
			SqlCatalog initial = catalog != null ? catalog : reflector.reflect(connections);
			return new SqlValidator(this, initial);
		}
	}
}
