package org.javai.sqlgate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.Level;
import org.javai.sqlgate.catalog.InMemorySqlCatalog;
import org.javai.sqlgate.catalog.SchemaReflector;
import org.javai.sqlgate.catalog.SchemaUnavailableException;
import org.javai.sqlgate.catalog.SqlCatalog;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.javai.sqlgate.sql.Dialect;
import org.javai.sqlgate.testsupport.H2Databases;
import org.javai.sqlgate.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SqlValidatorTest {

	private ConnectionFactory connections;
	private SqlValidator validator;

	@BeforeEach
	void setUp() {
		connections = H2Databases.soilPollution();
		validator = SqlValidator.builder()
				.connections(connections)
				.dialect(Dialect.H2)
				.build();
	}

	@Nested
	@DisplayName("Passing queries")
	class PassingQueries {

		@Test
		@DisplayName("passes a valid aggregate query")
		void passesAggregateQuery() {
			Verdict verdict = validator.validate(
					"SELECT country, AVG(concentration) AS avg_concentration FROM readings "
							+ "GROUP BY country ORDER BY avg_concentration DESC");

			assertThat(verdict.passed()).isTrue();
			assertThat(verdict.stage()).isEqualTo(Stage.EXECUTION);
			assertThat(verdict.message()).isEqualTo("All validations passed");
		}

		@Test
		@DisplayName("passes joins with table aliases")
		void passesJoin() {
			Verdict verdict = validator.validate(
					"SELECT s.name, r.pollutant FROM readings r JOIN sites s ON r.site_id = s.id WHERE r.concentration > 1");

			assertThat(verdict.passed()).isTrue();
		}

		@Test
		@DisplayName("passes CTE queries")
		void passesCte() {
			Verdict verdict = validator.validate(
					"WITH c AS (SELECT country AS land FROM readings) SELECT land FROM c");

			assertThat(verdict.passed()).isTrue();
		}

		@Test
		@DisplayName("returns the same verdict for the same query")
		void isIdempotent() {
			String sql = "SELECT bogus_col FROM readings";

			assertThat(validator.validate(sql)).isEqualTo(validator.validate(sql));
		}
	}

	@Nested
	@DisplayName("Rejected queries")
	class RejectedQueries {

		@Test
		@DisplayName("stops destructive statements at the safety stage")
		void rejectsDrop() {
			Verdict verdict = validator.validate("DROP TABLE readings");

			assertThat(verdict.passed()).isFalse();
			assertThat(verdict.stage()).isEqualTo(Stage.SAFETY);
			assertThat(verdict.message()).isEqualTo("Safety failed: Unsafe: Drop operation detected");
			assertThat(H2Databases.count(connections, "readings")).isEqualTo(3);
		}

		@Test
		@DisplayName("stops a mutation hidden behind a query")
		void rejectsInsertSelect() {
			Verdict verdict = validator.validate("INSERT INTO sites SELECT id, country, country FROM readings");

			assertThat(verdict.message()).isEqualTo("Safety failed: Unsafe: Insert operation detected");
			assertThat(H2Databases.count(connections, "sites")).isEqualTo(2);
		}

		@Test
		@DisplayName("reports unknown columns at the semantic stage")
		void rejectsUnknownColumn() {
			Verdict verdict = validator.validate("SELECT bogus_col FROM readings");

			assertThat(verdict.stage()).isEqualTo(Stage.SEMANTIC);
			assertThat(verdict.message()).isEqualTo("Semantic failed: Missing columns: [bogus_col]");
		}

		@Test
		@DisplayName("reports unknown tables at the semantic stage")
		void rejectsUnknownTable() {
			Verdict verdict = validator.validate("SELECT * FROM nonexistent_table");

			assertThat(verdict.message()).isEqualTo("Semantic failed: Missing tables: [nonexistent_table]");
		}

		@Test
		@DisplayName("lets the execution stage catch errors the catalog cannot see")
		void rejectsAtExecution() {
			Verdict verdict = validator.validate("SELECT UPPER(bogus_col) AS label FROM readings");

			assertThat(verdict.stage()).isEqualTo(Stage.EXECUTION);
			assertThat(verdict.message()).startsWith("Execution failed: Runtime error: ");
		}

		@Test
		@DisplayName("rejects blank input")
		void rejectsBlank() {
			Verdict verdict = validator.validate("  ");

			assertThat(verdict.message()).isEqualTo("Safety failed: Unsafe: Parse failed - empty result");
		}

		@Test
		@DisplayName("rejects unparseable SQL with harmful keywords at the safety stage")
		void rejectsHarmfulGarbage() {
			Verdict verdict = validator.validate("DELETE readings WHERE ((");

			assertThat(verdict.message()).isEqualTo("Safety failed: Unsafe: Harmful keyword detected (DELETE)");
		}

		@Test
		@DisplayName("rejects other unparseable SQL at the semantic stage")
		void rejectsHarmlessGarbage() {
			Verdict verdict = validator.validate("SELEC country FROM readings");

			assertThat(verdict.stage()).isEqualTo(Stage.SEMANTIC);
			assertThat(verdict.message()).startsWith("Semantic failed: Parse failed - ");
		}

		@Test
		@DisplayName("stops a destructive statement stacked behind a query")
		void rejectsStackedDrop() {
			Verdict verdict = validator.validate("SELECT country FROM readings; DROP TABLE sites");

			assertThat(verdict.passed()).isFalse();
			assertThat(verdict.stage()).isEqualTo(Stage.SAFETY);
			assertThat(verdict.message()).isEqualTo("Safety failed: Unsafe: Harmful keyword detected (DROP)");
			assertThat(H2Databases.count(connections, "sites")).isEqualTo(2);
		}

		@Test
		@DisplayName("rejects several queries in one string")
		void rejectsStackedQueries() {
			Verdict verdict = validator.validate("SELECT country FROM readings; SELECT name FROM sites");

			assertThat(verdict.stage()).isEqualTo(Stage.SEMANTIC);
			assertThat(verdict.message()).startsWith("Semantic failed: Parse failed - multiple statements");
		}

		@Test
		@DisplayName("stops a delete inside a common table expression")
		void rejectsModifyingCte() {
			Verdict verdict = validator.validate("WITH d AS (DELETE FROM readings RETURNING *) SELECT * FROM d");

			assertThat(verdict.passed()).isFalse();
			assertThat(verdict.stage()).isEqualTo(Stage.SAFETY);
			assertThat(verdict.message()).containsIgnoringCase("delete");
			assertThat(H2Databases.count(connections, "readings")).isEqualTo(3);
		}

		@Test
		@DisplayName("rejects input holding only comments")
		void rejectsCommentOnly() {
			Verdict verdict = validator.validate("-- nothing to run\n/* still nothing */");

			assertThat(verdict.stage()).isEqualTo(Stage.SAFETY);
			assertThat(verdict.message()).isEqualTo("Safety failed: Unsafe: Parse failed - empty result");
		}

		@Test
		@DisplayName("returns a verdict for very long conditions")
		void handlesLongConditions() {
			StringBuilder sql = new StringBuilder("SELECT country FROM readings WHERE concentration = 0");
			for (int i = 1; i < 3000; i++) {
				sql.append(" OR concentration = ").append(i);
			}

			Verdict[] verdict = new Verdict[1];
			assertThatCode(() -> verdict[0] = validator.validate(sql.toString())).doesNotThrowAnyException();
			assertThat(verdict[0].stage()).isEqualTo(Stage.EXECUTION);
		}

		@Test
		@DisplayName("logs each rejection")
		void logsRejections() {
			try (LogCaptorAppender captor = LogCaptorAppender.capture(SqlValidator.class, Level.INFO)) {
				validator.validate("DROP TABLE readings");

				assertThat(captor.messagesAt(Level.INFO))
						.contains("SQL rejected: Safety failed: Unsafe: Drop operation detected");
			}
		}
	}

	@Nested
	@DisplayName("Catalog lifecycle")
	class CatalogLifecycle {

		@Test
		@DisplayName("sees new tables only after a refresh")
		void refreshesCatalog() {
			H2Databases.execute(connections, "CREATE TABLE samples (id INT, depth_cm INT)");
			String sql = "SELECT depth_cm FROM samples";

			assertThat(validator.validate(sql).message()).isEqualTo("Semantic failed: Missing tables: [samples]");

			SqlCatalog refreshed = validator.refreshCatalog();

			assertThat(refreshed.hasTable("samples")).isTrue();
			assertThat(validator.catalog()).isSameAs(refreshed);
			assertThat(validator.validate(sql).passed()).isTrue();
		}

		@Test
		@DisplayName("uses a supplied catalog without reflecting")
		void usesSuppliedCatalog() {
			SchemaReflector reflector = mock(SchemaReflector.class);
			SqlCatalog catalog = InMemorySqlCatalog.builder().addTable("readings", "country").build();

			SqlValidator supplied = SqlValidator.builder()
					.connections(connections)
					.reflector(reflector)
					.catalog(catalog)
					.build();

			verify(reflector, never()).reflect(any());
			assertThat(supplied.catalog()).isSameAs(catalog);
			assertThat(supplied.validate("SELECT concentration FROM readings").message())
					.isEqualTo("Semantic failed: Missing columns: [concentration]");
		}

		@Test
		@DisplayName("keeps the old catalog when a refresh fails")
		void keepsCatalogOnFailedRefresh() {
			SchemaReflector reflector = mock(SchemaReflector.class);
			SqlCatalog catalog = InMemorySqlCatalog.builder().addTable("readings", "country").build();
			when(reflector.reflect(any())).thenThrow(new SchemaUnavailableException("Cannot read database schema: gone", null));
			SqlValidator supplied = SqlValidator.builder()
					.connections(connections)
					.reflector(reflector)
					.catalog(catalog)
					.build();

			assertThatThrownBy(supplied::refreshCatalog).isInstanceOf(SchemaUnavailableException.class);
			assertThat(supplied.catalog()).isSameAs(catalog);
		}

		@Test
		@DisplayName("fails to build when the schema cannot be read")
		void failsWithoutSchema() {
			assertThatThrownBy(() -> SqlValidator.builder()
					.connections(() -> {
						throw new SQLException("no such database");
					})
					.build())
					.isInstanceOf(SchemaUnavailableException.class)
					.hasMessageContaining("no such database");
		}

		@Test
		@DisplayName("requires a connection factory")
		void requiresConnections() {
			assertThatThrownBy(() -> SqlValidator.builder().build())
					.isInstanceOf(NullPointerException.class);
		}
	}

	@Test
	@DisplayName("validates concurrently")
	void validatesConcurrently() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try {
			List<Future<Verdict>> verdicts = new ArrayList<>();
			for (int i = 0; i < 32; i++) {
				String sql = i % 2 == 0
						? "SELECT country FROM readings WHERE concentration > " + i
						: "DELETE FROM readings WHERE id = " + i;
				verdicts.add(executor.submit(() -> validator.validate(sql)));
			}
			for (int i = 0; i < verdicts.size(); i++) {
				Verdict verdict = verdicts.get(i).get(10, TimeUnit.SECONDS);
				assertThat(verdict.passed()).isEqualTo(i % 2 == 0);
			}
		} finally {
			executor.shutdownNow();
		}
		assertThat(H2Databases.count(connections, "readings")).isEqualTo(3);
	}
}
