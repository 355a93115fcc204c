package org.javai.sqlgate.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import org.javai.sqlgate.jdbc.ConnectionFactory;
import org.javai.sqlgate.testsupport.H2Databases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class ExecutionProberTest {

	@Nested
	@DisplayName("Against a live database")
	class LiveDatabase {

		private ConnectionFactory connections;
		private ExecutionProber prober;

		@BeforeEach
		void setUp() {
			connections = H2Databases.soilPollution();
			prober = new ExecutionProber(connections);
		}

		@Test
		@DisplayName("passes a query that runs")
		void passesRunnableQuery() {
			CheckResult result = prober.probe("SELECT country, AVG(concentration) FROM readings GROUP BY country");

			assertThat(result.passed()).isTrue();
			assertThat(result.reason()).isEqualTo("Executed successfully");
		}

		@Test
		@DisplayName("reports the driver message when the query fails")
		void reportsRuntimeErrors() {
			CheckResult result = prober.probe("SELECT no_such_function(country) FROM readings");

			assertThat(result.passed()).isFalse();
			assertThat(result.reason()).startsWith("Runtime error: ").containsIgnoringCase("no_such_function");
		}

		@Test
		@DisplayName("rolls back whatever the statement changed")
		void rollsBackChanges() {
			// Given
			long before = H2Databases.count(connections, "readings");

			// When
			CheckResult result = prober.probe("DELETE FROM readings");

			// Then
			assertThat(result.passed()).isTrue();
			assertThat(H2Databases.count(connections, "readings")).isEqualTo(before);
		}

		@Test
		@DisplayName("stops reading after the row limit")
		void limitsRows() {
			ExecutionProber limited = new ExecutionProber(connections, Duration.ofSeconds(5), 1);

			CheckResult result = limited.probe("SELECT * FROM readings");

			assertThat(result.passed()).isTrue();
		}

		@Test
		@DisplayName("fails when no connection can be opened")
		void failsWithoutConnection() {
			ExecutionProber unreachable = new ExecutionProber(() -> {
				throw new SQLException("Connection refused");
			});

			CheckResult result = unreachable.probe("SELECT 1");

			assertThat(result.passed()).isFalse();
			assertThat(result.reason()).isEqualTo("Runtime error: Connection refused");
		}
	}

	@Nested
	@DisplayName("Transaction handling")
	@ExtendWith(MockitoExtension.class)
	class TransactionHandling {

		@Mock
		private Connection connection;

		@Mock
		private Statement statement;

		private final ExecutionProber prober = new ExecutionProber(() -> {
			throw new SQLException("not used");
		});

		@Test
		@DisplayName("rolls back and restores auto-commit after a failure")
		void restoresAfterFailure() throws SQLException {
			when(connection.getAutoCommit()).thenReturn(true);
			when(connection.createStatement()).thenReturn(statement);
			when(statement.execute(anyString())).thenThrow(new SQLException("Table \"NOPE\" not found"));

			CheckResult result = prober.probe("SELECT * FROM nope", connection);

			assertThat(result.reason()).isEqualTo("Runtime error: Table \"NOPE\" not found");
			InOrder order = inOrder(connection);
			order.verify(connection).setAutoCommit(false);
			order.verify(connection).rollback();
			order.verify(connection).setAutoCommit(true);
			verify(statement).close();
		}

		@Test
		@DisplayName("applies the query timeout in whole seconds")
		void appliesTimeout() throws SQLException {
			ExecutionProber timed = new ExecutionProber(() -> connection, Duration.ofMillis(1500), 10);
			when(connection.getAutoCommit()).thenReturn(false);
			when(connection.createStatement()).thenReturn(statement);
			when(statement.execute(anyString())).thenReturn(false);

			CheckResult result = timed.probe("UPDATE readings SET concentration = 0");

			assertThat(result.passed()).isTrue();
			verify(statement).setQueryTimeout(2);
			verify(statement).setMaxRows(10);
			verify(connection).rollback();
			verify(connection, times(2)).setAutoCommit(false);
			verify(connection).close();
		}

		@Test
		@DisplayName("restores auto-commit even when rollback fails")
		void restoresWhenRollbackFails() throws SQLException {
			when(connection.getAutoCommit()).thenReturn(true);
			when(connection.createStatement()).thenReturn(statement);
			when(statement.execute(anyString())).thenReturn(false);
			doThrow(new SQLException("rollback failed")).when(connection).rollback();

			assertThatThrownBy(() -> prober.probe("SELECT 1", connection))
					.isInstanceOf(SQLException.class)
					.hasMessage("rollback failed");
			verify(connection).setAutoCommit(true);
		}
	}

	@Test
	@DisplayName("rejects a non-positive row limit")
	void rejectsInvalidRowLimit() {
		assertThatThrownBy(() -> new ExecutionProber(() -> null, Duration.ofSeconds(1), 0))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
