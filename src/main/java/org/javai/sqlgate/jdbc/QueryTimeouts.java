package org.javai.sqlgate.jdbc;

import java.time.Duration;
import java.util.Objects;

/**
 * Conversion of timeouts to the whole seconds {@link java.sql.Statement#setQueryTimeout(int)} takes.
 */
public final class QueryTimeouts {

	private QueryTimeouts() {
	}

	/**
	 * Rounds up to whole seconds, so a sub-second timeout still limits the query.
	 *
	 * @param timeout the timeout; zero disables it
	 * @return seconds for {@code setQueryTimeout}, capped at {@link Integer#MAX_VALUE}
	 */
	public static int seconds(Duration timeout) {
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must not be negative");
		}
		long seconds = timeout.toSeconds();
		if (timeout.getNano() > 0) {
			seconds++;
		}
		return (int) Math.min(seconds, Integer.MAX_VALUE);
	}
}
