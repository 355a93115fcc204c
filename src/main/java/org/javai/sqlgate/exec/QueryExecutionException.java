package org.javai.sqlgate.exec;

/**
 * Thrown when a validated query fails while being executed for real.
 */
public class QueryExecutionException extends RuntimeException {

	public QueryExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
