package org.javai.sqlgate.sql;

/**
 * Base exception for SQL that cannot be accepted for execution.
 *
 * <p>Subtypes distinguish SQL that cannot be parsed ({@link SqlParseException}) from
 * SQL that parsed but was rejected by the validation pipeline.</p>
 */
public class QueryValidationException extends RuntimeException {

	public QueryValidationException(String message) {
		super(message);
	}

	public QueryValidationException(String message, Throwable cause) {
		super(message, cause);
	}
}
