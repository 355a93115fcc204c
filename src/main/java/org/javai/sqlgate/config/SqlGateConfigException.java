package org.javai.sqlgate.config;

/**
 * Thrown when configuration cannot be read or is invalid.
 */
public class SqlGateConfigException extends RuntimeException {

	public SqlGateConfigException(String message) {
		super(message);
	}

	public SqlGateConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
