package org.javai.sqlgate.catalog;

/**
 * Thrown when the schema of a store cannot be read.
 *
 * <p>Without a catalog no query can be checked, so this is fatal for building a validator.</p>
 */
public class SchemaUnavailableException extends RuntimeException {

	public SchemaUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
