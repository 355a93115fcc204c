package org.javai.sqlgate.catalog;

import org.javai.sqlgate.jdbc.ConnectionFactory;

/**
 * Produces a catalog of the tables and columns a live store holds.
 */
public interface SchemaReflector {

	/**
	 * Opens a connection, reads the schema and closes the connection again.
	 *
	 * @param connections source of the connection to read through
	 * @return an immutable catalog snapshot
	 * @throws SchemaUnavailableException if the store cannot be reached or introspected
	 */
	SqlCatalog reflect(ConnectionFactory connections);
}
