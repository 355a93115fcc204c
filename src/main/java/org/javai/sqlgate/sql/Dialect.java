package org.javai.sqlgate.sql;

import java.util.Locale;
import net.sf.jsqlparser.parser.CCJSqlParser;

/**
 * SQL dialects the parser can be configured for.
 *
 * <p>JSqlParser reads one broad grammar; the dialect only switches on the parser
 * features a store needs beyond it (for example {@code [bracketed]} identifiers).</p>
 */
public enum Dialect {
	/** Standard ANSI SQL (default) */
	ANSI,
	/** PostgreSQL-specific syntax */
	POSTGRES,
	MYSQL,
	SQLITE,
	H2,
	/** SQL Server, with square-bracket quoted identifiers */
	SQLSERVER;

	/**
	 * Applies the parser features this dialect requires.
	 *
	 * @param parser the parser about to read a statement
	 */
	public void configure(CCJSqlParser parser) {
		if (this == SQLSERVER) {
			parser.withSquareBracketQuotation(true);
		}
	}

	/**
	 * Resolves a dialect from its name, ignoring case and accepting a few common aliases.
	 *
	 * @param name the dialect name, e.g. {@code "postgres"} or {@code "postgresql"}
	 * @return the dialect
	 * @throws IllegalArgumentException if the name is not recognised
	 */
	public static Dialect fromName(String name) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Dialect name must not be blank");
		}
		String normalized = name.trim().toUpperCase(Locale.ROOT);
		return switch (normalized) {
			case "POSTGRESQL", "PG" -> POSTGRES;
			case "MARIADB" -> MYSQL;
			case "MSSQL", "SQL_SERVER" -> SQLSERVER;
			case "SQLITE3" -> SQLITE;
			default -> Dialect.valueOf(normalized);
		};
	}

	/**
	 * Infers the dialect from a JDBC URL, falling back to {@link #ANSI}.
	 *
	 * @param jdbcUrl a URL such as {@code jdbc:sqlite:db/soil.db}
	 * @return the inferred dialect
	 */
	public static Dialect fromJdbcUrl(String jdbcUrl) {
		if (jdbcUrl == null) {
			return ANSI;
		}
		String url = jdbcUrl.toLowerCase(Locale.ROOT);
		if (url.startsWith("jdbc:postgresql:")) {
			return POSTGRES;
		}
		if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:")) {
			return MYSQL;
		}
		if (url.startsWith("jdbc:sqlite:")) {
			return SQLITE;
		}
		if (url.startsWith("jdbc:h2:")) {
			return H2;
		}
		if (url.startsWith("jdbc:sqlserver:")) {
			return SQLSERVER;
		}
		return ANSI;
	}
}
