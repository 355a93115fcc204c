package org.javai.sqlgate.sql;

/**
 * Helpers for identifier text as written in SQL.
 */
public final class Identifiers {

	private Identifiers() {
	}

	/**
	 * Strips one level of identifier quoting: {@code "name"}, {@code `name`} or {@code [name]}.
	 *
	 * @param identifier the identifier as it appears in SQL (may be null)
	 * @return the bare identifier
	 */
	public static String unquote(String identifier) {
		if (identifier == null) {
			return null;
		}
		String trimmed = identifier.trim();
		if (trimmed.length() < 2) {
			return trimmed;
		}
		char first = trimmed.charAt(0);
		char last = trimmed.charAt(trimmed.length() - 1);
		if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
			return trimmed.substring(1, trimmed.length() - 1);
		}
		return trimmed;
	}
}
