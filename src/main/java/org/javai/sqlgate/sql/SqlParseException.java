package org.javai.sqlgate.sql;

/**
 * Thrown when SQL text cannot be turned into a statement tree.
 */
public class SqlParseException extends QueryValidationException {

	/**
	 * Why parsing failed.
	 */
	public enum Reason {
		/** Input was null, blank, or contained no statement */
		EMPTY,
		/** The parser rejected the input */
		SYNTAX
	}

	private final Reason reason;
	private final String detail;

	private SqlParseException(Reason reason, String detail, Throwable cause) {
		super(reason == Reason.EMPTY ? "SQL string cannot be null or blank" : "Invalid SQL syntax: " + detail, cause);
		this.reason = reason;
		this.detail = detail;
	}

	public static SqlParseException empty() {
		return new SqlParseException(Reason.EMPTY, "empty result", null);
	}

	public static SqlParseException syntax(String detail, Throwable cause) {
		return new SqlParseException(Reason.SYNTAX, detail, cause);
	}

	public Reason reason() {
		return reason;
	}

	public boolean isEmpty() {
		return reason == Reason.EMPTY;
	}

	/**
	 * @return a one-line description of the failure, suitable for verdict messages
	 */
	public String detail() {
		return detail;
	}
}
