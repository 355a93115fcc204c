package org.javai.sqlgate.sql;

import java.util.Objects;

/**
 * A statement parsed for one validation call.
 *
 * @param sql the original SQL text
 * @param dialect the dialect it was parsed with
 * @param root the tagged tree used by the checks
 */
public record ParsedStatement(String sql, Dialect dialect, SqlNode root) {

	public ParsedStatement {
		Objects.requireNonNull(sql, "sql must not be null");
		Objects.requireNonNull(dialect, "dialect must not be null");
		Objects.requireNonNull(root, "root must not be null");
		if (!root.kind().isStatement()) {
			throw new IllegalArgumentException("Root node must be a statement, got " + root.kind());
		}
	}

	/**
	 * @return the kind of the top-level statement
	 */
	public NodeKind kind() {
		return root.kind();
	}

	public boolean isSelect() {
		return root.kind() == NodeKind.SELECT;
	}
}
