package org.javai.sqlgate.sql;

/**
 * Tags carried by {@link SqlNode}s.
 *
 * <p>Statement kinds describe what a (possibly nested) statement does; the remaining
 * kinds mark the structural nodes the reference collectors look for.</p>
 */
public enum NodeKind {

	SELECT("Select", Category.QUERY),
	// Forbidden kinds are searched in declaration order
	DROP("Drop", Category.DDL),
	CREATE("Create", Category.DDL),
	ALTER("Alter", Category.DDL),
	TRUNCATE("Truncate", Category.DDL),
	RENAME("Rename", Category.DDL),
	DELETE("Delete", Category.DML),
	INSERT("Insert", Category.DML),
	UPDATE("Update", Category.DML),
	MERGE("Merge", Category.DML),
	/** Any other statement (grants, session settings, ...) */
	OTHER("Other", Category.OTHER_STATEMENT),

	/** A common table expression; {@code name} is the bound name */
	CTE("CTE", Category.STRUCTURE),
	/** A column declared in a CTE's column list, {@code WITH c(a, b) AS ...} */
	CTE_COLUMN("CTE column", Category.STRUCTURE),
	/** An aliased projection; {@code name} is the alias, the single child the aliased expression */
	ALIAS("Alias", Category.STRUCTURE),
	COLUMN("Column", Category.STRUCTURE),
	TABLE("Table", Category.STRUCTURE),
	/** {@code *} or {@code t.*} */
	STAR("Star", Category.STRUCTURE),
	/** Everything else: operators, functions, literals, clauses */
	EXPRESSION("Expression", Category.STRUCTURE);

	private enum Category { QUERY, DML, DDL, OTHER_STATEMENT, STRUCTURE }

	private final String displayName;
	private final Category category;

	NodeKind(String displayName, Category category) {
		this.displayName = displayName;
		this.category = category;
	}

	public String displayName() {
		return displayName;
	}

	public boolean isDdl() {
		return category == Category.DDL;
	}

	/**
	 * @return true for statements that change stored data
	 */
	public boolean isDataMutation() {
		return category == Category.DML;
	}

	public boolean isStatement() {
		return category != Category.STRUCTURE;
	}
}
