package org.javai.sqlgate.check;

import java.util.Set;

/**
 * Result of checking a statement's references against a catalog.
 *
 * @param references the names the statement introduces and references
 * @param missingTables referenced tables the catalog does not know
 * @param missingColumns referenced columns the catalog does not know
 */
public record SemanticReport(ReferenceSets references, Set<String> missingTables, Set<String> missingColumns) {

	public SemanticReport {
		missingTables = Set.copyOf(missingTables);
		missingColumns = Set.copyOf(missingColumns);
	}

	public boolean passed() {
		return missingTables.isEmpty() && missingColumns.isEmpty();
	}

	/**
	 * Missing tables are reported ahead of missing columns.
	 */
	public CheckResult toCheckResult() {
		if (!missingTables.isEmpty()) {
			return CheckResult.fail("Missing tables: " + SemanticChecker.sorted(missingTables));
		}
		if (!missingColumns.isEmpty()) {
			return CheckResult.fail("Missing columns: " + SemanticChecker.sorted(missingColumns));
		}
		return CheckResult.pass("Schema valid");
	}
}
