package org.javai.sqlgate.check;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.sqlgate.catalog.SqlCatalog;
import org.javai.sqlgate.sql.ParsedStatement;

/**
 * Checks that a statement only references tables and columns the catalog knows.
 *
 * <p>Names local to the query are not schema references: projection aliases (also
 * inside subqueries), CTE names and CTE output columns are excluded, as are column
 * references that sit inside an alias definition. Columns are matched against the
 * flattened column set of the catalog, without regard to which table they belong to.</p>
 */
public class SemanticChecker {

	public SemanticReport check(ParsedStatement statement, SqlCatalog catalog) {
		ReferenceSets references = ReferenceSets.collect(statement.root());

		Set<String> missingTables = new LinkedHashSet<>();
		for (String table : references.usedTables()) {
			if (!catalog.hasTable(table)) {
				missingTables.add(table);
			}
		}
		Set<String> missingColumns = new LinkedHashSet<>();
		for (String column : references.realColumns()) {
			if (!catalog.hasColumn(column)) {
				missingColumns.add(column);
			}
		}
		return new SemanticReport(references, missingTables, missingColumns);
	}

	static List<String> sorted(Collection<String> names) {
		return names.stream().sorted(String.CASE_INSENSITIVE_ORDER).toList();
	}
}
