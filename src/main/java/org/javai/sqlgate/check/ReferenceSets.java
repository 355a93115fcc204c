package org.javai.sqlgate.check;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import org.javai.sqlgate.sql.NodeKind;
import org.javai.sqlgate.sql.SqlNode;

/**
 * The names a statement introduces and references.
 *
 * <p>All sets compare names ignoring case.</p>
 *
 * @param selectAliases output names introduced by aliased projections anywhere in the statement
 * @param cteNames names bound by {@code WITH} clauses
 * @param cteColumns output names of CTEs: aliases in a CTE body and declared CTE column lists
 * @param usedTables table references that are not CTE names
 * @param realColumns column references that read stored columns
 */
public record ReferenceSets(
		SortedSet<String> selectAliases,
		SortedSet<String> cteNames,
		SortedSet<String> cteColumns,
		SortedSet<String> usedTables,
		SortedSet<String> realColumns) {

	/**
	 * Collects the reference sets of a statement tree.
	 */
	public static ReferenceSets collect(SqlNode root) {
		SortedSet<String> cteNames = names();
		SortedSet<String> cteColumns = names();
		for (SqlNode cte : root.findAll(NodeKind.CTE)) {
			addName(cteNames, cte);
			for (SqlNode child : cte.children()) {
				if (child.is(NodeKind.CTE_COLUMN)) {
					addName(cteColumns, child);
				}
			}
			cte.findAll(NodeKind.ALIAS).forEach(alias -> addName(cteColumns, alias));
		}

		SortedSet<String> selectAliases = names();
		root.findAll(NodeKind.ALIAS).forEach(alias -> addName(selectAliases, alias));

		SortedSet<String> realColumns = names();
		for (SqlNode column : root.findAll(NodeKind.COLUMN)) {
			String name = column.name();
			if (selectAliases.contains(name) || cteColumns.contains(name)) {
				continue;
			}
			if (column.alias() != null || column.hasAncestor(NodeKind.ALIAS)) {
				// part of an alias definition
				continue;
			}
			realColumns.add(name);
		}

		SortedSet<String> usedTables = names();
		root.findAll(NodeKind.TABLE).forEach(table -> addName(usedTables, table));
		usedTables.removeIf(cteNames::contains);

		return new ReferenceSets(
				Collections.unmodifiableSortedSet(selectAliases),
				Collections.unmodifiableSortedSet(cteNames),
				Collections.unmodifiableSortedSet(cteColumns),
				Collections.unmodifiableSortedSet(usedTables),
				Collections.unmodifiableSortedSet(realColumns));
	}

	private static SortedSet<String> names() {
		return new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
	}

	private static void addName(SortedSet<String> target, SqlNode node) {
		if (node.name() != null && !node.name().isBlank()) {
			target.add(node.name());
		}
	}
}
