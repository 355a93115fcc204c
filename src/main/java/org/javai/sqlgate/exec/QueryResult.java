package org.javai.sqlgate.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by a guarded query.
 *
 * @param columns column labels in select-list order
 * @param rows one map per row, keyed by column label in select-list order
 * @param truncated true if the row limit cut the result short
 */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows, boolean truncated) {

	public QueryResult {
		columns = List.copyOf(columns);
		// values may be SQL NULL, so rows are wrapped rather than copied with Map.copyOf
		rows = rows.stream()
				.map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
				.toList();
	}

	public int rowCount() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}
}
