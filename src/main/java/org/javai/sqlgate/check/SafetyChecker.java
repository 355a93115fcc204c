package org.javai.sqlgate.check;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.javai.sqlgate.sql.NodeKind;
import org.javai.sqlgate.sql.ParsedStatement;
import org.javai.sqlgate.sql.SqlNode;
import org.javai.sqlgate.sql.SqlParseException;

/**
 * Rejects anything but read-only queries.
 *
 * <p>Parsed statements are checked structurally: the whole tree is searched for DDL
 * and data-mutating nodes, so a mutation wrapped in an otherwise read-only query is
 * still found. When the SQL cannot be parsed, a case-insensitive keyword scan decides
 * instead. The scan can only reject: SQL it lets through still fails the semantic
 * stage, which needs a parsed statement.</p>
 */
public class SafetyChecker {

	// Search order decides which kind a message names when several are present
	private static final List<NodeKind> FORBIDDEN_KINDS = Arrays.stream(NodeKind.values())
			.filter(kind -> kind.isDdl() || kind.isDataMutation())
			.toList();

	static final List<String> HARMFUL_KEYWORDS = List.of("DROP", "DELETE", "INSERT", "UPDATE", "CREATE", "ALTER");

	public CheckResult check(ParsedStatement statement) {
		SqlNode root = statement.root();
		for (NodeKind kind : FORBIDDEN_KINDS) {
			if (root.find(kind).isPresent()) {
				return CheckResult.fail("Unsafe: " + kind.displayName() + " operation detected");
			}
		}
		if (!statement.isSelect()) {
			return CheckResult.fail("Unsafe: Non-SELECT statement");
		}
		return CheckResult.pass("Safe - SELECT only");
	}

	/**
	 * Fallback for SQL the parser rejected.
	 *
	 * @param sql the raw SQL text
	 * @param error why parsing failed
	 */
	public CheckResult checkUnparsed(String sql, SqlParseException error) {
		if (error.isEmpty() || sql == null) {
			return CheckResult.fail("Unsafe: Parse failed - empty result");
		}
		String upper = sql.toUpperCase(Locale.ROOT);
		for (String keyword : HARMFUL_KEYWORDS) {
			if (upper.contains(keyword)) {
				return CheckResult.fail("Unsafe: Harmful keyword detected (" + keyword + ")");
			}
		}
		return CheckResult.pass("Safe - Keyword check passed");
	}
}
