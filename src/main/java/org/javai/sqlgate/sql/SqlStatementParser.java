package org.javai.sqlgate.sql;

import java.util.Objects;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses raw SQL text into a {@link ParsedStatement} for a declared dialect.
 *
 * <p>Instances are stateless and safe to share between threads.</p>
 */
public class SqlStatementParser {

	private static final Logger logger = LoggerFactory.getLogger(SqlStatementParser.class);

	private static final Pattern EXCEPTION_PREFIX = Pattern.compile("^(?:[\\w$]+\\.)*[\\w$]*(?:Exception|Error):\\s*");

	private final Dialect dialect;

	public SqlStatementParser(Dialect dialect) {
		this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
	}

	public Dialect dialect() {
		return dialect;
	}

	/**
	 * Parses a single SQL statement.
	 *
	 * @param sql the SQL text
	 * @return the parsed statement with its tagged tree
	 * @throws SqlParseException with reason {@code EMPTY} for input holding nothing but whitespace and comments,
	 * {@code SYNTAX} if the parser rejects it or it holds more than one statement
	 */
	public ParsedStatement parse(String sql) {
		if (sql == null || isEmpty(sql)) {
			throw SqlParseException.empty();
		}

		Statements statements;
		try {
			statements = CCJSqlParserUtil.parseStatements(sql, dialect::configure);
		} catch (JSQLParserException e) {
			String detail = firstLine(e);
			logger.debug("Failed to parse SQL as {}: {}", dialect, detail);
			throw SqlParseException.syntax(detail, e);
		} catch (StackOverflowError e) {
			throw tooDeep(e);
		}
		if (statements == null || statements.isEmpty()) {
			throw SqlParseException.empty();
		}
		if (statements.size() > 1) {
			logger.debug("Rejecting {} stacked statements", statements.size());
			throw SqlParseException.syntax("multiple statements (" + statements.size() + ")", null);
		}

		SqlNode root;
		try {
			root = SqlTreeBuilder.build(statements.get(0));
		} catch (StackOverflowError e) {
			throw tooDeep(e);
		}
		logger.debug("Parsed {} statement", root.kind().displayName());
		return new ParsedStatement(sql, dialect, root);
	}

	private static SqlParseException tooDeep(StackOverflowError error) {
		logger.debug("SQL nesting exhausted the stack");
		return SqlParseException.syntax("statement nested too deeply", error);
	}

	/**
	 * @return true if the text holds nothing but whitespace, {@code --} line comments and block comments
	 */
	static boolean isEmpty(String sql) {
		int i = 0;
		int length = sql.length();
		while (i < length) {
			char c = sql.charAt(i);
			if (Character.isWhitespace(c) || c == ';') {
				i++;
			} else if (sql.startsWith("--", i)) {
				int newline = sql.indexOf('\n', i);
				i = newline < 0 ? length : newline + 1;
			} else if (sql.startsWith("/*", i)) {
				int close = sql.indexOf("*/", i + 2);
				if (close < 0) {
					// unterminated comment: leave it to the parser
					return false;
				}
				i = close + 2;
			} else {
				return false;
			}
		}
		return true;
	}

	private static String firstLine(Throwable error) {
		String message = error.getMessage();
		if ((message == null || message.isBlank()) && error.getCause() != null) {
			message = error.getCause().getMessage();
		}
		if (message == null || message.isBlank()) {
			return error.getClass().getSimpleName();
		}
		String line = message.strip();
		int newline = line.indexOf('\n');
		if (newline >= 0) {
			line = line.substring(0, newline).strip();
		}
		// wrapped exceptions repeat the class name of the cause
		String stripped = EXCEPTION_PREFIX.matcher(line).replaceFirst("");
		return stripped.isBlank() ? line : stripped;
	}
}
