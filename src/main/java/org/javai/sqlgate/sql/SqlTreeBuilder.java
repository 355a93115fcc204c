package org.javai.sqlgate.sql;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.statement.upsert.Upsert;

/**
 * Converts a JSqlParser statement into the tagged {@link SqlNode} tree.
 *
 * <p>JSqlParser has no uniform way to enumerate a node's children, and its visitor
 * interfaces only reach the parts each visitor chooses to follow. The builder
 * therefore names the handful of nodes the checks care about (columns, tables,
 * aliased projections, CTEs, statements) and descends through every other parser
 * object field by field, so a mutating statement nested anywhere in the tree
 * still shows up.</p>
 */
final class SqlTreeBuilder {

	private static final String PARSER_PACKAGE = "net.sf.jsqlparser.";
	// JavaCC/JJTree internals: tokens and the concrete syntax tree hanging off every AST node
	private static final String GENERATED_PACKAGE = "net.sf.jsqlparser.parser.";

	// Identifiers JSqlParser may read as columns although they are literals
	private static final Set<String> LITERAL_IDENTIFIERS = Set.of("TRUE", "FALSE", "NULL");

	private static final ClassValue<List<Field>> CHILD_FIELDS = new ClassValue<>() {
		@Override
		protected List<Field> computeValue(Class<?> type) {
			List<Field> fields = new ArrayList<>();
			for (Class<?> current = type; current != null && isParserType(current); current = current.getSuperclass()) {
				for (Field field : current.getDeclaredFields()) {
					Class<?> fieldType = field.getType();
					if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()
							|| fieldType.isPrimitive() || fieldType == String.class
							|| fieldType.getName().startsWith(GENERATED_PACKAGE)) {
						continue;
					}
					fields.add(open(field));
				}
			}
			return List.copyOf(fields);
		}
	};

	private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());

	private SqlTreeBuilder() {
	}

	/**
	 * Builds the tagged tree for a parsed statement.
	 *
	 * @param statement the statement returned by JSqlParser
	 * @return the root node, whose kind is always a statement kind
	 * @throws IllegalStateException if a parser field cannot be inspected
	 */
	static SqlNode build(Statement statement) {
		return new SqlTreeBuilder().convert(statement);
	}

	/**
	 * Makes a parser field readable. A field that stays closed would hide part of the
	 * statement, so it is an error rather than a gap in the tree.
	 */
	static Field open(Field field) {
		if (!field.trySetAccessible()) {
			throw new IllegalStateException("Cannot inspect parser field " + field);
		}
		return field;
	}

	/*
	 * Depth-first conversion with an explicit stack of partly built nodes, so the
	 * depth of the statement (long AND/OR chains are left-deep) does not use the
	 * call stack.
	 */
	private SqlNode convert(Object root) {
		Deque<PendingNode> stack = new ArrayDeque<>();
		SqlNode leaf = start(root, stack);
		if (leaf != null) {
			return leaf;
		}
		if (stack.isEmpty()) {
			throw new IllegalStateException("Nothing to convert in " + root.getClass().getName());
		}
		while (true) {
			PendingNode top = stack.peek();
			Object next = top.nextValue();
			if (next != null) {
				SqlNode child = start(next, stack);
				if (child != null) {
					top.children.add(child);
				}
				continue;
			}
			stack.pop();
			SqlNode finished = top.finish();
			if (stack.isEmpty()) {
				return finished;
			}
			stack.peek().children.add(finished);
		}
	}

	/**
	 * Converts a leaf at once, or pushes a pending node for anything with children.
	 *
	 * @return the leaf node, or null if a node was pushed or the object was already converted
	 */
	private SqlNode start(Object source, Deque<PendingNode> stack) {
		if (!visited.add(source)) {
			return null;
		}
		if (source instanceof Column column) {
			return columnNode(column, null);
		}
		if (source instanceof AllColumns || source instanceof AllTableColumns) {
			return SqlNode.leaf(NodeKind.STAR, null);
		}
		if (source instanceof Table table) {
			return tableNode(table);
		}
		if (source instanceof SelectItem<?> item) {
			return startSelectItem(item, stack);
		}
		if (source instanceof WithItem<?> withItem) {
			PendingNode cte = new PendingNode(NodeKind.CTE, Identifiers.unquote(withItem.getAliasName()));
			List<SelectItem<?>> declaredColumns = withItem.getWithItemList();
			if (declaredColumns != null) {
				for (SelectItem<?> declared : declaredColumns) {
					cte.children.add(SqlNode.leaf(NodeKind.CTE_COLUMN, declaredColumnName(declared)));
				}
			}
			cte.queueChildren(withItem, declaredColumns);
			stack.push(cte);
			return null;
		}

		PendingNode node = new PendingNode(kindOf(source), source.getClass().getSimpleName());
		if (source instanceof PlainSelect plainSelect
				&& plainSelect.getIntoTables() != null && !plainSelect.getIntoTables().isEmpty()) {
			// SELECT ... INTO creates a table
			node.children.add(SqlNode.leaf(NodeKind.CREATE, "SELECT INTO"));
		}
		node.queueChildren(source, null);
		stack.push(node);
		return null;
	}

	private SqlNode startSelectItem(SelectItem<?> item, Deque<PendingNode> stack) {
		Expression expression = item.getExpression();
		Alias alias = item.getAlias();
		if (alias == null || alias.getName() == null) {
			// an unaliased item stands for its expression
			return expression != null ? start(expression, stack) : null;
		}
		String aliasName = Identifiers.unquote(alias.getName());
		PendingNode aliased = new PendingNode(NodeKind.ALIAS, aliasName);
		if (expression instanceof Column column) {
			visited.add(column);
			aliased.children.add(columnNode(column, aliasName));
		} else if (expression != null) {
			aliased.pending.add(expression);
		}
		stack.push(aliased);
		return null;
	}

	private static NodeKind kindOf(Object source) {
		if (source instanceof Select) {
			return NodeKind.SELECT;
		}
		if (source instanceof Insert || source instanceof Upsert) {
			return NodeKind.INSERT;
		}
		if (source instanceof Update) {
			return NodeKind.UPDATE;
		}
		if (source instanceof Delete) {
			return NodeKind.DELETE;
		}
		if (source instanceof Merge) {
			return NodeKind.MERGE;
		}
		if (!(source instanceof Statement)) {
			return NodeKind.EXPRESSION;
		}
		// DDL statements come in many classes: CreateTable, CreateView, AlterView, Drop, RenameTableStatement, ...
		String simpleName = source.getClass().getSimpleName();
		if (simpleName.startsWith("Create")) {
			return NodeKind.CREATE;
		}
		if (simpleName.startsWith("Alter")) {
			return NodeKind.ALTER;
		}
		if (simpleName.startsWith("Drop")) {
			return NodeKind.DROP;
		}
		if (simpleName.startsWith("Truncate")) {
			return NodeKind.TRUNCATE;
		}
		if (simpleName.startsWith("Rename")) {
			return NodeKind.RENAME;
		}
		return NodeKind.OTHER;
	}

	private SqlNode columnNode(Column column, String alias) {
		String name = Identifiers.unquote(column.getColumnName());
		if (name == null || LITERAL_IDENTIFIERS.contains(name.toUpperCase(Locale.ROOT))) {
			return SqlNode.leaf(NodeKind.EXPRESSION, name);
		}
		return SqlNode.leaf(NodeKind.COLUMN, name, alias);
	}

	private SqlNode tableNode(Table table) {
		Alias alias = table.getAlias();
		return SqlNode.leaf(NodeKind.TABLE, Identifiers.unquote(table.getName()),
				alias != null ? Identifiers.unquote(alias.getName()) : null);
	}

	private static String declaredColumnName(SelectItem<?> declared) {
		if (declared.getAlias() != null && declared.getAlias().getName() != null) {
			return Identifiers.unquote(declared.getAlias().getName());
		}
		if (declared.getExpression() instanceof Column column) {
			return Identifiers.unquote(column.getColumnName());
		}
		return Identifiers.unquote(declared.toString());
	}

	/**
	 * A node whose children are still being converted.
	 */
	private static final class PendingNode {
		private final NodeKind kind;
		private final String name;
		private final List<SqlNode> children = new ArrayList<>();
		// raw values still to convert, in source order; collections are expanded lazily
		private final Deque<Object> pending = new ArrayDeque<>();

		PendingNode(NodeKind kind, String name) {
			this.kind = kind;
			this.name = name;
		}

		void queueChildren(Object source, Object skipped) {
			if (source instanceof Iterable<?> elements) {
				// e.g. ExpressionList, which is itself a list
				for (Object element : elements) {
					queue(element);
				}
			}
			for (Field field : CHILD_FIELDS.get(source.getClass())) {
				Object value = read(field, source);
				if (value != skipped) {
					queue(value);
				}
			}
		}

		private void queue(Object value) {
			if (value != null) {
				pending.addLast(value);
			}
		}

		/**
		 * @return the next parser object to convert, or null when all children are done
		 */
		Object nextValue() {
			Object value;
			while ((value = pending.pollFirst()) != null) {
				if (isParserType(value.getClass())) {
					return value;
				}
				List<Object> elements = new ArrayList<>();
				if (value instanceof Iterable<?> iterable) {
					iterable.forEach(elements::add);
				} else if (value instanceof Map<?, ?> map) {
					for (Map.Entry<?, ?> entry : map.entrySet()) {
						elements.add(entry.getKey());
						elements.add(entry.getValue());
					}
				} else if (value instanceof Object[] array) {
					elements.addAll(Arrays.asList(array));
				}
				for (int i = elements.size() - 1; i >= 0; i--) {
					if (elements.get(i) != null) {
						pending.addFirst(elements.get(i));
					}
				}
			}
			return null;
		}

		SqlNode finish() {
			return SqlNode.of(kind, name, children);
		}
	}

	private static Object read(Field field, Object source) {
		try {
			return field.get(source);
		} catch (IllegalAccessException e) {
			throw new IllegalStateException("Cannot read parser field " + field, e);
		}
	}

	private static boolean isParserType(Class<?> type) {
		String name = type.getName();
		return name.startsWith(PARSER_PACKAGE)
				&& !name.startsWith(GENERATED_PACKAGE)
				&& !Enum.class.isAssignableFrom(type);
	}
}
