package org.javai.sqlgate.sql;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Node of the tagged statement tree produced by {@link SqlStatementParser}.
 *
 * <p>Every pass over a statement (CTE collection, alias collection, reference
 * collection, forbidden-kind search) uses the same descendant traversal,
 * {@link #findAll(Predicate)}. Nodes are immutable once the tree is built; each
 * node knows its parent so ancestry can be tested.</p>
 */
public final class SqlNode {

	private final NodeKind kind;
	private final String name;
	private final String alias;
	private final List<SqlNode> children;
	private SqlNode parent;

	SqlNode(NodeKind kind, String name, String alias, List<SqlNode> children) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.name = name;
		this.alias = alias;
		this.children = List.copyOf(children);
		for (SqlNode child : this.children) {
			child.parent = this;
		}
	}

	public static SqlNode leaf(NodeKind kind, String name) {
		return new SqlNode(kind, name, null, List.of());
	}

	public static SqlNode leaf(NodeKind kind, String name, String alias) {
		return new SqlNode(kind, name, alias, List.of());
	}

	public static SqlNode of(NodeKind kind, String name, List<SqlNode> children) {
		return new SqlNode(kind, name, null, children);
	}

	public NodeKind kind() {
		return kind;
	}

	/**
	 * @return the identifier this node introduces or references, unquoted; null for unnamed nodes
	 */
	public String name() {
		return name;
	}

	/**
	 * @return the alias attached to this node (a table alias, or the alias of a projected column), or null
	 */
	public String alias() {
		return alias;
	}

	public List<SqlNode> children() {
		return children;
	}

	public Optional<SqlNode> parent() {
		return Optional.ofNullable(parent);
	}

	public boolean is(NodeKind candidate) {
		return kind == candidate;
	}

	/**
	 * Visits this node and all of its descendants in pre-order.
	 */
	public void walk(Consumer<SqlNode> visitor) {
		Deque<SqlNode> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()) {
			SqlNode node = stack.pop();
			visitor.accept(node);
			for (int i = node.children.size() - 1; i >= 0; i--) {
				stack.push(node.children.get(i));
			}
		}
	}

	/**
	 * Returns this node and every descendant matching the predicate, in pre-order.
	 */
	public List<SqlNode> findAll(Predicate<SqlNode> predicate) {
		List<SqlNode> matches = new ArrayList<>();
		walk(node -> {
			if (predicate.test(node)) {
				matches.add(node);
			}
		});
		return matches;
	}

	public List<SqlNode> findAll(NodeKind candidate) {
		return findAll(node -> node.kind == candidate);
	}

	/**
	 * Returns the first node of the given kind in this subtree, this node included.
	 */
	public Optional<SqlNode> find(NodeKind candidate) {
		Deque<SqlNode> stack = new ArrayDeque<>();
		stack.push(this);
		while (!stack.isEmpty()) {
			SqlNode node = stack.pop();
			if (node.kind == candidate) {
				return Optional.of(node);
			}
			for (int i = node.children.size() - 1; i >= 0; i--) {
				stack.push(node.children.get(i));
			}
		}
		return Optional.empty();
	}

	/**
	 * @return true if any proper ancestor of this node has the given kind
	 */
	public boolean hasAncestor(NodeKind candidate) {
		for (SqlNode current = parent; current != null; current = current.parent) {
			if (current.kind == candidate) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(kind.name());
		if (name != null) {
			sb.append('(').append(name).append(')');
		}
		if (alias != null) {
			sb.append(" AS ").append(alias);
		}
		if (!children.isEmpty()) {
			sb.append(children);
		}
		return sb.toString();
	}
}
