package org.javai.querybuilder.assembly;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.querybuilder.model.CaseWhenBranch;
import org.javai.querybuilder.model.CaseWhenSpec;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.GroupBySpec;
import org.javai.querybuilder.model.JoinSpec;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.SortSpec;
import org.javai.querybuilder.model.TableReference;
import org.javai.querybuilder.model.WindowFunctionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link QueryAssembly} to a single SELECT statement.
 *
 * <p>Clause order is fixed: SELECT, select list, FROM, JOINs, WHERE, GROUP BY /
 * HAVING, ORDER BY, LIMIT / OFFSET. Clauses are separated by newlines and the
 * statement ends with exactly one {@code ;}. Missing data degrades the output
 * rather than failing; an assembly without tables renders no FROM clause and an
 * empty assembly renders {@code "SELECT\n  ;"}.</p>
 */
public final class SqlRenderer {

	private static final Logger logger = LoggerFactory.getLogger(SqlRenderer.class);

	private static final String INDENT = "  ";

	private SqlRenderer() {
	}

	public static String render(QueryAssembly query) {
		List<String> lines = new ArrayList<>();

		lines.add(query.isDistinct() ? "SELECT DISTINCT" : "SELECT");

		List<String> selectItems = new ArrayList<>();
		for (TableReference table : query.tables()) {
			selectItems.addAll(table.qualifiedFields());
		}
		for (CaseWhenSpec caseWhen : query.caseWhens()) {
			selectItems.add(renderCaseWhen(caseWhen, INDENT.length()));
		}
		for (WindowFunctionSpec window : query.windowFunctions()) {
			selectItems.add(INDENT + renderWindowFunction(window));
		}
		lines.add(INDENT + String.join(",\n" + INDENT, selectItems));

		if (!query.tables().isEmpty()) {
			TableReference driving = query.tables().get(0);
			lines.add("FROM " + driving.name() + " AS " + driving.alias());
		}

		for (JoinSpec join : query.joins()) {
			lines.add(join.toSql());
		}

		List<FilterCondition> filters = query.filters();
		if (!filters.isEmpty()) {
			lines.add("WHERE");
			List<String> predicates = new ArrayList<>(filters.size());
			for (int i = 0; i < filters.size(); i++) {
				FilterCondition filter = filters.get(i);
				String predicate = PredicateRenderer.render(filter);
				predicates.add(i == 0 ? INDENT + predicate : INDENT + filter.logic() + " " + predicate);
			}
			lines.add(String.join("\n", predicates));
		}

		query.groupBy().ifPresent(groupBy -> {
			lines.add("GROUP BY " + String.join(", ", groupBy.fields()));
			if (groupBy.hasHaving()) {
				lines.add("HAVING " + renderHaving(groupBy));
			}
		});

		if (!query.orderBys().isEmpty()) {
			lines.add("ORDER BY " + query.orderBys().stream()
					.map(SqlRenderer::renderSort)
					.collect(Collectors.joining(", ")));
		}

		Integer limit = query.limit();
		if (limit != null && limit != 0) {
			StringBuilder limitClause = new StringBuilder("LIMIT ").append(limit);
			Integer offset = query.offset();
			if (offset != null && offset > 0) {
				limitClause.append(" OFFSET ").append(offset);
			}
			lines.add(limitClause.toString());
		}

		String sql = String.join("\n", lines) + ";";
		logger.debug("Rendered {} select item(s) into {} line(s)", selectItems.size(), lines.size());
		return sql;
	}

	/**
	 * Renders a CASE WHEN block; branch lines are indented two spaces deeper than
	 * the CASE and END lines.
	 */
	public static String renderCaseWhen(CaseWhenSpec caseWhen, int indent) {
		String spaces = " ".repeat(indent);
		List<String> lines = new ArrayList<>();
		lines.add(spaces + "CASE");
		for (CaseWhenBranch branch : caseWhen.branches()) {
			lines.add(spaces + INDENT + "WHEN " + PredicateRenderer.render(branch.condition())
					+ " THEN " + branch.thenValue().toSql());
		}
		if (caseWhen.hasElse()) {
			lines.add(spaces + INDENT + "ELSE " + caseWhen.elseValue().toSql());
		}
		lines.add(spaces + "END AS " + caseWhen.alias());
		return String.join("\n", lines);
	}

	/**
	 * Renders {@code FUNC(alias.field) OVER (PARTITION BY ... ORDER BY ...) AS alias}.
	 * Either window clause is omitted when empty; with both omitted the window is
	 * {@code OVER ()}.
	 */
	public static String renderWindowFunction(WindowFunctionSpec window) {
		StringBuilder sb = new StringBuilder();
		sb.append(window.functionName()).append('(');
		if (window.hasField()) {
			sb.append(window.tableAlias()).append('.').append(window.field());
		}
		sb.append(')');

		sb.append(" OVER (");
		if (!window.partitionBy().isEmpty()) {
			sb.append("PARTITION BY ").append(String.join(", ", window.partitionBy())).append(' ');
		}
		if (!window.orderBy().isEmpty()) {
			sb.append("ORDER BY ").append(window.orderBy().stream()
					.map(SqlRenderer::renderSort)
					.collect(Collectors.joining(", ")));
		}
		sb.append(')');

		if (!window.alias().isEmpty()) {
			sb.append(" AS ").append(window.alias());
		}
		return sb.toString();
	}

	/**
	 * Renders one sort key; a missing key renders as {@code NULL}.
	 */
	public static String renderSort(SortSpec sort) {
		return sort != null ? sort.toSql() : Literal.NULL.toSql();
	}

	private static String renderHaving(GroupBySpec groupBy) {
		return groupBy.havingConditions().stream()
				.map(PredicateRenderer::render)
				.collect(Collectors.joining(" AND "));
	}
}
