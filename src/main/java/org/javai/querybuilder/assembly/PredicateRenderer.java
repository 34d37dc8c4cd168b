package org.javai.querybuilder.assembly;

import java.util.List;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.Literal;

/**
 * Renders a single {@link FilterCondition} as a SQL predicate. Used verbatim for
 * WHERE conditions, HAVING conditions and CASE WHEN branches.
 *
 * <p>The value is interpreted per operator and never validated:</p>
 * <ul>
 *   <li>{@code IS NULL}/{@code IS NOT NULL} ignore the value</li>
 *   <li>{@code IN}/{@code NOT IN} list the elements of a sequence, quoting text;
 *       a scalar is placed inside the parentheses as-is</li>
 *   <li>{@code BETWEEN} uses exactly the first two elements, unquoted</li>
 *   <li>{@code REGEXP} always quotes the value</li>
 *   <li>everything else quotes the value iff it is textual</li>
 * </ul>
 *
 * <p>A missing condition renders as {@code NULL}.</p>
 */
public final class PredicateRenderer {

	private PredicateRenderer() {
	}

	public static String render(FilterCondition condition) {
		if (condition == null) {
			return Literal.NULL.toSql();
		}
		String field = condition.qualifiedField();
		FilterOperator operator = condition.operator();
		Literal value = condition.value();

		if (operator == null) {
			return field + " " + value.toSql();
		}

		return switch (operator) {
			case IS_NULL, IS_NOT_NULL -> field + " " + operator.token();
			case IN, NOT_IN -> field + " " + operator.token() + " (" + renderList(value) + ")";
			case BETWEEN -> field + " BETWEEN " + bound(value, 0) + " AND " + bound(value, 1);
			case REGEXP -> field + " REGEXP '" + value.raw() + "'";
			default -> field + " " + operator.token() + " " + value.toSql();
		};
	}

	private static String renderList(Literal value) {
		if (value instanceof Literal.Sequence sequence) {
			return sequence.toSql();
		}
		return value.raw();
	}

	private static String bound(Literal value, int index) {
		List<Literal> elements = value.elements();
		return index < elements.size() ? elements.get(index).raw() : Literal.NULL.raw();
	}
}
