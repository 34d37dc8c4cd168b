package org.javai.querybuilder.model;

/**
 * A predicate on one qualified field.
 *
 * <p>{@code logic} describes how this condition combines with the condition
 * <i>before</i> it in a sequence. The first condition of a sequence has no
 * predecessor, so its logic operator is carried but never rendered.</p>
 *
 * @param tableAlias alias of the table owning the field
 * @param field the field name
 * @param operator the comparison operator
 * @param value the right-hand side; interpreted per operator at render time
 * @param logic connective to the previous condition
 */
public record FilterCondition(String tableAlias, String field, FilterOperator operator, Literal value,
		LogicOperator logic) {

	public FilterCondition {
		value = value != null ? value : Literal.NULL;
		logic = logic != null ? logic : LogicOperator.AND;
	}

	public FilterCondition(String tableAlias, String field, FilterOperator operator, Object value) {
		this(tableAlias, field, operator, Literal.of(value), LogicOperator.AND);
	}

	public String qualifiedField() {
		return tableAlias + "." + field;
	}
}
