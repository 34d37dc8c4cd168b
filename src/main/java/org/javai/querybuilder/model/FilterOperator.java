package org.javai.querybuilder.model;

/**
 * Comparison operators available to filter, HAVING and CASE WHEN conditions.
 *
 * <p>Each operator carries the SQL token it renders as and the operand shape it
 * expects. The shape is informational: conditions are accepted with any value and
 * the renderer decides per operator which parts of the value it uses.</p>
 */
public enum FilterOperator {

	EQUALS("=", Arity.SINGLE),
	NOT_EQUALS("!=", Arity.SINGLE),
	GREATER(">", Arity.SINGLE),
	LESS("<", Arity.SINGLE),
	GREATER_EQUAL(">=", Arity.SINGLE),
	LESS_EQUAL("<=", Arity.SINGLE),
	IN("IN", Arity.SEQUENCE),
	NOT_IN("NOT IN", Arity.SEQUENCE),
	LIKE("LIKE", Arity.SINGLE),
	NOT_LIKE("NOT LIKE", Arity.SINGLE),
	BETWEEN("BETWEEN", Arity.PAIR),
	IS_NULL("IS NULL", Arity.NONE),
	IS_NOT_NULL("IS NOT NULL", Arity.NONE),
	REGEXP("REGEXP", Arity.SINGLE);

	/**
	 * Number of operands an operator expects on its right-hand side.
	 */
	public enum Arity {
		/** No value; any supplied value is ignored. */
		NONE,
		/** Exactly one scalar value. */
		SINGLE,
		/** Exactly two values, the bounds of a range. */
		PAIR,
		/** One or more values. */
		SEQUENCE
	}

	private final String token;
	private final Arity arity;

	FilterOperator(String token, Arity arity) {
		this.token = token;
		this.arity = arity;
	}

	public String token() {
		return token;
	}

	public Arity arity() {
		return arity;
	}
}
