package org.javai.querybuilder.model;

/**
 * One {@code WHEN <condition> THEN <value>} arm of a CASE expression.
 */
public record CaseWhenBranch(FilterCondition condition, Literal thenValue) {

	public CaseWhenBranch {
		thenValue = thenValue != null ? thenValue : Literal.NULL;
	}

	public CaseWhenBranch(FilterCondition condition, Object thenValue) {
		this(condition, Literal.of(thenValue));
	}
}
