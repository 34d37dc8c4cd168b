package org.javai.querybuilder.assembly;

/**
 * A structural problem found in a {@link QueryAssembly} before rendering.
 *
 * @param code the kind of problem
 * @param message a human-readable explanation naming the offending element
 */
public record ConsistencyProblem(Code code, String message) {

	public enum Code {
		NO_TABLES,
		EMPTY_SELECT_LIST,
		DUPLICATE_ALIAS,
		UNKNOWN_ALIAS,
		OPERATOR_ARITY,
		MISSING_CONDITION,
		MISSING_SORT_KEY,
		NEGATIVE_LIMIT,
		NEGATIVE_OFFSET,
		OFFSET_WITHOUT_LIMIT
	}

	@Override
	public String toString() {
		return code + ": " + message;
	}
}
