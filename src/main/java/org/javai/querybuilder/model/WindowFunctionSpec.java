package org.javai.querybuilder.model;

import java.util.List;

/**
 * A windowed computed column such as {@code RANK() OVER (...)} or
 * {@code SUM(o.amount) OVER (...)}.
 *
 * @param functionName the function, e.g. {@code ROW_NUMBER}, {@code SUM}
 * @param tableAlias alias qualifying {@code field}
 * @param field the argument field; {@code null} or blank for ranking functions
 * @param partitionBy qualified fields of the PARTITION BY clause
 * @param orderBy sort keys of the window's ORDER BY clause
 * @param alias the output column name; blank for none
 */
public record WindowFunctionSpec(String functionName, String tableAlias, String field,
		List<String> partitionBy, List<SortSpec> orderBy, String alias) {

	public WindowFunctionSpec {
		partitionBy = ImmutableLists.copyOf(partitionBy);
		orderBy = ImmutableLists.copyOf(orderBy);
		alias = alias != null ? alias : "";
	}

	public boolean hasField() {
		return field != null && !field.isEmpty();
	}
}
