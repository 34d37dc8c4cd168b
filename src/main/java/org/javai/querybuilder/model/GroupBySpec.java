package org.javai.querybuilder.model;

import java.util.List;

/**
 * Grouping for a query. Having conditions are always combined with AND,
 * whatever their own logic operator says.
 *
 * @param fields qualified grouping fields
 * @param havingConditions conditions of the HAVING clause
 */
public record GroupBySpec(List<String> fields, List<FilterCondition> havingConditions) {

	public GroupBySpec {
		fields = ImmutableLists.copyOf(fields);
		havingConditions = ImmutableLists.copyOf(havingConditions);
	}

	public boolean hasHaving() {
		return !havingConditions.isEmpty();
	}
}
