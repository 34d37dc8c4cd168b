package org.javai.querybuilder.assembly;

/**
 * Counts shown alongside a rendered query.
 */
public record QueryStatistics(
		int lineCount,
		int tableCount,
		int joinCount,
		int filterCount,
		int caseWhenCount,
		int orderByCount
) {

	public static QueryStatistics of(QueryAssembly query, String sql) {
		int lines = sql == null || sql.isEmpty() ? 0 : (int) sql.lines().count();
		return new QueryStatistics(
				lines,
				query.tables().size(),
				query.joins().size(),
				query.filters().size(),
				query.caseWhens().size(),
				query.orderBys().size()
		);
	}
}
