package org.javai.querybuilder.assembly;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.querybuilder.assembly.ConsistencyProblem.Code;
import org.javai.querybuilder.model.CaseWhenBranch;
import org.javai.querybuilder.model.CaseWhenSpec;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.JoinSpec;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.SortSpec;
import org.javai.querybuilder.model.TableReference;
import org.javai.querybuilder.model.WindowFunctionSpec;

/**
 * Pre-render consistency check for a {@link QueryAssembly}.
 *
 * <p>The assembly accepts any input, so gaps such as a repeated alias or an
 * {@code IN} filter with a scalar value are only visible here. Checking never
 * throws and never changes what the assembly renders.</p>
 */
public final class QueryConsistencyChecker {

	private QueryConsistencyChecker() {
	}

	public static List<ConsistencyProblem> check(QueryAssembly query) {
		List<ConsistencyProblem> problems = new ArrayList<>();

		if (query.tables().isEmpty()) {
			problems.add(new ConsistencyProblem(Code.NO_TABLES, "Query has no tables, so no FROM clause is rendered"));
		}
		if (selectItemCount(query) == 0) {
			problems.add(new ConsistencyProblem(Code.EMPTY_SELECT_LIST, "Query selects no fields or computed columns"));
		}

		Set<String> aliases = new LinkedHashSet<>();
		Set<String> reported = new HashSet<>();
		for (TableReference table : query.tables()) {
			if (!aliases.add(table.alias()) && reported.add(table.alias())) {
				problems.add(new ConsistencyProblem(Code.DUPLICATE_ALIAS,
						"Alias '%s' is used by more than one table".formatted(table.alias())));
			}
		}

		for (JoinSpec join : query.joins()) {
			checkAlias(join.leftAlias(), "join to " + join.rightTable().name(), aliases, problems);
		}
		for (FilterCondition filter : query.filters()) {
			checkCondition(filter, "filter", aliases, problems);
		}
		query.groupBy().ifPresent(groupBy -> {
			for (FilterCondition having : groupBy.havingConditions()) {
				checkCondition(having, "having condition", aliases, problems);
			}
		});
		for (CaseWhenSpec caseWhen : query.caseWhens()) {
			for (CaseWhenBranch branch : caseWhen.branches()) {
				checkCondition(branch.condition(), "case '" + caseWhen.alias() + "'", aliases, problems);
			}
		}
		for (WindowFunctionSpec window : query.windowFunctions()) {
			if (window.hasField()) {
				checkAlias(window.tableAlias(), "window function " + window.functionName(), aliases, problems);
			}
			for (SortSpec sort : window.orderBy()) {
				if (sort == null) {
					problems.add(new ConsistencyProblem(Code.MISSING_SORT_KEY,
							"window function %s has an empty sort key".formatted(window.functionName())));
					continue;
				}
				checkAlias(sort.tableAlias(), "window order of " + window.functionName(), aliases, problems);
			}
		}
		for (SortSpec sort : query.orderBys()) {
			checkAlias(sort.tableAlias(), "order by " + sort.field(), aliases, problems);
		}

		Integer limit = query.limit();
		Integer offset = query.offset();
		if (limit != null && limit < 0) {
			problems.add(new ConsistencyProblem(Code.NEGATIVE_LIMIT, "Limit must not be negative: " + limit));
		}
		if (offset != null && offset < 0) {
			problems.add(new ConsistencyProblem(Code.NEGATIVE_OFFSET, "Offset must not be negative: " + offset));
		}
		if (offset != null && offset > 0 && (limit == null || limit == 0)) {
			problems.add(new ConsistencyProblem(Code.OFFSET_WITHOUT_LIMIT,
					"Offset " + offset + " is ignored because no limit is set"));
		}

		return problems;
	}

	private static int selectItemCount(QueryAssembly query) {
		int count = query.caseWhens().size() + query.windowFunctions().size();
		for (TableReference table : query.tables()) {
			count += table.selectedFields().size();
		}
		return count;
	}

	private static void checkCondition(FilterCondition condition, String context, Set<String> aliases,
			List<ConsistencyProblem> problems) {
		if (condition == null) {
			problems.add(new ConsistencyProblem(Code.MISSING_CONDITION, context + " has an empty condition"));
			return;
		}
		checkAlias(condition.tableAlias(), context + " on " + condition.field(), aliases, problems);
		if (!arityMatches(condition.operator(), condition.value())) {
			problems.add(new ConsistencyProblem(Code.OPERATOR_ARITY,
					"%s on %s: operator %s does not accept value %s".formatted(
							context, condition.qualifiedField(), condition.operator(), condition.value().raw())));
		}
	}

	private static void checkAlias(String alias, String context, Set<String> aliases,
			List<ConsistencyProblem> problems) {
		if (!aliases.contains(alias)) {
			problems.add(new ConsistencyProblem(Code.UNKNOWN_ALIAS,
					"%s refers to unknown alias '%s'".formatted(context, alias)));
		}
	}

	static boolean arityMatches(FilterOperator operator, Literal value) {
		if (operator == null) {
			return false;
		}
		return switch (operator.arity()) {
			case NONE -> value instanceof Literal.Null;
			case SINGLE -> !(value instanceof Literal.Sequence) && !(value instanceof Literal.Null);
			case PAIR -> value instanceof Literal.Sequence sequence && sequence.values().size() == 2;
			case SEQUENCE -> value instanceof Literal.Sequence sequence && !sequence.values().isEmpty();
		};
	}
}
