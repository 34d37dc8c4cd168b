package org.javai.querybuilder.narrative;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.javai.querybuilder.assembly.QueryAssembly;
import org.javai.querybuilder.model.CaseWhenSpec;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.JoinSpec;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.SortSpec;
import org.javai.querybuilder.model.TableReference;
import org.javai.querybuilder.model.WindowFunctionSpec;

/**
 * Describes a query's intent in prose, reading the assembly directly rather than
 * its rendered SQL so the description stays meaningful for degenerate queries.
 *
 * <p>Sections appear in a fixed order (intent, primary table, joins, filters,
 * grouping, computed columns, window functions, ordering, row limit); a section
 * whose source is empty is left out. Bold markers use Markdown.</p>
 */
public final class QueryNarrator {

	private QueryNarrator() {
	}

	public static String describe(QueryAssembly query) {
		StringBuilder sb = new StringBuilder();

		sb.append(query.isDistinct() ? "Query distinct data" : "Query data");

		if (!query.tables().isEmpty()) {
			TableReference main = query.tables().get(0);
			sb.append(", from **").append(main.name()).append("** table");
			if (!main.selectedFields().isEmpty()) {
				sb.append(" (fields: ").append(String.join(", ", main.selectedFields())).append(")");
			}
		}

		if (!query.joins().isEmpty()) {
			StringJoiner joins = new StringJoiner(", ");
			for (JoinSpec join : query.joins()) {
				joins.add(NarrativeVocabulary.joinLabel(join.kind()) + " **" + join.rightTable().name() + "** table"
						+ " (ON " + join.leftAlias() + "." + join.leftField() + " = "
						+ join.rightTable().alias() + "." + join.rightField() + ")");
			}
			sb.append(", ").append(joins);
		}

		List<FilterCondition> filters = query.filters();
		if (!filters.isEmpty()) {
			sb.append(".\n\n**Filters**:");
			List<String> items = new ArrayList<>();
			for (int i = 0; i < filters.size(); i++) {
				FilterCondition filter = filters.get(i);
				String logic = i == 0 ? "" : " **" + filter.logic() + "** ";
				items.add(logic + filter.qualifiedField() + " "
						+ NarrativeVocabulary.operatorLabel(filter.operator()) + filterValue(filter));
			}
			sb.append("\n- ").append(String.join("\n- ", items));
		}

		query.groupBy()
				.filter(groupBy -> !groupBy.fields().isEmpty() || groupBy.hasHaving())
				.ifPresent(groupBy -> {
					sb.append("\n\n**Grouping**: group by ").append(String.join(", ", groupBy.fields()));
					if (groupBy.hasHaving()) {
						sb.append(", with HAVING conditions");
					}
				});

		if (!query.caseWhens().isEmpty()) {
			sb.append("\n\n**Computed columns**:");
			for (CaseWhenSpec caseWhen : query.caseWhens()) {
				int branches = caseWhen.branches().size();
				sb.append("\n- ").append(caseWhen.alias())
						.append(" (").append(branches).append(branches == 1 ? " condition branch)" : " condition branches)");
			}
		}

		if (!query.windowFunctions().isEmpty()) {
			sb.append("\n\n**Window functions**:");
			for (WindowFunctionSpec window : query.windowFunctions()) {
				sb.append("\n- ");
				if (!window.alias().isEmpty()) {
					sb.append(window.alias()).append(": ");
				}
				sb.append(window.functionName());
				if (!window.partitionBy().isEmpty()) {
					sb.append(" PARTITION BY ").append(String.join(", ", window.partitionBy()));
				}
			}
		}

		if (!query.orderBys().isEmpty()) {
			StringJoiner sorts = new StringJoiner(", ");
			for (SortSpec sort : query.orderBys()) {
				sorts.add(sort.tableAlias() + "." + sort.field() + " " + NarrativeVocabulary.directionLabel(sort.direction()));
			}
			sb.append("\n\n**Ordering**: by ").append(sorts);
		}

		Integer limit = query.limit();
		if (limit != null && limit != 0) {
			sb.append("\n\n**Limit**: return ").append(limit).append(" rows");
			Integer offset = query.offset();
			if (offset != null && offset > 0) {
				sb.append(" (skipping the first ").append(offset).append(")");
			}
		}

		if (sb.charAt(sb.length() - 1) != '.') {
			sb.append('.');
		}
		return sb.toString();
	}

	private static String filterValue(FilterCondition filter) {
		if (filter.value() instanceof Literal.Sequence sequence
				&& filter.operator() != FilterOperator.BETWEEN) {
			return " [" + sequence.raw() + "]";
		}
		return NarrativeVocabulary.valueText(filter);
	}
}
