package org.javai.querybuilder.narrative;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.javai.querybuilder.assembly.PredicateRenderer;
import org.javai.querybuilder.assembly.QueryAssembly;
import org.javai.querybuilder.model.CaseWhenBranch;
import org.javai.querybuilder.model.CaseWhenSpec;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.GroupBySpec;
import org.javai.querybuilder.model.JoinSpec;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.SortSpec;
import org.javai.querybuilder.model.TableReference;
import org.javai.querybuilder.model.WindowFunctionSpec;

/**
 * Transcribes a query assembly into a requirements request that a person (or a
 * language model) could write the SQL from.
 *
 * <p>Sections follow the same order and omission rule as
 * {@link QueryNarrator#describe}; each is separated by a blank line.</p>
 */
public final class RequirementsTranscriber {

	static final String HEADER = "I need a SQL query with the following requirements:";
	static final String CLOSING = "Please write the SQL query that satisfies these requirements.";

	private RequirementsTranscriber() {
	}

	public static String transcribe(QueryAssembly query) {
		List<String> sections = new ArrayList<>();

		if (query.isDistinct()) {
			sections.add("**Deduplication**: the result must not contain duplicate rows");
		}
		if (!query.tables().isEmpty()) {
			sections.add(dataSources(query.tables()));
		}
		if (!query.joins().isEmpty()) {
			sections.add(relationships(query.joins()));
		}
		if (!query.filters().isEmpty()) {
			sections.add(filterConditions(query.filters()));
		}
		query.groupBy()
				.filter(groupBy -> !groupBy.fields().isEmpty() || groupBy.hasHaving())
				.ifPresent(groupBy -> sections.add(grouping(groupBy)));
		if (!query.caseWhens().isEmpty()) {
			sections.add(computedColumns(query.caseWhens()));
		}
		if (!query.windowFunctions().isEmpty()) {
			sections.add(windowFunctions(query.windowFunctions()));
		}
		if (!query.orderBys().isEmpty()) {
			sections.add(ordering(query.orderBys()));
		}
		Integer limit = query.limit();
		if (limit != null && limit != 0) {
			String text = "**Row limit**: return only " + limit + " rows";
			Integer offset = query.offset();
			if (offset != null && offset > 0) {
				text += ", skipping the first " + offset;
			}
			sections.add(text);
		}

		StringJoiner transcript = new StringJoiner("\n\n");
		transcript.add(HEADER);
		sections.forEach(transcript::add);
		transcript.add(CLOSING);
		return transcript.toString();
	}

	private static String dataSources(List<TableReference> tables) {
		StringBuilder sb = new StringBuilder("**Data sources**:");
		for (int i = 0; i < tables.size(); i++) {
			TableReference table = tables.get(i);
			sb.append("\n- ").append(i == 0 ? "Primary table: " : "Joined table: ")
					.append(table.name()).append(" (alias: ").append(table.alias()).append(")");
			if (!table.selectedFields().isEmpty()) {
				sb.append("\n  Required fields: ").append(String.join(", ", table.selectedFields()));
			}
		}
		return sb.toString();
	}

	private static String relationships(List<JoinSpec> joins) {
		StringBuilder sb = new StringBuilder("**Table relationships**:");
		for (JoinSpec join : joins) {
			String rightAlias = join.rightTable().alias();
			sb.append("\n- ").append(join.leftAlias()).append(' ')
					.append(NarrativeVocabulary.joinLabel(join.kind())).append(' ').append(rightAlias)
					.append("\n  Join condition: ").append(join.leftAlias()).append('.').append(join.leftField())
					.append(" = ").append(rightAlias).append('.').append(join.rightField());
		}
		return sb.toString();
	}

	private static String filterConditions(List<FilterCondition> filters) {
		StringBuilder sb = new StringBuilder("**Filter conditions**:");
		for (int i = 0; i < filters.size(); i++) {
			FilterCondition filter = filters.get(i);
			sb.append("\n- ");
			if (i > 0) {
				sb.append(filter.logic()).append(' ');
			}
			sb.append(filter.qualifiedField()).append(' ')
					.append(NarrativeVocabulary.operatorLabel(filter.operator()))
					.append(NarrativeVocabulary.valueText(filter));
		}
		return sb.toString();
	}

	private static String grouping(GroupBySpec groupBy) {
		StringBuilder sb = new StringBuilder("**Grouping**: group by ").append(String.join(", ", groupBy.fields()));
		for (FilterCondition having : groupBy.havingConditions()) {
			sb.append("\n- HAVING condition: ").append(PredicateRenderer.render(having));
		}
		return sb.toString();
	}

	private static String computedColumns(List<CaseWhenSpec> caseWhens) {
		StringBuilder sb = new StringBuilder("**Computed columns**:");
		for (CaseWhenSpec caseWhen : caseWhens) {
			sb.append("\n- Create column ").append(caseWhen.alias()).append(", assigned as follows:");
			List<CaseWhenBranch> branches = caseWhen.branches();
			for (int i = 0; i < branches.size(); i++) {
				CaseWhenBranch branch = branches.get(i);
				sb.append("\n  Condition ").append(i + 1).append(": if ")
						.append(PredicateRenderer.render(branch.condition()))
						.append(", the value is ").append(branch.thenValue().raw());
			}
			if (caseWhen.hasElse()) {
				sb.append("\n  Otherwise the value is ").append(caseWhen.elseValue().raw());
			}
		}
		return sb.toString();
	}

	private static String windowFunctions(List<WindowFunctionSpec> windows) {
		StringBuilder sb = new StringBuilder("**Window functions**:");
		for (WindowFunctionSpec window : windows) {
			sb.append("\n- Compute ").append(window.functionName());
			if (window.hasField()) {
				sb.append(" of ").append(window.tableAlias()).append('.').append(window.field());
			}
			if (!window.alias().isEmpty()) {
				sb.append(", named ").append(window.alias());
			}
			if (!window.partitionBy().isEmpty()) {
				sb.append("\n  Partition by ").append(String.join(", ", window.partitionBy()));
			}
			if (!window.orderBy().isEmpty()) {
				StringJoiner sorts = new StringJoiner(", ");
				window.orderBy().forEach(sort -> sorts.add(sortText(sort)));
				sb.append("\n  Order by ").append(sorts);
			}
		}
		return sb.toString();
	}

	private static String ordering(List<SortSpec> sorts) {
		StringJoiner joiner = new StringJoiner(", ");
		sorts.forEach(sort -> joiner.add(sortText(sort)));
		return "**Result ordering**: by " + joiner;
	}

	private static String sortText(SortSpec sort) {
		if (sort == null) {
			return Literal.NULL.raw();
		}
		return sort.tableAlias() + "." + sort.field() + " " + NarrativeVocabulary.directionLabel(sort.direction());
	}
}
