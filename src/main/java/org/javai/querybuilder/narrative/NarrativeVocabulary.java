package org.javai.querybuilder.narrative;

import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.JoinKind;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.SortDirection;

/**
 * Human-readable labels shared by {@link QueryNarrator} and
 * {@link RequirementsTranscriber}.
 */
public final class NarrativeVocabulary {

	private NarrativeVocabulary() {
	}

	public static String operatorLabel(FilterOperator operator) {
		if (operator == null) {
			return "compares to";
		}
		return switch (operator) {
			case EQUALS -> "equals";
			case NOT_EQUALS -> "does not equal";
			case GREATER -> "is greater than";
			case LESS -> "is less than";
			case GREATER_EQUAL -> "is at least";
			case LESS_EQUAL -> "is at most";
			case IN -> "is one of";
			case NOT_IN -> "is not one of";
			case LIKE -> "contains";
			case NOT_LIKE -> "does not contain";
			case BETWEEN -> "is between";
			case IS_NULL -> "is empty";
			case IS_NOT_NULL -> "is not empty";
			case REGEXP -> "matches pattern";
		};
	}

	public static String joinLabel(JoinKind kind) {
		if (kind == null) {
			return "join";
		}
		return switch (kind) {
			case INNER -> "inner join";
			case LEFT -> "left join";
			case RIGHT -> "right join";
			case FULL_OUTER -> "full outer join";
		};
	}

	public static String directionLabel(SortDirection direction) {
		return direction == SortDirection.DESC ? "descending" : "ascending";
	}

	/**
	 * Describes the value side of a condition, with a leading space, or an empty
	 * string when the operator takes no value.
	 */
	static String valueText(FilterCondition condition) {
		FilterOperator operator = condition.operator();
		Literal value = condition.value();
		if ((operator != null && operator.arity() == FilterOperator.Arity.NONE) || value instanceof Literal.Null) {
			return "";
		}
		if (operator == FilterOperator.BETWEEN) {
			var elements = value.elements();
			String low = elements.size() > 0 ? elements.get(0).raw() : Literal.NULL.raw();
			String high = elements.size() > 1 ? elements.get(1).raw() : Literal.NULL.raw();
			return " " + low + " and " + high;
		}
		return " " + value.raw();
	}
}
