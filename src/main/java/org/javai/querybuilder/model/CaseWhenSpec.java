package org.javai.querybuilder.model;

import java.util.List;

/**
 * A conditional computed column. Branches are evaluated top to bottom and the
 * first match wins, so branch order is significant and rendered as stored. A
 * {@code null} branch is kept as a branch without condition or result.
 *
 * @param alias the output column name
 * @param branches the WHEN/THEN arms in evaluation order
 * @param elseValue the ELSE result, or {@code null} for no ELSE
 */
public record CaseWhenSpec(String alias, List<CaseWhenBranch> branches, Literal elseValue) {

	public CaseWhenSpec {
		branches = ImmutableLists.copyOf(branches == null ? null
				: branches.stream().map(b -> b != null ? b : new CaseWhenBranch(null, Literal.NULL)).toList());
	}

	public boolean hasElse() {
		return elseValue != null;
	}
}
