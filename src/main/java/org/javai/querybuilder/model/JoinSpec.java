package org.javai.querybuilder.model;

/**
 * A join that brings {@code rightTable} into scope, matched on a single
 * equality between a field of the left alias and a field of the right table.
 *
 * @param leftAlias alias of a table already in scope
 * @param rightTable the table introduced by this join
 * @param kind the join type
 * @param leftField field of the left table used in the ON clause
 * @param rightField field of the right table used in the ON clause
 */
public record JoinSpec(String leftAlias, TableReference rightTable, JoinKind kind,
		String leftField, String rightField) {

	public String toSql() {
		return kind.keyword() + " " + rightTable.name() + " AS " + rightTable.alias()
				+ " ON " + leftAlias + "." + leftField + " = "
				+ rightTable.alias() + "." + rightField;
	}
}
