package org.javai.querybuilder.model;

import java.util.List;

/**
 * A table brought into scope by a query, addressed everywhere else by its alias.
 *
 * @param name the table name as it appears in FROM/JOIN
 * @param alias the alias used to qualify fields of this table
 * @param selectedFields fields to project, in output column order
 */
public record TableReference(String name, String alias, List<String> selectedFields) {

	public TableReference {
		selectedFields = ImmutableLists.copyOf(selectedFields);
	}

	/**
	 * @return the selected fields qualified with this table's alias, e.g. {@code p.price}
	 */
	public List<String> qualifiedFields() {
		return selectedFields.stream()
				.map(field -> alias + "." + field)
				.toList();
	}
}
