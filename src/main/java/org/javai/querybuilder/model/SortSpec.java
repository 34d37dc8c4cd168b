package org.javai.querybuilder.model;

public record SortSpec(String tableAlias, String field, SortDirection direction) {

	public SortSpec {
		direction = direction != null ? direction : SortDirection.ASC;
	}

	public String toSql() {
		return tableAlias + "." + field + " " + direction;
	}
}
