package org.javai.querybuilder.model;

public enum SortDirection {
	ASC,
	DESC
}
