package org.javai.querybuilder.model;

/**
 * Boolean connective linking a condition to the condition before it.
 */
public enum LogicOperator {
	AND,
	OR
}
