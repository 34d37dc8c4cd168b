package org.javai.querybuilder.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A literal value appearing on the right-hand side of a condition, or as a
 * THEN/ELSE result of a CASE WHEN branch.
 *
 * <p>Quoting is driven purely by the variant: {@link Text} renders inside single
 * quotes, every other variant renders verbatim. Embedded quote characters are
 * <b>not</b> escaped, so {@code O'Brien} renders as {@code 'O'Brien'}.</p>
 */
public sealed interface Literal {

	Null NULL = new Null();

	/**
	 * Renders the value as it appears in SQL: quoted if textual, verbatim otherwise.
	 */
	String toSql();

	/**
	 * Renders the value without any quoting.
	 */
	String raw();

	default boolean isTextual() {
		return false;
	}

	/**
	 * Returns the elements of this value when viewed as a sequence. A scalar is a
	 * sequence of one element; {@link Null} is an empty sequence.
	 */
	default List<Literal> elements() {
		return List.of(this);
	}

	/**
	 * Converts a plain Java value into a literal. Strings and characters become
	 * {@link Text}, numbers {@link Numeric}, booleans {@link Bool}, collections and
	 * arrays {@link Sequence}; {@code null} becomes {@link #NULL}. Any other object is
	 * kept verbatim through its {@code toString()}.
	 */
	static Literal of(Object value) {
		if (value == null) {
			return NULL;
		}
		if (value instanceof Literal literal) {
			return literal;
		}
		if (value instanceof CharSequence || value instanceof Character) {
			return new Text(value.toString());
		}
		if (value instanceof Number number) {
			return new Numeric(number);
		}
		if (value instanceof Boolean bool) {
			return new Bool(bool);
		}
		if (value instanceof Collection<?> collection) {
			return sequenceOf(collection);
		}
		if (value instanceof Object[] array) {
			return sequenceOf(Arrays.asList(array));
		}
		return new Raw(value.toString());
	}

	/**
	 * Builds a sequence literal from the given values.
	 */
	static Sequence list(Object... values) {
		return sequenceOf(Arrays.asList(values));
	}

	private static Sequence sequenceOf(Collection<?> values) {
		List<Literal> elements = new ArrayList<>(values.size());
		for (Object value : values) {
			elements.add(of(value));
		}
		return new Sequence(elements);
	}

	record Text(String value) implements Literal {

		public Text {
			value = value != null ? value : "";
		}

		@Override
		public String toSql() {
			return "'" + value + "'";
		}

		@Override
		public String raw() {
			return value;
		}

		@Override
		public boolean isTextual() {
			return true;
		}
	}

	record Numeric(Number value) implements Literal {

		@Override
		public String toSql() {
			return String.valueOf(value);
		}

		@Override
		public String raw() {
			return String.valueOf(value);
		}
	}

	record Bool(boolean value) implements Literal {

		@Override
		public String toSql() {
			return Boolean.toString(value);
		}

		@Override
		public String raw() {
			return Boolean.toString(value);
		}
	}

	/**
	 * A non-textual value kept verbatim, such as a date or an expression.
	 */
	record Raw(String value) implements Literal {

		@Override
		public String toSql() {
			return value;
		}

		@Override
		public String raw() {
			return value;
		}
	}

	record Sequence(List<Literal> values) implements Literal {

		public Sequence {
			values = ImmutableLists.copyOf(values == null ? null
					: values.stream().map(v -> v != null ? v : NULL).toList());
		}

		@Override
		public String toSql() {
			return values.stream().map(Literal::toSql).collect(Collectors.joining(", "));
		}

		@Override
		public String raw() {
			return values.stream().map(Literal::raw).collect(Collectors.joining(", "));
		}

		@Override
		public List<Literal> elements() {
			return values;
		}
	}

	record Null() implements Literal {

		@Override
		public String toSql() {
			return "NULL";
		}

		@Override
		public String raw() {
			return "NULL";
		}

		@Override
		public List<Literal> elements() {
			return List.of();
		}
	}
}
