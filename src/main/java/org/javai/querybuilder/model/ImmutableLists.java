package org.javai.querybuilder.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Null-tolerant list copying for value records. A {@code null} source becomes an
 * empty list and {@code null} elements are kept.
 */
public final class ImmutableLists {

	private ImmutableLists() {
	}

	public static <T> List<T> copyOf(Collection<? extends T> source) {
		if (source == null || source.isEmpty()) {
			return List.of();
		}
		return Collections.unmodifiableList(new ArrayList<>(source));
	}
}
