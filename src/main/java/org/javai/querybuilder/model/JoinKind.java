package org.javai.querybuilder.model;

import java.util.Locale;

/**
 * Join types supported by the renderer, each with the keyword it emits.
 */
public enum JoinKind {

	INNER("INNER JOIN"),
	LEFT("LEFT JOIN"),
	RIGHT("RIGHT JOIN"),
	FULL_OUTER("FULL OUTER JOIN");

	private final String keyword;

	JoinKind(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	/**
	 * Resolves a join kind from either its enum name ({@code FULL_OUTER}) or the
	 * SQL keyword it renders as ({@code FULL OUTER JOIN}). Matching ignores case and
	 * surrounding whitespace.
	 *
	 * @param text the name or keyword
	 * @return the matching kind
	 * @throws IllegalArgumentException if nothing matches
	 */
	public static JoinKind fromKeyword(String text) {
		if (text == null) {
			throw new IllegalArgumentException("Join kind must not be null");
		}
		String normalized = text.trim().toUpperCase(Locale.ROOT);
		for (JoinKind kind : values()) {
			if (kind.name().equals(normalized) || kind.keyword.equals(normalized)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown join kind: " + text);
	}
}
