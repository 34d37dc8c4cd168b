package org.javai.querybuilder.validation;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse statement type detected for a piece of SQL text.
 */
public enum StatementKind {
	SELECT,
	INSERT,
	UPDATE,
	DELETE,
	MERGE,
	REPLACE,
	CREATE,
	ALTER,
	DROP,
	TRUNCATE,
	UNKNOWN;

	/**
	 * Maps a leading keyword to the statement kind it introduces.
	 */
	static Optional<StatementKind> forKeyword(String keyword) {
		String upper = keyword.toUpperCase(Locale.ROOT);
		for (StatementKind kind : values()) {
			if (kind != UNKNOWN && kind.name().equals(upper)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
