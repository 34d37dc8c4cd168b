package org.javai.querybuilder.validation;

import java.util.List;
import java.util.Optional;

/**
 * Output of a {@link SqlTokenizer}.
 *
 * @param formatted the cosmetically reformatted text
 * @param statementKind the detected statement kind
 * @param tokens the flattened token stream, whitespace excluded
 * @param grammarError why a full grammar parse rejected the text, or {@code null}
 *                     if it was accepted
 */
public record TokenizedSql(String formatted, StatementKind statementKind, List<SqlToken> tokens,
		String grammarError) {

	public TokenizedSql {
		tokens = tokens != null ? List.copyOf(tokens) : List.of();
		statementKind = statementKind != null ? statementKind : StatementKind.UNKNOWN;
	}

	public Optional<String> grammarErrorMessage() {
		return Optional.ofNullable(grammarError);
	}
}
