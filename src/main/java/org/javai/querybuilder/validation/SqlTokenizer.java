package org.javai.querybuilder.validation;

/**
 * Collaborator that lexes SQL text for validation and cosmetic reformatting.
 *
 * <p>Implementations must not hang and must have no side effects. Text that
 * cannot be tokenized at all is signalled with {@link SqlTokenizationException};
 * text that tokenizes but is odd (a non-SELECT statement, unbalanced parentheses)
 * is returned normally and judged by {@link QueryValidator}.</p>
 */
public interface SqlTokenizer {

	/**
	 * @param sql the raw SQL text
	 * @return the reformatted text, statement kind and flattened token stream
	 * @throws SqlTokenizationException if the text cannot be tokenized
	 */
	TokenizedSql tokenize(String sql);
}
