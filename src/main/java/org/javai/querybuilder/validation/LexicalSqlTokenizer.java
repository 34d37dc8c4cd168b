package org.javai.querybuilder.validation;

import java.util.List;
import org.javai.querybuilder.config.QueryBuilderSettings;

/**
 * Default {@link SqlTokenizer}: lexes with {@link SqlLexer}, reformats with
 * {@link SqlFormatter} and detects the statement kind with
 * {@link StatementClassifier}.
 *
 * <p>Only null or blank text is rejected; everything else tokenizes.</p>
 */
public class LexicalSqlTokenizer implements SqlTokenizer {

	private final SqlFormatter formatter;
	private final StatementClassifier classifier;

	public LexicalSqlTokenizer() {
		this(QueryBuilderSettings.defaults());
	}

	public LexicalSqlTokenizer(QueryBuilderSettings settings) {
		this(new SqlFormatter(settings.indentWidth(), settings.uppercaseKeywords()), new StatementClassifier());
	}

	public LexicalSqlTokenizer(SqlFormatter formatter, StatementClassifier classifier) {
		this.formatter = formatter;
		this.classifier = classifier;
	}

	@Override
	public TokenizedSql tokenize(String sql) {
		if (sql == null || sql.isBlank()) {
			throw new SqlTokenizationException("SQL text is empty");
		}
		List<SqlToken> tokens = new SqlLexer(sql).tokenize();
		StatementClassifier.Classification classification = classifier.classify(sql, tokens);
		return new TokenizedSql(formatter.format(tokens), classification.kind(), tokens,
				classification.grammarError());
	}
}
