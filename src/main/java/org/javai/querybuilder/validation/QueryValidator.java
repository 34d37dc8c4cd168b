package org.javai.querybuilder.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.querybuilder.config.QueryBuilderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks on rendered SQL text.
 *
 * <p>Checks run independently of each other; only text that cannot be tokenized
 * at all stops validation early. The verdict is invalid when the text is
 * unparsable or its parentheses do not balance. Everything else (a non-SELECT
 * statement, an odd number of single quotes, {@code SELECT *}) is reported as a
 * warning. The quote check simply counts {@code '} characters, so it can both
 * miss and over-report problems in text containing escaped quotes.</p>
 *
 * <p>Validation never throws: a failing {@link SqlTokenizer} is reported as a
 * fatal error in the result.</p>
 */
public class QueryValidator {

	private static final Logger logger = LoggerFactory.getLogger(QueryValidator.class);

	public static final String UNPARSABLE = "Unable to parse SQL statement";
	public static final String PARSE_ERROR_PREFIX = "Parse error: ";
	public static final String UNBALANCED_PARENTHESES = "Unbalanced parentheses";
	public static final String NON_SELECT_PREFIX = "Non-SELECT statement detected: ";
	public static final String UNCLOSED_QUOTE = "Possible unclosed single quote";
	public static final String SELECT_STAR = "SELECT * used; list the columns explicitly";
	public static final String STRICT_GRAMMAR_PREFIX = "Strict grammar check failed: ";

	private final SqlTokenizer tokenizer;
	private final boolean strictGrammar;

	public QueryValidator() {
		this(QueryBuilderSettings.defaults());
	}

	public QueryValidator(QueryBuilderSettings settings) {
		this(new LexicalSqlTokenizer(settings), settings.strictGrammar());
	}

	public QueryValidator(SqlTokenizer tokenizer, boolean strictGrammar) {
		this.tokenizer = tokenizer;
		this.strictGrammar = strictGrammar;
	}

	public ValidationResult validate(String sql) {
		List<String> errors = new ArrayList<>();
		List<String> warnings = new ArrayList<>();

		TokenizedSql tokenized;
		try {
			tokenized = tokenizer.tokenize(sql);
		} catch (SqlTokenizationException e) {
			logger.debug("SQL text could not be tokenized: {}", e.getMessage());
			errors.add(UNPARSABLE);
			return new ValidationResult(false, "", errors, warnings);
		} catch (RuntimeException e) {
			logger.warn("SQL tokenizer failed", e);
			errors.add(PARSE_ERROR_PREFIX + e.getMessage());
			return new ValidationResult(false, "", errors, warnings);
		}

		if (tokenized.statementKind() != StatementKind.SELECT) {
			warnings.add(NON_SELECT_PREFIX + tokenized.statementKind());
		}

		if (!parenthesesBalanced(tokenized.tokens())) {
			errors.add(UNBALANCED_PARENTHESES);
		}

		if (countSingleQuotes(sql) % 2 != 0) {
			warnings.add(UNCLOSED_QUOTE);
		}

		String lower = sql.toLowerCase(Locale.ROOT);
		if (lower.contains("select *") || lower.contains("select  *")) {
			warnings.add(SELECT_STAR);
		}

		if (strictGrammar) {
			tokenized.grammarErrorMessage()
					.ifPresent(message -> warnings.add(STRICT_GRAMMAR_PREFIX + message));
		}

		boolean valid = errors.isEmpty();
		logger.debug("Validated SQL: valid={}, {} error(s), {} warning(s)", valid, errors.size(), warnings.size());
		return new ValidationResult(valid, tokenized.formatted(), errors, warnings);
	}

	/**
	 * Scans the token stream keeping a running count of parentheses. Scanning stops
	 * at the first closing parenthesis without a matching opener.
	 */
	static boolean parenthesesBalanced(List<SqlToken> tokens) {
		int count = 0;
		for (SqlToken token : tokens) {
			if (token.isPunctuation("(")) {
				count++;
			} else if (token.isPunctuation(")")) {
				count--;
			}
			if (count < 0) {
				return false;
			}
		}
		return count == 0;
	}

	private static long countSingleQuotes(String sql) {
		return sql.chars().filter(c -> c == '\'').count();
	}
}
