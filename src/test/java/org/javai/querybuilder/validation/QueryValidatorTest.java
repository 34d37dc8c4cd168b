package org.javai.querybuilder.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.querybuilder.assembly.QueryAssembly;
import org.javai.querybuilder.config.QueryBuilderSettings;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

class QueryValidatorTest {

	private final QueryValidator validator = new QueryValidator();

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		@DisplayName("flags one unmatched opening parenthesis")
		void unmatchedOpening() {
			ValidationResult result = validator.validate("SELECT COUNT(id FROM orders;");

			assertThat(result.valid()).isFalse();
			assertThat(result.errors()).containsExactly(QueryValidator.UNBALANCED_PARENTHESES);
			assertThat(result.formatted()).isNotEmpty();
		}

		@Test
		@DisplayName("reports unbalanced parentheses once")
		void reportedOnce() {
			ValidationResult result = validator.validate("SELECT ) ( ) ) (( FROM t");

			assertThat(result.errors()).containsExactly("Unbalanced parentheses");
		}

		@Test
		@DisplayName("ignores parentheses inside string literals")
		void parenthesesInStrings() {
			ValidationResult result = validator.validate("SELECT ':(' AS face FROM t;");

			assertThat(result.valid()).isTrue();
			assertThat(result.errors()).isEmpty();
		}

		@Test
		@DisplayName("treats blank text as unparsable")
		void blankText() {
			ValidationResult result = validator.validate("   ");

			assertThat(result.valid()).isFalse();
			assertThat(result.formatted()).isEmpty();
			assertThat(result.errors()).containsExactly(QueryValidator.UNPARSABLE);
		}

		@Test
		@DisplayName("treats null text as unparsable")
		void nullText() {
			assertThat(validator.validate(null).errors()).containsExactly("Unable to parse SQL statement");
		}
	}

	@Nested
	@DisplayName("Warnings")
	class Warnings {

		@Test
		@DisplayName("accepts a rendered query without findings")
		void cleanQuery() {
			QueryAssembly query = new QueryAssembly();
			query.addTable("products", "p", List.of("product_id", "price"));
			query.addFilter("p", "name", FilterOperator.LIKE, "%phone%");

			ValidationResult result = validator.validate(query.toSql());

			assertThat(result.valid()).isTrue();
			assertThat(result.errors()).isEmpty();
			assertThat(result.hasWarnings()).isFalse();
		}

		@Test
		@DisplayName("warns about a non-SELECT statement")
		void nonSelect() {
			ValidationResult result = validator.validate("DELETE FROM orders WHERE id = 1");

			assertThat(result.valid()).isTrue();
			assertThat(result.warnings()).containsExactly("Non-SELECT statement detected: DELETE");
		}

		@Test
		@DisplayName("warns about an odd number of single quotes")
		void oddQuotes() {
			ValidationResult result = validator.validate("SELECT 'abc FROM t");

			assertThat(result.valid()).isTrue();
			assertThat(result.warnings()).containsExactly(QueryValidator.UNCLOSED_QUOTE);
		}

		@Test
		@DisplayName("warns about an unescaped quote in a rendered value")
		void unescapedRenderedQuote() {
			QueryAssembly query = new QueryAssembly();
			query.addTable("customers", "c", List.of("id"));
			query.addFilter("c", "name", FilterOperator.EQUALS, "O'Brien");

			ValidationResult result = validator.validate(query.toSql());

			assertThat(result.valid()).isTrue();
			assertThat(result.warnings()).contains(QueryValidator.UNCLOSED_QUOTE);
		}

		@Test
		@DisplayName("warns about SELECT *")
		void selectStar() {
			ValidationResult result = validator.validate("select * from orders");

			assertThat(result.warnings()).containsExactly(QueryValidator.SELECT_STAR);
		}

		@Test
		@DisplayName("reports grammar failures only in strict mode")
		void strictGrammar() {
			QueryValidator strict = new QueryValidator(
					new QueryBuilderSettings(2, true, true, null));

			ValidationResult lenientResult = validator.validate("SELECT\n  ;");
			ValidationResult strictResult = strict.validate("SELECT\n  ;");

			assertThat(lenientResult.warnings()).isEmpty();
			assertThat(strictResult.valid()).isTrue();
			assertThat(strictResult.warnings()).singleElement()
					.asString().startsWith(QueryValidator.STRICT_GRAMMAR_PREFIX);
		}
	}

	@Nested
	@DisplayName("Tokenizer collaborator")
	@ExtendWith(MockitoExtension.class)
	class TokenizerCollaborator {

		@Mock
		private SqlTokenizer tokenizer;

		@Test
		@DisplayName("turns a tokenizer failure into a fatal error and logs it")
		void tokenizerFailure() {
			when(tokenizer.tokenize(anyString())).thenThrow(new IllegalStateException("lexer exploded"));
			QueryValidator failing = new QueryValidator(tokenizer, false);

			try (LogCaptorAppender logs = LogCaptorAppender.capture(QueryValidator.class, Level.WARN)) {
				ValidationResult result = failing.validate("SELECT 1");

				assertThat(result.valid()).isFalse();
				assertThat(result.formatted()).isEmpty();
				assertThat(result.errors()).containsExactly("Parse error: lexer exploded");
				assertThat(logs.messagesAt(Level.WARN)).containsExactly("SQL tokenizer failed");
				assertThat(logs.thrown()).singleElement().isInstanceOf(IllegalStateException.class);
			}
		}

		@Test
		@DisplayName("uses the statement kind the tokenizer reports")
		void reportedKind() {
			when(tokenizer.tokenize(anyString())).thenReturn(
					new TokenizedSql("MERGE INTO t", StatementKind.MERGE, List.of(), null));
			QueryValidator custom = new QueryValidator(tokenizer, false);

			ValidationResult result = custom.validate("MERGE INTO t");

			assertThat(result.formatted()).isEqualTo("MERGE INTO t");
			assertThat(result.warnings()).containsExactly("Non-SELECT statement detected: MERGE");
		}
	}

	@Test
	@DisplayName("balances parentheses over a token stream")
	void parenthesesBalanced() {
		assertThat(QueryValidator.parenthesesBalanced(new SqlLexer("f((a), b)").tokenize())).isTrue();
		assertThat(QueryValidator.parenthesesBalanced(new SqlLexer("f((a), b").tokenize())).isFalse();
		assertThat(QueryValidator.parenthesesBalanced(new SqlLexer(")(").tokenize())).isFalse();
		assertThat(QueryValidator.parenthesesBalanced(List.of())).isTrue();
	}
}
