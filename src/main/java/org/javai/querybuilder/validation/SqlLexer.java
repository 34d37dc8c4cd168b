package org.javai.querybuilder.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient lexer for SQL text. Converts input into a flat stream of tokens,
 * dropping whitespace.
 *
 * <p>The lexer never rejects input: an unterminated string, quoted identifier or
 * block comment runs to the end of the text, and characters it does not recognise
 * become single-character operator tokens. Doubled quotes ({@code ''}) inside a
 * string are read as part of the string.</p>
 */
public class SqlLexer {

	static final Set<String> KEYWORDS = Set.of(
			"SELECT", "DISTINCT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "LIKE", "ILIKE",
			"BETWEEN", "IS", "NULL", "AS", "ON", "USING", "JOIN", "INNER", "LEFT", "RIGHT",
			"FULL", "OUTER", "CROSS", "NATURAL", "GROUP", "BY", "HAVING", "ORDER", "ASC",
			"DESC", "LIMIT", "OFFSET", "FETCH", "CASE", "WHEN", "THEN", "ELSE", "END", "OVER",
			"PARTITION", "REGEXP", "UNION", "INTERSECT", "EXCEPT", "ALL", "ANY", "EXISTS",
			"WITH", "INSERT", "INTO", "VALUES", "UPDATE", "SET", "DELETE", "MERGE", "REPLACE",
			"CREATE", "ALTER", "DROP", "TRUNCATE", "TABLE", "VIEW", "INDEX", "TRUE", "FALSE");

	private final String input;
	private int pos = 0;

	public SqlLexer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire input string.
	 *
	 * @return the tokens in input order
	 */
	public List<SqlToken> tokenize() {
		List<SqlToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespace();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		return tokens;
	}

	private SqlToken nextToken() {
		int start = pos;
		char c = peek();

		return switch (c) {
			case '(', ')', ',', ';' -> {
				advance();
				yield new SqlToken(SqlToken.TokenType.PUNCTUATION, String.valueOf(c), start);
			}
			case '\'' -> scanQuoted('\'', SqlToken.TokenType.STRING);
			case '"', '`' -> scanQuoted(c, SqlToken.TokenType.QUOTED_IDENTIFIER);
			default -> {
				if (c == '-' && peekNext() == '-') {
					yield scanLineComment();
				} else if (c == '/' && peekNext() == '*') {
					yield scanBlockComment();
				} else if (isDigit(c)) {
					yield scanNumber();
				} else if (isIdentifierStart(c)) {
					yield scanWord();
				} else {
					yield scanOperator();
				}
			}
		};
	}

	private SqlToken scanQuoted(char quote, SqlToken.TokenType type) {
		int start = pos;
		advance(); // consume opening quote

		while (!isAtEnd()) {
			char c = advance();
			if (c == quote) {
				if (peek() == quote) {
					advance(); // doubled quote stays inside the literal
				} else {
					break;
				}
			}
		}

		return new SqlToken(type, input.substring(start, pos), start);
	}

	private SqlToken scanLineComment() {
		int start = pos;
		while (!isAtEnd() && peek() != '\n') {
			advance();
		}
		return new SqlToken(SqlToken.TokenType.COMMENT, input.substring(start, pos), start);
	}

	private SqlToken scanBlockComment() {
		int start = pos;
		advance();
		advance(); // consume /*
		while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
			advance();
		}
		if (!isAtEnd()) {
			advance();
			advance(); // consume */
		}
		return new SqlToken(SqlToken.TokenType.COMMENT, input.substring(start, pos), start);
	}

	private SqlToken scanNumber() {
		int start = pos;

		while (!isAtEnd() && isDigit(peek())) {
			advance();
		}

		// Check for decimal part
		if (peek() == '.' && isDigit(peekNext())) {
			advance(); // consume '.'
			while (!isAtEnd() && isDigit(peek())) {
				advance();
			}
		}

		return new SqlToken(SqlToken.TokenType.NUMBER, input.substring(start, pos), start);
	}

	private SqlToken scanWord() {
		int start = pos;

		while (!isAtEnd() && isIdentifierChar(peek())) {
			advance();
		}

		String value = input.substring(start, pos);
		SqlToken.TokenType type = KEYWORDS.contains(value.toUpperCase(Locale.ROOT))
				? SqlToken.TokenType.KEYWORD
				: SqlToken.TokenType.IDENTIFIER;
		return new SqlToken(type, value, start);
	}

	private SqlToken scanOperator() {
		int start = pos;
		char c = advance();
		char next = peek();
		boolean twoChar = switch (c) {
			case '<' -> next == '=' || next == '>';
			case '>', '!' -> next == '=';
			case '|' -> next == '|';
			case ':' -> next == ':';
			default -> false;
		};
		if (twoChar) {
			advance();
		}
		return new SqlToken(SqlToken.TokenType.OPERATOR, input.substring(start, pos), start);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '.' || c == '$';
	}
}
