package org.javai.querybuilder.validation;

import java.util.Locale;

/**
 * A lexical token of SQL text.
 *
 * @param type the token type
 * @param value the token text exactly as it appears in the input
 * @param position the character position in the input string
 */
public record SqlToken(TokenType type, String value, int position) {

	public enum TokenType {
		KEYWORD,           // SELECT, FROM, AND, ...
		IDENTIFIER,        // names, qualified names (p.price), function names
		QUOTED_IDENTIFIER, // "name" or `name`
		STRING,            // 'text', including the quotes
		NUMBER,            // integers and decimals
		OPERATOR,          // =, !=, <=, *, ...
		PUNCTUATION,       // ( ) , ;
		COMMENT            // -- line or /* block */
	}

	@Override
	public String toString() {
		return type + "(" + value + ")";
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isPunctuation(String expected) {
		return type == TokenType.PUNCTUATION && value.equals(expected);
	}

	public boolean isKeyword(String expected) {
		return type == TokenType.KEYWORD && value.equalsIgnoreCase(expected);
	}

	/**
	 * @return the keyword in upper case, or the raw value for other token types
	 */
	public String normalized() {
		return type == TokenType.KEYWORD ? value.toUpperCase(Locale.ROOT) : value;
	}
}
