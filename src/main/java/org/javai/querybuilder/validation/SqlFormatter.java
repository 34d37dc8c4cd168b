package org.javai.querybuilder.validation;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cosmetic re-indentation of a SQL token stream.
 *
 * <p>Top-level clauses (SELECT, FROM, JOINs, WHERE, GROUP BY, HAVING, ORDER BY,
 * LIMIT, set operators) start on a new line. Select-list items and WHERE/HAVING
 * conditions go one per line, indented one level; CASE branches are indented one
 * level deeper than their CASE. Parenthesised content is kept on the current
 * line. Formatting never drops or reorders tokens, so it is safe on invalid
 * input.</p>
 */
public class SqlFormatter {

	private static final Set<String> JOIN_MODIFIERS = Set.of("INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL");
	private static final Set<String> SIMPLE_CLAUSES = Set.of("SELECT", "FROM", "WHERE", "HAVING", "LIMIT", "JOIN",
			"UNION", "INTERSECT", "EXCEPT");

	private enum Clause {
		NONE, SELECT, FILTER, OTHER
	}

	private final int indentSize;
	private final boolean uppercaseKeywords;

	private StringBuilder output;
	private boolean atLineStart;

	public SqlFormatter() {
		this(2, true);
	}

	public SqlFormatter(int indentSize, boolean uppercaseKeywords) {
		this.indentSize = Math.max(0, indentSize);
		this.uppercaseKeywords = uppercaseKeywords;
	}

	public String format(List<SqlToken> tokens) {
		output = new StringBuilder();
		atLineStart = true;

		Clause clause = Clause.NONE;
		int depth = 0;
		int caseDepth = 0;
		boolean betweenPending = false;
		SqlToken previous = null;

		for (int i = 0; i < tokens.size(); i++) {
			SqlToken token = tokens.get(i);

			if (token.isType(SqlToken.TokenType.COMMENT)) {
				if (!atLineStart) {
					newLine(0);
				}
				output.append(token.value());
				newLine(0);
				previous = null;
				continue;
			}

			int phraseLength = depth == 0 ? clausePhraseLength(tokens, i) : 0;
			if (phraseLength > 0) {
				if (output.length() > 0) {
					newLine(0);
				}
				for (int j = 0; j < phraseLength; j++) {
					if (j > 0) {
						output.append(' ');
					}
					output.append(text(tokens.get(i + j)));
				}
				atLineStart = false;
				String head = tokens.get(i).normalized();
				i += phraseLength - 1;
				previous = tokens.get(i);
				clause = switch (head) {
					case "SELECT" -> Clause.SELECT;
					case "WHERE", "HAVING" -> Clause.FILTER;
					default -> Clause.OTHER;
				};
				if (clause == Clause.SELECT && i + 1 < tokens.size() && tokens.get(i + 1).isKeyword("DISTINCT")) {
					i++;
					previous = tokens.get(i);
					output.append(' ').append(text(previous));
				}
				if (clause == Clause.SELECT || clause == Clause.FILTER) {
					newLine(1);
				}
				caseDepth = 0;
				continue;
			}

			int itemLevel = clause == Clause.SELECT || clause == Clause.FILTER ? 1 : 0;

			if (depth == 0 && clause == Clause.SELECT && caseDepth == 0 && token.isPunctuation(",")) {
				output.append(',');
				newLine(itemLevel);
				previous = token;
				continue;
			}

			if (token.isKeyword("BETWEEN")) {
				betweenPending = true;
			} else if (token.isKeyword("AND") && betweenPending) {
				betweenPending = false;
			} else if (depth == 0 && clause == Clause.FILTER && caseDepth == 0
					&& (token.isKeyword("AND") || token.isKeyword("OR"))) {
				newLine(itemLevel);
			}

			if (token.isKeyword("WHEN") || token.isKeyword("ELSE")) {
				if (caseDepth > 0) {
					newLine(itemLevel + caseDepth);
				}
			} else if (token.isKeyword("END") && caseDepth > 0) {
				caseDepth--;
				newLine(itemLevel + caseDepth);
			}

			if (needsSpace(previous, token)) {
				output.append(' ');
			}
			output.append(text(token));
			atLineStart = false;

			if (token.isKeyword("CASE")) {
				caseDepth++;
			} else if (token.isPunctuation("(")) {
				depth++;
			} else if (token.isPunctuation(")") && depth > 0) {
				depth--;
			}
			previous = token;
		}

		return output.toString();
	}

	/**
	 * Returns how many tokens starting at {@code index} form a clause-opening
	 * phrase such as {@code GROUP BY} or {@code LEFT OUTER JOIN}, or 0 if none does.
	 */
	private int clausePhraseLength(List<SqlToken> tokens, int index) {
		SqlToken token = tokens.get(index);
		if (!token.isType(SqlToken.TokenType.KEYWORD)) {
			return 0;
		}
		String word = token.normalized();
		if (SIMPLE_CLAUSES.contains(word)) {
			if ((word.equals("UNION") || word.equals("INTERSECT") || word.equals("EXCEPT"))
					&& keywordAt(tokens, index + 1, "ALL")) {
				return 2;
			}
			return 1;
		}
		if ((word.equals("GROUP") || word.equals("ORDER")) && keywordAt(tokens, index + 1, "BY")) {
			return 2;
		}
		if (JOIN_MODIFIERS.contains(word)) {
			int next = index + 1;
			if (keywordAt(tokens, next, "OUTER")) {
				next++;
			}
			if (keywordAt(tokens, next, "JOIN")) {
				return next - index + 1;
			}
		}
		return 0;
	}

	private boolean keywordAt(List<SqlToken> tokens, int index, String keyword) {
		return index < tokens.size() && tokens.get(index).isKeyword(keyword);
	}

	private boolean needsSpace(SqlToken previous, SqlToken current) {
		if (atLineStart || previous == null) {
			return false;
		}
		if (current.isPunctuation(",") || current.isPunctuation(";") || current.isPunctuation(")")) {
			return false;
		}
		if (previous.isPunctuation("(")) {
			return false;
		}
		// function call: no space between name and its argument list
		return !(current.isPunctuation("(") && previous.isType(SqlToken.TokenType.IDENTIFIER));
	}

	private String text(SqlToken token) {
		if (uppercaseKeywords && token.isType(SqlToken.TokenType.KEYWORD)) {
			return token.value().toUpperCase(Locale.ROOT);
		}
		return token.value();
	}

	private void newLine(int level) {
		while (output.length() > 0 && output.charAt(output.length() - 1) == ' ') {
			output.setLength(output.length() - 1);
		}
		output.append('\n').append(" ".repeat(level * indentSize));
		atLineStart = true;
	}
}
