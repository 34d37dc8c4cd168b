package org.javai.querybuilder.validation;

import java.util.List;
import java.util.Optional;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.alter.Alter;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.view.CreateView;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.drop.Drop;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.truncate.Truncate;
import net.sf.jsqlparser.statement.update.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects the statement kind of SQL text.
 *
 * <p>The text is first parsed with JSqlParser; when that succeeds the parsed
 * statement's type decides the kind. Rendered queries are often outside the
 * grammar JSqlParser accepts (an empty select list, a dangling operator), so a
 * failed parse falls back to the first statement keyword of the token stream and
 * records the parser's message as the grammar error.</p>
 */
public class StatementClassifier {

	private static final Logger logger = LoggerFactory.getLogger(StatementClassifier.class);

	/**
	 * @param kind the detected statement kind
	 * @param grammarError the parser's rejection message, or {@code null} if the text parsed
	 */
	public record Classification(StatementKind kind, String grammarError) {
	}

	public Classification classify(String sql, List<SqlToken> tokens) {
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(sql);
		} catch (JSQLParserException | RuntimeException e) {
			String message = rootMessage(e);
			logger.debug("Grammar parse rejected text, falling back to lexical detection: {}", message);
			return new Classification(lexicalKind(tokens), message);
		}
		return new Classification(kindOf(statement, tokens).orElseGet(() -> lexicalKind(tokens)), null);
	}

	/**
	 * Maps a parsed statement to its kind. JSqlParser parses {@code REPLACE INTO}
	 * as an {@link Insert}, so the leading keyword tells the two apart.
	 */
	private static Optional<StatementKind> kindOf(Statement statement, List<SqlToken> tokens) {
		StatementKind kind = null;
		if (statement instanceof Select) {
			kind = StatementKind.SELECT;
		} else if (statement instanceof Insert) {
			kind = lexicalKind(tokens) == StatementKind.REPLACE ? StatementKind.REPLACE : StatementKind.INSERT;
		} else if (statement instanceof Update) {
			kind = StatementKind.UPDATE;
		} else if (statement instanceof Delete) {
			kind = StatementKind.DELETE;
		} else if (statement instanceof Merge) {
			kind = StatementKind.MERGE;
		} else if (statement instanceof CreateTable || statement instanceof CreateView
				|| statement instanceof CreateIndex) {
			kind = StatementKind.CREATE;
		} else if (statement instanceof Alter) {
			kind = StatementKind.ALTER;
		} else if (statement instanceof Drop) {
			kind = StatementKind.DROP;
		} else if (statement instanceof Truncate) {
			kind = StatementKind.TRUNCATE;
		}
		return Optional.ofNullable(kind);
	}

	/**
	 * The first keyword decides the kind, ignoring comments and opening
	 * parentheses. A leading {@code WITH} is skipped up to the first statement
	 * keyword outside parentheses.
	 */
	static StatementKind lexicalKind(List<SqlToken> tokens) {
		boolean inWith = false;
		int depth = 0;
		for (SqlToken token : tokens) {
			if (token.isType(SqlToken.TokenType.COMMENT)) {
				continue;
			}
			if (token.isPunctuation("(")) {
				depth++;
				continue;
			}
			if (token.isPunctuation(")")) {
				depth = Math.max(0, depth - 1);
				continue;
			}
			if (!inWith && token.isKeyword("WITH")) {
				inWith = true;
				continue;
			}
			if (inWith) {
				if (depth == 0 && token.isType(SqlToken.TokenType.KEYWORD)) {
					Optional<StatementKind> kind = StatementKind.forKeyword(token.value());
					if (kind.isPresent()) {
						return kind.get();
					}
				}
				continue;
			}
			if (token.isType(SqlToken.TokenType.KEYWORD)) {
				return StatementKind.forKeyword(token.value()).orElse(StatementKind.UNKNOWN);
			}
			return StatementKind.UNKNOWN;
		}
		return StatementKind.UNKNOWN;
	}

	private static String rootMessage(Throwable e) {
		Throwable cause = e;
		while (cause.getCause() != null && cause.getCause() != cause) {
			cause = cause.getCause();
		}
		String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		return message.lines().findFirst().orElse(message).trim();
	}
}
