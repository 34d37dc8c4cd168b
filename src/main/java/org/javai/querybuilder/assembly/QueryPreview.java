package org.javai.querybuilder.assembly;

import java.util.List;
import org.javai.querybuilder.validation.ValidationResult;

/**
 * Everything derived from one query configuration in a single pass.
 *
 * @param sql the rendered statement
 * @param validation structural diagnostics for {@code sql}
 * @param description the prose description; empty if it could not be produced
 * @param requirements the requirements transcript; empty if it could not be produced
 * @param statistics counts for the query and its rendering
 * @param problems consistency findings for the configuration
 */
public record QueryPreview(
		String sql,
		ValidationResult validation,
		String description,
		String requirements,
		QueryStatistics statistics,
		List<ConsistencyProblem> problems
) {

	public QueryPreview {
		problems = problems != null ? List.copyOf(problems) : List.of();
	}
}
