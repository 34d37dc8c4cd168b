package org.javai.querybuilder.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JoinKindTest {

	@Test
	@DisplayName("resolves constant names and SQL keywords ignoring case")
	void resolvesNamesAndKeywords() {
		assertThat(JoinKind.fromKeyword("LEFT")).isEqualTo(JoinKind.LEFT);
		assertThat(JoinKind.fromKeyword("left join")).isEqualTo(JoinKind.LEFT);
		assertThat(JoinKind.fromKeyword("FULL OUTER JOIN")).isEqualTo(JoinKind.FULL_OUTER);
		assertThat(JoinKind.fromKeyword("full_outer")).isEqualTo(JoinKind.FULL_OUTER);
	}

	@Test
	@DisplayName("rejects unknown join types")
	void rejectsUnknown() {
		assertThatThrownBy(() -> JoinKind.fromKeyword("SIDEWAYS JOIN"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("SIDEWAYS JOIN");
	}

	@Test
	@DisplayName("renders its SQL keyword")
	void keyword() {
		assertThat(JoinKind.INNER.keyword()).isEqualTo("INNER JOIN");
		assertThat(JoinKind.FULL_OUTER.keyword()).isEqualTo("FULL OUTER JOIN");
	}
}
