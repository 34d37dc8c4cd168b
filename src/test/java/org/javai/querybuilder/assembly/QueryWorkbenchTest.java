package org.javai.querybuilder.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.querybuilder.config.ConfigurationException;
import org.javai.querybuilder.config.QueryConfigurationCodec;
import org.javai.querybuilder.template.InMemoryTemplateStore;
import org.javai.querybuilder.template.TemplateStoreException;
import org.javai.querybuilder.template.TemplateSummary;
import org.javai.querybuilder.validation.QueryValidator;
import org.javai.querybuilder.validation.SqlTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryWorkbenchTest {

	private static final String EXAMPLE_SQL = """
			SELECT
			  p.product_id,
			  p.product_name,
			  p.price,
			  c.category_name
			FROM products AS p
			LEFT JOIN categories AS c ON p.category_id = c.category_id
			WHERE
			  p.price > 100
			ORDER BY p.price DESC;""";

	private final ObjectMapper mapper = new ObjectMapper();
	private InMemoryTemplateStore templates;
	private QueryWorkbench workbench;

	@BeforeEach
	void setUp() {
		templates = new InMemoryTemplateStore();
		workbench = new QueryWorkbench(templates);
	}

	private JsonNode ordersDocument() throws Exception {
		return mapper.readTree("""
				{
				  "tables": [{"name": "orders", "alias": "o", "fields": ["id", "total"]}],
				  "filters": [{"tableAlias": "o", "field": "total", "operator": "GREATER_EQUAL", "value": 50}],
				  "limitConfig": {"limit": 5, "offset": 0}
				}""");
	}

	@Nested
	@DisplayName("Preview")
	class Preview {

		@Test
		@DisplayName("previews an empty configuration without failing")
		void emptyConfiguration() {
			QueryPreview preview = workbench.preview();

			assertThat(preview.sql()).isEqualTo("SELECT\n  ;");
			assertThat(preview.validation().valid()).isTrue();
			assertThat(preview.description()).isEqualTo("Query data.");
			assertThat(preview.statistics().tableCount()).isZero();
			assertThat(preview.problems()).extracting(ConsistencyProblem::code)
					.containsExactly(ConsistencyProblem.Code.NO_TABLES, ConsistencyProblem.Code.EMPTY_SELECT_LIST);
		}

		@Test
		@DisplayName("previews an applied document")
		void appliedDocument() throws Exception {
			workbench.apply(ordersDocument());

			QueryPreview preview = workbench.preview();

			assertThat(preview.sql()).isEqualTo("""
					SELECT
					  o.id,
					  o.total
					FROM orders AS o
					WHERE
					  o.total >= 50
					LIMIT 5;""");
			assertThat(preview.description()).contains("**Limit**: return 5 rows");
			assertThat(preview.requirements()).contains("- o.total is at least 50");
			assertThat(preview.problems()).isEmpty();
		}

		@Test
		@DisplayName("reports a failing tokenizer in the validation result")
		void tokenizerFailure() {
			SqlTokenizer tokenizer = mock(SqlTokenizer.class);
			when(tokenizer.tokenize(anyString())).thenThrow(new IllegalStateException("boom"));
			QueryWorkbench failing = new QueryWorkbench(new QueryConfigurationCodec(),
					new QueryValidator(tokenizer, false), templates);
			failing.loadExample();

			QueryPreview preview = failing.preview();

			assertThat(preview.sql()).isEqualTo(EXAMPLE_SQL);
			assertThat(preview.validation().valid()).isFalse();
			assertThat(preview.validation().errors()).containsExactly("Parse error: boom");
			assertThat(preview.description()).startsWith("Query data, from **products** table");
		}
	}

	@Nested
	@DisplayName("Configuration changes")
	class ConfigurationChanges {

		@Test
		@DisplayName("rejects a document with an unknown operator and keeps the current one")
		void rejectsUnknownOperator() throws Exception {
			workbench.apply(ordersDocument());
			ObjectNode broken = (ObjectNode) ordersDocument();
			((ObjectNode) broken.get("filters").get(0)).put("operator", "ROUGHLY");

			assertThatThrownBy(() -> workbench.apply(broken))
					.isInstanceOf(ConfigurationException.class)
					.hasMessageContaining("ROUGHLY");
			assertThat(workbench.preview().sql()).contains("o.total >= 50");
		}

		@Test
		@DisplayName("clear empties the configuration")
		void clearEmpties() throws Exception {
			workbench.apply(ordersDocument());
			workbench.clear();

			assertThat(workbench.preview().sql()).isEqualTo("SELECT\n  ;");
		}

		@Test
		@DisplayName("document returns a copy")
		void documentIsCopy() throws Exception {
			workbench.apply(ordersDocument());
			((ObjectNode) workbench.document()).put("distinct", true);

			assertThat(workbench.rebuild().isDistinct()).isFalse();
		}
	}

	@Nested
	@DisplayName("Example")
	class Example {

		@Test
		@DisplayName("loads the example query")
		void loadsExample() {
			workbench.loadExample();

			assertThat(workbench.preview().sql()).isEqualTo(EXAMPLE_SQL);
			assertThat(workbench.canUndoExample()).isTrue();
		}

		@Test
		@DisplayName("undo restores the configuration from before the example, once")
		void undoRestoresOnce() throws Exception {
			workbench.apply(ordersDocument());
			String before = workbench.preview().sql();

			workbench.loadExample();

			assertThat(workbench.undoExample()).isTrue();
			assertThat(workbench.preview().sql()).isEqualTo(before);
			assertThat(workbench.undoExample()).isFalse();
			assertThat(workbench.canUndoExample()).isFalse();
		}

		@Test
		@DisplayName("undo without an example does nothing")
		void undoWithoutExample() {
			assertThat(workbench.undoExample()).isFalse();
		}
	}

	@Nested
	@DisplayName("Templates")
	class Templates {

		@Test
		@DisplayName("saves, lists, loads and deletes templates")
		void lifecycle() throws Exception {
			workbench.apply(ordersDocument());
			workbench.saveTemplate("Big orders");
			workbench.loadExample();
			workbench.saveTemplate("Example");

			assertThat(workbench.listTemplates()).extracting(TemplateSummary::name)
					.containsExactly("Big orders", "Example");

			assertThat(workbench.loadTemplate("Big orders")).isTrue();
			assertThat(workbench.preview().sql()).contains("FROM orders AS o");

			assertThat(workbench.deleteTemplate("Big orders")).isTrue();
			assertThat(workbench.deleteTemplate("Big orders")).isFalse();
			assertThat(workbench.listTemplates()).extracting(TemplateSummary::name).containsExactly("Example");
		}

		@Test
		@DisplayName("loading a missing template keeps the configuration")
		void missingTemplate() throws Exception {
			workbench.apply(ordersDocument());

			assertThat(workbench.loadTemplate("nothing here")).isFalse();
			assertThat(workbench.preview().sql()).contains("FROM orders AS o");
		}

		@Test
		@DisplayName("refuses a blank template name")
		void blankName() {
			assertThatThrownBy(() -> workbench.saveTemplate("  "))
					.isInstanceOf(TemplateStoreException.class);
		}
	}
}
