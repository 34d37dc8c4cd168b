package org.javai.querybuilder.assembly;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.javai.querybuilder.config.ConfigurationException;
import org.javai.querybuilder.config.QueryConfigurationCodec;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.JoinKind;
import org.javai.querybuilder.model.SortDirection;
import org.javai.querybuilder.narrative.QueryNarrator;
import org.javai.querybuilder.narrative.RequirementsTranscriber;
import org.javai.querybuilder.template.TemplateStore;
import org.javai.querybuilder.template.TemplateStoreException;
import org.javai.querybuilder.template.TemplateSummary;
import org.javai.querybuilder.validation.QueryValidator;
import org.javai.querybuilder.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one session's query configuration document and derives everything shown
 * for it.
 *
 * <p>The workbench keeps the configuration as a document rather than as a live
 * {@link QueryAssembly}: every {@link #preview()} rebuilds a fresh assembly, so
 * the preview always reflects the document exactly. Documents are normalized
 * through {@link QueryConfigurationCodec} on the way in.</p>
 *
 * <p>A workbench is meant for a single writer and is not thread-safe.</p>
 */
public class QueryWorkbench {

	private static final Logger logger = LoggerFactory.getLogger(QueryWorkbench.class);

	private final QueryConfigurationCodec codec;
	private final QueryValidator validator;
	private final TemplateStore templates;

	private JsonNode document;
	private JsonNode exampleBackup;

	public QueryWorkbench(TemplateStore templates) {
		this(new QueryConfigurationCodec(), new QueryValidator(), templates);
	}

	public QueryWorkbench(QueryConfigurationCodec codec, QueryValidator validator, TemplateStore templates) {
		this.codec = codec;
		this.validator = validator;
		this.templates = templates;
		this.document = codec.toDocument(new QueryAssembly());
	}

	/**
	 * Replaces the current configuration.
	 *
	 * @throws ConfigurationException if the document names an unknown operator,
	 *         join type, logic operator or sort direction
	 */
	public void apply(JsonNode document) {
		this.document = normalize(document);
	}

	/**
	 * @return a copy of the current configuration document
	 */
	public JsonNode document() {
		return document.deepCopy();
	}

	public QueryAssembly rebuild() {
		return codec.fromDocument(document);
	}

	/**
	 * Renders, validates, describes and measures the current configuration.
	 * Narrative failures are logged and reported as empty text.
	 */
	public QueryPreview preview() {
		QueryAssembly query = rebuild();
		String sql = query.toSql();
		ValidationResult validation = validator.validate(sql);
		String description = narrate("description", query, QueryNarrator::describe);
		String requirements = narrate("requirements", query, RequirementsTranscriber::transcribe);
		return new QueryPreview(sql, validation, description, requirements,
				QueryStatistics.of(query, sql), QueryConsistencyChecker.check(query));
	}

	public void clear() {
		document = codec.toDocument(new QueryAssembly());
	}

	/**
	 * Replaces the configuration with {@link #exampleQuery()}, keeping the current
	 * configuration so that {@link #undoExample()} can restore it.
	 */
	public void loadExample() {
		exampleBackup = document;
		document = codec.toDocument(exampleQuery());
	}

	/**
	 * Restores the configuration saved by the last {@link #loadExample()}. The
	 * backup is consumed, so a second undo does nothing.
	 *
	 * @return whether a configuration was restored
	 */
	public boolean undoExample() {
		if (exampleBackup == null) {
			return false;
		}
		document = exampleBackup;
		exampleBackup = null;
		return true;
	}

	public boolean canUndoExample() {
		return exampleBackup != null;
	}

	public void saveTemplate(String name) {
		if (name == null || name.isBlank()) {
			throw new TemplateStoreException("Template name must not be blank");
		}
		templates.put(name, document);
		logger.debug("Saved template '{}'", name);
	}

	/**
	 * Replaces the configuration with a saved template.
	 *
	 * @return {@code false} if there is no template with that name
	 */
	public boolean loadTemplate(String name) {
		Optional<JsonNode> template = templates.get(name);
		template.ifPresent(this::apply);
		return template.isPresent();
	}

	public boolean deleteTemplate(String name) {
		return templates.delete(name);
	}

	public List<TemplateSummary> listTemplates() {
		return templates.listAll();
	}

	/**
	 * A small two-table query: products with their category, priced above 100,
	 * most expensive first.
	 */
	public static QueryAssembly exampleQuery() {
		QueryAssembly query = new QueryAssembly();
		query.addTable("products", "p", List.of("product_id", "product_name", "price"));
		query.addJoin("p", "categories", "c", "category_id", "category_id", JoinKind.LEFT, List.of("category_name"));
		query.addFilter("p", "price", FilterOperator.GREATER, 100);
		query.addOrderBy("p", "price", SortDirection.DESC);
		return query;
	}

	private JsonNode normalize(JsonNode document) {
		return codec.toDocument(codec.fromDocument(document));
	}

	private static String narrate(String kind, QueryAssembly query, Function<QueryAssembly, String> narrator) {
		try {
			return narrator.apply(query);
		} catch (RuntimeException e) {
			logger.warn("Failed to produce query {}", kind, e);
			return "";
		}
	}
}
