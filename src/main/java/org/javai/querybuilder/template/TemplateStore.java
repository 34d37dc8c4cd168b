package org.javai.querybuilder.template;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for named query configuration documents.
 */
public interface TemplateStore {
	Optional<JsonNode> get(String name);
	void put(String name, JsonNode document);
	boolean delete(String name);
	List<TemplateSummary> listAll();
}
