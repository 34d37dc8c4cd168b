package org.javai.querybuilder.template;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple in-memory template store, intended for tests and local use. Templates
 * are listed in the order they were first saved.
 */
public class InMemoryTemplateStore implements TemplateStore {

	private final Map<String, JsonNode> templates = new LinkedHashMap<>();

	@Override
	public synchronized Optional<JsonNode> get(String name) {
		JsonNode document = templates.get(name);
		return Optional.ofNullable(document != null ? document.deepCopy() : null);
	}

	@Override
	public synchronized void put(String name, JsonNode document) {
		templates.put(name, document.deepCopy());
	}

	@Override
	public synchronized boolean delete(String name) {
		return templates.remove(name) != null;
	}

	@Override
	public synchronized List<TemplateSummary> listAll() {
		List<TemplateSummary> summaries = new ArrayList<>();
		templates.keySet().forEach(name -> summaries.add(new TemplateSummary(name, null)));
		return summaries;
	}
}
