package org.javai.querybuilder.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Settings shared by the validator, formatter and template store.
 *
 * <p>Read from a YAML document with the keys {@code indent_width},
 * {@code uppercase_keywords}, {@code strict_grammar} and
 * {@code template_directory}; any key left out keeps its default. A template
 * directory starting with {@code ~/} is resolved against the user's home.</p>
 *
 * @param indentWidth spaces per indentation level in formatted SQL
 * @param uppercaseKeywords whether the formatter upper-cases keywords
 * @param strictGrammar whether validation also reports full-grammar parse failures as warnings
 * @param templateDirectory where the file template store keeps its documents
 */
public record QueryBuilderSettings(int indentWidth, boolean uppercaseKeywords, boolean strictGrammar,
		Path templateDirectory) {

	public static final String RESOURCE_NAME = "querybuilder.yml";
	static final String DEFAULT_TEMPLATE_DIRECTORY = "~/.sql_builder_templates";

	public QueryBuilderSettings {
		if (indentWidth < 0) {
			throw new ConfigurationException("indent_width must not be negative: " + indentWidth);
		}
		templateDirectory = templateDirectory != null ? templateDirectory : expandHome(DEFAULT_TEMPLATE_DIRECTORY);
	}

	public static QueryBuilderSettings defaults() {
		return new QueryBuilderSettings(2, true, false, null);
	}

	/**
	 * Loads {@value #RESOURCE_NAME} from the classpath, falling back to
	 * {@link #defaults()} when there is none.
	 */
	public static QueryBuilderSettings fromClasspath() {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null) {
			loader = QueryBuilderSettings.class.getClassLoader();
		}
		try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
			return in != null ? load(in) : defaults();
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read " + RESOURCE_NAME, e);
		}
	}

	public static QueryBuilderSettings load(InputStream inputStream) {
		Map<String, Object> data;
		try {
			data = new Yaml().load(inputStream);
		} catch (RuntimeException e) {
			throw new ConfigurationException("Failed to parse query builder settings", e);
		}
		if (data == null) {
			return defaults();
		}
		QueryBuilderSettings defaults = defaults();
		Object directory = data.get("template_directory");
		return new QueryBuilderSettings(
				intValue(data, "indent_width", defaults.indentWidth()),
				booleanValue(data, "uppercase_keywords", defaults.uppercaseKeywords()),
				booleanValue(data, "strict_grammar", defaults.strictGrammar()),
				directory != null ? expandHome(directory.toString()) : null);
	}

	private static int intValue(Map<String, Object> data, String key, int fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new ConfigurationException("'" + key + "' must be a number but was: " + value);
	}

	private static boolean booleanValue(Map<String, Object> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean bool) {
			return bool;
		}
		throw new ConfigurationException("'" + key + "' must be true or false but was: " + value);
	}

	static Path expandHome(String directory) {
		if (directory.equals("~") || directory.startsWith("~/")) {
			return Path.of(System.getProperty("user.home")).resolve(directory.substring(1).replaceFirst("^/", ""));
		}
		return Path.of(directory);
	}
}
