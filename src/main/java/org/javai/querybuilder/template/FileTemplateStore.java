package org.javai.querybuilder.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.javai.querybuilder.config.QueryBuilderSettings;
import org.javai.querybuilder.config.QueryConfigurationCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps each template as a pretty-printed {@code <name>.json} file in one
 * directory.
 *
 * <p>File names are derived from the template name by keeping only letters,
 * digits, spaces, {@code -} and {@code _}, then trimming. Two names that reduce
 * to the same file name therefore share a template. The original name is stored
 * inside the document under {@code name} and reported by {@link #listAll()}.</p>
 *
 * <p>The directory is created on first save. Files that cannot be read are left
 * out of the listing.</p>
 */
public class FileTemplateStore implements TemplateStore {

	private static final Logger logger = LoggerFactory.getLogger(FileTemplateStore.class);

	static final String NAME_FIELD = "name";
	private static final String EXTENSION = ".json";

	private final Path directory;
	private final ObjectMapper mapper;

	public FileTemplateStore(QueryBuilderSettings settings) {
		this(settings.templateDirectory());
	}

	public FileTemplateStore(Path directory) {
		this(directory, QueryConfigurationCodec.documentMapper());
	}

	public FileTemplateStore(Path directory, ObjectMapper mapper) {
		this.directory = directory;
		this.mapper = mapper;
	}

	public Path directory() {
		return directory;
	}

	@Override
	public Optional<JsonNode> get(String name) {
		Path file = fileFor(name);
		if (!Files.isRegularFile(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(mapper.readTree(file.toFile()));
		} catch (IOException e) {
			throw new TemplateStoreException("Failed to read template '" + name + "' from " + file, e);
		}
	}

	@Override
	public void put(String name, JsonNode document) {
		Path file = fileFor(name);
		ObjectNode stored = mapper.createObjectNode();
		stored.put(NAME_FIELD, name);
		if (document != null && document.isObject()) {
			document.fields().forEachRemaining(entry -> {
				if (!NAME_FIELD.equals(entry.getKey())) {
					stored.set(entry.getKey(), entry.getValue().deepCopy());
				}
			});
		}
		try {
			Files.createDirectories(directory);
			mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), stored);
		} catch (IOException e) {
			throw new TemplateStoreException("Failed to save template '" + name + "' to " + file, e);
		}
		logger.debug("Saved template '{}' to {}", name, file);
	}

	@Override
	public boolean delete(String name) {
		Path file = fileFor(name);
		try {
			return Files.deleteIfExists(file);
		} catch (IOException e) {
			throw new TemplateStoreException("Failed to delete template '" + name + "' at " + file, e);
		}
	}

	@Override
	public List<TemplateSummary> listAll() {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		List<Path> files;
		try (Stream<Path> entries = Files.list(directory)) {
			files = entries
					.filter(path -> path.getFileName().toString().endsWith(EXTENSION))
					.filter(Files::isRegularFile)
					.sorted()
					.toList();
		} catch (IOException e) {
			throw new TemplateStoreException("Failed to list templates in " + directory, e);
		}

		List<TemplateSummary> summaries = new ArrayList<>();
		for (Path file : files) {
			try {
				JsonNode document = mapper.readTree(file.toFile());
				JsonNode name = document.get(NAME_FIELD);
				summaries.add(new TemplateSummary(
						name != null && name.isTextual() ? name.asText() : stem(file), file));
			} catch (IOException e) {
				logger.warn("Skipping unreadable template file {}: {}", file, e.getMessage());
			}
		}
		return summaries;
	}

	Path fileFor(String name) {
		String safeName = safeName(name);
		if (safeName.isEmpty()) {
			throw new TemplateStoreException("Template name '" + name + "' has no usable characters");
		}
		return directory.resolve(safeName + EXTENSION);
	}

	static String safeName(String name) {
		if (name == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		name.codePoints()
				.filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
				.forEach(sb::appendCodePoint);
		return sb.toString().trim();
	}

	private static String stem(Path file) {
		String fileName = file.getFileName().toString();
		return fileName.substring(0, fileName.length() - EXTENSION.length());
	}
}
