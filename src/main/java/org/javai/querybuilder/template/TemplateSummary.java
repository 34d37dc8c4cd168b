package org.javai.querybuilder.template;

import java.nio.file.Path;

/**
 * A listed template.
 *
 * @param name the name the template was saved under
 * @param file the backing file, or {@code null} for stores that keep templates in memory
 */
public record TemplateSummary(String name, Path file) {
}
