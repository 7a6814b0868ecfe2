package org.pragmatica.hcl.format;

import java.util.Objects;

/**
 * Formatter configuration options.
 *
 * @param indent         text emitted once per nesting level
 * @param compactArrays  render tuples on a single line; otherwise one element per line
 * @param compactObjects render every object on a single line, including attribute values
 */
public record FormatterConfig(String indent, boolean compactArrays, boolean compactObjects) {
    public static final FormatterConfig DEFAULT = new FormatterConfig("  ", true, false);

    public FormatterConfig {
        Objects.requireNonNull(indent, "indent");
        if (!indent.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("Indent must consist of spaces and tabs only");
        }
    }

    public FormatterConfig withIndent(String indent) {
        return new FormatterConfig(indent, compactArrays, compactObjects);
    }

    public FormatterConfig withCompactArrays(boolean compactArrays) {
        return new FormatterConfig(indent, compactArrays, compactObjects);
    }

    public FormatterConfig withCompactObjects(boolean compactObjects) {
        return new FormatterConfig(indent, compactArrays, compactObjects);
    }
}
