package org.pragmatica.hcl.parser;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth how deep expressions may nest before parsing stops with a
 *                        {@code nesting too deep} error
 */
public record ParserConfig(int maxNestingDepth) {
    public static final ParserConfig DEFAULT = new ParserConfig(256);

    public ParserConfig {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public ParserConfig withMaxNestingDepth(int maxNestingDepth) {
        return new ParserConfig(maxNestingDepth);
    }
}
