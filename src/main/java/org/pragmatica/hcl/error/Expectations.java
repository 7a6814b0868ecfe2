package org.pragmatica.hcl.error;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import static org.pragmatica.hcl.error.Expectation.description;
import static org.pragmatica.hcl.error.Expectation.literal;

/**
 * Expected-token sets and failure categories shared by the lexer and the parser.
 */
public final class Expectations {
    private Expectations() {}

    // Categories
    public static final String INVALID_STRUCTURE = "invalid structure";
    public static final String INVALID_BLOCK = "invalid block";
    public static final String INVALID_BLOCK_BODY = "invalid block body";
    public static final String INVALID_BLOCK_LABEL = "invalid block label";
    public static final String INVALID_ATTRIBUTE = "invalid attribute";
    public static final String INVALID_EXPRESSION = "invalid expression";
    public static final String INVALID_TRAVERSAL_OPERATOR = "invalid traversal operator";
    public static final String INVALID_INDEX = "invalid index";
    public static final String INVALID_SPLAT = "invalid splat";
    public static final String INVALID_ARRAY_ITEM = "invalid array item";
    public static final String INVALID_OBJECT_ITEM = "invalid object item";
    public static final String INVALID_FUNCTION_CALL = "invalid function call";
    public static final String INVALID_PARENTHESIZED_EXPRESSION = "invalid parenthesized expression";
    public static final String INVALID_CONDITIONAL = "invalid conditional";
    public static final String INVALID_FOR_EXPRESSION = "invalid for expression";
    public static final String INVALID_STRING = "invalid string";
    public static final String INVALID_ESCAPE_SEQUENCE = "invalid escape sequence";
    public static final String INVALID_HEREDOC = "invalid heredoc";
    public static final String INVALID_INTERPOLATION = "invalid interpolation";
    public static final String INVALID_TEMPLATE_DIRECTIVE = "invalid template directive";
    public static final String INVALID_COMMENT = "invalid comment";
    public static final String NESTING_TOO_DEEP = "nesting too deep";

    // Abstract terminals
    public static final Expectation IDENTIFIER = description("identifier");
    public static final Expectation NEWLINE = description("newline");
    public static final Expectation UNSIGNED_INTEGER = description("unsigned integer");
    public static final Expectation END_OF_INPUT = description("end of input");
    public static final Expectation LETTER = description("letter");
    public static final Expectation DIGIT = description("digit");

    public static final List<Expectation> STRUCTURE_CONTINUATION =
        List.of(literal("{"), literal("="), literal("\""), IDENTIFIER);
    public static final List<Expectation> BLOCK_CONTINUATION =
        List.of(literal("{"), literal("\""), IDENTIFIER);
    public static final List<Expectation> BLOCK_BODY =
        List.of(literal("}"), NEWLINE, IDENTIFIER);
    public static final List<Expectation> ATTRIBUTE_ASSIGNMENT = List.of(literal("="));
    public static final List<Expectation> EXPRESSION_START =
        List.of(literal("\""), literal("["), literal("{"), literal("-"), literal("!"), literal("("),
                literal("_"), literal("<"), LETTER, DIGIT);
    public static final List<Expectation> TRAVERSAL_OPERATOR =
        List.of(literal("*"), IDENTIFIER, UNSIGNED_INTEGER);
    public static final List<Expectation> OBJECT_ITEM_CONTINUATION =
        List.of(literal("}"), literal(","), NEWLINE);
    public static final List<Expectation> OBJECT_ITEM_ASSIGNMENT = List.of(literal("="), literal(":"));
    public static final List<Expectation> ARRAY_ITEM_CONTINUATION = List.of(literal("]"), literal(","));
    public static final List<Expectation> FUNCTION_ARGUMENT_CONTINUATION =
        List.of(literal(")"), literal(","), literal("..."));
    public static final List<Expectation> ESCAPE_SEQUENCE =
        List.of(literal("n"), literal("r"), literal("t"), literal("\""), literal("\\"), literal("u"), literal("U"));

    public static List<Expectation> literals(String... texts) {
        var result = new ArrayList<Expectation>(texts.length);
        for (var text : texts) {
            result.add(literal(text));
        }
        return List.copyOf(result);
    }

    /**
     * Deduplicate while keeping first-encountered order, then move literals ahead of
     * descriptions. The partition is stable.
     */
    public static List<Expectation> ordered(List<Expectation> expected) {
        var unique = new LinkedHashSet<>(expected);
        var result = new ArrayList<Expectation>(unique.size());
        for (var expectation : unique) {
            if (expectation.literal()) {
                result.add(expectation);
            }
        }
        for (var expectation : unique) {
            if (!expectation.literal()) {
                result.add(expectation);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Join alternatives the way a sentence lists them: {@code a, b or c}.
     */
    public static String describe(List<Expectation> expected) {
        var sb = new StringBuilder();
        for (int i = 0; i < expected.size(); i++) {
            if (i > 0) {
                sb.append(i == expected.size() - 1 ? " or " : ", ");
            }
            sb.append(expected.get(i).display());
        }
        return sb.toString();
    }
}
