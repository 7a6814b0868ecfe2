package org.pragmatica.hcl.parser;

import org.pragmatica.hcl.error.Expectation;
import org.pragmatica.hcl.tree.SourceSpan;

import java.util.List;

/**
 * Token types produced by {@link HclLexer}.
 */
public sealed interface Token {
    SourceSpan span();

    // Identifiers and literals
    record Ident(SourceSpan span, String name) implements Token {}

    record Number(SourceSpan span, String text) implements Token {}

    record Punct(SourceSpan span, Symbol symbol) implements Token {}

    record Newline(SourceSpan span) implements Token {}

    // Templates
    record OpenQuote(SourceSpan span) implements Token {}

    record CloseQuote(SourceSpan span) implements Token {}

    /**
     * Literal template text with escapes already decoded.
     */
    record TemplateLiteral(SourceSpan span, String value) implements Token {}

    // ${ or ${~
    record InterpolationStart(SourceSpan span, boolean strip) implements Token {}

    // %{ or %{~
    record DirectiveStart(SourceSpan span, boolean strip) implements Token {}

    // } or ~} closing an interpolation or directive
    record TemplateSeqEnd(SourceSpan span, boolean strip) implements Token {}

    // <<DELIM or <<-DELIM, including the line terminator after it
    record HeredocStart(SourceSpan span, String delimiter, boolean indented) implements Token {}

    record HeredocEnd(SourceSpan span) implements Token {}

    // Special
    record Eof(SourceSpan span) implements Token {}

    /**
     * A character that starts no token. The parser reports it against its own expectations.
     */
    record Unknown(SourceSpan span, String text) implements Token {}

    /**
     * Malformed input the lexer diagnosed itself, e.g. a bad escape sequence.
     */
    record Invalid(SourceSpan span, String category, List<Expectation> expected) implements Token {}

    /**
     * Punctuation and operators.
     */
    enum Symbol {
        LBRACE("{"),
        RBRACE("}"),
        LBRACKET("["),
        RBRACKET("]"),
        LPAREN("("),
        RPAREN(")"),
        COMMA(","),
        DOT("."),
        ELLIPSIS("..."),
        ASSIGN("="),
        EQ("=="),
        BANG("!"),
        NOT_EQ("!="),
        LESS("<"),
        LESS_EQ("<="),
        GREATER(">"),
        GREATER_EQ(">="),
        AND("&&"),
        OR("||"),
        PLUS("+"),
        MINUS("-"),
        STAR("*"),
        SLASH("/"),
        PERCENT("%"),
        QUESTION("?"),
        COLON(":"),
        DOUBLE_COLON("::"),
        FAT_ARROW("=>");

        private final String text;

        Symbol(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }
    }

    static boolean is(Token token, Symbol symbol) {
        return token instanceof Punct punct && punct.symbol() == symbol;
    }

    static boolean isKeyword(Token token, String keyword) {
        return token instanceof Ident ident && ident.name().equals(keyword);
    }
}
