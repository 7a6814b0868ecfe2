package org.pragmatica.hcl.parser;

import org.pragmatica.hcl.error.Expectation;
import org.pragmatica.hcl.error.Expectations;
import org.pragmatica.hcl.structure.Identifier;
import org.pragmatica.hcl.tree.SourceLocation;
import org.pragmatica.hcl.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.pragmatica.hcl.error.Expectation.literal;

/**
 * Lexer for HCL native syntax.
 *
 * <p>Tokens are produced on demand. The lexer is mode driven: normal code, quoted templates and
 * heredoc templates each scan differently, and every {@code ${} or {@code %{} pushes a normal mode
 * that pops at its matching closing brace, so templates nest to any depth. Malformed input never
 * stops the scan; it becomes an {@link Token.Unknown} or {@link Token.Invalid} token and the
 * parser decides what to report.
 */
public final class HclLexer implements Iterator<Token> {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    /**
     * Receives alternatives the lexer tried and abandoned, for furthest-progress reporting.
     */
    interface FailureListener {
        FailureListener NONE = (location, category, expected) -> {};

        void failed(SourceLocation location, String category, List<Expectation> expected);
    }

    private sealed interface Mode permits Normal, Quoted, Heredoc {}

    private static final class Normal implements Mode {
        private int braceDepth;
    }

    private static final class Quoted implements Mode {}

    private static final class Heredoc implements Mode {
        private final String delimiter;
        private boolean lineStart = true;

        private Heredoc(String delimiter) {
            this.delimiter = delimiter;
        }
    }

    private final String input;
    private final FailureListener listener;
    private final Deque<Mode> modes = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column;
    private boolean finished;

    HclLexer(String input, FailureListener listener) {
        this.input = input;
        this.listener = listener;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.modes.push(new Normal());
    }

    /**
     * Lazily tokenize input. The returned iterator ends after the {@link Token.Eof} token.
     */
    public static HclLexer tokenize(String input) {
        return new HclLexer(input, FailureListener.NONE);
    }

    /**
     * Tokenize the whole input, including the final {@link Token.Eof}.
     */
    public static List<Token> tokenizeAll(String input) {
        var tokens = new ArrayList<Token>();
        tokenize(input).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("End of input already reached");
        }
        var mode = modes.peek();
        Token token;
        if (mode instanceof Quoted) {
            token = nextQuoted();
        } else if (mode instanceof Heredoc heredoc) {
            token = nextHeredoc(heredoc);
        } else {
            token = nextNormal((Normal) mode);
        }
        if (token instanceof Token.Eof) {
            finished = true;
        }
        return token;
    }

    // === Normal mode ===

    private Token nextNormal(Normal mode) {
        var trivia = skipWhitespaceAndComments();
        if (trivia.isPresent()) {
            return trivia.get();
        }
        var start = currentLocation();
        if (isAtEnd()) {
            return new Token.Eof(SourceSpan.at(start));
        }
        char c = peek();
        if (c == '\n') {
            advance();
            return new Token.Newline(span(start));
        }
        if (c == '\r' && peekIs(1, '\n')) {
            advance();
            advance();
            return new Token.Newline(span(start));
        }
        int codePoint = input.codePointAt(pos);
        if (Identifier.isIdentifierStart(codePoint)) {
            return scanIdentifier(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (c == '"') {
            advance();
            modes.push(new Quoted());
            return new Token.OpenQuote(span(start));
        }
        if (c == '<' && peekIs(1, '<')) {
            var heredoc = scanHeredocStart(start);
            if (heredoc.isPresent()) {
                return heredoc.get();
            }
        }
        if (c == '{') {
            advance();
            mode.braceDepth++;
            return new Token.Punct(span(start), Token.Symbol.LBRACE);
        }
        if (c == '}') {
            advance();
            if (mode.braceDepth == 0 && modes.size() > 1) {
                modes.pop();
                return new Token.TemplateSeqEnd(span(start), false);
            }
            if (mode.braceDepth > 0) {
                mode.braceDepth--;
            }
            return new Token.Punct(span(start), Token.Symbol.RBRACE);
        }
        if (c == '~' && peekIs(1, '}') && mode.braceDepth == 0 && modes.size() > 1) {
            advance();
            advance();
            modes.pop();
            return new Token.TemplateSeqEnd(span(start), true);
        }
        return scanOperator(start);
    }

    private Token scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && Identifier.isIdentifierPart(input.codePointAt(pos))) {
            sb.appendCodePoint(advance());
        }
        return new Token.Ident(span(start), sb.toString());
    }

    private Token scanNumber(SourceLocation start) {
        int begin = pos;
        skipDigits();
        if (peekIs(0, '.') && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            advance();
            skipDigits();
        }
        if (peekIs(0, 'e') || peekIs(0, 'E')) {
            int lookahead = pos + 1;
            if (lookahead < input.length() && (input.charAt(lookahead) == '+' || input.charAt(lookahead) == '-')) {
                lookahead++;
            }
            if (lookahead < input.length() && isDigit(input.charAt(lookahead))) {
                while (pos < lookahead) {
                    advance();
                }
                skipDigits();
            }
        }
        return new Token.Number(span(start), input.substring(begin, pos));
    }

    private void skipDigits() {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
    }

    /**
     * {@code <<DELIM} or {@code <<-DELIM} directly followed by a line terminator. Anything else is
     * recorded as an abandoned heredoc and left to be lexed as {@code <}.
     */
    private Optional<Token> scanHeredocStart(SourceLocation start) {
        int lookahead = pos + 2;
        boolean indented = lookahead < input.length() && input.charAt(lookahead) == '-';
        if (indented) {
            lookahead++;
        }
        int delimiterStart = lookahead;
        if (lookahead >= input.length() || !Identifier.isIdentifierStart(input.codePointAt(lookahead))) {
            var expected = indented
                           ? List.of(Expectations.IDENTIFIER)
                           : List.of(literal("-"), Expectations.IDENTIFIER);
            listener.failed(locationAhead(start, lookahead), Expectations.INVALID_HEREDOC, expected);
            return Optional.empty();
        }
        while (lookahead < input.length() && Identifier.isIdentifierPart(input.codePointAt(lookahead))) {
            lookahead += Character.charCount(input.codePointAt(lookahead));
        }
        int delimiterEnd = lookahead;
        int terminatorLength = lineTerminatorLength(lookahead);
        if (terminatorLength == 0) {
            listener.failed(locationAhead(start, lookahead), Expectations.INVALID_HEREDOC, List.of(Expectations.NEWLINE));
            return Optional.empty();
        }
        var delimiter = input.substring(delimiterStart, delimiterEnd);
        while (pos < delimiterEnd + terminatorLength) {
            advance();
        }
        modes.push(new Heredoc(delimiter));
        return Optional.of(new Token.HeredocStart(span(start), delimiter, indented));
    }

    private Token scanOperator(SourceLocation start) {
        int c = advance();
        return switch (c) {
            case '[' -> punct(start, Token.Symbol.LBRACKET);
            case ']' -> punct(start, Token.Symbol.RBRACKET);
            case '(' -> punct(start, Token.Symbol.LPAREN);
            case ')' -> punct(start, Token.Symbol.RPAREN);
            case ',' -> punct(start, Token.Symbol.COMMA);
            case '.' -> {
                if (peekIs(0, '.') && peekIs(1, '.')) {
                    advance();
                    advance();
                    yield punct(start, Token.Symbol.ELLIPSIS);
                }
                yield punct(start, Token.Symbol.DOT);
            }
            case '=' -> {
                if (match('=')) {
                    yield punct(start, Token.Symbol.EQ);
                }
                if (match('>')) {
                    yield punct(start, Token.Symbol.FAT_ARROW);
                }
                yield punct(start, Token.Symbol.ASSIGN);
            }
            case '!' -> punct(start, match('=') ? Token.Symbol.NOT_EQ : Token.Symbol.BANG);
            case '<' -> punct(start, match('=') ? Token.Symbol.LESS_EQ : Token.Symbol.LESS);
            case '>' -> punct(start, match('=') ? Token.Symbol.GREATER_EQ : Token.Symbol.GREATER);
            case '&' -> match('&') ? punct(start, Token.Symbol.AND) : new Token.Unknown(span(start), "&");
            case '|' -> match('|') ? punct(start, Token.Symbol.OR) : new Token.Unknown(span(start), "|");
            case '+' -> punct(start, Token.Symbol.PLUS);
            case '-' -> punct(start, Token.Symbol.MINUS);
            case '*' -> punct(start, Token.Symbol.STAR);
            case '/' -> punct(start, Token.Symbol.SLASH);
            case '%' -> punct(start, Token.Symbol.PERCENT);
            case '?' -> punct(start, Token.Symbol.QUESTION);
            case ':' -> punct(start, match(':') ? Token.Symbol.DOUBLE_COLON : Token.Symbol.COLON);
            default -> new Token.Unknown(span(start), new String(Character.toChars(c)));
        };
    }

    private Token punct(SourceLocation start, Token.Symbol symbol) {
        return new Token.Punct(span(start), symbol);
    }

    /**
     * Skips blanks and comments. Line terminators are tokens and are left in place.
     */
    private Optional<Token> skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || (c == '\r' && !peekIs(1, '\n'))) {
                advance();
            } else if (c == '#' || (c == '/' && peekIs(1, '/'))) {
                while (!isAtEnd() && peek() != '\n' && !(peek() == '\r' && peekIs(1, '\n'))) {
                    advance();
                }
            } else if (c == '/' && peekIs(1, '*')) {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekIs(1, '/'))) {
                    advance();
                }
                if (isAtEnd()) {
                    return Optional.of(new Token.Invalid(currentSpan(),
                                                         Expectations.INVALID_COMMENT,
                                                         List.of(literal("*/"))));
                }
                advance();
                advance();
            } else {
                break;
            }
        }
        return Optional.empty();
    }

    // === Quoted template mode ===

    private Token nextQuoted() {
        var start = currentLocation();
        if (isAtEnd()) {
            return new Token.Eof(SourceSpan.at(start));
        }
        char c = peek();
        if (c == '"') {
            advance();
            modes.pop();
            return new Token.CloseQuote(span(start));
        }
        if (c == '\n' || (c == '\r' && peekIs(1, '\n'))) {
            var location = currentLocation();
            advance();
            return new Token.Invalid(SourceSpan.at(location), Expectations.INVALID_STRING, List.of(literal("\"")));
        }
        var sequence = scanTemplateSequenceStart(start);
        if (sequence.isPresent()) {
            return sequence.get();
        }
        if (c == '\\') {
            var error = checkEscape();
            if (error.isPresent()) {
                return error.get();
            }
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            c = peek();
            if (c == '"' || c == '\n' || (c == '\r' && peekIs(1, '\n')) || isTemplateSequenceStart()) {
                break;
            }
            if (scanTemplateEscape(sb)) {
                continue;
            }
            if (c == '\\') {
                if (checkEscapeAhead().isPresent()) {
                    break;
                }
                advance();
                sb.appendCodePoint(decodeEscape());
                continue;
            }
            sb.appendCodePoint(advance());
        }
        return new Token.TemplateLiteral(span(start), sb.toString());
    }

    /**
     * Validates the escape sequence at the current backslash without consuming it. On error the
     * backslash and the offending character are consumed and an invalid token is returned.
     */
    private Optional<Token> checkEscape() {
        var problem = checkEscapeAhead();
        if (problem.isEmpty()) {
            return Optional.empty();
        }
        int offending = problem.get();
        boolean badLetter = offending == pos + 1;
        while (pos < offending) {
            advance();
        }
        var location = currentLocation();
        var expected = badLetter
                       ? Expectations.ESCAPE_SEQUENCE
                       : List.of(Expectation.description("hexadecimal digit"));
        if (!isAtEnd() && peek() != '\n' && peek() != '"') {
            advance();
        }
        return Optional.of(new Token.Invalid(SourceSpan.at(location), Expectations.INVALID_ESCAPE_SEQUENCE, expected));
    }

    /**
     * Offset of the offending character if the escape at the current backslash is malformed.
     */
    private Optional<Integer> checkEscapeAhead() {
        int next = pos + 1;
        if (next >= input.length()) {
            return Optional.of(next);
        }
        char c = input.charAt(next);
        switch (c) {
            case 'n', 'r', 't', '"', '\\' -> {
                return Optional.empty();
            }
            case 'u', 'U' -> {
                int digits = c == 'u' ? 4 : 8;
                for (int i = 1; i <= digits; i++) {
                    int at = next + i;
                    if (at >= input.length() || Character.digit(input.charAt(at), 16) < 0) {
                        return Optional.of(at);
                    }
                }
                int value = Integer.parseUnsignedInt(input.substring(next + 1, next + 1 + digits), 16);
                return Character.isValidCodePoint(value) ? Optional.empty() : Optional.of(next + 1);
            }
            default -> {
                return Optional.of(next);
            }
        }
    }

    /**
     * Decodes a validated escape; the backslash is already consumed.
     */
    private int decodeEscape() {
        int c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'u', 'U' -> {
                int digits = c == 'u' ? 4 : 8;
                var hex = input.substring(pos, pos + digits);
                for (int i = 0; i < digits; i++) {
                    advance();
                }
                yield Integer.parseUnsignedInt(hex, 16);
            }
            default -> c;
        };
    }

    // === Heredoc template mode ===

    private Token nextHeredoc(Heredoc mode) {
        var start = currentLocation();
        if (isAtEnd()) {
            return new Token.Eof(SourceSpan.at(start));
        }
        if (mode.lineStart) {
            int lookahead = pos;
            while (lookahead < input.length() && (input.charAt(lookahead) == ' ' || input.charAt(lookahead) == '\t')) {
                lookahead++;
            }
            int markerEnd = lookahead + mode.delimiter.length();
            if (input.startsWith(mode.delimiter, lookahead)
                && (markerEnd == input.length() || lineTerminatorLength(markerEnd) > 0)) {
                while (pos < markerEnd) {
                    advance();
                }
                modes.pop();
                return new Token.HeredocEnd(span(start));
            }
        }
        var sequence = scanTemplateSequenceStart(start);
        if (sequence.isPresent()) {
            mode.lineStart = false;
            return sequence.get();
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        mode.lineStart = false;
        while (!isAtEnd() && !isTemplateSequenceStart()) {
            if (scanTemplateEscape(sb)) {
                continue;
            }
            int c = advance();
            sb.appendCodePoint(c);
            if (c == '\n') {
                mode.lineStart = true;
                break;
            }
        }
        return new Token.TemplateLiteral(span(start), sb.toString());
    }

    // === Shared template scanning ===

    private boolean isTemplateSequenceStart() {
        return (peek() == '$' || peek() == '%') && peekIs(1, '{');
    }

    /**
     * {@code ${}, {@code %{} and their strip variants switch back to normal mode.
     */
    private Optional<Token> scanTemplateSequenceStart(SourceLocation start) {
        if (isAtEnd() || !isTemplateSequenceStart()) {
            return Optional.empty();
        }
        boolean interpolation = advance() == '$';
        advance();
        boolean strip = match('~');
        modes.push(new Normal());
        return Optional.of(interpolation
                           ? new Token.InterpolationStart(span(start), strip)
                           : new Token.DirectiveStart(span(start), strip));
    }

    /**
     * {@code $${} and {@code %%{} stand for literal {@code ${} and {@code %{}.
     */
    private boolean scanTemplateEscape(StringBuilder sb) {
        if ((input.startsWith("$${", pos) || input.startsWith("%%{", pos))) {
            sb.append(peek()).append('{');
            advance();
            advance();
            advance();
            return true;
        }
        return false;
    }

    // === Character access ===

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean peekIs(int offset, char expected) {
        int at = pos + offset;
        return at < input.length() && input.charAt(at) == expected;
    }

    private boolean match(char expected) {
        if (peekIs(0, expected)) {
            advance();
            return true;
        }
        return false;
    }

    private int advance() {
        int c = input.codePointAt(pos);
        pos += Character.charCount(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private int lineTerminatorLength(int at) {
        if (at < input.length() && input.charAt(at) == '\n') {
            return 1;
        }
        if (at + 1 < input.length() && input.charAt(at) == '\r' && input.charAt(at + 1) == '\n') {
            return 2;
        }
        return 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    /**
     * Location of an offset on the current line ahead of {@code start}.
     */
    private SourceLocation locationAhead(SourceLocation start, int offset) {
        int columns = input.codePointCount(start.offset(), offset);
        return SourceLocation.at(start.line(), start.column() + columns, offset);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }
}
