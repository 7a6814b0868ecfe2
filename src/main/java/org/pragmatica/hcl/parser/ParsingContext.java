package org.pragmatica.hcl.parser;

import org.pragmatica.hcl.HclResult;
import org.pragmatica.hcl.error.Diagnostic;
import org.pragmatica.hcl.error.Expectation;
import org.pragmatica.hcl.error.Expectations;
import org.pragmatica.hcl.error.ParseError;
import org.pragmatica.hcl.tree.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Mutable parsing state for a single parse call: the token cursor, newline handling, nesting
 * depth and the furthest failure seen so far.
 */
final class ParsingContext implements HclLexer.FailureListener {
    private final String input;
    private final ParserConfig config;
    private final HclLexer lexer;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Boolean> newlineModes = new ArrayDeque<>();

    private int index;
    private int depth;

    // Furthest failure
    private SourceLocation furthestLocation;
    private String furthestCategory;
    private final List<Expectation> furthestExpected = new ArrayList<>();

    private ParsingContext(String input, ParserConfig config, boolean ignoreNewlines) {
        this.input = input;
        this.config = config;
        this.lexer = new HclLexer(input, this);
        this.newlineModes.push(ignoreNewlines);
    }

    static ParsingContext forBody(String input, ParserConfig config) {
        return new ParsingContext(input, config, false);
    }

    static ParsingContext forExpression(String input, ParserConfig config) {
        return new ParsingContext(input, config, true);
    }

    // === Token Access ===

    /**
     * Current token. When newlines are ignored, newline tokens are consumed first.
     */
    Token peek() {
        if (newlineModes.peek()) {
            while (tokenAt(index) instanceof Token.Newline) {
                index++;
            }
        }
        return tokenAt(index);
    }

    /**
     * The significant token {@code ahead} positions after the current one.
     */
    Token peek(int ahead) {
        return scan(ahead, newlineModes.peek());
    }

    /**
     * Like {@link #peek(int)} but never stops at newlines.
     */
    Token peekIgnoringNewlines(int ahead) {
        return scan(ahead, true);
    }

    private Token scan(int ahead, boolean skipNewlines) {
        int at = index;
        int remaining = ahead;
        while (true) {
            var token = tokenAt(at);
            if (token instanceof Token.Eof) {
                return token;
            }
            if (skipNewlines && token instanceof Token.Newline) {
                at++;
                continue;
            }
            if (remaining == 0) {
                return token;
            }
            remaining--;
            at++;
        }
    }

    Token advance() {
        var token = peek();
        if (!(token instanceof Token.Eof)) {
            index++;
        }
        return token;
    }

    boolean check(Token.Symbol symbol) {
        return Token.is(peek(), symbol);
    }

    boolean match(Token.Symbol symbol) {
        if (check(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    SourceLocation location() {
        return peek().span().start();
    }

    private Token tokenAt(int at) {
        while (tokens.size() <= at && lexer.hasNext()) {
            tokens.add(lexer.next());
        }
        return at < tokens.size() ? tokens.get(at) : tokens.get(tokens.size() - 1);
    }

    // === Newline Handling ===

    /**
     * Run a production with newlines either ignored or significant, restoring the enclosing mode
     * afterwards.
     */
    <T> HclResult<T> withNewlines(boolean ignore, Supplier<HclResult<T>> production) {
        newlineModes.push(ignore);
        try {
            return production.get();
        } finally {
            newlineModes.pop();
        }
    }

    // === Nesting ===

    <T> HclResult<T> nested(Supplier<HclResult<T>> production) {
        if (depth >= config.maxNestingDepth()) {
            var location = location();
            return HclResult.failure(new ParseError.LimitExceeded(location,
                                                                  Diagnostic.lineAt(input, location.line()),
                                                                  Expectations.NESTING_TOO_DEEP,
                                                                  "maximum depth is " + config.maxNestingDepth()));
        }
        depth++;
        try {
            return production.get();
        } finally {
            depth--;
        }
    }

    // === Error Tracking ===

    @Override
    public void failed(SourceLocation location, String category, List<Expectation> expected) {
        updateFurthest(location, category, expected);
    }

    void updateFurthest(SourceLocation location, String category, List<Expectation> expected) {
        if (furthestLocation == null || location.offset() > furthestLocation.offset()) {
            furthestLocation = location;
            furthestCategory = category;
            furthestExpected.clear();
            furthestExpected.addAll(expected);
        } else if (location.offset() == furthestLocation.offset()) {
            furthestExpected.addAll(expected);
        }
    }

    /**
     * Record a failure at the current token and report the furthest failure seen so far. A token
     * the lexer already diagnosed reports its own category instead.
     */
    <T> HclResult<T> fail(String category, List<Expectation> expected) {
        var token = peek();
        if (token instanceof Token.Invalid invalid) {
            updateFurthest(invalid.span().start(), invalid.category(), invalid.expected());
        } else {
            updateFurthest(token.span().start(), category, expected);
        }
        return HclResult.failure(furthestError());
    }

    ParseError furthestError() {
        return new ParseError.UnexpectedInput(furthestLocation,
                                              Diagnostic.lineAt(input, furthestLocation.line()),
                                              furthestCategory,
                                              furthestExpected);
    }
}
