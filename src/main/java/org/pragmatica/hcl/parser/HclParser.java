package org.pragmatica.hcl.parser;

import org.pragmatica.hcl.HclResult;
import org.pragmatica.hcl.expr.BinaryOperator;
import org.pragmatica.hcl.expr.Expression;
import org.pragmatica.hcl.expr.FuncName;
import org.pragmatica.hcl.expr.ObjectItem;
import org.pragmatica.hcl.expr.ObjectKey;
import org.pragmatica.hcl.expr.Strip;
import org.pragmatica.hcl.expr.Template;
import org.pragmatica.hcl.expr.TemplateElement;
import org.pragmatica.hcl.expr.TraversalOperator;
import org.pragmatica.hcl.expr.UnaryOperator;
import org.pragmatica.hcl.structure.Attribute;
import org.pragmatica.hcl.structure.Block;
import org.pragmatica.hcl.structure.BlockLabel;
import org.pragmatica.hcl.structure.Body;
import org.pragmatica.hcl.structure.Identifier;
import org.pragmatica.hcl.structure.Structure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.pragmatica.hcl.error.Expectations.ARRAY_ITEM_CONTINUATION;
import static org.pragmatica.hcl.error.Expectations.ATTRIBUTE_ASSIGNMENT;
import static org.pragmatica.hcl.error.Expectations.BLOCK_BODY;
import static org.pragmatica.hcl.error.Expectations.BLOCK_CONTINUATION;
import static org.pragmatica.hcl.error.Expectations.END_OF_INPUT;
import static org.pragmatica.hcl.error.Expectations.EXPRESSION_START;
import static org.pragmatica.hcl.error.Expectations.FUNCTION_ARGUMENT_CONTINUATION;
import static org.pragmatica.hcl.error.Expectations.IDENTIFIER;
import static org.pragmatica.hcl.error.Expectations.INVALID_ARRAY_ITEM;
import static org.pragmatica.hcl.error.Expectations.INVALID_ATTRIBUTE;
import static org.pragmatica.hcl.error.Expectations.INVALID_BLOCK;
import static org.pragmatica.hcl.error.Expectations.INVALID_BLOCK_BODY;
import static org.pragmatica.hcl.error.Expectations.INVALID_BLOCK_LABEL;
import static org.pragmatica.hcl.error.Expectations.INVALID_CONDITIONAL;
import static org.pragmatica.hcl.error.Expectations.INVALID_EXPRESSION;
import static org.pragmatica.hcl.error.Expectations.INVALID_FOR_EXPRESSION;
import static org.pragmatica.hcl.error.Expectations.INVALID_FUNCTION_CALL;
import static org.pragmatica.hcl.error.Expectations.INVALID_HEREDOC;
import static org.pragmatica.hcl.error.Expectations.INVALID_INDEX;
import static org.pragmatica.hcl.error.Expectations.INVALID_INTERPOLATION;
import static org.pragmatica.hcl.error.Expectations.INVALID_OBJECT_ITEM;
import static org.pragmatica.hcl.error.Expectations.INVALID_PARENTHESIZED_EXPRESSION;
import static org.pragmatica.hcl.error.Expectations.INVALID_SPLAT;
import static org.pragmatica.hcl.error.Expectations.INVALID_STRING;
import static org.pragmatica.hcl.error.Expectations.INVALID_STRUCTURE;
import static org.pragmatica.hcl.error.Expectations.INVALID_TEMPLATE_DIRECTIVE;
import static org.pragmatica.hcl.error.Expectations.INVALID_TRAVERSAL_OPERATOR;
import static org.pragmatica.hcl.error.Expectations.NEWLINE;
import static org.pragmatica.hcl.error.Expectations.OBJECT_ITEM_ASSIGNMENT;
import static org.pragmatica.hcl.error.Expectations.OBJECT_ITEM_CONTINUATION;
import static org.pragmatica.hcl.error.Expectations.STRUCTURE_CONTINUATION;
import static org.pragmatica.hcl.error.Expectations.TRAVERSAL_OPERATOR;
import static org.pragmatica.hcl.error.Expectations.literals;

/**
 * Recursive-descent parser for HCL native syntax.
 *
 * <p>Each production peeks at most two tokens ahead and never backtracks. A production that
 * cannot continue reports its own category and expected alternatives through the
 * {@link ParsingContext}, which keeps whichever failure got furthest into the input.
 */
public final class HclParser {
    private static final Logger log = LoggerFactory.getLogger(HclParser.class);

    // Legacy index chains such as ".0.1" arrive as a single number token
    private static final Pattern LEGACY_INDEX = Pattern.compile("\\d{1,18}(\\.\\d{1,18})?");

    private final ParsingContext ctx;

    private HclParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Parse a configuration file body.
     */
    public static HclResult<Body> parseBody(String input) {
        return parseBody(input, ParserConfig.DEFAULT);
    }

    /**
     * Parse a configuration file body with custom configuration.
     */
    public static HclResult<Body> parseBody(String input, ParserConfig config) {
        log.trace("Parsing body of {} characters", input.length());
        return logFailure(new HclParser(ParsingContext.forBody(input, config)).parseTopLevelBody());
    }

    /**
     * Parse a standalone expression. Newlines are insignificant outside of objects.
     */
    public static HclResult<Expression> parseExpression(String input) {
        return parseExpression(input, ParserConfig.DEFAULT);
    }

    /**
     * Parse a standalone expression with custom configuration.
     */
    public static HclResult<Expression> parseExpression(String input, ParserConfig config) {
        log.trace("Parsing expression of {} characters", input.length());
        return logFailure(new HclParser(ParsingContext.forExpression(input, config)).parseStandaloneExpression());
    }

    private static <T> HclResult<T> logFailure(HclResult<T> result) {
        return result.onFailure(error -> log.debug("Parsing failed:\n{}", error.message()));
    }

    private static <T> HclResult<T> propagate(HclResult<?> failure) {
        return HclResult.failure(failure.error());
    }

    private static <T> HclResult<T> success(T value) {
        return HclResult.success(value);
    }

    // === Structure ===

    private HclResult<Body> parseTopLevelBody() {
        var structures = new ArrayList<Structure>();

        while (true) {
            skipNewlines();
            var token = ctx.peek();
            if (token instanceof Token.Eof) {
                break;
            }
            if (!(token instanceof Token.Ident)) {
                return ctx.fail(INVALID_STRUCTURE, List.of(NEWLINE, IDENTIFIER));
            }
            var structure = parseStructure();
            if (structure.isFailure()) {
                return propagate(structure);
            }
            structures.add(structure.unwrap());

            var next = ctx.peek();
            if (!(next instanceof Token.Newline) && !(next instanceof Token.Eof)) {
                return ctx.fail(INVALID_STRUCTURE, List.of(NEWLINE));
            }
        }
        return success(new Body(structures));
    }

    private HclResult<Structure> parseStructure() {
        var name = (Token.Ident) ctx.advance();
        var identifier = Identifier.of(name.name());
        var next = ctx.peek();

        if (Token.is(next, Token.Symbol.ASSIGN)) {
            ctx.advance();
            return parseExpressionTerm().map(value -> new Attribute(identifier, value));
        }
        if (Token.is(next, Token.Symbol.LBRACE) || next instanceof Token.OpenQuote || next instanceof Token.Ident) {
            return parseBlock(identifier).map(block -> block);
        }
        return ctx.fail(INVALID_STRUCTURE, STRUCTURE_CONTINUATION);
    }

    private HclResult<Block> parseBlock(Identifier identifier) {
        var labels = new ArrayList<BlockLabel>();

        while (true) {
            var token = ctx.peek();
            if (token instanceof Token.Ident ident) {
                ctx.advance();
                labels.add(new BlockLabel.IdentifierLabel(Identifier.of(ident.name())));
            } else if (token instanceof Token.OpenQuote) {
                var label = parseStringLabel();
                if (label.isFailure()) {
                    return propagate(label);
                }
                labels.add(label.unwrap());
            } else {
                break;
            }
        }

        if (!ctx.match(Token.Symbol.LBRACE)) {
            return ctx.fail(INVALID_BLOCK, BLOCK_CONTINUATION);
        }
        return ctx.nested(this::parseBlockBody)
                  .map(body -> new Block(identifier, labels, body));
    }

    private HclResult<BlockLabel> parseStringLabel() {
        ctx.advance();
        var sb = new StringBuilder();
        while (ctx.peek() instanceof Token.TemplateLiteral literal) {
            ctx.advance();
            sb.append(literal.value());
        }
        if (!(ctx.peek() instanceof Token.CloseQuote)) {
            return ctx.fail(INVALID_BLOCK_LABEL, literals("\""));
        }
        ctx.advance();
        return success(new BlockLabel.StringLabel(sb.toString()));
    }

    private HclResult<Body> parseBlockBody() {
        var token = ctx.peek();

        if (Token.is(token, Token.Symbol.RBRACE)) {
            ctx.advance();
            return success(Body.EMPTY);
        }
        if (token instanceof Token.Newline) {
            return parseMultiLineBody();
        }
        if (token instanceof Token.Ident) {
            return parseSingleLineBody();
        }
        return ctx.fail(INVALID_BLOCK_BODY, BLOCK_BODY);
    }

    // ident { key = value }
    private HclResult<Body> parseSingleLineBody() {
        var name = (Token.Ident) ctx.advance();
        if (!ctx.match(Token.Symbol.ASSIGN)) {
            return ctx.fail(INVALID_ATTRIBUTE, ATTRIBUTE_ASSIGNMENT);
        }
        var value = parseExpressionTerm();
        if (value.isFailure()) {
            return propagate(value);
        }
        if (!ctx.match(Token.Symbol.RBRACE)) {
            return ctx.fail(INVALID_BLOCK_BODY, literals("}"));
        }
        return success(Body.of(new Attribute(Identifier.of(name.name()), value.unwrap())));
    }

    private HclResult<Body> parseMultiLineBody() {
        var structures = new ArrayList<Structure>();

        while (true) {
            skipNewlines();
            var token = ctx.peek();
            if (Token.is(token, Token.Symbol.RBRACE)) {
                ctx.advance();
                return success(new Body(structures));
            }
            if (!(token instanceof Token.Ident)) {
                return ctx.fail(INVALID_BLOCK_BODY, BLOCK_BODY);
            }
            var structure = parseStructure();
            if (structure.isFailure()) {
                return propagate(structure);
            }
            structures.add(structure.unwrap());

            if (!(ctx.peek() instanceof Token.Newline)) {
                return ctx.fail(INVALID_BLOCK_BODY, List.of(NEWLINE));
            }
        }
    }

    private void skipNewlines() {
        while (ctx.peek() instanceof Token.Newline) {
            ctx.advance();
        }
    }

    // === Expressions ===

    private HclResult<Expression> parseStandaloneExpression() {
        var expression = parseExpressionTerm();
        if (expression.isFailure()) {
            return expression;
        }
        if (!(ctx.peek() instanceof Token.Eof)) {
            return ctx.fail(INVALID_EXPRESSION, List.of(END_OF_INPUT));
        }
        return expression;
    }

    private HclResult<Expression> parseExpressionTerm() {
        return ctx.nested(this::parseConditional);
    }

    private HclResult<Expression> parseConditional() {
        var condition = parseBinary(BinaryOperator.LOWEST_PRECEDENCE);
        if (condition.isFailure() || !ctx.match(Token.Symbol.QUESTION)) {
            return condition;
        }
        var trueExpr = parseExpressionTerm();
        if (trueExpr.isFailure()) {
            return trueExpr;
        }
        if (!ctx.match(Token.Symbol.COLON)) {
            return ctx.fail(INVALID_CONDITIONAL, literals(":"));
        }
        return parseExpressionTerm()
            .map(falseExpr -> new Expression.Conditional(condition.unwrap(), trueExpr.unwrap(), falseExpr));
    }

    // Precedence climbing; all binary operators are left-associative
    private HclResult<Expression> parseBinary(int minPrecedence) {
        var lhs = parseUnary();
        if (lhs.isFailure()) {
            return lhs;
        }
        var result = lhs.unwrap();

        while (true) {
            var operator = binaryOperator(ctx.peek());
            if (operator.isEmpty() || operator.get().precedence() < minPrecedence) {
                break;
            }
            ctx.advance();
            var rhs = parseBinary(operator.get().precedence() + 1);
            if (rhs.isFailure()) {
                return rhs;
            }
            result = new Expression.BinaryOp(result, operator.get(), rhs.unwrap());
        }
        return success(result);
    }

    private static Optional<BinaryOperator> binaryOperator(Token token) {
        if (token instanceof Token.Punct punct) {
            return BinaryOperator.fromSymbol(punct.symbol().text());
        }
        return Optional.empty();
    }

    private HclResult<Expression> parseUnary() {
        var token = ctx.peek();
        UnaryOperator operator;
        if (Token.is(token, Token.Symbol.MINUS)) {
            operator = UnaryOperator.NEG;
        } else if (Token.is(token, Token.Symbol.BANG)) {
            operator = UnaryOperator.NOT;
        } else {
            return parsePostfix();
        }
        ctx.advance();
        return ctx.nested(this::parseUnary)
                  .map(operand -> applyUnary(operator, operand));
    }

    private static Expression applyUnary(UnaryOperator operator, Expression operand) {
        if (operator == UnaryOperator.NEG
            && operand instanceof Expression.NumberLiteral number
            && number.value().signum() >= 0) {
            return new Expression.NumberLiteral(number.value().negate());
        }
        return new Expression.UnaryOp(operator, operand);
    }

    private HclResult<Expression> parsePostfix() {
        var base = parsePrimary();
        if (base.isFailure()) {
            return base;
        }
        var operators = new ArrayList<TraversalOperator>();

        while (true) {
            HclResult<List<TraversalOperator>> step;
            if (ctx.match(Token.Symbol.DOT)) {
                step = parseAttributeAccess();
            } else if (ctx.match(Token.Symbol.LBRACKET)) {
                step = ctx.withNewlines(true, this::parseIndexAccess);
            } else {
                break;
            }
            if (step.isFailure()) {
                return propagate(step);
            }
            operators.addAll(step.unwrap());
        }

        if (operators.isEmpty()) {
            return base;
        }
        return success(new Expression.Traversal(base.unwrap(), operators));
    }

    // After '.': name, '*' or legacy numeric index
    private HclResult<List<TraversalOperator>> parseAttributeAccess() {
        var token = ctx.peek();

        if (token instanceof Token.Ident ident) {
            ctx.advance();
            return success(List.of(new TraversalOperator.GetAttr(Identifier.of(ident.name()))));
        }
        if (Token.is(token, Token.Symbol.STAR)) {
            ctx.advance();
            return success(List.of(new TraversalOperator.AttrSplat()));
        }
        if (token instanceof Token.Number number && LEGACY_INDEX.matcher(number.text()).matches()) {
            ctx.advance();
            var indices = new ArrayList<TraversalOperator>();
            for (var part : number.text().split("\\.")) {
                indices.add(new TraversalOperator.LegacyIndex(Long.parseLong(part)));
            }
            return success(indices);
        }
        return ctx.fail(INVALID_TRAVERSAL_OPERATOR, TRAVERSAL_OPERATOR);
    }

    // After '[': '*]' or 'expr]'
    private HclResult<List<TraversalOperator>> parseIndexAccess() {
        if (ctx.match(Token.Symbol.STAR)) {
            if (!ctx.match(Token.Symbol.RBRACKET)) {
                return ctx.fail(INVALID_SPLAT, literals("]"));
            }
            return success(List.of(new TraversalOperator.FullSplat()));
        }
        var index = parseExpressionTerm();
        if (index.isFailure()) {
            return propagate(index);
        }
        if (!ctx.match(Token.Symbol.RBRACKET)) {
            return ctx.fail(INVALID_INDEX, literals("]"));
        }
        return success(List.of(new TraversalOperator.Index(index.unwrap())));
    }

    private HclResult<Expression> parsePrimary() {
        var token = ctx.peek();

        if (token instanceof Token.Number number) {
            ctx.advance();
            return success(new Expression.NumberLiteral(new BigDecimal(number.text())));
        }
        if (token instanceof Token.Ident ident) {
            return parseIdentifierTerm(ident);
        }
        if (token instanceof Token.OpenQuote) {
            return parseQuotedTemplate();
        }
        if (token instanceof Token.HeredocStart heredoc) {
            return parseHeredoc(heredoc);
        }
        if (Token.is(token, Token.Symbol.LBRACKET)) {
            return parseTuple();
        }
        if (Token.is(token, Token.Symbol.LBRACE)) {
            return parseObject();
        }
        if (Token.is(token, Token.Symbol.LPAREN)) {
            return parseParenthesis();
        }
        return ctx.fail(INVALID_EXPRESSION, EXPRESSION_START);
    }

    private HclResult<Expression> parseIdentifierTerm(Token.Ident ident) {
        var next = ctx.peek(1);
        if (Token.is(next, Token.Symbol.LPAREN) || Token.is(next, Token.Symbol.DOUBLE_COLON)) {
            return parseFunctionCall();
        }
        ctx.advance();
        Expression value = switch (ident.name()) {
            case "true" -> Expression.bool(true);
            case "false" -> Expression.bool(false);
            case "null" -> Expression.NULL;
            default -> new Expression.Variable(Identifier.of(ident.name()));
        };
        return success(value);
    }

    private HclResult<Expression> parseParenthesis() {
        ctx.advance();
        return ctx.withNewlines(true, () -> {
            var inner = parseExpressionTerm();
            if (inner.isFailure()) {
                return inner;
            }
            if (!ctx.match(Token.Symbol.RPAREN)) {
                return ctx.fail(INVALID_PARENTHESIZED_EXPRESSION, literals(")"));
            }
            return success(new Expression.Parenthesis(inner.unwrap()));
        });
    }

    // === Function calls ===

    private HclResult<Expression> parseFunctionCall() {
        var parts = new ArrayList<Identifier>();
        parts.add(Identifier.of(((Token.Ident) ctx.advance()).name()));

        while (ctx.match(Token.Symbol.DOUBLE_COLON)) {
            if (!(ctx.peek() instanceof Token.Ident part)) {
                return ctx.fail(INVALID_FUNCTION_CALL, List.of(IDENTIFIER));
            }
            ctx.advance();
            parts.add(Identifier.of(part.name()));
        }
        if (!ctx.match(Token.Symbol.LPAREN)) {
            return ctx.fail(INVALID_FUNCTION_CALL, literals("(", "::"));
        }

        var name = new FuncName(parts.subList(0, parts.size() - 1), parts.get(parts.size() - 1));
        return ctx.withNewlines(true, () -> parseArguments(name));
    }

    private HclResult<Expression> parseArguments(FuncName name) {
        var args = new ArrayList<Expression>();
        boolean expandFinal = false;

        while (!ctx.check(Token.Symbol.RPAREN)) {
            var arg = parseExpressionTerm();
            if (arg.isFailure()) {
                return arg;
            }
            args.add(arg.unwrap());

            if (ctx.match(Token.Symbol.ELLIPSIS)) {
                expandFinal = true;
                ctx.match(Token.Symbol.COMMA);
                if (!ctx.check(Token.Symbol.RPAREN)) {
                    return ctx.fail(INVALID_FUNCTION_CALL, literals(")"));
                }
                break;
            }
            if (ctx.match(Token.Symbol.COMMA)) {
                continue;
            }
            if (!ctx.check(Token.Symbol.RPAREN)) {
                return ctx.fail(INVALID_FUNCTION_CALL, FUNCTION_ARGUMENT_CONTINUATION);
            }
        }
        ctx.advance();
        return success(new Expression.FuncCall(name, args, expandFinal));
    }

    // === Collections ===

    private HclResult<Expression> parseTuple() {
        ctx.advance();
        return ctx.withNewlines(true, () -> {
            if (isForExpression()) {
                return parseForExpression(false);
            }
            var elements = new ArrayList<Expression>();
            while (!ctx.check(Token.Symbol.RBRACKET)) {
                var element = parseExpressionTerm();
                if (element.isFailure()) {
                    return element;
                }
                elements.add(element.unwrap());

                if (ctx.match(Token.Symbol.COMMA)) {
                    continue;
                }
                if (!ctx.check(Token.Symbol.RBRACKET)) {
                    return ctx.fail(INVALID_ARRAY_ITEM, ARRAY_ITEM_CONTINUATION);
                }
            }
            ctx.advance();
            return success(new Expression.TupleExpr(elements));
        });
    }

    private HclResult<Expression> parseObject() {
        ctx.advance();
        if (isForExpression()) {
            return ctx.withNewlines(true, () -> parseForExpression(true));
        }
        return ctx.withNewlines(false, this::parseObjectItems);
    }

    // Items are separated by commas or newlines
    private HclResult<Expression> parseObjectItems() {
        var items = new ArrayList<ObjectItem>();

        while (true) {
            skipNewlines();
            if (ctx.match(Token.Symbol.RBRACE)) {
                return success(new Expression.ObjectExpr(items));
            }
            var key = parseObjectKey();
            if (key.isFailure()) {
                return propagate(key);
            }
            if (!ctx.match(Token.Symbol.ASSIGN) && !ctx.match(Token.Symbol.COLON)) {
                return ctx.fail(INVALID_OBJECT_ITEM, OBJECT_ITEM_ASSIGNMENT);
            }
            var value = parseExpressionTerm();
            if (value.isFailure()) {
                return value;
            }
            items.add(new ObjectItem(key.unwrap(), value.unwrap()));

            if (ctx.match(Token.Symbol.COMMA)) {
                continue;
            }
            var next = ctx.peek();
            if (!(next instanceof Token.Newline) && !Token.is(next, Token.Symbol.RBRACE)) {
                return ctx.fail(INVALID_OBJECT_ITEM, OBJECT_ITEM_CONTINUATION);
            }
        }
    }

    private HclResult<ObjectKey> parseObjectKey() {
        if (ctx.peek() instanceof Token.Ident ident) {
            var next = ctx.peek(1);
            if (Token.is(next, Token.Symbol.ASSIGN) || Token.is(next, Token.Symbol.COLON)) {
                ctx.advance();
                return success(new ObjectKey.IdentifierKey(Identifier.of(ident.name())));
            }
        }
        return parseExpressionTerm().map(ObjectKey::of);
    }

    private boolean isForExpression() {
        return Token.isKeyword(ctx.peekIgnoringNewlines(0), "for")
               && ctx.peekIgnoringNewlines(1) instanceof Token.Ident;
    }

    // [for k, v in coll : v if cond] and {for k, v in coll : k => v... if cond}
    private HclResult<Expression> parseForExpression(boolean object) {
        ctx.advance();
        if (!(ctx.peek() instanceof Token.Ident first)) {
            return ctx.fail(INVALID_FOR_EXPRESSION, List.of(IDENTIFIER));
        }
        ctx.advance();

        Optional<Identifier> keyVariable = Optional.empty();
        var valueVariable = Identifier.of(first.name());
        if (ctx.match(Token.Symbol.COMMA)) {
            if (!(ctx.peek() instanceof Token.Ident second)) {
                return ctx.fail(INVALID_FOR_EXPRESSION, List.of(IDENTIFIER));
            }
            ctx.advance();
            keyVariable = Optional.of(valueVariable);
            valueVariable = Identifier.of(second.name());
        }
        if (!Token.isKeyword(ctx.peek(), "in")) {
            return ctx.fail(INVALID_FOR_EXPRESSION, keyVariable.isPresent() ? literals("in") : literals(",", "in"));
        }
        ctx.advance();

        var collection = parseExpressionTerm();
        if (collection.isFailure()) {
            return collection;
        }
        if (!ctx.match(Token.Symbol.COLON)) {
            return ctx.fail(INVALID_FOR_EXPRESSION, literals(":"));
        }

        Optional<Expression> keyExpr = Optional.empty();
        if (object) {
            var key = parseExpressionTerm();
            if (key.isFailure()) {
                return key;
            }
            if (!ctx.match(Token.Symbol.FAT_ARROW)) {
                return ctx.fail(INVALID_FOR_EXPRESSION, literals("=>"));
            }
            keyExpr = Optional.of(key.unwrap());
        }
        var value = parseExpressionTerm();
        if (value.isFailure()) {
            return value;
        }
        boolean grouping = object && ctx.match(Token.Symbol.ELLIPSIS);

        Optional<Expression> condition = Optional.empty();
        if (Token.isKeyword(ctx.peek(), "if")) {
            ctx.advance();
            var filter = parseExpressionTerm();
            if (filter.isFailure()) {
                return filter;
            }
            condition = Optional.of(filter.unwrap());
        }

        var closing = object ? Token.Symbol.RBRACE : Token.Symbol.RBRACKET;
        if (!ctx.match(closing)) {
            return ctx.fail(INVALID_FOR_EXPRESSION,
                            condition.isPresent() ? literals(closing.text()) : literals(closing.text(), "if"));
        }
        return success(new Expression.ForExpr(keyVariable,
                                              valueVariable,
                                              collection.unwrap(),
                                              keyExpr,
                                              value.unwrap(),
                                              grouping,
                                              condition));
    }

    // === Templates ===

    private HclResult<Expression> parseQuotedTemplate() {
        ctx.advance();
        return ctx.withNewlines(true, () -> {
            var elements = parseTemplateElements();
            if (elements.isFailure()) {
                return propagate(elements);
            }
            if (ctx.peek() instanceof Token.DirectiveStart) {
                return strayDirective();
            }
            if (!(ctx.peek() instanceof Token.CloseQuote)) {
                return ctx.fail(INVALID_STRING, literals("\""));
            }
            ctx.advance();
            return success(Expression.template(new Template(elements.unwrap())));
        });
    }

    private HclResult<Expression> parseHeredoc(Token.HeredocStart start) {
        ctx.advance();
        return ctx.withNewlines(true, () -> {
            var elements = parseTemplateElements();
            if (elements.isFailure()) {
                return propagate(elements);
            }
            if (ctx.peek() instanceof Token.DirectiveStart) {
                return strayDirective();
            }
            if (!(ctx.peek() instanceof Token.HeredocEnd)) {
                return ctx.fail(INVALID_HEREDOC, literals(start.delimiter()));
            }
            ctx.advance();
            var content = start.indented()
                          ? HeredocIndent.dedent(elements.unwrap())
                          : elements.unwrap();
            return success(new Expression.HeredocExpr(Identifier.of(start.delimiter()),
                                                      start.indented(),
                                                      new Template(content)));
        });
    }

    // else, endif or endfor without an opening directive
    private <T> HclResult<T> strayDirective() {
        ctx.advance();
        return ctx.fail(INVALID_TEMPLATE_DIRECTIVE, literals("if", "for"));
    }

    /**
     * Literal text, interpolations and complete directives up to the first token that does not
     * continue the template. Adjacent literals are merged.
     */
    private HclResult<List<TemplateElement>> parseTemplateElements() {
        var elements = new ArrayList<TemplateElement>();

        while (true) {
            var token = ctx.peek();
            HclResult<TemplateElement> element;

            if (token instanceof Token.TemplateLiteral literal) {
                ctx.advance();
                appendLiteral(elements, literal.value());
                continue;
            } else if (token instanceof Token.InterpolationStart start) {
                element = parseInterpolation(start);
            } else if (token instanceof Token.DirectiveStart start && Token.isKeyword(ctx.peek(1), "if")) {
                element = ctx.nested(() -> parseIfDirective(start));
            } else if (token instanceof Token.DirectiveStart start && Token.isKeyword(ctx.peek(1), "for")) {
                element = ctx.nested(() -> parseForDirective(start));
            } else {
                return success(elements);
            }

            if (element.isFailure()) {
                return propagate(element);
            }
            elements.add(element.unwrap());
        }
    }

    private static void appendLiteral(List<TemplateElement> elements, String text) {
        if (text.isEmpty()) {
            return;
        }
        int last = elements.size() - 1;
        if (last >= 0 && elements.get(last) instanceof TemplateElement.Literal previous) {
            elements.set(last, new TemplateElement.Literal(previous.text() + text));
        } else {
            elements.add(new TemplateElement.Literal(text));
        }
    }

    private HclResult<TemplateElement> parseInterpolation(Token.InterpolationStart start) {
        ctx.advance();
        var expression = parseExpressionTerm();
        if (expression.isFailure()) {
            return propagate(expression);
        }
        if (!(ctx.peek() instanceof Token.TemplateSeqEnd end)) {
            return ctx.fail(INVALID_INTERPOLATION, literals("}"));
        }
        ctx.advance();
        return success(new TemplateElement.Interpolation(expression.unwrap(), Strip.of(start.strip(), end.strip())));
    }

    private record Tag(String keyword, boolean stripStart) {}

    private HclResult<TemplateElement> parseIfDirective(Token.DirectiveStart start) {
        ctx.advance();
        ctx.advance();
        var condition = parseExpressionTerm();
        if (condition.isFailure()) {
            return propagate(condition);
        }
        var ifEnd = closeTag();
        if (ifEnd.isFailure()) {
            return propagate(ifEnd);
        }
        var trueElements = parseTemplateElements();
        if (trueElements.isFailure()) {
            return propagate(trueElements);
        }

        var next = openTag("else", "endif");
        if (next.isFailure()) {
            return propagate(next);
        }
        var tag = next.unwrap();
        Optional<Template> falseTemplate = Optional.empty();
        var elseStrip = Strip.NONE;

        if (tag.keyword().equals("else")) {
            var elseEnd = closeTag();
            if (elseEnd.isFailure()) {
                return propagate(elseEnd);
            }
            elseStrip = Strip.of(tag.stripStart(), elseEnd.unwrap());
            var falseElements = parseTemplateElements();
            if (falseElements.isFailure()) {
                return propagate(falseElements);
            }
            falseTemplate = Optional.of(new Template(falseElements.unwrap()));

            var endif = openTag("endif");
            if (endif.isFailure()) {
                return propagate(endif);
            }
            tag = endif.unwrap();
        }

        var endifEnd = closeTag();
        if (endifEnd.isFailure()) {
            return propagate(endifEnd);
        }
        return success(new TemplateElement.IfDirective(condition.unwrap(),
                                                       new Template(trueElements.unwrap()),
                                                       falseTemplate,
                                                       Strip.of(start.strip(), ifEnd.unwrap()),
                                                       elseStrip,
                                                       Strip.of(tag.stripStart(), endifEnd.unwrap())));
    }

    private HclResult<TemplateElement> parseForDirective(Token.DirectiveStart start) {
        ctx.advance();
        ctx.advance();
        if (!(ctx.peek() instanceof Token.Ident first)) {
            return ctx.fail(INVALID_TEMPLATE_DIRECTIVE, List.of(IDENTIFIER));
        }
        ctx.advance();

        Optional<Identifier> keyVariable = Optional.empty();
        var valueVariable = Identifier.of(first.name());
        if (ctx.match(Token.Symbol.COMMA)) {
            if (!(ctx.peek() instanceof Token.Ident second)) {
                return ctx.fail(INVALID_TEMPLATE_DIRECTIVE, List.of(IDENTIFIER));
            }
            ctx.advance();
            keyVariable = Optional.of(valueVariable);
            valueVariable = Identifier.of(second.name());
        }
        if (!Token.isKeyword(ctx.peek(), "in")) {
            return ctx.fail(INVALID_TEMPLATE_DIRECTIVE, keyVariable.isPresent() ? literals("in") : literals(",", "in"));
        }
        ctx.advance();

        var collection = parseExpressionTerm();
        if (collection.isFailure()) {
            return propagate(collection);
        }
        var forEnd = closeTag();
        if (forEnd.isFailure()) {
            return propagate(forEnd);
        }
        var body = parseTemplateElements();
        if (body.isFailure()) {
            return propagate(body);
        }
        var endfor = openTag("endfor");
        if (endfor.isFailure()) {
            return propagate(endfor);
        }
        var endforEnd = closeTag();
        if (endforEnd.isFailure()) {
            return propagate(endforEnd);
        }
        return success(new TemplateElement.ForDirective(keyVariable,
                                                        valueVariable,
                                                        collection.unwrap(),
                                                        new Template(body.unwrap()),
                                                        Strip.of(start.strip(), forEnd.unwrap()),
                                                        Strip.of(endfor.unwrap().stripStart(), endforEnd.unwrap())));
    }

    // %{ keyword, consuming both tokens
    private HclResult<Tag> openTag(String... keywords) {
        if (ctx.peek() instanceof Token.DirectiveStart start) {
            var keyword = ctx.peek(1);
            for (var candidate : keywords) {
                if (Token.isKeyword(keyword, candidate)) {
                    ctx.advance();
                    ctx.advance();
                    return success(new Tag(candidate, start.strip()));
                }
            }
        }
        var expected = new String[keywords.length];
        for (int i = 0; i < keywords.length; i++) {
            expected[i] = "%{ " + keywords[i] + " }";
        }
        return ctx.fail(INVALID_TEMPLATE_DIRECTIVE, literals(expected));
    }

    // } or ~} ending a directive tag; the value is the strip flag
    private HclResult<Boolean> closeTag() {
        if (ctx.peek() instanceof Token.TemplateSeqEnd end) {
            ctx.advance();
            return success(end.strip());
        }
        return ctx.fail(INVALID_TEMPLATE_DIRECTIVE, literals("}"));
    }
}
