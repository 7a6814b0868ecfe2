package org.pragmatica.hcl.format;

import org.junit.jupiter.api.Test;
import org.pragmatica.hcl.error.FormatError;
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

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FormatterTest {
    private final Formatter formatter = Formatter.create();

    @Test
    void format_attribute_endsWithNewline() {
        var attribute = Attribute.of("_foo", Expression.string("bar"));

        assertEquals("_foo = \"bar\"\n", formatter.format(attribute));
    }

    @Test
    void format_functionCallWithCollections_isSingleLine() {
        var call = Expression.call("func",
                                   Expression.tuple(Expression.number(1), Expression.number(2), Expression.number(3)),
                                   Expression.object(ObjectItem.of("foo", Expression.string("bar")),
                                                     ObjectItem.of("baz", Expression.string("qux"))));

        assertEquals("func([1, 2, 3], { foo = \"bar\", baz = \"qux\" })", formatter.format(call));
    }

    @Test
    void format_stringObjectKey_isQuoted() {
        var object = Expression.object(new ObjectItem(ObjectKey.of(Expression.string("bar")), Expression.call("baz")));

        assertEquals("foo({ \"bar\" = baz() })", formatter.format(Expression.call("foo", object)));
    }

    @Test
    void format_variableObjectKey_isBare() {
        var object = Expression.object(new ObjectItem(ObjectKey.of(Expression.variable("name")), Expression.NULL));

        assertEquals("{ name = null }", formatter.format(object));
    }

    @Test
    void format_literals_useCanonicalSpelling() {
        assertEquals("null", formatter.format(Expression.NULL));
        assertEquals("true", formatter.format(Expression.bool(true)));
        assertEquals("false", formatter.format(Expression.bool(false)));
        assertEquals("42", formatter.format(Expression.number(42)));
        assertEquals("1.5", formatter.format(Expression.number("1.5")));
        assertEquals("-7", formatter.format(Expression.number(-7)));
    }

    @Test
    void format_quotedString_escapesSpecialCharacters() {
        var value = Expression.string("a\"b\\c\nd\re\tf\u0001g");

        assertEquals("\"a\\\"b\\\\c\\nd\\re\\tf\\u0001g\"", formatter.format(value));
    }

    @Test
    void format_quotedString_doublesTemplateOpeners() {
        var value = Expression.string("${x} %{y} $ % {");

        assertEquals("\"$${x} %%{y} $ % {\"", formatter.format(value));
    }

    @Test
    void format_block_indentsBody() {
        var block = Block.builder("resource")
                         .label("aws_instance")
                         .label(BlockLabel.identifier("web"))
                         .attribute("ami", Expression.string("abc"))
                         .block(Block.builder("tags")
                                     .attribute("count", Expression.number(2))
                                     .build())
                         .build();

        assertEquals("""
                     resource "aws_instance" web {
                       ami = "abc"
                       tags {
                         count = 2
                       }
                     }
                     """,
                     formatter.format(block));
    }

    @Test
    void format_emptyBlock_isSingleLine() {
        assertEquals("locals {}\n", formatter.format(Block.of("locals", Body.EMPTY)));
    }

    @Test
    void format_labelWithQuote_isEscaped() {
        var block = Block.builder("b")
                         .label("say \"hi\"")
                         .build();

        assertEquals("b \"say \\\"hi\\\"\" {}\n", formatter.format(block));
    }

    @Test
    void format_body_keepsOrderAndDuplicates() {
        var body = Body.builder()
                       .attribute("a", Expression.number(1))
                       .block(Block.of("x", Body.EMPTY))
                       .attribute("a", Expression.number(2))
                       .build();

        assertEquals("a = 1\nx {}\na = 2\n", formatter.format(body));
    }

    @Test
    void format_objectAttribute_isExpanded() {
        var body = Body.of(Attribute.of("tags", Expression.object(ObjectItem.of("name", Expression.string("web")),
                                                                  ObjectItem.of("env", Expression.object(
                                                                  ObjectItem.of("stage", Expression.string("prod")))))));

        assertEquals("""
                     tags = {
                       name = "web"
                       env = {
                         stage = "prod"
                       }
                     }
                     """,
                     formatter.format(body));
    }

    @Test
    void format_objectInsideTuple_isCompact() {
        var attribute = Attribute.of("items", Expression.tuple(Expression.object(ObjectItem.of("a", Expression.number(1)))));

        assertEquals("items = [{ a = 1 }]\n", formatter.format(attribute));
    }

    @Test
    void format_emptyCollections() {
        assertEquals("x = []\n", formatter.format(Attribute.of("x", Expression.tuple())));
        assertEquals("x = {}\n", formatter.format(Attribute.of("x", Expression.object())));
    }

    @Test
    void format_compactObjects_keepsAttributeObjectsOnOneLine() {
        var compact = Formatter.create(FormatterConfig.DEFAULT.withCompactObjects(true));
        var attribute = Attribute.of("tags", Expression.object(ObjectItem.of("a", Expression.number(1)),
                                                               ObjectItem.of("b", Expression.number(2))));

        assertEquals("tags = { a = 1, b = 2 }\n", compact.format(attribute));
    }

    @Test
    void format_expandedArrays_putOneElementPerLine() {
        var expanded = Formatter.create(FormatterConfig.DEFAULT.withCompactArrays(false));
        var block = Block.builder("b")
                         .attribute("list", Expression.tuple(Expression.number(1), Expression.string("two")))
                         .build();

        assertEquals("""
                     b {
                       list = [
                         1,
                         "two",
                       ]
                     }
                     """,
                     expanded.format(block));
    }

    @Test
    void format_customIndent_isUsedPerLevel() {
        var tabs = Formatter.create(FormatterConfig.DEFAULT.withIndent("\t"));
        var block = Block.builder("outer")
                         .block(Block.builder("inner")
                                     .attribute("x", Expression.bool(true))
                                     .build())
                         .build();

        assertEquals("outer {\n\tinner {\n\t\tx = true\n\t}\n}\n", tabs.format(block));
    }

    @Test
    void config_rejectsNonWhitespaceIndent() {
        assertThrows(IllegalArgumentException.class, () -> new FormatterConfig("--", true, false));
    }

    @Test
    void format_operators_areSpaced() {
        var sum = new Expression.BinaryOp(Expression.variable("a"),
                                          BinaryOperator.PLUS,
                                          new Expression.BinaryOp(Expression.number(2), BinaryOperator.MUL, Expression.number(3)));
        var negated = new Expression.UnaryOp(UnaryOperator.NOT, Expression.variable("ok"));
        var conditional = new Expression.Conditional(negated, Expression.string("no"), Expression.string("yes"));

        assertEquals("a + 2 * 3", formatter.format(sum));
        assertEquals("!ok ? \"no\" : \"yes\"", formatter.format(conditional));
    }

    @Test
    void format_parenthesis_isPreserved() {
        var grouped = new Expression.BinaryOp(new Expression.Parenthesis(new Expression.BinaryOp(Expression.number(1),
                                                                                                 BinaryOperator.PLUS,
                                                                                                 Expression.number(2))),
                                              BinaryOperator.MUL,
                                              Expression.number(3));

        assertEquals("(1 + 2) * 3", formatter.format(grouped));
    }

    @Test
    void format_traversal_rendersEveryOperator() {
        var traversal = new Expression.Traversal(Expression.variable("var"),
                                                 List.of(new TraversalOperator.GetAttr(Identifier.of("list")),
                                                         new TraversalOperator.Index(Expression.number(0)),
                                                         new TraversalOperator.LegacyIndex(1),
                                                         new TraversalOperator.AttrSplat(),
                                                         new TraversalOperator.GetAttr(Identifier.of("id")),
                                                         new TraversalOperator.FullSplat()));

        assertEquals("var.list[0].1.*.id[*]", formatter.format(traversal));
    }

    @Test
    void format_namespacedCallWithExpansion() {
        var call = new Expression.FuncCall(new FuncName(List.of(Identifier.of("provider")), Identifier.of("merge")),
                                           List.of(Expression.variable("a"), Expression.variable("rest")),
                                           true);

        assertEquals("provider::merge(a, rest...)", formatter.format(call));
    }

    @Test
    void format_builtCall_matchesFactoryCall() {
        var built = Expression.FuncCall.builder("concat")
                                       .arg(Expression.variable("a"))
                                       .arg(Expression.variable("b"))
                                       .expandFinal(true)
                                       .build();

        assertEquals("concat(a, b...)", formatter.format(built));
    }

    @Test
    void format_forExpressions() {
        var tuple = new Expression.ForExpr(Optional.empty(),
                                           Identifier.of("s"),
                                           Expression.variable("list"),
                                           Optional.empty(),
                                           Expression.call("upper", Expression.variable("s")),
                                           false,
                                           Optional.of(new Expression.BinaryOp(Expression.variable("s"),
                                                                               BinaryOperator.NOT_EQ,
                                                                               Expression.string(""))));
        var object = new Expression.ForExpr(Optional.of(Identifier.of("k")),
                                            Identifier.of("v"),
                                            Expression.variable("map"),
                                            Optional.of(Expression.variable("v")),
                                            Expression.variable("k"),
                                            true,
                                            Optional.empty());

        assertEquals("[for s in list : upper(s) if s != \"\"]", formatter.format(tuple));
        assertEquals("{for k, v in map : v => k...}", formatter.format(object));
    }

    @Test
    void format_template_rendersInterpolationsAndStripMarkers() {
        var template = Template.of(new TemplateElement.Literal("Hello, "),
                                   TemplateElement.Interpolation.of(Expression.variable("name")),
                                   new TemplateElement.Literal("!\n"),
                                   new TemplateElement.Interpolation(Expression.variable("tail"), Strip.BOTH));

        assertEquals("\"Hello, ${name}!\\n${~tail~}\"", formatter.format(Expression.template(template)));
    }

    @Test
    void format_literalOnlyTemplate_becomesString() {
        assertEquals("\"plain\"", formatter.format(Expression.template(Template.literal("plain"))));
    }

    @Test
    void format_directives_renderTags() {
        var ifDirective = new TemplateElement.IfDirective(Expression.variable("on"),
                                                          Template.literal("yes"),
                                                          Optional.of(Template.literal("no")),
                                                          Strip.NONE,
                                                          Strip.START,
                                                          Strip.BOTH);
        var forDirective = new TemplateElement.ForDirective(Optional.of(Identifier.of("i")),
                                                            Identifier.of("item"),
                                                            Expression.variable("items"),
                                                            Template.of(TemplateElement.Interpolation.of(Expression.variable("item"))),
                                                            Strip.END,
                                                            Strip.NONE);

        assertEquals("\"%{ if on }yes%{~ else }no%{~ endif ~}\"",
                     formatter.format(Expression.template(Template.of(ifDirective))));
        assertEquals("\"%{ for i, item in items ~}${item}%{ endfor }\"",
                     formatter.format(Expression.template(Template.of(forDirective))));
    }

    @Test
    void format_heredoc_writesDelimiterLines() {
        var heredoc = new Expression.HeredocExpr(Identifier.of("EOT"), false, Template.literal("hello\n  world\n"));

        assertEquals("text = <<EOT\nhello\n  world\nEOT\n", formatter.format(Attribute.of("text", heredoc)));
    }

    @Test
    void format_heredocWithoutTrailingNewline_addsOne() {
        var heredoc = new Expression.HeredocExpr(Identifier.of("END"), true, Template.literal("x = ${y}"));

        assertEquals("<<-END\nx = $${y}\nEND\n", formatter.format(heredoc));
    }

    @Test
    void format_heredocOperand_isParenthesized() {
        var heredoc = new Expression.HeredocExpr(Identifier.of("EOT"), false, Template.literal("a\n"));
        var sum = new Expression.BinaryOp(heredoc, BinaryOperator.PLUS, Expression.string("b"));

        assertEquals("(<<EOT\na\nEOT\n) + \"b\"", formatter.format(sum));
        assertEquals("trimspace(<<EOT\na\nEOT\n)", formatter.format(Expression.call("trimspace", heredoc)));
    }

    @Test
    void format_heredocInCompactObject_fallsBackToExpanded() {
        var heredoc = new Expression.HeredocExpr(Identifier.of("EOT"), false, Template.literal("a\n"));
        var tuple = Expression.tuple(Expression.object(ObjectItem.of("doc", heredoc)));

        assertEquals("[{\n  doc = <<EOT\na\nEOT\n}]", formatter.format(tuple));
    }

    @Test
    void format_intoSink_appendsText() {
        var sink = new StringBuilder("# header\n");

        var result = formatter.format(Attribute.of("a", Expression.number(1)), sink);

        assertTrue(result.isSuccess());
        assertSame(sink, result.unwrap());
        assertEquals("# header\na = 1\n", sink.toString());
    }

    @Test
    void format_intoFailingSink_returnsFormatError() {
        var result = formatter.format(Attribute.of("a", Expression.number(1)), new FailingAppendable());

        assertTrue(result.isFailure());
        var error = assertInstanceOf(FormatError.class, result.error());
        assertEquals("Failed to write formatted HCL: disk full", error.message());
    }

    @Test
    void format_isDeterministic() {
        var body = Body.of(Attribute.of("a", Expression.object(ObjectItem.of("b", Expression.tuple(Expression.number(1))))));

        assertEquals(formatter.format(body), formatter.format(body));
    }

    private static final class FailingAppendable implements Appendable {
        @Override
        public Appendable append(CharSequence csq) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public Appendable append(CharSequence csq, int start, int end) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public Appendable append(char c) throws IOException {
            throw new IOException("disk full");
        }
    }
}
