package org.pragmatica.hcl;

import org.junit.jupiter.api.Test;
import org.pragmatica.hcl.expr.BinaryOperator;
import org.pragmatica.hcl.expr.Expression;
import org.pragmatica.hcl.expr.ObjectItem;
import org.pragmatica.hcl.expr.ObjectKey;
import org.pragmatica.hcl.expr.Strip;
import org.pragmatica.hcl.expr.Template;
import org.pragmatica.hcl.expr.TemplateElement;
import org.pragmatica.hcl.structure.Attribute;
import org.pragmatica.hcl.structure.Block;
import org.pragmatica.hcl.structure.Body;
import org.pragmatica.hcl.structure.Identifier;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoundTripTest {

    private static final String CANONICAL = """
        terraform {
          required_version = ">= 1.0"
        }
        variable "region" {
          default = "eu-west-1"
          type = string
        }
        resource "aws_instance" web {
          ami = data.aws_ami.ubuntu.id
          count = var.enabled ? 2 : 0
          tags = {
            Name = "web-${count.index}"
            "kubernetes.io/role" = "node"
          }
          ports = [80, 443]
          user_data = <<-EOT
        #!/bin/bash
        echo ${var.greeting}
        EOT
          names = [for s in var.list : upper(s) if s != ""]
          lookup = {for k, v in var.map : v => k...}
          splat = aws_instance.web[*].id
          legacy = var.list.0
          math = (1 + 2) * -var.x
          expanded = merge(var.a, var.b...)
          banner = "%{ if var.loud }HELLO%{ else }hello%{ endif }"
          empty {}
        }
        """;

    @Test
    void canonicalText_isReproducedExactly() {
        var body = Hcl.parseBody(CANONICAL).unwrap();

        assertEquals(CANONICAL, Hcl.toString(body));
    }

    @Test
    void formatting_isIdempotent() {
        var messy = "a   =   1 # trailing comment\n\n\nb{\nc=[1,2,]\n  d = {x=1,y=\"two\"}\n}\n";

        var once = Hcl.toString(Hcl.parseBody(messy).unwrap());
        var twice = Hcl.toString(Hcl.parseBody(once).unwrap());

        assertEquals("a = 1\nb {\n  c = [1, 2]\n  d = {\n    x = 1\n    y = \"two\"\n  }\n}\n", once);
        assertEquals(once, twice);
    }

    @Test
    void builtModel_survivesFormatParseFormat() {
        var greeting = Template.of(new TemplateElement.Literal("Hello, "),
                                   new TemplateElement.Interpolation(Expression.variable("name"), Strip.END),
                                   new TemplateElement.Literal(" $ and 100% {sure}"));
        var model = Body.builder()
                        .attribute("greeting", Expression.template(greeting))
                        .attribute("escapes", Expression.string("quote \" slash \\ tab \t ${not} %{this}"))
                        .attribute("sum", new Expression.BinaryOp(Expression.number(1),
                                                                  BinaryOperator.MINUS,
                                                                  Expression.number("2.5")))
                        .block(Block.builder("service")
                                    .label("web")
                                    .attribute("settings", Expression.object(
                                    ObjectItem.of("enabled", Expression.bool(true)),
                                    new ObjectItem(ObjectKey.of(Expression.string("with space")), Expression.NULL),
                                    ObjectItem.of("nested", Expression.tuple(Expression.object(ObjectItem.of("a",
                                                                                                          Expression.number(1)))))))
                                    .attribute("doc", new Expression.HeredocExpr(Identifier.of("EOF"),
                                                                                 false,
                                                                                 Template.literal("line one\n  line two\n")))
                                    .attribute("pairs", new Expression.ForExpr(Optional.of(Identifier.of("k")),
                                                                               Identifier.of("v"),
                                                                               Expression.variable("items"),
                                                                               Optional.of(Expression.variable("k")),
                                                                               Expression.variable("v"),
                                                                               false,
                                                                               Optional.empty()))
                                    .build())
                        .build();

        var text = Hcl.toString(model);
        var reparsed = Hcl.parseBody(text);

        assertTrue(reparsed.isSuccess(), () -> reparsed.error().message());
        assertEquals(text, Hcl.toString(reparsed.unwrap()));
    }

    @Test
    void attribute_roundTripsThroughExpressionParser() {
        var value = Expression.call("func",
                                    Expression.tuple(Expression.number(1), Expression.number(2), Expression.number(3)),
                                    Expression.object(ObjectItem.of("foo", Expression.string("bar")),
                                                      ObjectItem.of("baz", Expression.string("qux"))));
        var text = Hcl.toString(value);

        assertEquals(value, Hcl.parseExpression(text).unwrap());
    }

    @Test
    void literalNamedVariable_isRejected() {
        for (var name : new String[]{"true", "false", "null"}) {
            var identifier = Identifier.of(name);

            assertThrows(IllegalArgumentException.class, () -> new Expression.Variable(identifier), name);
        }
    }

    @Test
    void keywordLiterals_reparseToLiterals() {
        var model = Body.of(Attribute.of("t", Expression.bool(true)),
                            Attribute.of("f", Expression.bool(false)),
                            Attribute.of("n", Expression.NULL),
                            Attribute.of("v", Expression.variable("truthy")));

        assertEquals(model, Hcl.parseBody(Hcl.toString(model)).unwrap());
    }

    @Test
    void simpleBody_reparsesToEqualModel() {
        var model = Body.of(Attribute.of("_foo", "bar"),
                            Block.builder("block")
                                 .label("one")
                                 .attribute("n", Expression.number(42))
                                 .build());

        assertEquals(model, Hcl.parseBody(Hcl.toString(model)).unwrap());
    }
}
