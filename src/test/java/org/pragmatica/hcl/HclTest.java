package org.pragmatica.hcl;

import org.junit.jupiter.api.Test;
import org.pragmatica.hcl.error.ParseError;
import org.pragmatica.hcl.expr.Expression;
import org.pragmatica.hcl.expr.ObjectItem;
import org.pragmatica.hcl.parser.ParserConfig;
import org.pragmatica.hcl.structure.Attribute;
import org.pragmatica.hcl.structure.Block;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HclTest {

    @Test
    void parseBody_exposesStructures() {
        var body = Hcl.parseBody("""
            service "web" {
              port = 8080
            }
            enabled = true
            """).unwrap();

        assertThat(body.size()).isEqualTo(2);
        assertThat(body.blocks().map(block -> block.identifier().name())).containsExactly("service");
        assertThat(body.attributes().map(Attribute::value)).containsExactly(Expression.bool(true));
    }

    @Test
    void unwrap_onFailure_throwsWithRenderedMessage() {
        var result = Hcl.parseBody("ident {");

        assertThatThrownBy(result::unwrap)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("invalid block body");
    }

    @Test
    void parseExpression_withConfig_appliesLimit() {
        var result = Hcl.parseExpression("[[[1]]]", new ParserConfig(2));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(ParseError.LimitExceeded.class);
    }

    @Test
    void format_returnsCanonicalText() {
        var result = Hcl.format(Attribute.of("name", "value"));

        assertThat(result.unwrap()).isEqualTo("name = \"value\"\n");
    }

    @Test
    void formatterBuilder_appliesAllSettings() {
        var formatter = Hcl.formatter()
                           .indent("    ")
                           .compactArrays(false)
                           .compactObjects(true)
                           .build();
        var block = Block.builder("b")
                         .attribute("o", Expression.object(ObjectItem.of("k", Expression.number(1))))
                         .attribute("l", Expression.tuple(Expression.number(1)))
                         .build();

        assertThat(formatter.format(block)).isEqualTo("""
            b {
                o = { k = 1 }
                l = [
                    1,
                ]
            }
            """);
    }

    @Test
    void formatIntoSink_returnsSink() {
        var sink = new StringBuilder();

        var result = Hcl.format(Expression.variable("x"), sink);

        assertThat(result.unwrap()).isSameAs(sink);
        assertThat(sink.toString()).isEqualTo("x");
    }
}
