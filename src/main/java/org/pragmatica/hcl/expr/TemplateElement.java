package org.pragmatica.hcl.expr;

import org.pragmatica.hcl.structure.Identifier;

import java.util.Objects;
import java.util.Optional;

/**
 * Template building blocks: literal text, {@code ${...}} interpolations and {@code %{...}} directives.
 */
public sealed interface TemplateElement {

    record Literal(String text) implements TemplateElement {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    record Interpolation(Expression expression, Strip strip) implements TemplateElement {
        public Interpolation {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(strip, "strip");
        }

        public static Interpolation of(Expression expression) {
            return new Interpolation(expression, Strip.NONE);
        }
    }

    /**
     * {@code %{ if cond }...%{ else }...%{ endif }}; each tag keeps its own strip markers.
     */
    record IfDirective(
    Expression condition,
    Template trueTemplate,
    Optional<Template> falseTemplate,
    Strip ifStrip,
    Strip elseStrip,
    Strip endifStrip) implements TemplateElement {
        public IfDirective {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(trueTemplate, "trueTemplate");
            Objects.requireNonNull(falseTemplate, "falseTemplate");
            Objects.requireNonNull(ifStrip, "ifStrip");
            Objects.requireNonNull(elseStrip, "elseStrip");
            Objects.requireNonNull(endifStrip, "endifStrip");
        }
    }

    /**
     * {@code %{ for key, value in collection }...%{ endfor }}
     */
    record ForDirective(
    Optional<Identifier> keyVariable,
    Identifier valueVariable,
    Expression collection,
    Template template,
    Strip forStrip,
    Strip endforStrip) implements TemplateElement {
        public ForDirective {
            Objects.requireNonNull(keyVariable, "keyVariable");
            Objects.requireNonNull(valueVariable, "valueVariable");
            Objects.requireNonNull(collection, "collection");
            Objects.requireNonNull(template, "template");
            Objects.requireNonNull(forStrip, "forStrip");
            Objects.requireNonNull(endforStrip, "endforStrip");
        }
    }
}
