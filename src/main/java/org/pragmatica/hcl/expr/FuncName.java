package org.pragmatica.hcl.expr;

import org.pragmatica.hcl.structure.Identifier;

import java.util.List;
import java.util.Objects;

/**
 * Function name with an optional {@code ::}-separated namespace, e.g. {@code provider::aws::arn_parse}.
 */
public record FuncName(List<Identifier> namespace, Identifier name) {

    public FuncName {
        namespace = List.copyOf(namespace);
        Objects.requireNonNull(name, "name");
    }

    public static FuncName of(String name) {
        return new FuncName(List.of(), Identifier.of(name));
    }

    public boolean isNamespaced() {
        return !namespace.isEmpty();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var part : namespace) {
            sb.append(part.name()).append("::");
        }
        return sb.append(name.name()).toString();
    }
}
