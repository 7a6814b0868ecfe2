package org.pragmatica.hcl.structure;

import java.util.Objects;

/**
 * A name guaranteed to match HCL's bare identifier syntax: a letter or {@code _} followed by
 * letters, digits, {@code _} or {@code -}.
 *
 * <p>Constructing an identifier from a string violating that syntax throws immediately;
 * producers check with {@link #isValid(String)} first.
 */
public record Identifier(String name) implements Comparable<Identifier> {

    public Identifier {
        Objects.requireNonNull(name, "name");
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid HCL identifier: '" + name + "'");
        }
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }

    public static boolean isValid(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        int first = name.codePointAt(0);
        if (!isIdentifierStart(first)) {
            return false;
        }
        return name.codePoints()
                   .skip(1)
                   .allMatch(Identifier::isIdentifierPart);
    }

    public static boolean isIdentifierStart(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == '_';
    }

    public static boolean isIdentifierPart(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_' || codePoint == '-';
    }

    @Override
    public int compareTo(Identifier other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
