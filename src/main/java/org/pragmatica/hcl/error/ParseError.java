package org.pragmatica.hcl.error;

import org.pragmatica.hcl.tree.SourceLocation;

import java.util.List;

/**
 * Parse error with location and context information.
 *
 * <p>{@link #message()} renders the full pointer-annotated diagnostic; the remaining accessors
 * expose the same facts in structured form for tools that build their own presentation.
 */
public sealed interface ParseError extends HclError {

    SourceLocation location();

    /**
     * The physical source line containing the failure, without its line terminator.
     */
    String sourceLine();

    /**
     * The production that failed, e.g. {@code invalid block body}.
     */
    String category();

    /**
     * What follows the category in the cause clause.
     */
    String detail();

    default List<Expectation> expected() {
        return List.of();
    }

    default List<String> expectedDescriptions() {
        return expected().stream()
                         .map(Expectation::display)
                         .toList();
    }

    default int line() {
        return location().line();
    }

    default int column() {
        return location().column();
    }

    default int offset() {
        return location().offset();
    }

    @Override
    default String message() {
        return Diagnostic.of(this).format();
    }

    /**
     * The input did not match any alternative of the failing production.
     */
    record UnexpectedInput(
    SourceLocation location,
    String sourceLine,
    String category,
    List<Expectation> expected) implements ParseError {
        public UnexpectedInput {
            expected = Expectations.ordered(expected);
        }

        @Override
        public String detail() {
            return "expected " + Expectations.describe(expected);
        }

        @Override
        public String toString() {
            return message();
        }
    }

    /**
     * A configured parser limit was hit, e.g. the maximum nesting depth.
     */
    record LimitExceeded(
    SourceLocation location,
    String sourceLine,
    String category,
    String detail) implements ParseError {
        @Override
        public String toString() {
            return message();
        }
    }
}
