package org.pragmatica.hcl.error;

/**
 * Failure value carried by a failed {@link org.pragmatica.hcl.HclResult}.
 */
public sealed interface HclError permits ParseError, FormatError {

    /**
     * Human readable description of the failure.
     */
    String message();
}
