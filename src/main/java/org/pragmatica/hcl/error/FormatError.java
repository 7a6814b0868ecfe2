package org.pragmatica.hcl.error;

import java.io.IOException;

/**
 * The output sink rejected formatted text. Rendering a well-formed tree into memory never fails.
 */
public record FormatError(IOException cause) implements HclError {

    @Override
    public String message() {
        return "Failed to write formatted HCL: " + cause.getMessage();
    }

    @Override
    public String toString() {
        return message();
    }
}
