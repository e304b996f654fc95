package org.littlemanplus.compiler.diagnostics;

import org.littlemanplus.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message that occurs during assembly.
 *
 * @param type The type of the diagnostic.
 * @param code The error code, for programmatic checks.
 * @param message The diagnostic message.
 * @param fileName The name of the program where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents assembly. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s (%s)", type, fileName, lineNumber, message, code);
    }
}
