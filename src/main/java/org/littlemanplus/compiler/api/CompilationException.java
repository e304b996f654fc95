package org.littlemanplus.compiler.api;

import org.littlemanplus.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * An exception that is thrown when one or more errors occur during assembly.
 * <p>
 * It carries every diagnostic of the run so callers can inspect the error codes
 * without parsing the message.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception.
     * @param message The detail message, usually the diagnostics summary.
     * @param diagnostics The diagnostics collected during assembly.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The error code of the first reported error, if any.
     */
    public Optional<CompilerErrorCode> firstErrorCode() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::code)
                .findFirst();
    }

    /**
     * @param code An error code.
     * @return {@code true} if any diagnostic carries the code.
     */
    public boolean hasErrorCode(CompilerErrorCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }
}
