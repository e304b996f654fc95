package org.littlemanplus.compiler.diagnostics;

import org.littlemanplus.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one assembly run so that every phase can report problems
 * and keep going, and all errors of a source are shown together.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param fileName   The program in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(CompilerErrorCode code, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber));
    }

    /**
     * @return {@code true} if at least one error exists.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics as one string, one per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
