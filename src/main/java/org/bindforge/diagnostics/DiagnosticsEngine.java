package org.bindforge.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics raised while loading and analyzing a library.
 * <p>
 * This decouples reporting from the analysis passes, which never fail on
 * partially specified input. Not thread-safe; concurrent passes report through
 * the thread that owns the engine.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, String subject) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, subject));
    }

    public void reportWarning(String message, String subject) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, subject));
    }

    public void reportInfo(String message, String subject) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, subject));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
