package org.bindforge.diagnostics;

/**
 * A single diagnostic message raised while loading or analyzing a library.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param subject The function or type the message is about.
 */
public record Diagnostic(
        Type type,
        String message,
        String subject
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that makes the output for the subject unusable. */
        ERROR,
        /** Output was produced but needs manual review. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, subject, message);
    }
}
