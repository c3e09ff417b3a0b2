package org.unbundle.splitter.diagnostics;

/**
 * A single message reported while splitting a chunk.
 *
 * @param severity The severity of the message.
 * @param scope    The reporting scope, e.g. {@code chunk-12/module-345}.
 * @param message  The formatted message text.
 */
public record Diagnostic(Severity severity, String scope, String message) {

    /**
     * Severity levels. Neither level affects control flow.
     */
    public enum Severity {
        /** Progress information, e.g. which rewrite was applied. */
        INFO,
        /** A shape that was skipped or left unrewritten. */
        WARNING
    }

    @Override
    public String toString() {
        return severity + " [" + scope + "] " + message;
    }
}
