package org.unbundle.splitter.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics reported while splitting chunks and forwards each of them to SLF4J.
 *
 * <p>Messages use SLF4J {@code {}} placeholders. Reporting is scoped: a chunk scope is obtained
 * with {@link #forChunk(int)} and narrowed to a module with {@link Scope#forModule(Object)}.
 * The engine is safe to share between chunks that are split concurrently.</p>
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Returns a reporting scope tagged {@code chunk-<chunkId>}.
     */
    public Scope forChunk(int chunkId) {
        return new Scope("chunk-" + chunkId);
    }

    /**
     * Returns a snapshot of all diagnostics reported so far.
     */
    public synchronized List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Returns a snapshot of all warnings reported so far.
     */
    public synchronized List<Diagnostic> warnings() {
        return diagnostics.stream()
                .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                .toList();
    }

    public synchronized boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.WARNING);
    }

    /**
     * One line per warning, for CLI summaries and test assertions.
     */
    public synchronized String summary() {
        return warnings().stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }

    private synchronized void record(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * A tagged reporting scope.
     */
    public final class Scope {

        private final String tag;

        private Scope(String tag) {
            this.tag = tag;
        }

        /**
         * Narrows this scope to a module, tagged {@code module-<moduleId>}.
         */
        public Scope forModule(Object moduleId) {
            return new Scope(tag + "/module-" + moduleId);
        }

        /**
         * Narrows this scope to a fusion module entry, tagged {@code fusion-module-<id>}.
         */
        public Scope forFusionModule(int fusionModuleId) {
            return new Scope(tag + "/fusion-module-" + fusionModuleId);
        }

        public String tag() {
            return tag;
        }

        public void warn(String message, Object... args) {
            String text = MessageFormatter.arrayFormat(message, args).getMessage();
            record(new Diagnostic(Diagnostic.Severity.WARNING, tag, text));
            log.warn("[{}] {}", tag, text);
        }

        public void info(String message, Object... args) {
            String text = MessageFormatter.arrayFormat(message, args).getMessage();
            record(new Diagnostic(Diagnostic.Severity.INFO, tag, text));
            log.info("[{}] {}", tag, text);
        }
    }
}
