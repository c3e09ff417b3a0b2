package org.unbundle.splitter.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unbundle.splitter.api.ChunkModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes the files produced for one chunk.
 *
 * <p>Writes are submitted as they become available and joined once in {@link #awaitAll()}.
 * A failed write is logged and does not affect the others. Without a caller supplied executor
 * the writer runs its writes on its own daemon threads, which are released by {@link #awaitAll()}.</p>
 */
public final class ChunkOutputWriter {

    private static final Logger log = LoggerFactory.getLogger(ChunkOutputWriter.class);
    private static final int WRITER_THREADS = 2;

    private final Path directory;
    private final int chunkId;
    private final Executor callerExecutor;
    private ExecutorService ownExecutor;
    private final List<CompletableFuture<Void>> pending = new ArrayList<>();

    /**
     * @param directory Target directory; created on the first write if missing.
     * @param chunkId   The chunk whose files are written.
     * @param executor  Executor running the writes, or null for a private I/O pool.
     */
    public ChunkOutputWriter(Path directory, int chunkId, Executor executor) {
        this.directory = directory;
        this.chunkId = chunkId;
        this.callerExecutor = executor;
    }

    /**
     * The name of the file holding a chunk's formatted module map.
     */
    public static String chunkFileName(int chunkId) {
        return "chunk-" + chunkId + ".js";
    }

    /**
     * The name of the file holding a split module.
     */
    public static String moduleFileName(ChunkModule module) {
        return module.id().value() + ".js";
    }

    /**
     * The comment block written at the top of every module file.
     */
    public static String moduleHeader(int chunkId, ChunkModule module) {
        return "/*\n * Webpack chunk " + chunkId + ", " + module.kindLabel() + " module " + module.id() + "\n */\n\n";
    }

    /**
     * Submits the pretty-printed module map of the chunk.
     */
    public void submitChunk(String formattedModuleMap) {
        submit(chunkFileName(chunkId), formattedModuleMap);
    }

    /**
     * Submits a split module with its header.
     */
    public void submitModule(ChunkModule module) {
        submit(moduleFileName(module), moduleHeader(chunkId, module) + module.sourceText());
    }

    private void submit(String fileName, String content) {
        Path target = directory.resolve(fileName);
        CompletableFuture<Void> write = CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(directory);
                Files.writeString(target, content, StandardCharsets.UTF_8);
                log.debug("Wrote {}", target);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, executor()).exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Failed to write {}: {}", target, cause.getMessage());
            return null;
        });
        pending.add(write);
    }

    /**
     * Blocks until every submitted write has finished.
     *
     * @return The number of writes that were submitted.
     */
    public int awaitAll() {
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
        } finally {
            if (ownExecutor != null) {
                ownExecutor.shutdown();
                ownExecutor = null;
            }
        }
        int count = pending.size();
        pending.clear();
        return count;
    }

    /**
     * Whether writes currently run on the writer's own pool.
     */
    boolean usesOwnExecutor() {
        return ownExecutor != null;
    }

    private Executor executor() {
        if (callerExecutor != null) {
            return callerExecutor;
        }
        if (ownExecutor == null) {
            AtomicInteger threadCount = new AtomicInteger();
            ownExecutor = Executors.newFixedThreadPool(WRITER_THREADS, runnable -> {
                Thread thread = new Thread(runnable, "chunk-" + chunkId + "-writer-" + threadCount.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
        return ownExecutor;
    }
}
