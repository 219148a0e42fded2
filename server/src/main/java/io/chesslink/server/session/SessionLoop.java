// file: server/src/main/java/io/chesslink/server/session/SessionLoop.java
package io.chesslink.server.session;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The host's single logical session thread.
 * <p>
 * Responsibilities:
 *  - Run every coordinator call and auto-save tick on one thread.
 *  - Give gateway completions somewhere to resume ({@link #executor()}).
 *  - Let other threads (console, gRPC) hand work in via {@link #call} / {@link #compose}.
 */
public final class SessionLoop implements AutoCloseable {

    private final ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-loop");
        t.setDaemon(true);
        return t;
    });

    public ScheduledExecutorService executor() {
        return exec;
    }

    /** Run {@code task} on the session thread. */
    public <T> CompletableFuture<T> call(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, exec);
    }

    /** Run an async {@code task} on the session thread and flatten its result. */
    public <T> CompletableFuture<T> compose(Supplier<CompletableFuture<T>> task) {
        return CompletableFuture.supplyAsync(task, exec).thenCompose(Function.identity());
    }

    @Override
    public void close() {
        exec.shutdownNow();
        try {
            exec.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
