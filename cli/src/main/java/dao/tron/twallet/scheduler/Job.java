package dao.tron.twallet.scheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Asynchronous unit of work submitted to a {@link Worker}.
 *
 * <p>Nothing runs until {@link #start()} is called. The worker calls it exactly once,
 * from whichever lane (or the calling thread) the job was scheduled on, and then waits
 * on the returned future.</p>
 *
 * @param <T> value produced on completion ({@link Void} for side-effect-only jobs)
 */
@FunctionalInterface
public interface Job<T> {

    CompletableFuture<T> start();

    /**
     * Wraps a blocking call so that it runs on {@code executor} once the job is started.
     */
    static <T> Job<T> supplyAsync(Supplier<T> task, Executor executor) {
        return () -> CompletableFuture.supplyAsync(task, executor);
    }

    static Job<Void> runAsync(Runnable task, Executor executor) {
        return () -> CompletableFuture.runAsync(task, executor);
    }
}
