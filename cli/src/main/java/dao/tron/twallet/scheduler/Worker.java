package dao.tron.twallet.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Fans a list of independent {@link Job}s out over a fixed number of lanes.
 *
 * <p>Jobs are assigned round-robin at push time: the job pushed as the i-th one (0-based)
 * lands in lane {@code i % laneCount}, and a lane keeps its jobs in push order. A worker is
 * filled by a single thread and then consumed by exactly one of the run methods:</p>
 * <ul>
 *   <li>{@link #run()} / {@link #runAndCollectResults()}: one thread per lane, each lane
 *       awaits its jobs one after another.</li>
 *   <li>{@link #runAllJoined()} / {@link #runAllJoinedAndCollectResults()}: one thread per
 *       lane, each lane starts all of its jobs at once and waits for all of them.</li>
 *   <li>{@link #runSingleThreaded(int)}: no extra threads; jobs are regrouped into chunks
 *       that run one after another, the jobs of a chunk concurrently. Bounds the number of
 *       in-flight jobs, e.g. open RPC connections.</li>
 * </ul>
 *
 * <p>Collected results are concatenated lane by lane (all of lane 0, then lane 1, ...).
 * With more than one lane this is not the push order: 7 jobs on 3 lanes come back as
 * {@code [0, 3, 6, 1, 4, 2, 5]}. Callers that need push order must carry an index in
 * their result type.</p>
 *
 * <p>Failure handling: a job whose future completes exceptionally (or whose {@code start()}
 * throws) aborts the rest of its lane. Other lanes are not interrupted. Once every lane has
 * finished, the run method rethrows the failure of the lowest failing lane; failures of
 * other lanes are attached as suppressed exceptions. Unchecked exceptions are rethrown as
 * they are, checked ones wrapped in a {@link CompletionException}.</p>
 *
 * <p>Not thread-safe: push from one thread, then run once.</p>
 *
 * @param <T> job output type
 */
@Slf4j
public final class Worker<T> {

    private static final String LANE_THREAD_PREFIX = "worker-lane-";

    private final int laneCount;
    private final List<List<Job<T>>> lanes;
    private int pushed;
    private boolean consumed;

    /**
     * Worker with one lane per available processor.
     */
    public Worker() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param laneCount number of lanes, at least 1
     * @throws IllegalArgumentException if {@code laneCount < 1}
     */
    public Worker(int laneCount) {
        if (laneCount < 1) {
            throw new IllegalArgumentException(
                    "laneCount must be positive (current: " + laneCount + ")");
        }
        this.laneCount = laneCount;
        this.lanes = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            lanes.add(new ArrayList<>());
        }
    }

    public void push(Job<T> job) {
        Objects.requireNonNull(job, "job cannot be null");
        ensureIdle();
        lanes.get(pushed % laneCount).add(job);
        pushed++;
    }

    public int laneCount() {
        return laneCount;
    }

    /**
     * @return number of jobs pushed so far
     */
    public int size() {
        return pushed;
    }

    /**
     * @return read-only snapshot of the lanes, indexed by lane
     */
    public List<List<Job<T>>> lanes() {
        List<List<Job<T>>> copy = new ArrayList<>(laneCount);
        for (List<Job<T>> lane : lanes) {
            copy.add(List.copyOf(lane));
        }
        return Collections.unmodifiableList(copy);
    }

    public void run() {
        consume();
        runLanes("sequential", Worker::awaitSequentially);
    }

    public List<T> runAndCollectResults() {
        consume();
        return concat(runLanes("sequential", Worker::awaitSequentially));
    }

    public void runAllJoined() {
        consume();
        runLanes("joined", Worker::awaitJoined);
    }

    public List<T> runAllJoinedAndCollectResults() {
        consume();
        return concat(runLanes("joined", Worker::awaitJoined));
    }

    /**
     * {@link #runSingleThreaded(int)} with the lane count as batch size.
     */
    public void runSingleThreaded() {
        runSingleThreaded(laneCount);
    }

    /**
     * Starts every job from the calling thread, never more than {@code batchSize} in flight.
     *
     * <p>Jobs are taken in push order. If there are no more than {@code batchSize} of them they
     * all start together. Otherwise they are spread round-robin over
     * {@code ceil(total / batchSize)} chunks (job i goes to chunk {@code i % chunks}), and the
     * chunks run one after another. A failing chunk is awaited in full; the following chunks
     * are then skipped and the failure is rethrown.</p>
     *
     * @param batchSize upper bound of a chunk, at least 1
     */
    public void runSingleThreaded(int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException(
                    "batchSize must be positive (current: " + batchSize + ")");
        }
        consume();
        if (pushed == 0) {
            return;
        }

        List<List<Job<T>>> chunks = chunk(flatten(), batchSize);
        log.debug("Running {} job(s) single-threaded in {} chunk(s) (batchSize={})",
                pushed, chunks.size(), batchSize);

        for (int i = 0; i < chunks.size(); i++) {
            try {
                awaitJoined(chunks.get(i));
            } catch (CompletionException | CancellationException e) {
                Throwable cause = unwrap(e);
                log.error("Chunk {} of {} failed, skipping the rest: {}", i, chunks.size(), cause.toString());
                throw propagate(cause);
            }
        }
    }

    /**
     * Round-robin regrouping used by {@link #runSingleThreaded(int)}.
     */
    static <J> List<List<J>> chunk(List<J> flat, int batchSize) {
        if (flat.size() <= batchSize) {
            return List.of(flat);
        }
        int chunksCount = (flat.size() + batchSize - 1) / batchSize;
        List<List<J>> chunks = new ArrayList<>(chunksCount);
        for (int i = 0; i < chunksCount; i++) {
            chunks.add(new ArrayList<>());
        }
        for (int i = 0; i < flat.size(); i++) {
            chunks.get(i % chunksCount).add(flat.get(i));
        }
        return chunks;
    }

    private List<List<T>> runLanes(String mode, Function<List<Job<T>>, List<T>> laneBody) {
        if (pushed == 0) {
            return List.of();
        }

        // round-robin fills lanes from index 0, so only the first min(pushed, laneCount) are non-empty
        int activeLanes = Math.min(pushed, laneCount);
        log.debug("Running {} job(s) on {} lane(s) ({})", pushed, activeLanes, mode);

        ExecutorService pool = Executors.newFixedThreadPool(
                activeLanes, new CustomizableThreadFactory(LANE_THREAD_PREFIX));
        try {
            List<Future<List<T>>> futures = new ArrayList<>(activeLanes);
            for (int i = 0; i < activeLanes; i++) {
                List<Job<T>> lane = lanes.get(i);
                futures.add(pool.submit(() -> laneBody.apply(lane)));
            }

            List<List<T>> results = new ArrayList<>(activeLanes);
            Throwable failure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = unwrap(e);
                    log.error("Lane {} aborted: {}", i, cause.toString());
                    if (failure == null) {
                        failure = cause;
                    } else if (failure != cause) {
                        failure.addSuppressed(cause);
                    }
                }
            }
            if (failure != null) {
                throw propagate(failure);
            }
            return results;
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for " + activeLanes + " lane(s)", e);
        } finally {
            pool.shutdown();
        }
    }

    private List<Job<T>> flatten() {
        List<Job<T>> flat = new ArrayList<>(pushed);
        for (int i = 0; i < pushed; i++) {
            flat.add(lanes.get(i % laneCount).get(i / laneCount));
        }
        return flat;
    }

    private static <T> List<T> awaitSequentially(List<Job<T>> jobs) {
        List<T> results = new ArrayList<>(jobs.size());
        for (Job<T> job : jobs) {
            results.add(launch(job).join());
        }
        return results;
    }

    private static <T> List<T> awaitJoined(List<Job<T>> jobs) {
        List<CompletableFuture<T>> launched = new ArrayList<>(jobs.size());
        for (Job<T> job : jobs) {
            launched.add(launch(job));
        }
        CompletableFuture.allOf(launched.toArray(new CompletableFuture<?>[0])).join();

        List<T> results = new ArrayList<>(launched.size());
        for (CompletableFuture<T> f : launched) {
            results.add(f.join());
        }
        return results;
    }

    private static <T> CompletableFuture<T> launch(Job<T> job) {
        try {
            CompletableFuture<T> future = job.start();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("job returned no future"));
            }
            return future;
        } catch (RuntimeException | Error e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> List<T> concat(List<List<T>> perLane) {
        List<T> all = new ArrayList<>();
        for (List<T> lane : perLane) {
            all.addAll(lane);
        }
        return all;
    }

    private void ensureIdle() {
        if (consumed) {
            throw new IllegalStateException("Worker has already been run");
        }
    }

    private void consume() {
        ensureIdle();
        consumed = true;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException re) {
            return re;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new CompletionException(failure);
    }
}
