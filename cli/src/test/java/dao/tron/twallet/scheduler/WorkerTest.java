package dao.tron.twallet.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    @Test
    @DisplayName("Jobs are assigned to lanes round-robin in push order")
    void testRoundRobinAssignment() {
        Worker<Integer> worker = new Worker<>(3);
        List<Job<Integer>> jobs = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            Job<Integer> job = value(i);
            jobs.add(job);
            worker.push(job);
        }

        List<List<Job<Integer>>> lanes = worker.lanes();
        assertEquals(3, lanes.size());
        assertEquals(List.of(jobs.get(0), jobs.get(3), jobs.get(6)), lanes.get(0));
        assertEquals(List.of(jobs.get(1), jobs.get(4)), lanes.get(1));
        assertEquals(List.of(jobs.get(2), jobs.get(5)), lanes.get(2));
        assertEquals(7, worker.size());
    }

    @Test
    @DisplayName("Lane count below one is rejected")
    void testInvalidLaneCount() {
        assertThrows(IllegalArgumentException.class, () -> new Worker<Integer>(0));
        assertThrows(IllegalArgumentException.class, () -> new Worker<Integer>(-2));
    }

    @Test
    @DisplayName("Default lane count is the number of available processors")
    void testDefaultLaneCount() {
        assertEquals(Runtime.getRuntime().availableProcessors(), new Worker<Integer>().laneCount());
    }

    @Test
    @DisplayName("Collected results are concatenated lane by lane")
    void testCollectLaneMajorOrder() {
        Worker<Integer> worker = new Worker<>(3);
        for (int i = 0; i < 7; i++) {
            worker.push(value(i));
        }

        assertEquals(List.of(0, 3, 6, 1, 4, 2, 5), worker.runAndCollectResults());
    }

    @Test
    @DisplayName("Joined collection keeps lane-major order")
    void testJoinedCollectLaneMajorOrder() {
        Worker<Integer> worker = new Worker<>(3);
        for (int i = 0; i < 7; i++) {
            worker.push(delayed(i, 10L * (7 - i)));
        }

        assertEquals(List.of(0, 3, 6, 1, 4, 2, 5), worker.runAllJoinedAndCollectResults());
    }

    @Test
    @DisplayName("run() returns only after every job completed")
    void testRunWaitsForAllJobs() {
        Worker<Void> worker = new Worker<>(2);
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < 6; i++) {
            worker.push(() -> CompletableFuture.runAsync(() -> {
                sleep(20);
                completed.incrementAndGet();
            }));
        }

        worker.run();

        assertEquals(6, completed.get());
    }

    @Test
    @DisplayName("runAllJoined() returns only after every job completed")
    void testRunAllJoinedWaitsForAllJobs() {
        Worker<Void> worker = new Worker<>(2);
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < 6; i++) {
            long delay = 10L * (i + 1);
            worker.push(() -> CompletableFuture.runAsync(() -> {
                sleep(delay);
                completed.incrementAndGet();
            }));
        }

        worker.runAllJoined();

        assertEquals(6, completed.get());
    }

    @Test
    @DisplayName("Sequential lanes start a job only after the previous one in the lane completed")
    void testSequentialLane() {
        Worker<Integer> worker = new Worker<>(1);
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < 3; i++) {
            int n = i;
            worker.push(() -> {
                events.add("start " + n);
                return CompletableFuture.supplyAsync(() -> {
                    sleep(10);
                    events.add("end " + n);
                    return n;
                });
            });
        }

        worker.run();

        assertEquals(List.of("start 0", "end 0", "start 1", "end 1", "start 2", "end 2"), events);
    }

    @Test
    @DisplayName("Joined lanes start all of their jobs before waiting")
    void testJoinedLaneStartsAllJobs() {
        Worker<Boolean> worker = new Worker<>(1);
        CountDownLatch secondStarted = new CountDownLatch(1);
        worker.push(() -> CompletableFuture.supplyAsync(() -> await(secondStarted)));
        worker.push(() -> {
            secondStarted.countDown();
            return CompletableFuture.completedFuture(true);
        });

        assertEquals(List.of(true, true), worker.runAllJoinedAndCollectResults());
    }

    @Test
    @DisplayName("Lanes run on their own threads")
    void testLaneThreads() {
        Worker<String> worker = new Worker<>(2);
        for (int i = 0; i < 4; i++) {
            worker.push(() -> CompletableFuture.completedFuture(Thread.currentThread().getName()));
        }

        List<String> threads = worker.runAndCollectResults();

        assertEquals(4, threads.size());
        String caller = Thread.currentThread().getName();
        threads.forEach(name -> {
            assertNotEquals(caller, name);
            assertTrue(name.startsWith("worker-lane-"), name);
        });
    }

    @Test
    @DisplayName("Single-threaded run starts chunks round-robin from the calling thread")
    void testSingleThreadedChunks() {
        Worker<Integer> worker = new Worker<>(4);
        List<Integer> startOrder = Collections.synchronizedList(new ArrayList<>());
        List<String> startThreads = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        for (int i = 0; i < 5; i++) {
            int n = i;
            worker.push(() -> {
                startOrder.add(n);
                startThreads.add(Thread.currentThread().getName());
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    sleep(20);
                    inFlight.decrementAndGet();
                    return n;
                });
            });
        }

        worker.runSingleThreaded(2);

        assertEquals(List.of(0, 3, 1, 4, 2), startOrder);
        assertTrue(maxInFlight.get() <= 2, "in flight: " + maxInFlight.get());
        String caller = Thread.currentThread().getName();
        startThreads.forEach(name -> assertEquals(caller, name));
    }

    @Test
    @DisplayName("Single-threaded run without batch size uses one chunk when jobs fit the lanes")
    void testSingleThreadedDefaultBatch() {
        Worker<Integer> worker = new Worker<>(4);
        CountDownLatch allStarted = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            worker.push(() -> {
                allStarted.countDown();
                return CompletableFuture.supplyAsync(() -> await(allStarted) ? 1 : 0);
            });
        }

        assertDoesNotThrow(() -> worker.runSingleThreaded());
        assertEquals(0, allStarted.getCount());
    }

    @Test
    @DisplayName("Chunking spreads jobs round-robin over ceil(n / batchSize) chunks")
    void testChunk() {
        assertEquals(List.of(List.of(0, 3), List.of(1, 4), List.of(2)),
                Worker.chunk(List.of(0, 1, 2, 3, 4), 2));
        assertEquals(List.of(List.of(0, 1, 2)), Worker.chunk(List.of(0, 1, 2), 3));
        assertEquals(List.of(List.of(0, 2, 4), List.of(1, 3)), Worker.chunk(List.of(0, 1, 2, 3, 4), 3));
    }

    @Test
    @DisplayName("Batch size below one is rejected")
    void testInvalidBatchSize() {
        Worker<Integer> worker = new Worker<>(2);
        worker.push(value(1));

        assertThrows(IllegalArgumentException.class, () -> worker.runSingleThreaded(0));
    }

    @Test
    @DisplayName("Empty worker completes immediately in every mode")
    void testEmptyWorker() {
        assertEquals(List.of(), new Worker<Integer>(3).runAndCollectResults());
        assertEquals(List.of(), new Worker<Integer>(3).runAllJoinedAndCollectResults());
        assertDoesNotThrow(() -> new Worker<Integer>(3).run());
        assertDoesNotThrow(() -> new Worker<Integer>(3).runAllJoined());
        assertDoesNotThrow(() -> new Worker<Integer>(3).runSingleThreaded(2));
    }

    @Test
    @DisplayName("A worker can be run only once")
    void testSingleUse() {
        Worker<Integer> worker = new Worker<>(2);
        worker.push(value(1));
        worker.run();

        assertThrows(IllegalStateException.class, worker::run);
        assertThrows(IllegalStateException.class, worker::runAllJoinedAndCollectResults);
        assertThrows(IllegalStateException.class, () -> worker.runSingleThreaded(1));
        assertThrows(IllegalStateException.class, () -> worker.push(value(2)));
    }

    @Test
    @DisplayName("A failing job aborts its lane while other lanes finish")
    void testFailureAbortsLane() {
        Worker<Integer> worker = new Worker<>(2);
        List<Integer> started = Collections.synchronizedList(new ArrayList<>());
        for (int i = 0; i < 5; i++) {
            int n = i;
            worker.push(() -> {
                started.add(n);
                if (n == 1) {
                    return CompletableFuture.failedFuture(new IllegalStateException("boom"));
                }
                return CompletableFuture.completedFuture(n);
            });
        }

        IllegalStateException e = assertThrows(IllegalStateException.class, worker::runAndCollectResults);

        assertEquals("boom", e.getMessage());
        assertTrue(started.containsAll(List.of(0, 2, 4)));
        assertFalse(started.contains(3));
    }

    @Test
    @DisplayName("The lowest failing lane is rethrown, other failures are suppressed")
    void testFailureFromSeveralLanes() {
        Worker<Integer> worker = new Worker<>(2);
        worker.push(() -> CompletableFuture.failedFuture(new IllegalArgumentException("lane 0")));
        worker.push(() -> CompletableFuture.failedFuture(new IllegalStateException("lane 1")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, worker::runAllJoined);

        assertEquals("lane 0", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("lane 1", e.getSuppressed()[0].getMessage());
    }

    @Test
    @DisplayName("Checked failures are wrapped in CompletionException")
    void testCheckedFailure() {
        Worker<Integer> worker = new Worker<>(1);
        worker.push(() -> CompletableFuture.failedFuture(new IOException("io")));

        CompletionException e = assertThrows(CompletionException.class, worker::run);

        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("A job throwing from start() counts as a failed job")
    void testStartThrows() {
        Worker<Integer> worker = new Worker<>(1);
        worker.push(() -> {
            throw new IllegalStateException("no start");
        });

        assertThrows(IllegalStateException.class, worker::runAllJoined);
    }

    @Test
    @DisplayName("A failing chunk is awaited in full and later chunks are skipped")
    void testSingleThreadedFailure() {
        Worker<Integer> worker = new Worker<>(2);
        List<Integer> started = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger completed = new AtomicInteger();
        for (int i = 0; i < 4; i++) {
            int n = i;
            worker.push(() -> {
                started.add(n);
                if (n == 0) {
                    return CompletableFuture.failedFuture(new IllegalStateException("chunk 0"));
                }
                return CompletableFuture.supplyAsync(() -> {
                    sleep(20);
                    completed.incrementAndGet();
                    return n;
                });
            });
        }

        // chunks {0, 2} and {1, 3}
        assertThrows(IllegalStateException.class, () -> worker.runSingleThreaded(2));

        assertEquals(List.of(0, 2), started);
        assertEquals(1, completed.get());
    }

    private static Job<Integer> value(int n) {
        return () -> CompletableFuture.completedFuture(n);
    }

    private static Job<Integer> delayed(int n, long millis) {
        return () -> CompletableFuture.supplyAsync(() -> {
            sleep(millis);
            return n;
        });
    }

    private static boolean await(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
