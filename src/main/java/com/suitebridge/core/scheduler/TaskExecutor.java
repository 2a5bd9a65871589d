package com.suitebridge.core.scheduler;

import com.suitebridge.dispatch.host.EventHandler;
import com.suitebridge.dispatch.host.SuiteTask;
import com.suitebridge.dispatch.host.TaskLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on behalf of hosts that do not schedule them themselves.
 * <p>
 * With one thread, tasks run on the calling thread in submission order. With more, they
 * run on a fixed pool of named daemon threads, each task single-threaded. A task that
 * fails (its suite could not be constructed) is logged and collected; its siblings
 * still run.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final int threadCount;
    private ExecutorService pool;

    public TaskExecutor(int threadCount) {
        if (threadCount <= 0) {
            throw new IllegalArgumentException("threadCount must be positive, got " + threadCount);
        }
        this.threadCount = threadCount;
    }

    public int threadCount() {
        return threadCount;
    }

    /**
     * Executes every task and waits for all of them.
     *
     * @return failures thrown by tasks, in submission order
     */
    public List<Throwable> executeAll(List<SuiteTask> tasks, EventHandler handler, TaskLogger... loggers) {
        List<Throwable> failures = new ArrayList<>();
        if (threadCount == 1) {
            for (SuiteTask task : tasks) {
                runOne(task, handler, loggers).ifPresent(failures::add);
            }
            return failures;
        }

        ExecutorService executor = pool();
        var futures = new ArrayList<CompletableFuture<Optional<Throwable>>>();
        for (SuiteTask task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> runOne(task, handler, loggers), executor));
        }
        for (var future : futures) {
            future.join().ifPresent(failures::add);
        }
        return failures;
    }

    private Optional<Throwable> runOne(SuiteTask task, EventHandler handler, TaskLogger[] loggers) {
        try {
            task.execute(handler, loggers);
            return Optional.empty();
        } catch (Throwable t) {
            log.error("Task {} failed: {}", task.request().qualifiedName(), t.toString(), t);
            return Optional.of(t);
        }
    }

    private synchronized ExecutorService pool() {
        if (pool == null) {
            var counter = new AtomicInteger();
            pool = Executors.newFixedThreadPool(threadCount, r -> {
                Thread t = new Thread(r, "suitebridge-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            log.debug("Started worker pool with {} thread(s)", threadCount);
        }
        return pool;
    }

    @Override
    public synchronized void close() {
        if (pool != null) {
            pool.shutdown();
            pool = null;
        }
    }
}
