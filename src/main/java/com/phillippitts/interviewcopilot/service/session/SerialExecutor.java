package com.phillippitts.interviewcopilot.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered task queue drained on a shared pool.
 *
 * <p>Tasks submitted to one {@code SerialExecutor} run one at a time in submission order,
 * while different instances drain concurrently on the delegate. This gives every session
 * its own ordered queue without a dedicated thread per session.
 *
 * <p>A drain pass runs at most {@link #BATCH_SIZE} tasks before handing the rest back to the
 * delegate, so one busy session cannot monopolise a pool thread.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe. Tasks may submit further tasks to the
 * same executor; those run after the current task, never re-entrantly.
 *
 * @since 1.0
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    static final int BATCH_SIZE = 32;

    private final String name;
    private final Executor delegate;
    private final Map<String, String> logContext;

    private final Lock lock = new ReentrantLock();
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    /**
     * @param name queue name used in logs
     * @param delegate shared pool that runs drain passes
     * @param logContext ThreadContext entries applied while this queue's tasks run
     */
    public SerialExecutor(String name, Executor delegate, Map<String, String> logContext) {
        this.name = Objects.requireNonNull(name, "name");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.logContext = logContext == null ? Map.of() : Map.copyOf(logContext);
    }

    /**
     * Queues a task. Tasks submitted after {@link #close()} are dropped with a debug log.
     */
    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        boolean schedule;
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Queue {} closed; dropping task", name);
                return;
            }
            tasks.add(task);
            schedule = !draining;
            draining = true;
        } finally {
            lock.unlock();
        }
        if (schedule) {
            delegate.execute(this::drain);
        }
    }

    /**
     * Stops accepting tasks and discards those not yet started.
     *
     * @return number of discarded tasks
     */
    public int close() {
        lock.lock();
        try {
            closed = true;
            int dropped = tasks.size();
            tasks.clear();
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Number of tasks waiting to run. */
    public int pending() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    private void drain() {
        Map<String, String> previous = ThreadContext.getImmutableContext();
        ThreadContext.putAll(logContext);
        try {
            for (int i = 0; i < BATCH_SIZE; i++) {
                Runnable next = poll();
                if (next == null) {
                    return;
                }
                runSafely(next);
            }
        } finally {
            ThreadContext.clearAll();
            if (previous != null && !previous.isEmpty()) {
                ThreadContext.putAll(previous);
            }
        }
        // Batch exhausted with work left: yield the pool thread
        if (hasMore()) {
            delegate.execute(this::drain);
        }
    }

    private Runnable poll() {
        lock.lock();
        try {
            Runnable next = tasks.poll();
            if (next == null) {
                draining = false;
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    private boolean hasMore() {
        lock.lock();
        try {
            if (tasks.isEmpty()) {
                draining = false;
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            // One failing task must not stall the queue
            LOG.error("Task failed in queue {}", name, e);
        }
    }
}
