package com.williamcallahan.book_graph.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Serial executor that gives one request a single-threaded timeline on top of a shared pool.
 * Tasks run one at a time in submission order.
 *
 * <p>Whenever the queue runs dry the idle hook fires; {@link RequestLoaders} uses it to dispatch
 * every key queued on its data loaders, so all loads issued before the request goes idle share
 * one bulk fetch per edge. Batch results are completed through this executor too, which makes
 * their continuations part of the next window.</p>
 */
public final class RequestScheduler implements Executor {

    private static final Logger log = LoggerFactory.getLogger(RequestScheduler.class);

    private final Executor delegate;
    private final String name;
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private volatile Runnable idleHook = () -> { };
    private boolean draining;

    public RequestScheduler(Executor delegate, String name) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.name = name;
    }

    /**
     * Registers the action run each time the queue empties. It may submit further tasks.
     */
    public void whenIdle(Runnable hook) {
        this.idleHook = Objects.requireNonNull(hook, "hook");
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (this) {
            tasks.addLast(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            delegate.execute(this::drain);
        } catch (RuntimeException ex) {
            synchronized (this) {
                tasks.remove(task);
                draining = false;
            }
            throw ex;
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = tasks.pollFirst();
            }
            if (next == null) {
                runSafely(idleHook);
                synchronized (this) {
                    if (tasks.isEmpty()) {
                        draining = false;
                        return;
                    }
                }
                continue;
            }
            runSafely(next);
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            // keep draining; later tasks of the request still run
            log.error("Task on request scheduler {} failed: {}", name, ex.getMessage(), ex);
        }
    }

    public synchronized int pendingTasks() {
        return tasks.size();
    }
}
