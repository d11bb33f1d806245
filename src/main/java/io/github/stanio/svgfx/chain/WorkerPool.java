/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.io.Closeable;
import java.util.Queue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Fixed-size pool of daemon worker threads shared by chains.  The number of
 * tasks submitted but not yet completed is bounded: {@code submit} waits for
 * a free slot no longer than the given deadline.
 */
public class WorkerPool implements Closeable {

    static final Logger log = Logger.getLogger(WorkerPool.class.getName());

    private final ExecutorService executor;

    private final Semaphore permits;

    private final int size;

    public WorkerPool() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public WorkerPool(int size) {
        this(size, size * 4);
    }

    /**
     * @param   size  number of worker threads
     * @param   maxPending  maximum number of tasks submitted and not yet
     *          completed
     */
    public WorkerPool(int size, int maxPending) {
        if (size < 1)
            throw new IllegalArgumentException("size: " + size);
        if (maxPending < size)
            throw new IllegalArgumentException("maxPending: " + maxPending);

        this.size = size;
        this.executor = Executors.newFixedThreadPool(size, daemonThreadFactory());
        this.permits = new Semaphore(maxPending, true);
        log.fine(() -> "Started " + size + " workers");
    }

    static ThreadFactory daemonThreadFactory() {
        ThreadFactory dtf = Executors.defaultThreadFactory();
        return r -> {
            Thread th = dtf.newThread(r);
            th.setDaemon(true);
            return th;
        };
    }

    public int size() {
        return size;
    }

    /**
     * Submits a task.  Once the task completes, normally, exceptionally, or
     * by cancellation, its future is added to {@code completion}.
     *
     * @param   <T>  task result type
     * @param   task  the task to run
     * @param   deadline  {@code System.nanoTime()} value to wait for a free
     *          slot until
     * @param   completion  queue receiving the completed future
     * @return  the task future
     * @throws  TimeoutException  if no slot became available before the
     *          deadline
     * @throws  InterruptedException  if interrupted while waiting for a slot
     * @throws  RejectedExecutionException  if the pool has been closed
     */
    public <T> Future<T> submit(Callable<T> task,
                                long deadline,
                                Queue<? super Future<T>> completion)
            throws TimeoutException, InterruptedException {
        long wait = deadline - System.nanoTime();
        if (!permits.tryAcquire(Math.max(0, wait), TimeUnit.NANOSECONDS))
            throw new TimeoutException("No worker available");

        FutureTask<T> future = new FutureTask<>(task) {
            @Override protected void done() {
                permits.release();
                completion.add(this);
            }
        };
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            permits.release();
            throw e;
        }
        return future;
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /**
     * Interrupts running tasks and stops the workers.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

}
