/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

class WorkerPoolTest {

    private static long inMillis(long millis) {
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    }

    @Test
    void completedFutureQueued() throws Exception {
        try (WorkerPool pool = new WorkerPool(1)) {
            BlockingQueue<Future<String>> completion = new LinkedBlockingQueue<>();

            Future<String> future = pool.submit(() -> "done", inMillis(1000), completion);

            assertThat(completion.poll(5, TimeUnit.SECONDS)).isSameAs(future);
            assertThat(future.get()).isEqualTo("done");
        }
    }

    @Test
    void pendingTasksBounded() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        try (WorkerPool pool = new WorkerPool(1, 1)) {
            BlockingQueue<Future<Boolean>> completion = new LinkedBlockingQueue<>();
            pool.submit(() -> release.await(5, TimeUnit.SECONDS), inMillis(1000), completion);

            assertThatThrownBy(() -> pool.submit(() -> true, inMillis(50), completion))
                    .isInstanceOf(TimeoutException.class);

            release.countDown();
            completion.poll(5, TimeUnit.SECONDS);
            Future<Boolean> next = pool.submit(() -> true, inMillis(1000), completion);
            assertThat(next.get(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void cancelledFutureQueued() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        try (WorkerPool pool = new WorkerPool(1)) {
            BlockingQueue<Future<Object>> completion = new LinkedBlockingQueue<>();
            Future<Object> future = pool.submit(() -> {
                started.countDown();
                Thread.sleep(10_000);
                return null;
            }, inMillis(1000), completion);

            assertThat(started.await(5, TimeUnit.SECONDS)).as("started").isTrue();
            future.cancel(true);

            assertThat(completion.poll(5, TimeUnit.SECONDS)).isSameAs(future);
        }
    }

    @Test
    void closedPoolRejects() {
        WorkerPool pool = new WorkerPool(1);
        pool.close();

        assertThat(pool.isClosed()).isTrue();
        assertThatThrownBy(() -> pool.submit(() -> 1, inMillis(100),
                                          new LinkedBlockingQueue<Future<Integer>>()))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void invalidSizes() {
        assertThatThrownBy(() -> new WorkerPool(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerPool(2, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
