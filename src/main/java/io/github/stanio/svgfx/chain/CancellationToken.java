/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Cancels an execution: in-flight futures registered with the token get
 * interrupted, and primitives observe {@link #isCancelled()} through their
 * context checkpoint.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
    }

    void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    void unregister(Future<?> future) {
        inFlight.remove(future);
    }

}
