/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quadrille.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.quadrille.quadtree.concurrent;

import com.hellblazer.quadrille.quadtree.RebalanceResult;
import com.hellblazer.quadrille.quadtree.SearchTree2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link SearchTree2D#rebalance()} off the caller's critical path, for example while a frame renders. At most one
 * pass is in flight at a time and a started pass always runs to completion.
 * <p>
 * The tree is not synchronized, so the owner must call {@link #await()} before issuing the next round of queries or
 * mutations:
 *
 * <pre>
 * rebalancer.await();       // barrier
 * tree.getNearbyValues(q);  // query and mutate
 * rebalancer.start();       // rebalance while doing unrelated work
 * </pre>
 * <p>
 * Thread Safety: start, await and close must all be called from the single thread that owns the tree.
 *
 * @param <V> the value type of the tree
 * @param <R> the search space type of the tree
 * @author hal.hildebrand
 */
public class BackgroundRebalancer<V, R> implements AutoCloseable {
    public static final  String DEFAULT_THREAD_NAME = "search-tree-rebalance";
    private static final Logger log                 = LoggerFactory.getLogger(BackgroundRebalancer.class);
    private static final long   SHUTDOWN_TIMEOUT_MS = 1000;

    private final SearchTree2D<V, R>      tree;
    private final ExecutorService         executor;
    private       Future<RebalanceResult> inFlight;
    private       boolean                 closed;

    public BackgroundRebalancer(SearchTree2D<V, R> tree) {
        this(tree, DEFAULT_THREAD_NAME);
    }

    public BackgroundRebalancer(SearchTree2D<V, R> tree, String threadName) {
        this.tree = Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(threadName, "threadName");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Wait for the in flight pass, if any, then release the background thread
     *
     * @throws RebalanceException if the final pass failed
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            await();
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Rebalance thread did not terminate within {}ms", SHUTDOWN_TIMEOUT_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Barrier: block until the in flight pass completes.
     *
     * @return the result of the pass, or empty if no pass was started since the last wait
     * @throws RebalanceException if the pass failed, or if the caller was interrupted while waiting. An interrupted
     *                            wait leaves the pass in flight, so it may be awaited again.
     */
    public Optional<RebalanceResult> await() {
        var pending = inFlight;
        if (pending == null) {
            return Optional.empty();
        }
        try {
            var result = pending.get();
            inFlight = null;
            return Optional.of(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RebalanceException("Interrupted waiting for rebalance", e);
        } catch (ExecutionException e) {
            inFlight = null;
            log.error("Background rebalance failed", e.getCause());
            throw new RebalanceException("Background rebalance failed", e.getCause());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return true if a pass has been started and has not yet completed
     */
    public boolean isRunning() {
        return inFlight != null && !inFlight.isDone();
    }

    /**
     * Start a rebalance pass on the background thread unless one is still running. A completed pass that was never
     * awaited is collected first, so its failure, if any, is reported here.
     *
     * @return true if a new pass was started
     * @throws IllegalStateException if this rebalancer has been closed
     * @throws RebalanceException    if the previous, unawaited pass failed
     */
    public boolean start() {
        if (closed) {
            throw new IllegalStateException("Rebalancer is closed");
        }
        if (isRunning()) {
            log.trace("Rebalance already in flight");
            return false;
        }
        await();
        inFlight = executor.submit(tree::rebalance);
        return true;
    }
}
