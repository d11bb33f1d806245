/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.FilterException;
import io.github.stanio.svgfx.UncheckedFilterException;
import io.github.stanio.svgfx.cache.CacheKey;
import io.github.stanio.svgfx.cache.CacheManager;
import io.github.stanio.svgfx.chain.DependencyLevels.Edge;
import io.github.stanio.svgfx.chain.DependencyLevels.Node;
import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.emf.EMFDocument;
import io.github.stanio.svgfx.emf.EMFEncoder;
import io.github.stanio.svgfx.emf.EMFEncodingException;
import io.github.stanio.svgfx.emf.RasterRenderer;
import io.github.stanio.svgfx.graph.FilterGraph;
import io.github.stanio.svgfx.graph.FilterGraphException;
import io.github.stanio.svgfx.policy.FallbackPolicyEngine;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.primitive.Filter;
import io.github.stanio.svgfx.primitive.FilterContext;
import io.github.stanio.svgfx.primitive.FilterPrimitiveException;
import io.github.stanio.svgfx.primitive.FilterRegistry;
import io.github.stanio.svgfx.primitive.PrimitiveOutput;
import io.github.stanio.svgfx.primitive.SourceGraphic;

/**
 * Executes a {@code FilterGraph} against a source graphic.
 * <p>
 * The graph is resolved into dependency levels first; unresolved references
 * and cycles fail the chain before any primitive runs.  Each primitive then
 * gets a render strategy from the policy engine and is applied to its
 * resolved inputs.  A failing primitive passes its primary input through
 * and records a diagnostic, unless the chain fails fast.</p>
 * <p>
 * The overall strategy is the least native one among the primitives.  For
 * native and vector strategies the result is the primitives' DrawingML
 * joined in execution order; otherwise the output geometry is encoded as
 * EMF, or rendered as PNG when the metafile can't be produced or the effect
 * needs pixel arithmetic.</p>
 * <p>
 * A chain executes once.</p>
 *
 * @see  io.github.stanio.svgfx.FilterRuntime
 */
public class FilterChain {

    static final Logger log = Logger.getLogger(FilterChain.class.getName());

    public static final long DEFAULT_PRIMITIVE_TIMEOUT_MILLIS = 5_000;

    public static final long DEFAULT_CHAIN_TIMEOUT_MILLIS = 30_000;

    /** How often queued parallel tasks are checked for having started. */
    static final long QUEUED_RECHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final FilterGraph graph;
    private final FilterRegistry registry;
    private final FallbackPolicyEngine policy;
    private final CacheManager<FilterExecutionResult> cache;
    private final WorkerPool workerPool;
    private final ExecutionMode mode;
    private final boolean failFast;
    private final long primitiveTimeoutNanos;
    private final long chainTimeoutNanos;
    private final double emuPerUnit;
    private final EMFEncoder emfEncoder;
    private RasterRenderer rasterRenderer;
    private final DiagnosticsSink diagnostics;

    private final AtomicReference<ChainState> state =
            new AtomicReference<>(ChainState.PENDING);

    private final CancellationToken cancellation = new CancellationToken();

    FilterChain(Builder builder) {
        this.graph = builder.graph;
        this.registry = builder.registry;
        this.policy = builder.policy;
        this.cache = builder.cache;
        this.workerPool = builder.workerPool;
        this.mode = builder.mode;
        this.failFast = builder.failFast;
        this.primitiveTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(builder.primitiveTimeoutMillis);
        this.chainTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(builder.chainTimeoutMillis);
        this.emuPerUnit = builder.emuPerUnit;
        this.emfEncoder = builder.emfEncoder;
        this.rasterRenderer = builder.rasterRenderer;
        this.diagnostics = builder.diagnostics;
    }

    public static Builder builder(FilterGraph graph,
                                  FilterRegistry registry,
                                  FallbackPolicyEngine policy) {
        return new Builder(graph, registry, policy);
    }

    public FilterGraph graph() {
        return graph;
    }

    public ExecutionMode mode() {
        return mode;
    }

    public ChainState state() {
        return state.get();
    }

    /**
     * Requests cancellation.  Running primitives get interrupted and the
     * execution fails with a {@code FilterChainException}.
     */
    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    private DependencyLevels begin() throws FilterGraphException {
        if (!state.compareAndSet(ChainState.PENDING, ChainState.RESOLVING))
            throw new IllegalStateException(graph.id() + ": already executed ("
                                            + state.get() + ")");
        try {
            DependencyLevels levels = DependencyLevels.resolve(graph);
            state.set(ChainState.EXECUTING);
            return levels;
        } catch (FilterGraphException e) {
            state.set(ChainState.FAILED);
            throw e;
        }
    }

    private CacheKey cacheKey(SourceGraphic source) {
        return CacheKey.of(graph, source.fingerprint(),
                           policy.version() + "@" + emuPerUnit);
    }

    /**
     * Executes the chain in its configured mode.
     *
     * @param   source  the filtered element
     * @return  the converted effect
     * @throws  FilterGraphException  if the graph has unresolved references
     *          or cycles
     * @throws  FilterChainException  if a primitive fails and the chain fails
     *          fast, the chain times out, or gets cancelled
     * @throws  FilterException  if the execution fails otherwise
     * @throws  IllegalStateException  if the chain has been executed already
     */
    public FilterExecutionResult execute(SourceGraphic source) throws FilterException {
        Objects.requireNonNull(source, "source");
        DependencyLevels levels = begin();
        boolean completed = false;
        try {
            CacheKey key = cacheKey(source);
            if (cache != null) {
                Optional<FilterExecutionResult> cached = cache.get(key);
                if (cached.isPresent()) {
                    log.fine(() -> graph.id() + ": cache hit " + key);
                    completed = true;
                    return cached.get().asCacheHit();
                }
            }

            Execution execution = new Execution(levels, source, key);
            switch (mode) {
            case PARALLEL:
                execution.runParallel();
                break;

            case LAZY: // level by level on the calling thread
            default:
                execution.runSequential();
            }

            FilterExecutionResult result = execution.assemble();
            if (cache != null && execution.isCacheable()) {
                cache.put(key, result, result.sizeEstimate());
            }
            completed = true;
            return result;
        } finally {
            state.set(completed ? ChainState.COMPLETED : ChainState.FAILED);
        }
    }

    /**
     * Starts executing the chain one dependency level per iteration step, on
     * the consuming thread.  The cache is not consulted.  Failures surface
     * from {@code next()} as {@code UncheckedFilterException}.
     *
     * @param   source  the filtered element
     * @return  iterator over the results of each dependency level
     * @throws  FilterGraphException  if the graph has unresolved references
     *          or cycles
     * @throws  IllegalStateException  if the chain has been executed already
     */
    public Iterator<List<NodeResult>> executeLazily(SourceGraphic source)
            throws FilterGraphException {
        Objects.requireNonNull(source, "source");
        DependencyLevels levels = begin();
        Execution execution = new Execution(levels, source, cacheKey(source));
        return new Iterator<>() {
            @Override public boolean hasNext() {
                return execution.hasNextLevel()
                        && state.get() == ChainState.EXECUTING;
            }

            @Override public List<NodeResult> next() {
                if (!hasNext())
                    throw new NoSuchElementException();

                boolean success = false;
                try {
                    List<NodeResult> results = execution.runNextLevel();
                    success = true;
                    return results;
                } catch (FilterException e) {
                    throw new UncheckedFilterException(e);
                } finally {
                    if (!success) {
                        state.set(ChainState.FAILED);
                    } else if (!execution.hasNextLevel()) {
                        state.set(ChainState.COMPLETED);
                    }
                }
            }
        };
    }

    synchronized RasterRenderer rasterRenderer() {
        if (rasterRenderer == null) {
            rasterRenderer = new RasterRenderer();
        }
        return rasterRenderer;
    }

    @Override
    public String toString() {
        return "FilterChain(" + graph.id() + ", " + mode + ", " + state.get() + ")";
    }


    private final class Execution {

        final DependencyLevels levels;
        final SourceGraphic source;
        final CacheKey key;
        final long deadline;

        final NodeResult[] results;
        final List<NodeResult> executionOrder = new ArrayList<>();
        final List<Diagnostic> diagnosticList =
                Collections.synchronizedList(new ArrayList<>());

        int nextLevel;

        Execution(DependencyLevels levels, SourceGraphic source, CacheKey key) {
            this.levels = levels;
            this.source = source;
            this.key = key;
            this.deadline = System.nanoTime() + chainTimeoutNanos;
            this.results = new NodeResult[levels.nodes().size()];
        }

        boolean hasNextLevel() {
            return nextLevel < levels.depth();
        }

        boolean isCacheable() {
            return executionOrder.stream().noneMatch(NodeResult::isFailed);
        }

        void runSequential() throws FilterException {
            while (hasNextLevel()) {
                runNextLevel();
            }
        }

        List<NodeResult> runNextLevel() throws FilterException {
            List<Node> level = levels.levels().get(nextLevel++);
            List<NodeResult> levelResults = new ArrayList<>(level.size());
            for (Node node : level) {
                checkAborted(node.id());
                NodeResult result = runNode(node, inputs(node), System.nanoTime());
                record(node, result);
                levelResults.add(result);
            }
            checkAborted(graph.id());
            return levelResults;
        }

        void runParallel() throws FilterException {
            if (workerPool == null || workerPool.isClosed()) {
                throw new IllegalStateException("No worker pool available");
            }
            while (hasNextLevel()) {
                List<Node> level = levels.levels().get(nextLevel++);
                runLevelParallel(level);
                checkAborted(graph.id());
                for (Node node : level) {
                    executionOrder.add(results[node.index()]);
                }
            }
        }

        private void runLevelParallel(List<Node> level) throws FilterException {
            BlockingQueue<Future<NodeResult>> completion = new LinkedBlockingQueue<>();
            Map<Future<NodeResult>, NodeTask> pending = new HashMap<>();
            try {
                for (Node node : level) {
                    checkAborted(node.id());
                    NodeTask task = new NodeTask(node, inputs(node));
                    Future<NodeResult> future;
                    try {
                        future = workerPool.submit(task, deadline, completion);
                    } catch (TimeoutException e) {
                        throw new FilterChainException(node.id(), "Timed out waiting for a worker");
                    } catch (RejectedExecutionException e) {
                        throw new FilterChainException(node.id(), e);
                    }
                    pending.put(future, task);
                    cancellation.register(future);
                }

                while (!pending.isEmpty()) {
                    long now = System.nanoTime();
                    long wait = deadline - now;
                    for (NodeTask task : pending.values()) {
                        long started = task.started;
                        if (started != 0) {
                            wait = Math.min(wait, started + primitiveTimeoutNanos - now);
                        } else {
                            // Its timeout runs from when a worker picks it up.
                            wait = Math.min(wait, QUEUED_RECHECK_NANOS);
                        }
                    }

                    Future<NodeResult> future = completion.poll(Math.max(0, wait),
                                                                TimeUnit.NANOSECONDS);
                    if (future == null) {
                        expire(pending);
                        continue;
                    }

                    NodeTask task = pending.remove(future);
                    if (task == null)
                        continue; // timed out before

                    cancellation.unregister(future);
                    results[task.node.index()] = collect(task.node, future);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FilterChainException(graph.id(), "Interrupted");
            } finally {
                for (Future<NodeResult> future : pending.keySet()) {
                    future.cancel(true);
                    cancellation.unregister(future);
                }
            }
        }

        private NodeResult collect(Node node, Future<NodeResult> future)
                throws FilterException, InterruptedException {
            try {
                return future.get();
            } catch (CancellationException e) {
                throw new FilterChainException(node.id(), "Cancelled");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof FilterException)
                    throw (FilterException) cause;
                if (cause instanceof Error)
                    throw (Error) cause;

                throw new FilterChainException(node.id(), cause);
            }
        }

        private void expire(Map<Future<NodeResult>, NodeTask> pending)
                throws FilterException {
            checkAborted(graph.id());

            long now = System.nanoTime();
            Iterator<Map.Entry<Future<NodeResult>, NodeTask>> iter =
                    pending.entrySet().iterator();
            while (iter.hasNext()) {
                Map.Entry<Future<NodeResult>, NodeTask> entry = iter.next();
                NodeTask task = entry.getValue();
                long started = task.started;
                if (started == 0 || now - (started + primitiveTimeoutNanos) < 0)
                    continue;

                iter.remove();
                entry.getKey().cancel(true);
                cancellation.unregister(entry.getKey());
                Node node = task.node;
                log.fine(() -> node.id() + ": timed out");
                results[node.index()] = failed(node, task.inputs,
                        new FilterPrimitiveException(node.id(), "Timed out after "
                                + TimeUnit.NANOSECONDS.toMillis(primitiveTimeoutNanos) + " ms"),
                        started);
            }
        }

        private void checkAborted(String id) throws FilterChainException {
            if (cancellation.isCancelled())
                throw new FilterChainException(id, "Cancelled");

            if (System.nanoTime() - deadline >= 0)
                throw new FilterChainException(id, "Chain timed out after "
                        + TimeUnit.NANOSECONDS.toMillis(chainTimeoutNanos) + " ms");
        }

        private void record(Node node, NodeResult result) {
            results[node.index()] = result;
            executionOrder.add(result);
        }

        List<PrimitiveOutput> inputs(Node node) {
            List<PrimitiveOutput> inputs = new ArrayList<>(node.inputs().size());
            for (Edge edge : node.inputs()) {
                if (!edge.isSource()) {
                    inputs.add(results[edge.node()].output());
                    continue;
                }
                switch (edge.source()) {
                case SOURCE_ALPHA:
                    inputs.add(source.alpha());
                    break;

                case BACKGROUND_IMAGE:
                    // The background is not available to a single element
                    inputs.add(PrimitiveOutput.empty());
                    break;

                default:
                    inputs.add(source.asOutput());
                }
            }
            return inputs;
        }

        NodeResult runNode(Node node, List<PrimitiveOutput> inputs, long started)
                throws FilterChainException {
            long nodeDeadline = started + primitiveTimeoutNanos;
            if (nodeDeadline - deadline > 0) {
                nodeDeadline = deadline;
            }
            try {
                Filter filter = registry.resolve(node.kind());
                double complexity = filter.complexityScore(node.params());
                RenderStrategy strategy = policy.decide(node.kind(), node.params(), complexity);
                FilterContext context = FilterContext.builder(node.id())
                        .strategy(strategy)
                        .emuPerUnit(emuPerUnit)
                        .source(source)
                        .region(node.spec().region())
                        .cancelled(cancellation::isCancelled)
                        .deadline(nodeDeadline)
                        .build();
                PrimitiveOutput output = filter.apply(node.params(), inputs, context);
                log.finer(() -> node.id() + ": " + strategy);
                return NodeResult.success(node, strategy, output, System.nanoTime() - started);
            } catch (FilterException e) {
                return failed(node, inputs, e, started);
            } catch (RuntimeException e) {
                return failed(node, inputs,
                        new FilterPrimitiveException(node.id(), String.valueOf(e), e), started);
            }
        }

        NodeResult failed(Node node, List<PrimitiveOutput> inputs,
                          FilterException cause, long started)
                throws FilterChainException {
            if (failFast)
                throw new FilterChainException(node.id(), cause);

            Diagnostic diagnostic = Diagnostic.warning(node.id(),
                    "Input passed through: " + cause.getMessage(), cause);
            report(diagnostic);
            PrimitiveOutput primary = inputs.isEmpty() ? source.asOutput()
                                                       : inputs.get(0);
            return NodeResult.failure(node, primary, diagnostic,
                                      System.nanoTime() - started);
        }

        private void report(Diagnostic diagnostic) {
            diagnosticList.add(diagnostic);
            diagnostics.report(diagnostic);
        }

        FilterExecutionResult assemble() {
            RenderStrategy overall = RenderStrategy.NATIVE_EFFECT;
            boolean rasterPreferred = false;
            for (NodeResult item : executionOrder) {
                overall = overall.leastNative(item.strategy());
                rasterPreferred |= item.output().isRasterPreferred();
            }

            NodeResult output = results[levels.outputNode().index()];
            Rectangle2D bounds = output.output().bounds();
            List<Diagnostic> diagnosticsCopy;
            synchronized (diagnosticList) {
                diagnosticsCopy = new ArrayList<>(diagnosticList);
            }

            if (overall.compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
                StringBuilder fragment = new StringBuilder();
                for (NodeResult item : executionOrder) {
                    fragment.append(item.output().fragment());
                }
                return FilterExecutionResult.ofFragment(overall, fragment.toString(),
                        bounds, key, executionOrder, diagnosticsCopy);
            }

            List<DrawingCommand> commands = output.output().commands();
            if (rasterPreferred) {
                log.fine(() -> graph.id() + ": pixel arithmetic, rendering bitmap");
                return FilterExecutionResult.ofPNG(rasterRenderer().renderPNG(commands, bounds),
                        bounds, key, executionOrder, diagnosticsCopy);
            }

            try {
                EMFDocument emf = emfEncoder.encode(commands, bounds);
                return FilterExecutionResult.ofEMF(emf, bounds, key,
                                                   executionOrder, diagnosticsCopy);
            } catch (EMFEncodingException e) {
                log.log(Level.WARNING, graph.id() + ": " + e.getMessage()
                        + " (" + e.reason() + "), rendering bitmap");
                Diagnostic diagnostic = Diagnostic.warning(output.primitiveId(),
                        "EMF encoding failed, rendered as bitmap: " + e.getMessage(), e);
                report(diagnostic);
                diagnosticsCopy.add(diagnostic);
                return FilterExecutionResult.ofPNG(rasterRenderer().renderPNG(commands, bounds),
                        bounds, key, executionOrder, diagnosticsCopy);
            }
        }


        final class NodeTask implements Callable<NodeResult> {

            final Node node;
            final List<PrimitiveOutput> inputs;
            volatile long started;

            NodeTask(Node node, List<PrimitiveOutput> inputs) {
                this.node = node;
                this.inputs = inputs;
            }

            @Override
            public NodeResult call() throws FilterChainException {
                long now = System.nanoTime();
                started = (now == 0) ? 1 : now;
                return runNode(node, inputs, now);
            }

        } // class NodeTask


    } // class Execution


    public static final class Builder {

        final FilterGraph graph;
        final FilterRegistry registry;
        final FallbackPolicyEngine policy;
        CacheManager<FilterExecutionResult> cache;
        WorkerPool workerPool;
        ExecutionMode mode = ExecutionMode.SEQUENTIAL;
        boolean failFast;
        long primitiveTimeoutMillis = DEFAULT_PRIMITIVE_TIMEOUT_MILLIS;
        long chainTimeoutMillis = DEFAULT_CHAIN_TIMEOUT_MILLIS;
        double emuPerUnit = FilterContext.DEFAULT_EMU_PER_UNIT;
        EMFEncoder emfEncoder = new EMFEncoder();
        RasterRenderer rasterRenderer;
        DiagnosticsSink diagnostics = DiagnosticsSink.none();

        Builder(FilterGraph graph, FilterRegistry registry, FallbackPolicyEngine policy) {
            this.graph = Objects.requireNonNull(graph, "graph");
            this.registry = Objects.requireNonNull(registry, "registry");
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /**
         * @param   cache  result cache, or {@code null} for none
         */
        public Builder cache(CacheManager<FilterExecutionResult> cache) {
            this.cache = cache;
            return this;
        }

        public Builder workerPool(WorkerPool workerPool) {
            this.workerPool = workerPool;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder primitiveTimeoutMillis(long timeout) {
            if (timeout <= 0)
                throw new IllegalArgumentException("primitiveTimeoutMillis: " + timeout);

            this.primitiveTimeoutMillis = timeout;
            return this;
        }

        public Builder chainTimeoutMillis(long timeout) {
            if (timeout <= 0)
                throw new IllegalArgumentException("chainTimeoutMillis: " + timeout);

            this.chainTimeoutMillis = timeout;
            return this;
        }

        public Builder emuPerUnit(double emuPerUnit) {
            if (!(emuPerUnit > 0))
                throw new IllegalArgumentException("emuPerUnit: " + emuPerUnit);

            this.emuPerUnit = emuPerUnit;
            return this;
        }

        public Builder emfEncoder(EMFEncoder encoder) {
            this.emfEncoder = Objects.requireNonNull(encoder, "encoder");
            return this;
        }

        public Builder rasterRenderer(RasterRenderer renderer) {
            this.rasterRenderer = renderer;
            return this;
        }

        public Builder diagnostics(DiagnosticsSink sink) {
            this.diagnostics = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * @throws  IllegalStateException  if {@code PARALLEL} mode is
         *          requested without a worker pool
         */
        public FilterChain build() {
            if (mode == ExecutionMode.PARALLEL && workerPool == null)
                throw new IllegalStateException("PARALLEL mode needs a worker pool");

            return new FilterChain(this);
        }

    } // class Builder


}
