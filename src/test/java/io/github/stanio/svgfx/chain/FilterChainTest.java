/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.chain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.stanio.svgfx.UncheckedFilterException;
import io.github.stanio.svgfx.cache.CacheManager;
import io.github.stanio.svgfx.emf.Brush;
import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.emf.EMFEncoder;
import io.github.stanio.svgfx.graph.CyclicFilterGraphException;
import io.github.stanio.svgfx.graph.FilterGraph;
import io.github.stanio.svgfx.graph.FilterPrimitiveSpec;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.FallbackPolicyEngine;
import io.github.stanio.svgfx.policy.NativeEffectTable;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.primitive.Filter;
import io.github.stanio.svgfx.primitive.FilterContext;
import io.github.stanio.svgfx.primitive.FilterPrimitiveException;
import io.github.stanio.svgfx.primitive.FilterRegistry;
import io.github.stanio.svgfx.primitive.OffsetFilter;
import io.github.stanio.svgfx.primitive.PrimitiveOutput;
import io.github.stanio.svgfx.primitive.SourceGraphic;

class FilterChainTest {

    private static final double[] SOBEL = { 1, 2, 1, 0, 0, 0, -1, -2, -1 };

    private FilterRegistry registry;

    private FallbackPolicyEngine policy;

    private WorkerPool workerPool;

    @BeforeEach
    void setUp() {
        registry = FilterRegistry.withDefaults();
        policy = new FallbackPolicyEngine(NativeEffectTable.loadDefault(),
                                          registry::vectorApproximation);
    }

    @AfterEach
    void tearDown() {
        if (workerPool != null) {
            workerPool.close();
        }
    }

    static SourceGraphic square() {
        return SourceGraphic.of(List.of(DrawingCommand
                .polygon(new double[] { 10, 10, 60, 10, 60, 60, 10, 60 },
                         Brush.solid(0x3366CC))));
    }

    private FilterChain.Builder chain(FilterGraph graph) {
        return FilterChain.builder(graph, registry, policy);
    }

    static FilterGraph blur(double stdDeviation) {
        return FilterGraph.of(FilterPrimitiveSpec
                .builder("blur", PrimitiveKind.GAUSSIAN_BLUR)
                .param("stdDeviation", stdDeviation)
                .build());
    }

    static FilterGraph convolve(int order, double... kernel) {
        return FilterGraph.of(FilterPrimitiveSpec
                .builder("convolve", PrimitiveKind.CONVOLVE_MATRIX)
                .param("order", order)
                .param("kernelMatrix", kernel)
                .build());
    }

    static double[] arbitraryKernel5x5() {
        return IntStream.rangeClosed(1, 25)
                        .mapToDouble(i -> (i * 7) % 11 - 3)
                        .toArray();
    }

    @Test
    void smallBlurIsNative() throws Exception {
        FilterChain chain = chain(blur(2)).build();

        FilterExecutionResult result = chain.execute(square());

        assertThat(result.strategy()).isEqualTo(RenderStrategy.NATIVE_EFFECT);
        assertThat(result.fragment()).hasValue("<a:blur rad=\"19050\"/>");
        assertThat(result.diagnostics()).isEmpty();
        assertThat(chain.state()).isEqualTo(ChainState.COMPLETED);
    }

    @Test
    void sobelKernelIsVectorApproximated() throws Exception {
        FilterExecutionResult result = chain(convolve(3, SOBEL)).build().execute(square());

        assertThat(result.strategy()).isEqualTo(RenderStrategy.VECTOR_APPROX);
        assertThat(result.fragment()).get().asString()
                .startsWith("<a:ln w=\"12700\"")
                .contains("<a:prstDash val=\"dash\"/>");
    }

    @Test
    void arbitraryKernelFallsBackToMetafile() throws Exception {
        FilterGraph graph = convolve(5, arbitraryKernel5x5());

        FilterExecutionResult first = chain(graph).build().execute(square());
        FilterExecutionResult second = chain(graph).build().execute(square());

        assertThat(first.strategy()).isEqualTo(RenderStrategy.EMF_FALLBACK);
        assertThat(first.emf()).isPresent();
        assertThat(first.fragment()).isEmpty();
        assertThat(second.payload())
                .as("re-encoded metafile")
                .isEqualTo(first.payload());
    }

    @Test
    void metafileIndependentOfExecutionMode() throws Exception {
        workerPool = new WorkerPool(2);
        FilterGraph graph = FilterGraph.builder("filter")
                .add(FilterPrimitiveSpec.builder("left", PrimitiveKind.OFFSET)
                        .param("dx", -5).result("l"))
                .add(FilterPrimitiveSpec.builder("right", PrimitiveKind.OFFSET)
                        .param("dx", 5).result("r"))
                .add(FilterPrimitiveSpec.builder("merge", PrimitiveKind.MERGE)
                        .in("l").in("r").result("m"))
                .add(FilterPrimitiveSpec.builder("convolve", PrimitiveKind.CONVOLVE_MATRIX)
                        .in("m").param("order", 5).param("kernelMatrix", arbitraryKernel5x5()))
                .build();

        FilterExecutionResult sequential = chain(graph)
                .build().execute(square());
        FilterExecutionResult parallel = chain(graph)
                .mode(ExecutionMode.PARALLEL).workerPool(workerPool)
                .build().execute(square());
        FilterExecutionResult lazy = chain(graph)
                .mode(ExecutionMode.LAZY)
                .build().execute(square());

        assertThat(sequential.strategy()).isEqualTo(RenderStrategy.EMF_FALLBACK);
        assertThat(parallel.payload()).as("parallel").isEqualTo(sequential.payload());
        assertThat(lazy.payload()).as("lazy").isEqualTo(sequential.payload());
    }

    @Test
    void independentOffsetsRunConcurrently() throws Exception {
        RendezvousFilter offset = new RendezvousFilter(2);
        registry.register(offset);
        workerPool = new WorkerPool(2);

        FilterGraph graph = FilterGraph.of(
                FilterPrimitiveSpec.builder("left", PrimitiveKind.OFFSET)
                        .in("SourceGraphic").param("dx", -5).result("l").build(),
                FilterPrimitiveSpec.builder("right", PrimitiveKind.OFFSET)
                        .in("SourceGraphic").param("dx", 5).result("r").build(),
                FilterPrimitiveSpec.builder("merge", PrimitiveKind.MERGE)
                        .in("l").in("r").build());
        FilterChain chain = chain(graph)
                .mode(ExecutionMode.PARALLEL)
                .workerPool(workerPool)
                .build();

        FilterExecutionResult result = chain.execute(square());

        assertThat(result.diagnostics()).as("diagnostics").isEmpty();
        assertThat(offset.threads).as("worker threads").hasSize(2);
        assertThat(result.nodeResults())
                .extracting(NodeResult::primitiveId, NodeResult::level)
                .containsExactly(tuple("left", 0),
                                 tuple("right", 0),
                                 tuple("merge", 1));
        NodeResult merge = result.nodeResults().get(2);
        assertThat(merge.output().commands()).as("merged commands").hasSize(2);
        assertThat(merge.output().bounds().getWidth()).isEqualTo(60);
    }

    @Test
    void failingPrimitivePassesInputThrough() throws Exception {
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, FailingFilter::new);
        List<Diagnostic> reported = Collections.synchronizedList(new ArrayList<>());

        FilterGraph graph = FilterGraph.of(
                FilterPrimitiveSpec.builder("broken", PrimitiveKind.GAUSSIAN_BLUR)
                        .param("stdDeviation", 2).build(),
                FilterPrimitiveSpec.builder("shift", PrimitiveKind.OFFSET)
                        .param("dx", 4).build());
        SourceGraphic source = square();

        FilterChain chain = chain(graph).diagnostics(reported::add).build();
        FilterExecutionResult result = chain.execute(source);

        assertThat(chain.state()).isEqualTo(ChainState.COMPLETED);
        NodeResult broken = result.nodeResults().get(0);
        assertThat(broken.isFailed()).as("failed").isTrue();
        assertThat(broken.output().commands()).isEqualTo(source.commands());
        assertThat(broken.output().hasFragment()).as("hasFragment").isFalse();
        assertThat(result.diagnostics()).hasSize(1)
                .first()
                .extracting(Diagnostic::primitiveId)
                .isEqualTo("broken");
        assertThat(reported).hasSize(1);
        assertThat(result.nodeResults().get(1).isFailed()).isFalse();
    }

    @Test
    void failFastAbortsOnFirstFailure() {
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, FailingFilter::new);
        FilterChain chain = chain(blur(2)).failFast(true).build();

        assertThatThrownBy(() -> chain.execute(square()))
                .isInstanceOf(FilterChainException.class)
                .hasCauseInstanceOf(FilterPrimitiveException.class)
                .extracting(e -> ((FilterChainException) e).primitiveId())
                .isEqualTo("blur");
        assertThat(chain.state()).isEqualTo(ChainState.FAILED);
    }

    @Test
    void lazyFailureUnchecked() throws Exception {
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, FailingFilter::new);
        FilterChain chain = chain(blur(2)).mode(ExecutionMode.LAZY).failFast(true).build();

        Iterator<List<NodeResult>> levels = chain.executeLazily(square());

        assertThatThrownBy(levels::next)
                .isInstanceOf(UncheckedFilterException.class)
                .hasCauseInstanceOf(FilterChainException.class);
        assertThat(chain.state()).isEqualTo(ChainState.FAILED);
        assertThat(levels.hasNext()).as("hasNext").isFalse();
    }

    @Test
    void slowPrimitiveTimesOut() throws Exception {
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, SlowFilter::new);
        workerPool = new WorkerPool(2);
        FilterChain chain = chain(blur(2))
                .mode(ExecutionMode.PARALLEL)
                .workerPool(workerPool)
                .primitiveTimeoutMillis(100)
                .build();

        FilterExecutionResult result = chain.execute(square());

        assertThat(result.nodeResults().get(0).isFailed()).as("failed").isTrue();
        assertThat(result.diagnostics()).singleElement()
                .extracting(Diagnostic::message).asString()
                .contains("Timed out");
    }

    @Test
    void queuedPrimitiveGetsOwnTimeout() throws Exception {
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, SlowFilter::new);
        workerPool = new WorkerPool(1);
        FilterGraph graph = FilterGraph.builder("filter")
                .add(FilterPrimitiveSpec.builder("blur1", PrimitiveKind.GAUSSIAN_BLUR)
                        .param("stdDeviation", 2).result("b1"))
                .add(FilterPrimitiveSpec.builder("blur2", PrimitiveKind.GAUSSIAN_BLUR)
                        .param("stdDeviation", 2).result("b2"))
                .add(FilterPrimitiveSpec.builder("merge", PrimitiveKind.MERGE)
                        .in("b1").in("b2"))
                .build();
        FilterChain chain = chain(graph)
                .mode(ExecutionMode.PARALLEL)
                .workerPool(workerPool)
                .primitiveTimeoutMillis(200)
                .chainTimeoutMillis(3_000)
                .build();

        long start = System.nanoTime();
        FilterExecutionResult result = chain.execute(square());
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(chain.state()).isEqualTo(ChainState.COMPLETED);
        assertThat(result.diagnostics())
                .extracting(Diagnostic::primitiveId, d -> d.message().contains("Timed out"))
                .containsExactlyInAnyOrder(tuple("blur1", true), tuple("blur2", true));
        assertThat(elapsedMillis).as("elapsed millis").isLessThan(2_000);
    }

    @Test
    void cycleRejectedBeforeExecution() {
        AtomicInteger applied = new AtomicInteger();
        registry.register(PrimitiveKind.GAUSSIAN_BLUR, () -> new CountingFilter(applied));
        FilterGraph graph = FilterGraph.of(
                FilterPrimitiveSpec.builder("a", PrimitiveKind.GAUSSIAN_BLUR)
                        .in("y").result("x").build(),
                FilterPrimitiveSpec.builder("b", PrimitiveKind.GAUSSIAN_BLUR)
                        .in("x").result("y").build());
        FilterChain chain = chain(graph).failFast(true).build();

        assertThatThrownBy(() -> chain.execute(square()))
                .isInstanceOf(CyclicFilterGraphException.class);
        assertThat(chain.state()).isEqualTo(ChainState.FAILED);
        assertThat(applied).as("primitives applied").hasValue(0);
    }

    @Test
    void executesOnce() throws Exception {
        FilterChain chain = chain(blur(1)).build();
        chain.execute(square());

        assertThatThrownBy(() -> chain.execute(square()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelledChainFails() {
        FilterChain chain = chain(blur(1)).build();
        chain.cancel();

        assertThatThrownBy(() -> chain.execute(square()))
                .isInstanceOf(FilterChainException.class)
                .hasMessageContaining("Cancelled");
    }

    @Test
    void lazyExecutionYieldsLevels() throws Exception {
        FilterGraph graph = FilterGraph.of(
                FilterPrimitiveSpec.builder("flood", PrimitiveKind.FLOOD)
                        .param("flood-color", "red").result("fill").build(),
                FilterPrimitiveSpec.builder("shift", PrimitiveKind.OFFSET)
                        .in("SourceAlpha").param("dx", 2).result("shadow").build(),
                FilterPrimitiveSpec.builder("merge", PrimitiveKind.MERGE)
                        .in("fill").in("shadow").in("SourceGraphic").build());
        FilterChain chain = chain(graph).mode(ExecutionMode.LAZY).build();

        Iterator<List<NodeResult>> levels = chain.executeLazily(square());
        List<Integer> sizes = new ArrayList<>();
        while (levels.hasNext()) {
            sizes.add(levels.next().size());
            if (levels.hasNext()) {
                assertThat(chain.state()).isEqualTo(ChainState.EXECUTING);
            }
        }

        assertThat(sizes).containsExactly(2, 1);
        assertThat(chain.state()).isEqualTo(ChainState.COMPLETED);
    }

    @Test
    void sourceAlphaIsBlack() throws Exception {
        FilterGraph graph = FilterGraph.of(FilterPrimitiveSpec
                .builder("shadow", PrimitiveKind.OFFSET)
                .in("SourceAlpha").param("dx", 3).param("dy", 3).build());

        FilterExecutionResult result = chain(graph).build().execute(square());

        assertThat(result.nodeResults().get(0).output().commands())
                .extracting(DrawingCommand::color)
                .containsOnly(0x000000);
        assertThat(result.fragment()).get().asString().startsWith("<a:outerShdw");
    }

    @Test
    void cacheHitShortCircuits() throws Exception {
        try (CacheManager<FilterExecutionResult> cache = CacheManager
                .<FilterExecutionResult>builder()
                .checksum(FilterExecutionResult::checksum)
                .build()) {
            FilterExecutionResult first = chain(blur(2)).cache(cache).build().execute(square());
            FilterExecutionResult second = chain(blur(2)).cache(cache).build().execute(square());

            assertThat(first.isCacheHit()).as("first").isFalse();
            assertThat(second.isCacheHit()).as("second").isTrue();
            assertThat(second.payload()).isEqualTo(first.payload());
            assertThat(second.cacheKey()).isEqualTo(first.cacheKey());
            assertThat(cache.stats().hits).isEqualTo(1);
        }
    }

    @Test
    void cacheKeyIgnoresAttributeOrder() throws Exception {
        FilterGraph dxFirst = FilterGraph.of(FilterPrimitiveSpec
                .builder("shift", PrimitiveKind.OFFSET)
                .param("dx", 2).param("dy", 3).build());
        FilterGraph dyFirst = FilterGraph.of(FilterPrimitiveSpec
                .builder("shift", PrimitiveKind.OFFSET)
                .param("dy", 3).param("dx", 2).build());
        try (CacheManager<FilterExecutionResult> cache = CacheManager
                .<FilterExecutionResult>builder().build()) {
            chain(dxFirst).cache(cache).build().execute(square());
            FilterExecutionResult result = chain(dyFirst).cache(cache).build().execute(square());

            assertThat(result.isCacheHit()).as("cache hit").isTrue();
        }
    }

    @Test
    void differentSourceMissesCache() throws Exception {
        SourceGraphic other = SourceGraphic.of(List.of(DrawingCommand
                .polygon(new double[] { 0, 0, 5, 0, 5, 5 }, Brush.solid(0xFF0000))));
        try (CacheManager<FilterExecutionResult> cache = CacheManager
                .<FilterExecutionResult>builder().build()) {
            chain(blur(2)).cache(cache).build().execute(square());
            FilterExecutionResult result = chain(blur(2)).cache(cache).build().execute(other);

            assertThat(result.isCacheHit()).as("cache hit").isFalse();
        }
    }

    @Test
    void pixelArithmeticRendersBitmap() throws Exception {
        FilterGraph graph = FilterGraph.of(
                FilterPrimitiveSpec.builder("shift", PrimitiveKind.OFFSET)
                        .param("dx", 10).result("moved").build(),
                FilterPrimitiveSpec.builder("clip", PrimitiveKind.COMPOSITE)
                        .in("SourceGraphic").in("moved").param("operator", "in").build());

        FilterExecutionResult result = chain(graph).build().execute(square());

        assertThat(result.strategy()).isEqualTo(RenderStrategy.RASTER_FALLBACK);
        assertThat(result.png()).get()
                .satisfies(png -> assertThat(png).startsWith(0x89, 'P', 'N', 'G'));
    }

    @Test
    void metafileSizeCapEscalatesToBitmap() throws Exception {
        FilterChain chain = chain(convolve(5, arbitraryKernel5x5()))
                .emfEncoder(new EMFEncoder(130))
                .build();

        FilterExecutionResult result = chain.execute(square());

        assertThat(result.strategy()).isEqualTo(RenderStrategy.RASTER_FALLBACK);
        assertThat(result.diagnostics()).singleElement()
                .extracting(Diagnostic::message).asString()
                .startsWith("EMF encoding failed");
    }

    @Test
    void parallelModeNeedsWorkerPool() {
        assertThatThrownBy(() -> chain(blur(1)).mode(ExecutionMode.PARALLEL).build())
                .isInstanceOf(IllegalStateException.class);
    }


    static class FailingFilter implements Filter {

        @Override
        public PrimitiveKind kind() {
            return PrimitiveKind.GAUSSIAN_BLUR;
        }

        @Override
        public double complexityScore(Parameters params) {
            return 0;
        }

        @Override
        public PrimitiveOutput apply(Parameters params,
                                     List<PrimitiveOutput> inputs,
                                     FilterContext context) {
            throw new IllegalStateException("boom");
        }

    }


    static class CountingFilter extends FailingFilter {

        final AtomicInteger applied;

        CountingFilter(AtomicInteger applied) {
            this.applied = applied;
        }

        @Override
        public PrimitiveOutput apply(Parameters params,
                                     List<PrimitiveOutput> inputs,
                                     FilterContext context) {
            applied.incrementAndGet();
            return inputs.get(0);
        }

    }


    static class SlowFilter extends FailingFilter {

        @Override
        public PrimitiveOutput apply(Parameters params,
                                     List<PrimitiveOutput> inputs,
                                     FilterContext context) {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return inputs.get(0);
        }

    }


    static class RendezvousFilter implements Filter {

        final OffsetFilter delegate = new OffsetFilter();

        final CountDownLatch arrived;

        final Set<String> threads = ConcurrentHashMap.newKeySet();

        RendezvousFilter(int parties) {
            this.arrived = new CountDownLatch(parties);
        }

        @Override
        public PrimitiveKind kind() {
            return PrimitiveKind.OFFSET;
        }

        @Override
        public double complexityScore(Parameters params) {
            return delegate.complexityScore(params);
        }

        @Override
        public PrimitiveOutput apply(Parameters params,
                                     List<PrimitiveOutput> inputs,
                                     FilterContext context)
                throws FilterPrimitiveException {
            threads.add(Thread.currentThread().getName());
            arrived.countDown();
            try {
                if (!arrived.await(3, TimeUnit.SECONDS))
                    throw new FilterPrimitiveException(context.primitiveId(),
                                                       "Peer did not arrive");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FilterPrimitiveException(context.primitiveId(), "Interrupted", e);
            }
            return delegate.apply(params, inputs, context);
        }

    }


}
