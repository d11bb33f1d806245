/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;
import io.github.stanio.svgfx.policy.VectorApproximation;

/**
 * {@code feMerge}: layers the {@code feMergeNode} inputs in order, the
 * first one at the bottom.
 */
public class MergeFilter extends AbstractFilter {

    private static final VectorApproximation approximation =
            VectorApproximation.of(params -> true, 1.0);

    public MergeFilter() {
        super(PrimitiveKind.MERGE);
    }

    @Override
    public double complexityScore(Parameters params) {
        return 0.1;
    }

    @Override
    public Optional<VectorApproximation> vectorApproximation() {
        return Optional.of(approximation);
    }

    @Override
    public PrimitiveOutput apply(Parameters params,
                                 List<PrimitiveOutput> inputs,
                                 FilterContext context)
            throws FilterPrimitiveException {
        if (inputs.isEmpty())
            return PrimitiveOutput.empty();

        List<DrawingCommand> layers = new ArrayList<>();
        Rectangle2D bounds = null;
        for (PrimitiveOutput layer : inputs) {
            context.checkpoint();
            layers.addAll(layer.commands());
            if (bounds == null) {
                bounds = layer.bounds();
            } else {
                bounds.add(layer.bounds());
            }
        }

        String fragment = "";
        if (context.strategy().compareTo(RenderStrategy.VECTOR_APPROX) <= 0) {
            StringBuilder dag = new StringBuilder("<a:effectDag type=\"sib\">");
            for (int i = 0; i < inputs.size(); i++) {
                dag.append("<a:cont type=\"sib\"/>");
            }
            fragment = dag.append("</a:effectDag>").toString();
        }
        return PrimitiveOutput.of(fragment, layers, bounds);
    }

}
