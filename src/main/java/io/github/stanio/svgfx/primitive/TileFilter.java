/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.Brush;
import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.emf.FillPattern;
import io.github.stanio.svgfx.graph.Parameters;
import io.github.stanio.svgfx.graph.PrimitiveKind;
import io.github.stanio.svgfx.policy.RenderStrategy;

/**
 * {@code feTile}: repeats the input across the primitive subregion.
 * <p>
 * A {@code pattern} parameter requests fill semantics instead ({@code
 * hatch}, {@code crosshatch}, {@code hexagonal}, {@code grid}, {@code
 * brick}, and synonyms), which only a metafile pattern brush
 * reproduces.</p>
 *
 * @see  FillPattern#forSemantics(String)
 */
public class TileFilter extends AbstractFilter {

    static final Logger log = Logger.getLogger(TileFilter.class.getName());

    /** Upper limit of input copies in the result geometry. */
    static final int MAX_TILES = 256;

    public TileFilter() {
        super(PrimitiveKind.TILE);
    }

    @Override
    public double complexityScore(Parameters params) {
        return params.has("pattern") ? 0.7 : 0.2;
    }

    @Override
    public PrimitiveOutput apply(Parameters params,
                                 List<PrimitiveOutput> inputs,
                                 FilterContext context)
            throws FilterPrimitiveException {
        PrimitiveOutput source = input(inputs, 0, context);
        Rectangle2D region = context.region(List.of());
        Rectangle2D tile = source.bounds();

        if (params.has("pattern")) {
            String semantics = params.string("pattern", "");
            FillPattern pattern = FillPattern.forSemantics(semantics).orElseGet(() -> {
                log.fine(() -> context.primitiveId()
                        + ": Unknown fill pattern \"" + semantics + "\", using grid");
                return FillPattern.GRID;
            });
            int color = source.commands().isEmpty() ? 0x000000
                                                    : source.commands().get(0).color();
            return PrimitiveOutput.of("", List.of(DrawingCommand
                    .fillRect(region, Brush.pattern(pattern, color, 0xFFFFFF))), region);
        }

        List<DrawingCommand> tiled = repeat(source.commands(), tile, region, context);
        String fragment = "";
        if (context.strategy() == RenderStrategy.NATIVE_EFFECT) {
            fragment = "<a:tile tx=\"" + context.toEmu(tile.getX() - region.getX())
                    + "\" ty=\"" + context.toEmu(tile.getY() - region.getY())
                    + "\" sx=\"100000\" sy=\"100000\" flip=\"none\" algn=\"tl\"/>";
        }
        return PrimitiveOutput.of(fragment, tiled, region);
    }

    private static List<DrawingCommand> repeat(List<DrawingCommand> commands,
                                               Rectangle2D tile,
                                               Rectangle2D region,
                                               FilterContext context)
            throws FilterPrimitiveException {
        if (tile.getWidth() <= 0 || tile.getHeight() <= 0 || region.isEmpty())
            return commands;

        // Tile grid aligned with the input tile
        double startX = tile.getX() - Math.ceil((tile.getX() - region.getX())
                                                / tile.getWidth()) * tile.getWidth();
        double startY = tile.getY() - Math.ceil((tile.getY() - region.getY())
                                                / tile.getHeight()) * tile.getHeight();
        List<DrawingCommand> tiled = new ArrayList<>();
        int count = 0;
        for (double y = startY; y < region.getMaxY(); y += tile.getHeight()) {
            context.checkpoint();
            for (double x = startX; x < region.getMaxX(); x += tile.getWidth()) {
                if (++count > MAX_TILES) {
                    log.fine(() -> context.primitiveId() + ": Tile count limited to " + MAX_TILES);
                    return tiled;
                }
                for (DrawingCommand cmd : commands) {
                    tiled.add(cmd.translate(x - tile.getX(), y - tile.getY()));
                }
            }
        }
        return tiled;
    }

}
