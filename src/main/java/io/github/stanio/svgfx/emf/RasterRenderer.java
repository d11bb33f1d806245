/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.util.List;
import java.util.logging.Logger;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Paint;
import java.awt.RenderingHints;
import java.awt.TexturePaint;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;

import io.github.stanio.svgfx.emf.DrawingCommand.FillRect;
import io.github.stanio.svgfx.emf.DrawingCommand.Polygon;
import io.github.stanio.svgfx.emf.DrawingCommand.Polyline;

/**
 * Last-resort fallback: paints drawing commands into a bitmap and encodes it
 * as PNG.  Used when metafile encoding fails.
 */
public class RasterRenderer {

    /** Maximum bitmap width or height in pixels. */
    public static final int MAX_DIMENSION = 4096;

    static final Logger log = Logger.getLogger(RasterRenderer.class.getName());

    private final double resolution;

    private final PNGEncoder pngEncoder;

    public RasterRenderer() {
        this(1.0);
    }

    /**
     * @param   resolution  pixels per user unit
     */
    public RasterRenderer(double resolution) {
        if (!(resolution > 0))
            throw new IllegalArgumentException("Resolution must be positive: " + resolution);

        this.resolution = resolution;
        this.pngEncoder = new PNGEncoder();
    }

    public byte[] renderPNG(List<? extends DrawingCommand> commands, Rectangle2D bounds) {
        return pngEncoder.encode(render(commands, bounds));
    }

    /**
     * Paints the given commands.  The bitmap covers {@code bounds}; its
     * resolution is reduced as necessary to stay within
     * {@link #MAX_DIMENSION}.
     *
     * @param   commands  drawing commands in paint order
     * @param   bounds  area to render, in user units
     * @return  an ARGB image with transparent background
     */
    public BufferedImage render(List<? extends DrawingCommand> commands, Rectangle2D bounds) {
        double scale = resolution;
        double extent = Math.max(bounds.getWidth(), bounds.getHeight()) * scale;
        if (extent > MAX_DIMENSION) {
            scale *= MAX_DIMENSION / extent;
            log.fine("Reduced raster resolution to " + scale);
        }

        int width = Math.max(1, (int) Math.ceil(bounds.getWidth() * scale));
        int height = Math.max(1, (int) Math.ceil(bounds.getHeight() * scale));
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
                               RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL,
                               RenderingHints.VALUE_STROKE_PURE);
            g.scale(scale, scale);
            g.translate(-bounds.getX(), -bounds.getY());

            for (DrawingCommand cmd : commands) {
                paint(g, cmd, scale);
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private static void paint(Graphics2D g, DrawingCommand cmd, double scale) {
        if (cmd instanceof Polygon) {
            Polygon polygon = (Polygon) cmd;
            Path2D path = path(polygon.coordinates(), true);
            path.setWindingRule(polygon.isNonZero() ? Path2D.WIND_NON_ZERO
                                                    : Path2D.WIND_EVEN_ODD);
            g.setPaint(paint(polygon.fill(), scale));
            g.fill(path);
        } else if (cmd instanceof Polyline) {
            Polyline polyline = (Polyline) cmd;
            g.setColor(new Color(polyline.color()));
            g.setStroke(new BasicStroke((float) polyline.width()));
            g.draw(path(polyline.coordinates(), false));
        } else if (cmd instanceof FillRect) {
            FillRect rect = (FillRect) cmd;
            g.setPaint(paint(rect.fill(), scale));
            g.fill(rect.bounds());
        } else {
            throw new IllegalArgumentException("Unsupported command: " + cmd);
        }
    }

    private static Path2D path(double[] xy, boolean closed) {
        Path2D path = new Path2D.Double();
        for (int i = 0; i < xy.length; i += 2) {
            if (i == 0) {
                path.moveTo(xy[i], xy[i + 1]);
            } else {
                path.lineTo(xy[i], xy[i + 1]);
            }
        }
        if (closed && xy.length > 0) {
            path.closePath();
        }
        return path;
    }

    static Paint paint(Brush brush, double scale) {
        FillPattern pattern = brush.pattern();
        if (pattern == null)
            return new Color(brush.color());

        BufferedImage tile = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
        byte[] rows = pattern.rows();
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                boolean set = (rows[y] & (0x80 >> x)) != 0;
                tile.setRGB(x, y, set ? brush.color() : brush.background());
            }
        }
        // One pattern cell spans 8 device pixels
        return new TexturePaint(tile, new Rectangle2D.Double(0, 0, 8 / scale, 8 / scale));
    }

}
