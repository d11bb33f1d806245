/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

/**
 * An abstract, device-independent drawing operation.  Filter primitives
 * describe their vector output as a list of these, which the
 * {@code EMFEncoder} serializes into metafile records.  Immutable.
 * Coordinates are in user units.
 */
public abstract class DrawingCommand {

    DrawingCommand() {}

    /**
     * {@return the command bounds in user units}
     */
    public abstract Rectangle2D bounds();

    /**
     * {@return a copy of this command moved by the given offset}
     *
     * @param   dx  horizontal offset
     * @param   dy  vertical offset
     */
    public abstract DrawingCommand translate(double dx, double dy);

    /**
     * {@return a copy of this command painted with the given solid color}
     *
     * @param   rgb  {@code 0xRRGGBB} color
     */
    public abstract DrawingCommand recolor(int rgb);

    /**
     * {@return the stroke or fill color; the foreground color of pattern
     * fills}
     */
    public abstract int color();

    public static Polygon polygon(List<? extends Point2D> points, Brush fill) {
        return new Polygon(coords(points), fill, false);
    }

    public static Polygon polygon(double[] xy, Brush fill) {
        return new Polygon(xy.clone(), fill, false);
    }

    public static Polyline polyline(List<? extends Point2D> points, int color, double width) {
        return new Polyline(coords(points), color, width);
    }

    public static Polyline polyline(double[] xy, int color, double width) {
        return new Polyline(xy.clone(), color, width);
    }

    public static FillRect fillRect(Rectangle2D rect, Brush fill) {
        return new FillRect(rect.getX(), rect.getY(),
                            rect.getWidth(), rect.getHeight(), fill);
    }

    static double[] coords(List<? extends Point2D> points) {
        double[] xy = new double[points.size() * 2];
        for (int i = 0, len = points.size(); i < len; i++) {
            Point2D pt = points.get(i);
            xy[2 * i] = pt.getX();
            xy[2 * i + 1] = pt.getY();
        }
        return xy;
    }

    static Rectangle2D bounds(double[] xy) {
        if (xy.length == 0)
            return new Rectangle2D.Double();

        double minX = xy[0], minY = xy[1];
        double maxX = minX, maxY = minY;
        for (int i = 2; i < xy.length; i += 2) {
            minX = Math.min(minX, xy[i]);
            maxX = Math.max(maxX, xy[i]);
            minY = Math.min(minY, xy[i + 1]);
            maxY = Math.max(maxY, xy[i + 1]);
        }
        return new Rectangle2D.Double(minX, minY, maxX - minX, maxY - minY);
    }

    static double[] translated(double[] xy, double dx, double dy) {
        double[] moved = new double[xy.length];
        for (int i = 0; i < xy.length; i += 2) {
            moved[i] = xy[i] + dx;
            moved[i + 1] = xy[i + 1] + dy;
        }
        return moved;
    }

    static void appendCoords(StringBuilder buf, double[] xy) {
        buf.append('[');
        for (int i = 0; i < xy.length; i += 2) {
            if (i > 0) buf.append(' ');
            buf.append(xy[i]).append(',').append(xy[i + 1]);
        }
        buf.append(']');
    }


    /**
     * Closed, filled outline.
     */
    public static final class Polygon extends DrawingCommand {

        private final double[] xy;
        private final Brush fill;
        private final boolean nonZero;

        Polygon(double[] xy, Brush fill, boolean nonZero) {
            if (xy.length % 2 != 0)
                throw new IllegalArgumentException("Odd number of coordinates: " + xy.length);

            this.xy = xy;
            this.fill = Objects.requireNonNull(fill, "fill");
            this.nonZero = nonZero;
        }

        /**
         * {@return a copy of this polygon using the non-zero winding fill
         * rule instead of even-odd}
         */
        public Polygon withNonZeroFill() {
            return new Polygon(xy, fill, true);
        }

        public int numPoints() {
            return xy.length / 2;
        }

        public double[] coordinates() {
            return xy.clone();
        }

        public Brush fill() {
            return fill;
        }

        @Override
        public int color() {
            return fill.color();
        }

        public boolean isNonZero() {
            return nonZero;
        }

        @Override
        public Rectangle2D bounds() {
            return bounds(xy);
        }

        @Override
        public Polygon recolor(int rgb) {
            return new Polygon(xy, Brush.solid(rgb), nonZero);
        }

        @Override
        public Polygon translate(double dx, double dy) {
            return new Polygon(translated(xy, dx, dy), fill, nonZero);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Polygon))
                return false;

            Polygon other = (Polygon) obj;
            return Arrays.equals(xy, other.xy)
                    && fill.equals(other.fill)
                    && nonZero == other.nonZero;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Arrays.hashCode(xy), fill, nonZero);
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder("Polygon(");
            appendCoords(buf, xy);
            return buf.append(", ").append(fill)
                      .append(nonZero ? ", nonzero)" : ")").toString();
        }

    } // class Polygon


    /**
     * Open, stroked outline.
     */
    public static final class Polyline extends DrawingCommand {

        private final double[] xy;
        private final int color;
        private final double width;

        Polyline(double[] xy, int color, double width) {
            if (xy.length % 2 != 0)
                throw new IllegalArgumentException("Odd number of coordinates: " + xy.length);
            if (!(width >= 0))
                throw new IllegalArgumentException("Negative stroke width: " + width);

            this.xy = xy;
            this.color = color & 0xFFFFFF;
            this.width = width;
        }

        public int numPoints() {
            return xy.length / 2;
        }

        public double[] coordinates() {
            return xy.clone();
        }

        @Override
        public int color() {
            return color;
        }

        public double width() {
            return width;
        }

        @Override
        public Rectangle2D bounds() {
            Rectangle2D bounds = bounds(xy);
            double half = width / 2;
            return new Rectangle2D.Double(bounds.getX() - half, bounds.getY() - half,
                    bounds.getWidth() + width, bounds.getHeight() + width);
        }

        @Override
        public Polyline recolor(int rgb) {
            return new Polyline(xy, rgb, width);
        }

        @Override
        public Polyline translate(double dx, double dy) {
            return new Polyline(translated(xy, dx, dy), color, width);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Polyline))
                return false;

            Polyline other = (Polyline) obj;
            return Arrays.equals(xy, other.xy)
                    && color == other.color
                    && Double.compare(width, other.width) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Arrays.hashCode(xy), color, width);
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder("Polyline(");
            appendCoords(buf, xy);
            return buf.append(String.format(", #%06X, ", color))
                      .append(width).append(')').toString();
        }

    } // class Polyline


    /**
     * Filled rectangle, typically with a pattern brush.
     */
    public static final class FillRect extends DrawingCommand {

        private final double x;
        private final double y;
        private final double width;
        private final double height;
        private final Brush fill;

        FillRect(double x, double y, double width, double height, Brush fill) {
            if (width < 0 || height < 0)
                throw new IllegalArgumentException("Negative size: " + width + " x " + height);

            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
            this.fill = Objects.requireNonNull(fill, "fill");
        }

        public Brush fill() {
            return fill;
        }

        @Override
        public int color() {
            return fill.color();
        }

        @Override
        public Rectangle2D bounds() {
            return new Rectangle2D.Double(x, y, width, height);
        }

        @Override
        public FillRect recolor(int rgb) {
            return new FillRect(x, y, width, height, Brush.solid(rgb));
        }

        @Override
        public FillRect translate(double dx, double dy) {
            return new FillRect(x + dx, y + dy, width, height, fill);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof FillRect))
                return false;

            FillRect other = (FillRect) obj;
            return Double.compare(x, other.x) == 0
                    && Double.compare(y, other.y) == 0
                    && Double.compare(width, other.width) == 0
                    && Double.compare(height, other.height) == 0
                    && fill.equals(other.fill);
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y, width, height, fill);
        }

        @Override
        public String toString() {
            return "FillRect(" + x + "," + y + " " + width + "x" + height + ", " + fill + ")";
        }

    } // class FillRect


}
