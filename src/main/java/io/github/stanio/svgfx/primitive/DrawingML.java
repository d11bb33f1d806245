/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.List;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand;
import io.github.stanio.svgfx.emf.DrawingCommand.Polygon;

/**
 * DrawingML markup helpers.  Fractions are expressed in thousandths of a
 * percent (100000 = 100%), angles in 60000ths of a degree.
 */
final class DrawingML {

    static final long FULL_CIRCLE = 21600000;

    private DrawingML() {}

    static String hex(int rgb) {
        return String.format("%06X", rgb & 0xFFFFFF);
    }

    static long percent(double fraction) {
        return Math.round(fraction * 100000);
    }

    static long angle(double degrees) {
        return Math.floorMod(Math.round(degrees * 60000), FULL_CIRCLE);
    }

    static String srgbColor(int rgb, double opacity) {
        if (opacity >= 1)
            return "<a:srgbClr val=\"" + hex(rgb) + "\"/>";

        return "<a:srgbClr val=\"" + hex(rgb) + "\"><a:alpha val=\""
                + percent(Math.max(0, opacity)) + "\"/></a:srgbClr>";
    }

    static String solidFill(int rgb, double opacity) {
        return "<a:solidFill>" + srgbColor(rgb, opacity) + "</a:solidFill>";
    }

    /**
     * Describes the polygons among the given commands as a custom geometry,
     * with coordinates relative to the given bounds.
     */
    static String customGeometry(List<DrawingCommand> commands,
                                 Rectangle2D bounds,
                                 FilterContext context) {
        StringBuilder buf = new StringBuilder("<a:custGeom><a:pathLst>");
        for (DrawingCommand cmd : commands) {
            if (!(cmd instanceof Polygon))
                continue;

            double[] xy = ((Polygon) cmd).coordinates();
            buf.append("<a:path w=\"").append(context.toEmu(bounds.getWidth()))
               .append("\" h=\"").append(context.toEmu(bounds.getHeight())).append("\">");
            for (int i = 0; i < xy.length; i += 2) {
                buf.append(i == 0 ? "<a:moveTo>" : "<a:lnTo>")
                   .append("<a:pt x=\"").append(context.toEmu(xy[i] - bounds.getX()))
                   .append("\" y=\"").append(context.toEmu(xy[i + 1] - bounds.getY()))
                   .append("\"/>")
                   .append(i == 0 ? "</a:moveTo>" : "</a:lnTo>");
            }
            buf.append("<a:close/></a:path>");
        }
        return buf.append("</a:pathLst></a:custGeom>").toString();
    }

}
