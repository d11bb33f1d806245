/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;

import java.awt.image.BufferedImage;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

/**
 * Encodes raster fallback images as PNG.  A single ImageIO writer is reused
 * per instance.
 */
final class PNGEncoder {

    private final ImageWriter pngWriter;

    PNGEncoder() {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("png");
        if (!writers.hasNext()) {
            throw new IllegalStateException("PNG image writer not available");
        }
        pngWriter = writers.next();
    }

    // ImageWriter instances are not thread-safe
    synchronized byte[] encode(BufferedImage image) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (ImageOutputStream out = new MemoryCacheImageOutputStream(buf)) {
            pngWriter.setOutput(out);
            pngWriter.write(null, new IIOImage(image, null, null), null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            pngWriter.setOutput(null);
        }
        return buf.toByteArray();
    }

}
