/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;

class RasterRendererTest {

    private static final List<DrawingCommand> square = List.of(DrawingCommand
            .fillRect(new Rectangle2D.Double(10, 10, 20, 20), Brush.solid(0x3366CC)));

    @Test
    void coversBounds() {
        BufferedImage image = new RasterRenderer(2)
                .render(square, new Rectangle2D.Double(0, 0, 40, 30));

        assertThat(image.getWidth()).as("width").isEqualTo(80);
        assertThat(image.getHeight()).as("height").isEqualTo(60);
        assertThat(image.getRGB(40, 40)).as("inside").isEqualTo(0xFF3366CC);
        assertThat(image.getRGB(5, 5) >>> 24).as("outside alpha").isZero();
    }

    @Test
    void dimensionLimited() {
        BufferedImage image = new RasterRenderer()
                .render(square, new Rectangle2D.Double(0, 0, 8192, 100));

        assertThat(image.getWidth()).isEqualTo(RasterRenderer.MAX_DIMENSION);
        assertThat(image.getHeight()).isEqualTo(50);
    }

    @Test
    void encodesPNG() throws Exception {
        byte[] png = new RasterRenderer().renderPNG(square, new Rectangle2D.Double(0, 0, 40, 40));

        assertThat(png).startsWith(0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n');
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(png));
        assertThat(decoded.getWidth()).as("width").isEqualTo(40);
        assertThat(decoded.getRGB(20, 20)).as("inside").isEqualTo(0xFF3366CC);
    }

    @Test
    void sharedEncoderConcurrentUse() throws Exception {
        RasterRenderer renderer = new RasterRenderer();
        Rectangle2D bounds = new Rectangle2D.Double(0, 0, 40, 40);
        byte[] expected = renderer.renderPNG(square, bounds);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<byte[]>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> renderer.renderPNG(square, bounds)));
            }
            for (Future<byte[]> png : results) {
                assertThat(png.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

}
