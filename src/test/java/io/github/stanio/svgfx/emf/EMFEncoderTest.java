/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import java.awt.Rectangle;
import java.awt.geom.Rectangle2D;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class EMFEncoderTest {

    static final int EMR_HEADER = 1;
    static final int EMR_POLYGON = 3;
    static final int EMR_POLYLINE = 4;
    static final int EMR_EOF = 14;
    static final int EMR_SETPOLYFILLMODE = 19;
    static final int EMR_SELECTOBJECT = 37;
    static final int EMR_CREATEPEN = 38;
    static final int EMR_CREATEBRUSHINDIRECT = 39;
    static final int EMR_RECTANGLE = 43;
    static final int EMR_CREATEMONOBRUSH = 93;

    static DrawingCommand triangle(int rgb) {
        return DrawingCommand.polygon(new double[] { 0, 0, 40, 0, 20, 30 }, Brush.solid(rgb));
    }

    @Test
    void emptyMetafile() throws Exception {
        EMFDocument emf = new EMFEncoder().encode(List.of());

        assertThat(emf.recordTypes()).containsExactly(EMR_HEADER, EMR_EOF);
        assertThat(emf.size()).isEqualTo(128);
        assertThat(emf.bounds()).isEqualTo(new Rectangle());
    }

    @Test
    void solidPolygonRecords() throws Exception {
        EMFDocument emf = new EMFEncoder().encode(List.of(triangle(0x112233)));

        assertThat(emf.recordTypes()).containsExactly(EMR_HEADER,
                EMR_SETPOLYFILLMODE, EMR_SELECTOBJECT, EMR_CREATEBRUSHINDIRECT,
                EMR_SELECTOBJECT, EMR_POLYGON, EMR_EOF);
        assertThat(emf.numHandles()).as("handles").isEqualTo(2);
        assertThat(emf.bounds()).isEqualTo(new Rectangle(0, 0, 40, 30));
    }

    @Test
    void objectsReused() throws Exception {
        EMFDocument emf = new EMFEncoder().encode(List.of(
                triangle(0x112233),
                DrawingCommand.polyline(new double[] { 0, 0, 10, 10 }, 0x000000, 1),
                DrawingCommand.polyline(new double[] { 5, 0, 15, 10 }, 0x000000, 1),
                triangle(0x112233)));

        int[] types = emf.recordTypes();
        assertThat(Arrays.stream(types).filter(t -> t == EMR_CREATEBRUSHINDIRECT).count())
                .as("brushes").isEqualTo(1);
        assertThat(Arrays.stream(types).filter(t -> t == EMR_CREATEPEN).count())
                .as("pens").isEqualTo(1);
        assertThat(Arrays.stream(types).filter(t -> t == EMR_POLYLINE).count())
                .as("polylines").isEqualTo(2);
    }

    @Test
    void recordsDWordAligned() throws Exception {
        EMFDocument emf = new EMFEncoder().encode(List.of(
                triangle(0xFF0000),
                DrawingCommand.fillRect(new Rectangle2D.Double(1.5, 2.5, 10, 10),
                        Brush.pattern(FillPattern.BRICK, 0x000000, 0xFFFFFF)),
                DrawingCommand.polyline(new double[] { 0, 0, 3, 7, 9, 2 }, 0x00FF00, 2)));

        assertThat(emf.records()).allSatisfy(record -> {
            assertThat(record.offset() % 4).as("offset").isZero();
            assertThat(record.size() % 4).as("size").isZero();
        });
        assertThat(emf.recordTypes()).contains(EMR_CREATEMONOBRUSH, EMR_RECTANGLE);

        EMFDocument parsed = EMFDocument.parse(emf.toByteArray());
        assertThat(parsed).isEqualTo(emf);
    }

    @Test
    void hatchedPatternUsesHatchBrush() throws Exception {
        EMFDocument emf = new EMFEncoder().encode(List.of(DrawingCommand
                .fillRect(new Rectangle2D.Double(0, 0, 8, 8),
                          Brush.pattern(FillPattern.CROSSHATCH, 0x000000, 0xFFFFFF))));

        assertThat(emf.recordTypes())
                .contains(EMR_CREATEBRUSHINDIRECT)
                .doesNotContain(EMR_CREATEMONOBRUSH);
    }

    @Test
    void deterministicOutput() throws Exception {
        List<DrawingCommand> commands = List.of(triangle(0xABCDEF),
                DrawingCommand.polyline(new double[] { 0, 0, 10, 10 }, 0x123456, 1.5));

        byte[] first = new EMFEncoder().encode(commands).toByteArray();
        byte[] second = new EMFEncoder().encode(commands).toByteArray();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void sizeCapExceeded() {
        List<DrawingCommand> commands = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            commands.add(DrawingCommand.polygon(new double[] { i, 0, i + 1, 0, i, 1 },
                                                Brush.solid(i)));
        }
        EMFEncoder encoder = new EMFEncoder(1024);

        assertThatThrownBy(() -> encoder.encode(commands))
                .isInstanceOf(EMFEncodingException.class)
                .extracting(e -> ((EMFEncodingException) e).reason())
                .isEqualTo(EMFEncodingException.Reason.SIZE_EXCEEDED);
    }

    @Test
    void degeneratePolygonUnsupported() {
        assertThatThrownBy(() -> new EMFEncoder().encode(List.of(DrawingCommand
                .polygon(new double[] { 0, 0, 1, 1 }, Brush.solid(0)))))
                .isInstanceOf(EMFEncodingException.class)
                .extracting(e -> ((EMFEncodingException) e).reason())
                .isEqualTo(EMFEncodingException.Reason.UNSUPPORTED_RECORD);
    }

    @Test
    void tooSmallCapRejected() {
        assertThatThrownBy(() -> new EMFEncoder(100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parseRejectsTruncated() throws Exception {
        byte[] data = new EMFEncoder().encode(List.of(triangle(0))).toByteArray();

        assertThatThrownBy(() -> EMFDocument.parse(Arrays.copyOf(data, data.length - 4)))
                .isInstanceOf(EMFEncodingException.class)
                .extracting(e -> ((EMFEncodingException) e).reason())
                .isEqualTo(EMFEncodingException.Reason.INVALID_RECORD);
        assertThatThrownBy(() -> EMFDocument.parse(new byte[16]))
                .isInstanceOf(EMFEncodingException.class)
                .hasMessage("Not an EMF header");
    }

    @Test
    void colorRefIsBgr() {
        assertThat(EMFEncoder.colorRef(0x112233)).isEqualTo(0x332211);
    }

    @Test
    void fillSemantics() {
        assertThat(FillPattern.forSemantics(" Dots ")).hasValue(FillPattern.HEXAGONAL);
        assertThat(FillPattern.forSemantics("masonry")).hasValue(FillPattern.BRICK);
        assertThat(FillPattern.forSemantics("plaid")).isEmpty();
        assertThat(FillPattern.HATCH.isHatched()).as("HATCH").isTrue();
        assertThat(FillPattern.GRID.isHatched()).as("GRID").isFalse();
    }

    @ParameterizedTest
    @EnumSource(FillPattern.class)
    void patternsAreEightByEight(FillPattern pattern) {
        assertThat(pattern.rows()).hasSize(8);
    }

}
