/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

/**
 * Record types, object styles, and fixed sizes of the subset of the
 * Enhanced Metafile format the encoder produces.
 *
 * @see  <a href="https://learn.microsoft.com/openspecs/windows_protocols/ms-emf/"
 *              >[MS-EMF]: Enhanced Metafile Format</a>
 */
interface EMFConstants {

    int EMR_HEADER = 1;
    int EMR_POLYGON = 3;
    int EMR_POLYLINE = 4;
    int EMR_EOF = 14;
    int EMR_SETPOLYFILLMODE = 19;
    int EMR_SELECTOBJECT = 37;
    int EMR_CREATEPEN = 38;
    int EMR_CREATEBRUSHINDIRECT = 39;
    int EMR_RECTANGLE = 43;
    int EMR_CREATEMONOBRUSH = 93;

    int ENHMETA_SIGNATURE = 0x464D4520; // " EMF"
    int META_VERSION = 0x10000;

    int BS_SOLID = 0;
    int BS_HATCHED = 2;

    int HS_HORIZONTAL = 0;
    int HS_CROSS = 4;

    int PS_SOLID = 0;

    int ALTERNATE = 1;
    int WINDING = 2;

    int DIB_RGB_COLORS = 0;

    int NULL_PEN = 0x80000008;

    int RECORD_HEADER_SIZE = 2 * Integer.BYTES; // type + size
    int HEADER_RECORD_SIZE = 108;
    int EOF_RECORD_SIZE = 20;
    int BITMAPINFOHEADER_SIZE = 40;

    int HEADER_BYTES_OFFSET = 48;
    int HEADER_RECORDS_OFFSET = 52;
    int HEADER_HANDLES_OFFSET = 56;

    // Reference device: 1920 x 1080 px at 96 DPI
    int DEVICE_WIDTH_PX = 1920;
    int DEVICE_HEIGHT_PX = 1080;
    int DEVICE_WIDTH_MM = 508;
    int DEVICE_HEIGHT_MM = 286;
    double HUNDREDTH_MM_PER_PX = 2540.0 / 96;

}
