/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * A single metafile record: a little-endian type tag, the record size
 * (including the 8-byte type/size header), and the payload padded to
 * 4-byte alignment.
 */
public final class EMFRecord {

    private final int type;
    private final int offset;
    private final ByteBuffer data;

    EMFRecord(int type, int offset, ByteBuffer data) {
        this.type = type;
        this.offset = offset;
        this.data = data.asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public int type() {
        return type;
    }

    /**
     * {@return the offset of this record within the document}
     */
    public int offset() {
        return offset;
    }

    /**
     * {@return the record size including its header}
     */
    public int size() {
        return data.limit();
    }

    /**
     * {@return the record payload following the type and size fields, as a
     * little-endian read-only buffer}
     */
    public ByteBuffer payload() {
        ByteBuffer buf = data.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        buf.position(EMFConstants.RECORD_HEADER_SIZE);
        return buf.slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public String toString() {
        return "EMFRecord(type=" + type + ", offset=" + offset + ", size=" + size() + ")";
    }

}
