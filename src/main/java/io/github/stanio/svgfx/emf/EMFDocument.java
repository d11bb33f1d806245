/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import static io.github.stanio.svgfx.emf.EMFConstants.*;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import java.awt.Rectangle;

import io.github.stanio.svgfx.emf.EMFEncodingException.Reason;

/**
 * An encoded Enhanced Metafile.  Immutable: accessors return copies or
 * read-only views.
 *
 * @see  EMFEncoder
 */
public final class EMFDocument {

    private final byte[] data;
    private final List<EMFRecord> records;

    private EMFDocument(byte[] data, List<EMFRecord> records) {
        this.data = data;
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * Parses the record structure of the given metafile data.  Validates the
     * header signature, record framing, alignment, and the terminating
     * {@code EMR_EOF} record.
     *
     * @param   data  metafile bytes
     * @return  a document over a copy of the given data
     * @throws  EMFEncodingException  if the data is not a well-formed
     *          metafile
     */
    public static EMFDocument parse(byte[] data) throws EMFEncodingException {
        byte[] copy = data.clone();
        return new EMFDocument(copy, splitRecords(copy));
    }

    static EMFDocument wrap(byte[] data) {
        try {
            return new EMFDocument(data, splitRecords(data));
        } catch (EMFEncodingException e) {
            throw new IllegalStateException("Encoder produced malformed data", e);
        }
    }

    private static List<EMFRecord> splitRecords(byte[] data) throws EMFEncodingException {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        if (buf.remaining() < HEADER_RECORD_SIZE
                || buf.getInt(0) != EMR_HEADER
                || buf.getInt(40) != ENHMETA_SIGNATURE) {
            throw new EMFEncodingException(Reason.INVALID_RECORD, "Not an EMF header");
        }

        int declaredSize = buf.getInt(HEADER_BYTES_OFFSET);
        int declaredCount = buf.getInt(HEADER_RECORDS_OFFSET);
        if (declaredSize != data.length) {
            throw new EMFEncodingException(Reason.INVALID_RECORD, "Header declares "
                    + declaredSize + " bytes, got " + data.length);
        }

        List<EMFRecord> records = new ArrayList<>();
        int offset = 0;
        while (offset < data.length) {
            if (data.length - offset < RECORD_HEADER_SIZE) {
                throw new EMFEncodingException(Reason.INVALID_RECORD,
                        "Truncated record header at " + offset);
            }
            int type = buf.getInt(offset);
            int size = buf.getInt(offset + Integer.BYTES);
            if (size < RECORD_HEADER_SIZE || size % 4 != 0 || size > data.length - offset) {
                throw new EMFEncodingException(Reason.INVALID_RECORD,
                        "Bad record size " + size + " at " + offset);
            }
            ByteBuffer slice = ByteBuffer.wrap(data, offset, size).slice();
            records.add(new EMFRecord(type, offset, slice));
            offset += size;
        }

        if (records.size() != declaredCount) {
            throw new EMFEncodingException(Reason.INVALID_RECORD, "Header declares "
                    + declaredCount + " records, got " + records.size());
        }
        if (records.get(records.size() - 1).type() != EMR_EOF) {
            throw new EMFEncodingException(Reason.INVALID_RECORD, "Missing EMR_EOF");
        }
        return records;
    }

    public List<EMFRecord> records() {
        return records;
    }

    public int[] recordTypes() {
        return records.stream().mapToInt(EMFRecord::type).toArray();
    }

    /**
     * {@return the total encoded size in bytes}
     */
    public int size() {
        return data.length;
    }

    /**
     * {@return the number of object handles declared in the header}
     */
    public int numHandles() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN)
                         .getShort(HEADER_HANDLES_OFFSET) & 0xFFFF;
    }

    /**
     * {@return the inclusive-inclusive bounds declared in the header, in
     * logical units}
     */
    public Rectangle bounds() {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        int left = buf.getInt(8);
        int top = buf.getInt(12);
        int right = buf.getInt(16);
        int bottom = buf.getInt(20);
        return new Rectangle(left, top, right - left, bottom - top);
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public ByteBuffer asByteBuffer() {
        return ByteBuffer.wrap(data).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public void writeTo(OutputStream out) throws IOException {
        out.write(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        return (obj instanceof EMFDocument)
                && Arrays.equals(data, ((EMFDocument) obj).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "EMFDocument(" + data.length + " bytes, " + records.size() + " records)";
    }

}
