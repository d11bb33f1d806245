/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import io.github.stanio.svgfx.emf.EMFEncodingException.Reason;

/**
 * Growable little-endian byte sink with an upper size limit.  Every write
 * first checks the limit, so encoding stops as soon as the output would get
 * too large, without producing the rest of it.  <em>Not thread-safe.</em>
 */
class LittleEndianOutput {

    public static final byte NUL = 0;

    private final long sizeLimit;

    private ByteBuffer outBuf;

    LittleEndianOutput(long sizeLimit) {
        this(sizeLimit, 1024);
    }

    LittleEndianOutput(long sizeLimit, int initialCapacity) {
        this.sizeLimit = sizeLimit;
        this.outBuf = ByteBuffer.allocate((int) Math.min(initialCapacity,
                                                         Math.max(sizeLimit, 16)))
                                .order(ByteOrder.LITTLE_ENDIAN);
    }

    private ByteBuffer ensureRemaining(int size) throws EMFEncodingException {
        long required = (long) outBuf.position() + size;
        if (required > sizeLimit) {
            throw new EMFEncodingException(Reason.SIZE_EXCEEDED,
                    "Metafile size exceeds limit of " + sizeLimit + " bytes");
        }
        if (outBuf.remaining() < size) {
            long newCapacity = Math.max(required, (long) outBuf.capacity() * 2);
            newCapacity = Math.min(newCapacity, Math.min(sizeLimit, Integer.MAX_VALUE - 8));
            ByteBuffer grown = ByteBuffer.allocate((int) newCapacity)
                                         .order(ByteOrder.LITTLE_ENDIAN);
            outBuf.flip();
            grown.put(outBuf);
            outBuf = grown;
        }
        return outBuf;
    }

    public int position() {
        return outBuf.position();
    }

    public void write(byte val) throws EMFEncodingException {
        ensureRemaining(Byte.BYTES).put(val);
    }

    public void write(byte[] src) throws EMFEncodingException {
        ensureRemaining(src.length).put(src);
    }

    public void writeWord(short val) throws EMFEncodingException {
        ensureRemaining(Short.BYTES).putShort(val);
    }

    public void writeDWord(int val) throws EMFEncodingException {
        ensureRemaining(Integer.BYTES).putInt(val);
    }

    /**
     * Writes a {@code RECTL}: left, top, right, bottom.
     */
    public void writeRect(int left, int top, int right, int bottom)
            throws EMFEncodingException {
        ensureRemaining(4 * Integer.BYTES)
                .putInt(left).putInt(top).putInt(right).putInt(bottom);
    }

    /**
     * Writes zero bytes up to the next multiple of {@code alignment}.
     */
    public void pad(int alignment) throws EMFEncodingException {
        int padding = (alignment - outBuf.position() % alignment) % alignment;
        ByteBuffer buf = ensureRemaining(padding);
        for (int i = 0; i < padding; i++) {
            buf.put(NUL);
        }
    }

    /**
     * Overwrites a previously written double word.
     */
    public void putDWord(int index, int val) {
        if (index + Integer.BYTES > outBuf.position())
            throw new IndexOutOfBoundsException("Not written yet: " + index);

        outBuf.putInt(index, val);
    }

    public void putWord(int index, short val) {
        if (index + Short.BYTES > outBuf.position())
            throw new IndexOutOfBoundsException("Not written yet: " + index);

        outBuf.putShort(index, val);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(outBuf.array(), outBuf.position());
    }

}
