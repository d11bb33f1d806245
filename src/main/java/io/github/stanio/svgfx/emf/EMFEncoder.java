/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.emf;

import static io.github.stanio.svgfx.emf.EMFConstants.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import java.awt.geom.Rectangle2D;

import io.github.stanio.svgfx.emf.DrawingCommand.FillRect;
import io.github.stanio.svgfx.emf.DrawingCommand.Polygon;
import io.github.stanio.svgfx.emf.DrawingCommand.Polyline;
import io.github.stanio.svgfx.emf.EMFEncodingException.Reason;

/**
 * Serializes drawing commands into an Enhanced Metafile.
 * <p>
 * The output consists of an {@code EMR_HEADER} record (bounds, reference
 * device), followed by object creation/selection and shape records in
 * command order, and a terminating {@code EMR_EOF} record.  Object handles
 * are allocated in the order of first use, so identical input always
 * produces byte-identical output.</p>
 * <p>
 * Instances hold no mutable state and may be shared between threads.</p>
 *
 * @see  <a href="https://learn.microsoft.com/openspecs/windows_protocols/ms-emf/"
 *              >[MS-EMF]: Enhanced Metafile Format</a>
 */
public final class EMFEncoder {

    /** 1 MiB */
    public static final long DEFAULT_SIZE_CAP = 1024 * 1024;

    static final Logger log = Logger.getLogger(EMFEncoder.class.getName());

    private final long sizeCap;

    private final double scale;

    /**
     * Constructs an encoder with the default size cap, using one logical
     * unit per user unit.
     */
    public EMFEncoder() {
        this(DEFAULT_SIZE_CAP);
    }

    public EMFEncoder(long sizeCap) {
        this(sizeCap, 1.0);
    }

    /**
     * Constructs a new encoder.
     *
     * @param   sizeCap  maximum encoded size in bytes
     * @param   scale  logical units per user unit
     */
    public EMFEncoder(long sizeCap, double scale) {
        if (sizeCap < HEADER_RECORD_SIZE + EOF_RECORD_SIZE)
            throw new IllegalArgumentException("Size cap too small: " + sizeCap);
        if (!(scale > 0))
            throw new IllegalArgumentException("Scale must be positive: " + scale);

        this.sizeCap = sizeCap;
        this.scale = scale;
    }

    public long sizeCap() {
        return sizeCap;
    }

    /**
     * Encodes the given commands.
     *
     * @param   commands  drawing commands in paint order
     * @return  the encoded document
     * @throws  EMFEncodingException  if the encoded size would exceed the
     *          size cap, or a command can't be represented
     */
    public EMFDocument encode(List<? extends DrawingCommand> commands)
            throws EMFEncodingException {
        Rectangle2D bounds = null;
        for (DrawingCommand cmd : commands) {
            Rectangle2D cmdBounds = Objects.requireNonNull(cmd, "command").bounds();
            if (bounds == null) {
                bounds = cmdBounds;
            } else {
                bounds.add(cmdBounds);
            }
        }
        return encode(commands, bounds);
    }

    /**
     * Encodes the given commands, declaring the given bounds in the header.
     *
     * @param   commands  drawing commands in paint order
     * @param   bounds  picture bounds in user units, or {@code null} for
     *          empty bounds
     * @return  the encoded document
     * @throws  EMFEncodingException  if the encoded size would exceed the
     *          size cap, or a command can't be represented
     */
    public EMFDocument encode(List<? extends DrawingCommand> commands, Rectangle2D bounds)
            throws EMFEncodingException {
        Encoding encoding = new Encoding();
        encoding.header(bounds);
        for (DrawingCommand cmd : commands) {
            if (cmd instanceof Polygon) {
                encoding.polygon((Polygon) cmd);
            } else if (cmd instanceof Polyline) {
                encoding.polyline((Polyline) cmd);
            } else if (cmd instanceof FillRect) {
                encoding.fillRect((FillRect) cmd);
            } else {
                throw new EMFEncodingException(Reason.UNSUPPORTED_RECORD,
                        "Unsupported command: " + cmd);
            }
        }
        byte[] data = encoding.finish();
        log.fine(() -> "Encoded " + commands.size() + " commands into "
                + data.length + " bytes (" + encoding.numRecords + " records)");
        return EMFDocument.wrap(data);
    }

    static int colorRef(int rgb) {
        return ((rgb & 0xFF) << 16) | (rgb & 0xFF00) | ((rgb >> 16) & 0xFF);
    }


    /**
     * State of a single {@code encode()} invocation.
     */
    private final class Encoding {

        final LittleEndianOutput out = new LittleEndianOutput(sizeCap);

        final Map<Brush, Integer> brushes = new HashMap<>();
        final Map<Long, Integer> pens = new HashMap<>();

        int nextHandle = 1;
        int numRecords;

        int selectedPen;
        int selectedBrush;
        int fillMode;

        Encoding() {}

        private int beginRecord(int type) throws EMFEncodingException {
            int start = out.position();
            out.writeDWord(type);
            out.writeDWord(0); // size placeholder
            return start;
        }

        private void endRecord(int start) throws EMFEncodingException {
            out.pad(4);
            out.putDWord(start + Integer.BYTES, out.position() - start);
            numRecords++;
        }

        void header(Rectangle2D bounds) throws EMFEncodingException {
            int left = 0, top = 0, right = 0, bottom = 0;
            if (bounds != null && !bounds.isEmpty()) {
                left = floor(bounds.getMinX());
                top = floor(bounds.getMinY());
                right = ceil(bounds.getMaxX());
                bottom = ceil(bounds.getMaxY());
            }

            int start = beginRecord(EMR_HEADER);
            out.writeRect(left, top, right, bottom);
            out.writeRect(frame(left), frame(top), frame(right), frame(bottom));
            out.writeDWord(ENHMETA_SIGNATURE);
            out.writeDWord(META_VERSION);
            out.writeDWord(0); // nBytes, patched
            out.writeDWord(0); // nRecords, patched
            out.writeWord((short) 0); // nHandles, patched
            out.writeWord((short) 0); // reserved
            out.writeDWord(0); // nDescription
            out.writeDWord(0); // offDescription
            out.writeDWord(0); // nPalEntries
            out.writeDWord(DEVICE_WIDTH_PX);
            out.writeDWord(DEVICE_HEIGHT_PX);
            out.writeDWord(DEVICE_WIDTH_MM);
            out.writeDWord(DEVICE_HEIGHT_MM);
            out.writeDWord(0); // cbPixelFormat
            out.writeDWord(0); // offPixelFormat
            out.writeDWord(0); // bOpenGL
            out.writeDWord(DEVICE_WIDTH_MM * 1000);
            out.writeDWord(DEVICE_HEIGHT_MM * 1000);
            endRecord(start);
            assert (out.position() == HEADER_RECORD_SIZE);
        }

        private int frame(int logical) {
            return (int) Math.round(logical / scale * HUNDREDTH_MM_PER_PX);
        }

        void polygon(Polygon polygon) throws EMFEncodingException {
            if (polygon.numPoints() < 3)
                throw new EMFEncodingException(Reason.UNSUPPORTED_RECORD,
                        "Polygon needs at least 3 points: " + polygon);

            setFillMode(polygon.isNonZero() ? WINDING : ALTERNATE);
            selectPen(NULL_PEN);
            selectBrush(brushHandle(polygon.fill()));
            points(EMR_POLYGON, polygon.coordinates());
        }

        void polyline(Polyline polyline) throws EMFEncodingException {
            if (polyline.numPoints() < 2)
                throw new EMFEncodingException(Reason.UNSUPPORTED_RECORD,
                        "Polyline needs at least 2 points: " + polyline);

            selectPen(penHandle(polyline.color(), polyline.width()));
            points(EMR_POLYLINE, polyline.coordinates());
        }

        void fillRect(FillRect rect) throws EMFEncodingException {
            Rectangle2D box = rect.bounds();
            selectPen(NULL_PEN);
            selectBrush(brushHandle(rect.fill()));
            int start = beginRecord(EMR_RECTANGLE);
            out.writeRect(floor(box.getMinX()), floor(box.getMinY()),
                          ceil(box.getMaxX()), ceil(box.getMaxY()));
            endRecord(start);
        }

        private void points(int type, double[] xy) throws EMFEncodingException {
            int count = xy.length / 2;
            int[] logical = new int[xy.length];
            int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
            int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
            for (int i = 0; i < xy.length; i += 2) {
                int x = round(xy[i]);
                int y = round(xy[i + 1]);
                logical[i] = x;
                logical[i + 1] = y;
                minX = Math.min(minX, x);
                maxX = Math.max(maxX, x);
                minY = Math.min(minY, y);
                maxY = Math.max(maxY, y);
            }

            int start = beginRecord(type);
            out.writeRect(minX, minY, maxX, maxY);
            out.writeDWord(count);
            for (int value : logical) {
                out.writeDWord(value);
            }
            endRecord(start);
        }

        private void setFillMode(int mode) throws EMFEncodingException {
            if (fillMode == mode)
                return;

            int start = beginRecord(EMR_SETPOLYFILLMODE);
            out.writeDWord(mode);
            endRecord(start);
            fillMode = mode;
        }

        private void selectPen(int handle) throws EMFEncodingException {
            if (selectedPen == handle)
                return;

            selectObject(handle);
            selectedPen = handle;
        }

        private void selectBrush(int handle) throws EMFEncodingException {
            if (selectedBrush == handle)
                return;

            selectObject(handle);
            selectedBrush = handle;
        }

        private void selectObject(int handle) throws EMFEncodingException {
            int start = beginRecord(EMR_SELECTOBJECT);
            out.writeDWord(handle);
            endRecord(start);
        }

        private int allocateHandle() throws EMFEncodingException {
            if (nextHandle >= 0xFFFF)
                throw new EMFEncodingException(Reason.UNSUPPORTED_RECORD,
                        "Too many objects: " + nextHandle);

            return nextHandle++;
        }

        private int penHandle(int color, double width) throws EMFEncodingException {
            int logicalWidth = Math.max(0, round(width));
            Long key = ((long) color << 32) | logicalWidth;
            Integer existing = pens.get(key);
            if (existing != null)
                return existing;

            int handle = allocateHandle();
            int start = beginRecord(EMR_CREATEPEN);
            out.writeDWord(handle);
            out.writeDWord(PS_SOLID);
            out.writeDWord(logicalWidth); // POINTL x
            out.writeDWord(0);            // POINTL y, unused
            out.writeDWord(colorRef(color));
            endRecord(start);
            pens.put(key, handle);
            return handle;
        }

        private int brushHandle(Brush brush) throws EMFEncodingException {
            Integer existing = brushes.get(brush);
            if (existing != null)
                return existing;

            int handle = allocateHandle();
            FillPattern pattern = brush.pattern();
            if (pattern == null || pattern.isHatched()) {
                int start = beginRecord(EMR_CREATEBRUSHINDIRECT);
                out.writeDWord(handle);
                out.writeDWord(pattern == null ? BS_SOLID : BS_HATCHED);
                out.writeDWord(colorRef(brush.color()));
                out.writeDWord(pattern == null ? 0 : pattern.hatchStyle());
                endRecord(start);
            } else {
                monoBrush(handle, brush);
            }
            brushes.put(brush, handle);
            return handle;
        }

        /*
         * EMR_CREATEMONOBRUSH with an 8x8 1-bpp DIB: color table entry 0 is
         * the background, entry 1 the foreground.
         */
        private void monoBrush(int handle, Brush brush) throws EMFEncodingException {
            final int fieldsSize = 6 * Integer.BYTES;
            final int colorTableSize = 2 * Integer.BYTES;
            final int rowStride = Integer.BYTES; // rows are DWORD-aligned
            final int bitsSize = 8 * rowStride;
            final int offBmi = RECORD_HEADER_SIZE + fieldsSize;
            final int cbBmi = BITMAPINFOHEADER_SIZE + colorTableSize;

            int start = beginRecord(EMR_CREATEMONOBRUSH);
            out.writeDWord(handle);
            out.writeDWord(DIB_RGB_COLORS);
            out.writeDWord(offBmi);
            out.writeDWord(cbBmi);
            out.writeDWord(offBmi + cbBmi);
            out.writeDWord(bitsSize);

            out.writeDWord(BITMAPINFOHEADER_SIZE);
            out.writeDWord(8); // biWidth
            out.writeDWord(8); // biHeight, bottom-up
            out.writeWord((short) 1); // biPlanes
            out.writeWord((short) 1); // biBitCount
            out.writeDWord(0); // BI_RGB
            out.writeDWord(bitsSize);
            out.writeDWord(0);
            out.writeDWord(0);
            out.writeDWord(2); // biClrUsed
            out.writeDWord(0);

            rgbQuad(brush.background());
            rgbQuad(brush.color());

            byte[] rows = brush.pattern().rows();
            for (int row = rows.length - 1; row >= 0; row--) {
                out.write(rows[row]);
                out.write(new byte[rowStride - 1]);
            }
            endRecord(start);
        }

        private void rgbQuad(int rgb) throws EMFEncodingException {
            out.write((byte) rgb);
            out.write((byte) (rgb >> 8));
            out.write((byte) (rgb >> 16));
            out.write(LittleEndianOutput.NUL);
        }

        byte[] finish() throws EMFEncodingException {
            int start = beginRecord(EMR_EOF);
            out.writeDWord(0);  // nPalEntries
            out.writeDWord(16); // offPalEntries
            out.writeDWord(EOF_RECORD_SIZE);
            endRecord(start);

            out.putDWord(HEADER_BYTES_OFFSET, out.position());
            out.putDWord(HEADER_RECORDS_OFFSET, numRecords);
            out.putWord(HEADER_HANDLES_OFFSET, (short) nextHandle);
            return out.toByteArray();
        }

        private int round(double value) throws EMFEncodingException {
            return toInt(Math.round(value * scale), value);
        }

        private int floor(double value) throws EMFEncodingException {
            return toInt((long) Math.floor(value * scale), value);
        }

        private int ceil(double value) throws EMFEncodingException {
            return toInt((long) Math.ceil(value * scale), value);
        }

        private int toInt(long logical, double value) throws EMFEncodingException {
            if (Double.isNaN(value) || logical < Integer.MIN_VALUE || logical > Integer.MAX_VALUE)
                throw new EMFEncodingException(Reason.UNSUPPORTED_RECORD,
                        "Coordinate out of range: " + value);

            return (int) logical;
        }

    } // class Encoding


}
