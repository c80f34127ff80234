///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;

import static org.scharp.fits.BigEndianUtil.read2;
import static org.scharp.fits.BigEndianUtil.read4;
import static org.scharp.fits.BigEndianUtil.read8;
import static org.scharp.fits.BigEndianUtil.write2;
import static org.scharp.fits.BigEndianUtil.write4;
import static org.scharp.fits.BigEndianUtil.write8;

/**
 * An {@link ArrayDataIO} that keeps its contents in memory.
 * <p>
 * Writing past the end of the contents extends them.  Seeking past the end is allowed; the gap is filled with zeros
 * if something is later written after it.
 * </p>
 * <p>
 * Once this stream is closed, all operations except {@code close()} fail with an {@link IOException}.  As with the
 * other classes in this library, this class is not thread-safe, although closing the stream from another thread makes
 * any further transfer fail.
 * </p>
 */
public final class ByteArrayDataIO implements ArrayDataIO {

    private static final int INITIAL_CAPACITY = FitsUtil.BLOCK_SIZE;

    private byte[] data;
    private int length;
    private int position;
    private volatile boolean closed;

    /**
     * Creates an empty stream for writing.
     */
    public ByteArrayDataIO() {
        data = new byte[INITIAL_CAPACITY];
        length = 0;
        position = 0;
        closed = false;
    }

    /**
     * Creates a stream for reading the given contents.  The position is at the start of the contents.
     *
     * @param contents
     *     The contents of the stream.  This is copied.
     *
     * @throws NullPointerException
     *     if {@code contents} is {@code null}.
     */
    public ByteArrayDataIO(byte[] contents) {
        ArgumentUtil.checkNotNull(contents, "contents");
        data = contents.clone();
        length = contents.length;
        position = 0;
        closed = false;
    }

    /**
     * Gets a copy of everything that was written to this stream, or that it was created with.
     *
     * @return A new array.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, length);
    }

    /**
     * Gets the number of bytes in this stream.
     *
     * @return The length of the contents.
     */
    public long length() {
        return length;
    }

    private void checkOpen() throws IOException {
        if (closed) {
            throw new IOException("stream is closed");
        }
    }

    /**
     * Checks that {@code count} elements of {@code elementSize} bytes can be read from the current position.
     *
     * @return the number of bytes to read
     */
    private int prepareRead(int bufferLength, int offset, int count, int elementSize) throws IOException {
        checkOpen();
        ArgumentUtil.checkSlice(bufferLength, offset, count);

        final long byteCount = (long) count * elementSize;
        if (length - position < byteCount) {
            throw new EOFException(
                "cannot read " + byteCount + " bytes at position " + position + ", only " +
                    Math.max(0, length - position) + " remain");
        }
        return (int) byteCount;
    }

    /**
     * Makes room for {@code count} elements of {@code elementSize} bytes at the current position.
     *
     * @return the number of bytes to write
     */
    private int prepareWrite(int bufferLength, int offset, int count, int elementSize) throws IOException {
        checkOpen();
        ArgumentUtil.checkSlice(bufferLength, offset, count);

        final long byteCount = (long) count * elementSize;
        final long end = position + byteCount;
        if (Integer.MAX_VALUE - 8 < end) {
            throw new IOException("cannot hold more than " + (Integer.MAX_VALUE - 8) + " bytes in memory");
        }
        if (data.length < end) {
            data = Arrays.copyOf(data, (int) Math.min(Integer.MAX_VALUE - 8, Math.max(end, 2L * data.length)));
        }
        return (int) byteCount;
    }

    private void finishWrite() {
        length = Math.max(length, position);
    }

    @Override
    public int read(byte[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 1);
        System.arraycopy(data, position, buffer, offset, count);
        position += byteCount;
        return byteCount;
    }

    @Override
    public int read(short[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 2);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = read2(data, position);
            position += 2;
        }
        return byteCount;
    }

    @Override
    public int read(int[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 4);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = read4(data, position);
            position += 4;
        }
        return byteCount;
    }

    @Override
    public int read(long[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 8);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = read8(data, position);
            position += 8;
        }
        return byteCount;
    }

    @Override
    public int read(float[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 4);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = Float.intBitsToFloat(read4(data, position));
            position += 4;
        }
        return byteCount;
    }

    @Override
    public int read(double[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 8);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = Double.longBitsToDouble(read8(data, position));
            position += 8;
        }
        return byteCount;
    }

    @Override
    public int read(boolean[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 1);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = data[position] == 'T';
            position++;
        }
        return byteCount;
    }

    @Override
    public int read(char[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareRead(buffer.length, offset, count, 1);
        for (int i = offset; i < offset + count; i++) {
            buffer[i] = (char) (data[position] & 0xFF);
            position++;
        }
        return byteCount;
    }

    @Override
    public int write(byte[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 1);
        System.arraycopy(buffer, offset, data, position, count);
        position += byteCount;
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(short[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 2);
        for (int i = offset; i < offset + count; i++) {
            position += write2(data, position, buffer[i]);
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(int[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 4);
        for (int i = offset; i < offset + count; i++) {
            position += write4(data, position, buffer[i]);
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(long[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 8);
        for (int i = offset; i < offset + count; i++) {
            position += write8(data, position, buffer[i]);
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(float[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 4);
        for (int i = offset; i < offset + count; i++) {
            position += write4(data, position, Float.floatToRawIntBits(buffer[i]));
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(double[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 8);
        for (int i = offset; i < offset + count; i++) {
            position += write8(data, position, Double.doubleToRawLongBits(buffer[i]));
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(boolean[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 1);
        for (int i = offset; i < offset + count; i++) {
            data[position] = (byte) (buffer[i] ? 'T' : 'F');
            position++;
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public int write(char[] buffer, int offset, int count) throws IOException {
        final int byteCount = prepareWrite(buffer.length, offset, count, 1);
        for (int i = offset; i < offset + count; i++) {
            data[position] = (byte) buffer[i];
            position++;
        }
        finishWrite();
        return byteCount;
    }

    @Override
    public long seek(long relativeOffset) throws IOException {
        checkOpen();
        final long newPosition = position + relativeOffset;
        if (newPosition < 0) {
            throw new IOException("cannot seek to " + newPosition + ", which is before the start of the stream");
        }
        if (Integer.MAX_VALUE - 8 < newPosition) {
            throw new IOException("cannot seek to " + newPosition + ", which is beyond what can be held in memory");
        }
        position = (int) newPosition;
        return position;
    }

    @Override
    public long position() throws IOException {
        checkOpen();
        return position;
    }

    @Override
    public void flush() throws IOException {
        checkOpen();
    }

    @Override
    public void close() {
        closed = true;
    }
}
