///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;

/**
 * An ordered binary stream that reads and writes slices of primitive arrays in the byte order of FITS files.
 * <p>
 * All numeric values are big-endian, using two's complement for integers and IEEE 754 for floating point values. A
 * {@code boolean} occupies one byte, which is {@code 'T'} for {@code true} and {@code 'F'} for {@code false}. A
 * {@code char} occupies one byte (ISO-8859-1).
 * </p>
 * <p>
 * Every {@code read} and {@code write} method transfers {@code count} elements from/to {@code buffer}, starting with
 * the element at {@code offset}, and returns the number of bytes that were transferred.
 * </p>
 */
public interface ArrayDataIO extends Closeable {

    /**
     * Reads bytes.
     *
     * @param buffer
     *     the array to fill
     * @param offset
     *     the index of the first element to fill
     * @param count
     *     the number of elements to fill
     *
     * @return the number of bytes read
     *
     * @throws EOFException
     *     if the stream ends before {@code count} elements are read.
     * @throws IOException
     *     if the stream could not be read.
     */
    int read(byte[] buffer, int offset, int count) throws IOException;

    /**
     * Reads 16-bit integers.
     *
     * @param buffer
     *     the array to fill
     * @param offset
     *     the index of the first element to fill
     * @param count
     *     the number of elements to fill
     *
     * @return the number of bytes read
     *
     * @throws IOException
     *     if the stream could not be read.
     */
    int read(short[] buffer, int offset, int count) throws IOException;

    /** Reads 32-bit integers. See {@link #read(short[], int, int)}. */
    int read(int[] buffer, int offset, int count) throws IOException;

    /** Reads 64-bit integers. See {@link #read(short[], int, int)}. */
    int read(long[] buffer, int offset, int count) throws IOException;

    /** Reads single precision floating point values. See {@link #read(short[], int, int)}. */
    int read(float[] buffer, int offset, int count) throws IOException;

    /** Reads double precision floating point values. See {@link #read(short[], int, int)}. */
    int read(double[] buffer, int offset, int count) throws IOException;

    /** Reads logical values. See {@link #read(short[], int, int)}. */
    int read(boolean[] buffer, int offset, int count) throws IOException;

    /** Reads single-byte characters. See {@link #read(short[], int, int)}. */
    int read(char[] buffer, int offset, int count) throws IOException;

    /**
     * Writes bytes.
     *
     * @param buffer
     *     the array to write from
     * @param offset
     *     the index of the first element to write
     * @param count
     *     the number of elements to write
     *
     * @return the number of bytes written
     *
     * @throws IOException
     *     if the stream could not be written.
     */
    int write(byte[] buffer, int offset, int count) throws IOException;

    /** Writes 16-bit integers. See {@link #write(byte[], int, int)}. */
    int write(short[] buffer, int offset, int count) throws IOException;

    /** Writes 32-bit integers. See {@link #write(byte[], int, int)}. */
    int write(int[] buffer, int offset, int count) throws IOException;

    /** Writes 64-bit integers. See {@link #write(byte[], int, int)}. */
    int write(long[] buffer, int offset, int count) throws IOException;

    /** Writes single precision floating point values. See {@link #write(byte[], int, int)}. */
    int write(float[] buffer, int offset, int count) throws IOException;

    /** Writes double precision floating point values. See {@link #write(byte[], int, int)}. */
    int write(double[] buffer, int offset, int count) throws IOException;

    /** Writes logical values. See {@link #write(byte[], int, int)}. */
    int write(boolean[] buffer, int offset, int count) throws IOException;

    /** Writes single-byte characters. See {@link #write(byte[], int, int)}. */
    int write(char[] buffer, int offset, int count) throws IOException;

    /**
     * Moves the position of the stream.
     *
     * @param relativeOffset
     *     the number of bytes to move, which may be negative.
     *
     * @return the new position
     *
     * @throws IOException
     *     if the new position would be before the start of the stream, or the stream is closed.
     */
    long seek(long relativeOffset) throws IOException;

    /**
     * Gets the position of the stream.
     *
     * @return the number of bytes from the start of the stream.
     *
     * @throws IOException
     *     if the stream is closed.
     */
    long position() throws IOException;

    /**
     * Writes any buffered data.
     *
     * @throws IOException
     *     if the data could not be written.
     */
    void flush() throws IOException;
}
