///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/** Utility methods for moving numbers in and out of a byte array in the big-endian order of FITS */
final class BigEndianUtil {

    // private constructor to prevent anyone from instantiating the class.
    private BigEndianUtil() {
    }

    /**
     * Writes a two byte numeric value as big endian to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     *
     * @return The number of bytes written.
     */
    static int write2(byte[] data, int offset, short number) {
        data[offset] = (byte) (number >> 8);
        data[offset + 1] = (byte) number;
        return 2;
    }

    /**
     * Writes a four byte numeric value as big endian to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     *
     * @return The number of bytes written.
     */
    static int write4(byte[] data, int offset, int number) {
        data[offset] = (byte) (number >> 24);
        data[offset + 1] = (byte) (number >> 16);
        data[offset + 2] = (byte) (number >> 8);
        data[offset + 3] = (byte) number;
        return 4;
    }

    /**
     * Writes an eight byte numeric value as big endian to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     *
     * @return The number of bytes written.
     */
    static int write8(byte[] data, int offset, long number) {
        data[offset] = (byte) (number >> 56);
        data[offset + 1] = (byte) (number >> 48);
        data[offset + 2] = (byte) (number >> 40);
        data[offset + 3] = (byte) (number >> 32);
        data[offset + 4] = (byte) (number >> 24);
        data[offset + 5] = (byte) (number >> 16);
        data[offset + 6] = (byte) (number >> 8);
        data[offset + 7] = (byte) number;
        return 8;
    }

    /**
     * Reads a two byte big endian numeric value from an array.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset in the array of the first byte.
     *
     * @return The number that was read.
     */
    static short read2(byte[] data, int offset) {
        return (short) ((data[offset] << 8) | (data[offset + 1] & 0xFF));
    }

    /**
     * Reads a four byte big endian numeric value from an array.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset in the array of the first byte.
     *
     * @return The number that was read.
     */
    static int read4(byte[] data, int offset) {
        return (data[offset] << 24) |
            ((data[offset + 1] & 0xFF) << 16) |
            ((data[offset + 2] & 0xFF) << 8) |
            (data[offset + 3] & 0xFF);
    }

    /**
     * Reads an eight byte big endian numeric value from an array.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset in the array of the first byte.
     *
     * @return The number that was read.
     */
    static long read8(byte[] data, int offset) {
        return ((long) read4(data, offset) << 32) | (read4(data, offset + 4) & 0xFFFF_FFFFL);
    }
}
