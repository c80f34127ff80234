package org.scharp.fits;

/**
 * A class for holding utility methods about the layout of FITS files.
 */
public final class FitsUtil {

    /** Every header and data unit in a FITS file is padded to a multiple of this many bytes. */
    public static final int BLOCK_SIZE = 2880;

    // private constructor to prevent anyone from instantiating the class.
    private FitsUtil() {
    }

    /**
     * Computes how many bytes of padding must follow {@code size} bytes so that they end on a block boundary.
     *
     * @param size
     *     The number of bytes before the padding.
     *
     * @return A number between 0 and 2879.
     *
     * @throws IllegalArgumentException
     *     if {@code size} is negative.
     */
    public static int padding(long size) {
        ArgumentUtil.checkNotNegative(size, "size");

        int excess = (int) (size % BLOCK_SIZE);
        return excess == 0 ? 0 : BLOCK_SIZE - excess;
    }

    /**
     * Computes the size of {@code size} bytes after they are padded to a block boundary.
     *
     * @param size
     *     The number of bytes before the padding.
     *
     * @return The smallest multiple of 2880 that is greater than or equal to {@code size}.
     *
     * @throws IllegalArgumentException
     *     if {@code size} is negative.
     */
    public static long paddedSize(long size) {
        return size + padding(size);
    }
}
