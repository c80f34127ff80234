package org.scharp.fits;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(long argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if a slice of {@code count} elements that starts at {@code offset} does not fit within an
     * array of {@code arrayLength} elements.
     *
     * @param arrayLength
     *     The length of the array being sliced.
     * @param offset
     *     The index of the first element in the slice.
     * @param count
     *     The number of elements in the slice.
     *
     * @throws IndexOutOfBoundsException
     *     if the slice is not entirely within the array.
     */
    static void checkSlice(int arrayLength, int offset, int count) {
        if (offset < 0 || count < 0 || arrayLength - count < offset) {
            throw new IndexOutOfBoundsException(
                "slice [" + offset + ", " + offset + " + " + count + ") is out of bounds for length " + arrayLength);
        }
    }
}
