///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * The type of the elements of a column in a {@link ColumnTable}.
 * <p>
 * Each type knows the Java primitive that holds its values in memory, the number of bytes that a value occupies in a
 * FITS binary table, and how to move values of that type through an {@link ArrayDataIO}.
 * </p>
 */
public enum PrimitiveType {

    /** 8-bit integers, held in a {@code byte[]}. */
    BYTE(byte.class, 1) {
        @Override
        Object newArray(int length) {
            return new byte[length];
        }

        @Override
        int length(Object array) {
            return ((byte[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((byte[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((byte[]) array, offset, count);
        }
    },

    /** 16-bit integers, held in a {@code short[]}. */
    SHORT(short.class, 2) {
        @Override
        Object newArray(int length) {
            return new short[length];
        }

        @Override
        int length(Object array) {
            return ((short[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((short[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((short[]) array, offset, count);
        }
    },

    /** 32-bit integers, held in an {@code int[]}. */
    INT(int.class, 4) {
        @Override
        Object newArray(int length) {
            return new int[length];
        }

        @Override
        int length(Object array) {
            return ((int[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((int[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((int[]) array, offset, count);
        }
    },

    /** 64-bit integers, held in a {@code long[]}. */
    LONG(long.class, 8) {
        @Override
        Object newArray(int length) {
            return new long[length];
        }

        @Override
        int length(Object array) {
            return ((long[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((long[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((long[]) array, offset, count);
        }
    },

    /** Single precision floating point values, held in a {@code float[]}. */
    FLOAT(float.class, 4) {
        @Override
        Object newArray(int length) {
            return new float[length];
        }

        @Override
        int length(Object array) {
            return ((float[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((float[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((float[]) array, offset, count);
        }
    },

    /** Double precision floating point values, held in a {@code double[]}. */
    DOUBLE(double.class, 8) {
        @Override
        Object newArray(int length) {
            return new double[length];
        }

        @Override
        int length(Object array) {
            return ((double[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((double[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((double[]) array, offset, count);
        }
    },

    /** Logical values, held in a {@code boolean[]}. */
    BOOLEAN(boolean.class, 1) {
        @Override
        Object newArray(int length) {
            return new boolean[length];
        }

        @Override
        int length(Object array) {
            return ((boolean[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((boolean[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((boolean[]) array, offset, count);
        }
    },

    /** Single-byte characters, held in a {@code char[]}. */
    CHAR(char.class, 1) {
        @Override
        Object newArray(int length) {
            return new char[length];
        }

        @Override
        int length(Object array) {
            return ((char[]) array).length;
        }

        @Override
        int read(ArrayDataIO input, Object array, int offset, int count) throws IOException {
            return input.read((char[]) array, offset, count);
        }

        @Override
        int write(ArrayDataIO output, Object array, int offset, int count) throws IOException {
            return output.write((char[]) array, offset, count);
        }
    };

    private final Class<?> elementClass;
    private final int elementSize;

    PrimitiveType(Class<?> elementClass, int elementSize) {
        this.elementClass = elementClass;
        this.elementSize = elementSize;
    }

    /**
     * Gets the Java primitive class that holds values of this type.
     *
     * @return A primitive class, such as {@code int.class}.
     */
    public Class<?> elementClass() {
        return elementClass;
    }

    /**
     * Gets the number of bytes that a value of this type occupies in a binary table.
     *
     * @return The size of one element in bytes.
     */
    public int elementSize() {
        return elementSize;
    }

    /**
     * Determines the type of the elements in an array.
     *
     * @param array
     *     An object that may be an array.
     *
     * @return The type of the elements in {@code array}, or {@code null} if {@code array} is not a one-dimensional
     *     array of a primitive type.
     */
    public static PrimitiveType forArray(Object array) {
        if (array == null || !array.getClass().isArray()) {
            return null;
        }

        Class<?> componentType = array.getClass().getComponentType();
        for (PrimitiveType type : values()) {
            if (type.elementClass == componentType) {
                return type;
            }
        }
        return null;
    }

    /**
     * Creates an array of this type.
     *
     * @param length
     *     The number of elements.
     *
     * @return A new array whose elements are all zero (or {@code false}).
     */
    abstract Object newArray(int length);

    /**
     * Gets the number of elements in an array of this type.
     *
     * @param array
     *     An array of this type.
     *
     * @return The length of {@code array}.
     */
    abstract int length(Object array);

    /**
     * Copies an array of this type.
     *
     * @param array
     *     The array to copy.  This must be an array of this type.
     *
     * @return A new array with the same elements.
     */
    Object copyOf(Object array) {
        assert forArray(array) == this : "wrong array type";

        int length = length(array);
        Object copy = newArray(length);
        System.arraycopy(array, 0, copy, 0, length);
        return copy;
    }

    /**
     * Reads {@code count} elements into an array of this type.
     *
     * @return The number of bytes read.
     */
    abstract int read(ArrayDataIO input, Object array, int offset, int count) throws IOException;

    /**
     * Writes {@code count} elements from an array of this type.
     *
     * @return The number of bytes written.
     */
    abstract int write(ArrayDataIO output, Object array, int offset, int count) throws IOException;
}
