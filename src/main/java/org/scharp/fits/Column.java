///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.io.IOException;

/**
 * One column of a {@link ColumnTable}: a primitive array that holds {@code rowWidth} consecutive elements for each
 * row.
 * <p>
 * The array is owned by this object.  Only the elements of the array change; growing the column creates a new
 * {@code Column}.
 * </p>
 */
final class Column {

    private final PrimitiveType type;
    private final Object data;
    private final int rowWidth;

    /**
     * Constructs a column without doing any parameter validation.
     *
     * @param type
     *     The type of {@code data}.
     * @param data
     *     The column's values, which are not copied.
     * @param rowWidth
     *     The number of elements in each row.
     */
    Column(PrimitiveType type, Object data, int rowWidth) {
        assert PrimitiveType.forArray(data) == type : "data is not an array of " + type;
        this.type = type;
        this.data = data;
        this.rowWidth = rowWidth;
    }

    PrimitiveType type() {
        return type;
    }

    int rowWidth() {
        return rowWidth;
    }

    int length() {
        return type.length(data);
    }

    /**
     * Gets the number of bytes that one row of this column occupies in a binary table.
     *
     * @return The row size in bytes.
     */
    long rowSizeBytes() {
        return (long) rowWidth * type.elementSize();
    }

    Object copyOfData() {
        return type.copyOf(data);
    }

    /**
     * Copies out the elements of one row.
     *
     * @param row
     *     The row.
     *
     * @return A new array of {@code rowWidth} elements.
     */
    Object getSlice(int row) {
        Object slice = type.newArray(rowWidth);
        System.arraycopy(data, row * rowWidth, slice, 0, rowWidth);
        return slice;
    }

    /**
     * Overwrites the elements of one row.
     *
     * @param row
     *     The row.
     * @param slice
     *     An array of this column's type with {@code rowWidth} elements.
     */
    void setSlice(int row, Object slice) {
        assert type.length(slice) == rowWidth;
        System.arraycopy(slice, 0, data, row * rowWidth, rowWidth);
    }

    /**
     * Creates a copy of this column with one more row at the end.
     *
     * @param slice
     *     The elements of the new row.  This must be an array of this column's type with {@code rowWidth} elements.
     *
     * @return A new column.
     */
    Column withRowAppended(Object slice) {
        assert type.length(slice) == rowWidth;

        final int length = length();
        Object grown = type.newArray(length + rowWidth);
        System.arraycopy(data, 0, grown, 0, length);
        System.arraycopy(slice, 0, grown, length, rowWidth);
        return new Column(type, grown, rowWidth);
    }

    int read(ArrayDataIO input, int row) throws IOException {
        return type.read(input, data, row * rowWidth, rowWidth);
    }

    int write(ArrayDataIO output, int row) throws IOException {
        return type.write(output, data, row * rowWidth, rowWidth);
    }
}
