///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * The data of a FITS binary table, held column by column.
 * <p>
 * Each column is a one-dimensional primitive array.  A column contributes a fixed number of elements, its "row width",
 * to every row, so a column with {@code n} rows and a row width of {@code w} holds {@code n * w} elements.  All columns
 * of a table have the same number of rows.
 * </p>
 * <p>
 * A table never shares its arrays with its caller.  Arrays that are given to a table are copied, and arrays that are
 * returned by a table are copies.  Every operation that can fail validates its arguments before it changes anything,
 * so a failed operation leaves the table as it was.
 * </p>
 * <pre>
 * ColumnTable table = new ColumnTable(
 *     new Object[] { new int[] { 1, 2, 3 }, new double[] { 1.5, 2.5, 3.5, 4.5, 5.5, 6.5 } },
 *     new int[] { 1, 2 });
 *
 * table.addRow(new Object[] { new int[] { 4 }, new double[] { 7.5, 8.5 } });
 *
 * try (ByteArrayDataIO output = new ByteArrayDataIO()) {
 *     table.write(output);
 *     byte[] data = output.toByteArray();
 * }
 * </pre>
 * <p>
 * On disk, the rows are written one after another, and within a row, the columns are written in order.  All values
 * are big-endian.
 * </p>
 * <p>
 * This class is not thread-safe.
 * </p>
 */
public final class ColumnTable {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnTable.class);

    /** The size of the I/O buffer for which {@link #chunk()} is computed. */
    static final int BUFFER_SIZE = 65536;

    private List<Column> columns;
    private int rowCount;
    private int rowSizeBytes;
    private int chunk;

    /**
     * Constructs a table with no columns and no rows.  The first call to {@link #addRow} or {@link #addColumn} defines
     * its shape.
     */
    public ColumnTable() {
        install(new ArrayList<>(), 0);
    }

    /**
     * Constructs a table from its columns.
     *
     * @param columnArrays
     *     The columns.  Each must be a one-dimensional array of {@code byte}, {@code short}, {@code int},
     *     {@code long}, {@code float}, {@code double}, {@code boolean}, or {@code char}.  The arrays are copied.
     * @param rowWidths
     *     The number of elements that each column contributes to a row.
     *
     * @throws NullPointerException
     *     if {@code columnArrays} or {@code rowWidths} is {@code null}.
     * @throws TableException
     *     if the number of columns and row widths differ, if a column is not a supported array, if a row width is
     *     negative or doesn't divide the length of its column, or if the columns don't have the same number of rows.
     */
    public ColumnTable(Object[] columnArrays, int[] rowWidths) {
        ArgumentUtil.checkNotNull(columnArrays, "columnArrays");
        ArgumentUtil.checkNotNull(rowWidths, "rowWidths");

        if (columnArrays.length != rowWidths.length) {
            throw new TableException(
                "there are " + columnArrays.length + " columns but " + rowWidths.length + " row widths");
        }

        List<Column> newColumns = new ArrayList<>(columnArrays.length);
        int ratio = 0;
        for (int i = 0; i < columnArrays.length; i++) {
            Column column = newColumn(columnArrays[i], rowWidths[i], i);
            ratio = checkColumnConsistency(column, ratio, i);
            newColumns.add(column);
        }

        install(newColumns, ratio);
    }

    /**
     * Creates a column from a caller's array, copying the array.
     */
    private static Column newColumn(Object array, int rowWidth, int index) {
        PrimitiveType type = PrimitiveType.forArray(array);
        if (type == null) {
            throw new TableException(
                "column " + index + " is a " + describe(array) +
                    ", not a one-dimensional array of a primitive type");
        }
        if (rowWidth < 0) {
            throw new TableException("the row width of column " + index + " must not be negative");
        }
        return new Column(type, type.copyOf(array), rowWidth);
    }

    /**
     * Checks that a column's length agrees with its row width and with the number of rows of the other columns.
     *
     * @param column
     *     The column to check.
     * @param ratio
     *     The number of rows of the other columns, or 0 if no other column determines it.
     * @param index
     *     The index of the column, for the exception message.
     *
     * @return The number of rows that the table has with this column.
     */
    private static int checkColumnConsistency(Column column, int ratio, int index) {
        final int length = column.length();
        final int rowWidth = column.rowWidth();

        if ((length == 0) != (rowWidth == 0)) {
            throw new TableException(
                "column " + index + " has " + length + " elements but a row width of " + rowWidth);
        }
        if (rowWidth == 0) {
            return ratio;
        }
        if (length % rowWidth != 0) {
            throw new TableException(
                "the row width " + rowWidth + " of column " + index + " does not divide its " + length + " elements");
        }

        final int columnRows = length / rowWidth;
        if (ratio != 0 && columnRows != ratio) {
            throw new TableException(
                "column " + index + " has " + columnRows + " rows but the other columns have " + ratio);
        }
        return columnRows;
    }

    /**
     * Makes {@code newColumns} the columns of this table and recomputes everything that derives from them.
     */
    private void install(List<Column> newColumns, int newRowCount) {
        long newRowSize = 0;
        for (Column column : newColumns) {
            newRowSize += column.rowSizeBytes();
        }
        if (Integer.MAX_VALUE < newRowSize) {
            throw new TableException("a row of " + newRowSize + " bytes is too large");
        }

        columns = newColumns;
        rowCount = newRowCount;
        rowSizeBytes = (int) newRowSize;
        chunk = computeChunk(rowSizeBytes, rowCount);

        assert columns.stream().allMatch(c -> c.length() == rowCount * c.rowWidth()) : "inconsistent columns";
        LOG.debug("table has {} columns, {} rows, and {} bytes per row", columns.size(), rowCount, rowSizeBytes);
    }

    /**
     * Computes how many whole rows fit in the I/O buffer.
     *
     * @param rowSizeBytes
     *     The number of bytes in a row.
     * @param rowCount
     *     The number of rows in the table.
     *
     * @return 0 if rows are empty, 1 if a row is larger than the buffer, {@code rowCount} if the whole table fits, and
     *     otherwise the number of rows that fit plus one.
     */
    static int computeChunk(int rowSizeBytes, int rowCount) {
        if (rowSizeBytes == 0) {
            return 0;
        }
        if (BUFFER_SIZE < rowSizeBytes) {
            return 1;
        }

        final int rowsPerBuffer = BUFFER_SIZE / rowSizeBytes;
        return rowCount <= rowsPerBuffer ? rowCount : rowsPerBuffer + 1;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getTypeName();
    }

    private void checkColumnIndex(int columnIndex) {
        if (columnIndex < 0 || columns.size() <= columnIndex) {
            throw new IndexOutOfBoundsException(
                "column " + columnIndex + " is out of range for a table with " + columns.size() + " columns");
        }
    }

    private void checkRowIndex(int rowIndex) {
        if (rowIndex < 0 || rowCount <= rowIndex) {
            throw new IndexOutOfBoundsException(
                "row " + rowIndex + " is out of range for a table with " + rowCount + " rows");
        }
    }

    /**
     * Checks that {@code slice} can be one row of a column.
     */
    private void checkSlice(int columnIndex, Object slice) {
        Column column = columns.get(columnIndex);
        PrimitiveType type = PrimitiveType.forArray(slice);
        if (type != column.type()) {
            throw new TableException(
                "column " + columnIndex + " holds " + column.type() + " values but a " + describe(slice) +
                    " was given");
        }

        int length = type.length(slice);
        if (length != column.rowWidth()) {
            throw new TableException(
                "column " + columnIndex + " has a row width of " + column.rowWidth() + " but " + length +
                    " elements were given");
        }
    }

    /**
     * Gets the number of rows in this table.
     *
     * @return The number of rows.
     */
    public int rowCount() {
        return rowCount;
    }

    /**
     * Gets the number of columns in this table.
     *
     * @return The number of columns.
     */
    public int columnCount() {
        return columns.size();
    }

    /**
     * Gets the number of elements that a column contributes to each row.
     *
     * @param columnIndex
     *     The index of the column.
     *
     * @return The column's row width.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code columnIndex} is out of range.
     */
    public int rowWidth(int columnIndex) {
        checkColumnIndex(columnIndex);
        return columns.get(columnIndex).rowWidth();
    }

    /**
     * Gets the type of a column's elements.
     *
     * @param columnIndex
     *     The index of the column.
     *
     * @return The column's type.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code columnIndex} is out of range.
     */
    public PrimitiveType columnType(int columnIndex) {
        checkColumnIndex(columnIndex);
        return columns.get(columnIndex).type();
    }

    /**
     * Gets the number of bytes that one row occupies in a binary table.
     *
     * @return The row size in bytes.
     */
    public int rowSizeBytes() {
        return rowSizeBytes;
    }

    /**
     * Gets the number of rows that should be transferred at a time when buffering this table's I/O through a
     * 65536-byte buffer.
     *
     * @return The chunk size in rows.
     */
    public int chunk() {
        return chunk;
    }

    /**
     * Gets the number of bytes that this table occupies in a binary table, before padding.
     *
     * @return the size of the data in bytes.
     */
    public long trueSize() {
        return (long) rowSizeBytes * rowCount;
    }

    /**
     * Gets the number of bytes that this table occupies in a FITS file, including the padding to a block boundary.
     *
     * @return the padded size in bytes.
     */
    public long paddedSize() {
        return FitsUtil.paddedSize(trueSize());
    }

    /**
     * Gets a copy of a column.
     *
     * @param columnIndex
     *     The index of the column.
     *
     * @return A new array holding the column's elements.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code columnIndex} is out of range.
     */
    public Object getColumn(int columnIndex) {
        checkColumnIndex(columnIndex);
        return columns.get(columnIndex).copyOfData();
    }

    /**
     * Replaces a column.  The column keeps its row width.
     * <p>
     * If the new array has a different type or length than the old one, the table is validated as if it were being
     * constructed with the new array.
     * </p>
     *
     * @param columnIndex
     *     The index of the column.
     * @param array
     *     The column's new elements.  This is copied.
     *
     * @throws NullPointerException
     *     if {@code array} is {@code null}.
     * @throws IndexOutOfBoundsException
     *     if {@code columnIndex} is out of range.
     * @throws TableException
     *     if {@code array} isn't a supported array or if it doesn't have the same number of rows as the other
     *     columns.
     */
    public void setColumn(int columnIndex, Object array) {
        checkColumnIndex(columnIndex);
        ArgumentUtil.checkNotNull(array, "array");

        Column oldColumn = columns.get(columnIndex);
        Column newColumn = newColumn(array, oldColumn.rowWidth(), columnIndex);
        if (newColumn.type() == oldColumn.type() && newColumn.length() == oldColumn.length()) {
            columns.set(columnIndex, newColumn);
            return;
        }

        List<Column> newColumns = new ArrayList<>(columns);
        newColumns.set(columnIndex, newColumn);
        int ratio = 0;
        for (int i = 0; i < newColumns.size(); i++) {
            ratio = checkColumnConsistency(newColumns.get(i), ratio, i);
        }

        LOG.debug("replaced column {} with {} {} elements", columnIndex, newColumn.length(), newColumn.type());
        install(newColumns, ratio);
    }

    /**
     * Adds a column after the last one.
     *
     * @param array
     *     The column's elements.  This is copied.  Its length must be {@code rowCount() * rowWidth}, unless the table
     *     has no rows, in which case the new column determines the number of rows.
     * @param rowWidth
     *     The number of elements that the column contributes to each row.
     *
     * @throws NullPointerException
     *     if {@code array} is {@code null}.
     * @throws TableException
     *     if {@code array} isn't a supported array or if its length doesn't agree with {@code rowWidth} and the
     *     number of rows.
     */
    public void addColumn(Object array, int rowWidth) {
        ArgumentUtil.checkNotNull(array, "array");

        final int columnIndex = columns.size();
        Column column = newColumn(array, rowWidth, columnIndex);
        int newRowCount = checkColumnConsistency(column, rowCount, columnIndex);

        List<Column> newColumns = new ArrayList<>(columns);
        newColumns.add(column);

        LOG.debug("added {} column with a row width of {}", column.type(), rowWidth);
        install(newColumns, newRowCount);
    }

    /**
     * Adds a row after the last one.
     * <p>
     * If the table has no columns, the row defines them: each element of {@code row} becomes a column whose row width
     * is the length of the element.
     * </p>
     * <p>
     * If every column has a row width of 0, the row has no elements and the table still has no rows afterwards.
     * </p>
     * <p>
     * This copies every column, so it is slow for loading many rows.  Constructing the table from whole columns is
     * faster.
     * </p>
     *
     * @param row
     *     One array per column, each with the type and row width of its column.  The arrays are copied.
     *
     * @throws NullPointerException
     *     if {@code row} is {@code null}.
     * @throws TableException
     *     if {@code row} doesn't have one element per column or if an element doesn't have the type or row width of
     *     its column.
     */
    public void addRow(Object[] row) {
        ArgumentUtil.checkNotNull(row, "row");

        if (columns.isEmpty()) {
            List<Column> newColumns = new ArrayList<>(row.length);
            int ratio = 0;
            for (int i = 0; i < row.length; i++) {
                PrimitiveType type = PrimitiveType.forArray(row[i]);
                Column column = newColumn(row[i], type == null ? 0 : type.length(row[i]), i);
                ratio = checkColumnConsistency(column, ratio, i);
                newColumns.add(column);
            }

            LOG.debug("first row defined {} columns", newColumns.size());
            install(newColumns, ratio);
            return;
        }

        if (row.length != columns.size()) {
            throw new TableException(
                "row has " + row.length + " elements but the table has " + columns.size() + " columns");
        }
        for (int i = 0; i < row.length; i++) {
            checkSlice(i, row[i]);
        }

        List<Column> newColumns = new ArrayList<>(columns.size());
        for (int i = 0; i < row.length; i++) {
            newColumns.add(columns.get(i).withRowAppended(row[i]));
        }

        // The number of rows of a table whose columns are all zero-width is always 0.
        install(newColumns, rowSizeBytes == 0 ? 0 : rowCount + 1);
    }

    /**
     * Gets the elements that a column has in one row.
     *
     * @param rowIndex
     *     The index of the row.
     * @param columnIndex
     *     The index of the column.
     *
     * @return A new array with {@code rowWidth(columnIndex)} elements.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code rowIndex} or {@code columnIndex} is out of range.
     */
    public Object getElement(int rowIndex, int columnIndex) {
        checkRowIndex(rowIndex);
        checkColumnIndex(columnIndex);
        return columns.get(columnIndex).getSlice(rowIndex);
    }

    /**
     * Sets the elements that a column has in one row.
     *
     * @param rowIndex
     *     The index of the row.
     * @param columnIndex
     *     The index of the column.
     * @param value
     *     An array with the column's type and {@code rowWidth(columnIndex)} elements.  This is copied.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code rowIndex} or {@code columnIndex} is out of range.
     * @throws TableException
     *     if {@code value} doesn't have the type or row width of the column.
     */
    public void setElement(int rowIndex, int columnIndex, Object value) {
        checkRowIndex(rowIndex);
        checkColumnIndex(columnIndex);
        checkSlice(columnIndex, value);
        columns.get(columnIndex).setSlice(rowIndex, value);
    }

    /**
     * Gets all elements of one row.
     *
     * @param rowIndex
     *     The index of the row.
     *
     * @return A new array with one element per column, as returned by {@link #getElement}.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code rowIndex} is out of range.
     */
    public Object[] getRow(int rowIndex) {
        checkRowIndex(rowIndex);

        Object[] row = new Object[columns.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = columns.get(i).getSlice(rowIndex);
        }
        return row;
    }

    /**
     * Sets all elements of one row.  Either every column is changed or, if any element is invalid, none is.
     *
     * @param rowIndex
     *     The index of the row.
     * @param values
     *     One array per column, as given to {@link #setElement}.  The arrays are copied.
     *
     * @throws NullPointerException
     *     if {@code values} is {@code null}.
     * @throws IndexOutOfBoundsException
     *     if {@code rowIndex} is out of range.
     * @throws TableException
     *     if {@code values} doesn't have one element per column or if an element doesn't have the type or row width
     *     of its column.
     */
    public void setRow(int rowIndex, Object[] values) {
        checkRowIndex(rowIndex);
        ArgumentUtil.checkNotNull(values, "values");

        if (values.length != columns.size()) {
            throw new TableException(
                "row has " + values.length + " elements but the table has " + columns.size() + " columns");
        }
        for (int i = 0; i < values.length; i++) {
            checkSlice(i, values[i]);
        }

        for (int i = 0; i < values.length; i++) {
            columns.get(i).setSlice(rowIndex, values[i]);
        }
    }

    /**
     * Reads every row of this table from a stream, replacing the table's elements.
     *
     * @param input
     *     The stream to read from.
     *
     * @return The number of bytes read.
     *
     * @throws NullPointerException
     *     if {@code input} is {@code null}.
     * @throws IOException
     *     if the stream couldn't be read, including if it ends before the table is full.
     */
    public long read(ArrayDataIO input) throws IOException {
        ArgumentUtil.checkNotNull(input, "input");

        long bytesRead = 0;
        for (int row = 0; row < rowCount; row++) {
            for (Column column : columns) {
                bytesRead += column.read(input, row);
            }
        }

        LOG.debug("read {} rows ({} bytes)", rowCount, bytesRead);
        return bytesRead;
    }

    /**
     * Writes every row of this table to a stream.
     *
     * @param output
     *     The stream to write to.
     *
     * @return The number of bytes written.
     *
     * @throws NullPointerException
     *     if {@code output} is {@code null}.
     * @throws IOException
     *     if the stream couldn't be written.
     */
    public long write(ArrayDataIO output) throws IOException {
        ArgumentUtil.checkNotNull(output, "output");

        if (rowSizeBytes == 0) {
            return 0;
        }

        long bytesWritten = 0;
        for (int row = 0; row < rowCount; row++) {
            for (Column column : columns) {
                bytesWritten += column.write(output, row);
            }
        }

        LOG.debug("wrote {} rows ({} bytes)", rowCount, bytesWritten);
        return bytesWritten;
    }
}
