///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Thrown when the columns of a {@link ColumnTable} would become inconsistent, for example, when they disagree on the
 * number of rows or when a value of the wrong type or size is given for a column.
 */
public class TableException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message
     *     A description of the problem.
     */
    public TableException(String message) {
        super(message);
    }
}
