///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Thrown when a header card cannot be built because its keyword, value, or comment violates the layout of an
 * 80-character FITS card.
 */
public class HeaderCardException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with the given message.
     *
     * @param message
     *     A description of the problem.
     */
    public HeaderCardException(String message) {
        super(message);
    }
}
