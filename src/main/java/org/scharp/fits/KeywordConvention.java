///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

/**
 * Which keywords are allowed in a header card.
 */
public enum KeywordConvention {

    /**
     * Only the keywords of the FITS standard: at most 8 characters.
     */
    STANDARD,

    /**
     * Also accept the ESO HIERARCH convention, where a card that starts with {@code HIERARCH } carries a keyword of
     * arbitrary length made of blank-separated levels. Such keywords are represented in Java with the levels joined
     * by dots, for example {@code HIERARCH.TEL.FOCUS}.
     */
    HIERARCH,
}
