///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library reads and writes the header cards and binary table data of FITS files.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.fits.HeaderCardCodec} for how cards are read and written, and
 * {@link org.scharp.fits.ColumnTable} for how binary table data is held.
 * </p>
 *
 * <h2>A FITS Primer for Java Programmers</h2>
 *
 * <p>
 * FITS (Flexible Image Transport System) is the standard file format of astronomy.  A FITS file is a sequence of
 * "header and data units" (HDUs).  Each HDU has a header that describes its data, followed by the data itself.  Both
 * are padded to a multiple of 2880 bytes, a size chosen in the 1970s to fit the tape drives of the time.
 * </p>
 *
 * <p>
 * A header is a sequence of "cards", each of which is exactly 80 ASCII characters, like a punched card.  A card has a
 * keyword of at most 8 characters, an optional value, and an optional comment.  The value indicator {@code "= "} must
 * be in columns 9 and 10.  String values are enclosed in single quotes, and a quote within a string is written as two
 * quotes.  The header ends with a card whose keyword is {@code END}.
 * </p>
 * <pre>
 * SIMPLE  =                    T / file conforms to FITS standard
 * OBJECT  = 'Barnard''s Star'   / name of the target
 * COMMENT This card has a keyword but no value.
 * END
 * </pre>
 *
 * <p>
 * Eight characters is not enough for many modern instruments, so the ESO HIERARCH convention allows longer keywords.
 * A HIERARCH card begins with the word {@code HIERARCH}, followed by blank-separated levels of the keyword.  In this
 * library, the keyword of such a card is written with dots between the levels, as in
 * {@code HIERARCH.ESO.TEL.FOCUS}.  Recognizing HIERARCH cards must be requested with
 * {@link org.scharp.fits.KeywordConvention#HIERARCH}.
 * </p>
 *
 * <p>
 * A binary table stores rows of fixed size.  Each column has a primitive type and a repeat count (called the "row
 * width" in this library), so one field can hold a small fixed-length array.  Rows are packed without any padding
 * between the fields, and all numbers are big-endian.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * Cards and tables that are built by a program are checked strictly, and an exception is thrown as soon as possible
 * (fail-fast).  Invalid cards throw a {@link org.scharp.fits.HeaderCardException} and invalid table operations throw a
 * {@link org.scharp.fits.TableException}.  A table operation that fails leaves the table unchanged.
 * </p>
 * <p>
 * Cards that are read from a file are parsed leniently, since a file that was written by another program should still
 * be readable.  A card that cannot be understood is kept as a comment and a warning is logged.
 * </p>
 */
package org.scharp.fits;
