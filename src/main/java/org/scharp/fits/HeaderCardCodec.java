///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between {@link HeaderCard} objects and the 80-character card images of a FITS header.
 * <p>
 * A card image has the keyword in columns 0-7, the value indicator {@code "= "} in columns 8-9, and the value and
 * optional comment (introduced by a {@code /}) in columns 10-79.  When the codec's {@link KeywordConvention} is
 * {@link KeywordConvention#HIERARCH}, card images that start with {@code "HIERARCH "} are parsed according to the ESO
 * HIERARCH convention instead.
 * </p>
 * <p>
 * Parsing is lenient, since a header that has already been written must remain readable: a card image that can't be
 * parsed as a key/value pair is returned as a comment card.  The strict counterpart for building new cards is
 * {@link HeaderCard.Builder}.
 * </p>
 * <p>
 * Instances of this class are immutable and hold no state besides their keyword convention.
 * </p>
 */
public final class HeaderCardCodec {

    private static final Logger LOG = LoggerFactory.getLogger(HeaderCardCodec.class);

    /** The number of characters in a card image. */
    public static final int CARD_LENGTH = 80;

    /** A codec that only understands keywords of the FITS standard. */
    public static final HeaderCardCodec STANDARD = new HeaderCardCodec(KeywordConvention.STANDARD);

    /** A codec that also understands HIERARCH keywords. */
    public static final HeaderCardCodec HIERARCH = new HeaderCardCodec(KeywordConvention.HIERARCH);

    private static final String HIERARCH_CARD_PREFIX = "HIERARCH ";

    // The offset of the value indicator and the offset of the value that follows it.
    private static final int VALUE_INDICATOR_OFFSET = 8;
    private static final int VALUE_OFFSET = 10;

    // A string value's closing quote is never before this column.
    private static final int MINIMUM_CLOSING_QUOTE_OFFSET = 19;

    // Fixed-format numeric values end at column 30 (the 29th offset), and comments are started after it.
    private static final int FIXED_VALUE_END = 30;

    // In a HIERARCH card, the column where the value starts if there's enough room.
    private static final int HIERARCH_VALUE_OFFSET = 29;

    private final KeywordConvention keywordConvention;

    /**
     * Creates a codec.
     *
     * @param keywordConvention
     *     Which keywords the codec understands when parsing.
     *
     * @throws NullPointerException
     *     if {@code keywordConvention} is {@code null}.
     */
    public HeaderCardCodec(KeywordConvention keywordConvention) {
        ArgumentUtil.checkNotNull(keywordConvention, "keywordConvention");
        this.keywordConvention = keywordConvention;
    }

    /**
     * Gets the keyword convention that this codec uses when parsing.
     *
     * @return The keyword convention.  This is never {@code null}.
     */
    public KeywordConvention keywordConvention() {
        return keywordConvention;
    }

    /**
     * Parses a card image.
     * <p>
     * This never fails on malformed text.  A string value without its closing quote makes the whole card image a
     * comment card without a keyword.
     * </p>
     *
     * @param cardImage
     *     The card image, which is normally 80 characters long.  Shorter lines are taken as a bare keyword.
     *
     * @return The card. This is never {@code null}.
     *
     * @throws NullPointerException
     *     if {@code cardImage} is {@code null}.
     */
    public HeaderCard parse(String cardImage) {
        ArgumentUtil.checkNotNull(cardImage, "cardImage");

        if (keywordConvention == KeywordConvention.HIERARCH &&
            HIERARCH_CARD_PREFIX.length() < cardImage.length() &&
            cardImage.startsWith(HIERARCH_CARD_PREFIX)) {
            return parseHierarch(cardImage);
        }

        // Treat short lines as a keyword by itself.
        if (cardImage.length() <= VALUE_INDICATOR_OFFSET) {
            String key = cardImage.trim();
            return new HeaderCard(key.isEmpty() ? null : key, null, null, false);
        }

        // A blank keyword means the rest of the card is commentary.
        String key = cardImage.substring(0, VALUE_INDICATOR_OFFSET).trim();
        if (key.isEmpty()) {
            String comment = cardImage.substring(VALUE_INDICATOR_OFFSET).stripTrailing();
            return new HeaderCard(null, null, emptyToNull(comment), false);
        }

        // Without a value indicator, this is a keyword with commentary, like COMMENT or HISTORY.
        if (!cardImage.startsWith("= ", VALUE_INDICATOR_OFFSET)) {
            String comment = cardImage.substring(VALUE_INDICATOR_OFFSET).trim();
            return new HeaderCard(key, null, emptyToNull(comment), false);
        }

        String valueAndComment = cardImage.substring(VALUE_OFFSET).trim();
        if (valueAndComment.isEmpty()) {
            return new HeaderCard(key, "", null, false);
        }

        if (valueAndComment.charAt(0) == '\'') {
            int closingQuote = findClosingQuote(valueAndComment, 1);
            if (closingQuote < 0) {
                LOG.warn("string value of keyword {} has no closing quote, reading the card as a comment", key);
                return new HeaderCard(null, null, emptyToNull(cardImage.stripTrailing()), false);
            }

            String value = unescape(valueAndComment.substring(1, closingQuote)).trim();

            String comment = valueAndComment.substring(closingQuote + 1).trim();
            if (comment.startsWith("/")) {
                comment = comment.substring(1).trim();
            }
            return new HeaderCard(key, value, emptyToNull(comment), true);
        }

        // A literal value is terminated by a '/', which starts the comment.
        int slash = valueAndComment.indexOf('/');
        if (slash < 0) {
            return new HeaderCard(key, valueAndComment, null, false);
        }
        String value = valueAndComment.substring(0, slash).trim();
        String comment = valueAndComment.substring(slash + 1).trim();
        return new HeaderCard(key, value, comment, false);
    }

    /**
     * Parses a HIERARCH card, which has the form
     * <pre>
     * HIERARCH LEVEL1 LEVEL2 ... = value / comment
     * </pre>
     * The keyword of the card is "HIERARCH.LEVEL1.LEVEL2...".
     */
    private static HeaderCard parseHierarch(String cardImage) {
        StringBuilder name = new StringBuilder();
        int position = 0;
        int[] token;
        while ((token = nextToken(cardImage, position)) != null) {
            if (cardImage.charAt(token[0]) == '=') {
                break;
            }
            if (name.length() != 0) {
                name.append('.');
            }
            name.append(cardImage, token[0], token[1]);
            position = token[1];
        }
        String key = name.toString();

        // No value indicator, or nothing after it.
        if (token == null) {
            return new HeaderCard(key, null, null, false);
        }
        int[] valueToken = nextToken(cardImage, token[1]);
        if (valueToken == null) {
            return new HeaderCard(key, null, null, false);
        }

        final int valueStart = valueToken[0];
        if (cardImage.charAt(valueStart) == '\'') {
            int closingQuote = findClosingQuote(cardImage, valueStart + 1);
            if (closingQuote < 0) {
                LOG.warn("string value of keyword {} has no closing quote, ignoring the value", key);
                return new HeaderCard(key, null, null, false);
            }
            String value = unescape(cardImage.substring(valueStart + 1, closingQuote)).trim();
            return new HeaderCard(key, value, commentAfter(cardImage, closingQuote + 1), true);
        }

        String tokenText = cardImage.substring(valueStart, valueToken[1]);
        int slash = tokenText.indexOf('/');
        if (slash == 0) {
            // There's no value, only a comment.
            return new HeaderCard(key, null, emptyToNull(cardImage.substring(valueStart + 1).trim()), false);
        }
        if (0 < slash) {
            String comment = cardImage.substring(valueStart + slash + 1).trim();
            return new HeaderCard(key, tokenText.substring(0, slash), emptyToNull(comment), false);
        }
        return new HeaderCard(key, tokenText, commentAfter(cardImage, valueToken[1]), false);
    }

    /**
     * Finds the next token in a card image.  Tokens are separated by blanks, and an '=' is always a token by itself.
     *
     * @return the start and end offset of the token, or {@code null} if there are no more tokens.
     */
    private static int[] nextToken(String cardImage, int position) {
        int start = position;
        while (start < cardImage.length() && cardImage.charAt(start) == ' ') {
            start++;
        }
        if (cardImage.length() <= start) {
            return null;
        }
        if (cardImage.charAt(start) == '=') {
            return new int[] { start, start + 1 };
        }

        int end = start + 1;
        while (end < cardImage.length() && cardImage.charAt(end) != ' ' && cardImage.charAt(end) != '=') {
            end++;
        }
        return new int[] { start, end };
    }

    /**
     * Gets the comment that follows a value, if the next non-blank character is a '/'.
     */
    private static String commentAfter(String cardImage, int position) {
        for (int i = position; i < cardImage.length(); i++) {
            char c = cardImage.charAt(i);
            if (c == '/') {
                return emptyToNull(cardImage.substring(i + 1).trim());
            }
            if (c != ' ') {
                return null;
            }
        }
        return null;
    }

    /**
     * Finds the quote that ends a string value.  Two consecutive quotes are an escaped quote and do not end the
     * string.
     *
     * @param text
     *     The text to search.
     * @param start
     *     The offset just after the opening quote.
     *
     * @return The offset of the closing quote, or -1 if there is none.
     */
    static int findClosingQuote(String text, int start) {
        for (int i = start; i < text.length(); i++) {
            if (text.charAt(i) == '\'') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    i++; // skip past the escaped quote
                    continue;
                }
                return i;
            }
        }
        return -1;
    }

    /**
     * Undoes the doubled quotes of a string value's text.
     */
    static String unescape(String quotedText) {
        return quotedText.replace("''", "'");
    }

    /**
     * Renders a string value the way it is written in a card: in quotes, with each quote in it doubled.
     */
    static String quote(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }

    private static String emptyToNull(String text) {
        return text.isEmpty() ? null : text;
    }

    /**
     * Formats a card as an 80-character card image.
     * <p>
     * This does not depend on the codec's keyword convention: a card whose keyword has the form
     * {@code HIERARCH.LEVEL1.LEVEL2} is always formatted as a HIERARCH card.
     * </p>
     *
     * @param card
     *     The card to format.
     *
     * @return An 80-character card image.  Text that doesn't fit is truncated.
     *
     * @throws NullPointerException
     *     if {@code card} is {@code null}.
     */
    public String format(HeaderCard card) {
        ArgumentUtil.checkNotNull(card, "card");
        return formatCard(card);
    }

    static String formatCard(HeaderCard card) {
        final String key = card.key();
        if (key != null && HeaderCard.isHierarchKeyword(key)) {
            return formatHierarch(card);
        }

        final String value = card.value();
        final String comment = card.comment();

        StringBuilder builder = new StringBuilder(CARD_LENGTH);
        if (key != null) {
            builder.append(key);
        }
        padTo(builder, VALUE_INDICATOR_OFFSET);

        if (value != null) {
            builder.append("= ");

            if (card.isStringValue()) {
                // Left justify the string inside the quotes.
                builder.append('\'').append(value.replace("'", "''"));
                padTo(builder, MINIMUM_CLOSING_QUOTE_OFFSET);
                builder.append('\'');
                padTo(builder, FIXED_VALUE_END);
            } else {
                // Right justify literals so that they end in column 30.
                padTo(builder, FIXED_VALUE_END - value.length());
                builder.append(value);
            }

            if (comment != null) {
                builder.append(" / ").append(comment);
            }
        } else if (comment != null) {
            // Commentary that looks like a value indicator must be moved so that it isn't read as one.
            if (key != null && comment.startsWith("= ")) {
                builder.append("  ");
            }
            builder.append(comment);
        }

        return fitToCard(builder);
    }

    private static String formatHierarch(HeaderCard card) {
        final String value = card.value();
        final String comment = card.comment();

        StringBuilder builder = new StringBuilder(CARD_LENGTH);
        builder.append(card.key().replace('.', ' '));

        if (value != null) {
            builder.append(" = ");

            final String valueText = card.isStringValue() ? quote(value) : value;

            // Try to align the values without pushing the comment off the card.
            int available = CARD_LENGTH - builder.length() - valueText.length();
            if (comment != null) {
                available -= 3 + comment.length();
            }
            if (0 < available && builder.length() < HIERARCH_VALUE_OFFSET) {
                int padding = Math.min(available, HIERARCH_VALUE_OFFSET - builder.length());
                builder.append(" ".repeat(padding));
                available -= padding;
            }
            if (!card.isStringValue() && 0 < available && valueText.length() < 10) {
                builder.append(" ".repeat(Math.min(available, 10 - valueText.length())));
            }
            builder.append(valueText);
        }

        if (comment != null) {
            // Without a value, the value indicator is still needed to end the keyword.
            builder.append(value == null ? " = / " : " / ").append(comment);
        }

        return fitToCard(builder);
    }

    private static void padTo(StringBuilder builder, int length) {
        if (builder.length() < length) {
            builder.append(" ".repeat(length - builder.length()));
        }
    }

    private static String fitToCard(StringBuilder builder) {
        if (CARD_LENGTH < builder.length()) {
            builder.setLength(CARD_LENGTH);
        } else {
            padTo(builder, CARD_LENGTH);
        }
        return builder.toString();
    }
}
