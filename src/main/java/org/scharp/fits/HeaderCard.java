///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.HashMap;
import java.util.Objects;

/**
 * One record (card) of a FITS header: an optional keyword, an optional value, and an optional comment.
 * <p>
 * Cards are either parsed from an 80-character card image with {@link HeaderCardCodec#parse(String)}, which is
 * forgiving of malformed text that is already in a file, or built from their parts with a {@link HeaderCard.Builder},
 * which rejects anything that could not be written as a well-formed card:
 * </p>
 *
 * <pre>
 * HeaderCard exposure = HeaderCard.builder().
 *     keyword("EXPTIME").
 *     value(30.0).
 *     comment("exposure time in seconds").
 *     build();
 * </pre>
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a
 * {@code HashMap}.
 * </p>
 */
public final class HeaderCard {

    /** The maximum length of a keyword, unless it follows the HIERARCH convention. */
    public static final int MAX_KEYWORD_LENGTH = 8;

    /** The maximum length of a value, including the quotes around a string value. */
    public static final int MAX_VALUE_LENGTH = 70;

    private static final String HIERARCH_PREFIX = "HIERARCH.";

    private final String key;
    private final String value;
    private final String comment;
    private final boolean isString;

    /**
     * A builder class for {@link HeaderCard}.
     */
    public static final class Builder {
        private String key;
        private String value;
        private String comment;
        private boolean isString;
        private KeywordConvention keywordConvention;

        private Builder() {
            this.key = null; // optional, absent for a comment card
            this.value = null; // optional, absent for a comment card or a keyword without a value
            this.comment = null; // optional
            this.isString = false;
            this.keywordConvention = KeywordConvention.STANDARD;
        }

        /**
         * Sets the card's keyword.
         * <p>
         * If this is never invoked, the card is a comment card without a keyword.
         * </p>
         *
         * @param keyword
         *     The new keyword.  This may be longer than 8 characters only if it starts with {@code HIERARCH.} and the
         *     builder uses {@link KeywordConvention#HIERARCH}, which is checked when the card is built.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code keyword} is {@code null}.
         * @throws HeaderCardException
         *     if {@code keyword} is blank, or contains anything other than printable ASCII characters.
         */
        public Builder keyword(String keyword) {
            ArgumentUtil.checkNotNull(keyword, "keyword");
            if (keyword.isEmpty()) {
                throw new HeaderCardException("keywords cannot be blank");
            }
            for (int i = 0; i < keyword.length(); i++) {
                char c = keyword.charAt(i);
                if (c <= ' ' || '~' < c) {
                    throw new HeaderCardException(
                        "keyword \"" + keyword + "\" must only contain printable ASCII characters without blanks");
                }
            }

            this.key = keyword;
            return this;
        }

        /**
         * Sets the card's value to a string.
         * <p>
         * Leading and trailing blanks are not significant in a FITS string value, so they are removed.  If the given
         * text is itself enclosed in single quotes, as it would be on a card, the quotes are removed and any doubled
         * quote inside is taken as a single quote.
         * </p>
         *
         * @param value
         *     The new value.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code value} is {@code null}.
         * @throws HeaderCardException
         *     if {@code value} is longer than 70 characters, if it starts with a quote but doesn't end with one, or if
         *     it contains anything other than printable ASCII characters.
         */
        public Builder value(String value) {
            ArgumentUtil.checkNotNull(value, "value");

            String trimmed = value.trim();
            checkValueLength(trimmed);
            checkPrintable(trimmed, "value");

            if (!trimmed.isEmpty() && trimmed.charAt(0) == '\'') {
                if (trimmed.length() < 2 || trimmed.charAt(trimmed.length() - 1) != '\'') {
                    throw new HeaderCardException("missing end quote in string value");
                }
                trimmed = HeaderCardCodec.unescape(trimmed.substring(1, trimmed.length() - 1)).trim();
            }

            // The value is written between quotes and with every quote doubled, so that's what must fit.
            checkValueLength(HeaderCardCodec.quote(trimmed));

            this.value = trimmed;
            this.isString = true;
            return this;
        }

        /**
         * Sets the card's value to a logical value, which is written as {@code T} or {@code F}.
         *
         * @param value
         *     The new value.
         *
         * @return This builder
         */
        public Builder value(boolean value) {
            return literal(value ? "T" : "F");
        }

        /**
         * Sets the card's value to an integer.
         *
         * @param value
         *     The new value.
         *
         * @return This builder
         */
        public Builder value(int value) {
            return literal(Integer.toString(value));
        }

        /**
         * Sets the card's value to an integer.
         *
         * @param value
         *     The new value.
         *
         * @return This builder
         */
        public Builder value(long value) {
            return literal(Long.toString(value));
        }

        /**
         * Sets the card's value to a floating point number.
         *
         * @param value
         *     The new value.
         *
         * @return This builder
         *
         * @throws HeaderCardException
         *     if {@code value} is infinite or NaN, which FITS headers cannot represent.
         */
        public Builder value(float value) {
            checkFinite(value);
            return literal(Float.toString(value));
        }

        /**
         * Sets the card's value to a floating point number.
         *
         * @param value
         *     The new value.
         *
         * @return This builder
         *
         * @throws HeaderCardException
         *     if {@code value} is infinite or NaN, which FITS headers cannot represent.
         */
        public Builder value(double value) {
            checkFinite(value);
            return literal(Double.toString(value));
        }

        /**
         * Sets the card's comment.
         *
         * @param comment
         *     The new comment.  If the card has a keyword, leading and trailing blanks are removed when the card is
         *     built.  Otherwise, only trailing blanks are removed.  A comment that is empty after this is the same as no
         *     comment.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code comment} is {@code null}.
         * @throws HeaderCardException
         *     if {@code comment} contains anything other than printable ASCII characters.
         */
        public Builder comment(String comment) {
            ArgumentUtil.checkNotNull(comment, "comment");
            checkPrintable(comment, "comment");

            this.comment = comment;
            return this;
        }

        /**
         * Sets which keywords the card may have.  The default is {@link KeywordConvention#STANDARD}.
         *
         * @param keywordConvention
         *     The keyword convention.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code keywordConvention} is {@code null}.
         */
        public Builder keywordConvention(KeywordConvention keywordConvention) {
            ArgumentUtil.checkNotNull(keywordConvention, "keywordConvention");
            this.keywordConvention = keywordConvention;
            return this;
        }

        private Builder literal(String literal) {
            assert literal.length() <= MAX_VALUE_LENGTH;
            this.value = literal;
            this.isString = false;
            return this;
        }

        private static void checkFinite(double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new HeaderCardException("value must be a finite number, but was " + value);
            }
        }

        private static void checkValueLength(String value) {
            if (MAX_VALUE_LENGTH < value.length()) {
                throw new HeaderCardException("value must not be longer than " + MAX_VALUE_LENGTH + " characters");
            }
        }

        private static void checkPrintable(String text, String description) {
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c < ' ' || '~' < c) {
                    throw new HeaderCardException(description + " must only contain printable ASCII characters");
                }
            }
        }

        /**
         * Builds an immutable {@code HeaderCard} with the configured parts.
         *
         * @return a {@code HeaderCard}
         *
         * @throws HeaderCardException
         *     if a value was set without a keyword, if the keyword is too long for the builder's keyword convention,
         *     if a HIERARCH keyword has an empty level or an '=', or if a HIERARCH keyword and its value don't fit on
         *     one card.
         */
        public HeaderCard build() {
            if (key == null && value != null) {
                throw new HeaderCardException("a card with a value must have a keyword");
            }

            if (key != null && MAX_KEYWORD_LENGTH < key.length()) {
                if (keywordConvention != KeywordConvention.HIERARCH || !isHierarchKeyword(key)) {
                    throw new HeaderCardException(
                        "keyword \"" + key + "\" must not be longer than " + MAX_KEYWORD_LENGTH + " characters");
                }
                checkHierarchKeyword(key, value, isString);
            }

            return new HeaderCard(key, value, normalizeComment(key, comment), isString);
        }

        private static void checkHierarchKeyword(String key, String value, boolean isString) {
            // The levels are written with blanks between them, so an empty level or an '=' would change the keyword.
            if (key.indexOf('=') != -1) {
                throw new HeaderCardException("keyword \"" + key + "\" must not contain '='");
            }
            if (key.contains("..") || key.endsWith(".")) {
                throw new HeaderCardException("keyword \"" + key + "\" must not have an empty level");
            }

            // Only the comment may be cut off at the end of the card.
            int length = key.length();
            if (value != null) {
                String valueText = isString ? HeaderCardCodec.quote(value) : value;
                length += " = ".length() + valueText.length();
            }
            if (HeaderCardCodec.CARD_LENGTH < length) {
                throw new HeaderCardException(
                    "keyword \"" + key + "\" and its value need " + length + " characters, but a card only has " +
                        HeaderCardCodec.CARD_LENGTH);
            }
        }

        // Parsing a card trims the comment of a card with a keyword and only the end of a comment without one.
        private static String normalizeComment(String key, String comment) {
            if (comment == null) {
                return null;
            }
            String normalized = key == null ? comment.stripTrailing() : comment.trim();
            return normalized.isEmpty() ? null : normalized;
        }
    }

    /**
     * Creates a new card builder.  By default, the card has no keyword, no value, and no comment.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Constructs a card without doing any validation.
     *
     * @param key
     *     The keyword, or {@code null} for a comment card.
     * @param value
     *     The value, or {@code null} if the card has none.
     * @param comment
     *     The comment, or {@code null} if the card has none.
     * @param isString
     *     Whether {@code value} is written between quotes.
     */
    HeaderCard(String key, String value, String comment, boolean isString) {
        this.key = key;
        this.value = value;
        this.comment = comment;
        this.isString = isString;
    }

    static boolean isHierarchKeyword(String key) {
        return HIERARCH_PREFIX.length() < key.length() && key.startsWith(HIERARCH_PREFIX);
    }

    /**
     * Gets this card's keyword.
     *
     * @return This card's keyword, or {@code null} if this is a comment card.
     */
    public String key() {
        return key;
    }

    /**
     * Gets this card's value.  For a string value, this is the text without the surrounding quotes and with doubled
     * quotes undone.
     *
     * @return This card's value, or {@code null} if the card doesn't have one.
     */
    public String value() {
        return value;
    }

    /**
     * Gets this card's comment.
     *
     * @return This card's comment, or {@code null} if the card doesn't have one.
     */
    public String comment() {
        return comment;
    }

    /**
     * Determines if this card's value is a string, which is written between quotes.
     *
     * @return {@code true}, if the value is a string.  {@code false}, otherwise.
     */
    public boolean isStringValue() {
        return isString;
    }

    /**
     * Determines if this card has both a keyword and a value.
     *
     * @return {@code true}, if this card has a keyword and a value.  {@code false}, otherwise.
     */
    public boolean isKeyValuePair() {
        return key != null && value != null;
    }

    /**
     * Creates a copy of this card with a different keyword.
     *
     * @param newKey
     *     The keyword of the copy.
     * @param keywordConvention
     *     The keyword convention that {@code newKey} must follow.
     *
     * @return A new card.
     *
     * @throws HeaderCardException
     *     if {@code newKey} isn't a valid keyword for {@code keywordConvention}, or if it doesn't fit on a card with
     *     this card's value.
     */
    HeaderCard withKey(String newKey, KeywordConvention keywordConvention) {
        Builder builder = builder().keyword(newKey).keywordConvention(keywordConvention);
        builder.value = value;
        builder.isString = isString;
        builder.comment = comment;
        return builder.build();
    }

    /**
     * Gets a hash code for this card.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This card's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(key, value, comment, isString);
    }

    /**
     * Determines if this card is equal to another object.
     * <p>
     * Two cards are equal if and only if their keyword, value, comment, and string flag are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this card.
     *
     * @return {@code true}, if this card is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof HeaderCard otherCard)) {
            return false;
        }

        return Objects.equals(key, otherCard.key) &&
            Objects.equals(value, otherCard.value) &&
            Objects.equals(comment, otherCard.comment) &&
            isString == otherCard.isString;
    }

    /**
     * Gets this card as the 80-character card image that would be written to a FITS header.
     *
     * @return An 80-character string.
     */
    @Override
    public String toString() {
        return HeaderCardCodec.formatCard(this);
    }
}
