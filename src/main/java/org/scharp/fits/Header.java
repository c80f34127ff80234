///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The header of a FITS header and data unit: an ordered list of {@link HeaderCard}s.
 * <p>
 * In a file, a header is a sequence of 80-character cards terminated by an {@code END} card and padded with blanks to
 * a multiple of 2880 bytes.  The {@code END} card is not held in this list; it is added when the header is written.
 * </p>
 * <p>
 * This class is not thread-safe.
 * </p>
 */
public final class Header {

    private static final Logger LOG = LoggerFactory.getLogger(Header.class);

    private static final String END_KEYWORD = "END";

    private final HeaderCardCodec codec;
    private final List<HeaderCard> cards;

    /**
     * Creates an empty header that uses the standard keyword convention.
     */
    public Header() {
        this(HeaderCardCodec.STANDARD);
    }

    /**
     * Creates an empty header.
     *
     * @param codec
     *     The codec with which lines added to this header are parsed.  This also determines which keywords may be
     *     given to {@link #renameKey}.
     *
     * @throws NullPointerException
     *     if {@code codec} is {@code null}.
     */
    public Header(HeaderCardCodec codec) {
        ArgumentUtil.checkNotNull(codec, "codec");
        this.codec = codec;
        this.cards = new ArrayList<>();
    }

    /**
     * Reads a header from a stream.  The stream is read in blocks of 2880 bytes up to and including the block with
     * the {@code END} card.
     *
     * @param input
     *     The stream to read from.  It is left positioned after the header's padding.
     * @param codec
     *     The codec with which the cards are parsed.
     *
     * @return The header.
     *
     * @throws NullPointerException
     *     if {@code input} or {@code codec} is {@code null}.
     * @throws EOFException
     *     if the stream ends before the {@code END} card.
     * @throws IOException
     *     if the stream couldn't be read.
     */
    public static Header read(InputStream input, HeaderCardCodec codec) throws IOException {
        ArgumentUtil.checkNotNull(input, "input");

        Header header = new Header(codec);
        byte[] block = new byte[FitsUtil.BLOCK_SIZE];
        int blocksRead = 0;
        while (true) {
            int bytesRead = input.readNBytes(block, 0, block.length);
            if (bytesRead != block.length) {
                throw new EOFException(
                    "stream ended after " + (blocksRead * FitsUtil.BLOCK_SIZE + bytesRead) +
                        " bytes without an END card");
            }
            blocksRead++;

            for (int offset = 0; offset < block.length; offset += HeaderCardCodec.CARD_LENGTH) {
                String line = new String(block, offset, HeaderCardCodec.CARD_LENGTH, StandardCharsets.US_ASCII);
                HeaderCard card = codec.parse(line);
                if (END_KEYWORD.equals(card.key()) && card.value() == null) {
                    LOG.debug("read header with {} cards in {} blocks", header.cards.size(), blocksRead);
                    return header;
                }
                header.cards.add(card);
            }
        }
    }

    /**
     * Writes this header to a stream, followed by an {@code END} card and blank padding to the end of a block.
     *
     * @param output
     *     The stream to write to.
     *
     * @throws NullPointerException
     *     if {@code output} is {@code null}.
     * @throws IOException
     *     if the stream couldn't be written.
     */
    public void write(OutputStream output) throws IOException {
        ArgumentUtil.checkNotNull(output, "output");

        for (HeaderCard card : cards) {
            output.write(codec.format(card).getBytes(StandardCharsets.US_ASCII));
        }
        output.write(codec.format(HeaderCard.builder().keyword(END_KEYWORD).build())
            .getBytes(StandardCharsets.US_ASCII));

        byte[] padding = new byte[FitsUtil.padding(trueSize())];
        Arrays.fill(padding, (byte) ' ');
        output.write(padding);

        LOG.debug("wrote header with {} cards ({} bytes)", cards.size(), paddedSize());
    }

    /**
     * Adds a card to the end of this header.
     *
     * @param card
     *     The card to add.
     *
     * @throws NullPointerException
     *     if {@code card} is {@code null}.
     */
    public void addCard(HeaderCard card) {
        ArgumentUtil.checkNotNull(card, "card");
        cards.add(card);
    }

    /**
     * Parses a line with this header's codec and adds the resulting card to the end of this header.
     *
     * @param line
     *     The text of a card.
     *
     * @return The card that was added.
     *
     * @throws NullPointerException
     *     if {@code line} is {@code null}.
     */
    public HeaderCard addLine(String line) {
        ArgumentUtil.checkNotNull(line, "line");
        HeaderCard card = codec.parse(line);
        cards.add(card);
        return card;
    }

    /**
     * Finds the first card with a keyword.
     *
     * @param key
     *     The keyword to look for.
     *
     * @return The first card whose keyword is {@code key}, or {@code null} if there is none.
     *
     * @throws NullPointerException
     *     if {@code key} is {@code null}.
     */
    public HeaderCard findCard(String key) {
        ArgumentUtil.checkNotNull(key, "key");
        int index = indexOfKey(key);
        return index < 0 ? null : cards.get(index);
    }

    private int indexOfKey(String key) {
        for (int i = 0; i < cards.size(); i++) {
            if (key.equals(cards.get(i).key())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Determines if this header has a card with a keyword.
     *
     * @param key
     *     The keyword to look for.
     *
     * @return {@code true}, if some card has the keyword {@code key}.  {@code false}, otherwise.
     *
     * @throws NullPointerException
     *     if {@code key} is {@code null}.
     */
    public boolean containsKey(String key) {
        return findCard(key) != null;
    }

    /**
     * Changes the keyword of the first card with a given keyword.
     * <p>
     * Cards are immutable, so the card is replaced by a copy with the new keyword.  Other references to the old card
     * still see the old keyword.
     * </p>
     *
     * @param oldKey
     *     The keyword of the card to rename.
     * @param newKey
     *     The card's new keyword.  This must be a valid keyword for this header's keyword convention.
     *
     * @return {@code true}, if a card was renamed.  {@code false}, if no card has the keyword {@code oldKey}.
     *
     * @throws NullPointerException
     *     if {@code oldKey} or {@code newKey} is {@code null}.
     * @throws HeaderCardException
     *     if {@code newKey} is not a valid keyword, if another card already has it, or if it is a HIERARCH keyword that
     *     doesn't fit on a card with the card's value.
     */
    public boolean renameKey(String oldKey, String newKey) {
        ArgumentUtil.checkNotNull(oldKey, "oldKey");
        ArgumentUtil.checkNotNull(newKey, "newKey");

        // Validate the new keyword the same way a new card's keyword is validated.
        HeaderCard.builder().keyword(newKey).keywordConvention(codec.keywordConvention()).build();

        int index = indexOfKey(oldKey);
        if (index < 0) {
            return false;
        }
        if (!oldKey.equals(newKey) && containsKey(newKey)) {
            throw new HeaderCardException("header already has a card with the keyword " + newKey);
        }

        cards.set(index, cards.get(index).withKey(newKey, codec.keywordConvention()));
        return true;
    }

    /**
     * Gets the value of a card as a string.
     *
     * @param key
     *     The keyword of the card.
     *
     * @return The value of the first card with the keyword {@code key}, or {@code null} if there is no such card or if
     *     it has no value.
     */
    public String getStringValue(String key) {
        HeaderCard card = findCard(key);
        return card == null ? null : card.value();
    }

    /**
     * Gets the value of a card as an integer.
     *
     * @param key
     *     The keyword of the card.
     * @param defaultValue
     *     The value to return if there is no card with a value for {@code key}.
     *
     * @return The card's value, or {@code defaultValue}.
     *
     * @throws HeaderCardException
     *     if the card's value is not an integer.
     */
    public long getLongValue(String key, long defaultValue) {
        String value = getStringValue(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException exception) {
            throw new HeaderCardException("value of " + key + " is not an integer: " + value);
        }
    }

    /**
     * Gets the value of a card as a floating point number.  FITS exponents written with a {@code D} are accepted.
     *
     * @param key
     *     The keyword of the card.
     * @param defaultValue
     *     The value to return if there is no card with a value for {@code key}.
     *
     * @return The card's value, or {@code defaultValue}.
     *
     * @throws HeaderCardException
     *     if the card's value is not a number.
     */
    public double getDoubleValue(String key, double defaultValue) {
        String value = getStringValue(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException exception) {
            throw new HeaderCardException("value of " + key + " is not a number: " + value);
        }
    }

    /**
     * Gets the value of a card as a logical value.
     *
     * @param key
     *     The keyword of the card.
     * @param defaultValue
     *     The value to return if there is no card with a value for {@code key}.
     *
     * @return {@code true} if the card's value is {@code T}, {@code false} if it is {@code F}, or
     *     {@code defaultValue}.
     *
     * @throws HeaderCardException
     *     if the card's value is neither {@code T} nor {@code F}.
     */
    public boolean getBooleanValue(String key, boolean defaultValue) {
        String value = getStringValue(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        if ("T".equals(value)) {
            return true;
        }
        if ("F".equals(value)) {
            return false;
        }
        throw new HeaderCardException("value of " + key + " is not a logical value: " + value);
    }

    /**
     * Gets the cards of this header, in order.
     *
     * @return An unmodifiable view of the cards.  This does not include the {@code END} card.
     */
    public List<HeaderCard> cards() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Gets the number of cards in this header, not counting the {@code END} card.
     *
     * @return The number of cards.
     */
    public int numberOfCards() {
        return cards.size();
    }

    /**
     * Gets the number of bytes that this header's cards occupy when written, including the {@code END} card but not
     * the padding.
     *
     * @return the size in bytes.
     */
    public long trueSize() {
        return (long) (cards.size() + 1) * HeaderCardCodec.CARD_LENGTH;
    }

    /**
     * Gets the number of bytes that this header occupies when written, including the padding.
     *
     * @return the size in bytes, a multiple of 2880.
     */
    public long paddedSize() {
        return FitsUtil.paddedSize(trueSize());
    }
}
