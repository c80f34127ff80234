package org.scharp.fits;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link HeaderCardCodec}. */
public class HeaderCardCodecTest {

    /** Pads a card image with blanks to 80 characters. */
    private static String pad(String text) {
        assert text.length() <= 80 : "TEST BUG: card image is too long";
        return text + " ".repeat(80 - text.length());
    }

    private static void assertCard(String key, String value, String comment, boolean isString, HeaderCard card) {
        assertEquals(key, card.key(), "key");
        assertEquals(value, card.value(), "value");
        assertEquals(comment, card.comment(), "comment");
        assertEquals(isString, card.isStringValue(), "isStringValue");
    }

    @Test
    void testConstruct() {
        assertSame(KeywordConvention.STANDARD, HeaderCardCodec.STANDARD.keywordConvention());
        assertSame(KeywordConvention.HIERARCH, HeaderCardCodec.HIERARCH.keywordConvention());
        assertSame(KeywordConvention.HIERARCH, new HeaderCardCodec(KeywordConvention.HIERARCH).keywordConvention());

        Exception exception = assertThrows(NullPointerException.class, () -> new HeaderCardCodec(null));
        assertEquals("keywordConvention must not be null", exception.getMessage());
    }

    @Test
    void testParseEscapedQuote() {
        HeaderCard card = HeaderCardCodec.STANDARD.parse(pad("KEY     = 'it''s'"));
        assertCard("KEY", "it's", null, true, card);
    }

    @Test
    void testParseString() {
        HeaderCard card = HeaderCardCodec.STANDARD.parse(pad("OBJECT  = 'M31     '           / the target"));
        assertCard("OBJECT", "M31", "the target", true, card);

        // A slash within the quotes is part of the value.
        card = HeaderCardCodec.STANDARD.parse(pad("DATE-OBS= '2024/01/02'"));
        assertCard("DATE-OBS", "2024/01/02", null, true, card);

        // Leading blanks in a string value are not significant.
        card = HeaderCardCodec.STANDARD.parse(pad("OBSERVER= '   Hubble'/no space before slash"));
        assertCard("OBSERVER", "Hubble", "no space before slash", true, card);

        // An empty string.
        card = HeaderCardCodec.STANDARD.parse(pad("EMPTY   = ''"));
        assertCard("EMPTY", "", null, true, card);

        // A string that ends with an escaped quote.
        card = HeaderCardCodec.STANDARD.parse(pad("QUOTE   = 'say '''"));
        assertCard("QUOTE", "say '", null, true, card);
    }

    @Test
    void testParseLiteral() {
        HeaderCard card = HeaderCardCodec.STANDARD.parse(pad("NAXIS   =                    2 / number of axes"));
        assertCard("NAXIS", "2", "number of axes", false, card);

        card = HeaderCardCodec.STANDARD.parse(pad("SIMPLE  =                    T"));
        assertCard("SIMPLE", "T", null, false, card);

        // A slash with nothing after it is an empty comment.
        card = HeaderCardCodec.STANDARD.parse(pad("BZERO   = 32768 /"));
        assertCard("BZERO", "32768", "", false, card);

        // Nothing after the value indicator.
        card = HeaderCardCodec.STANDARD.parse(pad("NOTHING ="));
        assertCard("NOTHING", "", null, false, card);

        // Only a comment after the value indicator.
        card = HeaderCardCodec.STANDARD.parse(pad("UNKNOWN =  / not known"));
        assertCard("UNKNOWN", "", "not known", false, card);
    }

    @Test
    void testParseCommentary() {
        // A keyword without a value indicator.
        HeaderCard card = HeaderCardCodec.STANDARD.parse(pad("COMMENT This file is a test."));
        assertCard("COMMENT", null, "This file is a test.", false, card);

        card = HeaderCardCodec.STANDARD.parse(pad("HISTORY"));
        assertCard("HISTORY", null, null, false, card);

        // "=" without the blank after it is not a value indicator.
        card = HeaderCardCodec.STANDARD.parse(pad("HISTORY =x"));
        assertCard("HISTORY", null, "=x", false, card);

        // A blank keyword.  Leading blanks of the comment are kept.
        card = HeaderCardCodec.STANDARD.parse(pad("          indented text"));
        assertCard(null, null, "  indented text", false, card);

        // A blank card.
        card = HeaderCardCodec.STANDARD.parse(pad(""));
        assertCard(null, null, null, false, card);
    }

    @Test
    void testParseShortLines() {
        assertCard("END", null, null, false, HeaderCardCodec.STANDARD.parse("END"));
        assertCard("NAXIS", null, null, false, HeaderCardCodec.STANDARD.parse("  NAXIS "));
        assertCard(null, null, null, false, HeaderCardCodec.STANDARD.parse(""));
        assertCard(null, null, null, false, HeaderCardCodec.STANDARD.parse("        "));

        // Nine characters is long enough to be a card with a keyword.
        assertCard("KEYWORD", null, "x", false, HeaderCardCodec.STANDARD.parse("KEYWORD x"));
    }

    @Test
    void testParseUnterminatedString() {
        // The card degrades to a comment card holding the whole line.
        String line = pad("TELESCOP= 'unterminated / comment");
        HeaderCard card = HeaderCardCodec.STANDARD.parse(line);
        assertCard(null, null, "TELESCOP= 'unterminated / comment", false, card);

        // An escaped quote doesn't end the string.
        card = HeaderCardCodec.STANDARD.parse(pad("KEY     = 'it''"));
        assertCard(null, null, "KEY     = 'it''", false, card);

        // A lone quote.
        card = HeaderCardCodec.STANDARD.parse(pad("KEY     = '"));
        assertCard(null, null, "KEY     = '", false, card);
    }

    @Test
    void testParseNull() {
        Exception exception = assertThrows(NullPointerException.class, () -> HeaderCardCodec.STANDARD.parse(null));
        assertEquals("cardImage must not be null", exception.getMessage());
    }

    @Test
    void testParseHierarch() {
        HeaderCard card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH TEL FOCUS = 12.5 / mm"));
        assertCard("HIERARCH.TEL.FOCUS", "12.5", "mm", false, card);

        // No blanks around the value indicator.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH ESO DET CHIPS=4"));
        assertCard("HIERARCH.ESO.DET.CHIPS", "4", null, false, card);

        // A string value with escaped quotes.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH ESO OBS NAME = 'my ''obs''' / the name"));
        assertCard("HIERARCH.ESO.OBS.NAME", "my 'obs'", "the name", true, card);

        // A slash within the value token.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH A B = 5/five"));
        assertCard("HIERARCH.A.B", "5", "five", false, card);

        // A slash without a value.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH A B = /only a comment"));
        assertCard("HIERARCH.A.B", null, "only a comment", false, card);

        // Text after the value that isn't a comment is ignored.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH A B = 5 junk"));
        assertCard("HIERARCH.A.B", "5", null, false, card);
    }

    @Test
    void testParseMalformedHierarch() {
        // No value indicator.
        HeaderCard card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH ESO FLAG"));
        assertCard("HIERARCH.ESO.FLAG", null, null, false, card);

        // Nothing after the value indicator.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH ESO FLAG ="));
        assertCard("HIERARCH.ESO.FLAG", null, null, false, card);

        // An unterminated string.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCH ESO NAME = 'open / comment"));
        assertCard("HIERARCH.ESO.NAME", null, null, false, card);
    }

    @Test
    void testHierarchNeedsConvention() {
        // Without the HIERARCH convention, the card is commentary under the keyword HIERARCH.
        HeaderCard card = HeaderCardCodec.STANDARD.parse(pad("HIERARCH TEL FOCUS = 12.5 / mm"));
        assertCard("HIERARCH", null, "TEL FOCUS = 12.5 / mm", false, card);

        // With it, only cards that start with "HIERARCH " are HIERARCH cards.
        card = HeaderCardCodec.HIERARCH.parse(pad("HIERARCHY=                    1"));
        assertCard("HIERARCH", null, "Y=                    1", false, card);

        card = HeaderCardCodec.HIERARCH.parse(pad("NAXIS   =                    2"));
        assertCard("NAXIS", "2", null, false, card);
    }

    @Test
    void testFormatString() {
        HeaderCard card = HeaderCard.builder().keyword("KEY").value("it's").build();
        assertEquals(pad("KEY     = 'it''s   '"), HeaderCardCodec.STANDARD.format(card));

        // A long string pushes the closing quote past column 19.
        card = HeaderCard.builder().keyword("LONG").value("abcdefghijklmnopqrstuvwxyz").comment("alphabet").build();
        assertEquals(pad("LONG    = 'abcdefghijklmnopqrstuvwxyz' / alphabet"), HeaderCardCodec.STANDARD.format(card));

        card = HeaderCard.builder().keyword("EMPTY").value("").build();
        assertEquals(pad("EMPTY   = '        '"), HeaderCardCodec.STANDARD.format(card));
    }

    @Test
    void testFormatLiteral() {
        HeaderCard card = HeaderCard.builder().keyword("NAXIS").value(2).comment("number of axes").build();
        assertEquals(pad("NAXIS   =                    2 / number of axes"), HeaderCardCodec.STANDARD.format(card));

        card = HeaderCard.builder().keyword("SIMPLE").value(true).build();
        assertEquals(pad("SIMPLE  =                    T"), HeaderCardCodec.STANDARD.format(card));

        card = HeaderCard.builder().keyword("CRVAL1").value(-123.456789).build();
        assertEquals(pad("CRVAL1  =          -123.456789"), HeaderCardCodec.STANDARD.format(card));

        // The blanks around a comment are not kept.
        card = HeaderCard.builder().keyword("NAXIS").value(2).comment(" indented ").build();
        assertEquals(pad("NAXIS   =                    2 / indented"), HeaderCardCodec.STANDARD.format(card));
    }

    @Test
    void testFormatCommentary() {
        HeaderCard card = HeaderCard.builder().keyword("COMMENT").comment("hello").build();
        assertEquals(pad("COMMENT hello"), HeaderCardCodec.STANDARD.format(card));

        card = HeaderCard.builder().comment("no keyword").build();
        assertEquals(pad("        no keyword"), HeaderCardCodec.STANDARD.format(card));

        // Commentary that would look like a value indicator is moved over.
        card = HeaderCard.builder().keyword("HISTORY").comment("= not a value").build();
        assertEquals(pad("HISTORY   = not a value"), HeaderCardCodec.STANDARD.format(card));

        card = HeaderCard.builder().build();
        assertEquals(pad(""), HeaderCardCodec.STANDARD.format(card));
    }

    @Test
    void testFormatTruncates() {
        HeaderCard card = HeaderCard.builder().keyword("COMMENT").comment("x".repeat(100)).build();
        String cardImage = HeaderCardCodec.STANDARD.format(card);
        assertEquals(80, cardImage.length());
        assertEquals("COMMENT " + "x".repeat(72), cardImage);
    }

    @Test
    void testFormatHierarch() {
        HeaderCard card = HeaderCard.builder().
            keyword("HIERARCH.TEL.FOCUS").
            value(12.5).
            comment("mm").
            keywordConvention(KeywordConvention.HIERARCH).
            build();

        String cardImage = HeaderCardCodec.HIERARCH.format(card);
        assertEquals(pad("HIERARCH TEL FOCUS = " + " ".repeat(14) + "12.5 / mm"), cardImage);
        assertTrue(cardImage.startsWith("HIERARCH TEL FOCUS"));

        // The layout doesn't depend on the codec.
        assertEquals(cardImage, HeaderCardCodec.STANDARD.format(card));

        // Parsing it restores the card.
        assertEquals(card, HeaderCardCodec.HIERARCH.parse(cardImage));

        card = HeaderCard.builder().
            keyword("HIERARCH.ESO.OBS.NAME").
            value("my 'obs'").
            comment("the name").
            keywordConvention(KeywordConvention.HIERARCH).
            build();
        assertEquals(
            pad("HIERARCH ESO OBS NAME =      'my ''obs''' / the name"),
            HeaderCardCodec.HIERARCH.format(card));
    }

    @Test
    void testFormatHierarchWithoutValue() {
        // The value indicator ends the keyword, so that the comment isn't read as more levels.
        HeaderCard card = HeaderCard.builder().
            keyword("HIERARCH.ESO.DPR.TECH").
            comment("no value").
            keywordConvention(KeywordConvention.HIERARCH).
            build();
        String cardImage = HeaderCardCodec.HIERARCH.format(card);
        assertEquals(pad("HIERARCH ESO DPR TECH = / no value"), cardImage);
        assertCard("HIERARCH.ESO.DPR.TECH", null, "no value", false, HeaderCardCodec.HIERARCH.parse(cardImage));

        card = HeaderCard.builder().
            keyword("HIERARCH.ESO.DPR.TECH").
            keywordConvention(KeywordConvention.HIERARCH).
            build();
        assertEquals(pad("HIERARCH ESO DPR TECH"), HeaderCardCodec.HIERARCH.format(card));
    }

    @Test
    void testFormatLongHierarch() {
        // There is no room for alignment, but the card must still be 80 characters.
        String keyword = "HIERARCH.A.VERY.LONG.KEYWORD.THAT.TAKES.UP.MOST.OF.THE.CARD";
        HeaderCard card = HeaderCard.builder().
            keyword(keyword).
            value(1).
            comment("this comment is too long to fit").
            keywordConvention(KeywordConvention.HIERARCH).
            build();

        String cardImage = HeaderCardCodec.HIERARCH.format(card);
        assertEquals(80, cardImage.length());
        assertEquals(
            "HIERARCH A VERY LONG KEYWORD THAT TAKES UP MOST OF THE CARD = 1 / this comment i",
            cardImage);
    }

    @Test
    void testFormatNull() {
        Exception exception = assertThrows(NullPointerException.class, () -> HeaderCardCodec.STANDARD.format(null));
        assertEquals("card must not be null", exception.getMessage());
    }

    /** Formatting a card and parsing the result must give back the same card. */
    @Test
    void testRoundTripFromParts() {
        List<HeaderCard> cards = List.of(
            HeaderCard.builder().keyword("SIMPLE").value(true).comment("conforms to FITS").build(),
            HeaderCard.builder().keyword("BITPIX").value(-64).build(),
            HeaderCard.builder().keyword("EXPTIME").value(30.5).comment("seconds").build(),
            HeaderCard.builder().keyword("EXPTIME").value(30.5).comment(" seconds").build(),
            HeaderCard.builder().keyword("GAIN").value(2).comment("   ").build(),
            HeaderCard.builder().keyword("HISTORY").comment("  reduced  ").build(),
            HeaderCard.builder().comment("trailing blanks   ").build(),
            HeaderCard.builder().keyword("OBJECT").value("NGC 1300").comment("barred spiral").build(),
            HeaderCard.builder().keyword("OBSERVER").value("O'Neil").build(),
            HeaderCard.builder().keyword("PATH").value("a/b/c").comment("not a comment").build(),
            HeaderCard.builder().keyword("EMPTY").value("").build(),
            HeaderCard.builder().keyword("QUOTES").value("''''").build(),
            HeaderCard.builder().keyword("COMMENT").comment("some commentary").build(),
            HeaderCard.builder().keyword("HISTORY").comment("= looks like a value").build(),
            HeaderCard.builder().keyword("NOCOMM").build(),
            HeaderCard.builder().comment("   indented commentary").build(),
            HeaderCard.builder().build(),
            HeaderCard.builder().
                keyword("HIERARCH.ESO.TEL.AIRM.START").
                value(1.234).
                comment("airmass").
                keywordConvention(KeywordConvention.HIERARCH).
                build(),
            HeaderCard.builder().
                keyword("HIERARCH.ESO.INS.NAME").
                value("it's 'quoted'").
                keywordConvention(KeywordConvention.HIERARCH).
                build(),
            HeaderCard.builder().
                keyword("HIERARCH.FLAG").
                value(false).
                keywordConvention(KeywordConvention.HIERARCH).
                build(),
            HeaderCard.builder().
                keyword("HIERARCH.ESO.DPR.TECH").
                comment("no value").
                keywordConvention(KeywordConvention.HIERARCH).
                build(),
            HeaderCard.builder().
                keyword("HIERARCH.ESO.DPR").
                keywordConvention(KeywordConvention.HIERARCH).
                build(),
            HeaderCard.builder().
                keyword("HIERARCH.ESO.INS.NAME").
                value("x".repeat(54)).
                keywordConvention(KeywordConvention.HIERARCH).
                build());

        for (HeaderCard card : cards) {
            String cardImage = HeaderCardCodec.HIERARCH.format(card);
            assertEquals(80, cardImage.length(), cardImage);
            assertEquals(card, HeaderCardCodec.HIERARCH.parse(cardImage), cardImage);
        }
    }

    /** Parsing well-formed card text and formatting the card must give back the same text. */
    @Test
    void testRoundTripFromText() {
        List<String> cardImages = List.of(
            pad("SIMPLE  =                    T / file conforms to FITS standard"),
            pad("BITPIX  =                  -32 / number of bits per data pixel"),
            pad("OBJECT  = 'M31     '           / the target"),
            pad("KEY     = 'it''s   '"),
            pad("COMMENT This is commentary"),
            pad("        A card without a keyword"),
            pad("HISTORY   = moved over"),
            pad(""));

        for (String cardImage : cardImages) {
            HeaderCard card = HeaderCardCodec.STANDARD.parse(cardImage);
            assertEquals(cardImage, HeaderCardCodec.STANDARD.format(card));
        }
    }

    @Test
    void testUnterminatedStringDoesNotRoundTrip() {
        // The degraded card keeps the text, but it is reformatted as commentary.
        HeaderCard card = HeaderCardCodec.STANDARD.parse(pad("KEY     = 'open"));
        assertFalse(card.isKeyValuePair());
        assertEquals(pad("        KEY     = 'open"), HeaderCardCodec.STANDARD.format(card));
    }

    @Test
    void testFindClosingQuote() {
        assertEquals(4, HeaderCardCodec.findClosingQuote("'abc'", 1));
        assertEquals(5, HeaderCardCodec.findClosingQuote("'a''b' / c", 1));
        assertEquals(1, HeaderCardCodec.findClosingQuote("''", 1));
        assertEquals(-1, HeaderCardCodec.findClosingQuote("'a''", 1));
        assertEquals(-1, HeaderCardCodec.findClosingQuote("'", 1));
        assertEquals(-1, HeaderCardCodec.findClosingQuote("'abc", 1));
    }

    @Test
    void testQuoteAndUnescape() {
        assertEquals("'it''s'", HeaderCardCodec.quote("it's"));
        assertEquals("''", HeaderCardCodec.quote(""));
        assertEquals("it's", HeaderCardCodec.unescape("it''s"));
        assertEquals("''", HeaderCardCodec.unescape("''''"));
    }
}
