package org.scharp.fits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(new int[0], "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotNegative(long, String)} */
    @Test
    void testCheckNotNegative() {
        ArgumentUtil.checkNotNegative(0, "arg");
        ArgumentUtil.checkNotNegative(1, "arg");
        ArgumentUtil.checkNotNegative(Long.MAX_VALUE, "arg");

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "size"));
        assertEquals("size must not be negative", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(Long.MIN_VALUE, "myArg"));
        assertEquals("myArg must not be negative", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkSlice(int, int, int)} */
    @Test
    void testCheckSlice() {
        // empty slices
        ArgumentUtil.checkSlice(0, 0, 0);
        ArgumentUtil.checkSlice(10, 10, 0);

        // whole array
        ArgumentUtil.checkSlice(10, 0, 10);

        // interior
        ArgumentUtil.checkSlice(10, 3, 4);

        Exception exception = assertThrows(IndexOutOfBoundsException.class, () -> ArgumentUtil.checkSlice(10, -1, 2));
        assertEquals("slice [-1, -1 + 2) is out of bounds for length 10", exception.getMessage());

        exception = assertThrows(IndexOutOfBoundsException.class, () -> ArgumentUtil.checkSlice(10, 0, -1));
        assertEquals("slice [0, 0 + -1) is out of bounds for length 10", exception.getMessage());

        exception = assertThrows(IndexOutOfBoundsException.class, () -> ArgumentUtil.checkSlice(10, 8, 3));
        assertEquals("slice [8, 8 + 3) is out of bounds for length 10", exception.getMessage());

        // offset + count overflows an int
        exception = assertThrows(
            IndexOutOfBoundsException.class,
            () -> ArgumentUtil.checkSlice(10, 5, Integer.MAX_VALUE));
        assertEquals("slice [5, 5 + 2147483647) is out of bounds for length 10", exception.getMessage());
    }
}
