package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.utils.Bytes;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KeyRangeTest {

    private static byte[] b(String s) {
        return Bytes.utf8(s);
    }

    @Test
    public void testUnboundedContainsEverything() {
        KeyRange all = KeyRange.all();
        assertSame(all, KeyRange.of(null, null));
        assertFalse(all.hasLowerBound());
        assertFalse(all.hasUpperBound());
        assertTrue(all.contains(Bytes.EMPTY));
        assertTrue(all.contains(new byte[]{(byte) 0xff, (byte) 0xff}));
        assertFalse(all.isEmpty());
    }

    @Test
    public void testBoundsAreInclusive() {
        KeyRange range = KeyRange.of(b("five"), b("three"));
        assertTrue(range.contains(b("five")));
        assertTrue(range.contains(b("three")));
        assertTrue(range.contains(b("six")));
        assertFalse(range.contains(b("eight")));
        assertFalse(range.contains(b("two")));
    }

    @Test
    public void testBoundNeedNotBeAKey() {
        KeyRange upToSi = KeyRange.atMost(b("si"));
        assertTrue(upToSi.contains(b("seven")));
        assertTrue(upToSi.isAboveUpper(b("six")));

        KeyRange fromFo = KeyRange.atLeast(b("fo"));
        assertTrue(fromFo.isBelowLower(b("five")));
        assertTrue(fromFo.contains(b("four")));
    }

    @Test
    public void testUnsignedComparison() {
        KeyRange range = KeyRange.atMost(new byte[]{0x7f});
        assertTrue(range.isAboveUpper(new byte[]{(byte) 0x80}));
        assertTrue(range.contains(new byte[]{0x00, (byte) 0xff}));
    }

    @Test
    public void testInvertedRangeIsEmpty() {
        assertTrue(KeyRange.of(b("z"), b("a")).isEmpty());
        assertFalse(KeyRange.of(b("a"), b("a")).isEmpty());
    }

    @Test
    public void testBoundsAreCopied() {
        byte[] from = b("abc");
        KeyRange range = KeyRange.atLeast(from);
        from[0] = 'z';
        assertArrayEquals(b("abc"), range.getFrom());
    }

    @Test
    public void testReturnedBoundsAreCopies() {
        KeyRange range = KeyRange.of(b("b"), b("d"));
        range.getFrom()[0] = 'z';
        range.getTo()[0] = 'a';
        assertArrayEquals(b("b"), range.getFrom());
        assertArrayEquals(b("d"), range.getTo());
        assertTrue(range.contains(b("c")));
        assertNull(KeyRange.atLeast(b("b")).getTo());
    }

    @Test
    public void testToString() {
        assertEquals("[-inf, +inf]", KeyRange.all().toString());
        assertEquals("[a, 0x00ff]", KeyRange.of(b("a"), new byte[]{0, (byte) 0xff}).toString());
    }
}
