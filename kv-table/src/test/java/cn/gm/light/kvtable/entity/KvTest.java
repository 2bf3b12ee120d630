package cn.gm.light.kvtable.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class KvTest {

    @Test
    public void testEqualityByContent() {
        Kv a = Kv.of(new byte[]{0, 1}, new byte[]{2});
        Kv b = Kv.of(new byte[]{0, 1}, new byte[]{2});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Kv.of(new byte[]{0, 1}, new byte[]{3}));
        assertEquals("0x0001=0x02", a.toString());
    }

    @Test
    public void testRejectsNull() {
        assertThrows(NullPointerException.class, () -> Kv.of((byte[]) null, new byte[0]));
        assertThrows(NullPointerException.class, () -> Kv.of(new byte[0], (byte[]) null));
    }
}
