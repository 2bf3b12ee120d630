package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.utils.Bytes;

/**
 * Inclusive key bounds for a range scan. A {@code null} bound means the
 * range is open on that side. Bounds are cut points in sorted key space and
 * need not be stored keys: {@code atMost("si")} excludes {@code "six"}.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/10 14:22:08
 */
public final class KeyRange {

    private static final KeyRange ALL = new KeyRange(null, null);

    private final byte[] from;
    private final byte[] to;

    private KeyRange(byte[] from, byte[] to) {
        this.from = from == null ? null : from.clone();
        this.to = to == null ? null : to.clone();
    }

    public static KeyRange all() {
        return ALL;
    }

    public static KeyRange of(byte[] from, byte[] to) {
        if (from == null && to == null) {
            return ALL;
        }
        return new KeyRange(from, to);
    }

    public static KeyRange atLeast(byte[] from) {
        return of(from, null);
    }

    public static KeyRange atMost(byte[] to) {
        return of(null, to);
    }

    public boolean hasLowerBound() {
        return from != null;
    }

    public boolean hasUpperBound() {
        return to != null;
    }

    /**
     * @return a copy of the lower bound, or null when unbounded
     */
    public byte[] getFrom() {
        return from == null ? null : from.clone();
    }

    /**
     * @return a copy of the upper bound, or null when unbounded
     */
    public byte[] getTo() {
        return to == null ? null : to.clone();
    }

    public boolean isBelowLower(byte[] key) {
        return from != null && Bytes.compare(key, from) < 0;
    }

    public boolean isAboveUpper(byte[] key) {
        return to != null && Bytes.compare(key, to) > 0;
    }

    public boolean contains(byte[] key) {
        return !isBelowLower(key) && !isAboveUpper(key);
    }

    // from > to 时不可能有键落在区间内
    public boolean isEmpty() {
        return from != null && to != null && Bytes.compare(from, to) > 0;
    }

    @Override
    public String toString() {
        return "[" + (from == null ? "-inf" : Bytes.toDisplay(from))
                + ", " + (to == null ? "+inf" : Bytes.toDisplay(to)) + "]";
    }
}
