package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.entity.Kv;
import cn.gm.light.kvtable.enums.BackendType;

/**
 * Sorted byte-key store, identical in behaviour over every backend.
 * <p>
 * Keys and values are arbitrary byte arrays, the zero byte and the empty
 * array included. Keys are ordered by unsigned lexicographic comparison and
 * a proper prefix sorts first. A store is owned by the single handle that
 * opened it; callers serialise writers themselves.
 * <p>
 * Every method throws {@link cn.gm.light.kvtable.exception.InvalidStateException}
 * once the store is closed, and
 * {@link cn.gm.light.kvtable.exception.BackendIOException} when the engine fails.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/7 13:10:47
 */
public interface KvStore extends AutoCloseable {

    /**
     * Exact lookup.
     *
     * @return the stored value, or {@code defaultValue} itself when absent
     */
    byte[] get(byte[] key, byte[] defaultValue);

    default byte[] get(byte[] key) {
        return get(key, null);
    }

    default boolean contains(byte[] key) {
        return get(key, null) != null;
    }

    /** Inserts or replaces the value of {@code key}. */
    void put(byte[] key, byte[] value);

    /**
     * Applies the entries as puts in iteration order, later duplicates
     * winning, using one engine batch where possible. Not atomic.
     */
    void putMany(Iterable<Kv> entries);

    /**
     * @return whether the key was present
     */
    boolean delete(byte[] key);

    /** Keys within the inclusive range, ascending. */
    RangeScan<byte[]> keys(KeyRange range);

    default RangeScan<byte[]> keys(byte[] keyFrom, byte[] keyTo) {
        return keys(KeyRange.of(keyFrom, keyTo));
    }

    default RangeScan<byte[]> keys() {
        return keys(KeyRange.all());
    }

    /** Entries within the inclusive range, in the same order as {@link #keys(KeyRange)}. */
    RangeScan<Kv> items(KeyRange range);

    default RangeScan<Kv> items(byte[] keyFrom, byte[] keyTo) {
        return items(KeyRange.of(keyFrom, keyTo));
    }

    default RangeScan<Kv> items() {
        return items(KeyRange.all());
    }

    /** Forces every successful write so far to durable storage. */
    void sync();

    String getIdentifier();

    BackendType getBackendType();

    /**
     * Releases the engine. All prior successful writes are durable once this
     * returns. Cursors still open are closed. Calling it again does nothing.
     */
    @Override
    void close();
}
