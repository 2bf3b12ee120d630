package cn.gm.light.kvtable.core.storage;

import cn.gm.light.kvtable.core.KeyRange;
import cn.gm.light.kvtable.core.KvStore;
import cn.gm.light.kvtable.core.RangeCursor;
import cn.gm.light.kvtable.core.RangeScan;
import cn.gm.light.kvtable.core.StoreLifecycle;
import cn.gm.light.kvtable.entity.Kv;
import cn.gm.light.kvtable.enums.BackendType;
import cn.gm.light.kvtable.utils.Bytes;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 内存跳表实现，关闭后数据丢弃；范围迭代为弱一致，可能看到迭代开始后的写入
 * @date 2025/3/12 09:20:41
 */
@Slf4j
public class MemoryKvStore implements KvStore {

    private final String name;
    private final StoreLifecycle lifecycle;
    private final ConcurrentSkipListMap<byte[], byte[]> table = new ConcurrentSkipListMap<>(Bytes.COMPARATOR);

    private MemoryKvStore(String name) {
        this.name = name;
        this.lifecycle = new StoreLifecycle("memory:" + name);
    }

    public static MemoryKvStore open(String name) {
        Preconditions.checkNotNull(name, "name");
        log.info("Opened memory store {}", name);
        return new MemoryKvStore(name);
    }

    @Override
    public byte[] get(byte[] key, byte[] defaultValue) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("get");
        byte[] value = table.get(key);
        return value == null ? defaultValue : value.clone();
    }

    @Override
    public void put(byte[] key, byte[] value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        lifecycle.checkOpen("put");
        table.put(key.clone(), value.clone());
    }

    @Override
    public void putMany(Iterable<Kv> entries) {
        Preconditions.checkNotNull(entries, "entries");
        lifecycle.checkOpen("putMany");
        for (Kv kv : entries) {
            table.put(kv.getKey().clone(), kv.getValue().clone());
        }
    }

    @Override
    public boolean delete(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("delete");
        return table.remove(key) != null;
    }

    @Override
    public RangeScan<byte[]> keys(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("keys");
        return new RangeScan<>(() -> new SkipListCursor(range, false).map(Kv::getKey));
    }

    @Override
    public RangeScan<Kv> items(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("items");
        return new RangeScan<>(() -> new SkipListCursor(range, true));
    }

    @Override
    public void sync() {
        lifecycle.checkOpen("sync");
    }

    @Override
    public String getIdentifier() {
        return name;
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.MEMORY;
    }

    @Override
    public void close() {
        if (!lifecycle.markClosed()) {
            return;
        }
        table.clear();
        log.info("Closed memory store {}", name);
    }

    private final class SkipListCursor extends RangeCursor {
        private final boolean withValues;
        private Iterator<Map.Entry<byte[], byte[]>> iterator;

        SkipListCursor(KeyRange range, boolean withValues) {
            super(range, lifecycle);
            this.withValues = withValues;
        }

        @Override
        protected Kv seek() {
            NavigableMap<byte[], byte[]> view = range.hasLowerBound()
                    ? table.tailMap(range.getFrom(), true)
                    : table;
            iterator = view.entrySet().iterator();
            return advance();
        }

        @Override
        protected Kv advance() {
            if (!iterator.hasNext()) {
                return null;
            }
            Map.Entry<byte[], byte[]> entry = iterator.next();
            return new Kv(entry.getKey().clone(), withValues ? entry.getValue().clone() : Bytes.EMPTY);
        }
    }
}
