package cn.gm.light.kvtable.core.storage;

import cn.gm.light.kvtable.core.KeyRange;
import cn.gm.light.kvtable.core.KvStore;
import cn.gm.light.kvtable.core.RangeCursor;
import cn.gm.light.kvtable.core.RangeScan;
import cn.gm.light.kvtable.core.StoreLifecycle;
import cn.gm.light.kvtable.core.config.StoreConfig;
import cn.gm.light.kvtable.entity.Kv;
import cn.gm.light.kvtable.enums.BackendType;
import cn.gm.light.kvtable.exception.BackendIOException;
import cn.gm.light.kvtable.utils.Bytes;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.h2.mvstore.Cursor;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;

import java.io.File;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * On-disk B-tree backend on H2 MVStore, a single map named {@code kv}.
 * <p>
 * The map keeps references to the arrays it is given, so keys and values
 * are copied on the way in and out. A scan cursor walks the copy-on-write
 * root current when the cursor is positioned, a snapshot: later writes are
 * not observed. Writes are committed by {@link #putMany}, {@link #sync},
 * {@link #close}, MVStore's background auto-commit, and after every write
 * when {@code syncWrites} is set.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/11 16:47:20
 */
@Slf4j
public class MvStoreKvStore implements KvStore {

    static final String MAP_NAME = "kv";

    private final String fileName;
    private final boolean syncWrites;
    private final ReentrantLock lock = new ReentrantLock();
    private final StoreLifecycle lifecycle;
    private final MVStore store;
    private final MVMap<byte[], byte[]> map;

    private MvStoreKvStore(String fileName, boolean syncWrites, MVStore store, MVMap<byte[], byte[]> map) {
        this.fileName = fileName;
        this.syncWrites = syncWrites;
        this.store = store;
        this.map = map;
        this.lifecycle = new StoreLifecycle("mvstore:" + fileName);
    }

    public static MvStoreKvStore open(String fileName) {
        return open(StoreConfig.of(BackendType.MVSTORE, fileName));
    }

    public static MvStoreKvStore open(StoreConfig config) {
        config.validate();
        String path = config.getDataDir();
        File file = new File(path);
        if (!file.exists()) {
            if (!config.isCreateIfMissing()) {
                throw new BackendIOException("Failed to open MVStore at " + path + ": file does not exist",
                        new NoSuchFileException(path));
            }
            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && parent.mkdirs()) {
                log.warn("Created a new directory: {}", parent);
            }
        }
        MVStore store = null;
        try {
            store = new MVStore.Builder()
                    .fileName(path)
                    .cacheSize(config.getCacheSizeMb())
                    .open();
            MVMap<byte[], byte[]> map = store.openMap(MAP_NAME, new MVMap.Builder<byte[], byte[]>()
                    .keyType(UnsignedBytesType.INSTANCE)
                    .valueType(UnsignedBytesType.INSTANCE));
            log.info("Opened MVStore store at {}", path);
            return new MvStoreKvStore(path, config.isSyncWrites(), store, map);
        } catch (MVStoreException e) {
            if (store != null) {
                store.closeImmediately();
            }
            log.error("Failed to open MVStore at {}", path, e);
            throw new BackendIOException("Failed to open MVStore at " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(byte[] key, byte[] defaultValue) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("get");
        this.lock.lock();
        try {
            byte[] value = map.get(key);
            return value == null ? defaultValue : value.clone();
        } catch (MVStoreException e) {
            throw failure("get " + Bytes.toDisplay(key), e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void put(byte[] key, byte[] value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        lifecycle.checkOpen("put");
        this.lock.lock();
        try {
            map.put(key.clone(), value.clone());
            if (syncWrites) {
                store.commit();
            }
        } catch (MVStoreException e) {
            throw failure("put " + Bytes.toDisplay(key), e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void putMany(Iterable<Kv> entries) {
        Preconditions.checkNotNull(entries, "entries");
        lifecycle.checkOpen("putMany");
        this.lock.lock();
        try {
            for (Kv kv : entries) {
                map.put(kv.getKey().clone(), kv.getValue().clone());
            }
            // 整批只提交一次
            store.commit();
        } catch (MVStoreException e) {
            throw failure("putMany", e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public boolean delete(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("delete");
        this.lock.lock();
        try {
            boolean removed = map.remove(key) != null;
            if (removed && syncWrites) {
                store.commit();
            }
            return removed;
        } catch (MVStoreException e) {
            throw failure("delete " + Bytes.toDisplay(key), e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public RangeScan<byte[]> keys(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("keys");
        return new RangeScan<>(() -> new MvCursor(range, false).map(Kv::getKey));
    }

    @Override
    public RangeScan<Kv> items(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("items");
        return new RangeScan<>(() -> new MvCursor(range, true));
    }

    @Override
    public void sync() {
        lifecycle.checkOpen("sync");
        this.lock.lock();
        try {
            store.commit();
        } catch (MVStoreException e) {
            throw failure("sync", e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public String getIdentifier() {
        return fileName;
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.MVSTORE;
    }

    @Override
    public void close() {
        this.lock.lock();
        try {
            if (!lifecycle.markClosed()) {
                return;
            }
            store.close();
            log.info("Closed MVStore store at {}", fileName);
        } catch (MVStoreException e) {
            throw failure("close", e);
        } finally {
            this.lock.unlock();
        }
    }

    private BackendIOException failure(String operation, MVStoreException e) {
        log.error("MVStore {} failed at {}", operation, fileName, e);
        return new BackendIOException("MVStore " + operation + " failed at " + fileName + ": " + e.getMessage(), e);
    }

    private final class MvCursor extends RangeCursor {
        private final boolean withValues;
        private Cursor<byte[], byte[]> cursor;

        MvCursor(KeyRange range, boolean withValues) {
            super(range, lifecycle);
            this.withValues = withValues;
        }

        @Override
        protected Kv seek() {
            try {
                cursor = map.cursor(range.getFrom());
            } catch (MVStoreException e) {
                throw failure("scan " + range, e);
            }
            return advance();
        }

        @Override
        protected Kv advance() {
            try {
                if (!cursor.hasNext()) {
                    return null;
                }
                byte[] key = cursor.next();
                return new Kv(key.clone(), withValues ? cursor.getValue().clone() : Bytes.EMPTY);
            } catch (MVStoreException e) {
                throw failure("scan " + range, e);
            }
        }
    }
}
