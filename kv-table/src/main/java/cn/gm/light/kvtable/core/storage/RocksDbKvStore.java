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
import org.rocksdb.FlushOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.File;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Log-structured backend on RocksDB, default column family, default
 * bytewise comparator (already unsigned lexicographic).
 * <p>
 * Range scans seek natively. A scan iterator reads the implicit snapshot
 * RocksDB takes when the engine iterator is created on the first
 * {@code hasNext()}; writes made after that point are not observed. The
 * native iterator is closed when the scan ends or is closed, when the store
 * closes, or after an abandoned cursor is garbage collected.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/4 18:04:00
 */
@Slf4j
public class RocksDbKvStore implements KvStore {

    static {
        RocksDB.loadLibrary();
    }

    private final String dataDir;
    private final ReentrantLock lock = new ReentrantLock();
    private final StoreLifecycle lifecycle;
    private final Options options;
    private final WriteOptions writeOptions;
    private final RocksDB db;

    private RocksDbKvStore(String dataDir, Options options, WriteOptions writeOptions, RocksDB db) {
        this.dataDir = dataDir;
        this.options = options;
        this.writeOptions = writeOptions;
        this.db = db;
        this.lifecycle = new StoreLifecycle("rocksdb:" + dataDir);
    }

    public static RocksDbKvStore open(String dataDir) {
        return open(StoreConfig.of(BackendType.ROCKSDB, dataDir));
    }

    public static RocksDbKvStore open(StoreConfig config) {
        config.validate();
        String dir = initializeDataDir(config);
        Options options = new Options().setCreateIfMissing(config.isCreateIfMissing());
        WriteOptions writeOptions = new WriteOptions().setSync(config.isSyncWrites());
        try {
            RocksDB db = RocksDB.open(options, dir);
            log.info("Opened RocksDB store at {}", dir);
            return new RocksDbKvStore(dir, options, writeOptions, db);
        } catch (RocksDBException e) {
            writeOptions.close();
            options.close();
            log.error("Failed to open RocksDB at {}", dir, e);
            throw new BackendIOException("Failed to open RocksDB at " + dir + ": " + e.getMessage(), e);
        }
    }

    private static String initializeDataDir(StoreConfig config) {
        String dir = config.getDataDir();
        File file = new File(dir);
        if (!file.exists() && config.isCreateIfMissing()) {
            boolean success = file.mkdirs();
            if (success) {
                log.warn("Created a new directory: {}", dir);
            }
        }
        return dir;
    }

    @Override
    public byte[] get(byte[] key, byte[] defaultValue) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("get");
        this.lock.lock();
        try {
            byte[] value = db.get(key);
            return value == null ? defaultValue : value;
        } catch (RocksDBException e) {
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
            db.put(writeOptions, key, value);
        } catch (RocksDBException e) {
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
        try (WriteBatch batch = new WriteBatch()) {
            // 批内按顺序写入，重复 key 后者覆盖前者
            for (Kv kv : entries) {
                batch.put(kv.getKey(), kv.getValue());
            }
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
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
            if (db.get(key) == null) {
                return false;
            }
            db.delete(writeOptions, key);
            return true;
        } catch (RocksDBException e) {
            throw failure("delete " + Bytes.toDisplay(key), e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public RangeScan<byte[]> keys(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("keys");
        return new RangeScan<>(() -> new RocksCursor(range, false).map(Kv::getKey));
    }

    @Override
    public RangeScan<Kv> items(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("items");
        return new RangeScan<>(() -> new RocksCursor(range, true));
    }

    @Override
    public void sync() {
        lifecycle.checkOpen("sync");
        this.lock.lock();
        try {
            db.flushWal(true);
        } catch (RocksDBException e) {
            throw failure("sync", e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public String getIdentifier() {
        return dataDir;
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.ROCKSDB;
    }

    @Override
    public void close() {
        this.lock.lock();
        try {
            if (!lifecycle.markClosed()) {
                return;
            }
            RocksDBException error = null;
            try {
                flushMemtables();
            } catch (RocksDBException e) {
                error = e;
            }
            // flush 失败也要关闭 db，释放目录锁
            try {
                db.closeE();
            } catch (RocksDBException e) {
                if (error == null) {
                    error = e;
                } else {
                    error.addSuppressed(e);
                }
            } finally {
                writeOptions.close();
                options.close();
            }
            if (error != null) {
                throw failure("close", error);
            }
            log.info("Closed RocksDB store at {}", dataDir);
        } finally {
            this.lock.unlock();
        }
    }

    void flushMemtables() throws RocksDBException {
        try (FlushOptions flushOptions = new FlushOptions().setWaitForFlush(true)) {
            db.flush(flushOptions);
        }
    }

    int openCursorCount() {
        return lifecycle.openCursorCount();
    }

    private BackendIOException failure(String operation, RocksDBException e) {
        log.error("RocksDB {} failed at {}", operation, dataDir, e);
        return new BackendIOException("RocksDB " + operation + " failed at " + dataDir + ": " + e.getMessage(), e);
    }

    private final class RocksCursor extends RangeCursor {
        private final boolean withValues;
        private RocksIterator iterator;

        RocksCursor(KeyRange range, boolean withValues) {
            super(range, lifecycle);
            this.withValues = withValues;
        }

        @Override
        protected Kv seek() {
            RocksIterator it = db.newIterator();
            track(it::close);
            iterator = it;
            if (range.hasLowerBound()) {
                iterator.seek(range.getFrom());
            } else {
                iterator.seekToFirst();
            }
            return current();
        }

        @Override
        protected Kv advance() {
            iterator.next();
            return current();
        }

        private Kv current() {
            if (!iterator.isValid()) {
                try {
                    // 迭代结束或出错，status 区分两者
                    iterator.status();
                } catch (RocksDBException e) {
                    throw failure("scan " + range, e);
                }
                return null;
            }
            return new Kv(iterator.key(), withValues ? iterator.value() : Bytes.EMPTY);
        }
    }
}
