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
import org.sqlite.SQLiteConfig;

import java.io.File;
import java.nio.file.NoSuchFileException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Embedded relational backend on SQLite, one table
 * {@code kv(key BLOB PRIMARY KEY, value BLOB) WITHOUT ROWID}.
 * <p>
 * Keys and values only ever travel as BLOB parameters and columns, never as
 * text, so NUL bytes round-trip. SQLite orders BLOBs with {@code memcmp},
 * which is the unsigned byte order the store promises.
 * <p>
 * Range scans are indexed queries fetched in pages of
 * {@link StoreConfig#getScanBatchSize()} rows, each page resuming after the
 * last key returned. Writes made between pages are observed when they sort
 * after that key; there is no snapshot.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/11 10:12:36
 */
@Slf4j
public class SqliteKvStore implements KvStore {

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS kv (key BLOB NOT NULL PRIMARY KEY, value BLOB NOT NULL) WITHOUT ROWID";
    // 空数组可能被驱动绑定为 NULL，统一折算为空 BLOB
    private static final String SELECT_VALUE = "SELECT value FROM kv WHERE key = ifnull(?, X'')";
    private static final String UPSERT = "INSERT OR REPLACE INTO kv (key, value) VALUES (ifnull(?, X''), ifnull(?, X''))";
    private static final String DELETE = "DELETE FROM kv WHERE key = ifnull(?, X'')";
    private static final String CHECKPOINT = "PRAGMA wal_checkpoint(FULL)";

    private final String dbFile;
    private final int scanBatchSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final StoreLifecycle lifecycle;
    private final Connection connection;

    SqliteKvStore(String dbFile, int scanBatchSize, Connection connection) {
        this.dbFile = dbFile;
        this.scanBatchSize = scanBatchSize;
        this.connection = connection;
        this.lifecycle = new StoreLifecycle("sqlite:" + dbFile);
    }

    public static SqliteKvStore open(String dbFile) {
        return open(StoreConfig.of(BackendType.SQLITE, dbFile));
    }

    public static SqliteKvStore open(StoreConfig config) {
        config.validate();
        String path = config.getDataDir();
        File file = new File(path);
        if (!file.exists()) {
            if (!config.isCreateIfMissing()) {
                throw new BackendIOException("Failed to open SQLite at " + path + ": file does not exist",
                        new NoSuchFileException(path));
            }
            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && parent.mkdirs()) {
                log.warn("Created a new directory: {}", parent);
            }
        }

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.valueOf(
                config.getSqliteJournalMode().toUpperCase(Locale.ROOT)));
        sqliteConfig.setSynchronous(config.isSyncWrites()
                ? SQLiteConfig.SynchronousMode.FULL : SQLiteConfig.SynchronousMode.NORMAL);

        Connection connection = null;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + path, sqliteConfig.toProperties());
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate(CREATE_TABLE);
            }
            log.info("Opened SQLite store at {}", path);
            return new SqliteKvStore(path, config.getScanBatchSize(), connection);
        } catch (SQLException e) {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            log.error("Failed to open SQLite at {}", path, e);
            throw new BackendIOException("Failed to open SQLite at " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] get(byte[] key, byte[] defaultValue) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("get");
        this.lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(SELECT_VALUE)) {
            ps.setBytes(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? blob(rs, 1) : defaultValue;
            }
        } catch (SQLException e) {
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
        try (PreparedStatement ps = connection.prepareStatement(UPSERT)) {
            ps.setBytes(1, key);
            ps.setBytes(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure("put " + Bytes.toDisplay(key), e);
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * One transaction and one statement batch for the whole sequence.
     */
    @Override
    public void putMany(Iterable<Kv> entries) {
        Preconditions.checkNotNull(entries, "entries");
        lifecycle.checkOpen("putMany");
        this.lock.lock();
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement ps = connection.prepareStatement(UPSERT)) {
                for (Kv kv : entries) {
                    ps.setBytes(1, kv.getKey());
                    ps.setBytes(2, kv.getValue());
                    ps.addBatch();
                }
                ps.executeBatch();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(e);
                restoreAutoCommit(e);
                throw e;
            }
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw failure("putMany", e);
        } finally {
            this.lock.unlock();
        }
    }

    private void rollbackQuietly(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }

    private void restoreAutoCommit(Exception cause) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException autoCommitError) {
            cause.addSuppressed(autoCommitError);
        }
    }

    @Override
    public boolean delete(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        lifecycle.checkOpen("delete");
        this.lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(DELETE)) {
            ps.setBytes(1, key);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw failure("delete " + Bytes.toDisplay(key), e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public RangeScan<byte[]> keys(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("keys");
        return new RangeScan<>(() -> new SqliteCursor(range, false).map(Kv::getKey));
    }

    @Override
    public RangeScan<Kv> items(KeyRange range) {
        Preconditions.checkNotNull(range, "range");
        lifecycle.checkOpen("items");
        return new RangeScan<>(() -> new SqliteCursor(range, true));
    }

    @Override
    public void sync() {
        lifecycle.checkOpen("sync");
        this.lock.lock();
        try (Statement statement = connection.createStatement()) {
            statement.execute(CHECKPOINT);
        } catch (SQLException e) {
            throw failure("sync", e);
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public String getIdentifier() {
        return dbFile;
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.SQLITE;
    }

    @Override
    public void close() {
        this.lock.lock();
        try {
            if (!lifecycle.markClosed()) {
                return;
            }
            connection.close();
            log.info("Closed SQLite store at {}", dbFile);
        } catch (SQLException e) {
            throw failure("close", e);
        } finally {
            this.lock.unlock();
        }
    }

    private BackendIOException failure(String operation, SQLException e) {
        log.error("SQLite {} failed at {}", operation, dbFile, e);
        return new BackendIOException("SQLite " + operation + " failed at " + dbFile + ": " + e.getMessage(), e);
    }

    private static byte[] blob(ResultSet rs, int column) throws SQLException {
        byte[] bytes = rs.getBytes(column);
        // NOT NULL 列，驱动对零长度 BLOB 可能返回 null
        return bytes == null ? Bytes.EMPTY : bytes;
    }

    static String scanSql(boolean withValues, boolean hasLower, boolean lowerInclusive, boolean hasUpper) {
        StringBuilder sql = new StringBuilder(withValues ? "SELECT key, value FROM kv" : "SELECT key FROM kv");
        if (hasLower || hasUpper) {
            sql.append(" WHERE ");
        }
        if (hasLower) {
            sql.append(lowerInclusive ? "key >= ifnull(?, X'')" : "key > ifnull(?, X'')");
        }
        if (hasLower && hasUpper) {
            sql.append(" AND ");
        }
        if (hasUpper) {
            sql.append("key <= ifnull(?, X'')");
        }
        return sql.append(" ORDER BY key LIMIT ?").toString();
    }

    private final class SqliteCursor extends RangeCursor {
        private final boolean withValues;
        private final Deque<Kv> page = new ArrayDeque<>();
        private byte[] lastKey;
        private boolean lastPage;

        SqliteCursor(KeyRange range, boolean withValues) {
            super(range, lifecycle);
            this.withValues = withValues;
        }

        @Override
        protected Kv seek() {
            fetchPage();
            return page.poll();
        }

        @Override
        protected Kv advance() {
            if (page.isEmpty() && !lastPage) {
                fetchPage();
            }
            return page.poll();
        }

        private void fetchPage() {
            boolean resume = lastKey != null;
            byte[] lower = resume ? lastKey : range.getFrom();
            String sql = scanSql(withValues, lower != null, !resume, range.hasUpperBound());
            lock.lock();
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                int index = 1;
                if (lower != null) {
                    ps.setBytes(index++, lower);
                }
                if (range.hasUpperBound()) {
                    ps.setBytes(index++, range.getTo());
                }
                ps.setInt(index, scanBatchSize);
                int rows = 0;
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        byte[] key = blob(rs, 1);
                        page.add(new Kv(key, withValues ? blob(rs, 2) : Bytes.EMPTY));
                        lastKey = key;
                        rows++;
                    }
                }
                lastPage = rows < scanBatchSize;
            } catch (SQLException e) {
                throw failure("scan " + range, e);
            } finally {
                lock.unlock();
            }
        }
    }
}
