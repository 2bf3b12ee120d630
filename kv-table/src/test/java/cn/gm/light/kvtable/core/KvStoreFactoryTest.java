package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.core.config.StoreConfig;
import cn.gm.light.kvtable.core.storage.MemoryKvStore;
import cn.gm.light.kvtable.core.storage.MvStoreKvStore;
import cn.gm.light.kvtable.core.storage.RocksDbKvStore;
import cn.gm.light.kvtable.core.storage.SqliteKvStore;
import cn.gm.light.kvtable.entity.Kv;
import cn.gm.light.kvtable.enums.BackendType;
import cn.gm.light.kvtable.utils.Bytes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KvStoreFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    public void testSelectsAdapterByBackend() {
        try (KvStore rocks = KvStoreFactory.open(BackendType.ROCKSDB, tempDir.resolve("rocks").toString());
             KvStore sqlite = KvStoreFactory.open(BackendType.SQLITE, tempDir.resolve("kv.db").toString());
             KvStore mv = KvStoreFactory.open(BackendType.MVSTORE, tempDir.resolve("kv.mv.db").toString());
             KvStore memory = KvStoreFactory.open(BackendType.MEMORY, "factory")) {
            assertTrue(rocks instanceof RocksDbKvStore);
            assertTrue(sqlite instanceof SqliteKvStore);
            assertTrue(mv instanceof MvStoreKvStore);
            assertTrue(memory instanceof MemoryKvStore);
            assertEquals(tempDir.resolve("kv.db").toString(), sqlite.getIdentifier());
            assertEquals(BackendType.ROCKSDB, rocks.getBackendType());
            assertEquals(BackendType.MEMORY, memory.getBackendType());
        }
    }

    @Test
    public void testBackendsAgree() {
        List<Kv> entries = List.of(Kv.of("b", "2"), Kv.of(new byte[]{0}, new byte[]{0}),
                Kv.of(new byte[]{(byte) 0xfe}, Bytes.EMPTY), Kv.of("a", "1"), Kv.of("b", "3"));
        List<Kv> reference = null;
        for (BackendType backend : BackendType.values()) {
            String identifier = tempDir.resolve("agree-" + backend.name().toLowerCase()).toString();
            try (KvStore store = KvStoreFactory.open(backend, identifier)) {
                store.putMany(entries);
                List<Kv> items = store.items(new byte[]{0}, Bytes.utf8("b")).toList();
                if (reference == null) {
                    reference = items;
                } else {
                    assertEquals(reference, items, backend.name());
                }
            }
        }
        assertEquals(List.of(Kv.of(new byte[]{0}, new byte[]{0}), Kv.of("a", "1"), Kv.of("b", "3")), reference);
    }

    @Test
    public void testRejectsIncompleteConfig() {
        assertThrows(IllegalArgumentException.class, () -> KvStoreFactory.open(new StoreConfig()));
        assertThrows(IllegalArgumentException.class, () -> KvStoreFactory.open(BackendType.SQLITE, ""));
    }
}
