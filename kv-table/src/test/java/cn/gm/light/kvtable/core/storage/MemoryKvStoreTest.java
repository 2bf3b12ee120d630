package cn.gm.light.kvtable.core.storage;

import cn.gm.light.kvtable.core.KvStore;
import cn.gm.light.kvtable.enums.BackendType;
import cn.gm.light.kvtable.utils.Bytes;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MemoryKvStoreTest extends AbstractKvStoreTest {

    @Override
    protected KvStore openStore(Path dir) {
        return MemoryKvStore.open(dir.toString());
    }

    @Override
    protected boolean persistent() {
        return false;
    }

    @Test
    public void testInstancesAreIndependent() {
        store.put(Bytes.utf8("k"), Bytes.utf8("v"));
        try (KvStore other = MemoryKvStore.open(store.getIdentifier())) {
            assertNull(other.get(Bytes.utf8("k")));
            assertEquals(BackendType.MEMORY, other.getBackendType());
        }
    }
}
