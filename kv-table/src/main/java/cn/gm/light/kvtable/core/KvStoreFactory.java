package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.core.config.StoreConfig;
import cn.gm.light.kvtable.core.storage.MemoryKvStore;
import cn.gm.light.kvtable.core.storage.MvStoreKvStore;
import cn.gm.light.kvtable.core.storage.RocksDbKvStore;
import cn.gm.light.kvtable.core.storage.SqliteKvStore;
import cn.gm.light.kvtable.enums.BackendType;
import lombok.extern.slf4j.Slf4j;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 按 BackendType 选择存储实现
 * @date 2025/3/12 11:05:16
 */
@Slf4j
public final class KvStoreFactory {

    public static KvStore open(BackendType backend, String identifier) {
        return open(StoreConfig.of(backend, identifier));
    }

    public static KvStore open(StoreConfig config) {
        config.validate();
        log.debug("Opening {} store at {}", config.getBackend(), config.getDataDir());
        switch (config.getBackend()) {
            case ROCKSDB:
                return RocksDbKvStore.open(config);
            case SQLITE:
                return SqliteKvStore.open(config);
            case MVSTORE:
                return MvStoreKvStore.open(config);
            case MEMORY:
                return MemoryKvStore.open(config.getDataDir());
            default:
                throw new IllegalArgumentException("Unsupported backend: " + config.getBackend());
        }
    }

    private KvStoreFactory() {
    }
}
