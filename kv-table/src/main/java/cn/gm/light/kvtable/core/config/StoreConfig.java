package cn.gm.light.kvtable.core.config;

import cn.gm.light.kvtable.enums.BackendType;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.google.common.base.Enums;
import com.google.common.base.Preconditions;
import com.google.common.io.Resources;
import lombok.Data;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 存储打开参数，可由 JSON 文件加载
 * @date 2025/3/4 09:07:47
 */
@Data
public class StoreConfig {
    private BackendType backend;

    // 目录(rocksdb)、文件(sqlite/mvstore)或内存实例名
    private String dataDir;

    private boolean createIfMissing = true;

    // 每次写入都落盘
    private boolean syncWrites = false;

    // sqlite 范围扫描每页行数
    private int scanBatchSize = 256;

    // mvstore 页缓存大小
    private int cacheSizeMb = 16;

    private String sqliteJournalMode = "WAL";

    public static StoreConfig of(BackendType backend, String dataDir) {
        StoreConfig config = new StoreConfig();
        config.setBackend(backend);
        config.setDataDir(dataDir);
        return config;
    }

    public static StoreConfig fromJson(String json) {
        StoreConfig config;
        try {
            config = JSON.parseObject(json, StoreConfig.class);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed store config: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new IllegalArgumentException("Empty store config");
        }
        return config.validate();
    }

    public static StoreConfig load(Path file) {
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read store config " + file, e);
        }
    }

    public static StoreConfig loadResource(String name) {
        URL url = Resources.getResource(name);
        try {
            return fromJson(Resources.toString(url, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read store config resource " + name, e);
        }
    }

    public StoreConfig validate() {
        Preconditions.checkArgument(backend != null, "backend is required");
        Preconditions.checkArgument(dataDir != null && !dataDir.isEmpty(), "dataDir is required");
        Preconditions.checkArgument(scanBatchSize > 0, "scanBatchSize must be positive: %s", scanBatchSize);
        Preconditions.checkArgument(cacheSizeMb > 0, "cacheSizeMb must be positive: %s", cacheSizeMb);
        Preconditions.checkArgument(sqliteJournalMode != null
                        && Enums.getIfPresent(SQLiteConfig.JournalMode.class,
                        sqliteJournalMode.toUpperCase(Locale.ROOT)).isPresent(),
                "unknown sqliteJournalMode: %s", sqliteJournalMode);
        return this;
    }
}
