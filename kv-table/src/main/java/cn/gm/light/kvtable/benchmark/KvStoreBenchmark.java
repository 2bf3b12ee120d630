package cn.gm.light.kvtable.benchmark;

import cn.gm.light.kvtable.core.CloseableIterator;
import cn.gm.light.kvtable.core.KvStore;
import cn.gm.light.kvtable.core.KvStoreFactory;
import cn.gm.light.kvtable.entity.Kv;
import cn.gm.light.kvtable.enums.BackendType;
import cn.gm.light.kvtable.utils.Bytes;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import lombok.extern.slf4j.Slf4j;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)          // 吞吐量（ops/ms）
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 3, time = 5)
@Measurement(iterations = 5, time = 10)
@Threads(1)                             // 单写者模型
@Fork(1)
@State(Scope.Benchmark)
@Slf4j
public class KvStoreBenchmark {

    @Param({"ROCKSDB", "SQLITE", "MVSTORE", "MEMORY"})
    private BackendType backend;

    private Path dataDir;
    private KvStore store;

    // 预生成 key，zero-padded 保证字节序与数字序一致
    private byte[][] testKeys;

    @Setup(Level.Trial)
    public void setup() throws IOException {
        dataDir = Files.createTempDirectory("kv-bench-");
        String identifier = backend == BackendType.ROCKSDB
                ? dataDir.resolve("rocks").toString()
                : dataDir.resolve("store.db").toString();
        store = KvStoreFactory.open(backend, identifier);

        int dataSize = 100_000;
        testKeys = new byte[dataSize][];
        List<Kv> batch = new ArrayList<>(1000);
        for (int i = 0; i < dataSize; i++) {
            testKeys[i] = Bytes.utf8(String.format("key%08d", i));
            batch.add(Kv.of(testKeys[i], Bytes.utf8("value_" + i)));
            if (batch.size() == 1000) {
                store.putMany(batch);
                batch.clear();
            }
        }
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        store.close();
        try {
            MoreFiles.deleteRecursively(dataDir, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            log.error("Failed to delete benchmark directory {}", dataDir, e);
        }
    }

    private byte[] randomKey() {
        return testKeys[ThreadLocalRandom.current().nextInt(testKeys.length)];
    }

    @Benchmark
    public void putMany(Blackhole blackhole) {
        // 单次写入10条，模拟批量
        List<Kv> batch = new ArrayList<>(10);
        for (int i = 0; i < 10; i++) {
            batch.add(Kv.of(randomKey(), Bytes.utf8("value_" + System.nanoTime())));
        }
        store.putMany(batch);
        blackhole.consume(batch);
    }

    @Benchmark
    public void getHit(Blackhole blackhole) {
        blackhole.consume(store.get(randomKey()));
    }

    @Benchmark
    public void getMiss(Blackhole blackhole) {
        byte[] key = Bytes.utf8("miss_" + ThreadLocalRandom.current().nextInt());
        blackhole.consume(store.get(key));
    }

    @Benchmark
    public void scan100(Blackhole blackhole) {
        int from = ThreadLocalRandom.current().nextInt(testKeys.length - 100);
        try (CloseableIterator<Kv> it = store.items(testKeys[from], testKeys[from + 99]).iterator()) {
            while (it.hasNext()) {
                blackhole.consume(it.next());
            }
        }
    }
}
