package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.exception.InvalidStateException;
import lombok.extern.slf4j.Slf4j;

import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 存储的打开/关闭状态，以及游标持有的引擎句柄
 * @date 2025/3/10 16:40:12
 */
@Slf4j
public final class StoreLifecycle {

    // 游标不可达后由 Cleaner 线程释放其引擎句柄
    private static final Cleaner CLEANER = Cleaner.create();

    private final String name;
    private volatile boolean closed;
    private final Set<EngineHandle> openHandles = ConcurrentHashMap.newKeySet();

    public StoreLifecycle(String name) {
        this.name = name;
    }

    public void checkOpen(String operation) {
        if (closed) {
            throw new InvalidStateException(operation + " on closed store " + name);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Tracks an engine handle owned by {@code owner}. The handle is released
     * by whichever comes first: {@link Cleaner.Cleanable#clean()}, the owner
     * becoming phantom reachable, or {@link #markClosed()}.
     * <p>
     * {@code release} must not reference {@code owner}, or the owner never
     * becomes unreachable.
     *
     * @throws InvalidStateException if the store is already closed
     */
    public Cleaner.Cleanable track(Object owner, Runnable release) {
        EngineHandle handle = new EngineHandle(release);
        synchronized (this) {
            checkOpen("scan");
            openHandles.add(handle);
        }
        return CLEANER.register(owner, handle);
    }

    /**
     * @return the number of cursors still holding an engine handle
     */
    public int openCursorCount() {
        return openHandles.size();
    }

    /**
     * Marks the store closed and releases every engine handle still held.
     *
     * @return false if the store was already closed
     */
    public synchronized boolean markClosed() {
        if (closed) {
            return false;
        }
        closed = true;
        List<EngineHandle> pending = new ArrayList<>(openHandles);
        if (!pending.isEmpty()) {
            log.warn("Closing {} abandoned cursor(s) of store {}", pending.size(), name);
        }
        for (EngineHandle handle : pending) {
            handle.run();
        }
        return true;
    }

    public String getName() {
        return name;
    }

    private final class EngineHandle implements Runnable {
        private final Runnable release;
        private boolean released;

        EngineHandle(Runnable release) {
            this.release = release;
        }

        @Override
        public void run() {
            // 与 markClosed 互斥，store 关闭引擎前所有句柄都已释放
            synchronized (StoreLifecycle.this) {
                if (released) {
                    return;
                }
                released = true;
                openHandles.remove(this);
                release.run();
            }
        }
    }
}
