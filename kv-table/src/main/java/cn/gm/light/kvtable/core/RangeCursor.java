package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.entity.Kv;
import com.google.common.collect.AbstractIterator;
import lombok.extern.slf4j.Slf4j;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;

/**
 * Shared range walk over one engine cursor.
 * <p>
 * Subclasses only position and advance the engine cursor; this class skips
 * entries below the lower bound (engines without a native seek may start
 * anywhere before it) and stops at the first key above the upper bound.
 * Key-only scans may return entries with an empty placeholder value; those
 * never leave the store.
 * <p>
 * A subclass that opens a native engine handle passes its release action to
 * {@link #track(Runnable)}. The handle is then released exactly once: when
 * the scan ends, on {@link #close()}, when the store closes, or once a caller
 * that stopped pulling drops the cursor and it is garbage collected.
 *
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @date 2025/3/10 15:31:27
 */
@Slf4j
public abstract class RangeCursor extends AbstractIterator<Kv> implements CloseableIterator<Kv> {

    protected final KeyRange range;
    private final StoreLifecycle lifecycle;
    private boolean positioned;
    private boolean released;
    private long returned;
    private Cleaner.Cleanable handle;

    protected RangeCursor(KeyRange range, StoreLifecycle lifecycle) {
        this.range = range;
        this.lifecycle = lifecycle;
        lifecycle.checkOpen("scan");
    }

    /**
     * Positions the engine cursor at the first entry with key >= the lower
     * bound, or at the first entry when there is none.
     *
     * @return that entry, or null if the engine has nothing there
     */
    protected abstract Kv seek();

    /**
     * @return the next entry in ascending key order, or null when exhausted
     */
    protected abstract Kv advance();

    /**
     * Registers the release action of the engine handle opened by
     * {@link #seek()}. The action must not capture this cursor.
     */
    protected final void track(Runnable release) {
        try {
            handle = lifecycle.track(this, release);
        } catch (RuntimeException e) {
            release.run();
            throw e;
        }
    }

    @Override
    protected final Kv computeNext() {
        lifecycle.checkOpen("scan");
        if (released) {
            return endOfData();
        }
        Kv kv;
        try {
            if (range.isEmpty()) {
                kv = null;
            } else if (!positioned) {
                positioned = true;
                kv = seek();
            } else {
                kv = advance();
            }
            while (kv != null && range.isBelowLower(kv.getKey())) {
                kv = advance();
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        } finally {
            // 引擎调用期间游标不能被回收，否则 Cleaner 会并发释放句柄
            Reference.reachabilityFence(this);
        }
        if (kv == null || range.isAboveUpper(kv.getKey())) {
            close();
            return endOfData();
        }
        returned++;
        return kv;
    }

    @Override
    public final void close() {
        if (released) {
            return;
        }
        released = true;
        if (handle != null) {
            handle.clean();
        }
        log.debug("Released cursor on {} range {} after {} entries", lifecycle.getName(), range, returned);
    }
}
