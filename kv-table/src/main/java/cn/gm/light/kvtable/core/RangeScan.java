package cn.gm.light.kvtable.core;

import com.google.common.collect.ImmutableList;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * @author 明溪
 * @version 1.0
 * @project kvTable
 * @description 惰性范围查询结果；每次 iterator() 重新打开底层游标，可重复遍历
 * @date 2025/3/10 15:03:51
 */
public final class RangeScan<T> implements Iterable<T> {

    private final Supplier<CloseableIterator<T>> opener;

    public RangeScan(Supplier<CloseableIterator<T>> opener) {
        this.opener = opener;
    }

    /**
     * Opens a new engine cursor. The cursor is released when the iterator is
     * exhausted, when {@link CloseableIterator#close()} is called or when the
     * store is closed. A caller may also just stop pulling and drop the
     * iterator; its engine handle is then released after it is collected.
     */
    @Override
    public CloseableIterator<T> iterator() {
        return opener.get();
    }

    /**
     * Stream over a fresh cursor; closing the stream releases the cursor.
     */
    public Stream<T> stream() {
        CloseableIterator<T> it = iterator();
        Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(it,
                Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(it::close);
    }

    public ImmutableList<T> toList() {
        try (CloseableIterator<T> it = iterator()) {
            return ImmutableList.copyOf(it);
        }
    }
}
