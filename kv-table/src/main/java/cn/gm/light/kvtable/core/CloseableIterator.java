package cn.gm.light.kvtable.core;

import java.util.Iterator;
import java.util.function.Function;

/**
 * Forward-only iterator holding an engine cursor until exhausted or closed.
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();

    default <R> CloseableIterator<R> map(Function<? super T, ? extends R> fn) {
        CloseableIterator<T> source = this;
        return new CloseableIterator<R>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public R next() {
                return fn.apply(source.next());
            }

            @Override
            public void close() {
                source.close();
            }
        };
    }
}
