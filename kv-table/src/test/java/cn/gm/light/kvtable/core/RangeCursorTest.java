package cn.gm.light.kvtable.core;

import cn.gm.light.kvtable.entity.Kv;
import cn.gm.light.kvtable.exception.BackendIOException;
import cn.gm.light.kvtable.exception.InvalidStateException;
import cn.gm.light.kvtable.utils.Bytes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Range walk over a plain list standing in for an engine without a native
 * seek: every scan starts from the first entry.
 */
@ExtendWith(MockitoExtension.class)
public class RangeCursorTest {

    @Mock
    private Runnable onRelease;

    private final StoreLifecycle lifecycle = new StoreLifecycle("test");

    private static final List<Kv> SORTED = List.of(
            Kv.of("eight", "8"), Kv.of("five", "5"), Kv.of("four", "4"),
            Kv.of("nine", "9"), Kv.of("one", "1"), Kv.of("seven", "7"),
            Kv.of("six", "6"), Kv.of("three", "3"), Kv.of("two", "2"));

    private class ListCursor extends RangeCursor {
        private final List<Kv> source;
        private final Runnable release;
        private Iterator<Kv> it;

        ListCursor(KeyRange range, List<Kv> source, Runnable release) {
            super(range, lifecycle);
            this.source = source;
            this.release = release;
        }

        ListCursor(KeyRange range, List<Kv> source) {
            this(range, source, onRelease);
        }

        @Override
        protected Kv seek() {
            track(release);
            it = source.iterator();
            return advance();
        }

        @Override
        protected Kv advance() {
            return it.hasNext() ? it.next() : null;
        }
    }

    private List<String> drain(CloseableIterator<Kv> cursor) {
        List<String> keys = new ArrayList<>();
        cursor.forEachRemaining(kv -> keys.add(Bytes.string(kv.getKey())));
        return keys;
    }

    @Test
    public void testFilterFallbackMatchesSeek() {
        ListCursor cursor = new ListCursor(KeyRange.of(Bytes.utf8("five"), Bytes.utf8("three")), SORTED);
        assertEquals(List.of("five", "four", "nine", "one", "seven", "six", "three"), drain(cursor));
        verify(onRelease, times(1)).run();
        assertEquals(0, lifecycle.openCursorCount());
    }

    @Test
    public void testStopsAtFirstKeyAboveUpper() {
        ListCursor cursor = new ListCursor(KeyRange.atMost(Bytes.utf8("si")), SORTED);
        assertEquals(List.of("eight", "five", "four", "nine", "one", "seven"), drain(cursor));
        verify(onRelease).run();
    }

    @Test
    public void testEmptyRangeNeverTouchesEngine() {
        ListCursor cursor = new ListCursor(KeyRange.of(Bytes.utf8("z"), Bytes.utf8("a")), SORTED);
        assertFalse(cursor.hasNext());
        verify(onRelease, never()).run();
        assertEquals(0, lifecycle.openCursorCount());
    }

    @Test
    public void testCloseIsIdempotent() {
        ListCursor cursor = new ListCursor(KeyRange.all(), SORTED);
        assertEquals("eight", Bytes.string(cursor.next().getKey()));
        assertEquals(1, lifecycle.openCursorCount());
        cursor.close();
        cursor.close();
        verify(onRelease, times(1)).run();
        assertFalse(cursor.hasNext());
        assertEquals(0, lifecycle.openCursorCount());
    }

    @Test
    public void testStoreCloseReleasesAbandonedCursor() {
        ListCursor cursor = new ListCursor(KeyRange.all(), SORTED);
        cursor.next();
        assertEquals(1, lifecycle.openCursorCount());

        assertTrue(lifecycle.markClosed());
        assertFalse(lifecycle.markClosed());
        verify(onRelease).run();
        assertEquals(0, lifecycle.openCursorCount());
        assertThrows(InvalidStateException.class, cursor::hasNext);

        // 关闭后的显式 close 不会再次释放
        cursor.close();
        verify(onRelease).run();
    }

    @Test
    public void testUnreachableCursorReleasesEngineHandle() throws InterruptedException {
        AtomicInteger released = new AtomicInteger();
        for (int i = 0; i < 1000; i++) {
            ListCursor cursor = new ListCursor(KeyRange.all(), SORTED, released::incrementAndGet);
            assertTrue(cursor.hasNext());
        }
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (lifecycle.openCursorCount() > 10 && System.nanoTime() < deadline) {
            System.gc();
            Thread.sleep(20);
        }
        assertTrue(lifecycle.openCursorCount() <= 10, "still open: " + lifecycle.openCursorCount());
        assertTrue(released.get() >= 990);
        verify(onRelease, never()).run();
    }

    @Test
    public void testEngineFailureReleasesCursor() {
        @SuppressWarnings("unchecked")
        Supplier<Kv> engine = mock(Supplier.class);
        when(engine.get()).thenReturn(Kv.of("a", "1"))
                .thenThrow(new BackendIOException("disk gone", new RuntimeException("EIO")));
        RangeCursor cursor = new RangeCursor(KeyRange.all(), lifecycle) {
            @Override
            protected Kv seek() {
                track(onRelease);
                return engine.get();
            }

            @Override
            protected Kv advance() {
                return engine.get();
            }
        };
        assertEquals("a", Bytes.string(cursor.next().getKey()));
        BackendIOException e = assertThrows(BackendIOException.class, cursor::hasNext);
        assertEquals("EIO", e.getCause().getMessage());
        verify(onRelease).run();
        assertEquals(0, lifecycle.openCursorCount());
    }

    @Test
    public void testCursorNeverOpensEngineAfterStoreClose() {
        ListCursor cursor = new ListCursor(KeyRange.all(), SORTED);
        lifecycle.markClosed();
        assertThrows(InvalidStateException.class, cursor::hasNext);
        verify(onRelease, never()).run();
        assertEquals(0, lifecycle.openCursorCount());
    }
}
