package com.sumitzway.dbpaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;

class DbPageKeyedDataSourceTest {
    private final DbTaskQueue queue = new DbTaskQueue();
    private final RecordingBoundaryCallback<Integer> boundary = new RecordingBoundaryCallback<>();

    private DbPagedList<Integer> build(DbPageKeyedDataSource<Integer, Integer> source) {
        return new DbPagedList.Builder<>(source, TestData.config(10, 10, 30))
                .setNotifyExecutor(queue)
                .setBoundaryCallback(boundary)
                .build();
    }

    @Test
    void followsPageKeysInBothDirections() {
        DbPagedList<Integer> list = build(new TestPageKeyedDataSource(45, 10, 2, false));
        assertEquals(10, list.size());
        assertEquals(20, list.get(0));

        list.loadAround(9);
        queue.drain();
        assertEquals(30, list.size());
        assertEquals(10, list.get(0));
        assertEquals(39, list.get(29));

        list.loadAround(29);
        queue.drain();
        assertEquals(35, list.size());
        assertEquals(Collections.singletonList(44), boundary.end);

        list.loadAround(0);
        queue.drain();
        assertEquals(45, list.size());
        assertEquals(0, list.get(0));
        assertEquals(Collections.singletonList(0), boundary.front);
        assertEquals(list.size(), TestData.placeholderSum(list));
    }

    @Test
    void countedInitialLoadFillsPlaceholders() {
        DbPagedList<Integer> list = build(new TestPageKeyedDataSource(45, 10, 2, true));
        assertEquals(45, list.size());
        assertNull(list.get(19));
        assertEquals(20, list.get(20));

        list.loadAround(20);
        queue.drain();

        assertEquals(45, list.size());
        assertEquals(10, list.get(10));
        assertEquals(39, list.get(39));
        assertEquals(list.size(), TestData.placeholderSum(list));
    }

    @Test
    void emptySourceReportsZeroItems() {
        DbPagedList<Integer> list = build(new TestPageKeyedDataSource(0, 10, 0, false));
        assertEquals(0, list.size());
        assertEquals(1, boundary.zeroItemsLoaded);
    }

    @Test
    void doesNotPersistLastKey() {
        DbPagedList<Integer> list = build(new TestPageKeyedDataSource(45, 10, 2, false));
        list.loadAround(5);
        assertNull(list.getLastKey());
    }

    @Test
    void mappedSourceConvertsPagesAndKeepsKeys() {
        TestPageKeyedDataSource source = new TestPageKeyedDataSource(45, 10, 2, false);
        DbPageKeyedDataSource<Integer, String> mapped = source.map(i -> "item" + i);
        DbPagedList<String> list = new DbPagedList.Builder<>(mapped, TestData.config(10, 10, 30))
                .setNotifyExecutor(queue)
                .build();

        list.loadAround(9);
        queue.drain();

        assertEquals("item10", list.get(0));
        assertEquals("item39", list.get(29));

        mapped.invalidate();
        assertTrue(source.isInvalid());
    }

    @Test
    void initialCallbackAcceptsOneResult() {
        DbPageKeyedDataSource<Integer, Integer> source = new DbPageKeyedDataSource<Integer, Integer>() {
            @Override
            public void loadInitial(@Nonnull LoadInitialParams<Integer> params,
                                    @Nonnull LoadInitialCallback<Integer, Integer> callback) {
                callback.onResult(TestData.range(0, 10), null, 1);
                callback.onResult(TestData.range(0, 10), null, 1);
            }

            @Override
            public void loadBefore(@Nonnull LoadParams<Integer> params,
                                   @Nonnull LoadCallback<Integer, Integer> callback) {
                callback.onResult(Collections.<Integer>emptyList(), null);
            }

            @Override
            public void loadAfter(@Nonnull LoadParams<Integer> params,
                                  @Nonnull LoadCallback<Integer, Integer> callback) {
                callback.onResult(Collections.<Integer>emptyList(), null);
            }
        };

        DbPagedList.Builder<Integer, Integer> builder =
                new DbPagedList.Builder<>(source, TestData.config(10, 10, 30))
                        .setNotifyExecutor(queue);
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void rejectsInitialResultBeyondTotalCount() {
        DbPageKeyedDataSource<Integer, Integer> source = new TestPageKeyedDataSource(45, 10, 0, false) {
            @Override
            public void loadInitial(@Nonnull LoadInitialParams<Integer> params,
                                    @Nonnull LoadInitialCallback<Integer, Integer> callback) {
                callback.onResult(TestData.range(0, 10), 40, 45, null, 1);
            }
        };

        DbPagedList.Builder<Integer, Integer> builder =
                new DbPagedList.Builder<>(source, TestData.config(10, 10, 30))
                        .setNotifyExecutor(queue);
        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
