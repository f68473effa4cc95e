package com.sumitzway.dbpaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class DbDataSourceTest {
    @Test
    void invalidationNotifiesOnce() {
        TestPositionalDataSource source = new TestPositionalDataSource(10, true);
        final AtomicInteger calls = new AtomicInteger();
        source.addInvalidatedCallback(calls::incrementAndGet);

        assertFalse(source.isInvalid());
        source.invalidate();
        source.invalidate();

        assertTrue(source.isInvalid());
        assertEquals(1, calls.get());
    }

    @Test
    void removedCallbackIsNotNotified() {
        TestPositionalDataSource source = new TestPositionalDataSource(10, true);
        final AtomicInteger calls = new AtomicInteger();
        DbDataSource.InvalidatedCallback callback = calls::incrementAndGet;
        source.addInvalidatedCallback(callback);
        source.removeInvalidatedCallback(callback);

        source.invalidate();
        assertEquals(0, calls.get());
    }

    @Test
    void mappedSourceSharesInvalidation() {
        TestPositionalDataSource source = new TestPositionalDataSource(10, true);
        DbPositionalDataSource<String> mapped = source.map(i -> "item" + i);
        final AtomicInteger calls = new AtomicInteger();
        source.addInvalidatedCallback(calls::incrementAndGet);

        mapped.invalidate();

        assertTrue(source.isInvalid());
        assertTrue(mapped.isInvalid());
        assertEquals(1, calls.get());
    }

    @Test
    void factoryMapAppliesToEveryCreatedSource() {
        ListObjectCollection<Integer> collection = new ListObjectCollection<>(TestData.range(0, 30));
        DbDataSource.Factory<Integer, String> factory =
                DbCollectionPositionalDataSource.factory(collection).map(i -> "v" + i);

        DbDataSource<Integer, String> first = factory.create();
        DbDataSource<Integer, String> second = factory.create();
        first.invalidate();
        assertFalse(second.isInvalid());

        DbPagedList<String> list = new DbPagedList.Builder<>(second, TestData.config(10, 10, 30))
                .setNotifyExecutor(new DbTaskQueue())
                .build();
        assertEquals(30, list.size());
        assertEquals("v29", list.get(29));
    }

    @Test
    void validatesInitialLoadArguments() {
        assertThrows(IllegalArgumentException.class, () ->
                DbDataSource.LoadCallbackHelper.validateInitialLoadParams(
                        TestData.range(0, 5), -1, 10));
        assertThrows(IllegalArgumentException.class, () ->
                DbDataSource.LoadCallbackHelper.validateInitialLoadParams(
                        TestData.range(0, 5), 6, 10));
        assertThrows(IllegalArgumentException.class, () ->
                DbDataSource.LoadCallbackHelper.validateInitialLoadParams(
                        new ArrayList<Integer>(), 0, 10));
        DbDataSource.LoadCallbackHelper.validateInitialLoadParams(Collections.emptyList(), 0, 0);
    }
}
