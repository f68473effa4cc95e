package com.sumitzway.dbpaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class DbContiguousPagedListTest {
    private final DbTaskQueue queue = new DbTaskQueue();
    private final RecordingBoundaryCallback<Integer> boundary = new RecordingBoundaryCallback<>();

    private DbPagedList<Integer> build(DbDataSource<Integer, Integer> source,
                                       DbPagedList.Config config) {
        return new DbPagedList.Builder<>(source, config)
                .setNotifyExecutor(queue)
                .setBoundaryCallback(boundary)
                .build();
    }

    @Test
    void initialLoadSizesListFromTotalCount() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(100, true),
                TestData.config(20, 20, 60));

        assertEquals(100, list.size());
        assertEquals(60, list.getLoadedCount());
        assertEquals(0, list.mStorage.getLeadingNullCount());
        assertEquals(59, list.get(59));
        assertNull(list.get(60));
        assertEquals(0, queue.size());
    }

    @Test
    void loadAroundNearEndLoadsRemainingPagesAndSignalsEnd() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(100, true),
                TestData.config(20, 20, 60));

        list.loadAround(95);
        queue.drain();

        assertEquals(100, list.size());
        assertEquals(100, list.getLoadedCount());
        assertEquals(99, list.get(99));
        assertEquals(Collections.singletonList(99), boundary.end);
        assertTrue(boundary.front.isEmpty());
        assertEquals(0, boundary.zeroItemsLoaded);
    }

    @Test
    void boundaryCallbacksFireAtMostOnce() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(100, true),
                TestData.config(20, 20, 60));

        list.loadAround(95);
        queue.drain();
        list.loadAround(0);
        queue.drain();
        for (int i = 0; i < 3; i++) {
            list.loadAround(99);
            list.loadAround(0);
            queue.drain();
        }

        assertEquals(Collections.singletonList(0), boundary.front);
        assertEquals(Collections.singletonList(99), boundary.end);
    }

    @Test
    void frontCallbackFromLoadAroundIsPosted() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(100, true),
                TestData.config(20, 20, 60));

        list.loadAround(0);
        assertTrue(boundary.front.isEmpty());

        queue.drain();
        assertEquals(Collections.singletonList(0), boundary.front);
    }

    @Test
    void smallDataSetSignalsBothEdgesDuringConstruction() {
        build(new TestPositionalDataSource(5, true), TestData.config(20, 20, 60));

        assertEquals(Collections.singletonList(0), boundary.front);
        assertEquals(Collections.singletonList(4), boundary.end);
        assertEquals(0, queue.size());
    }

    @Test
    void emptyInitialLoadSignalsZeroItemsOnce() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(0, true),
                TestData.config(20, 20, 60));
        queue.drain();

        assertEquals(0, list.size());
        assertEquals(1, boundary.zeroItemsLoaded);
        assertTrue(boundary.front.isEmpty());
        assertTrue(boundary.end.isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> list.get(0));
        assertThrows(IndexOutOfBoundsException.class, () -> list.loadAround(0));
    }

    @Test
    void repeatedLoadAroundDispatchesSingleAppend() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, true).stashRanges();
        DbPagedList<Integer> list = build(source, TestData.config(20, 20, 60));

        list.loadAround(50);
        list.loadAround(55);
        list.loadAround(59);
        assertEquals(1, queue.size());

        queue.drain();
        assertEquals(1, source.mRangeLoads);
        assertEquals(1, source.stashedCount());

        list.loadAround(59);
        queue.drain();
        assertEquals(1, source.mRangeLoads);

        source.flushStashed();
        queue.drain();
        assertEquals(80, list.getLoadedCount());
    }

    @Test
    void resultAfterInvalidationDoesNotMutateStorage() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, true).stashRanges();
        DbPagedList<Integer> list = build(source, TestData.config(20, 20, 60));

        list.loadAround(50);
        queue.drain();
        source.invalidate();
        source.flushStashed();
        queue.drain();

        assertEquals(100, list.size());
        assertEquals(60, list.getLoadedCount());
        assertNull(list.get(60));
        assertTrue(list.isDetached());
    }

    @Test
    void invalidatedSourceDetachesOnNextLoad() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, true);
        DbPagedList<Integer> list = build(source, TestData.config(20, 20, 60));

        source.invalidate();
        list.loadAround(50);
        queue.drain();

        assertTrue(list.isDetached());
        assertEquals(0, source.mRangeLoads);
        assertEquals(60, list.getLoadedCount());
    }

    @Test
    void invalidSourceBuildsDetachedEmptyList() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, true);
        source.invalidate();
        DbPagedList<Integer> list = build(source, TestData.config(20, 20, 60));

        assertTrue(list.isDetached());
        assertEquals(0, list.size());
    }

    @Test
    void detachedListKeepsBookkeepingButStopsLoading() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, true);
        DbPagedList<Integer> list = build(source, TestData.config(20, 20, 60));

        list.detach();
        list.detach();
        list.loadAround(59);
        queue.drain();

        assertTrue(list.isDetached());
        assertEquals(0, source.mRangeLoads);
        assertEquals(60, list.getLoadedCount());
        assertEquals(59, list.getLastKey());
    }

    @Test
    void inFlightLoadStillDeliversAfterDetach() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, true).stashRanges();
        DbPagedList<Integer> list = build(source, TestData.config(20, 20, 60));

        list.loadAround(50);
        queue.drain();
        list.detach();
        source.flushStashed();
        queue.drain();

        assertEquals(80, list.getLoadedCount());
        assertEquals(79, list.get(79));
        assertEquals(1, source.mRangeLoads);
    }

    @Test
    void placeholderLayoutHoldsAfterEveryLoadAround() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(250, true),
                TestData.config(10, 15, 30));

        int[] accesses = {3, 29, 40, 120, 119, 249, 200, 0, 77};
        for (int index : accesses) {
            list.loadAround(index);
            assertEquals(list.size(), TestData.placeholderSum(list));
            queue.drain();
            assertEquals(list.size(), TestData.placeholderSum(list));
        }
        assertEquals(250, list.size());
    }

    @Test
    void boundedListDropsPagesFarFromAccess() {
        DbPagedList.Config config = new DbPagedList.Config.Builder()
                .setPageSize(10)
                .setPrefetchDistance(10)
                .setInitialLoadSizeHint(30)
                .setMaxSize(40)
                .build();
        DbPagedList<Integer> list = build(new TestPositionalDataSource(200, true), config);

        for (int i = 0; i < 200; i++) {
            list.loadAround(i);
            queue.drain();
            assertEquals(200, list.size());
            assertEquals(200, TestData.placeholderSum(list));
        }

        assertTrue(list.getLoadedCount() <= 50);
        assertNull(list.get(0));
        assertEquals(199, list.get(199));
        assertEquals(Collections.singletonList(199), boundary.end);
    }

    @Test
    void notifiesCallbacksOfLoadedRanges() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(100, true),
                TestData.config(20, 20, 60));
        final List<String> events = new ArrayList<>();
        DbPagedList.Callback callback = new DbPagedList.Callback() {
            @Override
            public void onChanged(int position, int count) {
                events.add("changed " + position + " " + count);
            }

            @Override
            public void onInserted(int position, int count) {
                events.add("inserted " + position + " " + count);
            }
        };
        list.addWeakCallback(callback);

        list.loadAround(50);
        queue.drain();
        assertEquals(Collections.singletonList("changed 60 20"), events);

        list.removeWeakCallback(callback);
        list.loadAround(75);
        queue.drain();
        assertEquals(1, events.size());
    }

    @Test
    void uncountedListGrowsAsPagesArrive() {
        DbPagedList<Integer> list = build(new TestPositionalDataSource(100, false),
                TestData.config(20, 20, 40));

        assertEquals(40, list.size());
        assertFalse(list.isDetached());

        list.loadAround(39);
        queue.drain();

        assertEquals(60, list.size());
        assertEquals(59, list.get(59));
        assertEquals(0, list.mStorage.getTrailingNullCount());
        assertEquals(list.size(), TestData.placeholderSum(list));
    }

    @Test
    void uncountedListStartingMidwayPrependsAndTracksOffset() {
        TestPositionalDataSource source = new TestPositionalDataSource(100, false);
        DbPagedList<Integer> list = new DbPagedList.Builder<Integer, Integer>(
                source, TestData.config(10, 10, 20))
                .setNotifyExecutor(queue)
                .setInitialKey(50)
                .build();

        assertEquals(20, list.size());
        assertEquals(40, list.getPositionOffset());
        assertEquals(40, list.get(0));

        list.loadAround(0);
        queue.drain();

        assertEquals(30, list.get(0));
        assertEquals(30, list.getPositionOffset());
        assertEquals(40, list.getLastKey());
    }

    @Test
    void defaultNotifyExecutorIsCallingThreadQueue() {
        DbTaskQueue current = DbTaskQueue.forCurrentThread();
        current.drain();
        DbPagedList<Integer> list = new DbPagedList.Builder<>(
                new TestPositionalDataSource(100, true), TestData.config(20, 20, 60))
                .build();

        list.loadAround(59);
        assertEquals(1, current.size());
        current.drain();
        assertEquals(80, list.getLoadedCount());
    }
}
