package com.sumitzway.dbpaging;

import java.util.List;

import javax.annotation.Nonnull;

/**
 * Item-keyed source over the sorted items {@code 0..count-1}; the key of an item is its value.
 */
class TestItemKeyedDataSource extends DbItemKeyedDataSource<Integer, Integer> {
    private final int mCount;
    private final boolean mCounted;

    TestItemKeyedDataSource(int count, boolean counted) {
        mCount = count;
        mCounted = counted;
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams<Integer> params,
                            @Nonnull LoadInitialCallback<Integer> callback) {
        int start = params.requestedInitialKey == null
                ? 0 : Math.min(params.requestedInitialKey, mCount);
        List<Integer> data = TestData.range(start,
                Math.min(mCount, start + params.requestedLoadSize));
        if (mCounted) {
            callback.onResult(data, start, mCount);
        } else {
            callback.onResult(data);
        }
    }

    @Override
    public void loadAfter(@Nonnull LoadParams<Integer> params,
                          @Nonnull LoadCallback<Integer> callback) {
        int start = params.key + 1;
        callback.onResult(TestData.range(start,
                Math.min(mCount, start + params.requestedLoadSize)));
    }

    @Override
    public void loadBefore(@Nonnull LoadParams<Integer> params,
                           @Nonnull LoadCallback<Integer> callback) {
        int end = params.key;
        callback.onResult(TestData.range(Math.max(0, end - params.requestedLoadSize), end));
    }

    @Nonnull
    @Override
    public Integer getKey(@Nonnull Integer item) {
        return item;
    }
}
