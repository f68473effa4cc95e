package com.sumitzway.dbpaging;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

/**
 * Page-keyed source over {@code 0..count-1}, where the key of a page is its page index.
 */
class TestPageKeyedDataSource extends DbPageKeyedDataSource<Integer, Integer> {
    private final int mCount;
    private final int mPageSize;
    private final int mStartPage;
    private final boolean mCounted;

    TestPageKeyedDataSource(int count, int pageSize, int startPage, boolean counted) {
        mCount = count;
        mPageSize = pageSize;
        mStartPage = startPage;
        mCounted = counted;
    }

    private int lastPage() {
        return (mCount - 1) / mPageSize;
    }

    private List<Integer> page(int index) {
        return TestData.range(index * mPageSize, Math.min(mCount, (index + 1) * mPageSize));
    }

    private Integer previousKey(int index) {
        return index > 0 ? index - 1 : null;
    }

    private Integer nextKey(int index) {
        return index < lastPage() ? index + 1 : null;
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams<Integer> params,
                            @Nonnull LoadInitialCallback<Integer, Integer> callback) {
        if (mCount == 0) {
            callback.onResult(new ArrayList<Integer>(), null, null);
            return;
        }
        List<Integer> data = page(mStartPage);
        if (mCounted) {
            callback.onResult(data, mStartPage * mPageSize, mCount,
                    previousKey(mStartPage), nextKey(mStartPage));
        } else {
            callback.onResult(data, previousKey(mStartPage), nextKey(mStartPage));
        }
    }

    @Override
    public void loadBefore(@Nonnull LoadParams<Integer> params,
                           @Nonnull LoadCallback<Integer, Integer> callback) {
        callback.onResult(page(params.key), previousKey(params.key));
    }

    @Override
    public void loadAfter(@Nonnull LoadParams<Integer> params,
                          @Nonnull LoadCallback<Integer, Integer> callback) {
        callback.onResult(page(params.key), nextKey(params.key));
    }
}
