package com.sumitzway.dbpaging;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

/**
 * Positional source over {@code 0..count-1}. Range loads can be held back to model slow I/O.
 */
class TestPositionalDataSource extends DbPositionalDataSource<Integer> {
    private final List<Integer> mItems;
    private final boolean mCounted;
    private final List<Runnable> mStashed = new ArrayList<>();
    private boolean mStashRanges = false;
    int mRangeLoads = 0;

    TestPositionalDataSource(int count, boolean counted) {
        mItems = TestData.range(0, count);
        mCounted = counted;
    }

    TestPositionalDataSource stashRanges() {
        mStashRanges = true;
        return this;
    }

    int stashedCount() {
        return mStashed.size();
    }

    void flushStashed() {
        List<Runnable> pending = new ArrayList<>(mStashed);
        mStashed.clear();
        for (Runnable runnable : pending) {
            runnable.run();
        }
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams params,
                            @Nonnull LoadInitialCallback<Integer> callback) {
        int totalCount = mItems.size();
        int position = computeInitialLoadPosition(params, totalCount);
        int loadSize = computeInitialLoadSize(params, position, totalCount);
        List<Integer> data = new ArrayList<>(mItems.subList(position, position + loadSize));
        if (mCounted) {
            callback.onResult(data, position, totalCount);
        } else {
            callback.onResult(data, position);
        }
    }

    @Override
    public void loadRange(@Nonnull final LoadRangeParams params,
                          @Nonnull final LoadRangeCallback<Integer> callback) {
        mRangeLoads++;
        Runnable load = new Runnable() {
            @Override
            public void run() {
                int end = Math.min(mItems.size(), params.startPosition + params.loadSize);
                callback.onResult(new ArrayList<>(mItems.subList(params.startPosition, end)));
            }
        };
        if (mStashRanges) {
            mStashed.add(load);
        } else {
            load.run();
        }
    }
}
