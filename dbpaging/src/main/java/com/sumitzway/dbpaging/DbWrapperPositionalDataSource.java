package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;

import java.util.List;
import java.util.function.Function;

/**
 * Positional source that converts every page of a wrapped source. Positions and counts are
 * reported by the wrapped source unchanged.
 */
class DbWrapperPositionalDataSource<A, B> extends DbPositionalDataSource<B> {
    private final DbPositionalDataSource<A> mSource;
    final Function<List<A>, List<B>> mListFunction;

    DbWrapperPositionalDataSource(DbPositionalDataSource<A> source,
                                  Function<List<A>, List<B>> listFunction) {
        super(source);
        mSource = source;
        mListFunction = listFunction;
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams params,
                            final @Nonnull LoadInitialCallback<B> callback) {
        mSource.loadInitial(params, new LoadInitialCallback<A>() {
            @Override
            public void onResult(@Nonnull List<A> data, int position, int totalCount) {
                callback.onResult(convert(mListFunction, data), position, totalCount);
            }

            @Override
            public void onResult(@Nonnull List<A> data, int position) {
                callback.onResult(convert(mListFunction, data), position);
            }
        });
    }

    @Override
    public void loadRange(@Nonnull LoadRangeParams params,
                          final @Nonnull LoadRangeCallback<B> callback) {
        mSource.loadRange(params, new LoadRangeCallback<A>() {
            @Override
            public void onResult(@Nonnull List<A> data) {
                callback.onResult(convert(mListFunction, data));
            }
        });
    }
}
