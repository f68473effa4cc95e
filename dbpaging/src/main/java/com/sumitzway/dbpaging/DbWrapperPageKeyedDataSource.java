package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Page-keyed source that converts every page of a wrapped source. Keys pass through untouched,
 * and invalidation is shared with the wrapped source.
 */
class DbWrapperPageKeyedDataSource<K, A, B> extends DbPageKeyedDataSource<K, B> {
    private final DbPageKeyedDataSource<K, A> mSource;
    final Function<List<A>, List<B>> mListFunction;

    DbWrapperPageKeyedDataSource(DbPageKeyedDataSource<K, A> source,
                                 Function<List<A>, List<B>> listFunction) {
        super(source);
        mSource = source;
        mListFunction = listFunction;
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams<K> params,
                            final @Nonnull LoadInitialCallback<K, B> callback) {
        mSource.loadInitial(params, new LoadInitialCallback<K, A>() {
            @Override
            public void onResult(@Nonnull List<A> data, int position, int totalCount,
                                 @Nullable K previousPageKey, @Nullable K nextPageKey) {
                callback.onResult(convert(mListFunction, data), position, totalCount,
                        previousPageKey, nextPageKey);
            }

            @Override
            public void onResult(@Nonnull List<A> data, @Nullable K previousPageKey,
                                 @Nullable K nextPageKey) {
                callback.onResult(convert(mListFunction, data), previousPageKey, nextPageKey);
            }
        });
    }

    @Override
    public void loadBefore(@Nonnull LoadParams<K> params,
                           final @Nonnull LoadCallback<K, B> callback) {
        mSource.loadBefore(params, new ConvertingLoadCallback(callback));
    }

    @Override
    public void loadAfter(@Nonnull LoadParams<K> params,
                          final @Nonnull LoadCallback<K, B> callback) {
        mSource.loadAfter(params, new ConvertingLoadCallback(callback));
    }

    private final class ConvertingLoadCallback extends LoadCallback<K, A> {
        private final LoadCallback<K, B> mTarget;

        ConvertingLoadCallback(LoadCallback<K, B> target) {
            mTarget = target;
        }

        @Override
        public void onResult(@Nonnull List<A> data, @Nullable K adjacentPageKey) {
            mTarget.onResult(convert(mListFunction, data), adjacentPageKey);
        }
    }
}
