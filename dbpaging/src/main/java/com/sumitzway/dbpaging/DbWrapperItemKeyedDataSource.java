package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.function.Function;

/**
 * Item-keyed source that converts every page of a wrapped source.
 * <p>
 * Converted items cannot produce the wrapped source's keys themselves, so the key of every
 * source item is recorded against its converted counterpart as pages pass through, and
 * forgotten once the list drops the page holding it.
 */
class DbWrapperItemKeyedDataSource<K, A, B> extends DbItemKeyedDataSource<K, B> {
    private final DbItemKeyedDataSource<K, A> mSource;
    final Function<List<A>, List<B>> mListFunction;

    @GuardedBy("mKeyMap")
    private final IdentityHashMap<B, K> mKeyMap = new IdentityHashMap<>();

    DbWrapperItemKeyedDataSource(DbItemKeyedDataSource<K, A> source,
                                 Function<List<A>, List<B>> listFunction) {
        super(source);
        mSource = source;
        mListFunction = listFunction;
    }

    List<B> convertWithStashedKeys(List<A> source) {
        List<B> dest = convert(mListFunction, source);
        synchronized (mKeyMap) {
            for (int i = 0; i < dest.size(); i++) {
                mKeyMap.put(dest.get(i), mSource.getKey(source.get(i)));
            }
        }
        return dest;
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams<K> params,
                            final @Nonnull LoadInitialCallback<B> callback) {
        mSource.loadInitial(params, new LoadInitialCallback<A>() {
            @Override
            public void onResult(@Nonnull List<A> data, int position, int totalCount) {
                callback.onResult(convertWithStashedKeys(data), position, totalCount);
            }

            @Override
            public void onResult(@Nonnull List<A> data) {
                callback.onResult(convertWithStashedKeys(data));
            }
        });
    }

    @Override
    public void loadAfter(@Nonnull LoadParams<K> params,
                          final @Nonnull LoadCallback<B> callback) {
        mSource.loadAfter(params, new LoadCallback<A>() {
            @Override
            public void onResult(@Nonnull List<A> data) {
                callback.onResult(convertWithStashedKeys(data));
            }
        });
    }

    @Override
    public void loadBefore(@Nonnull LoadParams<K> params,
                           final @Nonnull LoadCallback<B> callback) {
        mSource.loadBefore(params, new LoadCallback<A>() {
            @Override
            public void onResult(@Nonnull List<A> data) {
                callback.onResult(convertWithStashedKeys(data));
            }
        });
    }

    @Override
    void onPagesDropped(@Nonnull List<List<B>> pages) {
        synchronized (mKeyMap) {
            for (List<B> page : pages) {
                for (B item : page) {
                    mKeyMap.remove(item);
                }
            }
        }
    }

    int getRecordedKeyCount() {
        synchronized (mKeyMap) {
            return mKeyMap.size();
        }
    }

    @Nonnull
    @Override
    public K getKey(@Nonnull B item) {
        synchronized (mKeyMap) {
            K key = mKeyMap.get(item);
            if (key == null) {
                throw new IllegalStateException("No key recorded for " + item
                        + ", it was not loaded through this source");
            }
            return key;
        }
    }
}
