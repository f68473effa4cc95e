package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional data source reading pages straight out of a {@link DbObjectCollection}.
 * <p>
 * Every load copies the requested range into a fresh list, so loaded pages do not change when
 * the collection does. Pair it with a list built over the same collection, or with
 * {@link #factory(DbObjectCollection)} and a {@link DbLivePagedListBuilder}, so that a change to
 * the collection invalidates this source.
 *
 * @param <T> Type of the stored objects.
 */
public class DbCollectionPositionalDataSource<T> extends DbPositionalDataSource<T> {
    @Nonnull
    private final DbObjectCollection<T> mCollection;

    public DbCollectionPositionalDataSource(@Nonnull DbObjectCollection<T> collection) {
        mCollection = collection;
    }

    @Nonnull
    public DbObjectCollection<T> getCollection() {
        return mCollection;
    }

    @Override
    public void loadInitial(@Nonnull LoadInitialParams params,
                            @Nonnull LoadInitialCallback<T> callback) {
        int totalCount = mCollection.size();
        int position = computeInitialLoadPosition(params, totalCount);
        int loadSize = computeInitialLoadSize(params, position, totalCount);
        callback.onResult(copyRange(position, loadSize), position, totalCount);
    }

    @Override
    public void loadRange(@Nonnull LoadRangeParams params,
                          @Nonnull LoadRangeCallback<T> callback) {
        if (isInvalid()) {
            // the collection may have shrunk, the callback reports the source as invalid
            callback.onResult(new ArrayList<T>());
            return;
        }
        int loadSize = Math.max(0,
                Math.min(params.loadSize, mCollection.size() - params.startPosition));
        callback.onResult(copyRange(params.startPosition, loadSize));
    }

    private List<T> copyRange(int start, int count) {
        List<T> page = new ArrayList<>(count);
        for (int i = start; i < start + count; i++) {
            page.add(mCollection.get(i));
        }
        return page;
    }

    /**
     * Factory producing a new source over {@code collection} on every call.
     */
    @Nonnull
    public static <T> DbDataSource.Factory<Integer, T> factory(
            @Nonnull final DbObjectCollection<T> collection) {
        return new DbDataSource.Factory<Integer, T>() {
            @Nonnull
            @Override
            public DbDataSource<Integer, T> create() {
                return new DbCollectionPositionalDataSource<>(collection);
            }
        };
    }
}
