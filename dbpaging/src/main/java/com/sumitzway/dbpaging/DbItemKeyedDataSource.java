package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Incremental data loader for paging keyed content, where loaded content uses previously loaded
 * items as input to future loads.
 * <p>
 * Implement a DbDataSource using DbItemKeyedDataSource if you need to use data from item
 * {@code N - 1} to load item {@code N}. This is common, for example, in sorted database queries
 * where the sort column of the last loaded row is the lower bound of the next query.
 * <p>
 * A source that cannot tell when it has run out of data signals the edge by returning an empty
 * page.
 *
 * @param <Key>   Type of data used to query Value types out of the DbDataSource.
 * @param <Value> Type of items being loaded by the DbDataSource.
 */
public abstract class DbItemKeyedDataSource<Key, Value> extends DbContiguousDataSource<Key, Value> {

    public DbItemKeyedDataSource() {
    }

    DbItemKeyedDataSource(@Nonnull DbDataSource<?, ?> source) {
        super(source);
    }

    /**
     * Holder object for inputs to {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}.
     *
     * @param <Key> Type of data used to query Value types out of the DbDataSource.
     */
    public static class LoadInitialParams<Key> {
        /**
         * Load items around this key, or at the beginning of the data set if {@code null} is
         * passed.
         * <p>
         * Note that this key is generally a hint, and may be ignored if you want to always load
         * from the beginning.
         */
        @Nullable
        public final Key requestedInitialKey;

        /**
         * Requested number of items to load.
         * <p>
         * Note that this may be larger than available data.
         */
        public final int requestedLoadSize;

        public LoadInitialParams(@Nullable Key requestedInitialKey, int requestedLoadSize) {
            this.requestedInitialKey = requestedInitialKey;
            this.requestedLoadSize = requestedLoadSize;
        }
    }

    /**
     * Holder object for inputs to {@link #loadBefore(LoadParams, LoadCallback)}
     * and {@link #loadAfter(LoadParams, LoadCallback)}.
     *
     * @param <Key> Type of data used to query Value types out of the DbDataSource.
     */
    public static class LoadParams<Key> {
        /**
         * Load items before/after this key.
         * <p>
         * Returned data must begin directly adjacent to this position.
         */
        @Nonnull
        public final Key key;

        /**
         * Requested number of items to load.
         */
        public final int requestedLoadSize;

        /**
         * Number of items the list holds when the load is requested.
         */
        public final int currentLoadedCount;

        public LoadParams(@Nonnull Key key, int requestedLoadSize, int currentLoadedCount) {
            this.key = key;
            this.requestedLoadSize = requestedLoadSize;
            this.currentLoadedCount = currentLoadedCount;
        }
    }

    /**
     * Callback for {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}
     * to return data and, optionally, position/count information.
     * <p>
     * A callback can be called only once, and will throw if called again.
     *
     * @param <Value> Type of items being loaded.
     */
    public abstract static class LoadInitialCallback<Value> {
        /**
         * Called to pass initial load state from a DbDataSource, with the number of items before
         * and after the loaded range.
         *
         * @param data       List of items loaded from the DbDataSource. If this is empty, the
         *                   DbDataSource is treated as empty, and no further loads will occur.
         * @param position   Position of the item at the front of the list.
         * @param totalCount Total number of items that may be returned from this DbDataSource.
         */
        public abstract void onResult(@Nonnull List<Value> data, int position, int totalCount);

        /**
         * Called to pass loaded data from a DbDataSource that cannot count its items.
         *
         * @param data List of items loaded from the DbDataSource.
         */
        public abstract void onResult(@Nonnull List<Value> data);
    }

    /**
     * Callback for DbItemKeyedDataSource {@link #loadBefore(LoadParams, LoadCallback)}
     * and {@link #loadAfter(LoadParams, LoadCallback)} to return data.
     * <p>
     * A callback can be called only once, and will throw if called again.
     *
     * @param <Value> Type of items being loaded.
     */
    public abstract static class LoadCallback<Value> {
        /**
         * Called to pass loaded data from a DbDataSource. Pass an empty list once there is
         * nothing more to load in the requested direction.
         *
         * @param data List of items loaded from the DbItemKeyedDataSource.
         */
        public abstract void onResult(@Nonnull List<Value> data);
    }

    static class LoadInitialCallbackImpl<Value> extends DbItemKeyedDataSource.LoadInitialCallback<Value> {
        final LoadCallbackHelper<Value> mCallbackHelper;

        LoadInitialCallbackImpl(@Nonnull DbItemKeyedDataSource<?, Value> dataSource,
                                @Nonnull DbPageResult.Receiver<Value> receiver) {
            mCallbackHelper = new LoadCallbackHelper<>(
                    dataSource, DbPageResult.INIT, null, receiver);
        }

        @Override
        public void onResult(@Nonnull List<Value> data, int position, int totalCount) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                LoadCallbackHelper.validateInitialLoadParams(data, position, totalCount);

                int trailingUnloadedCount = totalCount - position - data.size();
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(
                        data, position, trailingUnloadedCount, 0, true,
                        position == 0, trailingUnloadedCount == 0));
            }
        }

        @Override
        public void onResult(@Nonnull List<Value> data) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(data, 0));
            }
        }
    }

    static class LoadCallbackImpl<Value> extends DbItemKeyedDataSource.LoadCallback<Value> {
        final LoadCallbackHelper<Value> mCallbackHelper;

        LoadCallbackImpl(@Nonnull DbItemKeyedDataSource<?, Value> dataSource, int type,
                         @Nullable Executor mainThreadExecutor,
                         @Nonnull DbPageResult.Receiver<Value> receiver) {
            mCallbackHelper = new LoadCallbackHelper<>(
                    dataSource, type, mainThreadExecutor, receiver);
        }

        @Override
        public void onResult(@Nonnull List<Value> data) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(data, 0));
            }
        }
    }

    @Nullable
    @Override
    final Key getKey(int position, @Nullable Value item) {
        if (item == null) {
            return null;
        }
        return getKey(item);
    }

    @Override
    final void dispatchLoadInitial(@Nullable Key key, int initialLoadSize, int pageSize,
                                   @Nonnull Executor mainThreadExecutor,
                                   @Nonnull DbPageResult.Receiver<Value> receiver) {
        DbItemKeyedDataSource.LoadInitialCallbackImpl<Value> callback =
                new DbItemKeyedDataSource.LoadInitialCallbackImpl<>(this, receiver);
        loadInitial(new DbItemKeyedDataSource.LoadInitialParams<>(key, initialLoadSize), callback);

        // If initialLoad's callback is not called within the body, we force any following calls
        // to post to the controlling thread.
        callback.mCallbackHelper.setPostExecutor(mainThreadExecutor);
    }

    @Override
    final void dispatchLoadAfter(int currentEndIndex, int currentLoadedCount,
                                 @Nonnull Value currentEndItem, int pageSize,
                                 @Nonnull Executor mainThreadExecutor,
                                 @Nonnull DbPageResult.Receiver<Value> receiver) {
        loadAfter(new DbItemKeyedDataSource.LoadParams<>(
                        getKey(currentEndItem), pageSize, currentLoadedCount),
                new DbItemKeyedDataSource.LoadCallbackImpl<>(
                        this, DbPageResult.APPEND, mainThreadExecutor, receiver));
    }

    @Override
    final void dispatchLoadBefore(int currentBeginIndex, int currentLoadedCount,
                                  @Nonnull Value currentBeginItem, int pageSize,
                                  @Nonnull Executor mainThreadExecutor,
                                  @Nonnull DbPageResult.Receiver<Value> receiver) {
        loadBefore(new DbItemKeyedDataSource.LoadParams<>(
                        getKey(currentBeginItem), pageSize, currentLoadedCount),
                new DbItemKeyedDataSource.LoadCallbackImpl<>(
                        this, DbPageResult.PREPEND, mainThreadExecutor, receiver));
    }

    /**
     * Load initial data.
     * <p>
     * {@link LoadInitialParams#requestedInitialKey} and
     * {@link LoadInitialParams#requestedLoadSize} are hints, not requirements, so they may be
     * altered or ignored.
     *
     * @param params   Parameters for initial load, including initial key and requested size.
     * @param callback Callback that receives initial load data.
     */
    public abstract void loadInitial(@Nonnull DbItemKeyedDataSource.LoadInitialParams<Key> params,
                                     @Nonnull DbItemKeyedDataSource.LoadInitialCallback<Value> callback);

    /**
     * Load list data after the key specified in {@link LoadParams#key LoadParams.key}.
     * <p>
     * Data may be passed synchronously during the loadAfter method, or deferred and called at a
     * later time. Further loads going down will be blocked until the callback is called.
     *
     * @param params   Parameters for the load, including the key to load after, and requested size.
     * @param callback Callback that receives loaded data.
     */
    public abstract void loadAfter(@Nonnull DbItemKeyedDataSource.LoadParams<Key> params,
                                   @Nonnull DbItemKeyedDataSource.LoadCallback<Value> callback);

    /**
     * Load list data before the key specified in {@link LoadParams#key LoadParams.key}.
     * <p>
     * The items passed to the callback must be in list order, so that the last item of the page
     * sits directly before the item that {@code params.key} was taken from.
     *
     * @param params   Parameters for the load, including the key to load before, and requested size.
     * @param callback Callback that receives loaded data.
     */
    public abstract void loadBefore(@Nonnull DbItemKeyedDataSource.LoadParams<Key> params,
                                    @Nonnull DbItemKeyedDataSource.LoadCallback<Value> callback);

    /**
     * Return a key associated with the given item.
     * <p>
     * The key of the last item loaded is passed to {@link #loadAfter(LoadParams, LoadCallback)},
     * and the key of the first to {@link #loadBefore(LoadParams, LoadCallback)}. It is also used
     * to restore the load position when a regenerated list replaces this one.
     *
     * @param item Item to get the key from.
     * @return Key associated with given item.
     */
    @Nonnull
    public abstract Key getKey(@Nonnull Value item);

    @Nonnull
    @Override
    public final <ToValue> DbItemKeyedDataSource<Key, ToValue> mapByPage(
            @Nonnull Function<List<Value>, List<ToValue>> function) {
        return new DbWrapperItemKeyedDataSource<>(this, function);
    }

    @Nonnull
    @Override
    public final <ToValue> DbItemKeyedDataSource<Key, ToValue> map(
            @Nonnull Function<Value, ToValue> function) {
        return mapByPage(createListFunction(function));
    }
}
