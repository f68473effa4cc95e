package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Incremental data loader for page-keyed content, where requests return keys for next/previous
 * pages.
 * <p>
 * Implement a DbDataSource using DbPageKeyedDataSource if you need to use data from page {@code N - 1}
 * to load page {@code N}. This is common, for example, for database cursors or network APIs that
 * hand out a next/previous token with each page.
 * <p>
 * Pages can only be loaded outward from the initial page, there is no way to jump to an
 * arbitrary page.
 *
 * @param <Key>   Type of data used to query Value types out of the DbDataSource.
 * @param <Value> Type of items being loaded by the DbDataSource.
 */
public abstract class DbPageKeyedDataSource<Key, Value> extends DbContiguousDataSource<Key, Value> {
    private final Object mKeyLock = new Object();

    public DbPageKeyedDataSource() {
    }

    DbPageKeyedDataSource(@Nonnull DbDataSource<?, ?> source) {
        super(source);
    }

    @Nullable
    @GuardedBy("mKeyLock")
    private Key mNextKey = null;

    @Nullable
    @GuardedBy("mKeyLock")
    private Key mPreviousKey = null;

    void initKeys(@Nullable Key previousKey, @Nullable Key nextKey) {
        synchronized (mKeyLock) {
            mPreviousKey = previousKey;
            mNextKey = nextKey;
        }
    }

    void setPreviousKey(@Nullable Key previousKey) {
        synchronized (mKeyLock) {
            mPreviousKey = previousKey;
        }
    }

    void setNextKey(@Nullable Key nextKey) {
        synchronized (mKeyLock) {
            mNextKey = nextKey;
        }
    }

    @Nullable
    Key getPreviousKey() {
        synchronized (mKeyLock) {
            return mPreviousKey;
        }
    }

    @Nullable
    Key getNextKey() {
        synchronized (mKeyLock) {
            return mNextKey;
        }
    }

    /**
     * Holder object for inputs to {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}.
     *
     * @param <Key> Type of data used to query pages.
     */
    public static class LoadInitialParams<Key> {
        /**
         * Requested number of items to load.
         * <p>
         * Note that this may be larger than available data.
         */
        public final int requestedLoadSize;

        public LoadInitialParams(int requestedLoadSize) {
            this.requestedLoadSize = requestedLoadSize;
        }
    }

    /**
     * Holder object for inputs to {@link #loadBefore(LoadParams, LoadCallback)} and
     * {@link #loadAfter(LoadParams, LoadCallback)}.
     *
     * @param <Key> Type of data used to query pages.
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
         * <p>
         * Returned page can be of this size, but it may be altered if that is easier, e.g. a
         * network data source where the backend defines page size.
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
     * <p>
     * If you can compute the number of items in the data set before and after the loaded range,
     * call the five parameter {@link #onResult(List, int, int, Object, Object)} to pass that
     * information, so the list can present placeholders for unloaded items.
     * <p>
     * It is always valid for a DbDataSource loading method that takes a callback to stash the
     * callback and call it later. This enables DataSources to be fully asynchronous, and to handle
     * temporary, recoverable error states (such as a network error that can be retried).
     *
     * @param <Key>   Type of data used to query pages.
     * @param <Value> Type of items being loaded.
     */
    public abstract static class LoadInitialCallback<Key, Value> {
        /**
         * Called to pass initial load state from a DbDataSource, with placeholder information.
         *
         * @param data            List of items loaded from the DbDataSource. If this is empty,
         *                        the DbDataSource is treated as empty, and no further loads will occur.
         * @param position        Position of the item at the front of the list. If there are
         *                        {@code N} items before the items in data, pass {@code N}.
         * @param totalCount      Total number of items that may be returned from this DbDataSource,
         *                        including the ones in {@code data}.
         * @param previousPageKey Key for page before the initial load result, or {@code null} if no
         *                        more data can be loaded before.
         * @param nextPageKey     Key for page after the initial load result, or {@code null} if no
         *                        more data can be loaded after.
         */
        public abstract void onResult(@Nonnull List<Value> data, int position, int totalCount,
                                      @Nullable Key previousPageKey, @Nullable Key nextPageKey);

        /**
         * Called to pass loaded data from a DbDataSource, without counting available data.
         *
         * @param data            List of items loaded from the DbPageKeyedDataSource.
         * @param previousPageKey Key for page before the initial load result, or {@code null} if no
         *                        more data can be loaded before.
         * @param nextPageKey     Key for page after the initial load result, or {@code null} if no
         *                        more data can be loaded after.
         */
        public abstract void onResult(@Nonnull List<Value> data, @Nullable Key previousPageKey,
                                      @Nullable Key nextPageKey);
    }

    /**
     * Callback for {@link #loadBefore(LoadParams, LoadCallback)} and
     * {@link #loadAfter(LoadParams, LoadCallback)} to return data.
     * <p>
     * A callback can be called only once, and will throw if called again.
     * <p>
     * It is always valid for a DbDataSource loading method that takes a callback to stash the
     * callback and call it later.
     *
     * @param <Key>   Type of data used to query pages.
     * @param <Value> Type of items being loaded.
     */
    public abstract static class LoadCallback<Key, Value> {

        /**
         * Called to pass loaded data from a DbDataSource.
         * <p>
         * Pass the key for the subsequent page to load to adjacentPageKey. For example, if you've
         * loaded a page in {@link #loadBefore(LoadParams, LoadCallback)}, pass the key for the
         * previous page, or {@code null} if the loaded page is the first. If in
         * {@link #loadAfter(LoadParams, LoadCallback)}, pass the key for the next page, or
         * {@code null} if the loaded page is the last.
         *
         * @param data            List of items loaded from the DbPageKeyedDataSource.
         * @param adjacentPageKey Key for subsequent page load, or {@code null} if there are
         *                        no more pages to load in the current load direction.
         */
        public abstract void onResult(@Nonnull List<Value> data, @Nullable Key adjacentPageKey);
    }

    static class LoadInitialCallbackImpl<Key, Value> extends DbPageKeyedDataSource.LoadInitialCallback<Key, Value> {
        final LoadCallbackHelper<Value> mCallbackHelper;
        private final DbPageKeyedDataSource<Key, Value> mDataSource;

        LoadInitialCallbackImpl(@Nonnull DbPageKeyedDataSource<Key, Value> dataSource,
                                @Nonnull DbPageResult.Receiver<Value> receiver) {
            mCallbackHelper = new LoadCallbackHelper<>(
                    dataSource, DbPageResult.INIT, null, receiver);
            mDataSource = dataSource;
        }

        @Override
        public void onResult(@Nonnull List<Value> data, int position, int totalCount,
                             @Nullable Key previousPageKey, @Nullable Key nextPageKey) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                LoadCallbackHelper.validateInitialLoadParams(data, position, totalCount);

                // setup keys before dispatching data, so guaranteed to be ready
                mDataSource.initKeys(previousPageKey, nextPageKey);

                int trailingUnloadedCount = totalCount - position - data.size();
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(
                        data, position, trailingUnloadedCount, 0, true,
                        previousPageKey == null, nextPageKey == null));
            }
        }

        @Override
        public void onResult(@Nonnull List<Value> data, @Nullable Key previousPageKey,
                             @Nullable Key nextPageKey) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                mDataSource.initKeys(previousPageKey, nextPageKey);
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(
                        data, 0, previousPageKey == null, nextPageKey == null));
            }
        }
    }

    static class LoadCallbackImpl<Key, Value> extends DbPageKeyedDataSource.LoadCallback<Key, Value> {
        final LoadCallbackHelper<Value> mCallbackHelper;
        private final DbPageKeyedDataSource<Key, Value> mDataSource;

        LoadCallbackImpl(@Nonnull DbPageKeyedDataSource<Key, Value> dataSource,
                         int type, @Nullable Executor mainThreadExecutor,
                         @Nonnull DbPageResult.Receiver<Value> receiver) {
            mCallbackHelper = new LoadCallbackHelper<>(
                    dataSource, type, mainThreadExecutor, receiver);
            mDataSource = dataSource;
        }

        @Override
        public void onResult(@Nonnull List<Value> data, @Nullable Key adjacentPageKey) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                boolean append = mCallbackHelper.mResultType == DbPageResult.APPEND;
                if (append) {
                    mDataSource.setNextKey(adjacentPageKey);
                } else {
                    mDataSource.setPreviousKey(adjacentPageKey);
                }
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(data, 0,
                        !append && adjacentPageKey == null, append && adjacentPageKey == null));
            }
        }
    }

    @Nullable
    @Override
    final Key getKey(int position, Value item) {
        // don't attempt to persist keys, since we currently don't pass them to initial load
        return null;
    }

    @Override
    boolean supportsPageDropping() {
        // dropping would require stashing the keys of every loaded page
        return false;
    }

    @Override
    final void dispatchLoadInitial(@Nullable Key key, int initialLoadSize, int pageSize,
                                   @Nonnull Executor mainThreadExecutor,
                                   @Nonnull DbPageResult.Receiver<Value> receiver) {
        DbPageKeyedDataSource.LoadInitialCallbackImpl<Key, Value> callback =
                new DbPageKeyedDataSource.LoadInitialCallbackImpl<>(this, receiver);
        loadInitial(new DbPageKeyedDataSource.LoadInitialParams<Key>(initialLoadSize), callback);

        // If initialLoad's callback is not called within the body, we force any following calls
        // to post to the controlling thread. This may be run on a background thread, but
        // after construction, mutation must happen on the controlling thread.
        callback.mCallbackHelper.setPostExecutor(mainThreadExecutor);
    }


    @Override
    final void dispatchLoadAfter(int currentEndIndex, int currentLoadedCount,
                                 @Nonnull Value currentEndItem, int pageSize,
                                 @Nonnull Executor mainThreadExecutor,
                                 @Nonnull DbPageResult.Receiver<Value> receiver) {
        @Nullable Key key = getNextKey();
        if (key != null) {
            loadAfter(new DbPageKeyedDataSource.LoadParams<>(key, pageSize, currentLoadedCount),
                    new DbPageKeyedDataSource.LoadCallbackImpl<>(
                            this, DbPageResult.APPEND, mainThreadExecutor, receiver));
        } else {
            postEmptyResult(DbPageResult.APPEND, mainThreadExecutor, receiver);
        }
    }

    @Override
    final void dispatchLoadBefore(int currentBeginIndex, int currentLoadedCount,
                                  @Nonnull Value currentBeginItem, int pageSize,
                                  @Nonnull Executor mainThreadExecutor,
                                  @Nonnull DbPageResult.Receiver<Value> receiver) {
        @Nullable Key key = getPreviousKey();
        if (key != null) {
            loadBefore(new DbPageKeyedDataSource.LoadParams<>(key, pageSize, currentLoadedCount),
                    new DbPageKeyedDataSource.LoadCallbackImpl<>(
                            this, DbPageResult.PREPEND, mainThreadExecutor, receiver));
        } else {
            postEmptyResult(DbPageResult.PREPEND, mainThreadExecutor, receiver);
        }
    }

    private static <Value> void postEmptyResult(final int type, @Nonnull Executor mainThreadExecutor,
                                                final @Nonnull DbPageResult.Receiver<Value> receiver) {
        mainThreadExecutor.execute(new Runnable() {
            @Override
            public void run() {
                receiver.onPageResult(type, DbPageResult.<Value>getEmptyResult());
            }
        });
    }

    /**
     * Load initial data.
     * <p>
     * This method is called first to initialize a DbPagedList with data. If it's possible to count
     * the items that can be loaded by the DbDataSource, it's recommended to pass the loaded data to
     * the callback via the five-parameter
     * {@link LoadInitialCallback#onResult(List, int, int, Object, Object)}. This enables lists
     * presenting data from this source to display placeholders to represent unloaded items.
     * <p>
     * {@link LoadInitialParams#requestedLoadSize} is a hint, not a requirement, so it may be
     * altered or ignored.
     *
     * @param params   Parameters for initial load, including requested load size.
     * @param callback Callback that receives initial load data.
     */
    public abstract void loadInitial(@Nonnull DbPageKeyedDataSource.LoadInitialParams<Key> params,
                                     @Nonnull DbPageKeyedDataSource.LoadInitialCallback<Key, Value> callback);

    /**
     * Prepend page with the key specified by {@link LoadParams#key LoadParams.key}.
     * <p>
     * Data may be passed synchronously during the load method, or deferred and called at a
     * later time. Further loads going up will be blocked until the callback is called.
     * <p>
     * If data cannot be loaded (for example, if the request is invalid, or the data would be stale
     * and inconsistent), it is valid to call {@link #invalidate()} to invalidate the data source,
     * and prevent further loading.
     *
     * @param params   Parameters for the load, including the key for the new page, and requested load
     *                 size.
     * @param callback Callback that receives loaded data.
     */
    public abstract void loadBefore(@Nonnull DbPageKeyedDataSource.LoadParams<Key> params,
                                    @Nonnull DbPageKeyedDataSource.LoadCallback<Key, Value> callback);

    /**
     * Append page with the key specified by {@link LoadParams#key LoadParams.key}.
     * <p>
     * Data may be passed synchronously during the load method, or deferred and called at a
     * later time. Further loads going down will be blocked until the callback is called.
     *
     * @param params   Parameters for the load, including the key for the new page, and requested load
     *                 size.
     * @param callback Callback that receives loaded data.
     */
    public abstract void loadAfter(@Nonnull DbPageKeyedDataSource.LoadParams<Key> params,
                                   @Nonnull DbPageKeyedDataSource.LoadCallback<Key, Value> callback);

    @Nonnull
    @Override
    public final <ToValue> DbPageKeyedDataSource<Key, ToValue> mapByPage(
            @Nonnull Function<List<Value>, List<ToValue>> function) {
        return new DbWrapperPageKeyedDataSource<>(this, function);
    }

    @Nonnull
    @Override
    public final <ToValue> DbPageKeyedDataSource<Key, ToValue> map(
            @Nonnull Function<Value, ToValue> function) {
        return mapByPage(createListFunction(function));
    }
}
