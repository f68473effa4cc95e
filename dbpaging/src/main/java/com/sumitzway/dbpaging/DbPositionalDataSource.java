package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Position-based data loader for a fixed-size, countable data set, supporting fixed-size loads
 * at arbitrary page positions.
 * <p>
 * Extend DbPositionalDataSource if you can load pages of a requested size at arbitrary
 * positions, and provide a fixed item count. This is the natural fit for ordered query results
 * of an embedded database, which can be indexed directly; see
 * {@link DbCollectionPositionalDataSource}.
 * <p>
 * The key of a DbPositionalDataSource is the absolute position of an item.
 *
 * @param <T> Type of items being loaded by the DbPositionalDataSource.
 */
public abstract class DbPositionalDataSource<T> extends DbContiguousDataSource<Integer, T> {

    public DbPositionalDataSource() {
    }

    DbPositionalDataSource(@Nonnull DbDataSource<?, ?> source) {
        super(source);
    }

    /**
     * Holder object for inputs to {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}.
     */
    public static class LoadInitialParams {
        /**
         * Initial load position requested.
         * <p>
         * Note that this may not be within the bounds of your data set, it may need to be adjusted
         * before you execute your load.
         */
        public final int requestedStartPosition;

        /**
         * Requested number of items to load, an integer multiple of {@link #pageSize}.
         * <p>
         * Note that this may be larger than available data.
         */
        public final int requestedLoadSize;

        /**
         * Defines page size acceptable for return values.
         * <p>
         * List of items passed to the callback must be an integer multiple of page size, unless it
         * runs to the end of the data set.
         */
        public final int pageSize;

        public LoadInitialParams(
                int requestedStartPosition,
                int requestedLoadSize,
                int pageSize) {
            this.requestedStartPosition = requestedStartPosition;
            this.requestedLoadSize = requestedLoadSize;
            this.pageSize = pageSize;
        }
    }

    /**
     * Holder object for inputs to {@link #loadRange(LoadRangeParams, LoadRangeCallback)}.
     */
    public static class LoadRangeParams {
        /**
         * Start position of data to load.
         * <p>
         * Returned data must start at this position.
         */
        public final int startPosition;
        /**
         * Number of items to load.
         * <p>
         * Returned data must be of this size, unless at end of the list.
         */
        public final int loadSize;

        public LoadRangeParams(int startPosition, int loadSize) {
            this.startPosition = startPosition;
            this.loadSize = loadSize;
        }
    }

    /**
     * Callback for {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}
     * to return data, position, and count.
     * <p>
     * A callback can be called only once, and will throw if called again.
     * <p>
     * It is always valid for a DbDataSource loading method that takes a callback to stash the
     * callback and call it later.
     *
     * @param <T> Type of items being loaded.
     */
    public abstract static class LoadInitialCallback<T> {
        /**
         * Called to pass initial load state from a DbDataSource, including the total count used
         * to size placeholders before and after the loaded items.
         *
         * @param data       List of items loaded from the DbDataSource. If this is empty, the
         *                   DbDataSource is treated as empty, and no further loads will occur.
         * @param position   Position of the item at the front of the list.
         * @param totalCount Total number of items that may be returned from this DbDataSource.
         */
        public abstract void onResult(@Nonnull List<T> data, int position, int totalCount);

        /**
         * Called to pass initial load state from a DbDataSource without total count. The list
         * then holds no placeholders, and grows as pages arrive.
         *
         * @param data     List of items loaded from the DbDataSource. If this is empty, the
         *                 DbDataSource is treated as empty, and no further loads will occur.
         * @param position Position of the item at the front of the list.
         */
        public abstract void onResult(@Nonnull List<T> data, int position);
    }

    /**
     * Callback for {@link #loadRange(LoadRangeParams, LoadRangeCallback)} to return data.
     * <p>
     * A callback can be called only once, and will throw if called again.
     *
     * @param <T> Type of items being loaded.
     */
    public abstract static class LoadRangeCallback<T> {
        /**
         * Called to pass loaded data from {@link #loadRange(LoadRangeParams, LoadRangeCallback)}.
         *
         * @param data List of items loaded from the DbDataSource. Must be same size as requested,
         *             unless at end of list.
         */
        public abstract void onResult(@Nonnull List<T> data);
    }

    static class LoadInitialCallbackImpl<T> extends DbPositionalDataSource.LoadInitialCallback<T> {
        final LoadCallbackHelper<T> mCallbackHelper;
        private final int mPageSize;

        LoadInitialCallbackImpl(@Nonnull DbPositionalDataSource<T> dataSource,
                                int pageSize, DbPageResult.Receiver<T> receiver) {
            mCallbackHelper = new LoadCallbackHelper<>(dataSource, DbPageResult.INIT, null, receiver);
            mPageSize = pageSize;
            if (mPageSize < 1) {
                throw new IllegalArgumentException("Page size must be positive");
            }
        }

        @Override
        public void onResult(@Nonnull List<T> data, int position, int totalCount) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                LoadCallbackHelper.validateInitialLoadParams(data, position, totalCount);
                if (position + data.size() != totalCount
                        && data.size() % mPageSize != 0) {
                    throw new IllegalArgumentException("DbPositionalDataSource requires initial load"
                            + " size to be a multiple of page size to support internal tiling."
                            + " loadSize " + data.size() + ", position " + position
                            + ", totalCount " + totalCount + ", pageSize " + mPageSize);
                }

                int trailingUnloadedCount = totalCount - position - data.size();
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(
                        data, position, trailingUnloadedCount, 0, true,
                        position == 0, trailingUnloadedCount == 0));
            }
        }

        @Override
        public void onResult(@Nonnull List<T> data, int position) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                if (position < 0) {
                    throw new IllegalArgumentException("Position must be non-negative");
                }
                if (data.isEmpty() && position != 0) {
                    throw new IllegalArgumentException(
                            "Initial result cannot be empty if items are present in data set.");
                }
                mCallbackHelper.dispatchResultToReceiver(
                        new DbPageResult<>(data, position, position == 0, false));
            }
        }
    }

    static class LoadRangeCallbackImpl<T> extends DbPositionalDataSource.LoadRangeCallback<T> {
        private final LoadCallbackHelper<T> mCallbackHelper;
        private final int mStartPosition;
        private final int mLoadSize;

        LoadRangeCallbackImpl(@Nonnull DbPositionalDataSource<T> dataSource,
                              int resultType, int startPosition, int loadSize,
                              Executor mainThreadExecutor, DbPageResult.Receiver<T> receiver) {
            mCallbackHelper = new LoadCallbackHelper<>(
                    dataSource, resultType, mainThreadExecutor, receiver);
            mStartPosition = startPosition;
            mLoadSize = loadSize;
        }

        @Override
        public void onResult(@Nonnull List<T> data) {
            if (!mCallbackHelper.dispatchInvalidResultIfInvalid()) {
                boolean prepend = mCallbackHelper.mResultType == DbPageResult.PREPEND;
                if (prepend ? data.size() != mLoadSize : data.size() > mLoadSize) {
                    throw new IllegalArgumentException("Range load at " + mStartPosition
                            + " returned " + data.size() + " items, requested " + mLoadSize);
                }
                mCallbackHelper.dispatchResultToReceiver(new DbPageResult<>(data, 0,
                        prepend && mStartPosition == 0,
                        !prepend && data.size() < mLoadSize));
            }
        }
    }

    /**
     * Rounds the initial load size down to whole pages, and centers it around
     * {@code requestedPosition}, aligned to a page boundary.
     */
    static int computeCenteredStartPosition(int requestedPosition, int loadSize, int pageSize) {
        int idealStart = requestedPosition - loadSize / 2;
        return Math.max(0, idealStart / pageSize * pageSize);
    }

    @Override
    final void dispatchLoadInitial(@Nullable Integer position, int initialLoadSize, int pageSize,
                                   @Nonnull Executor mainThreadExecutor,
                                   @Nonnull DbPageResult.Receiver<T> receiver) {
        int loadSize = Math.max(initialLoadSize / pageSize, 1) * pageSize;
        int startPosition = position == null
                ? 0 : computeCenteredStartPosition(position, loadSize, pageSize);

        DbPositionalDataSource.LoadInitialCallbackImpl<T> callback =
                new DbPositionalDataSource.LoadInitialCallbackImpl<>(this, pageSize, receiver);
        loadInitial(new DbPositionalDataSource.LoadInitialParams(
                startPosition, loadSize, pageSize), callback);

        // If initialLoad's callback is not called within the body, we force any following calls
        // to post to the controlling thread.
        callback.mCallbackHelper.setPostExecutor(mainThreadExecutor);
    }

    @Override
    final void dispatchLoadAfter(int currentEndIndex, int currentLoadedCount,
                                 @Nonnull T currentEndItem, int pageSize,
                                 @Nonnull Executor mainThreadExecutor,
                                 @Nonnull DbPageResult.Receiver<T> receiver) {
        dispatchLoadRange(DbPageResult.APPEND, currentEndIndex + 1, pageSize,
                mainThreadExecutor, receiver);
    }

    @Override
    final void dispatchLoadBefore(int currentBeginIndex, int currentLoadedCount,
                                  @Nonnull T currentBeginItem, int pageSize,
                                  @Nonnull Executor mainThreadExecutor,
                                  @Nonnull DbPageResult.Receiver<T> receiver) {
        int startIndex = currentBeginIndex - 1;
        if (startIndex < 0) {
            // trigger empty list load
            dispatchLoadRange(DbPageResult.PREPEND, 0, 0, mainThreadExecutor, receiver);
        } else {
            int loadSize = Math.min(pageSize, startIndex + 1);
            startIndex = startIndex - loadSize + 1;
            dispatchLoadRange(DbPageResult.PREPEND, startIndex, loadSize,
                    mainThreadExecutor, receiver);
        }
    }

    private void dispatchLoadRange(int resultType, int startPosition, int count,
                                   @Nonnull Executor mainThreadExecutor,
                                   @Nonnull DbPageResult.Receiver<T> receiver) {
        DbPositionalDataSource.LoadRangeCallback<T> callback =
                new DbPositionalDataSource.LoadRangeCallbackImpl<>(
                        this, resultType, startPosition, count, mainThreadExecutor, receiver);
        if (count == 0) {
            callback.onResult(Collections.<T>emptyList());
        } else {
            loadRange(new DbPositionalDataSource.LoadRangeParams(startPosition, count), callback);
        }
    }

    @Override
    final Integer getKey(int position, @Nullable T item) {
        return position;
    }

    /**
     * Load initial list data.
     * <p>
     * This method is called to load the initial page(s) from the DbDataSource.
     * <p>
     * Result list must be a multiple of pageSize to enable efficient tiling.
     *
     * @param params   Parameters for initial load, including requested start position, load size,
     *                 and page size.
     * @param callback Callback that receives initial load data, including
     *                 position and total data set size.
     */
    public abstract void loadInitial(
            @Nonnull DbPositionalDataSource.LoadInitialParams params,
            @Nonnull DbPositionalDataSource.LoadInitialCallback<T> callback);

    /**
     * Called to load a range of data from the DbDataSource.
     * <p>
     * Unlike {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}, this method must return
     * the number of items requested, at the position requested, unless the end of the data set
     * is reached.
     *
     * @param params   Parameters for load, including start position and load size.
     * @param callback Callback that receives loaded data.
     */
    public abstract void loadRange(@Nonnull DbPositionalDataSource.LoadRangeParams params,
                                   @Nonnull DbPositionalDataSource.LoadRangeCallback<T> callback);

    /**
     * Helper for computing an initial position in
     * {@link #loadInitial(LoadInitialParams, LoadInitialCallback)} when total data set size can be
     * computed ahead of loading.
     * <p>
     * The value computed by this function will do bounds checking, page alignment, and positioning
     * based on initial load size requested.
     * <pre>
     * {@literal @}Override
     * public void loadInitial({@literal @}Nonnull LoadInitialParams params,
     *         {@literal @}Nonnull LoadInitialCallback&lt;Item> callback) {
     *     int totalCount = computeCount();
     *     int position = computeInitialLoadPosition(params, totalCount);
     *     int loadSize = computeInitialLoadSize(params, position, totalCount);
     *     callback.onResult(loadRangeInternal(position, loadSize), position, totalCount);
     * }</pre>
     *
     * @param params     Params passed to {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}.
     * @param totalCount Total size of the data set.
     * @return Position to start loading at.
     * @see #computeInitialLoadSize(LoadInitialParams, int, int)
     */
    public static int computeInitialLoadPosition(@Nonnull DbPositionalDataSource.LoadInitialParams params,
                                                 int totalCount) {
        int position = params.requestedStartPosition;
        int initialLoadSize = params.requestedLoadSize;
        int pageSize = params.pageSize;

        int pageStart = position / pageSize * pageSize;

        // maximum start pos is that which will encompass end of list
        int maximumLoadPage = ((totalCount - initialLoadSize + pageSize - 1) / pageSize) * pageSize;
        pageStart = Math.min(maximumLoadPage, pageStart);

        // minimum start position is 0
        pageStart = Math.max(0, pageStart);

        return pageStart;
    }

    /**
     * Helper for computing an initial load size in
     * {@link #loadInitial(LoadInitialParams, LoadInitialCallback)} when total data set size can be
     * computed ahead of loading.
     *
     * @param params              Params passed to
     *                            {@link #loadInitial(LoadInitialParams, LoadInitialCallback)}.
     * @param initialLoadPosition Value returned by
     *                            {@link #computeInitialLoadPosition(LoadInitialParams, int)}
     * @param totalCount          Total size of the data set.
     * @return Number of items to load.
     * @see #computeInitialLoadPosition(LoadInitialParams, int)
     */
    public static int computeInitialLoadSize(@Nonnull DbPositionalDataSource.LoadInitialParams params,
                                             int initialLoadPosition, int totalCount) {
        return Math.min(totalCount - initialLoadPosition, params.requestedLoadSize);
    }

    @Nonnull
    @Override
    public final <V> DbPositionalDataSource<V> mapByPage(
            @Nonnull Function<List<T>, List<V>> function) {
        return new DbWrapperPositionalDataSource<>(this, function);
    }

    @Nonnull
    @Override
    public final <V> DbPositionalDataSource<V> map(@Nonnull Function<T, V> function) {
        return mapByPage(createListFunction(function));
    }
}
