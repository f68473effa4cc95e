package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lazy loading list that pages in immutable content from a {@link DbDataSource}.
 * <p>
 * A DbPagedList is a {@link java.util.List} which loads its data in chunks (pages) from a
 * {@link DbDataSource}. Items can be accessed with {@link #get(int)}, and further loading can be
 * triggered with {@link #loadAround(int)}. To display a DbPagedList, observe its
 * {@link Callback} to learn about loaded and dropped ranges.
 * <p>
 * All data in a DbPagedList is loaded from its DbDataSource. Creating a DbPagedList loads the
 * first chunk of data from the DbDataSource immediately, and should for this reason be done on a
 * background thread. The constructed DbPagedList may then be passed to and used on the
 * controlling thread, the one draining the notify executor.
 * <p>
 * If the DbDataSource counts its items, the list is sized to the whole data set up front, and
 * unloaded positions read as {@code null} placeholders. Otherwise the list grows as pages are
 * appended or prepended.
 * <p>
 * A DbPagedList is a snapshot of its source. Once the DbDataSource is invalidated, for example
 * because the {@link DbObjectCollection} it reads from changed, the list {@link #detach()
 * detaches} and stops loading; a new list has to be built to see the change. A
 * {@link DbLivePagedListBuilder} does that automatically.
 *
 * @param <T> The type of the entries in the list.
 */
public abstract class DbPagedList<T> extends AbstractList<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbPagedList.class);

    @Nonnull
    final Executor mMainThreadExecutor;
    @Nonnull
    final Executor mBackgroundThreadExecutor;
    @Nullable
    final DbPagedList.BoundaryCallback<T> mBoundaryCallback;
    @Nonnull
    final DbPagedList.Config mConfig;
    @Nonnull
    final DbPagedStorage<T> mStorage;

    /**
     * Last access location, in total position space (including offset).
     * <p>
     * Used by positional data sources to initialize loading near viewport
     */
    int mLastLoad = 0;
    T mLastItem = null;

    final int mRequiredRemainder;

    // if set to true, mBoundaryCallback is non-null, and should
    // be dispatched when nearby load has occurred
    @SuppressWarnings("WeakerAccess") /* synthetic access */
            boolean mBoundaryCallbackBeginDeferred = false;
    @SuppressWarnings("WeakerAccess") /* synthetic access */
            boolean mBoundaryCallbackEndDeferred = false;

    private boolean mBoundaryCallbackBeginDispatched = false;
    private boolean mBoundaryCallbackEndDispatched = false;

    // lowest and highest index accessed by loadAround, only meaningful once
    // mAccessRangeInitialized is set. Used to decide when mBoundaryCallback should be dispatched
    private boolean mAccessRangeInitialized = false;
    private int mLowestIndexAccessed;
    private int mHighestIndexAccessed;

    private final AtomicBoolean mDetached = new AtomicBoolean(false);

    private final ArrayList<WeakReference<Callback>> mCallbacks = new ArrayList<>();

    @Nullable
    private DbObjectCollection<T> mBackingCollection;
    @Nullable
    private DbObjectCollection.ChangeListener<T> mCollectionListener;
    @Nullable
    private DbDataSource.InvalidatedCallback mDetachOnInvalidated;

    DbPagedList(@Nonnull DbPagedStorage<T> storage,
                @Nonnull Executor mainThreadExecutor,
                @Nonnull Executor backgroundThreadExecutor,
                @Nullable DbPagedList.BoundaryCallback<T> boundaryCallback,
                @Nonnull DbPagedList.Config config) {
        mStorage = storage;
        mMainThreadExecutor = mainThreadExecutor;
        mBackgroundThreadExecutor = backgroundThreadExecutor;
        mBoundaryCallback = boundaryCallback;
        mConfig = config;
        mRequiredRemainder = mConfig.prefetchDistance * 2 + mConfig.pageSize;
    }

    /**
     * Create a DbPagedList which loads data from the provided data source on a background thread,
     * allowing passing of data back to the controlling thread.
     *
     * @param backingCollection Collection whose changes invalidate the data source, or null.
     * @param dataSource        DbDataSource providing data to the DbPagedList
     * @param notifyExecutor    Thread that will use and consume data from the DbPagedList.
     *                          Generally, this is the thread draining a {@link DbTaskQueue}.
     * @param fetchExecutor     Data loading will be done via this executor.
     * @param boundaryCallback  Optional boundary callback to attach to the list.
     * @param config            DbPagedList Config, which defines how the DbPagedList will load data.
     * @param <K>               Key type that indicates to the DbDataSource what data to load.
     * @param <T>               Type of items to be held and loaded by the DbPagedList.
     * @return Newly created DbPagedList, which will page in data from the DbDataSource as needed.
     */
    @Nonnull
    @SuppressWarnings("WeakerAccess") /* synthetic access */
    static <K, T> DbPagedList<T> create(@Nullable DbObjectCollection<T> backingCollection,
                                        @Nonnull DbDataSource<K, T> dataSource,
                                        @Nonnull Executor notifyExecutor,
                                        @Nonnull Executor fetchExecutor,
                                        @Nullable DbPagedList.BoundaryCallback<T> boundaryCallback,
                                        @Nonnull DbPagedList.Config config,
                                        @Nullable K key) {
        int lastLoad = DbContiguousPagedList.LAST_LOAD_UNSPECIFIED;
        if (dataSource instanceof DbPositionalDataSource && key != null) {
            lastLoad = (Integer) key;
        }
        DbContiguousDataSource<K, T> contigDataSource = (DbContiguousDataSource<K, T>) dataSource;
        DbPagedList<T> list = new DbContiguousPagedList<>(contigDataSource,
                notifyExecutor,
                fetchExecutor,
                boundaryCallback,
                config,
                key,
                lastLoad);
        if (backingCollection != null && !list.isDetached()) {
            list.attachBackingCollection(backingCollection);
        }
        return list;
    }

    /**
     * Builder class for DbPagedList.
     * <p>
     * DbDataSource, Config, and the initial key are all required to be known up front. Executors
     * are optional: without a notify executor, results are posted to the
     * {@link DbTaskQueue#forCurrentThread() queue of the building thread}, which that thread then
     * drains. Without a fetch executor, loads run on the notify executor.
     *
     * @param <Value> Type of items held and loaded by the DbPagedList.
     * @param <Key>   Type of key used to load data from the DbDataSource.
     */
    @SuppressWarnings("WeakerAccess")
    public static final class Builder<Key, Value> {
        @Nullable
        private final DbObjectCollection<Value> mBackingCollection;
        private final DbDataSource<Key, Value> mDataSource;
        private final DbPagedList.Config mConfig;
        private Executor mNotifyExecutor;
        private Executor mFetchExecutor;
        private DbPagedList.BoundaryCallback<Value> mBoundaryCallback;
        private Key mInitialKey;

        /**
         * Create a DbPagedList.Builder over a database collection.
         * <p>
         * The built list invalidates {@code dataSource} as soon as {@code backingCollection}
         * reports a change. The list detaches once its data source is invalidated, for any
         * reason, and stops listening to the collection.
         *
         * @param backingCollection Collection the data source reads from.
         * @param dataSource        DbDataSource the DbPagedList will load from.
         * @param config            Config that defines how the DbPagedList loads data from its
         *                          DbDataSource.
         */
        public Builder(@Nullable DbObjectCollection<Value> backingCollection,
                       @Nonnull DbDataSource<Key, Value> dataSource,
                       @Nonnull DbPagedList.Config config) {
            //noinspection ConstantConditions
            if (dataSource == null) {
                throw new IllegalArgumentException("DbDataSource may not be null");
            }
            //noinspection ConstantConditions
            if (config == null) {
                throw new IllegalArgumentException("Config may not be null");
            }
            mBackingCollection = backingCollection;
            mDataSource = dataSource;
            mConfig = config;
        }

        public Builder(@Nonnull DbDataSource<Key, Value> dataSource, @Nonnull DbPagedList.Config config) {
            this(null, dataSource, config);
        }

        /**
         * Create a DbPagedList.Builder with the provided {@link DbDataSource} and page size.
         * <p>
         * This method is a convenience for:
         * <pre>
         * DbPagedList.Builder(dataSource,
         *         new DbPagedList.Config.Builder().setPageSize(pageSize).build());
         * </pre>
         *
         * @param dataSource DbDataSource the DbPagedList will load from.
         * @param pageSize   Config that defines how the DbPagedList loads data from its DbDataSource.
         */
        public Builder(@Nonnull DbDataSource<Key, Value> dataSource, int pageSize) {
            this(dataSource, new DbPagedList.Config.Builder().setPageSize(pageSize).build());
        }

        /**
         * The executor defining where page loading updates are dispatched.
         *
         * @param notifyExecutor Executor that receives DbPagedList updates, and where
         *                       {@link Callback} calls are dispatched.
         * @return this
         */
        @Nonnull
        public DbPagedList.Builder<Key, Value> setNotifyExecutor(@Nonnull Executor notifyExecutor) {
            mNotifyExecutor = notifyExecutor;
            return this;
        }

        /**
         * The executor used to fetch additional pages from the DbDataSource.
         *
         * @param fetchExecutor Executor used to fetch from DataSources.
         * @return this
         */
        @Nonnull
        public DbPagedList.Builder<Key, Value> setFetchExecutor(@Nonnull Executor fetchExecutor) {
            mFetchExecutor = fetchExecutor;
            return this;
        }

        /**
         * The BoundaryCallback for out of data events.
         * <p>
         * Pass a BoundaryCallback to listen to when the DbPagedList runs out of data to load.
         *
         * @param boundaryCallback BoundaryCallback for listening to out-of-data events.
         * @return this
         */
        @Nonnull
        public DbPagedList.Builder<Key, Value> setBoundaryCallback(
                @Nullable DbPagedList.BoundaryCallback<Value> boundaryCallback) {
            mBoundaryCallback = boundaryCallback;
            return this;
        }

        /**
         * Sets the initial key the DbDataSource should load around as part of initialization.
         *
         * @param initialKey Key the DbDataSource should load around as part of initialization.
         * @return this
         */
        @Nonnull
        public DbPagedList.Builder<Key, Value> setInitialKey(@Nullable Key initialKey) {
            mInitialKey = initialKey;
            return this;
        }

        /**
         * Creates a {@link DbPagedList} with the given parameters.
         * <p>
         * This call will dispatch the {@link DbDataSource}'s loadInitial method immediately. If a
         * DbDataSource posts all of its work (e.g. to a network thread), the DbPagedList will
         * be immediately created as empty, and grow to its initial size when the initial load
         * completes.
         * <p>
         * If the DbDataSource implements its load synchronously, doing the load work immediately
         * in the loadInitial method, the DbPagedList will block on that load before completing
         * construction.
         *
         * @return The newly constructed DbPagedList
         */
        @Nonnull
        public DbPagedList<Value> build() {
            Executor notifyExecutor = mNotifyExecutor != null
                    ? mNotifyExecutor : DbTaskQueue.forCurrentThread();
            Executor fetchExecutor = mFetchExecutor != null ? mFetchExecutor : notifyExecutor;

            return DbPagedList.create(
                    mBackingCollection,
                    mDataSource,
                    notifyExecutor,
                    fetchExecutor,
                    mBoundaryCallback,
                    mConfig,
                    mInitialKey);
        }
    }

    /**
     * Get the item in the list of loaded items at the provided index.
     *
     * @param index Index in the loaded item list. Must be >= 0, and &lt; {@link #size()}
     * @return The item at the passed index, or null if a null placeholder is at the specified
     * position.
     * @see #size()
     */
    @Override
    @Nullable
    public T get(int index) {
        T item = mStorage.get(index);
        if (item != null) {
            mLastItem = item;
        }
        return item;
    }

    /**
     * Load adjacent items to passed index.
     *
     * @param index Index at which to load.
     */
    public void loadAround(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size());
        }

        mLastLoad = index + getPositionOffset();
        if (!isDetached()) {
            loadAroundInternal(index);
        }

        if (mAccessRangeInitialized) {
            mLowestIndexAccessed = Math.min(mLowestIndexAccessed, index);
            mHighestIndexAccessed = Math.max(mHighestIndexAccessed, index);
        } else {
            mAccessRangeInitialized = true;
            mLowestIndexAccessed = index;
            mHighestIndexAccessed = index;
        }

        /*
         * mLowestIndexAccessed / mHighestIndexAccessed have been updated, so check if we need to
         * dispatch boundary callbacks. Boundary callbacks are deferred until last items are loaded,
         * and accesses happen near the boundaries.
         *
         * Note: we post here, since the caller may want to react to the callback by touching
         * this list again.
         */
        tryDispatchBoundaryCallbacks(true);
    }

    // Creation thread for initial synchronous load, otherwise controlling thread
    // Safe to access controlling thread only state - no other thread has reference during construction
    void deferBoundaryCallbacks(final boolean deferEmpty,
                                final boolean deferBegin, final boolean deferEnd) {
        if (mBoundaryCallback == null) {
            throw new IllegalStateException("Can't defer BoundaryCallback, no instance");
        }

        /*
         * If the access range hasn't been initialized, set it to (size, 0), since placeholders
         * must already be computed by this point. Boundary callbacks are then sent immediately
         * when the loaded data set is smaller than the prefetch window.
         */
        if (!mAccessRangeInitialized) {
            mAccessRangeInitialized = true;
            mLowestIndexAccessed = mStorage.size();
            mHighestIndexAccessed = 0;
        }

        if (deferEmpty || deferBegin || deferEnd) {
            // on is dispatched immediately, since items won't be accessed
            if (deferEmpty) {
                mBoundaryCallback.onZeroItemsLoaded();
            }

            // for other callbacks, mark deferred, and only dispatch if loadAround
            // has been called near to the position
            if (deferBegin && !mBoundaryCallbackBeginDispatched) {
                mBoundaryCallbackBeginDeferred = true;
            }
            if (deferEnd && !mBoundaryCallbackEndDispatched) {
                mBoundaryCallbackEndDeferred = true;
            }
            tryDispatchBoundaryCallbacks(false);
        }
    }

    /**
     * Call this when the access range has changed, or a deferred flag is set.
     */
    @SuppressWarnings("WeakerAccess") /* synthetic access */
    void tryDispatchBoundaryCallbacks(boolean post) {
        if (!mAccessRangeInitialized) {
            return;
        }
        final boolean dispatchBegin = mBoundaryCallbackBeginDeferred
                && mLowestIndexAccessed <= mConfig.prefetchDistance;
        final boolean dispatchEnd = mBoundaryCallbackEndDeferred
                && mHighestIndexAccessed >= size() - 1 - mConfig.prefetchDistance;

        if (!dispatchBegin && !dispatchEnd) {
            return;
        }

        if (dispatchBegin) {
            mBoundaryCallbackBeginDeferred = false;
            mBoundaryCallbackBeginDispatched = true;
        }
        if (dispatchEnd) {
            mBoundaryCallbackEndDeferred = false;
            mBoundaryCallbackEndDispatched = true;
        }
        if (post) {
            mMainThreadExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    dispatchBoundaryCallbacks(dispatchBegin, dispatchEnd);
                }
            });
        } else {
            dispatchBoundaryCallbacks(dispatchBegin, dispatchEnd);
        }
    }

    @SuppressWarnings("WeakerAccess") /* synthetic access */
    void dispatchBoundaryCallbacks(boolean begin, boolean end) {
        // safe to deref mBoundaryCallback here, since we only defer if mBoundaryCallback present
        if (begin) {
            //noinspection ConstantConditions
            mBoundaryCallback.onItemAtFrontLoaded(mStorage.getFirstLoadedItem());
        }
        if (end) {
            //noinspection ConstantConditions
            mBoundaryCallback.onItemAtEndLoaded(mStorage.getLastLoadedItem());
        }
    }

    /**
     * The loaded edge item changed, so a pending front or end callback would report a stale item.
     */
    void cancelDeferredBoundaryCallback(boolean begin) {
        if (begin) {
            mBoundaryCallbackBeginDeferred = false;
        } else {
            mBoundaryCallbackEndDeferred = false;
        }
    }

    void offsetAccessIndices(int offset) {
        // update access range
        if (mAccessRangeInitialized) {
            mLowestIndexAccessed += offset;
            mHighestIndexAccessed += offset;
        }
    }

    /**
     * Returns size of the list, including any not-yet-loaded null padding.
     *
     * @return Current total size of the list.
     */
    @Override
    public int size() {
        return mStorage.size();
    }

    /**
     * Returns the number of items loaded in the DbPagedList.
     *
     * @return Number of items currently loaded, not counting placeholders.
     */
    public int getLoadedCount() {
        return mStorage.getLoadedCount();
    }

    /**
     * Return the Config used to construct this DbPagedList.
     *
     * @return the Config of this DbPagedList
     */
    @Nonnull
    public DbPagedList.Config getConfig() {
        return mConfig;
    }

    /**
     * Return the DbDataSource that provides data to this DbPagedList.
     *
     * @return the DbDataSource of this DbPagedList.
     */
    @Nonnull
    public abstract DbDataSource<?, T> getDataSource();

    /**
     * Return the key for the position passed most recently to {@link #loadAround(int)}.
     * <p>
     * When a DbPagedList is invalidated, you can pass the key returned by this function to
     * initialize the next DbPagedList. This ensures (depending on load times) that the next
     * DbPagedList that arrives will have data that overlaps. If you use
     * {@link DbLivePagedListBuilder}, it will do this for you.
     *
     * @return Key of position most recently passed to {@link #loadAround(int)}.
     */
    @Nullable
    public abstract Object getLastKey();

    /**
     * True if the DbPagedList has detached the DbDataSource it was loading from, and will no
     * longer load new data.
     *
     * @return True if the data source is detached.
     */
    @SuppressWarnings("WeakerAccess")
    public boolean isDetached() {
        return mDetached.get();
    }

    /**
     * Detach the DbPagedList from its DbDataSource, and attempt to load no more data.
     * <p>
     * This is called automatically when a DbDataSource is observed to be invalid, which is a
     * signal to stop loading. Loads already in flight still deliver if their source is valid.
     */
    @SuppressWarnings("WeakerAccess")
    public void detach() {
        if (mDetached.compareAndSet(false, true)) {
            LOGGER.debug("Detached {} from {}", this.getClass().getSimpleName(), getDataSource());
            detachBackingCollection();
        }
    }

    /**
     * Position offset of the data in the list.
     * <p>
     * If the data source counts its items, this is always zero, since every position in the data
     * set is represented by an item or a placeholder.
     * <p>
     * Otherwise, this is the absolute position of the item at list index zero, which lets a list
     * that starts from the middle of its data set report positions that agree with its source.
     *
     * @return Position offset of the list.
     */
    public int getPositionOffset() {
        return mStorage.getPositionOffset();
    }

    /**
     * Invalidates the data source whenever {@code collection} changes. The list detaches as soon
     * as its data source is invalidated, dropping the collection listener with it.
     */
    void attachBackingCollection(@Nonnull DbObjectCollection<T> collection) {
        final DbDataSource<?, T> dataSource = getDataSource();
        DbObjectCollection.ChangeListener<T> listener = new DbObjectCollection.ChangeListener<T>() {
            @Override
            public void onChange(@Nonnull DbObjectCollection<T> changed) {
                dataSource.invalidate();
            }
        };
        DbDataSource.InvalidatedCallback detachCallback = new DbDataSource.InvalidatedCallback() {
            @Override
            public void onInvalidated() {
                detach();
            }
        };
        synchronized (mCallbacks) {
            mBackingCollection = collection;
            mCollectionListener = listener;
            mDetachOnInvalidated = detachCallback;
        }
        collection.addChangeListener(listener);
        dataSource.addInvalidatedCallback(detachCallback);
        if (dataSource.isInvalid()) {
            // invalidated before the callback was registered
            detach();
        }
        if (isDetached()) {
            // detached while registering, the listeners may have been added after removal
            detachBackingCollection();
        }
    }

    private void detachBackingCollection() {
        DbObjectCollection<T> collection;
        DbObjectCollection.ChangeListener<T> listener;
        DbDataSource.InvalidatedCallback detachCallback;
        synchronized (mCallbacks) {
            collection = mBackingCollection;
            listener = mCollectionListener;
            detachCallback = mDetachOnInvalidated;
            mBackingCollection = null;
            mCollectionListener = null;
            mDetachOnInvalidated = null;
        }
        if (collection != null) {
            collection.removeChangeListener(listener);
        }
        if (detachCallback != null) {
            getDataSource().removeInvalidatedCallback(detachCallback);
        }
    }

    /**
     * Adds a callback, which will be notified when the list's content changes.
     * <p>
     * The callback is held weakly; keep a reference to it for as long as updates are wanted.
     *
     * @param callback Callback to dispatch to.
     * @see #removeWeakCallback(Callback)
     */
    @SuppressWarnings("WeakerAccess")
    public void addWeakCallback(@Nonnull DbPagedList.Callback callback) {
        // first, clean up any empty weak refs
        for (int i = mCallbacks.size() - 1; i >= 0; i--) {
            final DbPagedList.Callback currentCallback = mCallbacks.get(i).get();
            if (currentCallback == null) {
                mCallbacks.remove(i);
            }
        }

        // then add the new one
        mCallbacks.add(new WeakReference<>(callback));
    }

    /**
     * Removes a previously added callback.
     *
     * @param callback Callback, previously added.
     * @see #addWeakCallback(Callback)
     */
    @SuppressWarnings("WeakerAccess")
    public void removeWeakCallback(@Nonnull DbPagedList.Callback callback) {
        for (int i = mCallbacks.size() - 1; i >= 0; i--) {
            final DbPagedList.Callback currentCallback = mCallbacks.get(i).get();
            if (currentCallback == null || currentCallback == callback) {
                // found callback, or empty weak ref
                mCallbacks.remove(i);
            }
        }
    }

    void notifyInserted(int position, int count) {
        if (count != 0) {
            for (int i = mCallbacks.size() - 1; i >= 0; i--) {
                final DbPagedList.Callback callback = mCallbacks.get(i).get();
                if (callback != null) {
                    callback.onInserted(position, count);
                }
            }
        }
    }

    void notifyChanged(int position, int count) {
        if (count != 0) {
            for (int i = mCallbacks.size() - 1; i >= 0; i--) {
                final DbPagedList.Callback callback = mCallbacks.get(i).get();

                if (callback != null) {
                    callback.onChanged(position, count);
                }
            }
        }
    }

    abstract void loadAroundInternal(int index);

    /**
     * Callback signaling when content is loaded into the list.
     * <p>
     * Can be used to listen to items being paged in and out. Called on the controlling thread.
     */
    public abstract static class Callback {
        /**
         * Called when null padding items have been loaded to signal newly available data, or when
         * data that hasn't been used in a while has been dropped, and swapped back to null.
         *
         * @param position Position of first newly loaded items, out of total number of items
         *                 (including padded nulls).
         * @param count    Number of items loaded.
         */
        public abstract void onChanged(int position, int count);

        /**
         * Called when new items have been loaded at the end or beginning of the list.
         *
         * @param position Position of the first newly loaded item (in practice, either
         *                 <code>0</code> or <code>size - 1</code>.
         * @param count    Number of items loaded.
         */
        public abstract void onInserted(int position, int count);
    }

    /**
     * Configures how a DbPagedList loads content from its DbDataSource.
     * <p>
     * Use a Config {@link DbPagedList.Config.Builder} to construct and define custom loading
     * behavior, such as {@link DbPagedList.Config.Builder#setPageSize(int)}, which defines number
     * of items loaded at a time.
     */
    public static class Config {
        /**
         * When {@link #maxSize} is set to {@code MAX_SIZE_UNBOUNDED}, the maximum number of items
         * loaded is unbounded, and pages will never be dropped.
         */
        @SuppressWarnings("WeakerAccess")
        public static final int MAX_SIZE_UNBOUNDED = Integer.MAX_VALUE;

        /**
         * Size of each page loaded by the DbPagedList.
         */
        public final int pageSize;

        /**
         * Prefetch distance which defines how far ahead to load.
         * <p>
         * If this value is set to 50, the paged list will attempt to load 50 items in advance of
         * data that's already been accessed.
         *
         * @see DbPagedList#loadAround(int)
         */
        @SuppressWarnings("WeakerAccess")
        public final int prefetchDistance;

        /**
         * Defines the maximum number of items that may be loaded into this pagedList before pages
         * should be dropped.
         * <p>
         * Page-keyed data sources never drop pages.
         *
         * @see #MAX_SIZE_UNBOUNDED
         * @see Builder#setMaxSize(int)
         */
        public final int maxSize;

        /**
         * Size hint for initial load of DbPagedList, often larger than a regular page.
         */
        @SuppressWarnings("WeakerAccess")
        public final int initialLoadSizeHint;

        Config(int pageSize, int prefetchDistance, int initialLoadSizeHint, int maxSize) {
            this.pageSize = pageSize;
            this.prefetchDistance = prefetchDistance;
            this.initialLoadSizeHint = initialLoadSizeHint;
            this.maxSize = maxSize;
        }

        @Override
        public String toString() {
            return "Config{pageSize=" + pageSize
                    + ", prefetchDistance=" + prefetchDistance
                    + ", initialLoadSizeHint=" + initialLoadSizeHint
                    + ", maxSize=" + (maxSize == MAX_SIZE_UNBOUNDED ? "unbounded" : maxSize)
                    + '}';
        }

        /**
         * Builder class for {@link DbPagedList.Config}.
         * <p>
         * You must at minimum specify page size with {@link #setPageSize(int)}.
         */
        public static final class Builder {
            static final int DEFAULT_INITIAL_PAGE_MULTIPLIER = 3;

            private int mPageSize = -1;
            private int mPrefetchDistance = -1;
            private int mInitialLoadSizeHint = -1;
            private int mMaxSize = MAX_SIZE_UNBOUNDED;

            /**
             * Defines the number of items loaded at once from the DbDataSource.
             * <p>
             * Should be several times the number of visible items onscreen.
             *
             * @param pageSize Number of items loaded at once from the DbDataSource, at least 1.
             * @return this
             */
            @Nonnull
            public DbPagedList.Config.Builder setPageSize(int pageSize) {
                if (pageSize < 1) {
                    throw new IllegalArgumentException("Page size must be a positive number");
                }
                mPageSize = pageSize;
                return this;
            }

            /**
             * Defines how far from the edge of loaded content an access must be to trigger further
             * loading.
             * <p>
             * If not set, defaults to page size.
             * <p>
             * A value of 0 indicates that no list items will be loaded until they are specifically
             * requested.
             *
             * @param prefetchDistance Distance the DbPagedList should prefetch.
             * @return this
             */
            @Nonnull
            public DbPagedList.Config.Builder setPrefetchDistance(int prefetchDistance) {
                if (prefetchDistance < 0) {
                    throw new IllegalArgumentException("Prefetch distance must not be negative");
                }
                mPrefetchDistance = prefetchDistance;
                return this;
            }

            /**
             * Defines how many items to load when first load occurs.
             * <p>
             * This value is typically larger than page size, so on first load data there's a large
             * enough range of content loaded to cover small scrolls.
             * <p>
             * If not set, defaults to three times page size.
             *
             * @param initialLoadSizeHint Number of items to load while initializing the DbPagedList.
             * @return this
             */
            @SuppressWarnings("WeakerAccess")
            @Nonnull
            public DbPagedList.Config.Builder setInitialLoadSizeHint(int initialLoadSizeHint) {
                if (initialLoadSizeHint < 1) {
                    throw new IllegalArgumentException("Initial load size hint must be positive");
                }
                mInitialLoadSizeHint = initialLoadSizeHint;
                return this;
            }

            /**
             * Defines how many items to keep loaded at once.
             * <p>
             * This can be used to cap the number of items kept in memory by dropping pages. This
             * value is typically many pages so old pages are cached in case the user scrolls back.
             * <p>
             * This value must be at least two times the
             * {@link #setPrefetchDistance(int)} prefetch distance} plus the
             * {@link #setPageSize(int) page size}. This constraint prevents loads from being
             * continuously fetched and discarded due to prefetching.
             * <p>
             * The max size specified here is best effort, not a guarantee. In practice, if maxSize
             * is many times the page size, the number of items held by the DbPagedList will not
             * grow above this number. Dropped pages are swapped back to placeholders, so the size
             * of the list never changes when pages are dropped.
             * <p>
             * If not set, defaults to {@code MAX_SIZE_UNBOUNDED}, which disables page dropping.
             *
             * @param maxSize Maximum number of items to keep in memory, or
             *                {@code MAX_SIZE_UNBOUNDED} to disable page dropping.
             * @return this
             * @see Config#MAX_SIZE_UNBOUNDED
             * @see Config#maxSize
             */
            @Nonnull
            public DbPagedList.Config.Builder setMaxSize(int maxSize) {
                mMaxSize = maxSize;
                return this;
            }

            /**
             * Creates a {@link DbPagedList.Config} with the given parameters.
             *
             * @return A new Config.
             */
            @Nonnull
            public DbPagedList.Config build() {
                if (mPageSize < 1) {
                    throw new IllegalArgumentException("Page size must be set");
                }
                if (mPrefetchDistance < 0) {
                    mPrefetchDistance = mPageSize;
                }
                if (mInitialLoadSizeHint < 0) {
                    mInitialLoadSizeHint = mPageSize * DEFAULT_INITIAL_PAGE_MULTIPLIER;
                }
                if (mMaxSize != MAX_SIZE_UNBOUNDED) {
                    if (mMaxSize < mPageSize + mPrefetchDistance * 2) {
                        throw new IllegalArgumentException("Maximum size must be at least"
                                + " pageSize + 2*prefetchDist, pageSize=" + mPageSize
                                + ", prefetchDist=" + mPrefetchDistance + ", maxSize=" + mMaxSize);
                    }
                }

                return new DbPagedList.Config(mPageSize, mPrefetchDistance,
                        mInitialLoadSizeHint, mMaxSize);
            }
        }
    }

    /**
     * Signals when a DbPagedList has reached the end of available data.
     * <p>
     * When the data source counts its items, or reports null page keys, the list knows where the
     * data set ends; this callback then fires once an access comes within the prefetch distance of
     * that edge. That is the moment to fetch more data from a remote store into the local database,
     * which in turn invalidates the current data source and brings in a new list with the data.
     * <p>
     * Called on the controlling thread. The same instance may be shared by several lists in turn,
     * so implementations should tolerate being told about the same edge more than once.
     *
     * @param <T> Type loaded by the DbPagedList.
     */
    public abstract static class BoundaryCallback<T> {
        /**
         * Called when zero items are returned from an initial load of the DbPagedList's data source.
         */
        public void onZeroItemsLoaded() {
        }

        /**
         * Called when the item at the front of the DbPagedList has been loaded, and access has
         * occurred within {@link Config#prefetchDistance} of it.
         * <p>
         * No more data will be prepended to the DbPagedList before this item.
         *
         * @param itemAtFront The first item of DbPagedList
         */
        public void onItemAtFrontLoaded(@Nonnull T itemAtFront) {
        }

        /**
         * Called when the item at the end of the DbPagedList has been loaded, and access has
         * occurred within {@link Config#prefetchDistance} of it.
         * <p>
         * No more data will be appended to the DbPagedList after this item.
         *
         * @param itemAtEnd The last item of DbPagedList
         */
        public void onItemAtEndLoaded(@Nonnull T itemAtEnd) {
        }
    }
}
