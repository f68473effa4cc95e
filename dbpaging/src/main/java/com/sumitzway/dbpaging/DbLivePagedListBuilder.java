package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * Builder for {@link DbLivePagedList}, given a {@link DbDataSource.Factory} and a
 * {@link DbPagedList.Config}.
 * <p>
 * The required parameters are in the constructor, so you can simply construct and build, or
 * optionally enable extra features (such as initial load key, or BoundaryCallback).
 *
 * @param <Key>   Type of input valued used to load data from the DbDataSource. Must be integer if
 *                you're using {@link DbPositionalDataSource}.
 * @param <Value> Item type being presented.
 */
public final class DbLivePagedListBuilder<Key, Value> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbLivePagedListBuilder.class);

    private Key mInitialLoadKey;
    private final DbPagedList.Config mConfig;
    private final DbDataSource.Factory<Key, Value> mDataSourceFactory;
    private DbPagedList.BoundaryCallback<Value> mBoundaryCallback;
    @Nullable
    private DbObjectCollection<Value> mBackingCollection;
    private Executor mNotifyExecutor;
    private Executor mFetchExecutor;

    /**
     * Creates a DbLivePagedListBuilder with required parameters.
     *
     * @param dataSourceFactory DbDataSource factory providing DbDataSource generations.
     * @param config            Paging configuration.
     */
    public DbLivePagedListBuilder(@Nonnull DbDataSource.Factory<Key, Value> dataSourceFactory,
                                  @Nonnull DbPagedList.Config config) {
        //noinspection ConstantConditions
        if (config == null) {
            throw new IllegalArgumentException("DbPagedList.Config must be provided");
        }
        //noinspection ConstantConditions
        if (dataSourceFactory == null) {
            throw new IllegalArgumentException("DbDataSource.Factory must be provided");
        }

        mDataSourceFactory = dataSourceFactory;
        mConfig = config;
    }

    /**
     * Creates a DbLivePagedListBuilder with required parameters.
     * <p>
     * This method is a convenience for:
     * <pre>
     * DbLivePagedListBuilder(dataSourceFactory,
     *         new DbPagedList.Config.Builder().setPageSize(pageSize).build())
     * </pre>
     *
     * @param dataSourceFactory DbDataSource.Factory providing DbDataSource generations.
     * @param pageSize          Size of pages to load.
     */
    public DbLivePagedListBuilder(@Nonnull DbDataSource.Factory<Key, Value> dataSourceFactory,
                                  int pageSize) {
        this(dataSourceFactory, new DbPagedList.Config.Builder().setPageSize(pageSize).build());
    }

    /**
     * First loading key passed to the first DbPagedList/DbDataSource.
     * <p>
     * When a new DbPagedList/DbDataSource pair is created after the first, it acquires a load key
     * from the previous generation so that data is loaded around the position already being
     * observed.
     *
     * @param key Initial load key passed to the first DbPagedList/DbDataSource.
     * @return this
     */
    @Nonnull
    public DbLivePagedListBuilder<Key, Value> setInitialLoadKey(@Nullable Key key) {
        mInitialLoadKey = key;
        return this;
    }

    /**
     * Sets a {@link DbPagedList.BoundaryCallback} on each DbPagedList created, typically used to
     * load additional data from a remote store when the local database runs out of data.
     * <p>
     * Pass a BoundaryCallback to listen to when the DbPagedList runs out of data to load. The same
     * instance is handed to every generation.
     *
     * @param boundaryCallback The boundary callback for listening to DbPagedList load state.
     * @return this
     */
    @SuppressWarnings("unused")
    @Nonnull
    public DbLivePagedListBuilder<Key, Value> setBoundaryCallback(
            @Nullable DbPagedList.BoundaryCallback<Value> boundaryCallback) {
        mBoundaryCallback = boundaryCallback;
        return this;
    }

    /**
     * Sets the collection the data sources read from. Every generation listens to it, and a
     * change to the collection produces the next generation.
     *
     * @param collection Collection backing the data sources of every generation.
     * @return this
     */
    @Nonnull
    public DbLivePagedListBuilder<Key, Value> setBackingCollection(
            @Nullable DbObjectCollection<Value> collection) {
        mBackingCollection = collection;
        return this;
    }

    /**
     * Sets the executor that receives each generation and every page load result.
     * <p>
     * If not set, defaults to the {@link DbTaskQueue#forCurrentThread() queue of the thread}
     * calling {@link #build()}.
     *
     * @param notifyExecutor Executor for delivering lists and pages.
     * @return this
     */
    @Nonnull
    public DbLivePagedListBuilder<Key, Value> setNotifyExecutor(@Nonnull Executor notifyExecutor) {
        mNotifyExecutor = notifyExecutor;
        return this;
    }

    /**
     * Sets executor used for background fetching of DbPagedLists, and the pages within.
     * <p>
     * If not set, defaults to the notify executor.
     *
     * @param fetchExecutor Executor for fetching data from DataSources.
     * @return this
     */
    @SuppressWarnings("unused")
    @Nonnull
    public DbLivePagedListBuilder<Key, Value> setFetchExecutor(@Nonnull Executor fetchExecutor) {
        mFetchExecutor = fetchExecutor;
        return this;
    }

    /**
     * Constructs the {@link DbLivePagedList}.
     * <p>
     * No work (such as loading) is done immediately, the creation of the first DbPagedList is
     * deferred until the first observer arrives.
     *
     * @return The DbLivePagedList of DbPagedLists
     */
    @Nonnull
    public DbLivePagedList<Value> build() {
        Executor notifyExecutor = mNotifyExecutor != null
                ? mNotifyExecutor : DbTaskQueue.forCurrentThread();
        Executor fetchExecutor = mFetchExecutor != null ? mFetchExecutor : notifyExecutor;
        return create(mInitialLoadKey, mConfig, mBoundaryCallback, mBackingCollection,
                mDataSourceFactory, notifyExecutor, fetchExecutor);
    }

    @Nonnull
    private static <Key, Value> DbLivePagedList<Value> create(
            @Nullable final Key initialLoadKey,
            @Nonnull final DbPagedList.Config config,
            @Nullable final DbPagedList.BoundaryCallback<Value> boundaryCallback,
            @Nullable final DbObjectCollection<Value> backingCollection,
            @Nonnull final DbDataSource.Factory<Key, Value> dataSourceFactory,
            @Nonnull final Executor notifyExecutor,
            @Nonnull final Executor fetchExecutor) {
        return new DbLivePagedList<Value>(fetchExecutor, notifyExecutor) {
            @Nullable
            private DbPagedList<Value> mList;
            @Nullable
            private DbDataSource<Key, Value> mDataSource;

            private final DbDataSource.InvalidatedCallback mCallback =
                    new DbDataSource.InvalidatedCallback() {
                        @Override
                        public void onInvalidated() {
                            invalidate();
                        }
                    };

            @SuppressWarnings("unchecked") // for casting getLastKey to Key
            @Nonnull
            @Override
            DbPagedList<Value> compute() {
                @Nullable Key initializeKey = initialLoadKey;
                if (mList != null) {
                    initializeKey = (Key) mList.getLastKey();
                }

                do {
                    if (mDataSource != null) {
                        mDataSource.removeInvalidatedCallback(mCallback);
                    }

                    mDataSource = dataSourceFactory.create();
                    mDataSource.addInvalidatedCallback(mCallback);

                    LOGGER.debug("Building list over {} from key {}", mDataSource, initializeKey);
                    mList = new DbPagedList.Builder<>(backingCollection, mDataSource, config)
                            .setNotifyExecutor(notifyExecutor)
                            .setFetchExecutor(fetchExecutor)
                            .setBoundaryCallback(boundaryCallback)
                            .setInitialKey(initializeKey)
                            .build();
                } while (mList.isDetached());
                return mList;
            }
        };
    }
}
