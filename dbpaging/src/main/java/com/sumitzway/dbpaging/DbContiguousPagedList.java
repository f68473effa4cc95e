package com.sumitzway.dbpaging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;

class DbContiguousPagedList<K, V> extends DbPagedList<V> implements DbPagedStorage.Callback<V> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbContiguousPagedList.class);

    @SuppressWarnings("WeakerAccess") /* synthetic access */
    final DbContiguousDataSource<K, V> mDataSource;

    static final int READY_TO_FETCH = 0;
    static final int FETCHING = 1;
    static final int DONE_FETCHING = 2;

    @SuppressWarnings("WeakerAccess") /* synthetic access */
            int mPrependWorkerState = READY_TO_FETCH;
    @SuppressWarnings("WeakerAccess") /* synthetic access */
            int mAppendWorkerState = READY_TO_FETCH;

    @SuppressWarnings("WeakerAccess") /* synthetic access */
            int mPrependItemsRequested = 0;
    @SuppressWarnings("WeakerAccess") /* synthetic access */
            int mAppendItemsRequested = 0;

    /**
     * Set once the initial load reported a total count: every placeholder then stands for an item
     * that exists, so consuming the last placeholder on a side means that side is complete.
     */
    @SuppressWarnings("WeakerAccess") /* synthetic access */
            boolean mCounted = false;

    @SuppressWarnings("WeakerAccess") /* synthetic access */
    final boolean mShouldTrim;

    @SuppressWarnings("WeakerAccess") /* synthetic access */
            DbPageResult.Receiver<V> mReceiver = new DbPageResult.Receiver<V>() {
        // Creation thread for initial synchronous load, otherwise controlling thread
        // Safe to access controlling thread only state - no other thread has reference during construction
        @Override
        public void onPageResult(int resultType, @Nonnull DbPageResult<V> pageResult) {
            if (pageResult.isInvalid() || mDataSource.isInvalid()) {
                LOGGER.debug("Discarding {} result of invalidated {}",
                        DbPageResult.typeName(resultType), mDataSource);
                detach();
                return;
            }

            List<V> page = pageResult.page;
            boolean deferBegin = false;
            boolean deferEnd = false;
            if (resultType == DbPageResult.INIT) {
                mCounted = pageResult.counted;
                if (pageResult.reachedFront) {
                    mPrependWorkerState = DONE_FETCHING;
                }
                if (pageResult.reachedEnd) {
                    mAppendWorkerState = DONE_FETCHING;
                }
                mStorage.init(pageResult.leadingNulls, page, pageResult.trailingNulls,
                        pageResult.positionOffset, DbContiguousPagedList.this);
                if (mLastLoad == LAST_LOAD_UNSPECIFIED) {
                    // Because the DbContiguousPagedList wasn't initialized with a last load position,
                    // initialize it to the middle of the initial load
                    mLastLoad =
                            pageResult.leadingNulls + pageResult.positionOffset + page.size() / 2;
                }
                deferBegin = pageResult.reachedFront;
                deferEnd = pageResult.reachedEnd;
                LOGGER.debug("Initialized with {}", pageResult);
            } else {
                // if we end up trimming, we trim from side that's furthest from most recent access
                boolean trimFromFront = mLastLoad > mStorage.getMiddleOfLoadedRange();

                // is the new page big enough to warrant pre-trimming (i.e. dropping) it?
                boolean skipNewPage = mShouldTrim
                        && mStorage.shouldPreTrimNewPage(
                        mConfig.maxSize, mRequiredRemainder, page.size());

                if (resultType == DbPageResult.APPEND) {
                    boolean reachedEnd = pageResult.reachedEnd
                            || (mCounted && mStorage.getTrailingNullCount() <= page.size());
                    if (skipNewPage && !trimFromFront) {
                        // don't append this data, drop it
                        LOGGER.debug("Dropping appended page of {} items", page.size());
                        mDataSource.onPagesDropped(Collections.singletonList(page));
                        mAppendItemsRequested = 0;
                        mAppendWorkerState = READY_TO_FETCH;
                    } else {
                        if (reachedEnd) {
                            mAppendWorkerState = DONE_FETCHING;
                        }
                        mStorage.appendPage(page, DbContiguousPagedList.this);
                        deferEnd = reachedEnd;
                    }
                } else if (resultType == DbPageResult.PREPEND) {
                    boolean reachedFront = pageResult.reachedFront
                            || (mCounted && mStorage.getLeadingNullCount() <= page.size());
                    if (skipNewPage && trimFromFront) {
                        // don't prepend this data, drop it
                        LOGGER.debug("Dropping prepended page of {} items", page.size());
                        mDataSource.onPagesDropped(Collections.singletonList(page));
                        mPrependItemsRequested = 0;
                        mPrependWorkerState = READY_TO_FETCH;
                    } else {
                        if (reachedFront) {
                            mPrependWorkerState = DONE_FETCHING;
                        }
                        mStorage.prependPage(page, DbContiguousPagedList.this);
                        deferBegin = reachedFront;
                    }
                } else {
                    throw new IllegalArgumentException("unexpected resultType " + resultType);
                }

                if (mShouldTrim) {
                    if (trimFromFront) {
                        if (mPrependWorkerState != FETCHING) {
                            if (mStorage.trimFromFront(
                                    mConfig.maxSize,
                                    mRequiredRemainder,
                                    DbContiguousPagedList.this)) {
                                // trimmed from front, ensure we can fetch in that dir
                                mPrependWorkerState = READY_TO_FETCH;
                                cancelDeferredBoundaryCallback(true);
                                deferBegin = false;
                            }
                        }
                    } else {
                        if (mAppendWorkerState != FETCHING) {
                            if (mStorage.trimFromEnd(
                                    mConfig.maxSize,
                                    mRequiredRemainder,
                                    DbContiguousPagedList.this)) {
                                mAppendWorkerState = READY_TO_FETCH;
                                cancelDeferredBoundaryCallback(false);
                                deferEnd = false;
                            }
                        }
                    }
                }
            }

            if (mBoundaryCallback != null) {
                boolean deferEmpty = resultType == DbPageResult.INIT && page.isEmpty();
                deferBoundaryCallbacks(deferEmpty,
                        !deferEmpty && deferBegin,
                        !deferEmpty && deferEnd);
            }
        }
    };

    static final int LAST_LOAD_UNSPECIFIED = -1;

    DbContiguousPagedList(
            @Nonnull DbContiguousDataSource<K, V> dataSource,
            @Nonnull Executor mainThreadExecutor,
            @Nonnull Executor backgroundThreadExecutor,
            @Nullable BoundaryCallback<V> boundaryCallback,
            @Nonnull Config config,
            final @Nullable K key,
            int lastLoad) {
        super(new DbPagedStorage<V>(), mainThreadExecutor, backgroundThreadExecutor,
                boundaryCallback, config);
        mDataSource = dataSource;
        mLastLoad = lastLoad;
        mShouldTrim = mDataSource.supportsPageDropping()
                && mConfig.maxSize != Config.MAX_SIZE_UNBOUNDED;

        if (mDataSource.isInvalid()) {
            detach();
        } else {
            LOGGER.debug("Loading initial {} items around {} with {}",
                    mConfig.initialLoadSizeHint, key, mConfig);
            mDataSource.dispatchLoadInitial(key,
                    mConfig.initialLoadSizeHint,
                    mConfig.pageSize,
                    mMainThreadExecutor,
                    mReceiver);
        }
    }

    static int getPrependItemsRequested(int prefetchDistance, int index, int leadingNulls) {
        return prefetchDistance - (index - leadingNulls);
    }

    static int getAppendItemsRequested(
            int prefetchDistance, int index, int itemsBeforeTrailingNulls) {
        return index + prefetchDistance + 1 - itemsBeforeTrailingNulls;
    }

    @Override
    void loadAroundInternal(int index) {
        int prependItems = getPrependItemsRequested(mConfig.prefetchDistance, index,
                mStorage.getLeadingNullCount());
        int appendItems = getAppendItemsRequested(mConfig.prefetchDistance, index,
                mStorage.getLeadingNullCount() + mStorage.getLoadedCount());

        mPrependItemsRequested = Math.max(prependItems, mPrependItemsRequested);
        if (mPrependItemsRequested > 0) {
            schedulePrepend();
        }

        mAppendItemsRequested = Math.max(appendItems, mAppendItemsRequested);
        if (mAppendItemsRequested > 0) {
            scheduleAppend();
        }
    }

    private void schedulePrepend() {
        if (mPrependWorkerState != READY_TO_FETCH || isDetached()) {
            return;
        }
        mPrependWorkerState = FETCHING;

        final int position = mStorage.getLeadingNullCount() + mStorage.getPositionOffset();
        final int loadedCount = mStorage.getLoadedCount();

        // safe to access first item here - mStorage can't be empty if we're prepending
        final V item = mStorage.getFirstLoadedItem();
        LOGGER.debug("Scheduling prepend before position {}, {} items requested",
                position, mPrependItemsRequested);
        mBackgroundThreadExecutor.execute(new Runnable() {
            @Override
            public void run() {
                if (isDetached()) {
                    return;
                }
                if (mDataSource.isInvalid()) {
                    detach();
                } else {
                    mDataSource.dispatchLoadBefore(position, loadedCount, item, mConfig.pageSize,
                            mMainThreadExecutor, mReceiver);
                }
            }
        });
    }

    private void scheduleAppend() {
        if (mAppendWorkerState != READY_TO_FETCH || isDetached()) {
            return;
        }
        mAppendWorkerState = FETCHING;

        final int position = mStorage.getLeadingNullCount()
                + mStorage.getLoadedCount() - 1 + mStorage.getPositionOffset();
        final int loadedCount = mStorage.getLoadedCount();

        // safe to access last item here - mStorage can't be empty if we're appending
        final V item = mStorage.getLastLoadedItem();
        LOGGER.debug("Scheduling append after position {}, {} items requested",
                position, mAppendItemsRequested);
        mBackgroundThreadExecutor.execute(new Runnable() {
            @Override
            public void run() {
                if (isDetached()) {
                    return;
                }
                if (mDataSource.isInvalid()) {
                    detach();
                } else {
                    mDataSource.dispatchLoadAfter(position, loadedCount, item, mConfig.pageSize,
                            mMainThreadExecutor, mReceiver);
                }
            }
        });
    }

    @Nonnull
    @Override
    public DbDataSource<?, V> getDataSource() {
        return mDataSource;
    }

    @Nullable
    @Override
    public Object getLastKey() {
        return mDataSource.getKey(mLastLoad, mLastItem);
    }

    @Override
    public void onInitialized(int count) {
        notifyInserted(0, count);
    }

    @Override
    public void onPagePrepended(int leadingNulls, int changedCount, int addedCount) {
        // consider whether to post more work, now that a page is fully prepended
        mPrependItemsRequested = mPrependItemsRequested - changedCount - addedCount;
        if (mPrependWorkerState != DONE_FETCHING) {
            mPrependWorkerState = READY_TO_FETCH;
            if (mPrependItemsRequested > 0) {
                // not done prepending, keep going
                schedulePrepend();
            }
        }

        // finally dispatch callbacks, after prepend may have already been scheduled
        notifyChanged(leadingNulls, changedCount);
        notifyInserted(0, addedCount);

        offsetAccessIndices(addedCount);
    }

    @Override
    public void onPageAppended(int endPosition, int changedCount, int addedCount) {
        // consider whether to post more work, now that a page is fully appended
        mAppendItemsRequested = mAppendItemsRequested - changedCount - addedCount;
        if (mAppendWorkerState != DONE_FETCHING) {
            mAppendWorkerState = READY_TO_FETCH;
            if (mAppendItemsRequested > 0) {
                // not done appending, keep going
                scheduleAppend();
            }
        }

        // finally dispatch callbacks, after append may have already been scheduled
        notifyChanged(endPosition, changedCount);
        notifyInserted(endPosition + changedCount, addedCount);
    }

    @Override
    public void onPagesSwappedToPlaceholder(int startOfDrops, int count,
                                            @Nonnull List<List<V>> droppedPages) {
        LOGGER.debug("Dropped {} items at {} to placeholders", count, startOfDrops);
        if (mLastItem != null && containsItem(droppedPages, mLastItem)) {
            // keep the last item among loaded ones, so that getLastKey() can still resolve it
            mLastItem = startOfDrops < mStorage.getLeadingNullCount()
                    ? mStorage.getFirstLoadedItem() : mStorage.getLastLoadedItem();
        }
        mDataSource.onPagesDropped(droppedPages);
        notifyChanged(startOfDrops, count);
    }

    private static <T> boolean containsItem(@Nonnull List<List<T>> pages, @Nonnull T item) {
        for (List<T> page : pages) {
            for (T candidate : page) {
                if (candidate == item) {
                    return true;
                }
            }
        }
        return false;
    }
}
