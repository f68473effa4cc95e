package com.sumitzway.dbpaging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;


/**
 * Base class for loading pages of snapshot data into a {@link DbPagedList}.
 * <p>
 * A DbDataSource is a snapshot of one query over the embedded database. When the data behind
 * that query changes, the DbDataSource must be {@link #invalidate() invalidated}, and a new one
 * created (typically through a {@link Factory}) to back a replacement {@link DbPagedList}.
 * <p>
 * Three loading strategies are provided:
 * <ul>
 * <li>{@link DbPositionalDataSource} for data addressed by absolute position, supporting
 * jumps to an arbitrary offset.</li>
 * <li>{@link DbPageKeyedDataSource} for data where each page hands out the keys of its
 * neighbouring pages.</li>
 * <li>{@link DbItemKeyedDataSource} for data where the key of the next page is derived from the
 * item at the edge of what's loaded.</li>
 * </ul>
 *
 * @param <Key>   Key identifying items in DbDataSource.
 * @param <Value> Type of items in the list loaded by the DbDataSource.
 */
@SuppressWarnings("unused") // suppress warning to remove Key/Value, needed for subclass type safety
public abstract class DbDataSource<Key, Value> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbDataSource.class);

    /**
     * Factory for DataSources.
     * <p>
     * A regenerating list ({@link DbLivePagedListBuilder}) asks its factory for a fresh
     * DbDataSource every time the previous one is invalidated.
     *
     * @param <Key>   Key identifying items in DbDataSource.
     * @param <Value> Type of items in the list loaded by the DataSources.
     */
    public abstract static class Factory<Key, Value> {

        @Nonnull
        public abstract DbDataSource<Key, Value> create();

        /**
         * Applies the given function to each value emitted by DataSources produced by this Factory.
         *
         * @param function  Function that runs on each loaded item.
         * @param <ToValue> Type of items produced by the new DbDataSource.
         * @return A new DbDataSource.Factory, which transforms items using the given function.
         * @see #mapByPage(Function)
         */
        @Nonnull
        public <ToValue> DbDataSource.Factory<Key, ToValue> map(
                @Nonnull Function<Value, ToValue> function) {
            return mapByPage(createListFunction(function));
        }

        /**
         * Applies the given function to each page emitted by DataSources produced by this Factory.
         *
         * @param function  Function that runs on each loaded page, must not change its size.
         * @param <ToValue> Type of items produced by the new DbDataSource.
         * @return A new DbDataSource.Factory, which transforms pages using the given function.
         * @see #map(Function)
         */
        @Nonnull
        public <ToValue> DbDataSource.Factory<Key, ToValue> mapByPage(
                @Nonnull final Function<List<Value>, List<ToValue>> function) {
            return new DbDataSource.Factory<Key, ToValue>() {
                @Nonnull
                @Override
                public DbDataSource<Key, ToValue> create() {
                    return DbDataSource.Factory.this.create().mapByPage(function);
                }
            };
        }
    }

    @Nonnull
    static <X, Y> Function<List<X>, List<Y>> createListFunction(
            final @Nonnull Function<X, Y> innerFunc) {
        return new Function<List<X>, List<Y>>() {
            @Override
            public List<Y> apply(@Nonnull List<X> source) {
                List<Y> out = new ArrayList<>(source.size());
                for (int i = 0; i < source.size(); i++) {
                    out.add(innerFunc.apply(source.get(i)));
                }
                return out;
            }
        };
    }

    static <A, B> List<B> convert(Function<List<A>, List<B>> function, List<A> source) {
        List<B> dest = function.apply(source);
        if (dest.size() != source.size()) {
            throw new IllegalStateException("Invalid Function " + function
                    + " changed return size. This is not supported.");
        }
        return dest;
    }

    private final Invalidation mInvalidation;

    // Since we rely on implementation details of the three variants,
    // prevent external subclassing, except through exposed subclasses
    DbDataSource() {
        mInvalidation = new Invalidation();
    }

    /**
     * Creates a source that shares its invalidation state with {@code source}: invalidating
     * either one invalidates both, and callbacks registered on either are notified.
     */
    DbDataSource(@Nonnull DbDataSource<?, ?> source) {
        mInvalidation = source.mInvalidation;
    }

    /**
     * Applies the given function to each page emitted by the DbDataSource.
     *
     * @param function  Function that runs on each loaded page, must not change its size.
     * @param <ToValue> Type of items produced by the new DbDataSource.
     * @return A new DbDataSource, which transforms pages using the given function.
     */
    @Nonnull
    public abstract <ToValue> DbDataSource<Key, ToValue> mapByPage(
            @Nonnull Function<List<Value>, List<ToValue>> function);

    /**
     * Applies the given function to each value emitted by the DbDataSource.
     *
     * @param function  Function that runs on each loaded item.
     * @param <ToValue> Type of items produced by the new DbDataSource.
     * @return A new DbDataSource, which transforms items using the given function.
     */
    @Nonnull
    public abstract <ToValue> DbDataSource<Key, ToValue> map(
            @Nonnull Function<Value, ToValue> function);

    /**
     * One-shot result channel shared by every load callback implementation.
     * <p>
     * Delivers inline until a post executor is set, then hands results to that executor.
     */
    static class LoadCallbackHelper<T> {
        static void validateInitialLoadParams(@Nonnull List<?> data, int position, int totalCount) {
            if (position < 0) {
                throw new IllegalArgumentException("Position must be non-negative");
            }
            if (data.size() + position > totalCount) {
                throw new IllegalArgumentException(
                        "List size + position too large, last item in list beyond totalCount.");
            }
            if (data.size() == 0 && totalCount > 0) {
                throw new IllegalArgumentException(
                        "Initial result cannot be empty if items are present in data set.");
            }
        }

        final int mResultType;
        private final DbDataSource<?, ?> mDataSource;
        final DbPageResult.Receiver<T> mReceiver;

        private final Object mSignalLock = new Object();
        @GuardedBy("mSignalLock")
        private Executor mPostExecutor;
        @GuardedBy("mSignalLock")
        private boolean mHasSignalled = false;

        LoadCallbackHelper(@Nonnull DbDataSource<?, ?> dataSource, int resultType,
                           @Nullable Executor mainThreadExecutor,
                           @Nonnull DbPageResult.Receiver<T> receiver) {
            mDataSource = dataSource;
            mResultType = resultType;
            mPostExecutor = mainThreadExecutor;
            mReceiver = receiver;
        }

        void setPostExecutor(Executor postExecutor) {
            synchronized (mSignalLock) {
                mPostExecutor = postExecutor;
            }
        }

        /**
         * Call before verifying args, or dispatching actual results.
         *
         * @return true if DbDataSource was invalid, and invalid result dispatched
         */
        boolean dispatchInvalidResultIfInvalid() {
            if (mDataSource.isInvalid()) {
                dispatchResultToReceiver(DbPageResult.<T>getInvalidResult());
                return true;
            }
            return false;
        }

        void dispatchResultToReceiver(final @Nonnull DbPageResult<T> result) {
            Executor executor;
            synchronized (mSignalLock) {
                if (mHasSignalled) {
                    throw new IllegalStateException(
                            "callback.onResult already called, cannot call again.");
                }
                mHasSignalled = true;
                executor = mPostExecutor;
            }

            if (executor != null) {
                executor.execute(new Runnable() {
                    @Override
                    public void run() {
                        mReceiver.onPageResult(mResultType, result);
                    }
                });
            } else {
                mReceiver.onPageResult(mResultType, result);
            }
        }
    }

    /**
     * Invalidation callback for DbDataSource.
     * <p>
     * Used to signal when a DbDataSource has become invalid, and that a new data source
     * is needed to continue loading data.
     */
    public interface InvalidatedCallback {
        /**
         * Called when the data backing the list has become invalid.
         * <p>
         * This callback will be invoked on the thread that calls {@link #invalidate()}. It is valid
         * for the data source to invalidate itself during its load methods, or for an outside
         * source to invalidate it.
         */
        void onInvalidated();
    }

    private static final class Invalidation {
        final AtomicBoolean mInvalid = new AtomicBoolean(false);

        final CopyOnWriteArrayList<InvalidatedCallback> mCallbacks = new CopyOnWriteArrayList<>();
    }

    /**
     * Add a callback to invoke when the DbDataSource is first invalidated.
     * <p>
     * Once invalidated, a data source will not become valid again.
     *
     * @param onInvalidatedCallback The callback, will be invoked on thread that
     *                              {@link #invalidate()} is called on.
     */
    public void addInvalidatedCallback(@Nonnull DbDataSource.InvalidatedCallback onInvalidatedCallback) {
        mInvalidation.mCallbacks.add(onInvalidatedCallback);
    }

    /**
     * Remove a previously added invalidate callback.
     *
     * @param onInvalidatedCallback The previously added callback.
     */
    public void removeInvalidatedCallback(@Nonnull DbDataSource.InvalidatedCallback onInvalidatedCallback) {
        mInvalidation.mCallbacks.remove(onInvalidatedCallback);
    }

    /**
     * Signal the data source to stop loading, and notify its callbacks.
     * <p>
     * If invalidate has already been called, this method does nothing.
     */
    public void invalidate() {
        if (mInvalidation.mInvalid.compareAndSet(false, true)) {
            LOGGER.debug("Invalidated {}", this);
            for (DbDataSource.InvalidatedCallback callback : mInvalidation.mCallbacks) {
                callback.onInvalidated();
            }
        }
    }

    /**
     * Returns true if the data source is invalid, and can no longer be queried for data.
     *
     * @return True if the data source is invalid, and can no longer return data.
     */
    public boolean isInvalid() {
        return mInvalidation.mInvalid.get();
    }
}
