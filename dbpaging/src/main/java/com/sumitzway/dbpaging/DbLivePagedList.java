package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Observable holder of the current generation of a {@link DbPagedList}.
 * <p>
 * Nothing is loaded until the first observer arrives. The first generation is then computed on
 * the fetch executor, and a new one every time the data source of the current generation is
 * invalidated. Observers receive every generation on the notify executor.
 * <p>
 * Created with a {@link DbLivePagedListBuilder}.
 *
 * @param <Value> Type of items in the lists.
 */
public abstract class DbLivePagedList<Value> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbLivePagedList.class);

    private final Executor mFetchExecutor;
    private final Executor mNotifyExecutor;

    private final CopyOnWriteArrayList<Consumer<DbPagedList<Value>>> mObservers =
            new CopyOnWriteArrayList<>();

    @SuppressWarnings("WeakerAccess") /* synthetic access */
    final AtomicBoolean mInvalid = new AtomicBoolean(true);
    @SuppressWarnings("WeakerAccess") /* synthetic access */
    final AtomicBoolean mComputing = new AtomicBoolean(false);
    private final AtomicBoolean mActive = new AtomicBoolean(false);

    @Nullable
    private volatile DbPagedList<Value> mValue;

    private int mGeneration = 0;

    DbLivePagedList(@Nonnull Executor fetchExecutor, @Nonnull Executor notifyExecutor) {
        mFetchExecutor = fetchExecutor;
        mNotifyExecutor = notifyExecutor;
    }

    @SuppressWarnings("WeakerAccess") /* synthetic access */
    final Runnable mRefreshRunnable = new Runnable() {
        @Override
        public void run() {
            boolean computed;
            do {
                computed = false;
                // compute can happen only in 1 thread but no reason to lock others.
                if (mComputing.compareAndSet(false, true)) {
                    // as long as it is invalid, keep computing.
                    try {
                        DbPagedList<Value> value = null;
                        while (mInvalid.compareAndSet(true, false)) {
                            computed = true;
                            value = compute();
                        }
                        if (computed) {
                            postValue(value);
                        }
                    } finally {
                        // release compute lock
                        mComputing.set(false);
                    }
                }
                // check invalid after releasing compute lock to avoid the following scenario.
                // Thread A runs compute()
                // Thread A checks invalid, it is false
                // Main thread sets invalid to true
                // Thread B runs, fails to acquire compute lock and skips
                // Thread A releases compute lock
                // We've left invalid in set state. The check below recovers.
            } while (computed && mInvalid.get());
        }
    };

    /**
     * Builds the next generation. Called on the fetch executor.
     */
    @Nonnull
    abstract DbPagedList<Value> compute();

    /**
     * Marks the current generation stale, and schedules a new one if anyone is observing.
     */
    public void invalidate() {
        if (mInvalid.compareAndSet(false, true) && mActive.get()) {
            mFetchExecutor.execute(mRefreshRunnable);
        }
    }

    /**
     * Starts delivering generations to {@code observer}, beginning with the current one if it
     * exists. The first observer triggers the first computation.
     */
    public void observe(@Nonnull final Consumer<DbPagedList<Value>> observer) {
        mObservers.add(observer);
        if (mActive.compareAndSet(false, true)) {
            mFetchExecutor.execute(mRefreshRunnable);
        } else {
            final DbPagedList<Value> current = mValue;
            if (current != null) {
                mNotifyExecutor.execute(new Runnable() {
                    @Override
                    public void run() {
                        observer.accept(current);
                    }
                });
            }
        }
    }

    public void removeObserver(@Nonnull Consumer<DbPagedList<Value>> observer) {
        mObservers.remove(observer);
    }

    /**
     * @return The latest generation delivered to observers, or null before the first one.
     */
    @Nullable
    public DbPagedList<Value> getValue() {
        return mValue;
    }

    private void postValue(final DbPagedList<Value> value) {
        mNotifyExecutor.execute(new Runnable() {
            @Override
            public void run() {
                mGeneration++;
                LOGGER.debug("Publishing generation {}: {} items", mGeneration, value.size());
                mValue = value;
                for (Consumer<DbPagedList<Value>> observer : mObservers) {
                    observer.accept(value);
                }
            }
        });
    }
}
