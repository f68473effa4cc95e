package com.sumitzway.dbpaging;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.util.List;
import java.util.concurrent.Executor;

abstract class DbContiguousDataSource<Key, Value> extends DbDataSource<Key, Value> {

    DbContiguousDataSource() {
    }

    DbContiguousDataSource(@Nonnull DbDataSource<?, ?> source) {
        super(source);
    }

    abstract void dispatchLoadInitial(
            @Nullable Key key,
            int initialLoadSize,
            int pageSize,
            @Nonnull Executor mainThreadExecutor,
            @Nonnull DbPageResult.Receiver<Value> receiver);

    abstract void dispatchLoadAfter(
            int currentEndIndex,
            int currentLoadedCount,
            @Nonnull Value currentEndItem,
            int pageSize,
            @Nonnull Executor mainThreadExecutor,
            @Nonnull DbPageResult.Receiver<Value> receiver);

    abstract void dispatchLoadBefore(
            int currentBeginIndex,
            int currentLoadedCount,
            @Nonnull Value currentBeginItem,
            int pageSize,
            @Nonnull Executor mainThreadExecutor,
            @Nonnull DbPageResult.Receiver<Value> receiver);

    /**
     * Get the key from either the position, or item, or null if position/item invalid.
     * <p>
     * Position may not match passed item's position - if trying to query the key from a position
     * that isn't yet loaded, a fallback item (last loaded item accessed) will be passed.
     */
    @Nullable
    abstract Key getKey(int position, @Nullable Value item);

    boolean supportsPageDropping() {
        return true;
    }

    /**
     * Called on the controlling thread for pages the list no longer holds: pages trimmed to
     * placeholders, and pages dropped on arrival.
     */
    void onPagesDropped(@Nonnull List<List<Value>> pages) {
    }
}
