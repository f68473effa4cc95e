package com.sumitzway.dbpaging;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.annotation.Nonnull;

/**
 * In-memory collection; changes are announced only when {@link #notifyChanged()} is called,
 * the way a database announces a committed transaction.
 */
class ListObjectCollection<T> extends ArrayList<T> implements DbObjectCollection<T> {
    private final List<ChangeListener<T>> mListeners = new CopyOnWriteArrayList<>();

    ListObjectCollection(Collection<T> initial) {
        super(initial);
    }

    @Override
    public void addChangeListener(@Nonnull ChangeListener<T> listener) {
        mListeners.add(listener);
    }

    @Override
    public void removeChangeListener(@Nonnull ChangeListener<T> listener) {
        mListeners.remove(listener);
    }

    int listenerCount() {
        return mListeners.size();
    }

    void notifyChanged() {
        for (ChangeListener<T> listener : mListeners) {
            listener.onChange(this);
        }
    }
}
