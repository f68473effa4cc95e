package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;

import java.util.List;

/**
 * Ordered, indexable result collection of an embedded object database query.
 * <p>
 * Reads are synchronous. Implementations that reflect later writes notify their
 * {@link ChangeListener}s after every change; a paged list built over such a collection
 * invalidates its data source when that happens, so that a fresh snapshot gets loaded.
 *
 * @param <T> Type of the stored objects.
 */
public interface DbObjectCollection<T> extends List<T> {

    /**
     * Notified after the contents of a collection changed.
     *
     * @param <T> Type of the stored objects.
     */
    interface ChangeListener<T> {
        void onChange(@Nonnull DbObjectCollection<T> collection);
    }

    void addChangeListener(@Nonnull ChangeListener<T> listener);

    void removeChangeListener(@Nonnull ChangeListener<T> listener);
}
