package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;

/**
 * Windowed buffer behind a {@link DbPagedList}.
 * <p>
 * Laid out as {@code [leading nulls][loaded pages][trailing nulls]}. The position offset is only
 * used by sources that do not count their items, where it tracks how far the first loaded item
 * sits from the item that was loaded first.
 * <p>
 * Not thread safe: mutated on the controlling thread only.
 */
final class DbPagedStorage<T> extends AbstractList<T> {

    private int mLeadingNullCount;

    /**
     * List of pages in storage.
     * <p>
     * Every page but the last is {@link #mPageSize} long while the storage is uniform, which lets
     * {@link #get(int)} use direct arithmetic instead of a scan.
     */
    private final ArrayList<List<T>> mPages;
    private int mTrailingNullCount;

    private int mPositionOffset;

    /**
     * Number of loaded items held in {@link #mPages}.
     */
    private int mLoadedCount;

    /**
     * Size of every page except the last, or -1 once page sizes diverge.
     */
    private int mPageSize;

    DbPagedStorage() {
        mLeadingNullCount = 0;
        mPages = new ArrayList<>();
        mTrailingNullCount = 0;
        mPositionOffset = 0;
        mLoadedCount = 0;
        mPageSize = 1;
    }

    private void init(int leadingNulls, @Nonnull List<T> page, int trailingNulls, int positionOffset) {
        mLeadingNullCount = leadingNulls;
        mPages.clear();
        mPages.add(page);
        mTrailingNullCount = trailingNulls;

        mPositionOffset = positionOffset;
        mLoadedCount = page.size();

        // a single page is uniform, whatever the placeholder counts around it
        mPageSize = page.isEmpty() ? -1 : page.size();
    }

    void init(int leadingNulls, @Nonnull List<T> page, int trailingNulls, int positionOffset,
              @Nonnull Callback<T> callback) {
        init(leadingNulls, page, trailingNulls, positionOffset);
        callback.onInitialized(size());
    }

    @Override
    @Nullable
    public T get(int i) {
        if (i < 0 || i >= size()) {
            throw new IndexOutOfBoundsException("Index: " + i + ", Size: " + size());
        }

        // is it definitely outside 'mPages'?
        int localIndex = i - mLeadingNullCount;
        if (localIndex < 0 || localIndex >= mLoadedCount) {
            return null;
        }

        int localPageIndex;
        int pageInternalIndex;

        if (mPageSize > 0) {
            localPageIndex = localIndex / mPageSize;
            pageInternalIndex = localIndex % mPageSize;
        } else {
            // page sizes diverged, scan for the page
            pageInternalIndex = localIndex;
            final int localPageCount = mPages.size();
            for (localPageIndex = 0; localPageIndex < localPageCount; localPageIndex++) {
                int pageSize = mPages.get(localPageIndex).size();
                if (pageSize > pageInternalIndex) {
                    // stop, found the page
                    break;
                }
                pageInternalIndex -= pageSize;
            }
        }

        return mPages.get(localPageIndex).get(pageInternalIndex);
    }

    /**
     * Receives every structural change, on the controlling thread.
     */
    interface Callback<T> {
        void onInitialized(int count);

        void onPagePrepended(int leadingNulls, int changed, int added);

        void onPageAppended(int endPosition, int changed, int added);

        /**
         * {@code droppedPages} are the pages that no longer back any index, in list order.
         */
        void onPagesSwappedToPlaceholder(int startOfDrops, int count,
                                         @Nonnull List<List<T>> droppedPages);
    }

    int getLeadingNullCount() {
        return mLeadingNullCount;
    }

    int getTrailingNullCount() {
        return mTrailingNullCount;
    }

    int getLoadedCount() {
        return mLoadedCount;
    }

    int getPageCount() {
        return mPages.size();
    }

    int getPositionOffset() {
        return mPositionOffset;
    }

    int getMiddleOfLoadedRange() {
        return mLeadingNullCount + mPositionOffset + mLoadedCount / 2;
    }

    @Override
    public int size() {
        return mLeadingNullCount + mLoadedCount + mTrailingNullCount;
    }

    boolean isUniform() {
        return mPageSize > 0;
    }

    // ---------------- Trimming API -------------------
    // Trimming is always done at the beginning or end of the list. Dropped pages become
    // placeholders, so size() is unchanged by a trim.

    private boolean needsTrim(int maxSize, int requiredRemaining, int localPageIndex) {
        List<T> page = mPages.get(localPageIndex);
        return mLoadedCount > maxSize
                && mPages.size() > 2
                && mLoadedCount - page.size() >= requiredRemaining;
    }

    boolean needsTrimFromFront(int maxSize, int requiredRemaining) {
        return needsTrim(maxSize, requiredRemaining, 0);
    }

    boolean needsTrimFromEnd(int maxSize, int requiredRemaining) {
        return needsTrim(maxSize, requiredRemaining, mPages.size() - 1);
    }

    /**
     * True if a page of {@code countToBeAdded} items should be dropped on arrival instead of
     * stored, because storing it would immediately force a trim on the opposite side.
     */
    boolean shouldPreTrimNewPage(int maxSize, int requiredRemaining, int countToBeAdded) {
        return mLoadedCount + countToBeAdded > maxSize
                && mPages.size() > 1
                && mLoadedCount >= requiredRemaining;
    }

    boolean trimFromFront(int maxSize, int requiredRemaining, @Nonnull Callback<T> callback) {
        int totalRemoved = 0;
        List<List<T>> dropped = new ArrayList<>();
        while (needsTrimFromFront(maxSize, requiredRemaining)) {
            List<T> page = mPages.remove(0);
            dropped.add(page);
            totalRemoved += page.size();
            mLoadedCount -= page.size();
        }
        if (totalRemoved > 0) {
            int previousLeadingNulls = mLeadingNullCount;
            mLeadingNullCount += totalRemoved;
            callback.onPagesSwappedToPlaceholder(previousLeadingNulls, totalRemoved, dropped);
        }
        return totalRemoved > 0;
    }

    boolean trimFromEnd(int maxSize, int requiredRemaining, @Nonnull Callback<T> callback) {
        int totalRemoved = 0;
        List<List<T>> dropped = new ArrayList<>();
        while (needsTrimFromEnd(maxSize, requiredRemaining)) {
            List<T> page = mPages.remove(mPages.size() - 1);
            dropped.add(0, page);
            totalRemoved += page.size();
            mLoadedCount -= page.size();
        }
        if (totalRemoved > 0) {
            int newEndPosition = mLeadingNullCount + mLoadedCount;
            mTrailingNullCount += totalRemoved;
            callback.onPagesSwappedToPlaceholder(newEndPosition, totalRemoved, dropped);
        }
        return totalRemoved > 0;
    }

    // ---------------- Contiguous API -------------------

    T getFirstLoadedItem() {
        // safe to access first page's first item here:
        // If storage is contiguous, pages can't be empty
        return mPages.get(0).get(0);
    }

    T getLastLoadedItem() {
        // safe to access last page's last item here:
        // If storage is contiguous, pages can't be empty
        List<T> page = mPages.get(mPages.size() - 1);
        return page.get(page.size() - 1);
    }

    void prependPage(@Nonnull List<T> page, @Nonnull Callback<T> callback) {
        final int count = page.size();
        if (count == 0) {
            return;
        }
        if (mPageSize > 0 && count != mPageSize) {
            if (mPages.size() == 1 && count > mPageSize) {
                // prepending to a single item - update current page size to that of 'inner' page
                mPageSize = count;
            } else {
                // no longer uniform
                mPageSize = -1;
            }
        }

        mPages.add(0, page);
        mLoadedCount += count;

        final int changedCount = Math.min(mLeadingNullCount, count);
        final int addedCount = count - changedCount;

        if (changedCount != 0) {
            mLeadingNullCount -= changedCount;
        }
        mPositionOffset -= addedCount;

        callback.onPagePrepended(mLeadingNullCount, changedCount, addedCount);
    }

    void appendPage(@Nonnull List<T> page, @Nonnull Callback<T> callback) {
        final int count = page.size();
        if (count == 0) {
            return;
        }

        if (mPageSize > 0) {
            // if the previous page was smaller than mPageSize,
            // or if this page is larger than the previous, page sizes diverged
            if (mPages.get(mPages.size() - 1).size() != mPageSize
                    || count > mPageSize) {
                mPageSize = -1;
            }
        }

        mPages.add(page);
        mLoadedCount += count;

        final int changedCount = Math.min(mTrailingNullCount, count);
        final int addedCount = count - changedCount;

        if (changedCount != 0) {
            mTrailingNullCount -= changedCount;
        }
        callback.onPageAppended(mLeadingNullCount + mLoadedCount - count,
                changedCount, addedCount);
    }

    @Override
    public String toString() {
        StringBuilder ret = new StringBuilder("leading " + mLeadingNullCount
                + ", loaded " + mLoadedCount
                + ", trailing " + getTrailingNullCount());

        for (int i = 0; i < mPages.size(); i++) {
            ret.append(" ").append(mPages.get(i));
        }
        return ret.toString();
    }
}
