package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;

import java.util.Collections;
import java.util.List;

class DbPageResult<T> {
    /**
     * Single empty instance to avoid allocations.
     * <p>
     * Note, distinct from {@link #INVALID_RESULT} because {@link #isInvalid()} checks instance.
     */
    @SuppressWarnings("rawtypes")
    private static final DbPageResult EMPTY_RESULT =
            new DbPageResult<>(Collections.emptyList(), 0);

    @SuppressWarnings("rawtypes")
    private static final DbPageResult INVALID_RESULT =
            new DbPageResult<>(Collections.emptyList(), 0);

    @SuppressWarnings("unchecked")
    static <T> DbPageResult<T> getEmptyResult() {
        return EMPTY_RESULT;
    }

    @SuppressWarnings("unchecked")
    static <T> DbPageResult<T> getInvalidResult() {
        return INVALID_RESULT;
    }

    static final int INIT = 0;

    // contiguous results
    static final int APPEND = 1;
    static final int PREPEND = 2;

    static String typeName(int resultType) {
        switch (resultType) {
            case INIT:
                return "INIT";
            case APPEND:
                return "APPEND";
            case PREPEND:
                return "PREPEND";
            default:
                return "UNKNOWN(" + resultType + ")";
        }
    }

    @Nonnull
    public final List<T> page;
    public final int leadingNulls;
    public final int trailingNulls;
    public final int positionOffset;

    /**
     * True if leading / trailing nulls were derived from a total count reported by the source,
     * so that every placeholder stands for an item that really exists.
     */
    public final boolean counted;

    /**
     * True if the source knows nothing can be loaded before the first item of this page.
     */
    public final boolean reachedFront;

    /**
     * True if the source knows nothing can be loaded after the last item of this page.
     */
    public final boolean reachedEnd;

    DbPageResult(@Nonnull List<T> list, int leadingNulls, int trailingNulls, int positionOffset,
                 boolean counted, boolean reachedFront, boolean reachedEnd) {
        this.page = list;
        this.leadingNulls = leadingNulls;
        this.trailingNulls = trailingNulls;
        this.positionOffset = positionOffset;
        this.counted = counted;
        this.reachedFront = reachedFront || list.isEmpty();
        this.reachedEnd = reachedEnd || list.isEmpty();
    }

    DbPageResult(@Nonnull List<T> list, int positionOffset,
                 boolean reachedFront, boolean reachedEnd) {
        this(list, 0, 0, positionOffset, false, reachedFront, reachedEnd);
    }

    DbPageResult(@Nonnull List<T> list, int positionOffset) {
        this(list, 0, 0, positionOffset, false, false, false);
    }

    @Override
    public String toString() {
        return "Result " + leadingNulls
                + ", " + page.size() + " items"
                + ", " + trailingNulls
                + ", offset " + positionOffset
                + (counted ? ", counted" : "")
                + (reachedFront ? ", front" : "")
                + (reachedEnd ? ", end" : "");
    }

    public boolean isInvalid() {
        return this == INVALID_RESULT;
    }

    abstract static class Receiver<T> {
        /**
         * Receives one load result. Called on the controlling thread, except for an initial load
         * that completes synchronously, which arrives on the thread building the list.
         */
        public abstract void onPageResult(int type, @Nonnull DbPageResult<T> pageResult);
    }
}
