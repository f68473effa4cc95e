package com.sumitzway.dbpaging;

import java.util.ArrayList;
import java.util.List;

final class TestData {
    private TestData() {
    }

    static List<Integer> range(int fromInclusive, int toExclusive) {
        List<Integer> out = new ArrayList<>();
        for (int i = fromInclusive; i < toExclusive; i++) {
            out.add(i);
        }
        return out;
    }

    static DbPagedList.Config config(int pageSize, int prefetchDistance, int initialLoadSizeHint) {
        return new DbPagedList.Config.Builder()
                .setPageSize(pageSize)
                .setPrefetchDistance(prefetchDistance)
                .setInitialLoadSizeHint(initialLoadSizeHint)
                .build();
    }

    static <T> int placeholderSum(DbPagedList<T> list) {
        DbPagedStorage<T> storage = list.mStorage;
        return storage.getLeadingNullCount() + storage.getLoadedCount()
                + storage.getTrailingNullCount();
    }
}
