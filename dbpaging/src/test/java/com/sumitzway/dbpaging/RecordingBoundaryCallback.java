package com.sumitzway.dbpaging;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

class RecordingBoundaryCallback<T> extends DbPagedList.BoundaryCallback<T> {
    int zeroItemsLoaded = 0;
    final List<T> front = new ArrayList<>();
    final List<T> end = new ArrayList<>();

    @Override
    public void onZeroItemsLoaded() {
        zeroItemsLoaded++;
    }

    @Override
    public void onItemAtFrontLoaded(@Nonnull T itemAtFront) {
        front.add(itemAtFront);
    }

    @Override
    public void onItemAtEndLoaded(@Nonnull T itemAtEnd) {
        end.add(itemAtEnd);
    }
}
