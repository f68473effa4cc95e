package com.sumitzway.dbpaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DbPagedListConfigTest {
    @Test
    void appliesDefaultsFromPageSize() {
        DbPagedList.Config config = new DbPagedList.Config.Builder().setPageSize(20).build();
        assertEquals(20, config.pageSize);
        assertEquals(20, config.prefetchDistance);
        assertEquals(60, config.initialLoadSizeHint);
        assertEquals(DbPagedList.Config.MAX_SIZE_UNBOUNDED, config.maxSize);
        assertTrue(config.initialLoadSizeHint >= config.pageSize);
    }

    @Test
    void keepsExplicitValues() {
        DbPagedList.Config config = new DbPagedList.Config.Builder()
                .setPageSize(10)
                .setPrefetchDistance(0)
                .setInitialLoadSizeHint(15)
                .setMaxSize(30)
                .build();
        assertEquals(10, config.pageSize);
        assertEquals(0, config.prefetchDistance);
        assertEquals(15, config.initialLoadSizeHint);
        assertEquals(30, config.maxSize);
    }

    @Test
    void requiresPageSize() {
        assertThrows(IllegalArgumentException.class, () -> new DbPagedList.Config.Builder().build());
    }

    @Test
    void rejectsInvalidValues() {
        DbPagedList.Config.Builder builder = new DbPagedList.Config.Builder();
        assertThrows(IllegalArgumentException.class, () -> builder.setPageSize(0));
        assertThrows(IllegalArgumentException.class, () -> builder.setPrefetchDistance(-1));
        assertThrows(IllegalArgumentException.class, () -> builder.setInitialLoadSizeHint(0));
    }

    @Test
    void rejectsMaxSizeSmallerThanPrefetchWindow() {
        DbPagedList.Config.Builder builder = new DbPagedList.Config.Builder()
                .setPageSize(10)
                .setPrefetchDistance(10)
                .setMaxSize(29);
        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
