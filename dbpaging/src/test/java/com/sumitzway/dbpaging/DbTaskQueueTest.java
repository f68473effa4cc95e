package com.sumitzway.dbpaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class DbTaskQueueTest {
    @Test
    void drainsInPostingOrderIncludingNestedTasks() {
        final DbTaskQueue queue = new DbTaskQueue();
        final List<String> ran = new ArrayList<>();
        queue.execute(() -> {
            ran.add("a");
            queue.execute(() -> ran.add("c"));
        });
        queue.execute(() -> ran.add("b"));
        assertEquals(2, queue.size());

        assertEquals(3, queue.drain());
        assertEquals(Arrays.asList("a", "b", "c"), ran);
        assertTrue(queue.isEmpty());
        assertFalse(queue.runNext());
    }

    @Test
    void rejectsNullTask() {
        assertThrows(NullPointerException.class, () -> new DbTaskQueue().execute(null));
    }

    @Test
    void onlyOwningThreadMayDrain() throws InterruptedException {
        final DbTaskQueue queue = new DbTaskQueue();
        queue.drain();

        final AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread other = new Thread(() -> {
            try {
                queue.drain();
            } catch (IllegalStateException e) {
                failure.set(e);
            }
        });
        other.start();
        other.join();

        assertTrue(failure.get() instanceof IllegalStateException);
    }

    @Test
    void currentThreadQueueIsPerThread() throws InterruptedException {
        final DbTaskQueue mine = DbTaskQueue.forCurrentThread();
        assertSame(mine, DbTaskQueue.forCurrentThread());

        final AtomicReference<DbTaskQueue> theirs = new AtomicReference<>();
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread other = new Thread(() -> {
            theirs.set(DbTaskQueue.forCurrentThread());
            try {
                mine.drain();
            } catch (IllegalStateException e) {
                failure.set(e);
            }
        });
        other.start();
        other.join();

        assertNotSame(mine, theirs.get());
        assertTrue(failure.get() instanceof IllegalStateException);
    }
}
