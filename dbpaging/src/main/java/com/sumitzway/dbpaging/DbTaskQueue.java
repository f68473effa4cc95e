package com.sumitzway.dbpaging;


import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * FIFO task queue drained by a single controlling thread.
 * <p>
 * Any thread may {@link #execute(Runnable) post} to the queue. Tasks run, in posting order, only
 * when the controlling thread calls {@link #drain()} or {@link #runNext()}. The first thread to
 * drain a queue becomes its controlling thread; draining from any other thread afterwards fails
 * with {@link IllegalStateException}.
 * <p>
 * Used as the notify executor of a {@link DbPagedList}: every page delivery and boundary callback
 * lands here, so all list mutation happens on one thread.
 */
public final class DbTaskQueue implements Executor {
    private static final Logger LOGGER = LoggerFactory.getLogger(DbTaskQueue.class);

    private static final ThreadLocal<DbTaskQueue> CURRENT = new ThreadLocal<DbTaskQueue>() {
        @Override
        protected DbTaskQueue initialValue() {
            DbTaskQueue queue = new DbTaskQueue();
            queue.mOwner.set(Thread.currentThread());
            return queue;
        }
    };

    private final ConcurrentLinkedQueue<Runnable> mTasks = new ConcurrentLinkedQueue<>();
    private final AtomicReference<Thread> mOwner = new AtomicReference<>();

    /**
     * Returns the queue owned by the calling thread, creating it on first use.
     */
    @Nonnull
    public static DbTaskQueue forCurrentThread() {
        return CURRENT.get();
    }

    @Override
    public void execute(@Nonnull Runnable command) {
        //noinspection ConstantConditions
        if (command == null) {
            throw new NullPointerException("command");
        }
        mTasks.add(command);
    }

    /**
     * Runs the oldest pending task, if any.
     *
     * @return true if a task was run.
     */
    public boolean runNext() {
        checkOwner();
        Runnable task = mTasks.poll();
        if (task == null) {
            return false;
        }
        task.run();
        return true;
    }

    /**
     * Runs pending tasks until the queue is empty, including tasks posted by the tasks it runs.
     *
     * @return Number of tasks run.
     */
    public int drain() {
        int count = 0;
        while (runNext()) {
            count++;
        }
        if (count > 0) {
            LOGGER.trace("Drained {} tasks", count);
        }
        return count;
    }

    /**
     * @return Number of tasks waiting to run.
     */
    public int size() {
        return mTasks.size();
    }

    public boolean isEmpty() {
        return mTasks.isEmpty();
    }

    private void checkOwner() {
        Thread current = Thread.currentThread();
        if (!mOwner.compareAndSet(null, current) && mOwner.get() != current) {
            throw new IllegalStateException("DbTaskQueue is drained by " + mOwner.get().getName()
                    + ", cannot drain from " + current.getName());
        }
    }
}
