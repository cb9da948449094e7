package com.ajjpj.upool.impl;

import com.ajjpj.upool.api.UTask;
import com.ajjpj.upool.api.UThreadPoolWithAdmin.ShutdownMode;
import com.ajjpj.upool.api.exc.UPoolException;
import com.ajjpj.upool.api.exc.UPoolRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;


/**
 * The pool's task queue: a linked list with a permanent sentinel at the head, guarded by two independent locks. Producers
 *  only ever take the append lock, workers only ever take the consume lock, so submitting work does not contend with
 *  fetching work. Both locks are taken together only by the drain barrier, {@link #pendingCount()} and shutdown, and
 *  always in the order append lock, then consume lock.<p>
 *
 * 'head' is the sentinel or the node that was consumed last, its task field cleared. The node after 'head' (if any)
 *  holds the next task to run, so 'queue is empty' is always 'head.next == null', and appending to an empty queue needs
 *  no special case.
 *
 * @author arno
 */
class TaskQueue {
    private static final Logger log = LoggerFactory.getLogger (TaskQueue.class);

    static final class Node {
        UTask<?> task;

        /**
         * Written by producers holding the append lock and read by workers holding the consume lock. The volatile write
         *  publishes the node's task along with the node.
         */
        volatile Node next;

        Node (UTask<?> task) {
            this.task = task;
        }
    }

    private final ReentrantLock appendLock = new ReentrantLock ();
    final ReentrantLock consumeLock = new ReentrantLock ();

    /**
     * signalled once per appended task, and to all workers on shutdown
     */
    private final Condition notEmpty = consumeLock.newCondition ();

    /**
     * signalled whenever a task has finished executing
     */
    private final Condition drained = consumeLock.newCondition ();

    /**
     * counted down by each worker the first time it enters {@link #consume(WorkerThread)}
     */
    private final CountDownLatch workersReady;

    private Node head; // guarded by consumeLock
    private Node tail; // guarded by appendLock

    private long submitted = 0; // guarded by appendLock
    private long consumed = 0;  // guarded by consumeLock, counts tasks that finished executing

    /**
     * null while the pool is running. This is written with both locks held, so holding either of them is sufficient for reading.
     */
    private ShutdownMode shutdownMode = null;

    TaskQueue (int numWorkers) {
        head = tail = new Node (null);
        workersReady = new CountDownLatch (numWorkers);
    }

    void awaitWorkersReady () throws InterruptedException {
        workersReady.await ();
    }

    void append (UTask<?> task) {
        final Node node;
        try {
            node = new Node (task);
        }
        catch (OutOfMemoryError exc) {
            throw new UPoolException (UPoolException.Kind.AllocationFailure, "could not allocate a queue node", exc);
        }

        acquire (appendLock, "append");
        try {
            if (shutdownMode != null) {
                throw new UPoolRejectedException ("pool is already shut down");
            }
            submitted += 1;
            tail.next = node;
            tail = node;
        }
        finally {
            appendLock.unlock ();
        }

        // Conditions require their lock to be held for signalling. The task is linked at this point, so the signal must
        //  not be lost to an interrupt.
        consumeLock.lock ();
        try {
            notEmpty.signal ();
        }
        finally {
            consumeLock.unlock ();
        }
    }

    /**
     * Blocks until a task is available and removes it from the queue. Waiting for work is the only point where a worker
     *  observes cancellation: either through the pool's shutdown, signalled by throwing {@link PoolShutdown}, or through
     *  the worker thread being interrupted. In both cases the consume lock is released before the exception propagates.
     */
    UTask<?> consume (WorkerThread worker) throws InterruptedException {
        acquire (consumeLock, "consume");

        final Node first;
        try {
            if (! worker.ready) {
                worker.ready = true;
                workersReady.countDown ();
            }
            first = awaitFirst (worker);
        }
        catch (PoolShutdown | InterruptedException | RuntimeException exc) {
            unlockAfterCancellation (worker);
            throw exc;
        }

        try {
            final UTask<?> result = first.task;

            // 'first' becomes the new head, so it must not look like it still holds live work
            first.task = null;

            final Node oldHead = head;
            head = first;
            oldHead.next = null;

            return result;
        }
        finally {
            consumeLock.unlock ();
        }
    }

    private Node awaitFirst (WorkerThread worker) throws InterruptedException {
        while (true) {
            if (shutdownMode == ShutdownMode.SkipUnstarted) {
                throw new PoolShutdown ();
            }

            final Node first = head.next;
            if (first != null) {
                return first;
            }

            if (shutdownMode != null) {
                // the queue is empty, and the worker was about to wait
                throw new PoolShutdown ();
            }

            if (UThreadPoolImpl.SHOULD_GATHER_STATISTICS) worker.stat_numWaits += 1;
            notEmpty.await ();
        }
    }

    private void unlockAfterCancellation (WorkerThread worker) {
        try {
            consumeLock.unlock ();
        }
        catch (RuntimeException exc) {
            log.error ("worker {} could not release the consume lock while stopping", worker.getName (), exc);
        }
    }

    /**
     * Called by a worker after a task finished, regardless of its outcome.
     */
    void taskDone () {
        consumeLock.lock ();
        try {
            consumed += 1;
            drained.signalAll ();
        }
        finally {
            consumeLock.unlock ();
        }
    }

    /**
     * Returns holding both locks once every task submitted in the current cycle has finished executing. Counters are
     *  reset for the next cycle.
     */
    void awaitDrained () throws InterruptedException {
        acquire (appendLock, "awaitDrained");
        try {
            acquire (consumeLock, "awaitDrained");
        }
        catch (UPoolException exc) {
            appendLock.unlock ();
            throw exc;
        }

        try {
            while (consumed != submitted) {
                drained.await ();
            }
        }
        catch (InterruptedException exc) {
            consumeLock.unlock ();
            appendLock.unlock ();
            throw exc;
        }

        submitted = 0;
        consumed = 0;
    }

    void release () {
        try {
            consumeLock.unlock ();
            appendLock.unlock ();
        }
        catch (IllegalMonitorStateException exc) {
            throw new UPoolException (UPoolException.Kind.LockFailure, "release() must be called by the thread that called awaitDrained()", exc);
        }
    }

    long pendingCount () {
        acquire (appendLock, "pendingCount");
        try {
            acquire (consumeLock, "pendingCount");
            try {
                return submitted - consumed;
            }
            finally {
                consumeLock.unlock ();
            }
        }
        finally {
            appendLock.unlock ();
        }
    }

    /**
     * Rejects all further appends and wakes up all waiting workers so they can observe the shutdown.
     */
    void shutdown (ShutdownMode mode) {
        appendLock.lock ();
        try {
            consumeLock.lock ();
            try {
                shutdownMode = mode;
                notEmpty.signalAll ();
            }
            finally {
                consumeLock.unlock ();
            }
        }
        finally {
            appendLock.unlock ();
        }
    }

    /**
     * For inspection only, e.g. diagnostics after a failed shutdown; the snapshot is stale as soon as the locks are released.
     *
     * @return the tasks that are currently queued and not yet started, in FIFO order
     */
    List<UTask<?>> queuedTasks () {
        return traverse (false);
    }

    /**
     * Unlinks every node after 'head', leaving an empty queue.
     *
     * @return the discarded tasks in FIFO order
     */
    List<UTask<?>> discardRemaining () {
        return traverse (true);
    }

    private List<UTask<?>> traverse (boolean unlink) {
        appendLock.lock ();
        try {
            consumeLock.lock ();
            try {
                final List<UTask<?>> result = new ArrayList<> ();

                Node n = head.next;
                while (n != null) {
                    result.add (n.task);
                    final Node next = n.next;
                    if (unlink) {
                        n.task = null;
                        n.next = null;
                    }
                    n = next;
                }

                if (unlink) {
                    head.next = null;
                    tail = head;
                    // discarded tasks will never finish, they must not count as pending
                    consumed += result.size ();
                }
                return result;
            }
            finally {
                consumeLock.unlock ();
            }
        }
        finally {
            appendLock.unlock ();
        }
    }

    private static void acquire (Lock lock, String operation) {
        try {
            lock.lockInterruptibly ();
        }
        catch (InterruptedException exc) {
            Thread.currentThread ().interrupt ();
            throw new UPoolException (UPoolException.Kind.LockFailure, operation + ": interrupted while acquiring lock", exc);
        }
    }
}
