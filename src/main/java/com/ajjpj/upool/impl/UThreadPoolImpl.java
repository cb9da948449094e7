package com.ajjpj.upool.impl;

import com.ajjpj.upool.api.UTask;
import com.ajjpj.upool.api.UThreadPoolStatistics;
import com.ajjpj.upool.api.UThreadPoolWithAdmin;
import com.ajjpj.upool.api.UWorkerThreadStatistics;
import com.ajjpj.upool.api.exc.UPoolException;
import com.ajjpj.upool.api.exc.UPoolRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;


/**
 * A fixed number of worker threads feeding from a single FIFO queue. Instances are created through {@link UThreadPoolBuilder}.
 *
 * @author arno
 */
public class UThreadPoolImpl implements UThreadPoolWithAdmin {
    public static final boolean SHOULD_GATHER_STATISTICS = true; // compile-time switch to enable / disable statistics gathering

    private static final Logger log = LoggerFactory.getLogger (UThreadPoolImpl.class);

    final TaskQueue queue;
    final WorkerThread[] workers;

    /**
     * 0 means 'wait forever'
     */
    private final long joinTimeoutMillis;

    private final AtomicReference<State> state = new AtomicReference<> (State.Running);

    UThreadPoolImpl (int numThreads, String threadNamePrefix, boolean daemonThreads, long joinTimeoutMillis, Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        this.joinTimeoutMillis = joinTimeoutMillis;
        this.queue = new TaskQueue (numThreads);

        workers = new WorkerThread[numThreads];
        for (int i=0; i<numThreads; i++) {
            workers[i] = new WorkerThread (queue, threadNamePrefix + i);
            workers[i].setDaemon (daemonThreads);
            if (uncaughtExceptionHandler != null) {
                workers[i].setUncaughtExceptionHandler (uncaughtExceptionHandler);
            }
        }
    }

    /**
     * Starts all worker threads and returns once every one of them is waiting for work.
     */
    void start () {
        for (WorkerThread worker: workers) {
            try {
                worker.start ();
            }
            catch (OutOfMemoryError exc) {
                abortStart ();
                throw new UPoolException (UPoolException.Kind.ThreadCreateFailure, "could not start worker thread " + worker.getName (), exc);
            }
        }

        try {
            queue.awaitWorkersReady ();
        }
        catch (InterruptedException exc) {
            abortStart ();
            Thread.currentThread ().interrupt ();
            throw new UPoolException (UPoolException.Kind.ThreadCreateFailure, "interrupted while waiting for worker threads to start", exc);
        }

        log.info ("started thread pool with {} worker threads", workers.length);
    }

    /**
     * Workers that were started stop as soon as they wait for work for the first time.
     */
    private void abortStart () {
        state.set (State.Down);
        queue.shutdown (ShutdownMode.ExecuteSubmitted);
    }

    @Override public void submit (UTask<?> task) {
        if (task == null) {
            throw new IllegalArgumentException ("task must not be null");
        }
        if (state.get () != State.Running) {
            throw new UPoolRejectedException ("pool is already shut down");
        }

        queue.append (task);
    }

    @Override public int getNumThreads () {
        return workers.length;
    }

    /**
     * This method returns an approximation of statistical data for all worker threads since the pool was started. Per-thread data is
     *  updated without synchronization, so it may be stale; see {@link WorkerThread#getStatistics()}.
     */
    @Override public UThreadPoolStatistics getStatistics () {
        final UWorkerThreadStatistics[] workerStatistics = new UWorkerThreadStatistics[workers.length];
        for (int i=0; i<workers.length; i++) {
            workerStatistics[i] = workers[i].getStatistics ();
        }
        return new UThreadPoolStatistics (workerStatistics, queue.pendingCount ());
    }

    @Override public State getState () {
        return state.get ();
    }

    @Override public void awaitDrained () throws InterruptedException {
        if (state.get () != State.Running) {
            throw new IllegalStateException ("pool is not running, state is " + state.get ());
        }
        queue.awaitDrained ();
    }

    @Override public void release () {
        queue.release ();
    }

    @Override public long pendingCount () {
        return queue.pendingCount ();
    }

    @Override public List<UTask<?>> destroy (ShutdownMode shutdownMode) {
        if (! state.compareAndSet (State.Running, State.ShuttingDown)) {
            throw new IllegalStateException ("a pool can be destroyed only once, state is " + state.get ());
        }

        log.info ("shutting down thread pool with {} worker threads, mode {}", workers.length, shutdownMode);
        queue.shutdown (shutdownMode);

        // If a join fails, nothing is released and the pool stays 'ShuttingDown': there is no way of telling whether it is
        //  safe to discard the queue while a worker refuses to terminate.
        try {
            for (WorkerThread worker: workers) {
                join (worker);
            }
        }
        catch (UPoolException exc) {
            log.error ("could not join all workers, pool stays {} with {} queued tasks", state.get (), queue.queuedTasks ().size ());
            throw exc;
        }

        final List<UTask<?>> discarded = queue.discardRemaining ();
        state.set (State.Down);

        if (! discarded.isEmpty ()) {
            log.info ("discarded {} unstarted tasks", discarded.size ());
        }
        log.info ("thread pool is down");
        return discarded;
    }

    private void join (WorkerThread worker) {
        try {
            worker.join (joinTimeoutMillis);
        }
        catch (InterruptedException exc) {
            Thread.currentThread ().interrupt ();
            throw new UPoolException (UPoolException.Kind.ThreadJoinFailure, "interrupted while joining worker " + worker.getName (), exc);
        }

        if (worker.isAlive ()) {
            throw new UPoolException (UPoolException.Kind.ThreadJoinFailure, "worker " + worker.getName () + " did not terminate within " + joinTimeoutMillis + "ms");
        }
    }

    @Override public void awaitTermination () throws InterruptedException {
        for (WorkerThread worker: workers) {
            worker.join ();
        }
    }
}
