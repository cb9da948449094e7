package com.ajjpj.upool.impl;

import com.ajjpj.upool.api.UTask;
import com.ajjpj.upool.api.UWorkerThreadStatistics;
import com.ajjpj.upool.api.exc.UPoolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * @author arno
 */
class WorkerThread extends Thread {
    private static final Logger log = LoggerFactory.getLogger (WorkerThread.class);

    final TaskQueue queue;

    /**
     * set the first time this thread waits for work, written only from this thread while holding the consume lock
     */
    boolean ready = false;

    //---------------------------------------------------
    //-- statistics data, written only from this thread
    //---------------------------------------------------

    long stat_numTasksExecuted = 0;
    long stat_numExceptions = 0;
    long stat_numWaits = 0;

    WorkerThread (TaskQueue queue, String name) {
        super (name);
        this.queue = queue;
    }

    /**
     * This method returns an approximation of this thread's execution statistics. Writes are done without memory barriers, so the data
     *  may be stale unless the caller synchronized with the pool in some other way, e.g. through the drain barrier.
     */
    UWorkerThreadStatistics getStatistics () {
        return new UWorkerThreadStatistics (getName (), isAlive (), stat_numTasksExecuted, stat_numExceptions, stat_numWaits);
    }

    @Override public void run () {
        log.debug ("worker {} started", getName ());

        try {
            //noinspection InfiniteLoopStatement
            while (true) {
                final UTask<?> task = queue.consume (this);
                try {
                    task.execute ();
                }
                catch (Exception exc) {
                    if (UThreadPoolImpl.SHOULD_GATHER_STATISTICS) stat_numExceptions += 1;
                    log.warn ("task {} failed on worker {}", task, getName (), exc);
                }
                finally {
                    if (UThreadPoolImpl.SHOULD_GATHER_STATISTICS) stat_numTasksExecuted += 1;

                    // an interrupt aimed at the task must not cancel this worker's next wait for work
                    //noinspection ResultOfMethodCallIgnored
                    Thread.interrupted ();
                    queue.taskDone ();
                }
            }
        }
        catch (PoolShutdown exc) {
            log.debug ("worker {} shut down", getName ());
        }
        catch (InterruptedException exc) {
            log.info ("worker {} was cancelled while waiting for work", getName ());
        }
        catch (UPoolException exc) {
            log.error ("worker {} terminated: could not fetch work", getName (), exc);
        }
        catch (Error err) {
            log.error ("worker {} terminated by an error thrown from a task", getName (), err);
            throw err;
        }
    }
}
