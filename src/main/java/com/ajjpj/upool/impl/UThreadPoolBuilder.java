package com.ajjpj.upool.impl;

import com.ajjpj.afoundation.function.AStatement1;
import com.ajjpj.upool.api.UThreadPoolWithAdmin;
import com.ajjpj.upool.api.exc.UPoolException;


public class UThreadPoolBuilder {
    private int numThreads = Runtime.getRuntime ().availableProcessors ();
    private String threadNamePrefix = "upool-worker-";
    private boolean daemonThreads = false;
    private long joinTimeoutMillis = 0;
    private Thread.UncaughtExceptionHandler uncaughtExceptionHandler = null;

    public UThreadPoolBuilder withNumThreads (int numThreads) {
        this.numThreads = numThreads;
        return this;
    }

    /**
     * Worker threads are named by appending their index to this prefix.
     */
    public UThreadPoolBuilder withThreadNamePrefix (String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    /**
     * Defaults to {@code false}: worker threads keep the JVM alive until the pool is destroyed, so a pool that is never
     *  destroyed prevents a regular JVM exit.
     */
    public UThreadPoolBuilder withDaemonThreads (boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    /**
     * Limits the time {@link UThreadPoolWithAdmin#destroy()} waits for each worker thread to terminate. 0 means 'wait forever',
     *  which is the default.
     */
    public UThreadPoolBuilder withJoinTimeoutMillis (long joinTimeoutMillis) {
        this.joinTimeoutMillis = joinTimeoutMillis;
        return this;
    }

    /**
     * Called when an Error thrown by a task terminates a worker thread. Exceptions thrown by tasks are logged, and the worker
     *  continues.
     */
    public UThreadPoolBuilder withUncaughtExceptionHandler (Thread.UncaughtExceptionHandler uncaughtExceptionHandler) {
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;
        return this;
    }

    public <E extends Exception> UThreadPoolBuilder log (AStatement1<String, E> logOperation) throws E {
        final String stringRepresentation = toString ();
        logOperation.apply (stringRepresentation);
        return this;
    }

    /**
     * Creates the pool and starts its worker threads. This method returns only after every worker thread is waiting for work.
     *
     * @throws UPoolException with kind {@code ConfigError} for an invalid configuration, {@code AllocationFailure} or
     *  {@code ThreadCreateFailure} if resources are exhausted
     */
    public UThreadPoolWithAdmin build () {
        if (numThreads < 1) {
            throw new UPoolException (UPoolException.Kind.ConfigError, "numThreads must be at least 1, is " + numThreads);
        }
        if (joinTimeoutMillis < 0) {
            throw new UPoolException (UPoolException.Kind.ConfigError, "joinTimeoutMillis must not be negative, is " + joinTimeoutMillis);
        }
        if (threadNamePrefix == null) {
            throw new UPoolException (UPoolException.Kind.ConfigError, "threadNamePrefix must not be null");
        }

        final UThreadPoolImpl result;
        try {
            result = new UThreadPoolImpl (numThreads, threadNamePrefix, daemonThreads, joinTimeoutMillis, uncaughtExceptionHandler);
        }
        catch (OutOfMemoryError exc) {
            throw new UPoolException (UPoolException.Kind.AllocationFailure, "could not allocate a pool with " + numThreads + " worker threads", exc);
        }

        result.start ();
        return result;
    }

    @Override
    public String toString () {
        return "UThreadPoolBuilder{" +
                "numThreads=" + numThreads +
                ", threadNamePrefix='" + threadNamePrefix + '\'' +
                ", daemonThreads=" + daemonThreads +
                ", joinTimeoutMillis=" + joinTimeoutMillis +
                ", uncaughtExceptionHandler=" + uncaughtExceptionHandler +
                '}';
    }
}
