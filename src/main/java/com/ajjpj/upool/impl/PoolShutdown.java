package com.ajjpj.upool.impl;

/**
 * This Throwable is thrown from a worker's wait for work to signal that the pool is shutting down, unwinding the worker
 *  loop without burdening regular execution with flag checks.
 *
 * @author arno
 */
class PoolShutdown extends Error {
    @Override public Throwable fillInStackTrace () {
        return this;
    }
}
