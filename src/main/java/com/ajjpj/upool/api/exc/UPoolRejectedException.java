package com.ajjpj.upool.api.exc;

import java.util.concurrent.RejectedExecutionException;


/**
 * Thrown when a task is submitted to a pool that is no longer running. Rejection is part of regular control flow
 *  during shutdown, so there is no stack trace.
 */
public class UPoolRejectedException extends RejectedExecutionException {
    public UPoolRejectedException (String msg) {
        super (msg);
    }

    @Override public Throwable fillInStackTrace () {
        return this;
    }
}
