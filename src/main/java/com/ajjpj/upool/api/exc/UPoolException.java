package com.ajjpj.upool.api.exc;


/**
 * Signals that a pool operation failed. The {@link Kind} tells callers what went wrong without parsing messages; the
 *  underlying exception (if any) is available as the cause.
 *
 * @author arno
 */
public class UPoolException extends RuntimeException {
    public enum Kind {
        AllocationFailure,
        ThreadCreateFailure,
        ThreadJoinFailure,
        LockFailure,
        /** Part of the error set for completeness: Java locks have no 'destroy' step, so the pool never raises this. */
        MutexDestroyFailure,
        /** Part of the error set for completeness: Java conditions have no 'destroy' step, so the pool never raises this. */
        ConditionDestroyFailure,
        ConfigError
    }

    public final Kind kind;

    public UPoolException (Kind kind, String msg) {
        super (kind + ": " + msg);
        this.kind = kind;
    }

    public UPoolException (Kind kind, String msg, Throwable cause) {
        super (kind + ": " + msg, cause);
        this.kind = kind;
    }
}
