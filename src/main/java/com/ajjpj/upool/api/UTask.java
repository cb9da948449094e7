package com.ajjpj.upool.api;

import com.ajjpj.afoundation.function.AStatement1;


/**
 * A unit of work: a routine together with the argument it is applied to. Instances are immutable, so the queued task
 *  can never be changed by the code that submitted it.
 *
 * @author arno
 */
public final class UTask<T> {
    private final AStatement1<? super T, ? extends Exception> routine;
    private final T arg;

    private UTask (AStatement1<? super T, ? extends Exception> routine, T arg) {
        this.routine = routine;
        this.arg = arg;
    }

    public static <T> UTask<T> of (AStatement1<? super T, ? extends Exception> routine, T arg) {
        if (routine == null) {
            throw new IllegalArgumentException ("routine must not be null");
        }
        return new UTask<> (routine, arg);
    }

    public static UTask<Void> of (Runnable code) {
        if (code == null) {
            throw new IllegalArgumentException ("code must not be null");
        }
        final AStatement1<Void, RuntimeException> routine = ignored -> code.run ();
        return new UTask<> (routine, null);
    }

    public T getArg () {
        return arg;
    }

    public void execute () throws Exception {
        routine.apply (arg);
    }

    @Override public String toString () {
        return "UTask{" +
                "routine=" + routine +
                ", arg=" + arg +
                '}';
    }
}
