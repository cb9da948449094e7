package com.ajjpj.upool.api;

import java.text.NumberFormat;


/**
 * @author arno
 */
public class UWorkerThreadStatistics {
    public final String threadName;
    public final boolean alive;

    public final long numTasksExecuted;
    public final long numExceptions;
    public final long numWaits;

    public UWorkerThreadStatistics (String threadName, boolean alive, long numTasksExecuted, long numExceptions, long numWaits) {
        this.threadName = threadName;
        this.alive = alive;
        this.numTasksExecuted = numTasksExecuted;
        this.numExceptions = numExceptions;
        this.numWaits = numWaits;
    }

    @Override public String toString () {
        return "UWorkerThreadStatistics{" +
                "threadName=" + threadName +
                ", alive=" + alive +
                ", numTasksExecuted=" + NumberFormat.getNumberInstance ().format (numTasksExecuted) +
                ", numExceptions=" + NumberFormat.getNumberInstance ().format (numExceptions) +
                ", numWaits=" + NumberFormat.getNumberInstance ().format (numWaits) +
                '}';
    }
}
