package com.ajjpj.upool.api;

import java.util.Arrays;


/**
 * @author arno
 */
public class UThreadPoolStatistics {
    public final UWorkerThreadStatistics[] workerThreadStatistics;
    public final long numPendingTasks;

    public UThreadPoolStatistics (UWorkerThreadStatistics[] workerThreadStatistics, long numPendingTasks) {
        this.workerThreadStatistics = workerThreadStatistics;
        this.numPendingTasks = numPendingTasks;
    }

    public long getNumTasksExecuted () {
        long result = 0;
        for (UWorkerThreadStatistics s: workerThreadStatistics) {
            result += s.numTasksExecuted;
        }
        return result;
    }

    @Override public String toString () {
        return "UThreadPoolStatistics{" +
                "workerThreadStatistics=" + Arrays.toString (workerThreadStatistics) +
                ", numPendingTasks=" + numPendingTasks +
                '}';
    }
}
