package benchmark;

import com.ajjpj.afoundation.util.AUnchecker;
import com.ajjpj.upool.api.UThreadPoolWithAdmin;
import com.ajjpj.upool.impl.UThreadPoolBuilder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.*;


/**
 * Compares submit / drain cycles of the u-pool with a JDK fixed thread pool of the same size. The JDK pool has no drain
 *  barrier, so its adapter tracks outstanding tasks with a Phaser.
 *
 * @author arno
 */
//@Fork (1)
@Fork (0)
@Threads (1)
@Warmup (iterations = 3, time = 1)
@Measurement (iterations = 3, time = 3)
@State (Scope.Benchmark)
public class PoolBenchmark {
    private static final int NUM_THREADS = 8;
    private static final int NUM_TASKS = 10_000;

    DrainablePool pool;

    @Param ({
            "u-pool",
            "Fixed",
    })
    public String strategy;

    @Setup
    public void setUp() {
        switch (strategy) {
            case "u-pool": pool = new UPoolAdapter (new UThreadPoolBuilder ().withNumThreads (NUM_THREADS).withDaemonThreads (true).build ()); break;
            case "Fixed":  pool = new ExecutorAdapter (Executors.newFixedThreadPool (NUM_THREADS)); break;
            default: throw new IllegalStateException ();
        }
    }

    @TearDown
    public void tearDown() {
        pool.shutdown ();
    }

    @Benchmark
    public void testSimpleScheduling() {
        for (int i=0; i<NUM_TASKS; i++) {
            pool.submit (() -> {});
        }
        pool.drain ();
    }

    @Benchmark
    public void testExpensive() {
        for (int i=0; i<NUM_TASKS; i++) {
            pool.submit (() -> Blackhole.consumeCPU (100));
        }
        pool.drain ();
    }

    /**
     * Each task submits its successor, so there is never more than one task in the queue.
     */
    @Benchmark
    public void testChained() {
        final CountDownLatch latch = new CountDownLatch (1);
        chain (1000, latch);
        AUnchecker.executeUnchecked (() -> latch.await ());
    }

    private void chain (int remaining, CountDownLatch latch) {
        if (remaining == 0) {
            latch.countDown ();
        }
        else {
            pool.submit (() -> chain (remaining-1, latch));
        }
    }

    interface DrainablePool {
        void submit (Runnable code);

        /**
         * waits until all tasks submitted since the previous call have finished
         */
        void drain ();

        void shutdown ();
    }

    static class UPoolAdapter implements DrainablePool {
        final UThreadPoolWithAdmin inner;

        UPoolAdapter (UThreadPoolWithAdmin inner) {
            this.inner = inner;
        }

        @Override public void submit (Runnable code) {
            inner.submit (code);
        }

        @Override public void drain () {
            AUnchecker.executeUnchecked (() -> inner.awaitDrained ());
            inner.release ();
        }

        @Override public void shutdown () {
            inner.destroy ();

            System.out.println ();
            System.out.println ("---- Thread Pool Statistics ----");
            System.out.println (inner.getStatistics ());
            System.out.println ("--------------------------------");
        }
    }

    static class ExecutorAdapter implements DrainablePool {
        final ExecutorService inner;

        /**
         * one party for the benchmark thread, plus one per outstanding task
         */
        private final Phaser outstanding = new Phaser (1);

        ExecutorAdapter (ExecutorService inner) {
            this.inner = inner;
        }

        @Override public void submit (Runnable code) {
            outstanding.register ();
            inner.execute (() -> {
                try {
                    code.run ();
                }
                finally {
                    outstanding.arriveAndDeregister ();
                }
            });
        }

        @Override public void drain () {
            outstanding.arriveAndAwaitAdvance ();
        }

        @Override public void shutdown () {
            inner.shutdown ();
        }
    }
}
