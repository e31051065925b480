package com.flowgraph.core.dispatch;

import com.flowgraph.core.job.DiagramJob;
import com.flowgraph.core.job.JobExecutor;
import com.flowgraph.core.job.JobOutcome;
import com.flowgraph.core.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs a batch of independent diagram jobs with bounded concurrency.
 *
 * <p>In {@link ExecutionMode#PARALLEL} mode, jobs are submitted to a fixed pool of
 * {@code concurrency} worker threads through an {@link ExecutorCompletionService} and
 * outcomes are drained as jobs complete, so at most {@code concurrency} jobs (and
 * renderer processes) run at any time. {@link ExecutionMode#SEQUENTIAL} mode, or a
 * concurrency of 1, runs the jobs on the calling thread with the same semantics.
 *
 * <p>{@link #dispatch} blocks until every job has a terminal outcome. If the calling
 * thread is interrupted, queued jobs are cancelled, running jobs are interrupted, and
 * every job without an outcome is reported as {@link JobStatus#CANCELLED}; the interrupt
 * flag is restored before returning.
 */
public class BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final int concurrency;
    private final ExecutionMode mode;

    /**
     * Creates a dispatcher.
     *
     * @param concurrency maximum number of jobs running at once
     * @param mode execution mode
     * @throws IllegalArgumentException if concurrency is less than 1
     */
    public BatchDispatcher(int concurrency, ExecutionMode mode) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        this.concurrency = concurrency;
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    /**
     * Creates a parallel dispatcher sized to the available processors.
     *
     * @return dispatcher
     */
    public static BatchDispatcher defaults() {
        return new BatchDispatcher(Runtime.getRuntime().availableProcessors(), ExecutionMode.PARALLEL);
    }

    public int concurrency() {
        return concurrency;
    }

    public ExecutionMode mode() {
        return mode;
    }

    /**
     * Runs all jobs and waits for their outcomes.
     *
     * @param jobs jobs to run
     * @param executor runs a single job
     * @param listener progress listener
     * @return outcomes in submission order
     */
    public BatchResult dispatch(List<DiagramJob> jobs, JobExecutor executor, DispatchListener listener) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        long start = System.nanoTime();
        notifyBatch(listener, BatchState.STARTED, jobs.size());
        for (DiagramJob job : jobs) {
            notifyJob(listener, job, JobState.PENDING);
        }

        int workers = Math.min(concurrency, Math.max(jobs.size(), 1));
        boolean sequential = mode == ExecutionMode.SEQUENTIAL || workers == 1;
        log.info("Dispatching {} jobs ({})", jobs.size(),
            sequential ? "sequential" : workers + " workers");

        AtomicReferenceArray<JobOutcome> outcomes = new AtomicReferenceArray<>(jobs.size());
        boolean cancelled = sequential
            ? runSequential(jobs, executor, listener, outcomes)
            : runParallel(jobs, executor, listener, outcomes, workers);

        List<JobOutcome> ordered = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            JobOutcome cancelledOutcome = JobOutcome.cancelled(jobs.get(i).scope());
            if (outcomes.compareAndSet(i, null, cancelledOutcome)) {
                notifyJob(listener, jobs.get(i), JobState.FAILED);
                notifyFinished(listener, jobs.get(i), cancelledOutcome);
            }
            ordered.add(outcomes.get(i));
        }

        BatchResult result = new BatchResult(ordered, Duration.ofNanos(System.nanoTime() - start), cancelled);
        notifyBatch(listener, BatchState.COMPLETE, jobs.size());
        log.info("Batch complete in {} ms: {}", result.elapsed().toMillis(), result.counts());
        return result;
    }

    private boolean runSequential(List<DiagramJob> jobs, JobExecutor executor, DispatchListener listener,
                                  AtomicReferenceArray<JobOutcome> outcomes) {
        notifyBatch(listener, BatchState.RUNNING, jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Interrupted, cancelling {} remaining jobs", jobs.size() - i);
                return true;
            }
            runJob(i, jobs.get(i), executor, listener, outcomes);
        }
        return false;
    }

    private boolean runParallel(List<DiagramJob> jobs, JobExecutor executor, DispatchListener listener,
                                AtomicReferenceArray<JobOutcome> outcomes, int workers) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        CompletionService<Integer> completion = new ExecutorCompletionService<>(pool);
        Map<Future<Integer>, Integer> submitted = new IdentityHashMap<>();
        List<Future<Integer>> futures = new ArrayList<>(jobs.size());

        notifyBatch(listener, BatchState.RUNNING, jobs.size());
        try {
            for (int i = 0; i < jobs.size(); i++) {
                int index = i;
                DiagramJob job = jobs.get(i);
                Future<Integer> future = completion.submit(() -> runJob(index, job, executor, listener, outcomes));
                submitted.put(future, index);
                futures.add(future);
            }

            for (int received = 0; received < jobs.size(); received++) {
                Future<Integer> future = completion.take();
                try {
                    future.get();
                } catch (ExecutionException e) {
                    int index = submitted.get(future);
                    DiagramJob job = jobs.get(index);
                    log.error("Job {} escaped with an error", job, e.getCause());
                    report(index, job, JobOutcome.failed(job.scope(), JobStatus.GENERATION_FAILED, null,
                        String.valueOf(e.getCause()), Duration.ZERO), listener, outcomes);
                }
            }
            pool.shutdown();
            return false;
        } catch (InterruptedException e) {
            log.warn("Interrupted, cancelling outstanding jobs");
            futures.forEach(f -> f.cancel(true));
            pool.shutdownNow();
            awaitWorkers(pool);
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private int runJob(int index, DiagramJob job, JobExecutor executor, DispatchListener listener,
                       AtomicReferenceArray<JobOutcome> outcomes) {
        notifyJob(listener, job, JobState.RUNNING);
        JobOutcome outcome;
        try {
            outcome = executor.execute(job);
            if (outcome == null) {
                throw new IllegalStateException("Executor returned no outcome");
            }
        } catch (RuntimeException | Error e) {
            log.error("Job {} failed unexpectedly", job, e);
            outcome = JobOutcome.failed(job.scope(), JobStatus.GENERATION_FAILED, null, e.toString(), Duration.ZERO);
        }
        report(index, job, outcome, listener, outcomes);
        return index;
    }

    /**
     * Records the outcome of a job unless it already has one, e.g. after cancellation.
     */
    private static void report(int index, DiagramJob job, JobOutcome outcome, DispatchListener listener,
                               AtomicReferenceArray<JobOutcome> outcomes) {
        if (outcomes.compareAndSet(index, null, outcome)) {
            notifyJob(listener, job, outcome.isFailure() ? JobState.FAILED : JobState.SUCCEEDED);
            notifyFinished(listener, job, outcome);
        }
    }

    private static void awaitWorkers(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void notifyBatch(DispatchListener listener, BatchState state, int jobCount) {
        try {
            listener.batchStateChanged(state, jobCount);
        } catch (RuntimeException e) {
            log.warn("Dispatch listener failed on batch state {}", state, e);
        }
    }

    private static void notifyJob(DispatchListener listener, DiagramJob job, JobState state) {
        try {
            listener.jobStateChanged(job, state);
        } catch (RuntimeException e) {
            log.warn("Dispatch listener failed on {} -> {}", job, state, e);
        }
    }

    private static void notifyFinished(DispatchListener listener, DiagramJob job, JobOutcome outcome) {
        try {
            listener.jobFinished(job, outcome);
        } catch (RuntimeException e) {
            log.warn("Dispatch listener failed on outcome of {}", job, e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_NUMBER = new AtomicInteger(1);

        private final int pool = POOL_NUMBER.getAndIncrement();
        private final AtomicInteger thread = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable task) {
            Thread worker = new Thread(task, "flowgraph-" + pool + "-worker-" + thread.getAndIncrement());
            worker.setDaemon(true);
            return worker;
        }
    }
}
