package com.example.appendagetransfer;

import com.example.appendagetransfer.error.ArchiveException;
import com.example.appendagetransfer.error.JobAbortedException;
import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.error.TransferTimeoutException;
import com.example.appendagetransfer.model.ArchiveConstants;
import com.example.appendagetransfer.model.AttemptFailure;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.JobResult;
import com.example.appendagetransfer.model.TransferEvent;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.UnitFailure;
import com.example.appendagetransfer.model.UnitResult;
import com.example.appendagetransfer.model.UnitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes the units of one job operation on a bounded worker pool.
 * <p>
 * Units are submitted while the source is still being walked. A unit starts only after
 * its parent has produced a remote id, so folders exist before anything is placed in
 * them; unrelated units run in parallel. Transient remote failures are retried with
 * backoff by the worker that owns the unit, so a unit never has two attempts in flight.
 * A failed unit is recorded and the batch continues; only a job-fatal failure
 * (authentication rejected, job gone) abandons the remaining units.
 */
public final class TransferEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransferEngine.class);

    private final TransferConfig config;

    public TransferEngine(TransferConfig config) {
        this.config = config;
    }

    /**
     * Runs every unit the source yields and returns the outcome of each.
     *
     * @throws JobAbortedException if a job-fatal failure stopped the run; carries the partial result
     */
    JobResult execute(String operation,
                      JobRef job,
                      UnitSource source,
                      UnitOperation unitOperation,
                      TransferRun run) throws JobAbortedException, InterruptedException {
        Instant startedAt = Instant.now();
        CancellationToken token = run.token();
        JobLedger ledger = new JobLedger();
        ExecutorService workers = Executors.newFixedThreadPool(config.threadCount());
        ExecutorService attempts = config.unitTimeout().isPresent() ? Executors.newCachedThreadPool() : null;
        Worker worker = new Worker(unitOperation, ledger, run, attempts);
        int submitted = 0;

        try {
            while (!token.isCancelled() && ledger.abortCause() == null && source.hasNext()) {
                TransferUnit unit = source.next();
                CompletableFuture<Long> parent = unit.isRoot()
                        ? CompletableFuture.completedFuture(ArchiveConstants.NO_PARENT)
                        : ledger.remoteIdOf(unit.parentIndex());
                CompletableFuture<Long> own = ledger.register(unit);
                parent.whenComplete((parentId, parentError) ->
                        workers.submit(() -> worker.run(unit, parentId, parentError, own)));
                submitted++;
            }
            if (source.abortCause() != null) {
                ledger.abort(source.abortCause());
            }
            LOGGER.info("{} on {}: {} units submitted, waiting for transfers", operation, job, submitted);
            ledger.allFinished().get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Unit bookkeeping failed", ex.getCause());
        } catch (InterruptedException ex) {
            token.cancel();
            workers.shutdownNow();
            throw ex;
        } finally {
            workers.shutdown();
            if (attempts != null) {
                attempts.shutdownNow();
            }
        }

        JobResult result = new JobResult(operation, job.toString(), ledger.results(), source.diagnostics(),
                token.isCancelled(), startedAt, Instant.now());
        LOGGER.info("{} on {} finished: {} succeeded, {} failed{}", operation, job, result.successes().size(),
                result.failures().size(), result.cancelled() ? " (cancelled)" : "");
        RemoteException abortCause = ledger.abortCause();
        if (abortCause != null) {
            throw new JobAbortedException(abortCause, result);
        }
        return result;
    }

    /**
     * Completes a unit's remote-id future exceptionally so its children do not start.
     */
    private static final class ParentUnavailable extends RuntimeException {
        private final boolean aborted;

        private ParentUnavailable(boolean aborted) {
            super(aborted ? "parent was aborted" : "parent not transferred", null, false, false);
            this.aborted = aborted;
        }
    }

    private final class Worker {
        private final UnitOperation operation;
        private final JobLedger ledger;
        private final TransferRun run;
        private final ExecutorService attempts;

        private Worker(UnitOperation operation, JobLedger ledger, TransferRun run, ExecutorService attempts) {
            this.operation = operation;
            this.ledger = ledger;
            this.run = run;
            this.attempts = attempts;
        }

        private void run(TransferUnit unit, Long parentId, Throwable parentError, CompletableFuture<Long> own) {
            try {
                if (parentError != null) {
                    Throwable cause = parentError instanceof CompletionException ? parentError.getCause() : parentError;
                    boolean aborted = ledger.abortCause() != null || run.token().isCancelled()
                            || cause instanceof ParentUnavailable && ((ParentUnavailable) cause).aborted;
                    if (aborted) {
                        abort(unit, own, "Parent was not transferred because the run stopped");
                    } else {
                        fail(unit, own, UnitFailure.notAttempted(unit.relativePath(), UnitFailure.PARENT_FAILED,
                                "Parent was not transferred"));
                    }
                    return;
                }
                if (run.token().isCancelled()) {
                    abort(unit, own, "Run was cancelled");
                    return;
                }
                if (ledger.abortCause() != null) {
                    abort(unit, own, "Run aborted: " + ledger.abortCause().getMessage());
                    return;
                }
                transfer(unit, parentId, own);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                abort(unit, own, "Interrupted");
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected failure transferring {}", unit.relativePath(), ex);
                fail(unit, own, new UnitFailure(unit.relativePath(), ex.getClass().getSimpleName(),
                        String.valueOf(ex.getMessage()), false, 1, config.retryPolicy().maxAttempts(), Instant.now(),
                        List.of()));
            }
        }

        private void transfer(TransferUnit unit, long parentId, CompletableFuture<Long> own)
                throws InterruptedException {
            RetryPolicy policy = config.retryPolicy();
            UnitProgress progress = new UnitProgress();
            List<AttemptFailure> history = new ArrayList<>();
            int attempt = 0;
            while (true) {
                attempt++;
                if (attempt == 1) {
                    run.publish(TransferEvent.of(TransferEvent.Kind.STARTED, unit, attempt, unit.type().name()));
                }
                try {
                    UnitOperation.Completion completion = attempt(unit, parentId, progress);
                    ledger.record(unit.index(), UnitResult.success(unit, completion.status(), completion.remoteId()));
                    TransferEvent.Kind kind = completion.status() == UnitStatus.SKIPPED
                            ? TransferEvent.Kind.SKIPPED : TransferEvent.Kind.TRANSFERRED;
                    run.publish(TransferEvent.of(kind, unit, attempt, "appendage " + completion.remoteId()));
                    own.complete(completion.remoteId());
                    return;
                } catch (RemoteException ex) {
                    history.add(failedAttempt(attempt, ex, ex.isTransient()));
                    if (ex.isJobFatal()) {
                        LOGGER.error("{} failed with a job-level error, stopping the run: {}",
                                unit.relativePath(), ex.getMessage());
                        ledger.abort(ex);
                        fail(unit, own, record(unit, ex, true, attempt, history));
                        return;
                    }
                    if (!ex.isTransient() || !policy.hasAttemptsLeft(attempt) || run.token().isCancelled()) {
                        LOGGER.warn("Giving up on {} after {} attempt(s): {}", unit.relativePath(), attempt,
                                ex.getMessage());
                        fail(unit, own, record(unit, ex, false, attempt, history));
                        return;
                    }
                    Duration backoff = policy.backoffAfter(attempt);
                    history.set(history.size() - 1, history.get(history.size() - 1).withBackoff(backoff));
                    LOGGER.warn("Transfer of {} failed (attempt {}/{}), retrying in {} ms: {}", unit.relativePath(),
                            attempt, policy.maxAttempts(), backoff.toMillis(), ex.getMessage());
                    run.publish(TransferEvent.of(TransferEvent.Kind.RETRYING, unit, attempt + 1, ex.getMessage()));
                    if (run.token().sleep(backoff)) {
                        fail(unit, own, record(unit, ex, false, attempt, history));
                        return;
                    }
                } catch (ArchiveException ex) {
                    history.add(failedAttempt(attempt, ex, false));
                    LOGGER.warn("Transfer of {} failed: {}", unit.relativePath(), ex.getMessage());
                    fail(unit, own, record(unit, ex, false, attempt, history));
                    return;
                }
            }
        }

        private UnitOperation.Completion attempt(TransferUnit unit, long parentId, UnitProgress progress)
                throws ArchiveException, InterruptedException {
            Optional<Duration> timeout = config.unitTimeout();
            if (timeout.isEmpty()) {
                return operation.perform(unit, parentId, progress);
            }
            Future<UnitOperation.Completion> pending = attempts.submit(() -> operation.perform(unit, parentId, progress));
            try {
                return pending.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                pending.cancel(true);
                throw new TransferTimeoutException(unit.relativePath(), timeout.get());
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                if (cause instanceof ArchiveException) {
                    throw (ArchiveException) cause;
                }
                if (cause instanceof InterruptedException) {
                    throw (InterruptedException) cause;
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException(cause);
            } catch (InterruptedException ex) {
                pending.cancel(true);
                throw ex;
            }
        }

        private AttemptFailure failedAttempt(int attempt, ArchiveException ex, boolean retryable) {
            return new AttemptFailure(attempt, Instant.now(), ex.getClass().getSimpleName(), ex.getMessage(),
                    retryable, Duration.ZERO);
        }

        private UnitFailure record(TransferUnit unit, ArchiveException ex, boolean jobFatal, int attempts,
                                   List<AttemptFailure> history) {
            return new UnitFailure(unit.relativePath(), ex.getClass().getSimpleName(), ex.getMessage(), jobFatal,
                    attempts, config.retryPolicy().maxAttempts(), Instant.now(), history);
        }

        private void fail(TransferUnit unit, CompletableFuture<Long> own, UnitFailure failure) {
            ledger.record(unit.index(), UnitResult.failure(unit, failure));
            run.publish(TransferEvent.of(TransferEvent.Kind.FAILED, unit, failure.attempts(), failure.message()));
            own.completeExceptionally(new ParentUnavailable(false));
        }

        private void abort(TransferUnit unit, CompletableFuture<Long> own, String reason) {
            ledger.record(unit.index(), UnitResult.aborted(unit, reason));
            run.publish(TransferEvent.of(TransferEvent.Kind.ABORTED, unit, 0, reason));
            own.completeExceptionally(new ParentUnavailable(true));
        }
    }
}
