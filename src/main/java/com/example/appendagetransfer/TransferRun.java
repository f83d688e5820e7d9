package com.example.appendagetransfer;

import com.example.appendagetransfer.error.ArchiveException;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.model.JobResult;
import com.example.appendagetransfer.model.TransferEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Handle on a job operation running in the background.
 * <p>
 * {@link #events()} is a blocking stream of progress records that ends after the
 * {@link TransferEvent.Kind#FINISHED} event; it can be consumed once. {@link #cancel()} stops
 * unstarted units; appendages already created stay on the archive.
 */
public final class TransferRun {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransferRun.class);
    private static final TransferEvent POISON = new TransferEvent(TransferEvent.Kind.FINISHED, -1, "poison", 0,
            "poison", Instant.EPOCH);

    private final String operation;
    private final JobRef job;
    private final CancellationToken token = new CancellationToken();
    private final BlockingQueue<TransferEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<JobResult> result = new CompletableFuture<>();
    private boolean eventsTaken;

    TransferRun(String operation, JobRef job) {
        this.operation = operation;
        this.job = job;
    }

    /**
     * Executes the body on a dedicated thread and completes this run with its outcome.
     */
    TransferRun start(JobBody body) {
        Thread runner = new Thread(() -> run(body), "transfer-" + operation);
        runner.setDaemon(true);
        runner.start();
        return this;
    }

    private void run(JobBody body) {
        try {
            JobResult jobResult = body.execute(this);
            publish(TransferEvent.finished(jobResult.successes().size() + " of " + jobResult.units().size()
                    + " units succeeded"));
            result.complete(jobResult);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            publish(TransferEvent.finished("interrupted"));
            result.completeExceptionally(ex);
        } catch (ArchiveException | RuntimeException ex) {
            LOGGER.warn("{} on {} ended with {}", operation, job, ex.toString());
            publish(TransferEvent.finished(ex.getMessage()));
            result.completeExceptionally(ex);
        } finally {
            events.add(POISON);
        }
    }

    public String operation() {
        return operation;
    }

    public JobRef job() {
        return job;
    }

    public void cancel() {
        LOGGER.info("Cancelling {} on {}", operation, job);
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Waits for the run to finish.
     *
     * @throws com.example.appendagetransfer.error.JobAbortedException if a job-level precondition failed
     * @throws ArchiveException if the operation could not start (missing local root, invalid preview, ...)
     */
    public JobResult await() throws ArchiveException, InterruptedException {
        try {
            return result.get();
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
            throw new IllegalStateException("Unexpected failure of " + operation, cause);
        }
    }

    public synchronized Stream<TransferEvent> events() {
        if (eventsTaken) {
            throw new IllegalStateException("Events of this run were already consumed");
        }
        eventsTaken = true;
        Iterator<TransferEvent> iterator = new Iterator<>() {
            private TransferEvent next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next == null && !done) {
                    TransferEvent event = take();
                    if (event == POISON) {
                        done = true;
                    } else {
                        next = event;
                    }
                }
                return next != null;
            }

            @Override
            public TransferEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                TransferEvent event = next;
                next = null;
                return event;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    private TransferEvent take() {
        try {
            return events.take();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return POISON;
        }
    }

    CancellationToken token() {
        return token;
    }

    void publish(TransferEvent event) {
        events.add(event);
    }

    @FunctionalInterface
    interface JobBody {
        JobResult execute(TransferRun run) throws ArchiveException, InterruptedException;
    }
}
