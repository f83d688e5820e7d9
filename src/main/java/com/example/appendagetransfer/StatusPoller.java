package com.example.appendagetransfer;

import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.model.JobRef;
import com.example.appendagetransfer.remote.ArchiveApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Observes the online flag of appendages after their bytes were sent.
 * <p>
 * An appendage seen online once is reported online from then on, even if a later
 * response says otherwise; the poller remembers the last {@value #REMEMBERED_ONLINE} of them.
 * Running out of time is not an error: the wait returns {@link Outcome#STILL_PROCESSING}
 * and the caller decides what that means.
 */
public class StatusPoller {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusPoller.class);
    static final int REMEMBERED_ONLINE = 10_000;

    public enum Outcome {
        ONLINE,
        /** Single poll: not online yet. */
        PROCESSING,
        /** Wait: the timeout elapsed before the appendage came online. */
        STILL_PROCESSING
    }

    private final ArchiveApi api;
    private final Duration pollInterval;
    private final Set<Long> observedOnline;

    public StatusPoller(ArchiveApi api, TransferConfig config) {
        this(api, config.pollInterval());
    }

    public StatusPoller(ArchiveApi api, Duration pollInterval) {
        this(api, pollInterval, REMEMBERED_ONLINE);
    }

    StatusPoller(ArchiveApi api, Duration pollInterval, int rememberedOnline) {
        this.api = api;
        this.pollInterval = pollInterval;
        this.observedOnline = Collections.synchronizedSet(Collections.newSetFromMap(
                new LinkedHashMap<Long, Boolean>() {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
                        return size() > rememberedOnline;
                    }
                }));
    }

    /**
     * Checks the appendage once without waiting.
     */
    public Outcome poll(JobRef job, long appendageId) throws RemoteException {
        if (observedOnline.contains(appendageId)) {
            return Outcome.ONLINE;
        }
        if (api.fetchAppendage(job, appendageId).online()) {
            observedOnline.add(appendageId);
            return Outcome.ONLINE;
        }
        return Outcome.PROCESSING;
    }

    /**
     * Polls until the appendage is online or the timeout elapses. Transient errors are
     * logged and polling continues until the deadline.
     */
    public Outcome awaitOnline(JobRef job, long appendageId, Duration timeout)
            throws RemoteException, InterruptedException {
        return observe(job, List.of(appendageId), timeout, new CancellationToken(), true).get(appendageId);
    }

    /**
     * Waits for several appendages against one shared deadline. Appendages that fail with a
     * non-transient error are left out of the returned map.
     */
    public Map<Long, Outcome> awaitAllOnline(JobRef job, List<Long> appendageIds, Duration timeout)
            throws InterruptedException {
        return awaitAllOnline(job, appendageIds, timeout, new CancellationToken());
    }

    Map<Long, Outcome> awaitAllOnline(JobRef job, List<Long> appendageIds, Duration timeout, CancellationToken token)
            throws InterruptedException {
        try {
            return observe(job, appendageIds, timeout, token, false);
        } catch (RemoteException ex) {
            throw new IllegalStateException("Lenient polling does not rethrow", ex);
        }
    }

    private Map<Long, Outcome> observe(JobRef job,
                                       List<Long> appendageIds,
                                       Duration timeout,
                                       CancellationToken token,
                                       boolean strict) throws RemoteException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Map<Long, Outcome> outcomes = new LinkedHashMap<>();
        Set<Long> pending = new LinkedHashSet<>(appendageIds);
        while (true) {
            for (Long id : List.copyOf(pending)) {
                try {
                    if (poll(job, id) == Outcome.ONLINE) {
                        outcomes.put(id, Outcome.ONLINE);
                        pending.remove(id);
                    }
                } catch (RemoteException ex) {
                    if (!ex.isTransient()) {
                        if (strict) {
                            throw ex;
                        }
                        LOGGER.warn("Cannot observe appendage {}: {}", id, ex.getMessage());
                        pending.remove(id);
                    } else {
                        LOGGER.debug("Status poll of appendage {} failed, will retry: {}", id, ex.getMessage());
                    }
                }
            }
            long remaining = deadline - System.nanoTime();
            if (pending.isEmpty() || remaining <= 0) {
                break;
            }
            Duration wait = Duration.ofNanos(Math.min(remaining, pollInterval.toNanos()));
            if (token.sleep(wait)) {
                break;
            }
        }
        for (Long id : pending) {
            outcomes.put(id, Outcome.STILL_PROCESSING);
        }
        if (!pending.isEmpty()) {
            LOGGER.info("{} appendage(s) of {} still processing after {} ms", pending.size(), job, timeout.toMillis());
        }
        return outcomes;
    }
}
