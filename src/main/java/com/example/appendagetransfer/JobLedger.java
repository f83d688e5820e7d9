package com.example.appendagetransfer;

import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.UnitResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-run state shared by the workers: the outcome of each unit and the remote id each
 * unit hands to its children. Both live behind one lock; writes happen once per unit.
 */
final class JobLedger {
    private final ReentrantLock lock = new ReentrantLock();
    private final List<UnitResult> results = new ArrayList<>();
    private final Map<Integer, CompletableFuture<Long>> remoteIds = new HashMap<>();
    private final List<CompletableFuture<Void>> finished = new ArrayList<>();
    private RemoteException abortCause;

    /**
     * Registers a unit and returns the future its remote id will complete.
     */
    CompletableFuture<Long> register(TransferUnit unit) {
        lock.lock();
        try {
            while (results.size() <= unit.index()) {
                results.add(null);
            }
            CompletableFuture<Long> remoteId = new CompletableFuture<>();
            remoteIds.put(unit.index(), remoteId);
            finished.add(remoteId.handle((id, error) -> null));
            return remoteId;
        } finally {
            lock.unlock();
        }
    }

    CompletableFuture<Long> remoteIdOf(int index) {
        lock.lock();
        try {
            CompletableFuture<Long> remoteId = remoteIds.get(index);
            if (remoteId == null) {
                throw new IllegalStateException("Parent unit " + index + " was never registered");
            }
            return remoteId;
        } finally {
            lock.unlock();
        }
    }

    void record(int index, UnitResult result) {
        lock.lock();
        try {
            results.set(index, result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the run aborted; the first cause wins.
     */
    void abort(RemoteException cause) {
        lock.lock();
        try {
            if (abortCause == null) {
                abortCause = cause;
            }
        } finally {
            lock.unlock();
        }
    }

    RemoteException abortCause() {
        lock.lock();
        try {
            return abortCause;
        } finally {
            lock.unlock();
        }
    }

    CompletableFuture<Void> allFinished() {
        lock.lock();
        try {
            return CompletableFuture.allOf(finished.toArray(new CompletableFuture<?>[0]));
        } finally {
            lock.unlock();
        }
    }

    List<UnitResult> results() {
        lock.lock();
        try {
            return List.copyOf(results);
        } finally {
            lock.unlock();
        }
    }
}
