package com.example.appendagetransfer.model;

import com.example.appendagetransfer.error.PartialUploadException;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate outcome of one job operation. Every submitted unit appears in
 * {@code units}, in submission order.
 */
public record JobResult(
        String operation,
        String job,
        List<UnitResult> units,
        List<WalkDiagnostic> diagnostics,
        boolean cancelled,
        Instant startedAt,
        Instant finishedAt
) {
    public JobResult {
        units = List.copyOf(units);
        diagnostics = List.copyOf(diagnostics);
    }

    public List<UnitResult> successes() {
        return units.stream().filter(UnitResult::isSuccess).toList();
    }

    public List<UnitResult> failures() {
        return units.stream().filter(unit -> !unit.isSuccess()).toList();
    }

    /**
     * True when every unit succeeded and the walk lost nothing.
     */
    public boolean isComplete() {
        return !cancelled
                && units.stream().allMatch(UnitResult::isSuccess)
                && diagnostics.stream().noneMatch(WalkDiagnostic::error);
    }

    /**
     * True when some units failed while others succeeded.
     */
    public boolean isPartial() {
        return !isComplete() && !successes().isEmpty();
    }

    /**
     * Result of the top-level unit, which for single-unit operations is the only one.
     */
    public UnitResult root() {
        if (units.isEmpty()) {
            throw new IllegalStateException("No units were submitted for " + operation);
        }
        return units.get(0);
    }

    public void throwIfIncomplete() throws PartialUploadException {
        if (!isComplete()) {
            throw new PartialUploadException(this);
        }
    }
}
