package com.example.appendagetransfer;

import com.example.appendagetransfer.error.RemoteException;
import com.example.appendagetransfer.model.TransferUnit;
import com.example.appendagetransfer.model.WalkDiagnostic;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-use sequence of transfer units in parent-before-child order. Diagnostics
 * accumulate while the sequence is consumed.
 */
public interface UnitSource extends Iterator<TransferUnit> {
    List<WalkDiagnostic> diagnostics();

    /**
     * Failure that invalidated the whole walk, if any. Local walks never report one.
     */
    default RemoteException abortCause() {
        return null;
    }

    default Stream<TransferUnit> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
    }

    /**
     * Source over units that are already known.
     */
    static UnitSource of(List<TransferUnit> units, List<WalkDiagnostic> diagnostics) {
        Iterator<TransferUnit> iterator = List.copyOf(units).iterator();
        List<WalkDiagnostic> found = new ArrayList<>(diagnostics);
        return new UnitSource() {
            @Override
            public List<WalkDiagnostic> diagnostics() {
                return List.copyOf(found);
            }

            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public TransferUnit next() {
                return iterator.next();
            }
        };
    }
}
