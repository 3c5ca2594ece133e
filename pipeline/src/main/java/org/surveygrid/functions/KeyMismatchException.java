package org.surveygrid.functions;

import org.surveygrid.models.AggregateKey;

/**
 * Records with different aggregate keys were routed to the same accumulator.
 * This is an internal invariant violation and is never recovered from.
 */
public class KeyMismatchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public KeyMismatchException(AggregateKey expected, AggregateKey actual) {
        super("Cannot combine records with different keys: " + expected + " vs " + actual);
    }
}
