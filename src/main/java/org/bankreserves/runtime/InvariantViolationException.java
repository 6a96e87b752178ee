package org.bankreserves.runtime;

/**
 * Signals a broken balance-sheet invariant: a negative cash, savings or loan balance,
 * or bank aggregates that no longer match the sum over all persons.
 * <p>
 * This is a programming defect, not a recoverable condition. The run is aborted.
 */
public class InvariantViolationException extends IllegalStateException {

    /**
     * @param message description of the violated invariant.
     */
    public InvariantViolationException(String message) {
        super(message);
    }
}
