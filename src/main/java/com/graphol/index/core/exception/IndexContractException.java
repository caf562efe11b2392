package com.graphol.index.core.exception;

/**
 * Raised when a caller breaks the contract of the project index, e.g. by passing
 * an item that belongs to a different diagram. Signals a bug in the caller, not a
 * recoverable condition.
 */
public class IndexContractException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IndexContractException(String message) {
        super(message);
    }
}
