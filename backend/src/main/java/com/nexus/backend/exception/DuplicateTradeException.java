package com.nexus.backend.exception;

/**
 * Raised when opening a trade would create a second open position on the same symbol.
 */
public class DuplicateTradeException extends RuntimeException {

    public DuplicateTradeException(String symbol) {
        super("An OPEN trade already exists for " + symbol + ".");
    }

    public DuplicateTradeException(String symbol, Throwable cause) {
        super("An OPEN trade already exists for " + symbol + ".", cause);
    }
}
