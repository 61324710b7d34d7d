package com.simpla.reconciliation.engine;

/**
 * Input documents missing structural fields the reconciliation cannot do without.
 */
public class MalformedInputException extends Exception {
    public MalformedInputException(String message) {
        super(message);
    }
}
