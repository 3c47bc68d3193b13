package com.parallel.reduction.strategy;

/**
 * A reduction run that could not produce a complete total.
 */
public class ReductionException extends Exception {

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
