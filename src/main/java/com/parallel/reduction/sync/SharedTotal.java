package com.parallel.reduction.sync;

/**
 * Running total that several workers contribute to concurrently.
 * Implementations never lose or tear an update.
 */
public interface SharedTotal {

    void add(long delta);

    /**
     * Current value; exact once every contributing worker has been joined.
     */
    long sum();
}
