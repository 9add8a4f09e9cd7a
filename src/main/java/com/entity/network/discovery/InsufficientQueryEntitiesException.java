package com.entity.network.discovery;

import com.entity.network.exploration.GraphExplorationException;

/**
 * Thrown when a discovery is asked for fewer than two distinct query entities.
 */
public class InsufficientQueryEntitiesException extends GraphExplorationException {

    private final int suppliedCount;

    public InsufficientQueryEntitiesException(int suppliedCount) {
        super("Network discovery needs at least 2 distinct query entities, got " + suppliedCount);
        this.suppliedCount = suppliedCount;
    }

    public int getSuppliedCount() {
        return suppliedCount;
    }
}
