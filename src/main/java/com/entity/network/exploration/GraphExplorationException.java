package com.entity.network.exploration;

/**
 * Base runtime exception for exploration and discovery calls whose input is structurally
 * unusable. Irregular but well-formed input (missing attributes, empty graphs) never raises it.
 */
public class GraphExplorationException extends RuntimeException {

    public GraphExplorationException(String message) {
        super(message);
    }

    public GraphExplorationException(String message, Throwable cause) {
        super(message, cause);
    }
}
