package com.entity.network.exploration;

/**
 * Thrown when a traversal is asked to start from a node the graph does not contain.
 */
public class UnknownStartNodeException extends GraphExplorationException {

    private final String nodeId;

    public UnknownStartNodeException(String nodeId) {
        super("Start node not found in graph: " + nodeId);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
