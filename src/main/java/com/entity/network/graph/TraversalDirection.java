package com.entity.network.graph;

/**
 * Which directed edges a traversal may follow. Undirected edges are always followed.
 */
public enum TraversalDirection {
    /** Follow directed edges both ways. */
    ALL,
    /** Follow directed edges from source to target only. */
    FORWARD,
    /** Follow directed edges from target to source only. */
    BACKWARD
}
