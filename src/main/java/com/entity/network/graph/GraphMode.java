package com.entity.network.graph;

/**
 * Edge orientation mode of a {@link Graph}.
 */
public enum GraphMode {
    /** Every edge is directed. */
    DIRECTED,
    /** Every edge is undirected. */
    UNDIRECTED,
    /** Directed and undirected edges may coexist. */
    MIXED
}
