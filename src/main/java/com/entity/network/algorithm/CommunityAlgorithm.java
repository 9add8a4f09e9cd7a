package com.entity.network.algorithm;

import com.entity.network.graph.Graph;

/**
 * Partitions the undirected simple view of a graph into communities. Every node belongs to
 * exactly one community; isolated nodes form their own.
 */
public interface CommunityAlgorithm {

    CommunityStructure detect(Graph graph);
}
