package com.entity.network.algorithm;

import java.util.List;

/**
 * One detected community.
 *
 * @param id            index in {@link CommunityStructure#getCommunities()}
 * @param members       member node ids in graph order
 * @param internalEdges linked member pairs
 * @param externalEdges linked pairs with one member outside the community
 * @param cohesion      internal edges over all possible member pairs, 0 for a single member
 */
public record Community(int id, List<String> members, int internalEdges, int externalEdges, double cohesion) {

    public Community {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
