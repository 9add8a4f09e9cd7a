package com.entity.network.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A partition of a graph into communities, numbered by the graph position of their first
 * member, with modularity and the nodes that link communities together.
 */
public final class CommunityStructure {

    private final List<Community> communities;
    private final Map<String, Integer> membership;
    private final Map<String, Set<Integer>> bridges;
    private final double modularity;

    private CommunityStructure(List<Community> communities, Map<String, Integer> membership,
                               Map<String, Set<Integer>> bridges, double modularity) {
        this.communities = List.copyOf(communities);
        this.membership = Collections.unmodifiableMap(membership);
        this.bridges = Collections.unmodifiableMap(bridges);
        this.modularity = modularity;
    }

    /**
     * Builds the structure from one label per node; labels only need to be equal within a
     * community.
     */
    static CommunityStructure of(Adjacency adjacency, int[] labels) {
        int n = adjacency.size();
        int[][] neighbors = adjacency.neighbors();

        Map<Integer, Integer> renumbered = new HashMap<>();
        int[] community = new int[n];
        for (int v = 0; v < n; v++) {
            community[v] = renumbered.computeIfAbsent(labels[v], label -> renumbered.size());
        }
        int count = renumbered.size();

        List<List<String>> members = new ArrayList<>(count);
        for (int c = 0; c < count; c++) {
            members.add(new ArrayList<>());
        }
        Map<String, Integer> membership = new LinkedHashMap<>();
        for (int v = 0; v < n; v++) {
            members.get(community[v]).add(adjacency.nodes().get(v));
            membership.put(adjacency.nodes().get(v), community[v]);
        }

        int[] internal = new int[count];
        int[] external = new int[count];
        long[] degreeSum = new long[count];
        long pairs = 0;
        Map<String, Set<Integer>> bridges = new LinkedHashMap<>();
        for (int v = 0; v < n; v++) {
            degreeSum[community[v]] += neighbors[v].length;
            Set<Integer> linked = new TreeSet<>();
            linked.add(community[v]);
            for (int w : neighbors[v]) {
                linked.add(community[w]);
                if (w <= v) {
                    continue;
                }
                pairs++;
                if (community[v] == community[w]) {
                    internal[community[v]]++;
                } else {
                    external[community[v]]++;
                    external[community[w]]++;
                }
            }
            if (linked.size() > 1) {
                bridges.put(adjacency.nodes().get(v), Collections.unmodifiableSet(linked));
            }
        }

        List<Community> communities = new ArrayList<>(count);
        double modularity = 0.0;
        for (int c = 0; c < count; c++) {
            int size = members.get(c).size();
            double cohesion = size <= 1 ? 0.0 : internal[c] / ((double) size * (size - 1) / 2.0);
            communities.add(new Community(c, members.get(c), internal[c], external[c], cohesion));
            if (pairs > 0) {
                double share = degreeSum[c] / (2.0 * pairs);
                modularity += (double) internal[c] / pairs - share * share;
            }
        }
        return new CommunityStructure(communities, membership, bridges, modularity);
    }

    public List<Community> getCommunities() {
        return communities;
    }

    public int count() {
        return communities.size();
    }

    /**
     * Returns the community index per node, in graph order.
     */
    public Map<String, Integer> getMembership() {
        return membership;
    }

    public Optional<Community> communityOf(String nodeId) {
        Integer id = membership.get(nodeId);
        return id != null ? Optional.of(communities.get(id)) : Optional.empty();
    }

    /**
     * Returns the other members of the node's community; empty for an unknown node.
     */
    public List<String> membersWith(String nodeId) {
        return communityOf(nodeId)
                .map(community -> {
                    List<String> others = new ArrayList<>(community.members());
                    others.remove(nodeId);
                    return List.copyOf(others);
                })
                .orElse(List.of());
    }

    /**
     * Nodes adjacent to another community, with every community they touch including their own.
     */
    public Map<String, Set<Integer>> getBridges() {
        return bridges;
    }

    /**
     * Newman modularity of the partition with unit edge weights; 0 for a graph without edges.
     */
    public double getModularity() {
        return modularity;
    }

    /**
     * Up to {@code limit} communities, largest first. Equal sizes keep community order.
     */
    public List<Community> largest(int limit) {
        List<Community> sorted = new ArrayList<>(communities);
        sorted.sort(Comparator.comparingInt(Community::size).reversed());
        return List.copyOf(sorted.subList(0, Math.max(0, Math.min(limit, sorted.size()))));
    }

    @Override
    public String toString() {
        return "CommunityStructure{" +
                "communities=" + communities.size() +
                ", bridges=" + bridges.size() +
                ", modularity=" + modularity +
                '}';
    }
}
