package com.entity.network.algorithm;

import com.entity.network.graph.Graph;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Exact measures from one breadth-first sweep per source node. Betweenness uses Brandes'
 * dependency accumulation; eigenvector centrality uses power iteration on {@code A + I}, which
 * shares the principal eigenvector of {@code A} and also converges on bipartite graphs.
 * The default implementation.
 */
public class BreadthFirstMetrics implements MetricsAlgorithm {

    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-6;

    @Override
    public Map<String, Double> centrality(Graph graph, CentralityMeasure measure) {
        Objects.requireNonNull(measure, "measure is required");
        Adjacency adjacency = Adjacency.of(graph);
        double[] scores = switch (measure) {
            case DEGREE -> degree(adjacency);
            case CLOSENESS -> closeness(adjacency);
            case BETWEENNESS -> betweenness(adjacency);
            case EIGENVECTOR -> eigenvector(adjacency);
        };
        return adjacency.toMap(scores);
    }

    @Override
    public int diameter(Graph graph) {
        return summarize(Adjacency.of(graph)).diameter();
    }

    @Override
    public int radius(Graph graph) {
        return summarize(Adjacency.of(graph)).radius();
    }

    @Override
    public double averagePathLength(Graph graph) {
        PathSummary summary = summarize(Adjacency.of(graph));
        return summary.pairs() == 0 ? 0.0 : (double) summary.totalLength() / summary.pairs();
    }

    /**
     * Source nodes the sweeps start from. Every node here; subclasses may sample.
     */
    protected int[] sources(Adjacency adjacency) {
        int[] sources = new int[adjacency.size()];
        for (int i = 0; i < sources.length; i++) {
            sources[i] = i;
        }
        return sources;
    }

    // ========== Path-based measures ==========

    private PathSummary summarize(Adjacency adjacency) {
        int diameter = 0;
        int radius = Integer.MAX_VALUE;
        long total = 0;
        long pairs = 0;
        for (int source : sources(adjacency)) {
            int eccentricity = 0;
            int[] distance = adjacency.distancesFrom(source);
            for (int d : distance) {
                if (d > 0) {
                    eccentricity = Math.max(eccentricity, d);
                    total += d;
                    pairs++;
                }
            }
            diameter = Math.max(diameter, eccentricity);
            radius = Math.min(radius, eccentricity);
        }
        return new PathSummary(diameter, radius == Integer.MAX_VALUE ? 0 : radius, total, pairs);
    }

    private record PathSummary(int diameter, int radius, long totalLength, long pairs) {}

    private double[] closeness(Adjacency adjacency) {
        int n = adjacency.size();
        long[] sum = new long[n];
        int[] reached = new int[n];
        for (int source : sources(adjacency)) {
            int[] distance = adjacency.distancesFrom(source);
            for (int v = 0; v < n; v++) {
                if (distance[v] > 0) {
                    sum[v] += distance[v];
                    reached[v]++;
                }
            }
        }
        double[] scores = new double[n];
        for (int v = 0; v < n; v++) {
            scores[v] = sum[v] == 0 ? 0.0 : (double) reached[v] / sum[v];
        }
        return scores;
    }

    private double[] betweenness(Adjacency adjacency) {
        int n = adjacency.size();
        double[] scores = new double[n];
        int[] sources = sources(adjacency);
        if (sources.length == 0) {
            return scores;
        }
        int[] distance = new int[n];
        double[] paths = new double[n];
        double[] dependency = new double[n];
        int[] order = new int[n];

        for (int source : sources) {
            Arrays.fill(distance, -1);
            Arrays.fill(paths, 0.0);
            Arrays.fill(dependency, 0.0);
            int head = 0;
            int tail = 0;
            distance[source] = 0;
            paths[source] = 1.0;
            order[tail++] = source;
            while (head < tail) {
                int v = order[head++];
                for (int w : adjacency.neighbors()[v]) {
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        order[tail++] = w;
                    }
                    if (distance[w] == distance[v] + 1) {
                        paths[w] += paths[v];
                    }
                }
            }
            // Predecessors of w are the neighbors one hop closer to the source
            for (int i = tail - 1; i > 0; i--) {
                int w = order[i];
                for (int v : adjacency.neighbors()[w]) {
                    if (distance[v] == distance[w] - 1) {
                        dependency[v] += paths[v] / paths[w] * (1.0 + dependency[w]);
                    }
                }
                scores[w] += dependency[w];
            }
        }

        // Each unordered pair is seen from both ends
        double scale = (double) n / sources.length / 2.0;
        for (int v = 0; v < n; v++) {
            scores[v] *= scale;
        }
        return scores;
    }

    // ========== Neighborhood measures ==========

    private static double[] degree(Adjacency adjacency) {
        int n = adjacency.size();
        double[] scores = new double[n];
        if (n <= 1) {
            return scores;
        }
        for (int v = 0; v < n; v++) {
            scores[v] = adjacency.neighbors()[v].length / (double) (n - 1);
        }
        return scores;
    }

    private static double[] eigenvector(Adjacency adjacency) {
        int n = adjacency.size();
        double[] current = new double[n];
        if (n == 0) {
            return current;
        }
        Arrays.fill(current, 1.0 / Math.sqrt(n));
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double[] next = new double[n];
            for (int v = 0; v < n; v++) {
                double score = current[v];
                for (int w : adjacency.neighbors()[v]) {
                    score += current[w];
                }
                next[v] = score;
            }
            double norm = 0.0;
            for (double score : next) {
                norm += score * score;
            }
            norm = Math.sqrt(norm);
            double change = 0.0;
            for (int v = 0; v < n; v++) {
                next[v] /= norm;
                change = Math.max(change, Math.abs(next[v] - current[v]));
            }
            current = next;
            if (change < TOLERANCE) {
                break;
            }
        }
        return current;
    }
}
