package com.entity.network.algorithm;

/**
 * Runs the sweeps from at most {@code sampleSize} evenly strided source nodes instead of
 * every node. Diameter is then a lower bound and radius an upper bound; closeness and
 * betweenness are estimates, betweenness scaled up by {@code n / sampleSize}.
 * Graphs no larger than the sample are measured exactly.
 */
public class SampledMetrics extends BreadthFirstMetrics {

    public static final int DEFAULT_SAMPLE_SIZE = 100;

    private final int sampleSize;

    public SampledMetrics() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    public SampledMetrics(int sampleSize) {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be positive: " + sampleSize);
        }
        this.sampleSize = sampleSize;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    @Override
    protected int[] sources(Adjacency adjacency) {
        int n = adjacency.size();
        if (n <= sampleSize) {
            return super.sources(adjacency);
        }
        int[] sources = new int[sampleSize];
        int step = n / sampleSize;
        for (int i = 0; i < sampleSize; i++) {
            sources[i] = i * step;
        }
        return sources;
    }
}
