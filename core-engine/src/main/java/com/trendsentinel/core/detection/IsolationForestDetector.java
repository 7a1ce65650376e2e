package com.trendsentinel.core.detection;

import com.trendsentinel.core.config.DetectorType;
import com.trendsentinel.core.error.DetectorUnavailableException;
import com.trendsentinel.core.error.InvalidParameterException;
import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Isolation forest detector over the features {@code [value, first
 * difference]}.
 *
 * <p>
 * Both features are standardized, then {@code trees} random isolation trees
 * are grown, each on a subsample of {@code sampleSize} observed points drawn
 * without replacement, to a depth limit of {@code ceil(log2(sampleSize))}.
 * The anomaly score of a point is {@code 2^(-E[h(x)] / c(sampleSize))}, where
 * {@code h} is the path length and {@code c} the average path length of an
 * unsuccessful binary search; scores lie in {@code [0, 1]}.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Every random choice is drawn from one {@link Random} seeded with the
 * configured seed, in a fixed order, so equal seeds give equal scores.
 * </p>
 *
 * <h3>Availability</h3>
 * <p>
 * Requires at least {@value #MIN_OBSERVED} observed points and, when the
 * sample size is explicit, no fewer observed points than the sample size.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestDetector.class);

    static final int MIN_OBSERVED = 8;
    static final int DEFAULT_MAX_SAMPLE = 256;

    private static final double EULER_GAMMA = 0.5772156649015329;
    private static final int FEATURES = 2;

    private final long seed;
    private final int trees;
    private final Integer sampleSize;
    private final double scoreThreshold;

    /**
     * @param seed           random seed
     * @param trees          number of trees, &gt;= 1
     * @param sampleSize     subsample per tree, or {@code null} for
     *                       {@code min(256, n)}
     * @param scoreThreshold score above which a point is an outlier, in (0, 1)
     * @throws InvalidParameterException if a parameter is out of range
     */
    public IsolationForestDetector(long seed, int trees, Integer sampleSize, double scoreThreshold) {
        if (trees < 1) {
            throw new InvalidParameterException("isolation_trees must be >= 1, got: " + trees);
        }
        if (sampleSize != null && sampleSize < 2) {
            throw new InvalidParameterException("isolation_sample_size must be >= 2, got: " + sampleSize);
        }
        if (!(scoreThreshold > 0 && scoreThreshold < 1)) {
            throw new InvalidParameterException(
                    "isolation_score_threshold must be in (0, 1), got: " + scoreThreshold);
        }
        this.seed = seed;
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.scoreThreshold = scoreThreshold;
    }

    @Override
    public List<DetectorResult> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.values();
        int[] observed = SeriesStatistics.observedIndices(values);
        int n = observed.length;
        if (n < MIN_OBSERVED) {
            throw new DetectorUnavailableException(getName(),
                    "needs at least " + MIN_OBSERVED + " observed points, got " + n);
        }
        if (sampleSize != null && sampleSize > n) {
            throw new DetectorUnavailableException(getName(),
                    "sample size " + sampleSize + " exceeds " + n + " observed points");
        }
        int psi = sampleSize != null ? sampleSize : Math.min(DEFAULT_MAX_SAMPLE, n);
        int depthLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));

        double[][] features = standardizedFeatures(SeriesStatistics.compact(values, observed));

        Random random = new Random(seed);
        int[] pool = new int[n];
        double[] pathSums = new double[n];
        for (int t = 0; t < trees; t++) {
            int[] sample = drawSample(pool, psi, random);
            Node root = grow(features, sample, 0, sample.length, 0, depthLimit, random);
            for (int k = 0; k < n; k++) {
                pathSums[k] += pathLength(root, features[k]);
            }
        }

        double normalizer = averagePathLength(psi);
        double[] scores = SeriesStatistics.nanArray(values.length);
        for (int k = 0; k < n; k++) {
            double meanPath = pathSums[k] / trees;
            scores[observed[k]] = Math.pow(2, -meanPath / normalizer);
        }

        List<DetectorResult> results = new ArrayList<>(values.length);
        int flagged = 0;
        for (int i = 0; i < values.length; i++) {
            boolean outlier = !Double.isNaN(scores[i]) && scores[i] > scoreThreshold;
            if (outlier) {
                flagged++;
            }
            results.add(new DetectorResult(getName(), series.timestampAt(i), scores[i], outlier));
        }
        LOG.debug("Series [{}]: isolation forest ({} trees, sample {}) flagged {} of {} point(s)",
                series.getKey(), trees, psi, flagged, n);
        return results;
    }

    @Override
    public String getName() {
        return DetectorType.ISOLATION.getDetectorName();
    }

    public long getSeed() {
        return seed;
    }

    public int getTrees() {
        return trees;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    // ---------------------------------------------------------------
    // Forest
    // ---------------------------------------------------------------

    /** Internal node ({@code feature >= 0}) or leaf ({@code feature < 0}). */
    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0, null, null, size);
        }
    }

    /**
     * Partial Fisher-Yates shuffle: the first {@code psi} entries of the pool
     * become the sample.
     */
    private static int[] drawSample(int[] pool, int psi, Random random) {
        for (int i = 0; i < pool.length; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < psi; i++) {
            int j = i + random.nextInt(pool.length - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[psi];
        System.arraycopy(pool, 0, sample, 0, psi);
        return sample;
    }

    private static Node grow(double[][] x, int[] idx, int from, int to, int depth, int depthLimit, Random random) {
        int size = to - from;
        if (depth >= depthLimit || size <= 1) {
            return Node.leaf(size);
        }
        int first = random.nextInt(FEATURES);
        for (int attempt = 0; attempt < FEATURES; attempt++) {
            int feature = (first + attempt) % FEATURES;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                min = Math.min(min, x[idx[i]][feature]);
                max = Math.max(max, x[idx[i]][feature]);
            }
            if (min == max) {
                continue;
            }
            double split = min + random.nextDouble() * (max - min);
            int mid = partition(x, idx, from, to, feature, split);
            Node left = grow(x, idx, from, mid, depth + 1, depthLimit, random);
            Node right = grow(x, idx, mid, to, depth + 1, depthLimit, random);
            return new Node(feature, split, left, right, size);
        }
        return Node.leaf(size);
    }

    /** Moves entries below {@code split} to the front; returns the boundary. */
    private static int partition(double[][] x, int[] idx, int from, int to, int feature, double split) {
        int store = from;
        for (int i = from; i < to; i++) {
            if (x[idx[i]][feature] < split) {
                int tmp = idx[store];
                idx[store] = idx[i];
                idx[i] = tmp;
                store++;
            }
        }
        return store;
    }

    private static double pathLength(Node root, double[] point) {
        Node node = root;
        int depth = 0;
        while (node.feature >= 0) {
            node = point[node.feature] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} nodes.
     */
    static double averagePathLength(int n) {
        if (n > 2) {
            double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
            return 2 * harmonic - 2.0 * (n - 1) / n;
        }
        return n == 2 ? 1 : 0;
    }

    private static double[][] standardizedFeatures(double[] values) {
        int n = values.length;
        double[][] features = new double[n][FEATURES];
        for (int k = 0; k < n; k++) {
            features[k][0] = values[k];
            features[k][1] = k == 0 ? 0 : values[k] - values[k - 1];
        }
        for (int f = 0; f < FEATURES; f++) {
            double sum = 0;
            for (double[] row : features) {
                sum += row[f];
            }
            double mean = sum / n;
            double sq = 0;
            for (double[] row : features) {
                sq += (row[f] - mean) * (row[f] - mean);
            }
            double std = Math.sqrt(sq / n);
            for (double[] row : features) {
                row[f] = std == 0 ? 0 : (row[f] - mean) / std;
            }
        }
        return features;
    }
}
