package com.trendsentinel.core.detection;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Descriptive statistics shared by the detectors.
 */
final class SeriesStatistics {

    private SeriesStatistics() {
        // utility class, not instantiable
    }

    static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Population standard deviation of {@code values[from, to)}.
     */
    static double populationStd(double[] values, int from, int to, double mean) {
        double sumSquaredDiff = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (to - from));
    }

    /**
     * Sample (n - 1) standard deviation of {@code values[from, to)}.
     */
    static double sampleStd(double[] values, int from, int to, double mean) {
        double sumSquaredDiff = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (to - from - 1));
    }

    /**
     * Quantile by linear interpolation between closest ranks, position
     * {@code q * (n - 1)}.
     *
     * @param sorted ascending values
     * @param q      quantile in [0, 1]
     */
    static double quantile(double[] sorted, double q) {
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (pos - lower);
    }

    static double[] sortedCopy(double[] values, int from, int to) {
        double[] copy = Arrays.copyOfRange(values, from, to);
        Arrays.sort(copy);
        return copy;
    }

    static boolean allEqual(double[] values, int from, int to) {
        for (int i = from + 1; i < to; i++) {
            if (values[i] != values[from]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Positions of the observed (non-NaN) values.
     */
    static int[] observedIndices(double[] values) {
        return IntStream.range(0, values.length)
                .filter(i -> !Double.isNaN(values[i]))
                .toArray();
    }

    static double[] nanArray(int length) {
        double[] result = new double[length];
        Arrays.fill(result, Double.NaN);
        return result;
    }

    /**
     * Observed values only, in series order.
     */
    static double[] compact(double[] values, int[] observed) {
        double[] result = new double[observed.length];
        for (int k = 0; k < observed.length; k++) {
            result[k] = values[observed[k]];
        }
        return result;
    }
}
