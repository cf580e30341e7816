package org.puneet.methcomp.regression;

import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.statistical.ConfidenceInterval;
import org.puneet.methcomp.statistical.ConfidenceIntervalCalculator;
import org.puneet.methcomp.util.ComparisonConfig;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Passing-Bablok regression: a non-parametric line fit built on the shifted
 * median of all pairwise slopes, robust to outliers and symmetric in the two
 * methods.
 *
 * <p>For every index pair {@code i < j} the slope {@code (y_j - y_i) / (x_j - x_i)}
 * is computed. Pairs with identical points, pairs with equal x (vertical) and
 * slopes of exactly -1 are excluded. With {@code N} retained slopes sorted
 * ascending and {@code K} of them below -1, the estimate is the median of the
 * sorted list shifted right by {@code K}. The confidence interval takes the
 * ranks {@code M1 = round((N - w) / 2)} and {@code M2 = N - M1 + 1} (1-based),
 * also shifted by {@code K}, where
 * {@code w = z * sqrt(n (n - 1) (2n + 5) / 18)}. All ranks are clamped into the
 * slope list.</p>
 *
 * <p>The intercept is {@code median(y) - slope * median(x)}; its interval
 * applies the same formula to each slope bound.</p>
 *
 * <p>Above the configured parallel threshold the slope rows are computed in
 * batches on the common pool. The merged list is sorted before ranking, so the
 * result does not depend on the split.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class PassingBablokEstimator implements Regressor<PassingBablokResult> {
    private static final Logger logger = LoggerFactory.getLogger(PassingBablokEstimator.class);

    public static final String METHOD = "Passing-Bablok";

    /** Rows handed to one asynchronous task in parallel mode. */
    private static final int ROWS_PER_BATCH = 64;

    @Override
    public String getName() {
        return METHOD;
    }

    @Override
    public PassingBablokResult fit(MeasurementSeries series, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        InputValidator.validateCount(series.size(), InputValidator.MIN_PAIRS, METHOD);

        int n = series.size();
        double level = config.getConfidenceLevel();
        double[] x = series.xValues();
        double[] y = series.yValues();
        boolean parallel = n >= config.getParallelThreshold();
        logger.info("Starting {} over {} pairs ({} slope computation)", METHOD, n,
            parallel ? "parallel" : "sequential");

        SlopeSet slopeSet = parallel ? computeParallel(x, y) : computeRows(x, y, 0, n);
        if (slopeSet.overflowRow >= 0) {
            throw StatisticalValidationException.numericOverflow(METHOD, "pairwise slope",
                slopeSet.overflowRow, n);
        }
        double[] slopes = slopeSet.toSortedArray();
        int count = slopes.length;
        logger.debug("{} slopes retained; excluded vertical={}, duplicate={}, minusOne={}",
            count, slopeSet.vertical, slopeSet.duplicate, slopeSet.minusOne);
        if (slopeSet.vertical > 0) {
            logger.warn("{}: {} pairs with equal x and different y were left out", METHOD, slopeSet.vertical);
        }

        if (count == 0) {
            throw StatisticalValidationException.degenerateRegression(METHOD, n,
                "no pairwise slope could be formed (all pairs vertical, identical or of slope -1)");
        }

        int offset = countBelowMinusOne(slopes);
        double slope = shiftedMedian(slopes, offset);

        double w = ConfidenceIntervalCalculator.zCritical(level)
            * Math.sqrt(n * (n - 1.0) * (2.0 * n + 5.0) / 18.0);
        long m1 = Math.round((count - w) / 2.0);
        // symmetric upper rank, not round((N + w) / 2)
        long m2 = count - m1 + 1;
        double slopeLower = ConfidenceIntervalCalculator.valueAtRank(slopes, m1 + offset - 1);
        double slopeUpper = ConfidenceIntervalCalculator.valueAtRank(slopes, m2 + offset - 1);
        logger.debug("N={}, K={}, w={}, M1={}, M2={}", count, offset, w, m1, m2);

        double medianX = ConfidenceIntervalCalculator.median(x);
        double medianY = ConfidenceIntervalCalculator.median(y);
        double intercept = medianY - slope * medianX;
        double interceptLower = medianY - slopeLower * medianX;
        double interceptUpper = medianY - slopeUpper * medianX;
        if (!Double.isFinite(intercept) || !Double.isFinite(interceptLower) || !Double.isFinite(interceptUpper)) {
            throw StatisticalValidationException.numericOverflow(METHOD, "intercept", null, n);
        }

        ConfidenceInterval slopeInterval = ConfidenceIntervalCalculator.ordered(
            slope, slopeLower, slopeUpper, level, n, "Rank");
        ConfidenceInterval interceptInterval = ConfidenceIntervalCalculator.ordered(
            intercept, interceptLower, interceptUpper, level, n, "Rank");

        PassingBablokResult result = new PassingBablokResult(slope, intercept, slopeInterval, interceptInterval,
            n, level, slopes, offset, slopeSet.vertical, slopeSet.duplicate, slopeSet.minusOne,
            medianX, medianY);
        logger.info("{} completed: {}", METHOD, result);
        return result;
    }

    /**
     * Median of the sorted slopes after shifting by {@code offset} positions.
     */
    static double shiftedMedian(double[] sorted, int offset) {
        int count = sorted.length;
        if (count % 2 == 1) {
            return ConfidenceIntervalCalculator.valueAtRank(sorted, count / 2 + offset);
        }
        double low = ConfidenceIntervalCalculator.valueAtRank(sorted, count / 2 - 1 + offset);
        double high = ConfidenceIntervalCalculator.valueAtRank(sorted, count / 2 + offset);
        return (low + high) / 2.0;
    }

    private static int countBelowMinusOne(double[] sorted) {
        int k = 0;
        while (k < sorted.length && sorted[k] < -1.0) {
            k++;
        }
        return k;
    }

    private static SlopeSet computeParallel(double[] x, double[] y) {
        int n = x.length;
        List<CompletableFuture<SlopeSet>> futures = new ArrayList<>();
        for (int start = 0; start < n; start += ROWS_PER_BATCH) {
            final int from = start;
            final int to = Math.min(start + ROWS_PER_BATCH, n);
            futures.add(CompletableFuture.supplyAsync(() -> computeRows(x, y, from, to)));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        SlopeSet merged = new SlopeSet();
        for (CompletableFuture<SlopeSet> future : futures) {
            merged.addAll(future.join());
        }
        logger.debug("Merged {} slope batches", futures.size());
        return merged;
    }

    /**
     * Slopes for the rows {@code i} in {@code [from, to)} against every {@code j > i}.
     * A difference or slope outside the double range marks its row as overflowed.
     */
    private static SlopeSet computeRows(double[] x, double[] y, int from, int to) {
        SlopeSet set = new SlopeSet();
        int n = x.length;
        for (int i = from; i < to; i++) {
            for (int j = i + 1; j < n; j++) {
                double dx = x[j] - x[i];
                double dy = y[j] - y[i];
                if (!Double.isFinite(dx) || !Double.isFinite(dy)) {
                    set.markOverflow(i);
                    continue;
                }
                if (dx == 0.0) {
                    if (dy == 0.0) {
                        set.duplicate++;
                    } else {
                        set.vertical++;
                    }
                    continue;
                }
                double s = dy / dx;
                if (!Double.isFinite(s)) {
                    set.markOverflow(i);
                    continue;
                }
                if (s == -1.0) {
                    set.minusOne++;
                    continue;
                }
                // normalise -0.0 so the sort order is plain numeric
                set.add(s == 0.0 ? 0.0 : s);
            }
        }
        return set;
    }

    /**
     * Growable slope buffer with exclusion counters.
     */
    private static final class SlopeSet {
        private double[] values = new double[16];
        private int size;
        private int vertical;
        private int duplicate;
        private int minusOne;
        private int overflowRow = -1;

        void markOverflow(int row) {
            if (overflowRow < 0) {
                overflowRow = row;
            }
        }

        void add(double value) {
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = value;
        }

        void addAll(SlopeSet other) {
            if (size + other.size > values.length) {
                values = Arrays.copyOf(values, Math.max(values.length * 2, size + other.size));
            }
            System.arraycopy(other.values, 0, values, size, other.size);
            size += other.size;
            vertical += other.vertical;
            duplicate += other.duplicate;
            minusOne += other.minusOne;
            // batches are merged in row order
            if (overflowRow < 0) {
                overflowRow = other.overflowRow;
            }
        }

        double[] toSortedArray() {
            double[] sorted = Arrays.copyOf(values, size);
            Arrays.sort(sorted);
            return sorted;
        }
    }
}
