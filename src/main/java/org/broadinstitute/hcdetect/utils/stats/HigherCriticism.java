package org.broadinstitute.hcdetect.utils.stats;

import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.hcdetect.utils.Utils;
import org.broadinstitute.hcdetect.utils.param.ParamUtils;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Higher Criticism (HC) of a collection of p-values.
 *
 * <p>
 *     The non-NaN p-values are sorted ascending as {@code p(1) <= ... <= p(n)} and compared with their expected
 *     uniform quantiles {@code u(i) = i / n} over the first {@code k = max(1, floor(alpha * n))} ranks:
 * </p>
 * <ul>
 *     <li>stable HC: {@code z(i) = sqrt(n) (u(i) - p(i)) / sqrt(p(i) (1 - p(i)))},</li>
 *     <li>classical HC: the same with {@code p(i)} clipped to {@code [1/n, 1 - 1/n]} in the denominator.</li>
 * </ul>
 * <p>
 *     Ranks whose denominator vanishes ({@code p(i)} equal to 0 or 1 in the stable variant) are skipped.
 * </p>
 * <p>
 *     The score is the maximum {@code z(i)} (first maximizing rank on ties) and the threshold is the p-value at that
 *     rank. NaN p-values are uninformative: they are skipped but keep their position in the input array.
 * </p>
 */
public final class HigherCriticism {

    public static final double DEFAULT_ALPHA = 0.45;

    private HigherCriticism() {
    }

    /**
     * The outcome of an HC computation.
     */
    public static final class Result {
        private static final Result UNDEFINED = new Result(Double.NaN, Double.NaN);

        private final double score;
        private final double threshold;

        public Result(final double score, final double threshold) {
            this.score = score;
            this.threshold = threshold;
        }

        public double getScore() {
            return score;
        }

        public double getThreshold() {
            return threshold;
        }

        /**
         * Whether the score could be computed, i.e. there was at least one usable p-value.
         */
        public boolean isDefined() {
            return !Double.isNaN(score);
        }

        /**
         * Indices of the p-values strictly below the threshold. NaN p-values are never selected.
         *
         * @param pValues the p-values this result was computed from.
         * @return never {@code null}, increasing indices; empty when the result is undefined.
         */
        public int[] significantIndices(final double[] pValues) {
            Utils.nonNull(pValues, "the p-values cannot be null");
            if (!isDefined()) {
                return new int[0];
            }
            return IntStream.range(0, pValues.length)
                    .filter(i -> !Double.isNaN(pValues[i]) && pValues[i] < threshold)
                    .toArray();
        }

        @Override
        public String toString() {
            return "HC{score=" + score + ", threshold=" + threshold + '}';
        }
    }

    /**
     * Same as {@link #compute(double[], double, boolean)} with {@link #DEFAULT_ALPHA}.
     */
    public static Result compute(final double[] pValues, final boolean stable) {
        return compute(pValues, DEFAULT_ALPHA, stable);
    }

    /**
     * Computes the HC score and its threshold.
     *
     * @param pValues p-values in [0, 1] or NaN; the array is not modified.
     * @param alpha fraction of the smallest p-values to consider, in (0, 1].
     * @param stable whether to use the stable variant (unclipped p-value denominator).
     * @return never {@code null}; an undefined result (NaN score and threshold) if no rank qualifies.
     * @throws IllegalArgumentException if {@code pValues} is {@code null}, {@code alpha} is out of range or a
     *  p-value is outside [0, 1].
     */
    public static Result compute(final double[] pValues, final double alpha, final boolean stable) {
        Utils.nonNull(pValues, "the p-values cannot be null");
        Utils.validateArg(alpha > 0 && alpha <= 1, () -> "alpha must be in (0, 1]: " + alpha);

        final double[] sorted = Arrays.stream(pValues).filter(p -> !Double.isNaN(p)).toArray();
        final int n = sorted.length;
        if (n == 0) {
            return Result.UNDEFINED;
        }
        for (final double p : sorted) {
            ParamUtils.inRange(p, 0, 1, "p-values must be in [0, 1]: " + p);
        }
        Arrays.sort(sorted);

        final int k = Math.max(1, (int) FastMath.floor(alpha * n));
        final double sqrtN = FastMath.sqrt(n);
        final double lower = 1.0 / n;
        final double upper = 1.0 - lower;
        double bestScore = Double.NaN;
        double bestThreshold = Double.NaN;
        for (int i = 1; i <= k; i++) {
            final double p = sorted[i - 1];
            final double u = (double) i / n;
            // clipping needs a non-empty interval, i.e. n >= 2
            final double pc = !stable && lower <= upper ? FastMath.min(FastMath.max(p, lower), upper) : p;
            final double variance = pc * (1 - pc);
            if (variance <= 0) {
                continue;
            }
            final double z = sqrtN * (u - p) / FastMath.sqrt(variance);
            if (Double.isNaN(bestScore) || z > bestScore) {
                bestScore = z;
                bestThreshold = p;
            }
        }
        return Double.isNaN(bestScore) ? Result.UNDEFINED : new Result(bestScore, bestThreshold);
    }
}
