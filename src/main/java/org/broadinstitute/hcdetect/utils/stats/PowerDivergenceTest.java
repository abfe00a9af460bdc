package org.broadinstitute.hcdetect.utils.stats;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.hcdetect.utils.MathUtils;
import org.broadinstitute.hcdetect.utils.Utils;
import org.broadinstitute.hcdetect.utils.param.ParamUtils;

/**
 * Cressie-Read power divergence test of homogeneity for two count vectors, viewed as the two rows of a
 * 2 x F contingency table.
 *
 * <p>
 *     With observed counts {@code O} and expected counts {@code E} under independence the statistic is
 *     {@code 2 / (lambda (lambda + 1)) * sum O ((O / E)^lambda - 1)}, with the limits lambda = 0
 *     ({@code 2 sum O log(O / E)}) and lambda = -1 ({@code 2 sum E log(E / O)}). Columns with no counts in either
 *     row are dropped and the statistic has {@code F' - 1} degrees of freedom.
 * </p>
 */
public final class PowerDivergenceTest {

    /** Pearson's chi-square. */
    public static final double PEARSON = 1.0;
    /** G-test. */
    public static final double LOG_LIKELIHOOD = 0.0;
    public static final double FREEMAN_TUKEY = -0.5;
    public static final double MOD_LOG_LIKELIHOOD = -1.0;
    public static final double NEYMAN = -2.0;
    public static final double CRESSIE_READ = 2.0 / 3.0;

    private PowerDivergenceTest() {
    }

    /**
     * The statistic, its degrees of freedom and p-value.
     */
    public static final class Result {
        private final double statistic;
        private final double pValue;
        private final int degreesOfFreedom;

        public Result(final double statistic, final double pValue, final int degreesOfFreedom) {
            this.statistic = statistic;
            this.pValue = pValue;
            this.degreesOfFreedom = degreesOfFreedom;
        }

        public double getStatistic() {
            return statistic;
        }

        public double getPValue() {
            return pValue;
        }

        public int getDegreesOfFreedom() {
            return degreesOfFreedom;
        }

        @Override
        public String toString() {
            return "ChiSquare{statistic=" + statistic + ", pValue=" + pValue + ", df=" + degreesOfFreedom + '}';
        }
    }

    /**
     * Pearson's chi-square test.
     */
    public static Result test(final int[] countsA, final int[] countsB) {
        return test(countsA, countsB, PEARSON);
    }

    /**
     * Runs the test.
     *
     * @param countsA first row, non-negative counts.
     * @param countsB second row, non-negative counts, same length as {@code countsA}.
     * @param lambda the power divergence exponent, a finite number; see the named constants.
     * @return never {@code null}. If either row is empty the statistic and p-value are NaN; if fewer than two
     *  columns have counts the statistic is 0 with p-value 1.
     */
    public static Result test(final int[] countsA, final int[] countsB, final double lambda) {
        Utils.nonNull(countsA, "the first count vector cannot be null");
        Utils.nonNull(countsB, "the second count vector cannot be null");
        Utils.validateArg(countsA.length == countsB.length, "count vectors have different lengths");
        ParamUtils.isFinite(lambda, "lambda must be finite");

        final long totalA = MathUtils.sum(countsA);
        final long totalB = MathUtils.sum(countsB);
        final long total = totalA + totalB;
        int usedColumns = 0;
        double divergence = 0.0;
        for (int j = 0; j < countsA.length; j++) {
            ParamUtils.isPositiveOrZero(countsA[j], "counts must be non-negative");
            ParamUtils.isPositiveOrZero(countsB[j], "counts must be non-negative");
            final long columnTotal = (long) countsA[j] + countsB[j];
            if (columnTotal == 0) {
                continue;
            }
            usedColumns++;
            divergence += term(countsA[j], (double) totalA * columnTotal / total, lambda);
            divergence += term(countsB[j], (double) totalB * columnTotal / total, lambda);
        }
        final int degreesOfFreedom = Math.max(0, usedColumns - 1);
        if (totalA == 0 || totalB == 0) {
            return new Result(Double.NaN, Double.NaN, degreesOfFreedom);
        }
        if (degreesOfFreedom == 0) {
            return new Result(0.0, 1.0, 0);
        }

        final double statistic = scale(lambda) * divergence;
        final double pValue = Double.isInfinite(statistic) ? 0.0
                : 1.0 - new ChiSquaredDistribution(null, degreesOfFreedom).cumulativeProbability(statistic);
        return new Result(statistic, Math.max(0.0, pValue), degreesOfFreedom);
    }

    private static double scale(final double lambda) {
        if (lambda == 0.0 || lambda == -1.0) {
            return 2.0;
        }
        return 2.0 / (lambda * (lambda + 1));
    }

    private static double term(final double observed, final double expected, final double lambda) {
        if (lambda == 0.0) {
            return observed == 0 ? 0.0 : observed * FastMath.log(observed / expected);
        } else if (lambda == -1.0) {
            return observed == 0 ? Double.POSITIVE_INFINITY : expected * FastMath.log(expected / observed);
        } else if (observed == 0) {
            return lambda > -1.0 ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return observed * (FastMath.pow(observed / expected, lambda) - 1.0);
    }
}
