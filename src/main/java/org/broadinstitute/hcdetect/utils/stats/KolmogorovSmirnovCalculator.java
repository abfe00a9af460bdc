package org.broadinstitute.hcdetect.utils.stats;

import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.hcdetect.utils.Utils;

/**
 * Two-sample Kolmogorov-Smirnov test over count histograms.
 * The reference histogram is fixed at construction; each sample histogram is compared with it bin by bin, the bins
 * being the features in vocabulary order.
 */
public class KolmogorovSmirnovCalculator {
    private static final double KS_SUM_CAUCHY_CRITERION = 1e-20;
    private static final int MAXIMUM_PARTIAL_SUM_COUNT = 100000;

    private final long referenceTotal;
    private final double[] referenceCdf;

    /**
     * The statistic and asymptotic p-value of a two-sample test.
     */
    public static final class Result {
        private final double statistic;
        private final double pValue;

        public Result(final double statistic, final double pValue) {
            this.statistic = statistic;
            this.pValue = pValue;
        }

        public double getStatistic() {
            return statistic;
        }

        public double getPValue() {
            return pValue;
        }

        @Override
        public String toString() {
            return "KS{statistic=" + statistic + ", pValue=" + pValue + '}';
        }
    }

    /**
     * @throws IllegalArgumentException if the histogram has a negative bin or no counts.
     */
    public KolmogorovSmirnovCalculator(final int[] referenceHistogram) {
        Utils.nonNull(referenceHistogram, "the reference histogram cannot be null");
        referenceTotal = total(referenceHistogram, "reference");
        referenceCdf = new double[referenceHistogram.length];
        long cumulative = 0L;
        for (int i = 0; i < referenceHistogram.length; i++) {
            cumulative += referenceHistogram[i];
            referenceCdf[i] = (double) cumulative / referenceTotal;
        }
    }

    /**
     * The largest absolute difference between the reference and sample empirical CDFs.
     */
    public double statistic(final int[] sampleHistogram) {
        final long sampleTotal = sampleTotal(sampleHistogram);
        double maxDifference = 0.0;
        long cumulative = 0L;
        for (int i = 0; i < sampleHistogram.length; i++) {
            cumulative += sampleHistogram[i];
            maxDifference = FastMath.max(maxDifference, FastMath.abs(referenceCdf[i] - (double) cumulative / sampleTotal));
        }
        return maxDifference;
    }

    /**
     * Runs the two-sample test with the asymptotic Kolmogorov distribution for the p-value.
     */
    public Result test(final int[] sampleHistogram) {
        final long sampleTotal = sampleTotal(sampleHistogram);
        final double d = statistic(sampleHistogram);
        final double effectiveSize = (double) referenceTotal * sampleTotal / (referenceTotal + sampleTotal);
        final double pValue = 1.0 - new KolmogorovSmirnovTest()
                .ksSum(d * FastMath.sqrt(effectiveSize), KS_SUM_CAUCHY_CRITERION, MAXIMUM_PARTIAL_SUM_COUNT);
        return new Result(d, FastMath.max(0.0, FastMath.min(1.0, pValue)));
    }

    private long sampleTotal(final int[] sampleHistogram) {
        Utils.nonNull(sampleHistogram, "the sample histogram cannot be null");
        Utils.validateArg(sampleHistogram.length == referenceCdf.length, () -> String.format(
                "the sample histogram has %d bins but the reference has %d", sampleHistogram.length, referenceCdf.length));
        return total(sampleHistogram, "sample");
    }

    private static long total(final int[] histogram, final String which) {
        long total = 0L;
        for (final int count : histogram) {
            Utils.validateArg(count >= 0, () -> "the " + which + " histogram has a negative bin");
            total += count;
        }
        Utils.validateArg(total > 0, () -> "the " + which + " histogram is empty");
        return total;
    }
}
