package org.broadinstitute.hcdetect.tools.corpus;

import org.broadinstitute.hcdetect.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * HC score of a candidate with respect to a {@link CorpusTable}, together with its empirical rank among the table's
 * calibration scores.
 *
 * <p>
 *     Either number may be {@link Double#NaN} when it is undefined: the HC score when no p-value could be used, the rank
 *     when the calibration distribution is empty. Soft conditions met while computing the result (vocabulary
 *     realignment, mismatching HC variants) are listed in {@link #getWarnings()}.
 * </p>
 */
public final class HCRankResult {

    private final double hc;
    private final double rank;
    private final double threshold;
    private final List<String> significantFeatures;
    private final RankEvaluator.Mode mode;
    private final List<String> warnings;

    public HCRankResult(final double hc, final double rank, final double threshold, final List<String> significantFeatures,
                        final RankEvaluator.Mode mode, final List<String> warnings) {
        this.hc = hc;
        this.rank = rank;
        this.threshold = threshold;
        this.significantFeatures = Collections.unmodifiableList(Utils.nonNull(significantFeatures));
        this.mode = Utils.nonNull(mode);
        this.warnings = Collections.unmodifiableList(Utils.nonNull(warnings));
    }

    public double getHC() {
        return hc;
    }

    /**
     * The fraction of calibration scores below {@link #getHC()}, in [0, 1], or NaN.
     */
    public double getRank() {
        return rank;
    }

    /**
     * The p-value threshold attaining the HC score.
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * Features whose p-value is below {@link #getThreshold()}, in vocabulary order.
     */
    public List<String> getSignificantFeatures() {
        return significantFeatures;
    }

    /**
     * The mode actually used, which may differ from the requested one.
     */
    public RankEvaluator.Mode getMode() {
        return mode;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "HCRankResult{" +
                "hc=" + hc +
                ", rank=" + rank +
                ", threshold=" + threshold +
                ", significantFeatures=" + significantFeatures.size() +
                ", mode=" + mode +
                ", warnings=" + warnings.size() +
                '}';
    }
}
