package org.broadinstitute.hcdetect.tools.corpus;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hcdetect.exceptions.HCDetectException;
import org.broadinstitute.hcdetect.exceptions.UserException;
import org.broadinstitute.hcdetect.utils.Utils;
import org.broadinstitute.hcdetect.utils.stats.HigherCriticism;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Scores candidate counts against a {@link CorpusTable} and ranks the score among calibration scores.
 *
 * <p>
 *     The rank of a score {@code hc} among calibration scores {@code S} is
 *     {@code (#{s in S : s < hc} + w) / (|S| + 1 - w)}, where {@code w} is 1 if the candidate is part of the table and 0
 *     otherwise. In {@link Mode#INTERNAL} mode {@code S} is the table's internal scores; in
 *     {@link Mode#LEAVE_ONE_OUT} mode it is the scores of each document against the table merged with the candidate,
 *     minus that document.
 * </p>
 */
public final class RankEvaluator {

    private static final Logger logger = LogManager.getLogger(RankEvaluator.class);

    public enum Mode {
        /** Rank against the table's cached internal scores. */
        INTERNAL,
        /** Rank against scores recomputed with the candidate added to the table. */
        LEAVE_ONE_OUT
    }

    private final Mode defaultMode;
    private final boolean parallelLeaveOneOut;

    public RankEvaluator() {
        this(new HigherCriticismArgumentCollection());
    }

    public RankEvaluator(final HigherCriticismArgumentCollection arguments) {
        Utils.nonNull(arguments, "the arguments cannot be null");
        arguments.validate();
        this.defaultMode = arguments.getMode();
        this.parallelLeaveOneOut = arguments.parallelLeaveOneOut;
    }

    /**
     * The mode used when none is given, {@link Mode#LEAVE_ONE_OUT} if the arguments asked for it.
     */
    public Mode getDefaultMode() {
        return defaultMode;
    }

    /**
     * Same as {@link #evaluate(CorpusTable, CorpusTable, Mode, boolean, Collection, Boolean)} in the default mode.
     */
    public HCRankResult evaluate(final CorpusTable table, final CorpusTable candidate, final boolean within,
                                 final Collection<String> maskedFeatures, final Boolean stbl) {
        return evaluate(table, candidate, defaultMode, within, maskedFeatures, stbl);
    }

    /**
     * Same as {@link #evaluate(CorpusTable, int[], Mode, boolean, Collection, Boolean)} in the default mode.
     */
    public HCRankResult evaluate(final CorpusTable table, final int[] candidateCounts, final boolean within,
                                 final Collection<String> maskedFeatures, final Boolean stbl) {
        return evaluate(table, candidateCounts, defaultMode, within, maskedFeatures, stbl);
    }

    /**
     * Scores another table's aggregate counts against {@code table}.
     * The candidate is realigned to the table's vocabulary if needed, with a notice in the result warnings.
     *
     * @see #evaluate(CorpusTable, int[], Mode, boolean, Collection, Boolean)
     */
    public HCRankResult evaluate(final CorpusTable table, final CorpusTable candidate, final Mode mode, final boolean within,
                                 final Collection<String> maskedFeatures, final Boolean stbl) {
        Utils.nonNull(table, "the table cannot be null");
        Utils.nonNull(candidate, "the candidate cannot be null");
        final List<String> warnings = new ArrayList<>();
        if (!table.hasSameVocabulary(candidate)) {
            warnings.add(CorpusTable.vocabularyMismatchMessage());
        }
        final int[] counts = table.conform(candidate).getAggregateCounts();
        return evaluate(table, counts, mode, within, maskedFeatures, stbl, warnings);
    }

    /**
     * Computes the HC score of candidate counts against {@code table} and its rank among calibration scores.
     *
     * @param table the reference table.
     * @param candidateCounts counts in the table's vocabulary order.
     * @param mode where the calibration scores come from.
     * @param within whether the candidate is already part of {@code table}. Implies {@link Mode#INTERNAL}.
     * @param maskedFeatures features left out of the HC score, {@code null} for none. Names outside the vocabulary are ignored.
     * @param stbl the HC variant for the candidate, {@code null} for the table's.
     * @return never {@code null}.
     * @throws UserException.InvalidSubsetRelation if {@code within} is set and the candidate is not part of the table.
     * @throws UserException.InvalidInput if the leave-one-out distribution is empty.
     */
    public HCRankResult evaluate(final CorpusTable table, final int[] candidateCounts, final Mode mode, final boolean within,
                                 final Collection<String> maskedFeatures, final Boolean stbl) {
        return evaluate(table, candidateCounts, mode, within, maskedFeatures, stbl, new ArrayList<>());
    }

    private HCRankResult evaluate(final CorpusTable table, final int[] candidateCounts, final Mode mode, final boolean within,
                                  final Collection<String> maskedFeatures, final Boolean stbl, final List<String> warnings) {
        Utils.nonNull(table, "the table cannot be null");
        Utils.nonNull(mode, "the mode cannot be null");
        final boolean stable = stbl == null ? table.isStable() : stbl;

        final double[] pValues = table.pValuesAgainst(candidateCounts, within);
        mask(table, pValues, maskedFeatures == null ? Collections.emptyList() : maskedFeatures);
        final HigherCriticism.Result hc = HigherCriticism.compute(pValues, table.getAlpha(), stable);
        final List<String> significant = Arrays.stream(hc.significantIndices(pValues))
                .mapToObj(table.getFeatureNames()::get)
                .collect(Collectors.toList());

        Mode used = mode;
        if (mode == Mode.LEAVE_ONE_OUT && within) {
            warn(warnings, "The candidate is part of the table; ranking against the table's internal scores instead of leave-one-out scores.");
            used = Mode.INTERNAL;
        }

        final double[] calibration;
        switch (used) {
            case INTERNAL:
                if (stable != table.isStable()) {
                    warn(warnings, String.format("The candidate is scored with the %s HC variant but the table's internal " +
                            "scores use the %s variant; the rank may be misleading.", variantName(stable), variantName(table.isStable())));
                }
                calibration = table.getInternalScores();
                break;
            case LEAVE_ONE_OUT:
                calibration = leaveOneOutScores(table, candidateCounts, stable);
                if (calibration.length == 0) {
                    throw new UserException.InvalidInput("the leave-one-out score distribution is empty");
                }
                break;
            default:
                throw new HCDetectException.ShouldNeverReachHereException("Unknown mode " + used);
        }

        final double rank = rank(hc.getScore(), calibration, within);
        logger.debug(String.format("HC %f ranked %f among %d %s scores", hc.getScore(), rank, calibration.length, used));
        return new HCRankResult(hc.getScore(), rank, hc.getThreshold(), significant, used, warnings);
    }

    /**
     * Score of each document of {@code table} against the table merged with the candidate, minus that document.
     *
     * @param stbl the HC variant, {@code null} for the table's.
     * @return one score per document, in row order.
     */
    public double[] leaveOneOutScores(final CorpusTable table, final int[] candidateCounts, final Boolean stbl) {
        Utils.nonNull(table, "the table cannot be null");
        Utils.nonNull(candidateCounts, "the candidate counts cannot be null");
        Utils.validateArg(candidateCounts.length == table.numFeatures(), () -> String.format(
                "the candidate has %d counts but the table has %d features", candidateCounts.length, table.numFeatures()));
        final boolean stable = stbl == null ? table.isStable() : stbl;
        final double alpha = table.getAlpha();

        final int[] merged = table.getAggregateCounts();
        for (int i = 0; i < merged.length; i++) {
            Utils.validateArg(candidateCounts[i] >= 0, "counts must be non-negative");
            merged[i] += candidateCounts[i];
        }
        final RealMatrix counts = table.getCounts();
        final double[] scores = new double[counts.getRowDimension()];
        IntStream rows = IntStream.range(0, scores.length);
        if (parallelLeaveOneOut) {
            rows = rows.parallel();
        }
        rows.forEach(r -> scores[r] = CorpusTable.scoreAgainstRest(CountMatrixUtils.row(counts, r), merged, stable, alpha));
        return scores;
    }

    /**
     * Empirical rank of {@code score} among {@code calibration}.
     *
     * @return NaN if {@code score} is NaN or there is nothing to rank against.
     */
    static double rank(final double score, final double[] calibration, final boolean within) {
        final int adjustment = within ? 1 : 0;
        final int denominator = calibration.length + 1 - adjustment;
        if (Double.isNaN(score) || calibration.length == 0 || denominator <= 0) {
            return Double.NaN;
        }
        final long below = Arrays.stream(calibration).filter(s -> s < score).count();
        return (double) (below + adjustment) / denominator;
    }

    private static void mask(final CorpusTable table, final double[] pValues, final Collection<String> maskedFeatures) {
        for (final String feature : maskedFeatures) {
            final int index = table.featureIndex(feature);
            if (index >= 0) {
                pValues[index] = Double.NaN;
            } else {
                logger.debug("Ignoring masked feature outside the vocabulary: " + feature);
            }
        }
    }

    private static void warn(final List<String> warnings, final String message) {
        Utils.warnUser(logger, message);
        warnings.add(message);
    }

    private static String variantName(final boolean stable) {
        return stable ? "stable" : "classical";
    }
}
