package org.broadinstitute.hcdetect.tools.corpus;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.hcdetect.utils.param.ParamUtils;

import java.io.Serializable;
import java.util.List;

/**
 * ArgumentCollection for Higher Criticism scoring of documents against a {@link CorpusTable}.
 */
public class HigherCriticismArgumentCollection implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ALPHA_LONG_NAME = "hc-alpha";
    public static final String STABLE_LONG_NAME = "hc-stable";
    public static final String LEAVE_ONE_OUT_LONG_NAME = "leave-one-out";
    public static final String PARALLEL_LEAVE_ONE_OUT_LONG_NAME = "parallel-leave-one-out";

    @Argument(
            doc = "Fraction of the smallest p-values searched for the Higher Criticism maximum (Range: 0 exclusive to 1).",
            fullName = ALPHA_LONG_NAME,
            optional = true
    )
    public double alpha = 0.45;

    @Argument(
            doc = "Use the stable Higher Criticism variant, which normalizes by the expected uniform quantile instead of " +
                    "the observed p-value.",
            fullName = STABLE_LONG_NAME,
            optional = true
    )
    public boolean stable = true;

    @Argument(
            doc = "Rank candidates against leave-one-out scores of the table merged with the candidate, instead of the " +
                    "table's cached internal scores.",
            fullName = LEAVE_ONE_OUT_LONG_NAME,
            optional = true
    )
    public boolean leaveOneOut = false;

    @Argument(
            doc = "Compute leave-one-out scores of the documents in parallel.",
            fullName = PARALLEL_LEAVE_ONE_OUT_LONG_NAME,
            optional = true
    )
    public boolean parallelLeaveOneOut = true;

    /**
     * @throws IllegalArgumentException if any argument is out of range.
     */
    public void validate() {
        ParamUtils.isPositive(alpha, "alpha must be positive");
        ParamUtils.inRange(alpha, 0, 1, "alpha must not be greater than 1");
    }

    /**
     * The mode requested by these arguments.
     */
    public RankEvaluator.Mode getMode() {
        return leaveOneOut ? RankEvaluator.Mode.LEAVE_ONE_OUT : RankEvaluator.Mode.INTERNAL;
    }

    /**
     * Creates a table with this collection's alpha and HC variant.
     */
    public CorpusTable createTable(final RealMatrix counts, final List<String> featureNames, final List<String> documentNames) {
        validate();
        return new CorpusTable(counts, featureNames, documentNames, stable, alpha);
    }
}
