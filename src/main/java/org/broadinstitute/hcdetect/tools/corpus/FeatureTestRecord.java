package org.broadinstitute.hcdetect.tools.corpus;

import org.broadinstitute.hcdetect.utils.Utils;

/**
 * One feature's line in a {@link TwoTableTestResult}.
 */
public final class FeatureTestRecord {

    private final String feature;
    private final int referenceCount;
    private final int candidateCount;
    private final double pValue;
    private final boolean significant;

    public FeatureTestRecord(final String feature, final int referenceCount, final int candidateCount,
                             final double pValue, final boolean significant) {
        this.feature = Utils.nonNull(feature);
        this.referenceCount = referenceCount;
        this.candidateCount = candidateCount;
        this.pValue = pValue;
        this.significant = significant;
    }

    public String getFeature() {
        return feature;
    }

    public int getReferenceCount() {
        return referenceCount;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public double getPValue() {
        return pValue;
    }

    public boolean isSignificant() {
        return significant;
    }

    @Override
    public String toString() {
        return feature + "\t" + referenceCount + "\t" + candidateCount + "\t" + pValue + "\t" + significant;
    }
}
