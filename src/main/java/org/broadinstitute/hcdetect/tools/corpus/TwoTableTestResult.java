package org.broadinstitute.hcdetect.tools.corpus;

import org.broadinstitute.hcdetect.utils.Utils;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-feature comparison of two count tables: counts, p-values and the features selected by the HC threshold.
 */
public final class TwoTableTestResult {

    private final List<FeatureTestRecord> records;
    private final double hc;
    private final double threshold;

    public TwoTableTestResult(final List<FeatureTestRecord> records, final double hc, final double threshold) {
        this.records = Collections.unmodifiableList(Utils.nonNull(records));
        this.hc = hc;
        this.threshold = threshold;
    }

    /**
     * One record per feature, in vocabulary order.
     */
    public List<FeatureTestRecord> getRecords() {
        return records;
    }

    public double getHC() {
        return hc;
    }

    public double getThreshold() {
        return threshold;
    }

    public List<String> getSignificantFeatures() {
        return records.stream()
                .filter(FeatureTestRecord::isSignificant)
                .map(FeatureTestRecord::getFeature)
                .collect(Collectors.toList());
    }
}
