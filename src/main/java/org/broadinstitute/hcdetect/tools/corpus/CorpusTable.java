package org.broadinstitute.hcdetect.tools.corpus;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.hcdetect.exceptions.HCDetectException;
import org.broadinstitute.hcdetect.exceptions.UserException;
import org.broadinstitute.hcdetect.utils.MathUtils;
import org.broadinstitute.hcdetect.utils.Utils;
import org.broadinstitute.hcdetect.utils.stats.HigherCriticism;
import org.broadinstitute.hcdetect.utils.stats.KolmogorovSmirnovCalculator;
import org.broadinstitute.hcdetect.utils.stats.PairwiseCountTest;
import org.broadinstitute.hcdetect.utils.stats.PowerDivergenceTest;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A document-by-feature count table with the statistics needed to score how unusual a sample is with respect to it.
 *
 * <p>
 *     Besides the counts, the table keeps the aggregate count of each feature and, for each document, its
 *     <em>internal score</em>: the Higher Criticism (HC) of that document's counts tested against the counts of the
 *     rest of the table. The internal scores are the calibration distribution used by {@link RankEvaluator}.
 * </p>
 * <p>
 *     All derived state is recomputed from scratch whenever the counts change. {@link #realignVocabulary(List)} and
 *     {@link #merge(CorpusTable)} return new tables; {@link #collapse()} swaps this table's state in a single step.
 * </p>
 *
 * Developer note: any public constructor of this class must verify that features and document names do not contain duplicates.
 */
public final class CorpusTable implements Serializable {

    static final long serialVersionUID = 4512902281L;

    private static final Logger logger = LogManager.getLogger(CorpusTable.class);

    /**
     * Prefix of the document names generated when none are given.
     */
    public static final String DOCUMENT_NAME_PREFIX = "doc";

    /**
     * Name of the single document left by {@link #collapse()}.
     */
    public static final String COLLAPSED_DOCUMENT_NAME = "collapsed";

    /**
     * Unmodifiable feature list in the column order of the counts.
     */
    private final List<String> featureNames;

    private final Object2IntMap<String> featureIndex;

    private final boolean stable;

    private final double alpha;

    private volatile TableState state;

    /**
     * Everything that depends on the count matrix. Replaced as a whole, never modified.
     */
    private static final class TableState implements Serializable {
        private static final long serialVersionUID = 1L;

        private final List<String> documentNames;
        private final Map<String, Integer> documentIndex;
        private final RealMatrix counts;
        private final int[] aggregateCounts;
        private final int[] documentLengths;
        private final double[] internalScores;

        private TableState(final List<String> documentNames, final RealMatrix counts, final int[] aggregateCounts,
                           final int[] documentLengths, final double[] internalScores) {
            this.documentNames = documentNames;
            this.counts = counts;
            this.aggregateCounts = aggregateCounts;
            this.documentLengths = documentLengths;
            this.internalScores = internalScores;
            final Map<String, Integer> index = new HashMap<>();
            IntStream.range(0, documentNames.size()).forEach(i -> index.put(documentNames.get(i), i));
            this.documentIndex = Collections.unmodifiableMap(index);
        }
    }

    /**
     * The table's counts together with another table's counts, adjusted for the "within" relation.
     */
    static final class CountPair {
        final int[] reference;
        final int[] candidate;

        private CountPair(final int[] reference, final int[] candidate) {
            this.reference = reference;
            this.candidate = candidate;
        }
    }

    /**
     * Creates a table with generated document names that uses the stable HC variant.
     *
     * @param counts document-by-feature counts.
     * @param featureNames the feature of each column.
     */
    public CorpusTable(final RealMatrix counts, final List<String> featureNames) {
        this(counts, featureNames, Collections.emptyList(), true);
    }

    /**
     * Creates a new table.
     *
     * @see #CorpusTable(RealMatrix, List, List, boolean, double)
     */
    public CorpusTable(final RealMatrix counts, final List<String> featureNames, final List<String> documentNames,
                       final boolean stable) {
        this(counts, featureNames, documentNames, stable, HigherCriticism.DEFAULT_ALPHA);
    }

    /**
     * Creates a new table from an array of counts, one row per document.
     */
    public CorpusTable(final int[][] counts, final List<String> featureNames, final List<String> documentNames,
                       final boolean stable) {
        this(CountMatrixUtils.fromCounts(counts), featureNames, documentNames, stable);
    }

    /**
     * Creates a new table.
     * <p>
     *     The new instance will have its own copy of the feature list, document names and counts. Therefore the input
     *     arguments can be modified after this call safely.
     * </p>
     *
     * @param counts document-by-feature counts, non-negative integers, dense or sparse.
     * @param featureNames the feature of each column.
     * @param documentNames names of the first documents; may be {@code null} or shorter than the number of rows, in
     *                      which case the remaining rows are named {@code doc<row>}. Extra names are ignored.
     * @param stable whether to use the stable HC variant for this table.
     * @param alpha fraction of the smallest p-values used by HC.
     * @throws IllegalArgumentException if any of these is true:
     * <ul>
     *     <li>{@code counts} or {@code featureNames} is {@code null},</li>
     *     <li>{@code featureNames} or {@code documentNames} contains {@code null}s or duplicates,</li>
     *     <li>{@code featureNames} length does not match the number of columns,</li>
     *     <li>{@code counts} has no rows or contains anything but non-negative integers.</li>
     * </ul>
     * @throws UserException.InvalidInput if all counts are zero.
     */
    public CorpusTable(final RealMatrix counts, final List<String> featureNames, final List<String> documentNames,
                       final boolean stable, final double alpha) {
        this(featureNames, counts, documentNames, stable, alpha, true);
    }

    /**
     * Creates a new table with or without verifying field values and copying inputs.
     *
     * <p>
     *     Without verification the field values are supposed to be compatible with a consistent state. The mass of the
     *     counts is checked in both cases.
     * </p>
     */
    private CorpusTable(final List<String> featureNames, final RealMatrix counts, final List<String> documentNames,
                        final boolean stable, final double alpha, final boolean verifyInput) {
        final List<String> names;
        final RealMatrix matrix;
        if (verifyInput) {
            Utils.nonNull(counts, "the counts cannot be null");
            Utils.nonNull(featureNames, "the feature names cannot be null");
            Utils.containsNoNull(featureNames, "there are some null feature names");
            Utils.checkForDuplicatesAndReturnSet(featureNames, "feature names contain duplicates.");
            Utils.validateArg(counts.getColumnDimension() == featureNames.size(), () -> String.format(
                    "number of count columns (%d) does not match the number of features (%d)", counts.getColumnDimension(), featureNames.size()));
            Utils.validateArg(counts.getRowDimension() > 0, "there must be at least one document");
            Utils.validateArg(alpha > 0 && alpha <= 1, () -> "alpha must be in (0, 1]: " + alpha);
            CountMatrixUtils.validateCounts(counts);
            names = completeDocumentNames(documentNames == null ? Collections.emptyList() : documentNames, counts.getRowDimension());
            this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
            matrix = counts.copy();
        } else {
            names = documentNames;
            this.featureNames = featureNames;
            matrix = counts;
        }
        this.featureIndex = CountMatrixUtils.indexOf(this.featureNames);
        this.stable = stable;
        this.alpha = alpha;
        this.state = buildState(names, matrix, stable, alpha);
    }

    private static List<String> completeDocumentNames(final List<String> documentNames, final int numDocuments) {
        Utils.containsNoNull(documentNames, "there are some null document names");
        final List<String> result = new ArrayList<>(documentNames.subList(0, Math.min(documentNames.size(), numDocuments)));
        for (int i = result.size(); i < numDocuments; i++) {
            result.add(DOCUMENT_NAME_PREFIX + i);
        }
        Utils.checkForDuplicatesAndReturnSet(result, "document names contain duplicates.");
        return Collections.unmodifiableList(result);
    }

    /**
     * Computes every count-dependent field.
     */
    private static TableState buildState(final List<String> documentNames, final RealMatrix counts,
                                         final boolean stable, final double alpha) {
        final int[] aggregateCounts = CountMatrixUtils.columnSums(counts);
        if (MathUtils.sum(aggregateCounts) == 0) {
            throw new UserException.EmptyCountTable(counts.getRowDimension(), counts.getColumnDimension());
        }
        if (documentNames.size() != counts.getRowDimension()) {
            throw new HCDetectException.InconsistentTableState(String.format("%d document names for %d rows",
                    documentNames.size(), counts.getRowDimension()));
        }
        final int[] documentLengths = CountMatrixUtils.rowSums(counts);
        final double[] internalScores = computeInternalScores(counts, aggregateCounts, stable, alpha);
        logger.debug(String.format("Computed %d internal scores for a %d x %d count table",
                internalScores.length, counts.getRowDimension(), counts.getColumnDimension()));
        return new TableState(documentNames, counts, aggregateCounts, documentLengths, internalScores);
    }

    /**
     * HC score of each row against the rest of the table.
     *
     * @return an empty array if the table has a single row.
     */
    static double[] computeInternalScores(final RealMatrix counts, final int[] aggregateCounts, final boolean stable,
                                          final double alpha) {
        if (counts.getRowDimension() < 2) {
            return new double[0];
        }
        return IntStream.range(0, counts.getRowDimension())
                .mapToDouble(r -> scoreAgainstRest(CountMatrixUtils.row(counts, r), aggregateCounts, stable, alpha))
                .toArray();
    }

    /**
     * HC score of a document that is part of {@code aggregateCounts} against the remaining counts.
     */
    static double scoreAgainstRest(final int[] documentCounts, final int[] aggregateCounts, final boolean stable, final double alpha) {
        final int[] rest = new int[aggregateCounts.length];
        for (int i = 0; i < rest.length; i++) {
            rest[i] = aggregateCounts[i] - documentCounts[i];
        }
        return HigherCriticism.compute(PairwiseCountTest.pValues(documentCounts, rest), alpha, stable).getScore();
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    /**
     * Document names in row order.
     */
    public List<String> getDocumentNames() {
        return state.documentNames;
    }

    /**
     * Map from document names to their row.
     */
    public Map<String, Integer> getDocumentIndex() {
        return state.documentIndex;
    }

    public int numDocuments() {
        return state.documentNames.size();
    }

    public int numFeatures() {
        return featureNames.size();
    }

    public boolean isStable() {
        return stable;
    }

    public double getAlpha() {
        return alpha;
    }

    /**
     * The total count of each feature.
     * @return a copy, in vocabulary order.
     */
    public int[] getAggregateCounts() {
        return state.aggregateCounts.clone();
    }

    /**
     * The number of counted terms in each document.
     * @return a copy, in row order.
     */
    public int[] getDocumentLengths() {
        return state.documentLengths.clone();
    }

    /**
     * HC of each document against the rest of the table.
     * @return a copy, in row order; empty if the table has a single document.
     */
    public double[] getInternalScores() {
        return state.internalScores.clone();
    }

    /**
     * @return a copy of the count matrix.
     */
    public RealMatrix getCounts() {
        return state.counts.copy();
    }

    /**
     * The counts of one document.
     * @throws IllegalArgumentException if there is no such document.
     */
    public int[] getDocumentCounts(final String documentName) {
        final TableState current = state;
        return CountMatrixUtils.row(current.counts, documentRow(current, documentName));
    }

    private static int documentRow(final TableState state, final String documentName) {
        Utils.nonNull(documentName, "the document name cannot be null");
        final Integer row = state.documentIndex.get(documentName);
        Utils.validateArg(row != null, () -> String.format("document '%s' is not present in the table", documentName));
        return row;
    }

    /**
     * Whether another table has exactly this table's features, in the same order.
     */
    public boolean hasSameVocabulary(final CorpusTable other) {
        return featureNames.equals(Utils.nonNull(other).featureNames);
    }

    /**
     * Returns p-values of external counts with respect to this table's aggregate counts.
     *
     * @param counts feature counts in vocabulary order.
     * @param within whether {@code counts} are already part of this table, in which case they are subtracted from the
     *               aggregate counts before testing.
     * @return one p-value per feature.
     * @throws UserException.InvalidSubsetRelation if {@code within} is set and the subtraction leaves a negative count.
     * @throws IllegalArgumentException if {@code counts} does not have one entry per feature.
     */
    public double[] pValuesAgainst(final int[] counts, final boolean within) {
        Utils.nonNull(counts, "the counts cannot be null");
        Utils.validateArg(counts.length == featureNames.size(), () -> String.format(
                "the counts have %d entries but the table has %d features", counts.length, featureNames.size()));
        final int[] reference = within ? subtractWithin(state.aggregateCounts, counts) : state.aggregateCounts;
        return PairwiseCountTest.pValues(counts, reference);
    }

    /**
     * Returns p-values of another table's aggregate counts with respect to this table.
     * The other table is realigned to this vocabulary first if needed.
     */
    public double[] pValuesAgainst(final CorpusTable other) {
        return pValuesAgainst(conform(other).state.aggregateCounts, false);
    }

    private int[] subtractWithin(final int[] aggregate, final int[] counts) {
        final int[] result = new int[aggregate.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = aggregate[i] - counts[i];
            if (result[i] < 0) {
                throw new UserException.InvalidSubsetRelation(featureNames.get(i), aggregate[i], counts[i]);
            }
        }
        return result;
    }

    /**
     * Returns {@code other} if it shares this vocabulary, otherwise a copy realigned to it.
     */
    CorpusTable conform(final CorpusTable other) {
        Utils.nonNull(other, "the other table cannot be null");
        if (hasSameVocabulary(other)) {
            return other;
        }
        Utils.warnUser(logger, vocabularyMismatchMessage());
        return other.realignVocabulary(featureNames);
    }

    static String vocabularyMismatchMessage() {
        return "Features of the other table do not match this table. Realigning the other table to this vocabulary; " +
                "its features that are not part of this vocabulary are ignored.";
    }

    /**
     * Returns a table with the same documents whose columns follow {@code newVocabulary}.
     * <p>
     *     Counts of features in both vocabularies are copied, features that are new are zero-filled and features
     *     missing from {@code newVocabulary} are dropped.
     * </p>
     *
     * @param newVocabulary the new feature list, no {@code null}s nor duplicates.
     * @return never {@code null}, a new table with the same HC variant and fresh internal scores.
     * @throws UserException.InvalidInput if none of the counted features survives the realignment.
     */
    public CorpusTable realignVocabulary(final List<String> newVocabulary) {
        Utils.nonEmpty(newVocabulary, "the new vocabulary cannot be null nor empty");
        Utils.containsNoNull(newVocabulary, "the new vocabulary contains nulls");
        Utils.checkForDuplicatesAndReturnSet(newVocabulary, "the new vocabulary contains duplicates.");
        final TableState current = state;
        final RealMatrix realigned = CountMatrixUtils.realignColumns(current.counts, featureNames, newVocabulary);
        if (logger.isDebugEnabled()) {
            final long missing = newVocabulary.stream().filter(f -> !featureIndex.containsKey(f)).count();
            logger.debug(String.format("Realigned to a vocabulary of %d features, %d of them zero-filled", newVocabulary.size(), missing));
        }
        return new CorpusTable(Collections.unmodifiableList(new ArrayList<>(newVocabulary)), realigned,
                current.documentNames, stable, alpha, false);
    }

    /**
     * Returns a deep copy of this table.
     */
    public CorpusTable copy() {
        final TableState current = state;
        return new CorpusTable(featureNames, current.counts.copy(), current.documentNames, stable, alpha, false);
    }

    /**
     * Returns a new table with the documents of this table followed by those of {@code other}.
     *
     * <p>
     *     A document of {@code other} whose name is already taken is renamed {@code doc<i>}, with {@code i} the first
     *     number from its merged row index on that gives an unused name.
     * </p>
     *
     * @param other the table to add; realigned to this vocabulary if needed. {@code null} returns a copy of this table.
     * @return never {@code null}, a table with this table's vocabulary and HC variant.
     */
    public CorpusTable merge(final CorpusTable other) {
        if (other == null) {
            return copy();
        }
        final CorpusTable aligned = conform(other);
        final TableState current = state;
        final TableState added = aligned.state;
        final List<String> names = new ArrayList<>(current.documentNames);
        final Set<String> taken = new HashSet<>(current.documentNames);
        taken.addAll(added.documentNames);
        for (final String name : added.documentNames) {
            String unique = name;
            if (names.contains(name)) {
                int i = names.size();
                while (taken.contains(DOCUMENT_NAME_PREFIX + i)) {
                    i++;
                }
                unique = DOCUMENT_NAME_PREFIX + i;
                taken.add(unique);
                logger.debug(String.format("Renamed merged document %s to %s", name, unique));
            }
            names.add(unique);
        }
        return new CorpusTable(featureNames, CountMatrixUtils.stackRows(current.counts, added.counts),
                Collections.unmodifiableList(names), stable, alpha, false);
    }

    /**
     * Returns a single-document table with the counts of one document.
     *
     * @throws IllegalArgumentException if there is no such document.
     * @throws UserException.InvalidInput if that document has no counts.
     */
    public CorpusTable extractDocument(final String documentName) {
        final TableState current = state;
        final int row = documentRow(current, documentName);
        return new CorpusTable(featureNames, CountMatrixUtils.rowAsMatrix(current.counts, row),
                Collections.singletonList(documentName), stable, alpha, false);
    }

    /**
     * Replaces all documents with a single one holding the aggregate counts.
     * <p>
     *     The aggregate counts are unchanged and the internal scores become empty.
     * </p>
     */
    public void collapse() {
        final TableState current = state;
        final RealMatrix collapsed = CountMatrixUtils.singleRow(current.counts, current.aggregateCounts);
        state = buildState(Collections.singletonList(COLLAPSED_DOCUMENT_NAME), collapsed, stable, alpha);
    }

    /**
     * This table's aggregate counts and another table's, with the latter subtracted from the former if {@code within}.
     */
    CountPair countPair(final CorpusTable other, final boolean within) {
        final int[] candidate = conform(other).state.aggregateCounts.clone();
        final int[] aggregate = state.aggregateCounts;
        final int[] reference = within ? subtractWithin(aggregate, candidate) : aggregate.clone();
        return new CountPair(reference, candidate);
    }

    /**
     * Power divergence (chi-square family) test between this table and another.
     *
     * @param lambda the power divergence exponent, {@code null} for Pearson's chi-square.
     */
    public PowerDivergenceTest.Result chiSquare(final CorpusTable other, final boolean within, final Double lambda) {
        final CountPair pair = countPair(other, within);
        return PowerDivergenceTest.test(pair.reference, pair.candidate, lambda == null ? PowerDivergenceTest.PEARSON : lambda);
    }

    /**
     * Two-sample Kolmogorov-Smirnov test between this table and another, with the features in vocabulary order as bins.
     */
    public KolmogorovSmirnovCalculator.Result kolmogorovSmirnov(final CorpusTable other, final boolean within) {
        final CountPair pair = countPair(other, within);
        return new KolmogorovSmirnovCalculator(pair.reference).test(pair.candidate);
    }

    /**
     * Cosine similarity between the counts of this table and another's.
     */
    public double cosineSimilarity(final CorpusTable other, final boolean within) {
        final CountPair pair = countPair(other, within);
        return MathUtils.cosineSimilarity(pair.reference, pair.candidate);
    }

    /**
     * Per-feature comparison with another table: counts, p-values and the features below the HC threshold.
     *
     * @param stbl the HC variant to use, {@code null} for this table's.
     */
    public TwoTableTestResult twoTableTest(final CorpusTable other, final boolean within, final Boolean stbl) {
        final CountPair pair = countPair(other, within);
        final double[] pValues = PairwiseCountTest.pValues(pair.candidate, pair.reference);
        final HigherCriticism.Result hc = HigherCriticism.compute(pValues, alpha, stbl == null ? stable : stbl);
        final Set<Integer> significant = Arrays.stream(hc.significantIndices(pValues)).boxed().collect(Collectors.toSet());
        final List<FeatureTestRecord> records = IntStream.range(0, featureNames.size())
                .mapToObj(i -> new FeatureTestRecord(featureNames.get(i), pair.reference[i], pair.candidate[i],
                        pValues[i], significant.contains(i)))
                .collect(Collectors.toList());
        return new TwoTableTestResult(records, hc.getScore(), hc.getThreshold());
    }

    /**
     * Column index of a feature, or -1 if it is not part of the vocabulary.
     */
    int featureIndex(final String feature) {
        return featureIndex.getInt(feature);
    }

    @Override
    public String toString() {
        return String.format("CorpusTable{%d documents x %d features, stable=%s}", numDocuments(), numFeatures(), stable);
    }
}
