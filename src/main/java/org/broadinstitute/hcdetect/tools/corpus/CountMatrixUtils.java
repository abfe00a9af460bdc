package org.broadinstitute.hcdetect.tools.corpus;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DefaultRealMatrixPreservingVisitor;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.hcdetect.utils.MathUtils;
import org.broadinstitute.hcdetect.utils.Utils;
import org.broadinstitute.hcdetect.utils.param.ParamUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Count-matrix operations used by {@link CorpusTable}: sums, row access, vertical stacking and column realignment.
 *
 * <p>
 *     Matrices have one row per document and one column per feature. Any {@link RealMatrix} works; new matrices are
 *     created with {@link RealMatrix#createMatrix(int, int)} so that sparse inputs stay sparse.
 * </p>
 */
public final class CountMatrixUtils {

    private CountMatrixUtils() {
    }

    /**
     * Builds a dense count matrix from a rectangular array of counts.
     */
    public static RealMatrix fromCounts(final int[][] counts) {
        Utils.nonNull(counts, "the counts cannot be null");
        Utils.validateArg(counts.length > 0, "there must be at least one document");
        final int columns = Utils.nonNull(counts[0], "count rows cannot be null").length;
        final double[][] values = new double[counts.length][];
        for (int i = 0; i < counts.length; i++) {
            Utils.nonNull(counts[i], "count rows cannot be null");
            Utils.validateArg(counts[i].length == columns, "count rows must all have the same length");
            values[i] = MathUtils.toDouble(counts[i]);
        }
        return new Array2DRowRealMatrix(values, false);
    }

    /**
     * Checks that every entry is a non-negative integer count.
     * @throws IllegalArgumentException otherwise.
     */
    public static void validateCounts(final RealMatrix matrix) {
        Utils.nonNull(matrix, "the count matrix cannot be null");
        matrix.walkInOptimizedOrder(new DefaultRealMatrixPreservingVisitor() {
            @Override
            public void visit(final int document, final int feature, final double count) {
                ParamUtils.isCount(count, String.format("invalid count %s at document %d feature %d: counts must be non-negative integers",
                        count, document, feature));
            }
        });
    }

    /**
     * Column sums, i.e. the total count of each feature.
     */
    public static int[] columnSums(final RealMatrix matrix) {
        return toCounts(MathUtils.columnSums(matrix), "feature total");
    }

    /**
     * Row sums, i.e. the number of counted terms in each document.
     */
    public static int[] rowSums(final RealMatrix matrix) {
        return toCounts(MathUtils.rowSums(matrix), "document total");
    }

    /**
     * The counts of a single document.
     */
    public static int[] row(final RealMatrix matrix, final int rowIndex) {
        ParamUtils.inRange(rowIndex, 0, matrix.getRowDimension() - 1, "row index is out of range: " + rowIndex);
        return toCounts(matrix.getRow(rowIndex), "count");
    }

    /**
     * A one-row matrix holding the counts of a single document.
     */
    public static RealMatrix rowAsMatrix(final RealMatrix matrix, final int rowIndex) {
        ParamUtils.inRange(rowIndex, 0, matrix.getRowDimension() - 1, "row index is out of range: " + rowIndex);
        final RealMatrix result = matrix.createMatrix(1, matrix.getColumnDimension());
        result.setRow(0, matrix.getRow(rowIndex));
        return result;
    }

    /**
     * A one-row matrix with the given counts, of the same kind as {@code like}.
     */
    public static RealMatrix singleRow(final RealMatrix like, final int[] counts) {
        Utils.validateArg(counts.length == like.getColumnDimension(), "the row length does not match the number of columns");
        final RealMatrix result = like.createMatrix(1, counts.length);
        result.setRow(0, MathUtils.toDouble(counts));
        return result;
    }

    /**
     * Stacks {@code bottom} under {@code top}.
     *
     * @return a new matrix of the same kind as {@code top}; the inputs are not modified.
     * @throws IllegalArgumentException if the column counts differ.
     */
    public static RealMatrix stackRows(final RealMatrix top, final RealMatrix bottom) {
        Utils.nonNull(top);
        Utils.nonNull(bottom);
        Utils.validateArg(top.getColumnDimension() == bottom.getColumnDimension(), () -> String.format(
                "cannot stack matrices with different number of columns: %d != %d", top.getColumnDimension(), bottom.getColumnDimension()));
        final RealMatrix result = top.createMatrix(top.getRowDimension() + bottom.getRowDimension(), top.getColumnDimension());
        for (int i = 0; i < top.getRowDimension(); i++) {
            result.setRow(i, top.getRow(i));
        }
        for (int i = 0; i < bottom.getRowDimension(); i++) {
            result.setRow(top.getRowDimension() + i, bottom.getRow(i));
        }
        return result;
    }

    /**
     * Rearranges the columns of a count matrix to follow a new vocabulary.
     * <p>
     *     Column {@code j} of the result is the column of {@code newVocabulary.get(j)} in {@code matrix}, or all zeros if
     *     that feature is not part of {@code oldVocabulary}. Features missing from {@code newVocabulary} are dropped.
     * </p>
     *
     * @return a new matrix of the same kind as {@code matrix}.
     */
    public static RealMatrix realignColumns(final RealMatrix matrix, final List<String> oldVocabulary, final List<String> newVocabulary) {
        Utils.nonNull(matrix);
        Utils.nonNull(oldVocabulary);
        Utils.nonNull(newVocabulary);
        Utils.validateArg(matrix.getColumnDimension() == oldVocabulary.size(), "the old vocabulary does not match the matrix columns");
        final Object2IntMap<String> oldIndex = indexOf(oldVocabulary);
        final RealMatrix result = matrix.createMatrix(matrix.getRowDimension(), newVocabulary.size());
        for (int j = 0; j < newVocabulary.size(); j++) {
            final int source = oldIndex.getInt(newVocabulary.get(j));
            if (source >= 0) {
                result.setColumn(j, matrix.getColumn(source));
            }
        }
        return result;
    }

    /**
     * Position of each name in a list; absent names map to -1.
     */
    static Object2IntMap<String> indexOf(final List<String> names) {
        final Object2IntMap<String> result = new Object2IntOpenHashMap<>(names.size());
        result.defaultReturnValue(-1);
        for (int i = 0; i < names.size(); i++) {
            result.put(names.get(i), i);
        }
        return result;
    }

    private static int[] toCounts(final double[] values, final String what) {
        return Arrays.stream(values)
                .mapToInt(v -> ParamUtils.isCount(v, String.format("%s %s is not a valid count", what, v)))
                .toArray();
    }
}
