package org.broadinstitute.hcdetect.utils;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.MathArrays;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Vector and matrix helpers shared by the count-table code.
 */
public final class MathUtils {
    private MathUtils() {
    }

    public static double sum(final double[] values) {
        double s = 0.0;
        for (final double v : values) {
            s += v;
        }
        return s;
    }

    public static long sum(final int[] values) {
        long s = 0L;
        for (final int v : values) {
            s += v;
        }
        return s;
    }

    /**
     *  Return an array with column sums in each entry
     *
     * @param matrix Never {@code null}
     * @return Never {@code null}
     */
    public static double[] columnSums(final RealMatrix matrix) {
        Utils.nonNull(matrix);

        return IntStream.range(0, matrix.getColumnDimension())
                .mapToDouble(c -> sum(matrix.getColumn(c))).toArray();
    }

    /**
     *  Return an array with row sums in each entry
     *
     * @param matrix Never {@code null}
     * @return Never {@code null}
     */
    public static double[] rowSums(final RealMatrix matrix) {
        Utils.nonNull(matrix);

        return IntStream.range(0, matrix.getRowDimension())
                .mapToDouble(r -> sum(matrix.getRow(r))).toArray();
    }

    public static double dotProduct(double[] a, double[] b){
        return sum(MathArrays.ebeMultiply(a, b));
    }

    /**
     * Cosine of the angle between two count vectors.
     *
     * @return a value in [0, 1] for non-negative input, or {@link Double#NaN} if either vector is all zeros.
     */
    public static double cosineSimilarity(final int[] a, final int[] b) {
        Utils.nonNull(a);
        Utils.nonNull(b);
        Utils.validateArg(a.length == b.length, "Arrays must have same length");
        final double[] x = toDouble(a);
        final double[] y = toDouble(b);
        final double norms = FastMath.sqrt(dotProduct(x, x)) * FastMath.sqrt(dotProduct(y, y));
        return norms == 0 ? Double.NaN : dotProduct(x, y) / norms;
    }

    public static double[] toDouble(final int[] values) {
        return Arrays.stream(values).asDoubleStream().toArray();
    }
}
