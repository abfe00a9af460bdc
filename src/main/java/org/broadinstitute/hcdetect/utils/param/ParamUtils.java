package org.broadinstitute.hcdetect.utils.param;

import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.util.MathUtils;

/**
 * Checks on numeric arguments. Each check returns its argument so it can be used inline, and throws an
 * {@link IllegalArgumentException} carrying the caller's message otherwise.
 *
 * NaN fails every check.
 */
public final class ParamUtils {
    private ParamUtils() {}

    /**
     * @return {@code val} if {@code min <= val <= max}.
     */
    public static double inRange(final double val, final double min, final double max, final String message) {
        if (!(val >= min && val <= max)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * @return {@code val} if it is not negative.
     */
    public static long isPositiveOrZero(final long val, final String message) {
        if (val < 0) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * @return {@code val} if it is strictly positive.
     */
    public static double isPositive(final double val, final String message) {
        if (!(val > 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * @return {@code val} if it is neither infinite nor NaN.
     */
    public static double isFinite(final double val, final String message) {
        try {
            MathUtils.checkFinite(val);
        } catch (final NotFiniteNumberException e) {
            throw new IllegalArgumentException(message, e);
        }
        return val;
    }

    /**
     * A matrix entry is a count if it is a finite non-negative integer that fits in an {@code int}.
     *
     * @return the count.
     */
    public static int isCount(final double val, final String message) {
        isFinite(val, message);
        if (val < 0 || val > Integer.MAX_VALUE || val != Math.rint(val)) {
            throw new IllegalArgumentException(message);
        }
        return (int) val;
    }
}
