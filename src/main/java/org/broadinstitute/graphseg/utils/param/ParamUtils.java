package org.broadinstitute.graphseg.utils.param;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.graphseg.utils.Utils;

/**
 * Numeric parameter checks that throw {@link IllegalArgumentException}.
 *
 * Double.NaN will generally cause a check to fail.  Note that any comparison with a NaN yields false.
 */
public final class ParamUtils {
    private ParamUtils () {}

    /**
     * Checks that the  input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositiveOrZero(final int val, final String message) {
        if (!(val >= 0)){
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that every entry of a matrix is finite, i.e. neither infinite nor NaN.
     * @param matrix matrix to check.  Never {@code null}
     * @param message the text message that would be pass to the exception thrown
     * @return the same matrix
     * @throws IllegalArgumentException if any entry is not finite
     */
    public static RealMatrix isFinite(final RealMatrix matrix, final String message) {
        Utils.nonNull(matrix, message);
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                if (!Double.isFinite(matrix.getEntry(i, j))) {
                    throw new IllegalArgumentException(message);
                }
            }
        }
        return matrix;
    }
}
