package org.broadinstitute.graphseg.segmentation.cost;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.utils.Utils;
import org.broadinstitute.graphseg.utils.param.ParamUtils;

/**
 * Prefix sums of a signal and of its squared row norms, giving the within-segment sum of squared deviations
 * {@code sum_t ||y_t - mean(y)||^2} of any segment in O(d).
 *
 * <p>
 *     The columns are centred before accumulation.  The cost does not depend on a constant shift of the
 *     signal, and centring keeps the difference of the two accumulated terms from cancelling catastrophically
 *     when the signal sits far from zero.
 * </p>
 */
final class SegmentSums {

    static final int MINIMUM_SEGMENT_LENGTH = 1;

    private final int numPoints;
    private final int numDimensions;

    /**
     * {@code sums[t][j]} is the sum of column {@code j} over rows {@code [0, t)}.
     */
    private final double[][] sums;

    /**
     * {@code squaredNormSums[t]} is the sum of squared row norms over rows {@code [0, t)}.
     */
    private final double[] squaredNormSums;

    SegmentSums(final RealMatrix signal) {
        Utils.nonNull(signal, "The signal cannot be null.");
        ParamUtils.isFinite(signal, "The signal must contain only finite values.");
        numPoints = signal.getRowDimension();
        numDimensions = signal.getColumnDimension();
        if (numPoints == 0) {
            throw new UserException.EmptySignal();
        }

        final double[][] data = signal.getData();
        final double[] columnMeans = new double[numDimensions];
        for (final double[] row : data) {
            for (int j = 0; j < numDimensions; j++) {
                columnMeans[j] += row[j];
            }
        }
        for (int j = 0; j < numDimensions; j++) {
            columnMeans[j] /= numPoints;
        }

        sums = new double[numPoints + 1][numDimensions];
        squaredNormSums = new double[numPoints + 1];
        for (int t = 0; t < numPoints; t++) {
            double squaredNorm = 0.;
            for (int j = 0; j < numDimensions; j++) {
                final double centred = data[t][j] - columnMeans[j];
                sums[t + 1][j] = sums[t][j] + centred;
                squaredNorm += centred * centred;
            }
            squaredNormSums[t + 1] = squaredNormSums[t] + squaredNorm;
        }
    }

    double sumOfSquaredDeviations(final int start, final int end) {
        Utils.validateArg(0 <= start && start <= end && end <= numPoints,
                () -> String.format("Segment [%d, %d) does not lie within a signal of %d points.", start, end, numPoints));
        if (end - start < MINIMUM_SEGMENT_LENGTH) {
            throw new UserException.SegmentTooShort(start, end, MINIMUM_SEGMENT_LENGTH);
        }
        final int length = end - start;
        if (length == 1) {
            return 0.;
        }
        double squaredNormOfSum = 0.;
        for (int j = 0; j < numDimensions; j++) {
            final double sum = sums[end][j] - sums[start][j];
            squaredNormOfSum += sum * sum;
        }
        final double cost = squaredNormSums[end] - squaredNormSums[start] - squaredNormOfSum / length;
        // round-off can push a zero-variance segment slightly below zero
        return FastMath.max(0., cost);
    }

    int getNumPoints() {
        return numPoints;
    }

    int getNumDimensions() {
        return numDimensions;
    }
}
