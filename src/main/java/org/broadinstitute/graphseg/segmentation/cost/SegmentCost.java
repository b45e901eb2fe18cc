package org.broadinstitute.graphseg.segmentation.cost;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.utils.Utils;

import java.util.Arrays;

/**
 * Additive cost of contiguous signal segments, used by the change-point search.
 *
 * <p>
 *     Signals are {@code n x d} matrices whose rows are time points and whose columns are dimensions
 *     (graph nodes).  {@link #fit(RealMatrix)} performs all per-signal precomputation and returns an
 *     immutable {@link FittedSegmentCost}.
 * </p>
 */
public interface SegmentCost {

    /**
     * Binds this cost to a signal.
     *
     * @param signal {@code n x d} signal.  Never {@code null}
     * @throws UserException.DimensionMismatch if the cost is tied to a fixed number of dimensions that the signal does not have
     */
    FittedSegmentCost fit(final RealMatrix signal);

    /**
     * Binds this cost to a signal given as rows of observations.
     *
     * @param signal array of {@code n} rows of equal length {@code d}.  Never {@code null}
     * @throws UserException.EmptySignal if there are no rows or the rows are empty
     */
    default FittedSegmentCost fit(final double[][] signal) {
        Utils.nonNull(signal, "The signal cannot be null.");
        if (signal.length == 0) {
            throw new UserException.EmptySignal();
        }
        if (signal[0] == null || signal[0].length == 0) {
            throw new UserException.EmptySignal("observations must have at least one dimension.");
        }
        Utils.validateArg(Arrays.stream(signal).allMatch(row -> row != null && row.length == signal[0].length),
                "All observations must have the same number of dimensions.");
        return fit(MatrixUtils.createRealMatrix(signal));
    }
}
