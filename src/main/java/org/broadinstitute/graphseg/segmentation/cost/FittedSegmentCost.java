package org.broadinstitute.graphseg.segmentation.cost;

import org.broadinstitute.graphseg.exceptions.UserException;

/**
 * A segment cost bound to a particular signal.
 *
 * <p>
 *     Implementations are immutable once fitted, so a single instance may be read concurrently by several searches.
 * </p>
 */
public interface FittedSegmentCost {

    /**
     * Cost of the half-open segment {@code [start, end)} of the fitted signal.
     *
     * @return a non-negative cost
     * @throws UserException.SegmentTooShort if {@code end - start} is below {@link #getMinimumSegmentLength()}
     * @throws IllegalArgumentException if the segment does not lie within {@code [0, getNumPoints()]}
     */
    double error(final int start, final int end);

    /**
     * Number of time points {@code n} of the fitted signal.
     */
    int getNumPoints();

    /**
     * Number of signal dimensions {@code d}.
     */
    int getNumDimensions();

    /**
     * Shortest segment for which {@link #error(int, int)} is defined.
     */
    int getMinimumSegmentLength();
}
