package org.broadinstitute.graphseg.segmentation.cost;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Graph-agnostic least-squares cost: the sum over the segment of squared Euclidean deviations from the segment mean,
 * {@code sum_t ||y_t - mean(y)||^2}.
 *
 * <p>
 *     Single-point segments are admissible and have zero cost.
 * </p>
 */
public final class L2Cost implements SegmentCost {

    @Override
    public Fitted fit(final RealMatrix signal) {
        return new Fitted(new SegmentSums(signal));
    }

    @Override
    public String toString() {
        return "L2Cost";
    }

    /**
     * {@link L2Cost} bound to a signal.
     */
    public static final class Fitted implements FittedSegmentCost {
        private final SegmentSums sums;

        private Fitted(final SegmentSums sums) {
            this.sums = sums;
        }

        @Override
        public double error(final int start, final int end) {
            return sums.sumOfSquaredDeviations(start, end);
        }

        @Override
        public int getNumPoints() {
            return sums.getNumPoints();
        }

        @Override
        public int getNumDimensions() {
            return sums.getNumDimensions();
        }

        @Override
        public int getMinimumSegmentLength() {
            return SegmentSums.MINIMUM_SEGMENT_LENGTH;
        }
    }
}
