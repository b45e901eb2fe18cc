package org.broadinstitute.graphseg.segmentation.cost;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.spectral.SpectralFilter;
import org.broadinstitute.graphseg.utils.Utils;

/**
 * Graph-filtered sum-of-squares (GFSS) cost.
 *
 * <p>
 *     The signal is passed once through a graph-spectral low-pass {@link SpectralFilter} and the segment cost is the
 *     least-squares cost of {@link L2Cost} evaluated on the filtered signal.  Energy on graph frequencies above the
 *     filter cutoff (for example noise that is uncorrelated between neighboring nodes, or a shift confined to a
 *     single weakly connected node) is attenuated before the within-segment variance is measured, so the cost
 *     responds mainly to mean shifts that are smooth over the graph.
 * </p>
 *
 * <p>
 *     Filtering costs one {@code n x d x d} matrix product at {@link #fit(RealMatrix)}; afterwards each
 *     {@link Fitted#error(int, int)} is O(d).  The minimum admissible segment length is 1, as for {@link L2Cost}.
 * </p>
 */
public final class GFSSCost implements SegmentCost {

    private static final Logger logger = LogManager.getLogger(GFSSCost.class);

    private final SpectralFilter filter;

    /**
     * @param filter filter over the graph on whose nodes the signal lives.  Never {@code null}
     */
    public GFSSCost(final SpectralFilter filter) {
        this.filter = Utils.nonNull(filter, "The spectral filter cannot be null.");
    }

    /**
     * Builds the {@link SpectralFilter} from a Laplacian and a cutoff.
     *
     * @see SpectralFilter#build(RealMatrix, double)
     */
    public GFSSCost(final RealMatrix laplacian, final double rho) {
        this(SpectralFilter.build(laplacian, rho));
    }

    /**
     * @throws UserException.DimensionMismatch if the signal does not have one column per graph node
     */
    @Override
    public Fitted fit(final RealMatrix signal) {
        Utils.nonNull(signal, "The signal cannot be null.");
        final RealMatrix filteredSignal = filter.apply(signal);
        logger.debug(String.format("Filtered a signal of %d points over %d nodes (rho = %s).",
                filteredSignal.getRowDimension(), filteredSignal.getColumnDimension(), filter.getRho()));
        return new Fitted(filteredSignal, new SegmentSums(filteredSignal));
    }

    public SpectralFilter getFilter() {
        return filter;
    }

    @Override
    public String toString() {
        return String.format("GFSSCost(rho = %s)", filter.getRho());
    }

    /**
     * {@link GFSSCost} bound to a signal.
     */
    public static final class Fitted implements FittedSegmentCost {
        private final RealMatrix filteredSignal;
        private final SegmentSums sums;

        private Fitted(final RealMatrix filteredSignal, final SegmentSums sums) {
            this.filteredSignal = filteredSignal;
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

        /**
         * @return a copy of the filtered signal the costs are computed on
         */
        public RealMatrix getFilteredSignal() {
            return filteredSignal.copy();
        }
    }
}
