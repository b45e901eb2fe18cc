package org.broadinstitute.graphseg.segmentation;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.segmentation.cost.FittedSegmentCost;
import org.broadinstitute.graphseg.segmentation.cost.SegmentCost;
import org.broadinstitute.graphseg.utils.Utils;
import org.broadinstitute.graphseg.utils.config.ConfigFactory;
import org.broadinstitute.graphseg.utils.config.GraphSegConfig;
import org.broadinstitute.graphseg.utils.logging.OneShotLogger;

import java.util.List;

/**
 * Offline change-point detector combining a {@link SegmentCost} with the {@link OptimalPartitioner}.
 *
 * <pre>
 *     final SpectralFilter filter = SpectralFilter.build(laplacian, rho);
 *     final List&lt;Integer&gt; breakpoints = new GraphChangepointDetector(new GFSSCost(filter))
 *             .fit(signal)
 *             .predict(penalty);
 * </pre>
 *
 * <p>
 *     The breakpoint grid ({@code jump} and minimum segment size) defaults to the values in {@link GraphSegConfig}.
 *     Instances are not thread-safe: {@link #fit(RealMatrix)} replaces the fitted signal.
 * </p>
 */
public final class GraphChangepointDetector {

    private static final Logger logger = LogManager.getLogger(GraphChangepointDetector.class);

    private final SegmentCost cost;
    private final int jump;
    private final int minSize;
    private final OptimalPartitioner partitioner = new OptimalPartitioner();
    private final OneShotLogger approximateGridWarning = new OneShotLogger(GraphChangepointDetector.class);

    private FittedSegmentCost fittedCost;

    public GraphChangepointDetector(final SegmentCost cost) {
        this(cost, defaultConfig().segmentation_default_jump(), defaultConfig().segmentation_default_min_size());
    }

    /**
     * @param cost segment cost.  Never {@code null}
     * @param jump stride of the changepoint grid, at least 1
     * @param minSize minimum number of points per segment, at least 1
     * @throws UserException.InvalidGrid if {@code jump} or {@code minSize} is below 1
     */
    public GraphChangepointDetector(final SegmentCost cost, final int jump, final int minSize) {
        this.cost = Utils.nonNull(cost, "The segment cost cannot be null.");
        if (jump < 1 || minSize < 1) {
            throw new UserException.InvalidGrid(jump, minSize);
        }
        this.jump = jump;
        this.minSize = minSize;
    }

    /**
     * Fits the segment cost to {@code signal}, replacing any previously fitted signal.
     *
     * @param signal {@code n x d} signal.  Never {@code null}
     * @return this detector
     */
    public GraphChangepointDetector fit(final RealMatrix signal) {
        Utils.nonNull(signal, "The signal cannot be null.");
        return bind(cost.fit(signal));
    }

    /**
     * @param signal array of {@code n} rows of equal length {@code d}.  Never {@code null}
     * @throws UserException.EmptySignal if there are no rows or the rows are empty
     * @see #fit(RealMatrix)
     */
    public GraphChangepointDetector fit(final double[][] signal) {
        Utils.nonNull(signal, "The signal cannot be null.");
        return bind(cost.fit(signal));
    }

    private GraphChangepointDetector bind(final FittedSegmentCost fitted) {
        fittedCost = fitted;
        logger.debug(String.format("Fitted %s to a signal of %d points and %d dimensions.",
                cost, fittedCost.getNumPoints(), fittedCost.getNumDimensions()));
        return this;
    }

    /**
     * @return breakpoints of the optimal partition of the fitted signal, ending with the number of points
     * @throws IllegalStateException if no signal has been fitted
     */
    public List<Integer> predict(final double penalty) {
        return predictPartition(penalty).getBreakpoints();
    }

    /**
     * @return the optimal partition of the fitted signal together with its penalized cost
     * @throws IllegalStateException if no signal has been fitted
     */
    public Partition predictPartition(final double penalty) {
        Utils.validate(fittedCost != null, "A signal must be fitted before changepoints can be predicted.");
        if (jump > 1) {
            approximateGridWarning.warn(String.format(
                    "Changepoints are restricted to multiples of %d; the partition is optimal on that grid only.", jump));
        }
        final Partition partition = partitioner.findOptimalPartition(fittedCost, penalty, jump, minSize);
        logger.info(String.format("Found %d changepoint(s) in %d points using %s with penalty %s.",
                partition.getNumSegments() - 1, partition.getNumPoints(), cost, penalty));
        return partition;
    }

    public SegmentCost getCost() {
        return cost;
    }

    public int getJump() {
        return jump;
    }

    public int getMinSize() {
        return minSize;
    }

    private static GraphSegConfig defaultConfig() {
        return ConfigFactory.getInstance().getGraphSegConfig();
    }
}
