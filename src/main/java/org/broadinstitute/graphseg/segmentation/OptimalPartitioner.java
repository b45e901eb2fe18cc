package org.broadinstitute.graphseg.segmentation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.segmentation.cost.FittedSegmentCost;
import org.broadinstitute.graphseg.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exact optimal partitioning with pruning (PELT) for arbitrary segment costs.
 *
 * <p>
 *     Finds the partition of {@code [0, n)} into contiguous segments minimizing
 * </p>
 *
 * <pre>
 *     sum over segments of cost.error(segment) + penalty * (number of segments - 1)
 * </pre>
 *
 * <p>
 *     over all partitions whose changepoints lie on the grid of multiples of {@code jump} and whose segments contain
 *     at least {@code minSize} points.  The dynamic program sweeps the grid in increasing order; {@code bestCost[t]}
 *     is the optimal penalized cost of {@code [0, t)}, seeded with {@code bestCost[0] = -penalty} so that the first
 *     segment is not charged a penalty.
 * </p>
 *
 * <p>
 *     Pruning: a candidate predecessor {@code s} is dominated at {@code t} when
 *     {@code bestCost[s] + error(s, t) > bestCost[t]}.  For costs with {@code error(s, t) + error(t, u) <= error(s, u)}
 *     (true for the least-squares costs) {@code s} can then never be the optimal predecessor of any {@code u} that
 *     may follow a changepoint at {@code t}, i.e. any {@code u >= t + minSize}; it is dropped once the sweep reaches
 *     that position.  With {@code minSize = 1} this is the usual immediate removal.  The pruning never changes the
 *     optimum.
 * </p>
 *
 * <p>
 *     With {@code jump > 1} changepoints are restricted to multiples of {@code jump}.  This is a deliberate
 *     approximation that trades exactness at arbitrary offsets for fewer cost evaluations.
 * </p>
 *
 * <p>
 *     Worst case O(n^2 / jump^2) cost evaluations (when no candidate is ever dominated), typically close to linear
 *     when true changes are present.  This class holds no state between calls and may be used from several threads.
 * </p>
 */
public final class OptimalPartitioner {

    private static final Logger logger = LogManager.getLogger(OptimalPartitioner.class);

    private static final int NOT_DOMINATED = Integer.MAX_VALUE;

    /**
     * @return the breakpoints of the optimal partition, strictly increasing and ending with {@code n}
     * @see #findOptimalPartition(FittedSegmentCost, double, int, int)
     */
    public List<Integer> search(final FittedSegmentCost cost, final double penalty, final int jump, final int minSize) {
        return findOptimalPartition(cost, penalty, jump, minSize).getBreakpoints();
    }

    /**
     * @param cost fitted segment cost.  Never {@code null}
     * @param penalty cost charged per changepoint; non-negative and finite
     * @param jump stride of the changepoint grid, at least 1
     * @param minSize minimum number of points per segment, at least 1
     * @return the optimal partition and its penalized cost; a single segment if {@code n < 2 * minSize}
     * @throws UserException.InvalidPenalty if {@code penalty} is negative, NaN or infinite
     * @throws UserException.InvalidGrid if {@code jump < 1} or {@code minSize < 1}
     * @throws UserException.EmptySignal if the fitted signal has no points
     */
    public Partition findOptimalPartition(final FittedSegmentCost cost, final double penalty, final int jump, final int minSize) {
        Utils.nonNull(cost, "The segment cost cannot be null.");
        if (!(penalty >= 0.) || Double.isInfinite(penalty)) {
            throw new UserException.InvalidPenalty(penalty);
        }
        if (jump < 1 || minSize < 1) {
            throw new UserException.InvalidGrid(jump, minSize);
        }
        final int numPoints = cost.getNumPoints();
        if (numPoints == 0) {
            throw new UserException.EmptySignal();
        }
        final int minSegmentLength = Math.max(minSize, cost.getMinimumSegmentLength());
        // numPoints / 2 < minSegmentLength is numPoints < 2 * minSegmentLength without overflow
        if (numPoints / 2 < minSegmentLength) {
            logger.debug(String.format("No split of %d points into segments of at least %d points is possible; returning a single segment.",
                    numPoints, minSegmentLength));
            return new Partition(Collections.singletonList(numPoints), cost.error(0, numPoints));
        }

        final int[] grid = buildGrid(numPoints, jump, minSegmentLength);

        final double[] bestCost = new double[numPoints + 1];
        final int[] lastChangepoint = new int[numPoints + 1];
        bestCost[0] = -penalty;

        // candidate set, compacted in place; expiry is the position from which a dominated candidate is dropped
        final int[] candidates = new int[grid.length];
        final int[] candidateExpiry = new int[grid.length];
        final double[] candidateErrors = new double[grid.length];
        int numCandidates = 0;
        int nextGridIndexToAdmit = 0;

        long numCostEvaluations = 0;
        long numPruned = 0;
        for (int gridIndex = 1; gridIndex < grid.length; gridIndex++) {
            final int t = grid[gridIndex];

            while (grid[nextGridIndexToAdmit] <= t - minSegmentLength) {
                candidates[numCandidates] = grid[nextGridIndexToAdmit];
                candidateExpiry[numCandidates] = NOT_DOMINATED;
                numCandidates++;
                nextGridIndexToAdmit++;
            }

            int numKept = 0;
            for (int c = 0; c < numCandidates; c++) {
                if (candidateExpiry[c] > t) {
                    candidates[numKept] = candidates[c];
                    candidateExpiry[numKept] = candidateExpiry[c];
                    numKept++;
                } else {
                    numPruned++;
                }
            }
            numCandidates = numKept;
            Utils.validate(numCandidates > 0, () -> String.format("No admissible predecessor remains for position %d.", t));

            double minimumCost = Double.POSITIVE_INFINITY;
            int argmin = -1;
            for (int c = 0; c < numCandidates; c++) {
                final int s = candidates[c];
                candidateErrors[c] = cost.error(s, t);
                final double total = bestCost[s] + candidateErrors[c] + penalty;
                if (total < minimumCost) {
                    minimumCost = total;
                    argmin = s;
                }
            }
            numCostEvaluations += numCandidates;
            bestCost[t] = minimumCost;
            lastChangepoint[t] = argmin;

            if (t == numPoints) {
                break;
            }
            for (int c = 0; c < numCandidates; c++) {
                if (candidateExpiry[c] == NOT_DOMINATED && bestCost[candidates[c]] + candidateErrors[c] > minimumCost) {
                    candidateExpiry[c] = (int) Math.min((long) t + minSegmentLength, NOT_DOMINATED);
                }
            }
        }

        final List<Integer> breakpoints = new ArrayList<>();
        for (int position = numPoints; position > 0; position = lastChangepoint[position]) {
            breakpoints.add(position);
        }
        Collections.reverse(breakpoints);

        logger.debug(String.format("Searched %d points (jump = %d, minimum segment size = %d) with %d cost evaluations; %d candidate(s) pruned; found %d changepoint(s) with cost %s.",
                numPoints, jump, minSegmentLength, numCostEvaluations, numPruned, breakpoints.size() - 1, bestCost[numPoints]));
        return new Partition(breakpoints, bestCost[numPoints]);
    }

    /**
     * Positions at which the sweep evaluates {@code bestCost}: 0, every multiple of {@code jump} in
     * {@code [minSize, n)}, and {@code n}.
     */
    private static int[] buildGrid(final int numPoints, final int jump, final int minSize) {
        final List<Integer> positions = new ArrayList<>();
        positions.add(0);
        final long firstMultiple = (((long) minSize + jump - 1) / jump) * jump;
        for (long position = firstMultiple; position < numPoints; position += jump) {
            positions.add((int) position);
        }
        positions.add(numPoints);
        return positions.stream().mapToInt(Integer::intValue).toArray();
    }
}
