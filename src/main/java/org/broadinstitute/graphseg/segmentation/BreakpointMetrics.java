package org.broadinstitute.graphseg.segmentation;

import org.broadinstitute.graphseg.utils.Utils;
import org.broadinstitute.graphseg.utils.param.ParamUtils;

import java.util.List;

/**
 * Comparisons between two breakpoint lists over the same signal, e.g. detected breakpoints against ground truth.
 *
 * <p>
 *     Both lists follow the {@link Partition} convention: strictly increasing and ending with the number of points,
 *     which must agree.  The terminal breakpoint is excluded from all comparisons.
 * </p>
 */
public final class BreakpointMetrics {

    private BreakpointMetrics() {}

    /**
     * Symmetric Hausdorff distance between the changepoints of two breakpoint lists: the largest distance from a
     * changepoint in either list to the nearest changepoint in the other.
     *
     * @return 0 if neither list has a changepoint, {@link Double#POSITIVE_INFINITY} if exactly one has none
     */
    public static double hausdorff(final List<Integer> breakpoints1, final List<Integer> breakpoints2) {
        validateSameSignal(breakpoints1, breakpoints2);
        final List<Integer> changepoints1 = breakpoints1.subList(0, breakpoints1.size() - 1);
        final List<Integer> changepoints2 = breakpoints2.subList(0, breakpoints2.size() - 1);
        if (changepoints1.isEmpty() && changepoints2.isEmpty()) {
            return 0.;
        }
        if (changepoints1.isEmpty() || changepoints2.isEmpty()) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(directedHausdorff(changepoints1, changepoints2), directedHausdorff(changepoints2, changepoints1));
    }

    private static int directedHausdorff(final List<Integer> from, final List<Integer> to) {
        int distance = 0;
        for (final int a : from) {
            int nearest = Integer.MAX_VALUE;
            for (final int b : to) {
                nearest = Math.min(nearest, Math.abs(a - b));
            }
            distance = Math.max(distance, nearest);
        }
        return distance;
    }

    /**
     * Precision and recall of predicted changepoints.  A predicted changepoint is a true positive if it lies within
     * {@code margin} of a true changepoint that has not already been matched; each true changepoint is matched at
     * most once.
     *
     * @param margin non-negative tolerance, in points
     */
    public static PrecisionRecall precisionRecall(final List<Integer> trueBreakpoints, final List<Integer> predictedBreakpoints, final int margin) {
        validateSameSignal(trueBreakpoints, predictedBreakpoints);
        ParamUtils.isPositiveOrZero(margin, "The margin must be non-negative.");
        final List<Integer> trueChangepoints = trueBreakpoints.subList(0, trueBreakpoints.size() - 1);
        final List<Integer> predictedChangepoints = predictedBreakpoints.subList(0, predictedBreakpoints.size() - 1);
        if (trueChangepoints.isEmpty() && predictedChangepoints.isEmpty()) {
            return new PrecisionRecall(1., 1.);
        }
        if (trueChangepoints.isEmpty() || predictedChangepoints.isEmpty()) {
            return new PrecisionRecall(0., 0.);
        }

        final boolean[] matched = new boolean[trueChangepoints.size()];
        int numTruePositives = 0;
        for (final int predicted : predictedChangepoints) {
            for (int i = 0; i < trueChangepoints.size(); i++) {
                if (!matched[i] && Math.abs(trueChangepoints.get(i) - predicted) <= margin) {
                    matched[i] = true;
                    numTruePositives++;
                    break;
                }
            }
        }
        return new PrecisionRecall((double) numTruePositives / predictedChangepoints.size(),
                (double) numTruePositives / trueChangepoints.size());
    }

    private static void validateSameSignal(final List<Integer> breakpoints1, final List<Integer> breakpoints2) {
        Utils.nonNull(breakpoints1, "Breakpoints cannot be null.");
        Utils.nonNull(breakpoints2, "Breakpoints cannot be null.");
        Utils.validateArg(!breakpoints1.isEmpty() && !breakpoints2.isEmpty(), "Breakpoint lists must end with the number of points.");
        Utils.validateArg(breakpoints1.get(breakpoints1.size() - 1).equals(breakpoints2.get(breakpoints2.size() - 1)),
                () -> String.format("Breakpoint lists refer to signals of different lengths (%d and %d).",
                        breakpoints1.get(breakpoints1.size() - 1), breakpoints2.get(breakpoints2.size() - 1)));
    }

    public static final class PrecisionRecall {
        private final double precision;
        private final double recall;

        PrecisionRecall(final double precision, final double recall) {
            this.precision = precision;
            this.recall = recall;
        }

        public double getPrecision() {
            return precision;
        }

        public double getRecall() {
            return recall;
        }

        @Override
        public String toString() {
            return "PrecisionRecall{precision=" + precision + ", recall=" + recall + '}';
        }
    }
}
