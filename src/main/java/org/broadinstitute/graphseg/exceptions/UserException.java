package org.broadinstitute.graphseg.exceptions;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as malformed graphs, out-of-range
 * parameters, or signals that do not match the graph they are supposed to live on.
 *
 * All of these are raised synchronously at the point where the violated precondition is detected
 * and before any cached state (eigendecompositions, prefix sums) is constructed.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.InvalidGraph
     * <p/>
     * For graph Laplacians that are not square, not finite, not numerically symmetric or not positive-semidefinite,
     * and for weight matrices that cannot describe an undirected graph.
     */
    public static class InvalidGraph extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidGraph(final String message) {
            super(String.format("Invalid graph: %s", message));
        }
    }

    /**
     * For filter parameters (e.g. the cutoff rho) outside of their admissible range.
     */
    public static class InvalidParameter extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidParameter(final String parameterName, final double value, final String requirement) {
            super(String.format("Invalid value %s for parameter %s: %s", value, parameterName, requirement));
        }
    }

    public static class InvalidPenalty extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidPenalty(final double penalty) {
            super(String.format("The penalty must be a non-negative number, but was %s.", penalty));
        }
    }

    /**
     * For search grids with a non-positive stride ({@code jump}) or minimum segment length ({@code minSize}).
     */
    public static class InvalidGrid extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidGrid(final int jump, final int minSize) {
            super(String.format("The search grid requires jump >= 1 and minimum segment size >= 1, but got jump = %d and minimum segment size = %d.",
                    jump, minSize));
        }
    }

    public static class EmptySignal extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptySignal() {
            super("The signal does not contain any observations.");
        }

        public EmptySignal(final String message) {
            super(String.format("The signal does not contain any observations: %s", message));
        }
    }

    /**
     * Thrown when a segment cost is requested for a segment shorter than the cost's minimum admissible length.
     */
    public static class SegmentTooShort extends UserException {
        private static final long serialVersionUID = 0L;

        public SegmentTooShort(final int start, final int end, final int minimumLength) {
            super(String.format("Segment [%d, %d) has length %d, which is below the minimum admissible segment length %d.",
                    start, end, end - start, minimumLength));
        }
    }

    /**
     * Thrown when the number of signal dimensions does not match the number of graph nodes.
     */
    public static class DimensionMismatch extends UserException {
        private static final long serialVersionUID = 0L;

        public DimensionMismatch(final int expectedDimension, final int actualDimension) {
            super(String.format("Expected a signal with %d dimensions (one per graph node), but the signal has %d.",
                    expectedDimension, actualDimension));
        }
    }
}
