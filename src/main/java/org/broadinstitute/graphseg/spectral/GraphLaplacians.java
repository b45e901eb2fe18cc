package org.broadinstitute.graphseg.spectral;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.utils.Utils;
import org.broadinstitute.graphseg.utils.config.ConfigFactory;

/**
 * Static helpers for turning an externally supplied weighted graph into a combinatorial Laplacian
 * and for the structural checks shared with {@link SpectralFilter}.
 */
public final class GraphLaplacians {

    private GraphLaplacians() {}

    /**
     * Builds the combinatorial Laplacian {@code L = D - W} of an undirected weighted graph.
     *
     * <p>
     *     The diagonal of {@code weights} is ignored (self loops do not change the Laplacian).  The weight matrix is
     *     symmetrized before use, so entries that differ by less than the configured symmetry tolerance are averaged.
     * </p>
     *
     * @param weights square, finite, symmetric matrix of non-negative edge weights.  Never {@code null}
     * @return the {@code d x d} Laplacian, whose rows sum to zero.  Never {@code null}
     * @throws UserException.InvalidGraph if {@code weights} cannot describe an undirected weighted graph
     */
    public static RealMatrix fromAdjacency(final RealMatrix weights) {
        Utils.nonNull(weights, "The weight matrix cannot be null.");
        final double symmetryTolerance = ConfigFactory.getInstance().getGraphSegConfig().spectral_filter_symmetry_tolerance();
        checkSquareFiniteAndSymmetric(weights, symmetryTolerance, "weight matrix");

        final int numNodes = weights.getRowDimension();
        final RealMatrix laplacian = MatrixUtils.createRealMatrix(numNodes, numNodes);
        for (int i = 0; i < numNodes; i++) {
            double degree = 0.;
            for (int j = 0; j < numNodes; j++) {
                if (i == j) {
                    continue;
                }
                final double weight = 0.5 * (weights.getEntry(i, j) + weights.getEntry(j, i));
                if (weight < 0.) {
                    throw new UserException.InvalidGraph(
                            String.format("edge weights must be non-negative, but the weight between nodes %d and %d is %s.", i, j, weight));
                }
                laplacian.setEntry(i, j, -weight);
                degree += weight;
            }
            laplacian.setEntry(i, i, degree);
        }
        return laplacian;
    }

    public static RealMatrix fromAdjacency(final double[][] weights) {
        Utils.nonNull(weights, "The weight matrix cannot be null.");
        Utils.validateArg(weights.length > 0, "The weight matrix must have at least one node.");
        return fromAdjacency(MatrixUtils.createRealMatrix(weights));
    }

    /**
     * Checks that {@code matrix} is square, has only finite entries, and is symmetric up to
     * {@code relativeTolerance} times its largest absolute entry.
     */
    static void checkSquareFiniteAndSymmetric(final RealMatrix matrix, final double relativeTolerance, final String description) {
        if (!matrix.isSquare()) {
            throw new UserException.InvalidGraph(String.format("the %s must be square, but it has dimensions %d x %d.",
                    description, matrix.getRowDimension(), matrix.getColumnDimension()));
        }
        final int dimension = matrix.getRowDimension();
        double scale = 0.;
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                final double entry = matrix.getEntry(i, j);
                if (!Double.isFinite(entry)) {
                    throw new UserException.InvalidGraph(String.format("the %s contains the non-finite entry %s at (%d, %d).",
                            description, entry, i, j));
                }
                scale = Math.max(scale, Math.abs(entry));
            }
        }
        final double absoluteTolerance = relativeTolerance * scale;
        for (int i = 0; i < dimension; i++) {
            for (int j = i + 1; j < dimension; j++) {
                if (Math.abs(matrix.getEntry(i, j) - matrix.getEntry(j, i)) > absoluteTolerance) {
                    throw new UserException.InvalidGraph(String.format("the %s is not symmetric: entries (%d, %d) = %s and (%d, %d) = %s differ.",
                            description, i, j, matrix.getEntry(i, j), j, i, matrix.getEntry(j, i)));
                }
            }
        }
    }
}
