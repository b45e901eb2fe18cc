package org.broadinstitute.graphseg.utils.eig;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.graphseg.exceptions.GraphSegException;
import org.broadinstitute.graphseg.utils.Utils;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Perform the symmetric eigendecomposition in pure Java, Commons Math.
 *
 * <p>
 *     {@link EigenDecomposition} makes no promise about the order of the eigenvalues it returns, so they are
 *     re-sorted here in ascending order together with their eigenvectors.
 * </p>
 */
public final class ApacheSymmetricEigenDecomposer implements SymmetricEigenDecomposer {

    /** Create an Eig instance using Apache Commons Math.
     *
     * @param m square symmetric matrix that is not {@code null}.  Symmetry is not checked here.
     * @return Eig instance that is never {@code null}
     */
    @Override
    public Eig createEig(final RealMatrix m) {
        Utils.nonNull(m, "Cannot create an eigendecomposition of a null matrix.");
        Utils.validateArg(m.isSquare(), "Cannot create an eigendecomposition of a non-square matrix.");

        final EigenDecomposition decomposition;
        try {
            decomposition = new EigenDecomposition(m);
        } catch (final MathIllegalStateException e) {
            throw new GraphSegException("The symmetric eigendecomposition failed to converge.", e);
        }

        final double[] unsortedEigenvalues = decomposition.getRealEigenvalues();
        final int[] order = IntStream.range(0, unsortedEigenvalues.length).boxed()
                .sorted(Comparator.comparingDouble(i -> unsortedEigenvalues[i]))
                .mapToInt(Integer::intValue).toArray();

        final int dimension = unsortedEigenvalues.length;
        final double[] eigenvalues = new double[dimension];
        final RealMatrix eigenvectors = MatrixUtils.createRealMatrix(dimension, dimension);
        for (int k = 0; k < dimension; k++) {
            eigenvalues[k] = unsortedEigenvalues[order[k]];
            eigenvectors.setColumnVector(k, decomposition.getEigenvector(order[k]));
        }
        return new SimpleEig(eigenvalues, eigenvectors);
    }
}
