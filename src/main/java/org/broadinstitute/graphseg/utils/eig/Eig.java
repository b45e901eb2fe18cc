package org.broadinstitute.graphseg.utils.eig;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Interface for the eigendecomposition of a real symmetric matrix.  Leverages Apache Commons for data fields.
 */
public interface Eig {

    /**
     * Get the eigenvalues, sorted in ascending order.
     */
    double[] getEigenvalues();

    /**
     * Get the matrix whose columns are the orthonormal eigenvectors, in the same order as {@link #getEigenvalues()}.
     * U has the property that U.transpose * U = I.
     */
    RealMatrix getEigenvectors();

    /**
     * Number of rows (and columns) of the decomposed matrix.
     */
    default int getDimension() {
        return getEigenvalues().length;
    }
}
