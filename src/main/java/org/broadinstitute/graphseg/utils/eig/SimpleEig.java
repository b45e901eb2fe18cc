package org.broadinstitute.graphseg.utils.eig;

import org.apache.commons.math3.linear.RealMatrix;
import org.broadinstitute.graphseg.utils.Utils;

/**
 * Simple implementation of the Eig interface for storing the eigenvalues and eigenvectors of a decomposition.
 */
public final class SimpleEig implements Eig {
    private final double[] eigenvalues;
    private final RealMatrix eigenvectors;

    public SimpleEig(final double[] eigenvalues, final RealMatrix eigenvectors) {
        Utils.nonNull(eigenvalues);
        Utils.nonNull(eigenvectors);
        Utils.validateArg(eigenvectors.getColumnDimension() == eigenvalues.length && eigenvectors.isSquare(),
                "There must be one eigenvector column per eigenvalue.");
        this.eigenvalues = eigenvalues;
        this.eigenvectors = eigenvectors;
    }

    @Override
    public double[] getEigenvalues() {
        return eigenvalues;
    }

    @Override
    public RealMatrix getEigenvectors() {
        return eigenvectors;
    }
}
