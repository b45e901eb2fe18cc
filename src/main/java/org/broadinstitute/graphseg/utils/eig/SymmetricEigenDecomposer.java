package org.broadinstitute.graphseg.utils.eig;

import org.apache.commons.math3.linear.RealMatrix;

/**
 *  Perform the eigendecomposition of a real symmetric matrix.
 */
public interface SymmetricEigenDecomposer {
    Eig createEig(final RealMatrix m);

    /**
     * Create the default decomposer.
     */
    static SymmetricEigenDecomposer getDefault(){
        return new ApacheSymmetricEigenDecomposer();
    }
}
