package org.broadinstitute.graphseg.spectral;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.graphseg.exceptions.UserException;
import org.broadinstitute.graphseg.utils.Utils;
import org.broadinstitute.graphseg.utils.config.ConfigFactory;
import org.broadinstitute.graphseg.utils.config.GraphSegConfig;
import org.broadinstitute.graphseg.utils.eig.Eig;
import org.broadinstitute.graphseg.utils.eig.SymmetricEigenDecomposer;

import java.util.Arrays;

/**
 * Graph-spectral low-pass filter over node space.
 *
 * <p>
 *     Given a graph Laplacian {@code L = U diag(lambda) U^T} and a cutoff {@code rho > 0}, the filter is the linear
 *     operator {@code F = U diag(g(lambda)) U^T} with gain
 * </p>
 *
 * <pre>
 *     g(0)      = 1
 *     g(lambda) = min(1, sqrt(rho / lambda))   for lambda &gt; 0
 * </pre>
 *
 * <p>
 *     so graph frequencies up to {@code rho} pass unchanged and higher frequencies are attenuated.  Every zero
 *     eigenvalue (one per connected component) is a DC component and is always passed.  {@code F} is symmetric,
 *     positive-semidefinite and has operator norm at most 1.
 * </p>
 *
 * <p>
 *     The eigendecomposition is computed once at construction; the operator is assembled on first use and cached.
 *     Instances are immutable (every accessor returns a copy) and may be shared between threads.
 * </p>
 */
public final class SpectralFilter {

    private static final Logger logger = LogManager.getLogger(SpectralFilter.class);

    private final double rho;

    /**
     * Laplacian eigenvalues in ascending order, with round-off negatives and near-zeros set to exactly 0.
     */
    private final double[] eigenvalues;

    /**
     * Orthonormal eigenvectors, one per column, in the order of {@link #eigenvalues}.
     */
    private final RealMatrix eigenvectors;

    private final double[] gains;

    private volatile RealMatrix operator;

    private SpectralFilter(final double rho, final double[] eigenvalues, final RealMatrix eigenvectors) {
        this.rho = rho;
        this.eigenvalues = eigenvalues;
        this.eigenvectors = eigenvectors;
        this.gains = Arrays.stream(eigenvalues).map(lambda -> gain(lambda, rho)).toArray();
    }

    /**
     * Builds a filter using the tolerances in {@link GraphSegConfig}.
     *
     * @param laplacian symmetric positive-semidefinite {@code d x d} Laplacian.  Never {@code null}
     * @param rho cutoff; must be positive and finite
     * @throws UserException.InvalidGraph if the Laplacian is not square, not finite, not numerically symmetric
     *                                    or has a clearly negative eigenvalue
     * @throws UserException.InvalidParameter if {@code rho} is not positive and finite
     */
    public static SpectralFilter build(final RealMatrix laplacian, final double rho) {
        final GraphSegConfig config = ConfigFactory.getInstance().getGraphSegConfig();
        return build(laplacian, rho,
                config.spectral_filter_symmetry_tolerance(),
                config.spectral_filter_eigenvalue_zero_tolerance(),
                SymmetricEigenDecomposer.getDefault());
    }

    public static SpectralFilter build(final double[][] laplacian, final double rho) {
        Utils.nonNull(laplacian, "The Laplacian cannot be null.");
        if (laplacian.length == 0) {
            throw new UserException.InvalidGraph("the Laplacian must have at least one node.");
        }
        return build(MatrixUtils.createRealMatrix(laplacian), rho);
    }

    /**
     * @param symmetryTolerance relative tolerance for the symmetry check and for rejecting negative eigenvalues
     * @param eigenvalueZeroTolerance eigenvalues at most this fraction of the spectral radius are treated as 0
     * @param decomposer symmetric eigensolver.  Never {@code null}
     */
    public static SpectralFilter build(final RealMatrix laplacian,
                                       final double rho,
                                       final double symmetryTolerance,
                                       final double eigenvalueZeroTolerance,
                                       final SymmetricEigenDecomposer decomposer) {
        Utils.nonNull(laplacian, "The Laplacian cannot be null.");
        Utils.nonNull(decomposer, "The eigendecomposer cannot be null.");
        Utils.validateArg(symmetryTolerance >= 0., "The symmetry tolerance must be non-negative.");
        Utils.validateArg(eigenvalueZeroTolerance >= 0., "The eigenvalue zero tolerance must be non-negative.");

        GraphLaplacians.checkSquareFiniteAndSymmetric(laplacian, symmetryTolerance, "Laplacian");
        if (!(rho > 0.) || !Double.isFinite(rho)) {
            throw new UserException.InvalidParameter("rho", rho, "the cutoff must be positive and finite.");
        }

        // remove the asymmetry allowed by the tolerance so the solver takes its symmetric path
        final RealMatrix symmetrized = laplacian.add(laplacian.transpose()).scalarMultiply(0.5);
        final Eig eig = decomposer.createEig(symmetrized);

        final double[] eigenvalues = eig.getEigenvalues().clone();
        final int dimension = eigenvalues.length;
        final double spectralRadius = FastMath.max(FastMath.abs(eigenvalues[0]), FastMath.abs(eigenvalues[dimension - 1]));
        if (eigenvalues[0] < -symmetryTolerance * spectralRadius) {
            throw new UserException.InvalidGraph(String.format(
                    "the Laplacian must be positive-semidefinite, but it has the eigenvalue %s.", eigenvalues[0]));
        }
        int numZeroEigenvalues = 0;
        for (int k = 0; k < dimension; k++) {
            if (eigenvalues[k] <= eigenvalueZeroTolerance * spectralRadius) {
                eigenvalues[k] = 0.;
                numZeroEigenvalues++;
            }
        }

        final SpectralFilter filter = new SpectralFilter(rho, eigenvalues, eig.getEigenvectors().copy());
        if (logger.isDebugEnabled()) {
            final long numAttenuated = Arrays.stream(filter.gains).filter(g -> g < 1.).count();
            logger.debug(String.format("Built spectral filter over %d nodes with rho = %s: %d zero eigenvalue(s), %d attenuated frequency(ies), spectral radius %s.",
                    dimension, rho, numZeroEigenvalues, numAttenuated, spectralRadius));
        }
        return filter;
    }

    /**
     * Filter gain at a graph frequency.
     *
     * @param lambda Laplacian eigenvalue; values {@code <= 0} are treated as DC components
     * @param rho cutoff; must be positive
     * @return 1 for {@code lambda <= rho}, otherwise {@code sqrt(rho / lambda)}
     */
    public static double gain(final double lambda, final double rho) {
        Utils.validateArg(rho > 0., "The cutoff rho must be positive.");
        if (lambda <= 0.) {
            return 1.;
        }
        return FastMath.min(1., FastMath.sqrt(rho / lambda));
    }

    /**
     * Returns {@code F = U diag(g) U^T}.
     *
     * @return a copy of the operator, which may be modified freely
     */
    public RealMatrix operator() {
        return cachedOperator().copy();
    }

    /**
     * The operator, computed on first call and cached.  Shared by every {@link #apply(RealMatrix)}; never exposed.
     */
    private RealMatrix cachedOperator() {
        RealMatrix result = operator;
        if (result == null) {
            synchronized (this) {
                result = operator;
                if (result == null) {
                    result = computeOperator();
                    operator = result;
                }
            }
        }
        return result;
    }

    // F_ij = sum_k g_k U_ik U_jk over the upper triangle, mirrored so that F is exactly symmetric
    private RealMatrix computeOperator() {
        final int dimension = getDimension();
        final double[][] u = eigenvectors.getData();
        final double[][] f = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = i; j < dimension; j++) {
                double sum = 0.;
                for (int k = 0; k < dimension; k++) {
                    sum += gains[k] * u[i][k] * u[j][k];
                }
                f[i][j] = sum;
                f[j][i] = sum;
            }
        }
        return MatrixUtils.createRealMatrix(f);
    }

    /**
     * Filters every time-row of {@code signal} through the node-space operator, i.e. returns {@code signal * F^T}.
     * The input is not modified.
     *
     * @param signal {@code n x d} signal, rows are time points and columns are graph nodes.  Never {@code null}
     * @return a new {@code n x d} matrix
     * @throws UserException.DimensionMismatch if the signal does not have one column per graph node
     */
    public RealMatrix apply(final RealMatrix signal) {
        Utils.nonNull(signal, "The signal cannot be null.");
        if (signal.getColumnDimension() != getDimension()) {
            throw new UserException.DimensionMismatch(getDimension(), signal.getColumnDimension());
        }
        return signal.multiply(cachedOperator().transpose());
    }

    public int getDimension() {
        return eigenvalues.length;
    }

    public double getRho() {
        return rho;
    }

    /**
     * @return Laplacian eigenvalues in ascending order (copy)
     */
    public double[] getEigenvalues() {
        return eigenvalues.clone();
    }

    /**
     * @return orthonormal eigenvectors as columns, ordered as {@link #getEigenvalues()} (copy)
     */
    public RealMatrix getEigenvectors() {
        return eigenvectors.copy();
    }

    /**
     * @return filter gains, one per eigenvalue in the order of {@link #getEigenvalues()} (copy)
     */
    public double[] getGains() {
        return gains.clone();
    }
}
