package org.broadinstitute.graphseg.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Configuration file for graphseg options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   system properties
 *        2)   "file:${" + GraphSegConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        3)   "file:GraphSegConfig.properties",
 *        4)   "classpath:org/broadinstitute/graphseg/utils/config/GraphSegConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "system:properties",                                                          // -D overrides
        "file:${" + GraphSegConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",              // Variable for file loading
        "file:GraphSegConfig.properties",                                             // Default path
        "classpath:org/broadinstitute/graphseg/utils/config/GraphSegConfig.properties" // Class path
})
public interface GraphSegConfig extends Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link GraphSegConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "GraphSegConfig.pathToConfig";

    // ----------------------------------------------------------
    // Spectral filter options:
    // ----------------------------------------------------------

    /**
     * Relative tolerance used to decide whether a Laplacian is numerically symmetric.  Also bounds how negative
     * an eigenvalue may be (relative to the spectral radius) before the Laplacian is rejected as not
     * positive-semidefinite.
     */
    @Key("spectral_filter.symmetry_tolerance")
    @DefaultValue("1e-8")
    double spectral_filter_symmetry_tolerance();

    /**
     * Eigenvalues whose magnitude is at most this fraction of the spectral radius are treated as exact zeros,
     * i.e. as constant (DC) components of a connected component, and are passed with gain 1.
     */
    @Key("spectral_filter.eigenvalue_zero_tolerance")
    @DefaultValue("1e-10")
    double spectral_filter_eigenvalue_zero_tolerance();

    // ----------------------------------------------------------
    // Segmentation options:
    // ----------------------------------------------------------

    @Key("segmentation.default_jump")
    @DefaultValue("1")
    int segmentation_default_jump();

    @Key("segmentation.default_min_size")
    @DefaultValue("1")
    int segmentation_default_min_size();
}
