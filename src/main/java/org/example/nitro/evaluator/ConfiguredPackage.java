package org.example.nitro.evaluator;

import org.example.nitro.exception.ConfigurationException;
import org.example.nitro.model.PackageProperties;
import org.example.nitro.model.PackageRequest;

/**
 * A package the user configured directly.
 *
 * @param <I> the evaluation input type this configuration can adjust
 */
public interface ConfiguredPackage<I extends EvalInput<I>> {

    /**
     * The request for this package. Its source should be {@code UserRequire}.
     */
    PackageRequest getPackage();

    /**
     * Whether failures while evaluating this package, or anything that only it
     * pulls in, may be ignored.
     */
    boolean isOptional();

    /**
     * Applies this configuration to the input used to evaluate the package.
     *
     * @param properties the package's declared properties
     * @param input      the input to modify in place
     * @throws ConfigurationException if the configuration does not fit the package
     */
    void overrideConfiguredPackageInput(PackageProperties properties, I input) throws ConfigurationException;
}
