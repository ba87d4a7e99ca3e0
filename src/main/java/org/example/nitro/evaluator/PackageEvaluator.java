package org.example.nitro.evaluator;

import org.example.nitro.exception.EvaluationException;
import org.example.nitro.model.PackageProperties;
import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.RelationsResult;

import java.util.List;

/**
 * Supplies package data to the resolver.
 *
 * <p>The resolver calls these methods one at a time and never concurrently.
 * An implementation is free to parallelise work inside
 * {@link #preloadPackages}.</p>
 *
 * @param <I> evaluation input type
 * @param <C> common input shared by every call, such as paths or an HTTP client
 */
public interface PackageEvaluator<I extends EvalInput<I>, C> {

    /**
     * Warms up a batch of packages so later calls for them are cheap.
     *
     * @throws EvaluationException if the batch cannot be loaded
     */
    void preloadPackages(List<PackageRequest> packages, C commonInput) throws EvaluationException;

    /**
     * Returns the properties of a package.
     *
     * @throws EvaluationException if the package cannot be found or read
     */
    PackageProperties getPackageProperties(PackageRequest pkg, C commonInput) throws EvaluationException;

    /**
     * Evaluates a package and reports its relations to other packages.
     *
     * @throws EvaluationException if evaluation fails
     */
    RelationsResult evalPackageRelations(PackageRequest pkg, I input, C commonInput) throws EvaluationException;

    /**
     * Rewrites a request into the form shown to users, for example by resolving
     * version aliases. Implementations that have nothing to rewrite return the
     * request unchanged.
     */
    PackageRequest makeReqDisplayable(PackageRequest pkg, C commonInput);
}
