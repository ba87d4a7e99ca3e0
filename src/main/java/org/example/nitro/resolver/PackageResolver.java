package org.example.nitro.resolver;

import org.example.nitro.evaluator.ConfiguredPackage;
import org.example.nitro.evaluator.EvalInput;
import org.example.nitro.evaluator.PackageEvaluator;
import org.example.nitro.exception.ResolutionException;
import org.example.nitro.model.PackageOverrides;
import org.example.nitro.model.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Resolves the full set of packages to install from the packages a user configured.
 *
 * <p>Each package is evaluated through the {@link PackageEvaluator}, and the
 * relations it reports (dependencies, bundles, conflicts, compats, extensions
 * and recommendations) are followed until nothing new is required. Evaluation
 * of queued packages is held back until they have been preloaded, so that the
 * evaluator receives packages in batches.</p>
 *
 * <p>Failures are reported as {@link ResolutionException}s whose requests have
 * already been passed through {@link PackageEvaluator#makeReqDisplayable}.</p>
 *
 * @param <I> evaluation input type
 * @param <C> common input type
 */
public class PackageResolver<I extends EvalInput<I>, C> {

    private static final Logger log = LoggerFactory.getLogger(PackageResolver.class);

    private final PackageEvaluator<I, C> evaluator;
    private final C commonInput;

    public PackageResolver(PackageEvaluator<I, C> evaluator, C commonInput) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator cannot be null");
        this.commonInput = commonInput;
    }

    /**
     * Resolves the given configured packages.
     *
     * @param packages      the packages the user configured
     * @param constantInput input shared by every package; copied before each evaluation
     * @param overrides     packages to suppress or force
     * @return the packages to install and the recommendations left unfulfilled
     * @throws ResolutionException if the packages cannot be resolved
     */
    public ResolutionResult resolve(List<? extends ConfiguredPackage<I>> packages,
                                    I constantInput,
                                    PackageOverrides overrides) throws ResolutionException {
        Objects.requireNonNull(packages, "packages cannot be null");
        Objects.requireNonNull(constantInput, "constantInput cannot be null");
        PackageOverrides effectiveOverrides = overrides != null ? overrides : PackageOverrides.none();

        log.info("Resolving {} configured package(s)", packages.size());

        ResolutionState<I, C> state = new ResolutionState<>(evaluator, commonInput, constantInput, effectiveOverrides);
        ResolutionResult result;
        try {
            result = state.run(packages);
        } catch (ResolutionException e) {
            throw e.withDisplayableRequests(req -> evaluator.makeReqDisplayable(req, commonInput));
        }

        log.info("Resolved {} package(s), {} unfulfilled recommendation(s)",
                result.getPackages().size(), result.getUnfulfilledRecommendations().size());
        return result;
    }

    /**
     * Shortcut for a one-off resolution.
     */
    public static <I extends EvalInput<I>, C> ResolutionResult resolve(
            List<? extends ConfiguredPackage<I>> packages,
            PackageEvaluator<I, C> evaluator,
            I constantInput,
            C commonInput,
            PackageOverrides overrides) throws ResolutionException {
        return new PackageResolver<>(evaluator, commonInput).resolve(packages, constantInput, overrides);
    }
}
