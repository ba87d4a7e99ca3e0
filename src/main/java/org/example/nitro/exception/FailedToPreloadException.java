package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Exception thrown when the evaluator fails to preload a batch of packages.
 * Always fatal.
 */
public class FailedToPreloadException extends ResolutionException {

    private final List<PackageRequest> packages;

    public FailedToPreloadException(List<PackageRequest> packages, EvaluationException cause) {
        super("Failed to preload packages", cause);
        this.packages = List.copyOf(packages);
    }

    public List<PackageRequest> getPackages() {
        return packages;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new FailedToPreloadException(rewriteAll(packages, rewriter), (EvaluationException) getCause());
    }
}
