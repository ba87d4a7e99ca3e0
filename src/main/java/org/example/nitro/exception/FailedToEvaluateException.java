package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.function.UnaryOperator;

/**
 * Exception thrown when the relations of a package cannot be evaluated.
 */
public class FailedToEvaluateException extends ResolutionException {

    private final PackageRequest request;

    public FailedToEvaluateException(PackageRequest request, EvaluationException cause) {
        super("Failed to evaluate package '" + request.getId() + "'", cause);
        this.request = request;
    }

    public PackageRequest getRequest() {
        return request;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new FailedToEvaluateException(rewriter.apply(request), (EvaluationException) getCause());
    }
}
