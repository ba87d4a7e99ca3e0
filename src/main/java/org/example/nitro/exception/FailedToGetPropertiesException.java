package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.function.UnaryOperator;

/**
 * Exception thrown when the properties of a package cannot be retrieved.
 */
public class FailedToGetPropertiesException extends ResolutionException {

    private final PackageRequest request;

    public FailedToGetPropertiesException(PackageRequest request, EvaluationException cause) {
        super("Failed to get properties for package '" + request.getId() + "'", cause);
        this.request = request;
    }

    public PackageRequest getRequest() {
        return request;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new FailedToGetPropertiesException(rewriter.apply(request), (EvaluationException) getCause());
    }
}
