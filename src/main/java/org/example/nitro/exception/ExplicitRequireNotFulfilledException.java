package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.function.UnaryOperator;

/**
 * Exception thrown when a package explicitly depends on a package the user did not require.
 */
public class ExplicitRequireNotFulfilledException extends ResolutionException {

    private final PackageRequest request;
    private final PackageRequest source;

    public ExplicitRequireNotFulfilledException(PackageRequest request, PackageRequest source) {
        super("Package '" + request.getId() + "' has been explicitly required by package '" + source.getId()
                + "'. This means it must be required by the user in their config.");
        this.request = request;
        this.source = source;
    }

    public PackageRequest getRequest() {
        return request;
    }

    public PackageRequest getSource() {
        return source;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new ExplicitRequireNotFulfilledException(rewriter.apply(request), rewriter.apply(source));
    }
}
