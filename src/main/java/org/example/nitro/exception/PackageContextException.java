package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.function.UnaryOperator;

/**
 * Wraps a resolution error with the package that was being evaluated when it
 * happened. Contexts nest along transitive chains.
 */
public class PackageContextException extends ResolutionException {

    private final PackageRequest request;

    public PackageContextException(PackageRequest request, ResolutionException inner) {
        super("In package '" + request.debugSources() + "'", inner);
        this.request = request;
    }

    public PackageRequest getRequest() {
        return request;
    }

    public ResolutionException getInner() {
        return (ResolutionException) getCause();
    }

    @Override
    public ResolutionException getRootCause() {
        return getInner().getRootCause();
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new PackageContextException(rewriter.apply(request), getInner().withDisplayableRequests(rewriter));
    }
}
