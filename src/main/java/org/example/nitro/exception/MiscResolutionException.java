package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.function.UnaryOperator;

/**
 * Resolution failure caused by something outside the resolver, such as a
 * configured package that cannot be applied.
 */
public class MiscResolutionException extends ResolutionException {

    public MiscResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return this;
    }
}
