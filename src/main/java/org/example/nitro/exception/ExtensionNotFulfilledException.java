package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Exception thrown when a package extends another package that ends up not installed.
 */
public class ExtensionNotFulfilledException extends ResolutionException {

    private final PackageRequest source;
    private final PackageRequest request;

    public ExtensionNotFulfilledException(PackageRequest source, PackageRequest request) {
        super(buildMessage(source, request));
        this.source = source;
        this.request = request;
    }

    private static String buildMessage(PackageRequest source, PackageRequest request) {
        if (source != null) {
            return "The package '" + source.debugSources() + "' extends the functionality of the package '"
                    + request.getId() + "', which is not installed.";
        }
        return "A package extends the functionality of the package '" + request.getId()
                + "', which is not installed.";
    }

    /**
     * The extending package, if known.
     */
    public Optional<PackageRequest> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * The package that was extended but not installed.
     */
    public PackageRequest getRequest() {
        return request;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new ExtensionNotFulfilledException(
                source == null ? null : rewriter.apply(source),
                rewriter.apply(request));
    }
}
