package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Exception thrown when a refused package is required, or a required package is refused.
 */
public class IncompatiblePackageException extends ResolutionException {

    private final PackageRequest request;
    private final List<String> refusers;

    public IncompatiblePackageException(PackageRequest request, List<String> refusers) {
        super("Package '" + request.getId() + "' is incompatible with existing packages "
                + String.join(", ", refusers));
        this.request = request;
        this.refusers = List.copyOf(refusers);
    }

    public PackageRequest getRequest() {
        return request;
    }

    /**
     * Ids of every package that refused this one.
     */
    public List<String> getRefusers() {
        return refusers;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new IncompatiblePackageException(rewriter.apply(request), refusers);
    }
}
