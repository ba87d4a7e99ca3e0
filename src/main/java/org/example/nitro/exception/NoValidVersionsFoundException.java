package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.VersionPattern;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Exception thrown when a package's version constraints leave no published
 * content version to choose from.
 */
public class NoValidVersionsFoundException extends ResolutionException {

    private final PackageRequest request;
    private final List<VersionPattern> constraints;

    public NoValidVersionsFoundException(PackageRequest request, List<VersionPattern> constraints) {
        super("Could not find a version of " + request.getId()
                + " that matches all of the content version requirements " + constraints);
        this.request = request;
        this.constraints = List.copyOf(constraints);
    }

    public PackageRequest getRequest() {
        return request;
    }

    public List<VersionPattern> getConstraints() {
        return constraints;
    }

    @Override
    public ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter) {
        return new NoValidVersionsFoundException(rewriter.apply(request), constraints);
    }
}
