package org.example.nitro.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A recommendation that resolution left unfulfilled.
 */
public final class RecommendedPackage {

    private final PackageRequest req;
    private final boolean invert;

    public RecommendedPackage(PackageRequest req, boolean invert) {
        this.req = Objects.requireNonNull(req, "req cannot be null");
        this.invert = invert;
    }

    public PackageRequest getReq() {
        return req;
    }

    /**
     * Whether this recommends against the package instead of for it.
     */
    public boolean isInvert() {
        return invert;
    }

    /**
     * Builds the warning shown to the user for this recommendation.
     */
    public String describe() {
        Optional<PackageRequest> source = req.getSource().getSource();
        String subject = source
                .map(s -> "The package '" + s.debugSources() + "'")
                .orElse("A package");
        if (invert) {
            return subject + " recommends against the use of the package '" + req.getId()
                    + "', which is installed";
        }
        return subject + " recommends the use of the package '" + req.getId()
                + "', which is not installed";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecommendedPackage that = (RecommendedPackage) o;
        return invert == that.invert && req.equals(that.req);
    }

    @Override
    public int hashCode() {
        return Objects.hash(req, invert);
    }

    @Override
    public String toString() {
        return (invert ? "!" : "") + req.getId();
    }
}
