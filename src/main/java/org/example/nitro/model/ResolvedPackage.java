package org.example.nitro.model;

import java.util.List;
import java.util.Objects;

/**
 * A single package resulting from resolution.
 */
public final class ResolvedPackage {

    private final PackageRequest req;
    private final DependencyKind kind;
    private final List<String> requiredContentVersions;
    private final List<String> preferredContentVersions;

    public ResolvedPackage(PackageRequest req, DependencyKind kind,
                           List<String> requiredContentVersions, List<String> preferredContentVersions) {
        this.req = Objects.requireNonNull(req, "req cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.requiredContentVersions = List.copyOf(requiredContentVersions);
        this.preferredContentVersions = List.copyOf(preferredContentVersions);
    }

    /**
     * The first request seen for this package. Its content version is not
     * meaningful on its own; see {@link #getRequiredContentVersions()}.
     */
    public PackageRequest getReq() {
        return req;
    }

    public String getId() {
        return req.getId();
    }

    public DependencyKind getKind() {
        return kind;
    }

    /**
     * Content versions that satisfy every constraint, in the package's order.
     * Empty when the package publishes no content versions.
     */
    public List<String> getRequiredContentVersions() {
        return requiredContentVersions;
    }

    public List<String> getPreferredContentVersions() {
        return preferredContentVersions;
    }

    @Override
    public String toString() {
        return "ResolvedPackage{" + req.getId() +
                ", kind=" + kind +
                ", required=" + requiredContentVersions +
                ", preferred=" + preferredContentVersions + '}';
    }
}
