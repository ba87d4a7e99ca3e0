package org.example.nitro.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Where a package request came from.
 *
 * <p>Every kind except {@link Kind#USER_REQUIRE} and {@link Kind#REPOSITORY}
 * points at the request that produced it, so a chain of sources forms a
 * provenance tree. Parents always exist before their children, so the tree
 * cannot contain cycles.</p>
 */
public final class RequestSource implements Comparable<RequestSource> {

    /**
     * Source kinds, declared in ordering priority.
     */
    public enum Kind {
        /** Required by the user in their configuration. */
        USER_REQUIRE,
        /** Bundled by another package. */
        BUNDLED,
        /** Depended on by another package. */
        DEPENDENCY,
        /** Refused by another package. */
        REFUSED,
        /** Requested by some automatic system. */
        REPOSITORY
    }

    private static final RequestSource USER_REQUIRE = new RequestSource(Kind.USER_REQUIRE, null);
    private static final RequestSource REPOSITORY = new RequestSource(Kind.REPOSITORY, null);

    private final Kind kind;
    private final PackageRequest parent;

    private RequestSource(Kind kind, PackageRequest parent) {
        this.kind = kind;
        this.parent = parent;
    }

    public static RequestSource userRequire() {
        return USER_REQUIRE;
    }

    public static RequestSource repository() {
        return REPOSITORY;
    }

    public static RequestSource bundled(PackageRequest bundler) {
        return new RequestSource(Kind.BUNDLED, Objects.requireNonNull(bundler, "bundler cannot be null"));
    }

    public static RequestSource dependency(PackageRequest dependent) {
        return new RequestSource(Kind.DEPENDENCY, Objects.requireNonNull(dependent, "dependent cannot be null"));
    }

    public static RequestSource refused(PackageRequest refuser) {
        return new RequestSource(Kind.REFUSED, Objects.requireNonNull(refuser, "refuser cannot be null"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the request that produced this one, whatever the kind.
     */
    public Optional<PackageRequest> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Returns the depending or bundling package, if any.
     * Refusers are not considered sources.
     */
    public Optional<PackageRequest> getSource() {
        return switch (kind) {
            case DEPENDENCY, BUNDLED -> Optional.of(parent);
            case USER_REQUIRE, REFUSED, REPOSITORY -> Optional.empty();
        };
    }

    /**
     * Whether this source is the user, or a chain of bundles that leads up to the user.
     */
    public boolean isUserBundled() {
        RequestSource current = this;
        while (current.kind == Kind.BUNDLED) {
            current = current.parent.getSource();
        }
        return current.kind == Kind.USER_REQUIRE;
    }

    /**
     * Orders by kind only.
     */
    @Override
    public int compareTo(RequestSource other) {
        return kind.compareTo(other.kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestSource that = (RequestSource) o;
        return kind == that.kind && Objects.equals(parent, that.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, parent);
    }

    @Override
    public String toString() {
        return parent == null ? kind.name() : kind.name() + "(" + parent.getId() + ")";
    }
}
