package org.example.nitro.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Overrides that apply to the whole resolution.
 *
 * <p>Entries are request strings; only their ids are significant, so
 * {@code modrinth:foo@1.0} overrides {@code foo}.</p>
 */
public class PackageOverrides {

    private final List<String> suppress;
    private final List<String> force;

    public PackageOverrides(List<String> suppress, List<String> force) {
        this.suppress = suppress != null ? List.copyOf(suppress) : List.of();
        this.force = force != null ? List.copyOf(force) : List.of();
    }

    public static PackageOverrides none() {
        return new PackageOverrides(List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Packages that must never be installed.
     */
    public List<String> getSuppress() {
        return suppress;
    }

    /**
     * Packages whose evaluation is forced.
     */
    public List<String> getForce() {
        return force;
    }

    public boolean isSuppressed(PackageRequest req) {
        return isOverridden(req, suppress);
    }

    public boolean isForced(PackageRequest req) {
        return isOverridden(req, force);
    }

    /**
     * Checks if a package is named in an override list.
     */
    public static boolean isOverridden(PackageRequest req, Collection<String> list) {
        for (String entry : list) {
            if (PackageRequest.parse(entry, RequestSource.userRequire()).equals(req)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageOverrides that = (PackageOverrides) o;
        return suppress.equals(that.suppress) && force.equals(that.force);
    }

    @Override
    public int hashCode() {
        return Objects.hash(suppress, force);
    }

    @Override
    public String toString() {
        return "PackageOverrides{suppress=" + suppress + ", force=" + force + '}';
    }

    /**
     * Builder for PackageOverrides.
     */
    public static class Builder {
        private final List<String> suppress = new ArrayList<>();
        private final List<String> force = new ArrayList<>();

        public Builder suppress(String... ids) {
            suppress.addAll(List.of(ids));
            return this;
        }

        public Builder force(String... ids) {
            force.addAll(List.of(ids));
            return this;
        }

        public PackageOverrides build() {
            return new PackageOverrides(suppress, force);
        }
    }
}
