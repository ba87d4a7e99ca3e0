package org.example.nitro.resolver;

import org.example.nitro.model.DependencyKind;
import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.VersionPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulated resolver state for one package id.
 *
 * <p>Created the first time the id is required and never removed. Version
 * constraints move from the uncanonicalized list to the canonicalized list once
 * the evaluator has translated them; the original is remembered so it is never
 * translated twice.</p>
 */
final class Dependency {

    private final PackageRequest pkg;
    private DependencyKind kind;
    private boolean userRequested;
    private boolean rootRequested;
    private final Set<String> requesters = new LinkedHashSet<>();

    private final List<VersionPattern> uncanonicalizedConstraints = new ArrayList<>();
    private final List<VersionPattern> canonicalizedConstraints = new ArrayList<>();
    private final List<VersionPattern> alreadyCanonicalizedConstraints = new ArrayList<>();

    private List<String> requiredContentVersions = List.of();
    private List<String> preferredContentVersions = List.of();

    Dependency(PackageRequest pkg, DependencyKind kind) {
        this.pkg = Objects.requireNonNull(pkg, "pkg cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    /**
     * The first request seen for this id.
     */
    PackageRequest getPkg() {
        return pkg;
    }

    DependencyKind getKind() {
        return kind;
    }

    void raiseKind(DependencyKind newKind) {
        kind = kind.max(newKind);
    }

    /**
     * Whether the user asked for this package directly, or through bundles of a package they asked for.
     */
    boolean isUserRequested() {
        return userRequested;
    }

    void markUserRequested() {
        userRequested = true;
    }

    void addRequester(String parentId) {
        requesters.add(parentId);
    }

    /**
     * Marks this package as asked for by the user rather than by another package.
     */
    void markRootRequested() {
        rootRequested = true;
    }

    boolean isRootRequested() {
        return rootRequested;
    }

    /**
     * Ids of the packages whose relations required this one.
     */
    Set<String> getRequesters() {
        return Collections.unmodifiableSet(requesters);
    }

    /**
     * Records a new version constraint.
     *
     * @return true if the constraint was not known before
     */
    boolean addConstraint(VersionPattern pattern) {
        if (pattern.isAny()
                || uncanonicalizedConstraints.contains(pattern)
                || canonicalizedConstraints.contains(pattern)
                || alreadyCanonicalizedConstraints.contains(pattern)) {
            return false;
        }
        uncanonicalizedConstraints.add(pattern);
        return true;
    }

    List<VersionPattern> getUncanonicalizedConstraints() {
        return Collections.unmodifiableList(uncanonicalizedConstraints);
    }

    /**
     * Moves a raw constraint to the canonical list under its translated form.
     */
    void canonicalize(VersionPattern original, VersionPattern canonical) {
        uncanonicalizedConstraints.remove(original);
        alreadyCanonicalizedConstraints.add(original);
        if (!canonical.isAny() && !canonicalizedConstraints.contains(canonical)) {
            canonicalizedConstraints.add(canonical);
        }
    }

    List<VersionPattern> getCanonicalizedConstraints() {
        return Collections.unmodifiableList(canonicalizedConstraints);
    }

    List<String> getRequiredContentVersions() {
        return requiredContentVersions;
    }

    List<String> getPreferredContentVersions() {
        return preferredContentVersions;
    }

    void setContentVersions(List<String> required, List<String> preferred) {
        this.requiredContentVersions = List.copyOf(required);
        this.preferredContentVersions = List.copyOf(preferred);
    }

    @Override
    public String toString() {
        return "Dependency{" + pkg.getId() +
                ", kind=" + kind +
                ", constraints=" + canonicalizedConstraints +
                ", pending=" + uncanonicalizedConstraints + '}';
    }
}
