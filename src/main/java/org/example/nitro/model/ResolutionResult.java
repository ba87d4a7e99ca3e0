package org.example.nitro.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result from package resolution.
 */
public class ResolutionResult {

    private final List<ResolvedPackage> packages;
    private final List<RecommendedPackage> unfulfilledRecommendations;

    public ResolutionResult(List<ResolvedPackage> packages, List<RecommendedPackage> unfulfilledRecommendations) {
        this.packages = List.copyOf(packages);
        this.unfulfilledRecommendations = List.copyOf(unfulfilledRecommendations);
    }

    /**
     * The packages to install, one per distinct package id.
     */
    public List<ResolvedPackage> getPackages() {
        return Collections.unmodifiableList(packages);
    }

    public List<RecommendedPackage> getUnfulfilledRecommendations() {
        return Collections.unmodifiableList(unfulfilledRecommendations);
    }

    /**
     * Returns the ids of all resolved packages, in result order.
     */
    public List<String> getPackageIds() {
        return packages.stream()
                .map(ResolvedPackage::getId)
                .collect(Collectors.toList());
    }

    public Optional<ResolvedPackage> findPackage(String id) {
        return packages.stream()
                .filter(p -> p.getId().equals(id))
                .findFirst();
    }

    public boolean contains(String id) {
        return findPackage(id).isPresent();
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "packages=" + getPackageIds() +
                ", unfulfilledRecommendations=" + unfulfilledRecommendations +
                '}';
    }
}
