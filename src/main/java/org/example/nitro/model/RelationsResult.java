package org.example.nitro.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The relations a package declared when it was evaluated.
 *
 * <p>Dependencies arrive in groups; groups carry no either/or meaning and are
 * flattened by the resolver.</p>
 */
public class RelationsResult {

    private final List<String> conflicts;
    private final List<List<RequiredPackage>> deps;
    private final List<String> bundled;
    private final List<Map.Entry<String, String>> compats;
    private final List<String> extensions;
    private final List<RecommendedRelation> recommendations;

    private RelationsResult(Builder builder) {
        this.conflicts = List.copyOf(builder.conflicts);
        List<List<RequiredPackage>> groups = new ArrayList<>();
        for (List<RequiredPackage> group : builder.deps) {
            groups.add(List.copyOf(group));
        }
        this.deps = List.copyOf(groups);
        this.bundled = List.copyOf(builder.bundled);
        this.compats = List.copyOf(builder.compats);
        this.extensions = List.copyOf(builder.extensions);
        this.recommendations = List.copyOf(builder.recommendations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A result with no relations at all.
     */
    public static RelationsResult empty() {
        return builder().build();
    }

    public List<String> getConflicts() {
        return conflicts;
    }

    public List<List<RequiredPackage>> getDeps() {
        return deps;
    }

    public List<String> getBundled() {
        return bundled;
    }

    /**
     * Compat pairs: when the key package is installed, the value package must be too.
     */
    public List<Map.Entry<String, String>> getCompats() {
        return compats;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public List<RecommendedRelation> getRecommendations() {
        return recommendations;
    }

    /**
     * Builder for RelationsResult.
     */
    public static class Builder {
        private final List<String> conflicts = new ArrayList<>();
        private final List<List<RequiredPackage>> deps = new ArrayList<>();
        private final List<String> bundled = new ArrayList<>();
        private final List<Map.Entry<String, String>> compats = new ArrayList<>();
        private final List<String> extensions = new ArrayList<>();
        private final List<RecommendedRelation> recommendations = new ArrayList<>();

        public Builder conflict(String id) {
            conflicts.add(id);
            return this;
        }

        public Builder dependency(String id) {
            deps.add(List.of(RequiredPackage.of(id)));
            return this;
        }

        public Builder explicitDependency(String id) {
            deps.add(List.of(RequiredPackage.explicit(id)));
            return this;
        }

        public Builder dependencyGroup(List<RequiredPackage> group) {
            deps.add(group);
            return this;
        }

        public Builder bundle(String id) {
            bundled.add(id);
            return this;
        }

        public Builder compat(String checkPackage, String compatPackage) {
            compats.add(Map.entry(checkPackage, compatPackage));
            return this;
        }

        public Builder extension(String id) {
            extensions.add(id);
            return this;
        }

        public Builder recommendation(RecommendedRelation recommendation) {
            recommendations.add(recommendation);
            return this;
        }

        public RelationsResult build() {
            return new RelationsResult(this);
        }
    }
}
