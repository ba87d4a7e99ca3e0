package org.example.nitro.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Properties a package declares about itself, as reported by the evaluator.
 */
public class PackageProperties {

    private final List<String> contentVersions;
    private final List<String> features;
    private final List<String> defaultFeatures;

    private PackageProperties(Builder builder) {
        this.contentVersions = builder.contentVersions == null ? null : List.copyOf(builder.contentVersions);
        this.features = List.copyOf(builder.features);
        this.defaultFeatures = List.copyOf(builder.defaultFeatures);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Properties of a package that declares nothing.
     */
    public static PackageProperties empty() {
        return builder().build();
    }

    /**
     * The content versions this package publishes, in the package's own order,
     * or empty if it does not version its content.
     */
    public Optional<List<String>> getContentVersions() {
        return Optional.ofNullable(contentVersions);
    }

    public List<String> getFeatures() {
        return features;
    }

    public List<String> getDefaultFeatures() {
        return defaultFeatures;
    }

    @Override
    public String toString() {
        return "PackageProperties{" +
                "contentVersions=" + contentVersions +
                ", features=" + features +
                ", defaultFeatures=" + defaultFeatures +
                '}';
    }

    /**
     * Builder for PackageProperties.
     */
    public static class Builder {
        private List<String> contentVersions;
        private List<String> features = new ArrayList<>();
        private List<String> defaultFeatures = new ArrayList<>();

        public Builder contentVersions(List<String> contentVersions) {
            this.contentVersions = contentVersions;
            return this;
        }

        public Builder contentVersions(String... contentVersions) {
            this.contentVersions = List.of(contentVersions);
            return this;
        }

        public Builder features(List<String> features) {
            this.features = features != null ? features : Collections.emptyList();
            return this;
        }

        public Builder defaultFeatures(List<String> defaultFeatures) {
            this.defaultFeatures = defaultFeatures != null ? defaultFeatures : Collections.emptyList();
            return this;
        }

        public PackageProperties build() {
            return new PackageProperties(this);
        }
    }
}
