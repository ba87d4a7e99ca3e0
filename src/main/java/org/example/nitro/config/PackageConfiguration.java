package org.example.nitro.config;

import org.example.nitro.evaluator.ConfiguredPackage;
import org.example.nitro.exception.ConfigurationException;
import org.example.nitro.model.PackageProperties;
import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.RequestSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of a single package the user asked for.
 */
public class PackageConfiguration implements ConfiguredPackage<StandardEvalInput> {

    /**
     * Request text in the form {@code [repository:]id[@version]}.
     */
    private final String request;

    /**
     * Whether failures while evaluating this package may be ignored.
     * Default: false
     */
    private final boolean optional;

    /**
     * Features enabled in addition to (or instead of) the package defaults.
     */
    private final List<String> features;

    /**
     * Whether the package's default features are enabled.
     * Default: true
     */
    private final boolean useDefaultFeatures;

    /**
     * Stability for this package. Null keeps the instance default.
     */
    private final PackageStability stability;

    private final PackageRequest parsedRequest;

    private PackageConfiguration(Builder builder) {
        this.request = Objects.requireNonNull(builder.request, "request cannot be null");
        this.optional = builder.optional;
        this.features = List.copyOf(builder.features);
        this.useDefaultFeatures = builder.useDefaultFeatures;
        this.stability = builder.stability;
        this.parsedRequest = PackageRequest.parse(request, RequestSource.userRequire());
    }

    public static Builder builder(String request) {
        return new Builder(request);
    }

    /**
     * Default configuration for a package request.
     */
    public static PackageConfiguration of(String request) {
        return builder(request).build();
    }

    public String getRequest() {
        return request;
    }

    @Override
    public PackageRequest getPackage() {
        return parsedRequest;
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    public List<String> getFeatures() {
        return features;
    }

    public boolean isUseDefaultFeatures() {
        return useDefaultFeatures;
    }

    public PackageStability getStability() {
        return stability;
    }

    /**
     * Computes the enabled features: configured ones first, then the package
     * defaults when enabled, without duplicates.
     *
     * @throws ConfigurationException if a configured feature is not declared by a
     *                                package that declares features
     */
    public List<String> calculateFeatures(PackageProperties properties) throws ConfigurationException {
        List<String> declared = properties.getFeatures();
        if (!declared.isEmpty()) {
            for (String feature : features) {
                if (!declared.contains(feature)) {
                    throw new ConfigurationException("Configured feature '" + feature
                            + "' does not exist in package '" + parsedRequest.getId() + "'");
                }
            }
        }

        Set<String> out = new LinkedHashSet<>(features);
        if (useDefaultFeatures) {
            out.addAll(properties.getDefaultFeatures());
        }
        return new ArrayList<>(out);
    }

    @Override
    public void overrideConfiguredPackageInput(PackageProperties properties, StandardEvalInput input)
            throws ConfigurationException {
        input.setFeatures(calculateFeatures(properties));
        if (stability != null) {
            input.setStability(stability);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageConfiguration that = (PackageConfiguration) o;
        return optional == that.optional &&
                useDefaultFeatures == that.useDefaultFeatures &&
                request.equals(that.request) &&
                features.equals(that.features) &&
                stability == that.stability;
    }

    @Override
    public int hashCode() {
        return Objects.hash(request, optional, features, useDefaultFeatures, stability);
    }

    @Override
    public String toString() {
        return "PackageConfiguration{" +
                "request='" + request + '\'' +
                ", optional=" + optional +
                ", features=" + features +
                ", useDefaultFeatures=" + useDefaultFeatures +
                ", stability=" + stability +
                '}';
    }

    /**
     * Builder for PackageConfiguration.
     */
    public static class Builder {
        private final String request;
        private boolean optional = false;
        private List<String> features = new ArrayList<>();
        private boolean useDefaultFeatures = true;
        private PackageStability stability;

        private Builder(String request) {
            this.request = request;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder features(List<String> features) {
            this.features = features != null ? new ArrayList<>(features) : new ArrayList<>();
            return this;
        }

        public Builder feature(String feature) {
            this.features.add(feature);
            return this;
        }

        public Builder useDefaultFeatures(boolean useDefaultFeatures) {
            this.useDefaultFeatures = useDefaultFeatures;
            return this;
        }

        public Builder stability(PackageStability stability) {
            this.stability = stability;
            return this;
        }

        public PackageConfiguration build() {
            return new PackageConfiguration(this);
        }
    }
}
