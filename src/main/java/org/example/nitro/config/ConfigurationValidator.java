package org.example.nitro.config;

import org.example.nitro.exception.ConfigurationException;
import org.example.nitro.model.PackageIds;
import org.example.nitro.model.PackageOverrides;
import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.RequestSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates configured packages and overrides before resolution.
 */
public class ConfigurationValidator {

    /**
     * Validates the configuration.
     *
     * @param packages  the configured packages
     * @param overrides the overrides, may be null
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(List<PackageConfiguration> packages, PackageOverrides overrides) {
        List<String> errors = new ArrayList<>();

        validatePackages(packages, errors);

        if (overrides != null) {
            validateOverrides(overrides, errors);
        }

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(List<PackageConfiguration> packages, PackageOverrides overrides)
            throws ConfigurationException {
        List<String> errors = validate(packages, overrides);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid package configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validatePackages(List<PackageConfiguration> packages, List<String> errors) {
        if (packages == null) {
            errors.add("packages is required");
            return;
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (PackageConfiguration config : packages) {
            String id = config.getPackage().getId();
            if (!PackageIds.isValid(id)) {
                errors.add("Invalid package id '" + id + "' in request '" + config.getRequest() + "'");
            }
            if (!seen.add(id)) {
                duplicates.add(id);
            }
            for (String feature : config.getFeatures()) {
                if (isBlank(feature)) {
                    errors.add("Package '" + id + "' contains an empty feature");
                }
            }
        }

        for (String id : duplicates) {
            errors.add("Package '" + id + "' is configured more than once");
        }
    }

    private void validateOverrides(PackageOverrides overrides, List<String> errors) {
        Set<String> suppressed = validateOverrideList(overrides.getSuppress(), "suppress", errors);
        Set<String> forced = validateOverrideList(overrides.getForce(), "force", errors);

        for (String id : suppressed) {
            if (forced.contains(id)) {
                errors.add("Package '" + id + "' is both suppressed and forced");
            }
        }
    }

    private Set<String> validateOverrideList(List<String> entries, String listName, List<String> errors) {
        Set<String> ids = new LinkedHashSet<>();
        for (String entry : entries) {
            if (isBlank(entry)) {
                errors.add(listName + " contains empty entry");
                continue;
            }
            String id = PackageRequest.parse(entry, RequestSource.userRequire()).getId();
            if (!PackageIds.isValid(id)) {
                errors.add(listName + " contains invalid package id: " + entry);
            }
            ids.add(id);
        }
        return ids;
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
