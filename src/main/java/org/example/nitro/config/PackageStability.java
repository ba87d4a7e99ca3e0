package org.example.nitro.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Which releases of a package's content are acceptable.
 */
public enum PackageStability {

    /**
     * Latest stable release only.
     */
    STABLE,

    /**
     * Latest release, including alphas and betas.
     */
    LATEST;

    public static PackageStability getDefault() {
        return STABLE;
    }

    /**
     * Parses {@code stable} or {@code latest}, case-insensitively.
     */
    public static Optional<PackageStability> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "stable" -> Optional.of(STABLE);
            case "latest" -> Optional.of(LATEST);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
