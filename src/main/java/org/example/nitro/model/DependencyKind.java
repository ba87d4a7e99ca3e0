package org.example.nitro.model;

/**
 * How strongly a package was required. Declared from weakest to strongest;
 * a package's kind only ever moves up.
 */
public enum DependencyKind {
    /** Required by another package. */
    REQUIRE,
    /** Bundled by another package. */
    BUNDLED,
    /** Required by the user. */
    USER_REQUIRE;

    /**
     * Returns the stronger of the two kinds.
     */
    public DependencyKind max(DependencyKind other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
