package org.example.nitro.model;

import java.util.Objects;

/**
 * A dependency relation reported by a package.
 * An explicit dependency is only satisfied when the user requires the target themselves.
 */
public final class RequiredPackage {

    private final String value;
    private final boolean explicit;

    public RequiredPackage(String value, boolean explicit) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.explicit = explicit;
    }

    public static RequiredPackage of(String value) {
        return new RequiredPackage(value, false);
    }

    public static RequiredPackage explicit(String value) {
        return new RequiredPackage(value, true);
    }

    public String getValue() {
        return value;
    }

    public boolean isExplicit() {
        return explicit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequiredPackage that = (RequiredPackage) o;
        return explicit == that.explicit && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, explicit);
    }

    @Override
    public String toString() {
        return explicit ? value + " (explicit)" : value;
    }
}
