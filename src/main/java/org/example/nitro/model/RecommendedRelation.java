package org.example.nitro.model;

import java.util.Objects;

/**
 * A recommendation relation reported by a package: a soft preference for
 * ({@code invert = false}) or against ({@code invert = true}) another package.
 */
public final class RecommendedRelation {

    private final String value;
    private final boolean invert;

    public RecommendedRelation(String value, boolean invert) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.invert = invert;
    }

    public static RecommendedRelation of(String value) {
        return new RecommendedRelation(value, false);
    }

    public static RecommendedRelation against(String value) {
        return new RecommendedRelation(value, true);
    }

    public String getValue() {
        return value;
    }

    public boolean isInvert() {
        return invert;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecommendedRelation that = (RecommendedRelation) o;
        return invert == that.invert && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, invert);
    }

    @Override
    public String toString() {
        return invert ? "!" + value : value;
    }
}
