package org.example.nitro.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A constraint on the content versions of a package.
 *
 * <p>Three forms exist:</p>
 * <ul>
 *   <li>{@code Any} - every version is acceptable</li>
 *   <li>{@code Single(v)} - only version {@code v} is acceptable</li>
 *   <li>{@code Prefer(v)} - every version is acceptable, {@code v} is preferred</li>
 * </ul>
 *
 * <p>Text form: empty or {@code *} is {@code Any}, a leading {@code ~} marks
 * {@code Prefer}, anything else is {@code Single}.</p>
 */
public final class VersionPattern implements Comparable<VersionPattern> {

    /**
     * Pattern kinds, declared in ordering priority.
     */
    public enum Kind {
        ANY,
        SINGLE,
        PREFER
    }

    private static final VersionPattern ANY = new VersionPattern(Kind.ANY, null);

    private final Kind kind;
    private final String version;

    private VersionPattern(Kind kind, String version) {
        this.kind = kind;
        this.version = version;
    }

    public static VersionPattern any() {
        return ANY;
    }

    public static VersionPattern single(String version) {
        return new VersionPattern(Kind.SINGLE, Objects.requireNonNull(version, "version cannot be null"));
    }

    public static VersionPattern prefer(String version) {
        return new VersionPattern(Kind.PREFER, Objects.requireNonNull(version, "version cannot be null"));
    }

    /**
     * Parses a version pattern from its text form.
     */
    public static VersionPattern parse(String text) {
        if (text == null) {
            return ANY;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equals("*")) {
            return ANY;
        }
        if (trimmed.startsWith("~")) {
            String preferred = trimmed.substring(1);
            return preferred.isEmpty() ? ANY : prefer(preferred);
        }
        return single(trimmed);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the version named by this pattern, or null for {@code Any}.
     */
    public String getVersion() {
        return version;
    }

    public boolean isAny() {
        return kind == Kind.ANY;
    }

    /**
     * Filters candidate versions down to the ones this pattern accepts.
     * Candidate order is preserved.
     */
    public List<String> matches(List<String> candidates) {
        return switch (kind) {
            case ANY, PREFER -> new ArrayList<>(candidates);
            case SINGLE -> {
                List<String> out = new ArrayList<>();
                for (String candidate : candidates) {
                    if (candidate.equals(version)) {
                        out.add(candidate);
                    }
                }
                yield out;
            }
        };
    }

    @Override
    public int compareTo(VersionPattern other) {
        int byKind = kind.compareTo(other.kind);
        if (byKind != 0) {
            return byKind;
        }
        if (version == null || other.version == null) {
            return version == null ? (other.version == null ? 0 : -1) : 1;
        }
        return version.compareTo(other.version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionPattern that = (VersionPattern) o;
        return kind == that.kind && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, version);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ANY -> "*";
            case SINGLE -> version;
            case PREFER -> "~" + version;
        };
    }
}
