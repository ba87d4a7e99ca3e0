package org.example.nitro.config;

import java.util.Objects;

/**
 * Evaluation settings that are the same for every package of an instance.
 */
public final class EvalConstants {

    private final String gameVersion;
    private final String loader;
    private final PackageStability defaultStability;

    public EvalConstants(String gameVersion, String loader, PackageStability defaultStability) {
        this.gameVersion = Objects.requireNonNull(gameVersion, "gameVersion cannot be null");
        this.loader = Objects.requireNonNull(loader, "loader cannot be null");
        this.defaultStability = defaultStability != null ? defaultStability : PackageStability.getDefault();
    }

    public String getGameVersion() {
        return gameVersion;
    }

    public String getLoader() {
        return loader;
    }

    /**
     * Stability used for packages that do not configure their own.
     */
    public PackageStability getDefaultStability() {
        return defaultStability;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EvalConstants that = (EvalConstants) o;
        return gameVersion.equals(that.gameVersion) &&
                loader.equals(that.loader) &&
                defaultStability == that.defaultStability;
    }

    @Override
    public int hashCode() {
        return Objects.hash(gameVersion, loader, defaultStability);
    }

    @Override
    public String toString() {
        return "EvalConstants{" +
                "gameVersion='" + gameVersion + '\'' +
                ", loader='" + loader + '\'' +
                ", defaultStability=" + defaultStability +
                '}';
    }
}
