package org.example.nitro.config;

import java.util.Locale;

/**
 * The side a package is installed on.
 */
public enum Side {
    CLIENT,
    SERVER;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
