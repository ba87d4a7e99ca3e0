package org.example.nitro.model;

/**
 * Package identifier rules.
 */
public final class PackageIds {

    /**
     * The maximum length for a package identifier.
     */
    public static final int MAX_LENGTH = 32;

    private PackageIds() {
    }

    /**
     * Checks if a package identifier is valid: lowercase ASCII letters, digits
     * and hyphens, between 1 and {@value #MAX_LENGTH} characters.
     */
    public static boolean isValid(String id) {
        if (id == null || id.isEmpty() || id.length() > MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }
}
