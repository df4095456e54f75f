package org.bindforge.config;

/**
 * Visibility of a generated function.
 */
public enum Visibility {
    PUBLIC,
    CRATE,
    PRIVATE,
    HIDDEN;

    public static Visibility parse(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
