package org.bindforge.analysis.special;

/**
 * Functions that code emission turns into trait implementations or dedicated helpers
 * instead of ordinary methods.
 */
public enum SpecialFunctionType {
    COPY,
    FREE,
    REF,
    UNREF,
    HASH,
    EQUAL,
    COMPARE,
    TO_STRING,
    /** Returns a static string describing an enumeration or bitfield value. */
    STATIC_STRINGIFY
}
