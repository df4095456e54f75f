package org.bindforge.library;

/**
 * Ownership transfer across the native call boundary.
 */
public enum Transfer {
    /** Nothing changes hands, the value is borrowed. */
    NONE,
    /** The container changes hands, its elements are borrowed. */
    CONTAINER,
    /** The value and everything it owns changes hands. */
    FULL
}
