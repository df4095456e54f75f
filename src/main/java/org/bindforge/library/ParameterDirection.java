package org.bindforge.library;

/**
 * Data flow direction of a native parameter.
 */
public enum ParameterDirection {
    /** Value passed into the call. */
    IN,
    /** Value written by the callee. */
    OUT,
    /** Value passed in and updated by the callee. */
    IN_OUT,
    /** The return value slot. */
    RETURN
}
