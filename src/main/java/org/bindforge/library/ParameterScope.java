package org.bindforge.library;

/**
 * Lifetime of a callback parameter.
 */
public enum ParameterScope {
    /** Valid only for the duration of the call. */
    CALL,
    /** Invoked once, after which it is released. */
    ASYNC,
    /** Valid until the paired destroy notification runs. */
    NOTIFIED,
    /** Never released. */
    FOREVER;

    public boolean isCall() {
        return this == CALL;
    }
}
