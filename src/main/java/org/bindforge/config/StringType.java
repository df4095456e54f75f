package org.bindforge.config;

import org.bindforge.library.Fundamental;

/**
 * Specialized string representations a parameter can be forced to.
 */
public enum StringType {
    UTF8(Fundamental.UTF8),
    FILENAME(Fundamental.FILENAME),
    OS_STRING(Fundamental.OS_STRING);

    private final Fundamental fundamental;

    StringType(Fundamental fundamental) {
        this.fundamental = fundamental;
    }

    public Fundamental fundamental() {
        return fundamental;
    }

    /**
     * @param value {@code utf8}, {@code filename} or {@code os_string}, case-insensitive.
     * @return The matching string type.
     * @throws IllegalArgumentException for any other value.
     */
    public static StringType parse(String value) {
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
