package org.bindforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Per-parameter overrides of one configured function.
 *
 * @param ident Which parameters the entry applies to.
 * @param nullable Replacement nullability, or {@code null} to keep the declared one.
 * @param constant Whether the parameter is never mutated by the callee.
 * @param lengthOf Name of the array parameter whose length this parameter holds, or {@code null}.
 * @param stringType Forced string representation, or {@code null}.
 */
public record ParameterConfig(
        Ident ident,
        Boolean nullable,
        boolean constant,
        String lengthOf,
        StringType stringType
) {

    static ParameterConfig fromConfig(Config config) {
        StringType stringType = null;
        if (config.hasPath("string-type")) {
            String value = config.getString("string-type");
            try {
                stringType = StringType.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(config.origin(), "string-type",
                        "Unknown string type '" + value + "'", e);
            }
        }
        return new ParameterConfig(
                Ident.fromConfig(config),
                config.hasPath("nullable") ? config.getBoolean("nullable") : null,
                config.hasPath("const") && config.getBoolean("const"),
                config.hasPath("length-of") ? config.getString("length-of") : null,
                stringType);
    }
}
