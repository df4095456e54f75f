package org.bindforge.analysis;

import org.bindforge.config.ParameterConfig;
import org.bindforge.env.Env;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;

import java.util.List;
import java.util.Objects;

/**
 * Applies the configured {@code string-type} of a parameter.
 */
public final class OverrideStringType {

    private OverrideStringType() {}

    /**
     * Replaces a string type with the first configured string representation.
     * Types that are not strings are returned unchanged.
     * @param env The environment holding the type.
     * @param typ The declared parameter type.
     * @param configuredParameters The configuration entries matching the parameter.
     * @return The type to lower the parameter with.
     */
    public static TypeId parameter(Env env, TypeId typ, List<ParameterConfig> configuredParameters) {
        return configuredParameters.stream()
                .map(ParameterConfig::stringType)
                .filter(Objects::nonNull)
                .findFirst()
                .map(stringType -> {
                    if (env.type(typ) instanceof Type.FundamentalType fundamental
                            && fundamental.fundamental().isString()) {
                        return env.library().fundamental(stringType.fundamental());
                    }
                    return typ;
                })
                .orElse(typ);
    }
}
