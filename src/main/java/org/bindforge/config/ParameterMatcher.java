package org.bindforge.config;

import java.util.List;

/**
 * Lookups over the configured entries of one function.
 */
public final class ParameterMatcher {

    private ParameterMatcher() {}

    /**
     * Collects the parameter entries of all given functions that match a parameter name,
     * in configuration order.
     * @param functions The configured functions matched for the function being lowered.
     * @param name The (mangled) parameter name.
     * @return The matching parameter entries, possibly empty.
     */
    public static List<ParameterConfig> matchedParameters(List<FunctionConfig> functions, String name) {
        return functions.stream()
                .flatMap(f -> f.parameters().stream())
                .filter(p -> p.ident().matches(name))
                .toList();
    }
}
