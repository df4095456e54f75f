package org.bindforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Typed view of the {@code bindforge} configuration tree.
 *
 * @param sysCrateName Name of the crate holding the raw foreign declarations.
 * @param threads Number of worker threads used to analyze a library.
 * @param functions The configured function overrides, in configuration order.
 */
public record GeneratorConfig(String sysCrateName, int threads, List<FunctionConfig> functions) {

    private static final String SYS_CRATE_KEY = "sys-crate";
    private static final String THREADS_KEY = "analysis.threads";
    private static final String FUNCTIONS_KEY = "functions";

    public GeneratorConfig {
        functions = List.copyOf(functions);
    }

    /**
     * Reads the generator settings from a resolved configuration.
     * @param config The root configuration.
     * @return The typed configuration.
     * @throws com.typesafe.config.ConfigException if an entry is malformed.
     */
    public static GeneratorConfig fromConfig(Config config) {
        String sysCrate = config.hasPath(SYS_CRATE_KEY) ? config.getString(SYS_CRATE_KEY) : "ffi";
        int threads = config.hasPath(THREADS_KEY) ? Math.max(1, config.getInt(THREADS_KEY)) : 1;
        List<FunctionConfig> functions = config.hasPath(FUNCTIONS_KEY)
                ? config.getConfigList(FUNCTIONS_KEY).stream().map(FunctionConfig::fromConfig).toList()
                : List.of();
        return new GeneratorConfig(sysCrate, threads, functions);
    }

    /**
     * Finds every function entry whose identifier matches the C identifier or the short name.
     * @param cIdentifier The exported symbol.
     * @param name The short name.
     * @return The matching entries in configuration order.
     */
    public List<FunctionConfig> matchedFunctions(String cIdentifier, String name) {
        return functions.stream()
                .filter(f -> f.ident().matches(cIdentifier) || f.ident().matches(name))
                .toList();
    }
}
