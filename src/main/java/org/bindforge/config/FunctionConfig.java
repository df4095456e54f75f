package org.bindforge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.List;

/**
 * Overrides for the functions matched by {@link #ident()}.
 *
 * @param ident Which functions the entry applies to, matched against the C identifier or the short name.
 * @param ignore Whether matched functions are not generated at all.
 * @param disableLengthDetect Whether the length naming heuristic is switched off.
 * @param async Forced async lowering, or {@code null} to detect it.
 * @param visibility Visibility of the generated function, or {@code null} for the default.
 * @param rename Name of the generated function, or {@code null} to derive it.
 * @param parameters Per-parameter overrides.
 */
public record FunctionConfig(
        Ident ident,
        boolean ignore,
        boolean disableLengthDetect,
        Boolean async,
        Visibility visibility,
        String rename,
        List<ParameterConfig> parameters
) {

    public FunctionConfig {
        parameters = List.copyOf(parameters);
    }

    static FunctionConfig fromConfig(Config config) {
        Visibility visibility = null;
        if (config.hasPath("visibility")) {
            String value = config.getString("visibility");
            try {
                visibility = Visibility.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(config.origin(), "visibility",
                        "Unknown visibility '" + value + "'", e);
            }
        }
        List<ParameterConfig> parameters = config.hasPath("parameters")
                ? config.getConfigList("parameters").stream().map(ParameterConfig::fromConfig).toList()
                : List.of();
        return new FunctionConfig(
                Ident.fromConfig(config),
                config.hasPath("ignore") && config.getBoolean("ignore"),
                config.hasPath("disable-length-detect") && config.getBoolean("disable-length-detect"),
                config.hasPath("async") ? config.getBoolean("async") : null,
                visibility,
                config.hasPath("rename") ? config.getString("rename") : null,
                parameters);
    }
}
