package org.bindforge.analysis;

import org.bindforge.analysis.parameters.ParameterLowering;
import org.bindforge.analysis.parameters.ParameterSet;
import org.bindforge.analysis.special.SpecialFunctions;
import org.bindforge.config.FunctionConfig;
import org.bindforge.config.Visibility;
import org.bindforge.env.Env;
import org.bindforge.library.Function;
import org.bindforge.library.Type;
import org.bindforge.naming.NameUtil;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Analyzes a single native function: applies its configuration, decides the async
 * and trait context, and lowers its parameters.
 */
public final class FunctionAnalyzer {

    private static final String ASYNC_SUFFIX = "_async";
    private static final String CALLBACK_NAME = "callback";

    private FunctionAnalyzer() {}

    /**
     * @param env The environment holding the types and configuration.
     * @param function The function to analyze.
     * @return The analysis result, or empty if the configuration ignores the function.
     */
    public static Optional<FunctionInfo> analyze(Env env, Function function) {
        List<FunctionConfig> configured = env.config().matchedFunctions(function.cIdentifier(), function.name());
        if (configured.stream().anyMatch(FunctionConfig::ignore)) {
            return Optional.empty();
        }

        boolean async = configured.stream()
                .map(FunctionConfig::async)
                .filter(Objects::nonNull)
                .findFirst()
                .orElseGet(() -> isAsync(function));
        boolean inTrait = isInTrait(env, function);
        boolean disableLengthDetect = configured.stream().anyMatch(FunctionConfig::disableLengthDetect);

        ParameterSet parameters = ParameterLowering.lower(env, function.parameters(), configured,
                disableLengthDetect, async, inTrait);
        parameters.appendReturnLength(env, function.returnValue());

        String codegenName = configured.stream()
                .map(FunctionConfig::rename)
                .filter(Objects::nonNull)
                .findFirst()
                .orElseGet(() -> NameUtil.mangleKeywords(function.name()));
        Visibility visibility = configured.stream()
                .map(FunctionConfig::visibility)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(Visibility.PUBLIC);

        return Optional.of(new FunctionInfo(
                codegenName,
                function.cIdentifier(),
                function.owner(),
                visibility,
                async,
                inTrait,
                parameters,
                SpecialFunctions.classify(env, function).orElse(null),
                function.deprecated()));
    }

    static boolean isAsync(Function function) {
        return function.name().endsWith(ASYNC_SUFFIX)
                && function.parameters().stream().anyMatch(p -> CALLBACK_NAME.equals(p.name()));
    }

    /**
     * Methods of interfaces and of classes open for subclassing are generated inside
     * an extension trait.
     */
    static boolean isInTrait(Env env, Function function) {
        if (function.owner() == null || !function.isMethod()) {
            return false;
        }
        Type owner = env.type(function.owner());
        return owner.isInterface() || (owner.isClass() && !owner.isFinalType());
    }
}
