package org.bindforge.analysis.special;

import org.bindforge.analysis.FunctionInfo;
import org.bindforge.env.Env;
import org.bindforge.library.Fundamental;
import org.bindforge.library.Function;
import org.bindforge.library.Parameter;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.Transfer;
import org.bindforge.library.Type;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The special functions of a library, keyed by C identifier.
 */
public final class SpecialFunctions {

    private static final Set<String> STRINGIFY_NAMES = Set.of("to_string", "to_str", "get_name", "get_nick");
    private static final Map<String, SpecialFunctionType> BY_NAME = Map.of(
            "copy", SpecialFunctionType.COPY,
            "free", SpecialFunctionType.FREE,
            "ref", SpecialFunctionType.REF,
            "unref", SpecialFunctionType.UNREF,
            "hash", SpecialFunctionType.HASH,
            "equal", SpecialFunctionType.EQUAL,
            "compare", SpecialFunctionType.COMPARE,
            "to_string", SpecialFunctionType.TO_STRING);

    private final Map<String, SpecialFunctionType> functions;

    private SpecialFunctions(Map<String, SpecialFunctionType> functions) {
        this.functions = Collections.unmodifiableMap(functions);
    }

    /**
     * Collects the special functions among analyzed functions.
     * @param infos The analyzed functions.
     * @return The special functions keyed by C identifier.
     */
    public static SpecialFunctions of(List<FunctionInfo> infos) {
        Map<String, SpecialFunctionType> functions = new HashMap<>();
        for (FunctionInfo info : infos) {
            if (info.special() != null) {
                functions.put(info.cIdentifier(), info.special());
            }
        }
        return new SpecialFunctions(functions);
    }

    public Optional<SpecialFunctionType> get(String cIdentifier) {
        return Optional.ofNullable(functions.get(cIdentifier));
    }

    public Map<String, SpecialFunctionType> functions() {
        return functions;
    }

    /**
     * Classifies a function by its name and shape.
     * @param env The environment holding the types.
     * @param function The function to classify.
     * @return The special function type, or empty for an ordinary function.
     */
    public static Optional<SpecialFunctionType> classify(Env env, Function function) {
        if (STRINGIFY_NAMES.contains(function.name()) && isStaticStringify(env, function)) {
            return Optional.of(SpecialFunctionType.STATIC_STRINGIFY);
        }
        SpecialFunctionType type = BY_NAME.get(function.name());
        if (type == null || function.owner() == null) {
            return Optional.empty();
        }
        // Lifecycle helpers take exactly their receiver; comparisons take one more value.
        int expectedParameters = switch (type) {
            case EQUAL, COMPARE -> 2;
            default -> 1;
        };
        return function.parameters().size() == expectedParameters ? Optional.of(type) : Optional.empty();
    }

    private static boolean isStaticStringify(Env env, Function function) {
        if (function.owner() == null || function.parameters().size() != 1) {
            return false;
        }
        Type owner = env.type(function.owner());
        if (!(owner instanceof Type.EnumerationType) && !(owner instanceof Type.BitfieldType)) {
            return false;
        }
        Parameter value = function.parameters().get(0);
        if (value.direction() != ParameterDirection.IN || !value.typ().equals(function.owner())) {
            return false;
        }
        return function.returnValue()
                .filter(ret -> ret.transfer() == Transfer.NONE)
                .map(ret -> env.type(env.resolveAlias(ret.typ())))
                .filter(t -> t instanceof Type.FundamentalType f && f.fundamental() == Fundamental.UTF8)
                .isPresent();
    }
}
