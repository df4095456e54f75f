package org.bindforge.analysis.parameters;

import org.bindforge.analysis.TypeFormatter;
import org.bindforge.config.ParameterConfig;
import org.bindforge.env.Env;
import org.bindforge.library.Parameter;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the array a length parameter belongs to.
 * <p>
 * Sources in priority order: a configured {@code length-of}, an array parameter's
 * own length link, and the naming heuristic. The heuristic ({@code ...len},
 * {@code ...length...} after an array-like parameter) is fuzzy and can be
 * switched off per function.
 */
final class ArrayLengthResolver {

    private final Env env;
    private final List<Parameter> parameters;
    private final boolean disableLengthDetect;
    // length parameter position -> array parameter name
    private final Map<Integer, String> arrayLengths = new HashMap<>();

    ArrayLengthResolver(Env env, List<Parameter> parameters, boolean disableLengthDetect) {
        this.env = env;
        this.parameters = parameters;
        this.disableLengthDetect = disableLengthDetect;
        for (Parameter par : parameters) {
            if (par.arrayLength() != null) {
                arrayLengths.put(par.arrayLength(), par.name());
            }
        }
    }

    /**
     * @param pos Position of the parameter in the descriptor list.
     * @param configuredParameters Configuration entries matching the parameter.
     * @return The unmangled name of the array whose length the parameter holds, if any.
     */
    Optional<String> arrayNameFor(int pos, List<ParameterConfig> configuredParameters) {
        Optional<String> configured = configuredParameters.stream()
                .map(ParameterConfig::lengthOf)
                .filter(Objects::nonNull)
                .findFirst();
        if (configured.isPresent()) {
            return configured;
        }
        String linked = arrayLengths.get(pos);
        if (linked != null) {
            return Optional.of(linked);
        }
        if (disableLengthDetect) {
            return Optional.empty();
        }
        return detectLength(pos);
    }

    private Optional<String> detectLength(int pos) {
        if (pos == 0 || !isLength(parameters.get(pos))) {
            return Optional.empty();
        }
        Parameter previous = parameters.get(pos - 1);
        return hasLength(env, previous.typ()) ? Optional.of(previous.name()) : Optional.empty();
    }

    /**
     * @param par A native parameter.
     * @return {@code true} if the name marks an input parameter as an element count.
     */
    static boolean isLength(Parameter par) {
        if (par.direction() != ParameterDirection.IN) {
            return false;
        }
        return par.name().endsWith("len") || par.name().contains("length");
    }

    /**
     * @param env The environment holding the type.
     * @param typ A parameter type.
     * @return {@code true} if values of the type are sequences with an element count.
     */
    static boolean hasLength(Env env, TypeId typ) {
        Type type = env.type(env.resolveAlias(typ));
        if (type instanceof Type.FundamentalType fundamental) {
            return fundamental.fundamental().isString();
        }
        return type instanceof Type.CArrayType
                || type instanceof Type.FixedArrayType
                || type instanceof Type.ArrayType
                || type instanceof Type.PtrArrayType
                || type instanceof Type.ListType
                || type instanceof Type.SListType
                || type instanceof Type.HashTableType;
    }

    static TransformationType.Length lengthType(Env env, String arrayName, String lengthName, TypeId lengthTyp) {
        return new TransformationType.Length(arrayName, lengthName, TypeFormatter.format(env, lengthTyp));
    }
}
