package org.bindforge.analysis;

import org.bindforge.env.Env;
import org.bindforge.library.Parameter;
import org.bindforge.library.Type;

/**
 * Rules for surfacing native out-parameters as return values.
 */
public final class OutParameters {

    private OutParameters() {}

    /**
     * Decides whether an out-parameter can be returned by the generated function
     * instead of being taken as an argument.
     * @param env The environment holding the parameter type.
     * @param par The out-parameter.
     * @return {@code true} if the value can be returned.
     */
    public static boolean canAsReturn(Env env, Parameter par) {
        return switch (ConversionType.of(env, par.typ())) {
            case DIRECT, SCALAR -> true;
            case POINTER -> {
                // C arrays of plain values are only returnable when their length is known.
                if (isCArrayWithDirectElements(env, par) && par.arrayLength() == null) {
                    yield false;
                }
                yield TypeFormatter.tryFormat(env, par.typ()).isPresent();
            }
            case BORROW, UNKNOWN -> false;
        };
    }

    private static boolean isCArrayWithDirectElements(Env env, Parameter par) {
        Type type = env.type(env.resolveAlias(par.typ()));
        return type instanceof Type.CArrayType array
                && ConversionType.of(env, array.element()) == ConversionType.DIRECT;
    }
}
