package org.bindforge.analysis;

import org.bindforge.env.Env;
import org.bindforge.library.Parameter;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;

/**
 * How the generated binding accesses a native parameter.
 */
public enum RefMode {
    /** By value or by ownership. */
    NONE,
    /** By shared reference. */
    BY_REF,
    /** By exclusive reference. */
    BY_REF_MUT,
    /** By shared reference although the native side takes a mutable pointer. */
    BY_REF_IMMUT,
    /** By shared reference to a constant. */
    BY_REF_CONST,
    /** By shared reference of a trait receiver, the reference is only nominal. */
    BY_REF_FAKE;

    /**
     * The reference mode implied by a type and the data flow direction alone.
     * @param env The environment holding the type.
     * @param typ The parameter type.
     * @param direction The parameter direction.
     * @return The base reference mode.
     */
    public static RefMode of(Env env, TypeId typ, ParameterDirection direction) {
        Type type = env.type(typ);
        boolean in = direction == ParameterDirection.IN;
        if (type instanceof Type.FundamentalType fundamental) {
            return fundamental.fundamental().isString() && in ? BY_REF : NONE;
        }
        if (type instanceof Type.ClassType
                || type instanceof Type.InterfaceType
                || type instanceof Type.ListType
                || type instanceof Type.SListType
                || type instanceof Type.PtrArrayType
                || type instanceof Type.CArrayType) {
            return in ? BY_REF : NONE;
        }
        if (type instanceof Type.RecordType record) {
            if (!in) {
                return NONE;
            }
            return record.refcounted() ? BY_REF : BY_REF_MUT;
        }
        if (type instanceof Type.UnionType) {
            return in ? BY_REF_MUT : NONE;
        }
        if (type instanceof Type.AliasType) {
            TypeId target = env.resolveAlias(typ);
            return env.type(target) instanceof Type.AliasType ? NONE : of(env, target, direction);
        }
        return NONE;
    }

    /**
     * Refines the base reference mode of a parameter, dropping exclusive access the
     * native side does not need.
     * @param env The environment holding the parameter type.
     * @param par The native parameter.
     * @param immutable Whether the configuration marks the parameter constant.
     * @param selfInTrait Whether the parameter is the receiver of a method generated inside a trait.
     * @return The reference mode to use for the parameter.
     */
    public static RefMode withoutUnneededMut(Env env, Parameter par, boolean immutable, boolean selfInTrait) {
        RefMode refMode = of(env, par.typ(), par.direction());
        if (refMode == BY_REF_MUT) {
            if (!isMutPtr(par.cType())) {
                return BY_REF;
            }
            return immutable ? BY_REF_IMMUT : BY_REF_MUT;
        }
        if (refMode == BY_REF && selfInTrait) {
            return isMutPtr(par.cType()) ? BY_REF_FAKE : BY_REF_CONST;
        }
        return refMode;
    }

    /**
     * @param cType A C type spelling.
     * @return {@code true} if the spelling is a pointer whose pointee is not {@code const}.
     */
    public static boolean isMutPtr(String cType) {
        if (cType == null) {
            return false;
        }
        String spelling = cType.trim();
        if (!spelling.endsWith("*")) {
            return false;
        }
        return !spelling.startsWith("const ") && !spelling.contains(" const");
    }
}
