package org.bindforge.analysis;

import org.bindforge.env.Env;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;

/**
 * How a value of a type crosses the native boundary.
 */
public enum ConversionType {
    /** Passed as is, the native and surface representations are identical. */
    DIRECT,
    /** Copied through a cheap value conversion. */
    SCALAR,
    /** Converted through pointer glue, ownership may change hands. */
    POINTER,
    /** Passed by borrowing the value with no conversion. */
    BORROW,
    /** No conversion is known; generated code needs manual review. */
    UNKNOWN;

    private static final String QUARK_C_TYPE = "GQuark";

    /**
     * Classifies a type. Total over the library: shapes without a known conversion
     * yield {@link #UNKNOWN}.
     * @param env The environment holding the type.
     * @param typ The type to classify.
     * @return The conversion category.
     */
    public static ConversionType of(Env env, TypeId typ) {
        Type type = env.type(typ);
        if (type instanceof Type.FundamentalType fundamental) {
            return switch (fundamental.fundamental()) {
                case BOOLEAN, UNICHAR, GTYPE -> SCALAR;
                case INT8, UINT8, INT16, UINT16, INT32, UINT32, INT64, UINT64,
                        CHAR, UCHAR, SHORT, USHORT, INT, UINT, LONG, ULONG,
                        SIZE, SSIZE, INT_PTR, UINT_PTR, FLOAT, DOUBLE -> DIRECT;
                case UTF8, FILENAME, OS_STRING, POINTER -> POINTER;
                case NONE, VAR_ARGS, UNSUPPORTED -> UNKNOWN;
            };
        }
        if (type instanceof Type.AliasType) {
            return ofAlias(env, typ);
        }
        if (type instanceof Type.EnumerationType || type instanceof Type.BitfieldType) {
            return SCALAR;
        }
        if (type instanceof Type.RecordType record) {
            return record.disguised() ? DIRECT : POINTER;
        }
        if (type instanceof Type.UnionType
                || type instanceof Type.ClassType
                || type instanceof Type.InterfaceType
                || type instanceof Type.CArrayType
                || type instanceof Type.ArrayType
                || type instanceof Type.PtrArrayType
                || type instanceof Type.ListType
                || type instanceof Type.SListType
                || type instanceof Type.HashTableType) {
            return POINTER;
        }
        if (type instanceof Type.CallbackType) {
            return DIRECT;
        }
        if (type instanceof Type.CustomType custom) {
            return custom.borrowed() ? BORROW : UNKNOWN;
        }
        return UNKNOWN;
    }

    /**
     * @return {@code true} if no ownership can cross the boundary for values of this category.
     */
    public boolean isValue() {
        return this == DIRECT || this == SCALAR;
    }

    private static ConversionType ofAlias(Env env, TypeId typ) {
        TypeId current = typ;
        // A quark anywhere along the chain wins; the type count bounds a cyclic chain.
        for (int hops = 0; hops <= env.library().typeCount(); hops++) {
            if (!(env.type(current) instanceof Type.AliasType alias)) {
                return of(env, current);
            }
            if (QUARK_C_TYPE.equals(alias.cType())) {
                return SCALAR;
            }
            current = alias.target();
        }
        return UNKNOWN;
    }
}
