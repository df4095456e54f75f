package org.bindforge.analysis;

import org.bindforge.env.Env;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;

import java.util.Optional;

/**
 * Renders types as target-language source text.
 */
public final class TypeFormatter {

    private static final String UNIMPLEMENTED = "/*Unimplemented*/";

    private TypeFormatter() {}

    /**
     * Renders a type, marking shapes that have no target-language spelling.
     * @param env The environment holding the type.
     * @param typ The type to render.
     * @return The source text, prefixed with {@code /*Unimplemented*}{@code /} if there is no spelling.
     */
    public static String format(Env env, TypeId typ) {
        return tryFormat(env, typ).orElseGet(() -> UNIMPLEMENTED + env.type(typ).name());
    }

    /**
     * Renders a type if it has a target-language spelling.
     * @param env The environment holding the type.
     * @param typ The type to render.
     * @return The source text, or empty if the type can not be expressed.
     */
    public static Optional<String> tryFormat(Env env, TypeId typ) {
        Type type = env.type(typ);
        if (type instanceof Type.FundamentalType fundamental) {
            return Optional.ofNullable(switch (fundamental.fundamental()) {
                case NONE -> "()";
                case BOOLEAN -> "bool";
                case INT8, CHAR -> "i8";
                case UINT8, UCHAR -> "u8";
                case INT16, SHORT -> "i16";
                case UINT16, USHORT -> "u16";
                case INT32, INT -> "i32";
                case UINT32, UINT -> "u32";
                case INT64 -> "i64";
                case UINT64 -> "u64";
                case LONG -> "libc::c_long";
                case ULONG -> "libc::c_ulong";
                case SIZE, UINT_PTR -> "usize";
                case SSIZE, INT_PTR -> "isize";
                case FLOAT -> "f32";
                case DOUBLE -> "f64";
                case UNICHAR -> "char";
                case UTF8 -> "GString";
                case FILENAME -> "std::path::PathBuf";
                case OS_STRING -> "std::ffi::OsString";
                case GTYPE -> "glib::types::Type";
                case POINTER, VAR_ARGS, UNSUPPORTED -> null;
            });
        }
        if (type instanceof Type.CArrayType array) {
            return tryFormat(env, array.element()).map(e -> "Vec<" + e + ">");
        }
        if (type instanceof Type.ArrayType array) {
            return tryFormat(env, array.element()).map(e -> "Vec<" + e + ">");
        }
        if (type instanceof Type.PtrArrayType array) {
            return tryFormat(env, array.element()).map(e -> "Vec<" + e + ">");
        }
        if (type instanceof Type.ListType list) {
            return tryFormat(env, list.element()).map(e -> "Vec<" + e + ">");
        }
        if (type instanceof Type.SListType list) {
            return tryFormat(env, list.element()).map(e -> "Vec<" + e + ">");
        }
        if (type instanceof Type.FixedArrayType array) {
            return tryFormat(env, array.element()).map(e -> "[" + e + "; " + array.size() + "]");
        }
        if (type instanceof Type.HashTableType table) {
            Optional<String> key = tryFormat(env, table.key());
            Optional<String> value = tryFormat(env, table.value());
            if (key.isEmpty() || value.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of("HashMap<" + key.get() + ", " + value.get() + ">");
        }
        if (type instanceof Type.CustomType custom && !custom.borrowed()) {
            return Optional.empty();
        }
        // Named types are spelled by their name.
        return Optional.of(type.name());
    }
}
