package org.bindforge.library;

/**
 * A type definition of the described library. Element and alias targets are
 * stored as {@link TypeId}s and resolved through the owning {@link Library}.
 */
public sealed interface Type permits Type.FundamentalType, Type.AliasType, Type.EnumerationType,
        Type.BitfieldType, Type.RecordType, Type.UnionType, Type.ClassType, Type.InterfaceType,
        Type.CArrayType, Type.FixedArrayType, Type.ArrayType, Type.PtrArrayType, Type.ListType,
        Type.SListType, Type.HashTableType, Type.CallbackType, Type.CustomType {

    /**
     * @return The name of the type as referenced in library descriptions.
     */
    String name();

    default boolean isClass() {
        return this instanceof ClassType;
    }

    default boolean isInterface() {
        return this instanceof InterfaceType;
    }

    /**
     * A type is final unless it is an interface or a class open for subclassing.
     * @return {@code true} if no subtype can exist.
     */
    default boolean isFinalType() {
        if (this instanceof ClassType cls) {
            return cls.isFinal();
        }
        return !(this instanceof InterfaceType);
    }

    /**
     * @param fundamental The built-in type.
     */
    record FundamentalType(Fundamental fundamental) implements Type {
        @Override
        public String name() {
            return fundamental.giName();
        }
    }

    /**
     * @param name The alias name.
     * @param cType The C spelling of the alias.
     * @param target The aliased type.
     */
    record AliasType(String name, String cType, TypeId target) implements Type {}

    record EnumerationType(String name, String cType) implements Type {}

    record BitfieldType(String name, String cType) implements Type {}

    /**
     * @param name The record name.
     * @param cType The C spelling of the struct.
     * @param disguised Whether the struct is only ever handled by value as an opaque handle.
     * @param refcounted Whether instances are shared through ref/unref functions.
     */
    record RecordType(String name, String cType, boolean disguised, boolean refcounted) implements Type {}

    record UnionType(String name, String cType) implements Type {}

    /**
     * @param name The class name.
     * @param cType The C spelling of the instance struct.
     * @param isFinal Whether the class can not be subclassed.
     */
    record ClassType(String name, String cType, boolean isFinal) implements Type {}

    record InterfaceType(String name, String cType) implements Type {}

    /** A C array, typically paired with a length parameter. */
    record CArrayType(String name, TypeId element) implements Type {}

    /**
     * @param name The spelling of the array type.
     * @param element The element type.
     * @param size The fixed element count.
     */
    record FixedArrayType(String name, TypeId element, int size) implements Type {}

    /** A growable array ({@code GArray}). */
    record ArrayType(String name, TypeId element) implements Type {}

    /** An array of pointers ({@code GPtrArray}). */
    record PtrArrayType(String name, TypeId element) implements Type {}

    /** A doubly linked list. */
    record ListType(String name, TypeId element) implements Type {}

    /** A singly linked list. */
    record SListType(String name, TypeId element) implements Type {}

    record HashTableType(String name, TypeId key, TypeId value) implements Type {}

    /** A function pointer type. */
    record CallbackType(String name, String cType) implements Type {}

    /**
     * A type with hand-written glue.
     * @param name The type name.
     * @param borrowed Whether the glue converts by borrowing the value.
     */
    record CustomType(String name, boolean borrowed) implements Type {}
}
