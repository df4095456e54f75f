package org.bindforge.analysis.parameters;

import org.bindforge.analysis.RefMode;
import org.bindforge.library.Transfer;

/**
 * One conversion instruction of a {@link ParameterSet}. Variants are immutable;
 * a changed variant is a new value.
 */
public sealed interface TransformationType permits TransformationType.ToNativeDirect,
        TransformationType.ToNativeScalar, TransformationType.ToNativePointer,
        TransformationType.ToNativeBorrow, TransformationType.ToNativeUnknown,
        TransformationType.Length, TransformationType.IntoRaw, TransformationType.ToSome {

    /**
     * @return {@code true} if this step converts a value for the native call,
     * {@code false} if it only links parameters.
     */
    default boolean isToNative() {
        return !(this instanceof Length);
    }

    /**
     * Sets the extra conversion suffix of a pointer conversion.
     * @param toNativeExtra The suffix, e.g. {@code ".as_ref()"}.
     * @return A pointer conversion carrying the suffix, or this step unchanged for other variants.
     */
    default TransformationType withToNativeExtra(String toNativeExtra) {
        return this;
    }

    record ToNativeDirect(String name) implements TransformationType {}

    record ToNativeScalar(String name, boolean nullable) implements TransformationType {}

    /**
     * @param name The parameter name.
     * @param instanceParameter Whether the value is the method receiver.
     * @param transfer The resolved ownership transfer.
     * @param refMode The resolved reference mode.
     * @param toNativeExtra Suffix applied before the conversion, empty if none.
     * @param explicitTargetType Target type spelled out in the conversion, empty if inferred.
     * @param pointerCast Cast applied to the converted pointer, empty if none.
     * @param inTrait Whether the function is generated inside a trait.
     * @param nullable Whether the surface value is optional.
     */
    record ToNativePointer(
            String name,
            boolean instanceParameter,
            Transfer transfer,
            RefMode refMode,
            String toNativeExtra,
            String explicitTargetType,
            String pointerCast,
            boolean inTrait,
            boolean nullable
    ) implements TransformationType {

        @Override
        public TransformationType withToNativeExtra(String toNativeExtra) {
            return new ToNativePointer(name, instanceParameter, transfer, refMode, toNativeExtra,
                    explicitTargetType, pointerCast, inTrait, nullable);
        }
    }

    /** Borrowed value, no conversion. */
    record ToNativeBorrow() implements TransformationType {}

    record ToNativeUnknown(String name) implements TransformationType {}

    /**
     * Links an array-bearing parameter with the parameter carrying its element count.
     * @param arrayName The array parameter, empty when the array is the return value.
     * @param lengthName The length parameter.
     * @param lengthType The printable type of the length parameter.
     */
    record Length(String arrayName, String lengthName, String lengthType) implements TransformationType {}

    /** Boxes the value into a raw owned pointer. */
    record IntoRaw(String name) implements TransformationType {}

    /** Wraps the value into a present optional value. */
    record ToSome(String name) implements TransformationType {}
}
