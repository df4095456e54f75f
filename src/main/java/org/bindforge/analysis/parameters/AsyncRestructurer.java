package org.bindforge.analysis.parameters;

/**
 * Rewrites the callback and user data slots of functions surfaced as async operations.
 * The user data carries the future's completion state across the foreign call, so
 * neither slot is an ordinary surface argument.
 */
final class AsyncRestructurer {

    static final String DATA_PARAM_NAME = "user_data";
    static final String CALLBACK_PARAM_NAME = "callback";

    private AsyncRestructurer() {}

    /**
     * @param name The declared parameter name.
     * @return {@code true} if the parameter is threaded through the future instead of the signature.
     */
    static boolean isRemovedFromSurface(String name) {
        // TODO: match the closure index of the callback instead of the name suffix
        return DATA_PARAM_NAME.equals(name) || name.endsWith("data");
    }

    /**
     * Replaces the primary step of the callback and user data slots.
     * @param primary The primary step of an async function's parameter.
     * @return The substituted step, or {@code primary} if the slot is an ordinary one.
     */
    static TransformationType substitute(TransformationType primary) {
        if (primary instanceof TransformationType.ToNativeDirect direct
                && CALLBACK_PARAM_NAME.equals(direct.name())) {
            return new TransformationType.ToSome(direct.name());
        }
        if (primary instanceof TransformationType.ToNativeUnknown unknown
                && CALLBACK_PARAM_NAME.equals(unknown.name())) {
            return new TransformationType.ToSome(unknown.name());
        }
        if (primary instanceof TransformationType.ToNativePointer pointer
                && DATA_PARAM_NAME.equals(pointer.name())) {
            return new TransformationType.IntoRaw(pointer.name());
        }
        return primary;
    }
}
