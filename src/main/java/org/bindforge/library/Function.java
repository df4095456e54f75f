package org.bindforge.library;

import java.util.List;
import java.util.Optional;

/**
 * A native function of the described library.
 *
 * @param name The short name, e.g. {@code "get_name"}.
 * @param cIdentifier The exported C symbol, e.g. {@code "foo_widget_get_name"}.
 * @param owner The type this function belongs to, or {@code null} for a free function.
 * @param parameters The parameters in native call order, the instance parameter first.
 * @param ret The return value, or {@code null} for {@code void}.
 * @param throwsError Whether the function reports failures through a trailing error parameter.
 * @param deprecated Whether the function is deprecated.
 */
public record Function(
        String name,
        String cIdentifier,
        TypeId owner,
        List<Parameter> parameters,
        Parameter ret,
        boolean throwsError,
        boolean deprecated
) {

    public Function {
        parameters = List.copyOf(parameters);
    }

    public Optional<Parameter> returnValue() {
        return Optional.ofNullable(ret);
    }

    /**
     * @return {@code true} if the first parameter is the receiver of a method.
     */
    public boolean isMethod() {
        return !parameters.isEmpty() && parameters.get(0).instanceParameter();
    }
}
