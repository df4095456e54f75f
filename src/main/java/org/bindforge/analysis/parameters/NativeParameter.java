package org.bindforge.analysis.parameters;

import org.bindforge.analysis.RefMode;
import org.bindforge.library.ParameterDirection;
import org.bindforge.library.ParameterScope;
import org.bindforge.library.Transfer;
import org.bindforge.library.TypeId;

/**
 * A parameter exactly as the foreign call needs it, with ownership and access resolved.
 *
 * @param name The (mangled) parameter name.
 * @param typ The working type, after string type overrides.
 * @param cType The C spelling of the parameter type.
 * @param instanceParameter Whether this is the receiver of a method.
 * @param direction The data flow direction.
 * @param nullable The resolved nullability.
 * @param transfer The resolved ownership transfer.
 * @param callerAllocates The resolved caller-allocates flag.
 * @param error Whether this is the trailing error out-parameter.
 * @param scope The lifetime of a callback value.
 * @param userDataIndex Position of the user data of this callback, or {@code null}.
 * @param destroyIndex Position of the destroy notification of this callback, or {@code null}.
 * @param refMode How the binding accesses the value.
 */
public record NativeParameter(
        String name,
        TypeId typ,
        String cType,
        boolean instanceParameter,
        ParameterDirection direction,
        boolean nullable,
        Transfer transfer,
        boolean callerAllocates,
        boolean error,
        ParameterScope scope,
        Integer userDataIndex,
        Integer destroyIndex,
        RefMode refMode
) {}
