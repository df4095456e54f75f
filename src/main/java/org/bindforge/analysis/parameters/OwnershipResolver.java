package org.bindforge.analysis.parameters;

import org.bindforge.analysis.ConversionType;
import org.bindforge.analysis.RefMode;
import org.bindforge.config.ParameterConfig;
import org.bindforge.env.Env;
import org.bindforge.library.Parameter;
import org.bindforge.library.Transfer;
import org.bindforge.library.TypeId;

import java.util.List;
import java.util.Objects;

/**
 * Resolves transfer, caller-allocates, nullability and reference mode of a native parameter.
 */
final class OwnershipResolver {

    /**
     * @param transfer The resolved ownership transfer.
     * @param callerAllocates The resolved caller-allocates flag.
     * @param nullable The resolved nullability.
     * @param refMode The resolved reference mode.
     */
    record Resolved(Transfer transfer, boolean callerAllocates, boolean nullable, RefMode refMode) {}

    private OwnershipResolver() {}

    /**
     * @param env The environment holding the parameter type.
     * @param par The native descriptor.
     * @param typ The working type of the parameter.
     * @param configuredParameters Configuration entries matching the parameter.
     * @param inTrait Whether the function is generated inside a trait.
     * @return The resolved flags.
     */
    static Resolved resolve(Env env, Parameter par, TypeId typ, List<ParameterConfig> configuredParameters,
                            boolean inTrait) {
        boolean callerAllocates = par.callerAllocates();
        Transfer transfer = par.transfer();
        if (ConversionType.of(env, typ).isValue()) {
            // Copyable values carry no ownership.
            callerAllocates = false;
            transfer = Transfer.NONE;
        }

        boolean immutable = configuredParameters.stream().anyMatch(ParameterConfig::constant);
        RefMode refMode = RefMode.withoutUnneededMut(env, par, immutable, inTrait && par.instanceParameter());

        boolean nullable = configuredParameters.stream()
                .map(ParameterConfig::nullable)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(par.nullable());

        return new Resolved(transfer, callerAllocates, nullable, refMode);
    }
}
