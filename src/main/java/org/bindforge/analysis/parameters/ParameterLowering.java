package org.bindforge.analysis.parameters;

import org.bindforge.analysis.ConversionType;
import org.bindforge.analysis.OutParameters;
import org.bindforge.analysis.OverrideStringType;
import org.bindforge.config.FunctionConfig;
import org.bindforge.config.ParameterConfig;
import org.bindforge.config.ParameterMatcher;
import org.bindforge.env.Env;
import org.bindforge.library.Parameter;
import org.bindforge.library.Type;
import org.bindforge.library.TypeId;
import org.bindforge.naming.NameUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lowers the native parameter list of one function into a {@link ParameterSet}.
 * <p>
 * A parameter folded into a length link keeps its native entry but has no surface
 * entry and no primary conversion step. The pass is total: lookups that find nothing (no array for a length candidate,
 * no matching configuration, no return length link) skip the optional step, and
 * types without a known conversion produce a {@link TransformationType.ToNativeUnknown}.
 * It reads only its arguments, so different functions can be lowered concurrently.
 */
public final class ParameterLowering {

    private static final Logger LOG = LoggerFactory.getLogger(ParameterLowering.class);
    private static final String AS_REF_EXTRA = ".as_ref()";

    private ParameterLowering() {}

    /**
     * Lowers the parameters of a function.
     * @param env The environment holding the types and configuration.
     * @param functionParameters The native descriptors in call order.
     * @param configuredFunctions The configuration entries matching the function.
     * @param disableLengthDetect Whether the length naming heuristic is off.
     * @param asyncFunc Whether the function is surfaced as an async operation.
     * @param inTrait Whether the function is generated inside a trait.
     * @return The lowered parameters; the return value length is not yet analyzed.
     */
    public static ParameterSet lower(Env env, List<Parameter> functionParameters,
                                     List<FunctionConfig> configuredFunctions, boolean disableLengthDetect,
                                     boolean asyncFunc, boolean inTrait) {
        ParameterSet parameters = new ParameterSet(functionParameters.size());
        ArrayLengthResolver lengths = new ArrayLengthResolver(env, functionParameters, disableLengthDetect);

        for (int pos = 0; pos < functionParameters.size(); pos++) {
            Parameter par = functionParameters.get(pos);
            String name = par.instanceParameter() ? par.name() : NameUtil.mangleKeywords(par.name());

            List<ParameterConfig> configuredParameters =
                    ParameterMatcher.matchedParameters(configuredFunctions, name);
            TypeId typ = OverrideStringType.parameter(env, par.typ(), configuredParameters);

            boolean addSurfaceParameter = switch (par.direction()) {
                case IN, IN_OUT -> true;
                case RETURN -> false;
                case OUT -> !OutParameters.canAsReturn(env, par) && !asyncFunc;
            };
            if (asyncFunc && AsyncRestructurer.isRemovedFromSurface(par.name())) {
                addSurfaceParameter = false;
            }

            Optional<String> arrayName = lengths.arrayNameFor(pos, configuredParameters);
            boolean folded = arrayName.isPresent();
            if (folded) {
                String array = NameUtil.mangleKeywords(arrayName.get());
                addSurfaceParameter = false;
                LOG.debug("Parameter '{}' holds the length of '{}'", par.name(), array);
                parameters.addTransformation(new Transformation(pos, null,
                        ArrayLengthResolver.lengthType(env, array, par.name(), typ)));
            }

            OwnershipResolver.Resolved resolved =
                    OwnershipResolver.resolve(env, par, typ, configuredParameters, inTrait);

            int nativeIndex = parameters.addNative(new NativeParameter(
                    name,
                    typ,
                    par.cType(),
                    par.instanceParameter(),
                    par.direction(),
                    resolved.nullable(),
                    resolved.transfer(),
                    resolved.callerAllocates(),
                    par.error(),
                    par.scope(),
                    par.closure(),
                    par.destroy(),
                    resolved.refMode()));

            Integer surfaceIndex = null;
            if (addSurfaceParameter) {
                surfaceIndex = parameters.addSurface(new SurfaceParameter(nativeIndex, name, typ, par.allowNone()));
            }
            if (folded) {
                // The value is computed from the array, the length link is its only step.
                continue;
            }

            boolean transNullable = false;
            String toNativeExtra = "";
            Type declaredType = env.type(par.typ());
            if (!par.instanceParameter() && resolved.nullable()
                    && (declaredType.isInterface() || declaredType.isClass())) {
                transNullable = true;
                if (!declaredType.isFinalType()) {
                    toNativeExtra = AS_REF_EXTRA;
                }
            }

            TransformationType primary = switch (ConversionType.of(env, typ)) {
                case DIRECT -> new TransformationType.ToNativeDirect(name);
                case SCALAR -> new TransformationType.ToNativeScalar(name, resolved.nullable());
                case POINTER -> new TransformationType.ToNativePointer(
                        name,
                        par.instanceParameter(),
                        resolved.transfer(),
                        resolved.refMode(),
                        "",
                        "",
                        "",
                        inTrait,
                        transNullable).withToNativeExtra(toNativeExtra);
                case BORROW -> new TransformationType.ToNativeBorrow();
                case UNKNOWN -> new TransformationType.ToNativeUnknown(name);
            };

            if (asyncFunc) {
                TransformationType substituted = AsyncRestructurer.substitute(primary);
                if (substituted != primary) {
                    LOG.trace("Async slot '{}' lowered as {}", name, substituted.getClass().getSimpleName());
                }
                primary = substituted;
            }

            parameters.addTransformation(new Transformation(nativeIndex, surfaceIndex, primary));
        }

        return parameters;
    }
}
