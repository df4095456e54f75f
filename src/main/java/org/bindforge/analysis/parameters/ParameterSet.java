package org.bindforge.analysis.parameters;

import org.bindforge.analysis.TypeFormatter;
import org.bindforge.env.Env;
import org.bindforge.library.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The lowered parameters of one function: the surface signature, the native call
 * arguments and the ordered transformation steps between them.
 * <p>
 * Built by {@link ParameterLowering}. The only change allowed afterwards is a single
 * {@link #appendReturnLength(Env, Optional)}; consumers see unmodifiable views.
 */
public final class ParameterSet {

    private final List<SurfaceParameter> surfaceParameters;
    private final List<NativeParameter> nativeParameters;
    private final List<Transformation> transformations;
    private boolean returnLengthAnalyzed;

    ParameterSet(int capacity) {
        this.surfaceParameters = new ArrayList<>(capacity);
        this.nativeParameters = new ArrayList<>(capacity);
        this.transformations = new ArrayList<>(capacity);
    }

    public List<SurfaceParameter> surfaceParameters() {
        return Collections.unmodifiableList(surfaceParameters);
    }

    public List<NativeParameter> nativeParameters() {
        return Collections.unmodifiableList(nativeParameters);
    }

    public List<Transformation> transformations() {
        return Collections.unmodifiableList(transformations);
    }

    int addNative(NativeParameter parameter) {
        nativeParameters.add(parameter);
        return nativeParameters.size() - 1;
    }

    int addSurface(SurfaceParameter parameter) {
        surfaceParameters.add(parameter);
        return surfaceParameters.size() - 1;
    }

    void addTransformation(Transformation transformation) {
        transformations.add(transformation);
    }

    /**
     * Appends the length link of an array return value, if the return value declares one
     * and it points at an existing native parameter. May be called once.
     * @param env The environment holding the parameter types.
     * @param ret The return value of the function, if any.
     * @throws IllegalStateException if the return value has already been analyzed.
     */
    public void appendReturnLength(Env env, Optional<Parameter> ret) {
        if (returnLengthAnalyzed) {
            throw new IllegalStateException("Return value length has already been analyzed");
        }
        returnLengthAnalyzed = true;

        Integer arrayLength = ret.map(Parameter::arrayLength).orElse(null);
        if (arrayLength == null || arrayLength < 0 || arrayLength >= nativeParameters.size()) {
            return;
        }
        NativeParameter par = nativeParameters.get(arrayLength);
        transformations.add(new Transformation(arrayLength, null,
                new TransformationType.Length("", par.name(), TypeFormatter.format(env, par.typ()))));
    }

    /**
     * @param nativeIndex Index into the native parameter list.
     * @return All steps positioned at the index, in build order.
     */
    public List<Transformation> transformationsAt(int nativeIndex) {
        return transformations.stream().filter(t -> t.nativeIndex() == nativeIndex).toList();
    }

    /**
     * @param nativeIndex Index into the native parameter list.
     * @return The surface parameter derived from the native one, if it is exposed.
     */
    public Optional<SurfaceParameter> surfaceFor(int nativeIndex) {
        return surfaceParameters.stream().filter(p -> p.nativeIndex() == nativeIndex).findFirst();
    }
}
