package org.bindforge.analysis.parameters;

/**
 * A transformation step positioned in a {@link ParameterSet}.
 *
 * @param nativeIndex Index into the native parameter list, always set.
 * @param surfaceIndex Index into the surface parameter list, or {@code null}
 *                     if the native parameter has no surface counterpart.
 * @param type The step itself.
 */
public record Transformation(int nativeIndex, Integer surfaceIndex, TransformationType type) {

    public boolean hasSurfaceIndex() {
        return surfaceIndex != null;
    }
}
