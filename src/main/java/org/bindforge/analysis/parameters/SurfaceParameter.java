package org.bindforge.analysis.parameters;

import org.bindforge.library.TypeId;

/**
 * A parameter of the generated binding's callable signature.
 *
 * @param nativeIndex Index of the native parameter this one is derived from.
 * @param name The (mangled) parameter name.
 * @param typ The parameter type.
 * @param allowNone Whether callers may pass an absent value.
 */
public record SurfaceParameter(int nativeIndex, String name, TypeId typ, boolean allowNone) {}
