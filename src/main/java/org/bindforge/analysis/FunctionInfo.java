package org.bindforge.analysis;

import org.bindforge.analysis.parameters.ParameterSet;
import org.bindforge.analysis.special.SpecialFunctionType;
import org.bindforge.config.Visibility;
import org.bindforge.library.TypeId;

/**
 * Analysis result of one native function, handed read-only to code emission.
 *
 * @param codegenName Name of the generated function.
 * @param cIdentifier The exported C symbol.
 * @param owner The type the function belongs to, or {@code null}.
 * @param visibility Visibility of the generated function.
 * @param async Whether the function is surfaced as an async operation.
 * @param inTrait Whether the function is generated inside a trait.
 * @param parameters The lowered parameters, with the return value length analyzed.
 * @param special The special function type, or {@code null} for an ordinary function.
 * @param deprecated Whether the native function is deprecated.
 */
public record FunctionInfo(
        String codegenName,
        String cIdentifier,
        TypeId owner,
        Visibility visibility,
        boolean async,
        boolean inTrait,
        ParameterSet parameters,
        SpecialFunctionType special,
        boolean deprecated
) {}
