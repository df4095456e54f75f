package org.bindforge.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.bindforge.analysis.FunctionInfo;
import org.bindforge.analysis.parameters.NativeParameter;
import org.bindforge.analysis.parameters.ParameterSet;
import org.bindforge.analysis.parameters.SurfaceParameter;
import org.bindforge.analysis.parameters.Transformation;
import org.bindforge.analysis.parameters.TransformationType;
import org.bindforge.env.Env;

import java.util.List;

/**
 * Renders analysis results as JSON for inspection.
 */
public final class ParameterDump {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private ParameterDump() {}

    /**
     * @param env The environment holding the types.
     * @param functions The analyzed functions.
     * @return A pretty-printed JSON array with one object per function.
     */
    public static String toJson(Env env, List<FunctionInfo> functions) {
        JsonArray root = new JsonArray();
        for (FunctionInfo info : functions) {
            root.add(function(env, info));
        }
        return GSON.toJson(root);
    }

    static JsonObject function(Env env, FunctionInfo info) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", info.codegenName());
        obj.addProperty("c-identifier", info.cIdentifier());
        obj.addProperty("visibility", info.visibility().name().toLowerCase());
        obj.addProperty("async", info.async());
        obj.addProperty("in-trait", info.inTrait());
        if (info.special() != null) {
            obj.addProperty("special", info.special().name().toLowerCase());
        }
        ParameterSet parameters = info.parameters();

        JsonArray surface = new JsonArray();
        for (SurfaceParameter par : parameters.surfaceParameters()) {
            JsonObject p = new JsonObject();
            p.addProperty("name", par.name());
            p.addProperty("type", env.type(par.typ()).name());
            p.addProperty("native-index", par.nativeIndex());
            p.addProperty("allow-none", par.allowNone());
            surface.add(p);
        }
        obj.add("surface", surface);

        JsonArray natives = new JsonArray();
        for (NativeParameter par : parameters.nativeParameters()) {
            JsonObject p = new JsonObject();
            p.addProperty("name", par.name());
            p.addProperty("type", env.type(par.typ()).name());
            p.addProperty("c-type", par.cType());
            p.addProperty("direction", par.direction().name().toLowerCase());
            p.addProperty("nullable", par.nullable());
            p.addProperty("transfer", par.transfer().name().toLowerCase());
            p.addProperty("caller-allocates", par.callerAllocates());
            p.addProperty("ref-mode", par.refMode().name().toLowerCase());
            natives.add(p);
        }
        obj.add("native", natives);

        JsonArray steps = new JsonArray();
        for (Transformation transformation : parameters.transformations()) {
            JsonObject t = new JsonObject();
            t.addProperty("native-index", transformation.nativeIndex());
            if (transformation.hasSurfaceIndex()) {
                t.addProperty("surface-index", transformation.surfaceIndex());
            }
            t.addProperty("step", describe(transformation.type()));
            steps.add(t);
        }
        obj.add("transformations", steps);
        return obj;
    }

    /**
     * @param type A transformation step.
     * @return A short human readable form, e.g. {@code length(data <- len: usize)}.
     */
    public static String describe(TransformationType type) {
        if (type instanceof TransformationType.ToNativeDirect t) {
            return "direct(" + t.name() + ")";
        }
        if (type instanceof TransformationType.ToNativeScalar t) {
            return "scalar(" + t.name() + (t.nullable() ? ", nullable" : "") + ")";
        }
        if (type instanceof TransformationType.ToNativePointer t) {
            return "pointer(" + t.name() + t.toNativeExtra() + ", " + t.transfer().name().toLowerCase()
                    + ", " + t.refMode().name().toLowerCase() + (t.nullable() ? ", nullable" : "") + ")";
        }
        if (type instanceof TransformationType.ToNativeBorrow) {
            return "borrow";
        }
        if (type instanceof TransformationType.ToNativeUnknown t) {
            return "unknown(" + t.name() + ")";
        }
        if (type instanceof TransformationType.Length t) {
            return "length(" + t.arrayName() + " <- " + t.lengthName() + ": " + t.lengthType() + ")";
        }
        if (type instanceof TransformationType.IntoRaw t) {
            return "into-raw(" + t.name() + ")";
        }
        if (type instanceof TransformationType.ToSome t) {
            return "to-some(" + t.name() + ")";
        }
        return type.toString();
    }
}
