package org.bindforge.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.bindforge.analysis.FunctionAnalyzer;
import org.bindforge.analysis.FunctionInfo;
import org.bindforge.analysis.RefMode;
import org.bindforge.analysis.parameters.TransformationType;
import org.bindforge.env.Env;
import org.bindforge.library.Function;
import org.bindforge.library.TestLibrary;
import org.bindforge.library.Transfer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bindforge.library.TestLibrary.in;
import static org.bindforge.library.TestLibrary.param;

@Tag("unit")
class ParameterDumpTest {

    @Test
    void describe_rendersEveryStep() {
        assertThat(ParameterDump.describe(new TransformationType.ToNativeDirect("x"))).isEqualTo("direct(x)");
        assertThat(ParameterDump.describe(new TransformationType.ToNativeScalar("x", true))).isEqualTo("scalar(x, nullable)");
        assertThat(ParameterDump.describe(new TransformationType.ToNativePointer("x", false, Transfer.FULL,
                RefMode.BY_REF, ".as_ref()", "", "", false, true))).isEqualTo("pointer(x.as_ref(), full, by_ref, nullable)");
        assertThat(ParameterDump.describe(new TransformationType.ToNativeBorrow())).isEqualTo("borrow");
        assertThat(ParameterDump.describe(new TransformationType.ToNativeUnknown("x"))).isEqualTo("unknown(x)");
        assertThat(ParameterDump.describe(new TransformationType.Length("data", "len", "usize")))
                .isEqualTo("length(data <- len: usize)");
        assertThat(ParameterDump.describe(new TransformationType.IntoRaw("user_data"))).isEqualTo("into-raw(user_data)");
        assertThat(ParameterDump.describe(new TransformationType.ToSome("callback"))).isEqualTo("to-some(callback)");
    }

    @Test
    void toJson_omitsSurfaceIndexOfHiddenParameters() {
        // Arrange
        TestLibrary lib = new TestLibrary();
        Env env = lib.env();
        Function function = new Function("write", "test_write", null, List.of(
                in("data", lib.byteArray, "const guint8*"),
                param("len", lib.gsize).cType("gsize").build()), null, false, false);
        FunctionInfo info = FunctionAnalyzer.analyze(env, function).orElseThrow();

        // Act
        JsonArray json = JsonParser.parseString(ParameterDump.toJson(env, List.of(info))).getAsJsonArray();

        // Assert
        JsonObject obj = json.get(0).getAsJsonObject();
        assertThat(obj.get("visibility").getAsString()).isEqualTo("public");
        assertThat(obj.has("special")).isFalse();
        JsonArray steps = obj.getAsJsonArray("transformations");
        assertThat(steps.get(0).getAsJsonObject().get("surface-index").getAsInt()).isZero();
        assertThat(steps.get(1).getAsJsonObject().has("surface-index")).isFalse();
        assertThat(obj.getAsJsonArray("native").get(1).getAsJsonObject().get("type").getAsString()).isEqualTo("gsize");
    }
}
