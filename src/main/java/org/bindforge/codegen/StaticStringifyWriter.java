package org.bindforge.codegen;

import org.bindforge.analysis.FunctionInfo;
import org.bindforge.analysis.special.SpecialFunctionType;
import org.bindforge.analysis.special.SpecialFunctions;
import org.bindforge.config.Visibility;
import org.bindforge.env.Env;

import java.io.IOException;
import java.io.Writer;
import java.util.Optional;

/**
 * Emits the helpers of special functions that are not ordinary method wrappers.
 */
public final class StaticStringifyWriter {

    private StaticStringifyWriter() {}

    /**
     * Writes the helper for a function if it is special.
     * @param w The output.
     * @param env The environment holding the configuration.
     * @param function The analyzed function.
     * @param specials The special functions of the library.
     * @return {@code true} if the function was special and has been written.
     * @throws IOException if writing fails.
     */
    public static boolean generate(Writer w, Env env, FunctionInfo function, SpecialFunctions specials)
            throws IOException {
        Optional<SpecialFunctionType> special = specials.get(function.cIdentifier());
        if (special.isEmpty() || special.get() != SpecialFunctionType.STATIC_STRINGIFY) {
            return false;
        }
        generateStaticToStr(w, env, function);
        return true;
    }

    /**
     * Writes a {@code fn name<'a>(self) -> &'a str} that calls the native function and
     * borrows the static C string it returns.
     * @param w The output.
     * @param env The environment holding the configuration.
     * @param function The analyzed stringify function.
     * @throws IOException if writing fails.
     */
    public static void generateStaticToStr(Writer w, Env env, FunctionInfo function) throws IOException {
        String visibility = function.visibility() == Visibility.PUBLIC ? "pub " : "";
        String ns = env.mainSysCrateName();
        String nativeName = function.cIdentifier();

        w.write("\n");
        w.write("\t" + visibility + "fn " + function.codegenName() + "<'a>(self) -> &'a str {\n");
        w.write("\t\tunsafe {\n");
        w.write("\t\t\tCStr::from_ptr(\n");
        w.write("\t\t\t\t" + ns + "::" + nativeName + "(self.into_glib())\n");
        w.write("\t\t\t\t\t.as_ref()\n");
        w.write("\t\t\t\t\t.expect(\"" + nativeName + " returned NULL\"),\n");
        w.write("\t\t\t)\n");
        w.write("\t\t\t.to_str()\n");
        w.write("\t\t\t.expect(\"" + nativeName + " returned an invalid string\")\n");
        w.write("\t\t}\n");
        w.write("\t}\n");
    }
}
