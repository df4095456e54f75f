package org.bindforge.cli.commands;

import com.typesafe.config.ConfigException;
import org.bindforge.analysis.FunctionInfo;
import org.bindforge.analysis.LibraryAnalyzer;
import org.bindforge.analysis.special.SpecialFunctions;
import org.bindforge.cli.CommandLineInterface;
import org.bindforge.codegen.StaticStringifyWriter;
import org.bindforge.diagnostics.DiagnosticsEngine;
import org.bindforge.env.Env;
import org.bindforge.io.LibraryLoadException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "stringify",
    description = "Emit the static to-string helpers of enumeration and bitfield types"
)
public class StringifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Library description (JSON)")
    private Path library;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            Env env = LowerCommand.loadEnv(parent, library, diagnostics);
            List<FunctionInfo> functions = new LibraryAnalyzer(env, diagnostics).analyze();
            SpecialFunctions specials = SpecialFunctions.of(functions);

            PrintWriter out = spec.commandLine().getOut();
            int written = 0;
            for (FunctionInfo function : functions) {
                if (StaticStringifyWriter.generate(out, env, function, specials)) {
                    written++;
                }
            }
            out.flush();
            err.println("Generated " + written + " stringify function(s)");
            LowerCommand.printDiagnostics(err, diagnostics);
            return diagnostics.hasErrors() ? 1 : 0;
        } catch (LibraryLoadException | IOException | ConfigException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return 1;
        }
    }
}
