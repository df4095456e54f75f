package org.bindforge.cli.commands;

import com.typesafe.config.ConfigException;
import org.bindforge.analysis.FunctionInfo;
import org.bindforge.analysis.LibraryAnalyzer;
import org.bindforge.cli.CommandLineInterface;
import org.bindforge.config.GeneratorConfig;
import org.bindforge.diagnostics.Diagnostic;
import org.bindforge.diagnostics.DiagnosticsEngine;
import org.bindforge.env.Env;
import org.bindforge.io.LibraryLoadException;
import org.bindforge.io.LibraryReader;
import org.bindforge.library.Library;
import org.bindforge.util.ParameterDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "lower",
    description = "Lower the parameters of every function of a library and print the result as JSON"
)
public class LowerCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(LowerCommand.class);

    @Parameters(index = "0", description = "Library description (JSON)")
    private Path library;

    @Option(
        names = {"-o", "--output"},
        description = "Write the JSON to this file instead of stdout"
    )
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            Env env = loadEnv(parent, library, diagnostics);
            List<FunctionInfo> functions = new LibraryAnalyzer(env, diagnostics).analyze();
            String json = ParameterDump.toJson(env, functions);

            if (output != null) {
                Files.writeString(output, json);
                LOG.info("Wrote {} functions to {}", functions.size(), output);
            } else {
                spec.commandLine().getOut().println(json);
            }
            printDiagnostics(err, diagnostics);
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

    static Env loadEnv(CommandLineInterface parent, Path library, DiagnosticsEngine diagnostics)
            throws LibraryLoadException {
        GeneratorConfig config = GeneratorConfig.fromConfig(parent.getConfig());
        Library lib = new LibraryReader(diagnostics).read(library);
        return new Env(lib, config);
    }

    static void printDiagnostics(PrintWriter err, DiagnosticsEngine diagnostics) {
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            err.println(diagnostic);
        }
    }
}
