package org.bindforge.analysis;

import org.bindforge.analysis.parameters.NativeParameter;
import org.bindforge.analysis.parameters.Transformation;
import org.bindforge.analysis.parameters.TransformationType;
import org.bindforge.config.FunctionConfig;
import org.bindforge.diagnostics.DiagnosticsEngine;
import org.bindforge.env.Env;
import org.bindforge.library.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Analyzes every function of a library. Functions are independent and the
 * environment is read-only, so they are analyzed on a fixed pool of
 * {@code analysis.threads} workers; results keep library order.
 */
public class LibraryAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(LibraryAnalyzer.class);

    private final Env env;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param env The environment holding the library and configuration.
     * @param diagnostics The engine receiving review notes and failures.
     */
    public LibraryAnalyzer(Env env, DiagnosticsEngine diagnostics) {
        this.env = env;
        this.diagnostics = diagnostics;
    }

    /**
     * Analyzes all functions that are not ignored by the configuration.
     * @return The analysis results in library order.
     * @throws InterruptedException if the calling thread is interrupted while waiting for workers.
     */
    public List<FunctionInfo> analyze() throws InterruptedException {
        List<Function> functions = env.library().functions();
        int threads = Math.min(env.config().threads(), Math.max(1, functions.size()));
        LOG.info("Analyzing {} functions of {} on {} thread(s)", functions.size(), env.library().namespace(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<FunctionInfo> result = new ArrayList<>(functions.size());
        try {
            List<Future<Optional<FunctionInfo>>> futures = new ArrayList<>(functions.size());
            for (Function function : functions) {
                futures.add(executor.submit(() -> FunctionAnalyzer.analyze(env, function)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Function function = functions.get(i);
                try {
                    Optional<FunctionInfo> info = futures.get(i).get();
                    if (info.isPresent()) {
                        reportUnknownConversions(info.get());
                        result.add(info.get());
                    } else {
                        LOG.debug("Function {} is ignored by configuration", function.cIdentifier());
                    }
                } catch (ExecutionException e) {
                    LOG.error("Analysis of {} failed", function.cIdentifier(), e.getCause());
                    diagnostics.reportError("Analysis failed: " + e.getCause().getMessage(), function.cIdentifier());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        reportUnmatchedConfiguration(functions);
        return result;
    }

    private void reportUnknownConversions(FunctionInfo info) {
        List<NativeParameter> nativeParameters = info.parameters().nativeParameters();
        for (Transformation transformation : info.parameters().transformations()) {
            if (transformation.type() instanceof TransformationType.ToNativeUnknown unknown) {
                NativeParameter par = nativeParameters.get(transformation.nativeIndex());
                diagnostics.reportWarning(String.format(
                        "Parameter '%s' of type '%s' has no known conversion, review the generated code.",
                        unknown.name(), env.type(par.typ()).name()), info.cIdentifier());
            }
        }
    }

    private void reportUnmatchedConfiguration(List<Function> functions) {
        for (FunctionConfig config : env.config().functions()) {
            boolean matched = functions.stream()
                    .anyMatch(f -> config.ident().matches(f.cIdentifier()) || config.ident().matches(f.name()));
            if (!matched) {
                diagnostics.reportInfo("Configured function matches no function of the library.",
                        config.ident().toString());
            }
        }
    }
}
