package com.whitehall.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.whitehall.core.CompilationResult;
import com.whitehall.core.Compiler;
import com.whitehall.core.config.CompilerConfig;
import com.whitehall.core.config.ConfigLoader;
import com.whitehall.core.diagnostic.Diagnostic;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compile sources without writing output and report diagnostics.
 *
 * <p>With {@code --json} the diagnostics of all files are printed as one JSON array, suitable
 * for editor integrations.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * whitehall check src/
 * whitehall check counter.wh --json
 * }</pre>
 */
@Command(
    name = "check",
    description = "Check Whitehall sources for errors without generating output",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(
        index = "0",
        description = "Source file or directory (default: current directory)",
        defaultValue = "."
    )
    private Path sourcePath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: whitehall.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--json"},
        description = "Print diagnostics as JSON"
    )
    private boolean json;

    @Option(
        names = {"--permissive"},
        description = "Treat unknown components and props as warnings"
    )
    private boolean permissive;

    @Override
    public Integer call() {
        try {
            CompilerConfig config = ConfigLoader.load(configPath);
            Compiler compiler = new Compiler(permissive ? config.withStrict(false) : config);

            List<Path> sources = SourceFiles.collect(sourcePath);
            List<Diagnostic> diagnostics = new ArrayList<>();
            boolean valid = true;

            for (Path source : sources) {
                log.debug("Checking {}", source);
                CompilationResult result = compiler.compile(
                    Files.readString(source, StandardCharsets.UTF_8), source.getFileName().toString());
                diagnostics.addAll(result.diagnostics());
                valid &= result.isSuccess();
            }

            if (json) {
                System.out.println(JSON_MAPPER.writeValueAsString(diagnostics));
            } else {
                printReport(sources.size(), diagnostics, valid);
            }
            return valid ? 0 : 1;

        } catch (Exception e) {
            log.error("Check failed", e);
            System.err.println("✗ Check failed: " + e.getMessage());
            return 1;
        }
    }

    private void printReport(int fileCount, List<Diagnostic> diagnostics, boolean valid) {
        for (Diagnostic diagnostic : diagnostics) {
            System.out.println("  • " + diagnostic.format());
        }
        if (!diagnostics.isEmpty()) {
            System.out.println();
        }
        long errors = diagnostics.stream().filter(Diagnostic::isError).count();
        long warnings = diagnostics.size() - errors;
        if (valid) {
            System.out.printf("✓ %d file(s) checked, %d warning(s)%n", fileCount, warnings);
        } else {
            System.out.printf("✗ %d file(s) checked, %d error(s), %d warning(s)%n", fileCount, errors, warnings);
        }
    }
}
