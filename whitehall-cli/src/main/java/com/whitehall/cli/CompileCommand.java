package com.whitehall.cli;

import com.whitehall.core.CompilationResult;
import com.whitehall.core.Compiler;
import com.whitehall.core.bridge.ManifestWriter;
import com.whitehall.core.bridge.NativeFunction;
import com.whitehall.core.config.CompilerConfig;
import com.whitehall.core.config.ConfigLoader;
import com.whitehall.core.diagnostic.Diagnostic;
import com.whitehall.core.renderer.GeneratedFile;
import com.whitehall.core.renderer.GeneratedOutput;
import com.whitehall.core.renderer.OutputRenderer;
import com.whitehall.core.renderer.RenderContext;
import com.whitehall.core.renderer.impl.ConsoleRenderer;
import com.whitehall.core.renderer.impl.FileSystemRenderer;
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
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to compile {@code .wh} files into Kotlin sources.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code whitehall.yaml}</li>
 *   <li>Compile every source file, printing its diagnostics</li>
 *   <li>Render generated files to the output directory (or stdout)</li>
 *   <li>Write {@code ffi-manifest.json} when native functions were declared</li>
 * </ol>
 *
 * <p>A file with errors produces no output; the others are still written.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Compile a directory with the settings in whitehall.yaml
 * whitehall compile src/
 *
 * # Override the output directory, pass unknown tags through
 * whitehall compile src/ -o build/kotlin --permissive
 *
 * # Print the generated Kotlin instead of writing files
 * whitehall compile counter.wh --stdout
 * }</pre>
 */
@Command(
    name = "compile",
    description = "Compile Whitehall sources into Kotlin Compose files",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

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
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--permissive"},
        description = "Pass unknown components and props through with a warning"
    )
    private boolean permissive;

    @Option(
        names = {"--stdout"},
        description = "Print generated files instead of writing them"
    )
    private boolean stdout;

    @Override
    public Integer call() {
        try {
            log.info("Compiling: {}", sourcePath.toAbsolutePath());

            CompilerConfig config = loadConfiguration();
            Compiler compiler = new Compiler(config);

            List<Path> sources = SourceFiles.collect(sourcePath);
            if (sources.isEmpty()) {
                System.out.println("No " + SourceFiles.EXTENSION + " files found in " + sourcePath);
                return 0;
            }

            List<GeneratedFile> generated = new ArrayList<>();
            List<NativeFunction> nativeFunctions = new ArrayList<>();
            int failed = 0;

            for (Path source : sources) {
                CompilationResult result = compiler.compile(
                    Files.readString(source, StandardCharsets.UTF_8), source.getFileName().toString());
                result.diagnostics().stream().map(Diagnostic::format).forEach(System.err::println);

                if (result.isSuccess()) {
                    generated.addAll(result.files());
                    nativeFunctions.addAll(result.nativeFunctions());
                    if (!stdout) {
                        System.out.println("✓ " + source + " (" + result.files().size() + " file(s))");
                    }
                } else {
                    failed++;
                    System.err.println("✗ " + source + " (" + result.errors().size() + " error(s))");
                }
            }

            Path outputDirectory = resolveOutputDirectory(config);
            renderOutput(new GeneratedOutput(generated), outputDirectory);

            if (!nativeFunctions.isEmpty() && config.output().manifest() && !stdout) {
                Path manifest = ManifestWriter.write(outputDirectory, nativeFunctions);
                System.out.println("✓ Wrote " + manifest);
            }

            if (failed > 0) {
                System.err.println();
                System.err.println("✗ " + failed + " of " + sources.size() + " file(s) failed");
                return 1;
            }
            if (!stdout) {
                System.out.println();
                System.out.println("✓ Compiled " + sources.size() + " file(s) to " + outputDirectory);
            }
            return 0;

        } catch (Exception e) {
            log.error("Compilation failed", e);
            System.err.println("✗ Compilation failed: " + e.getMessage());
            return 1;
        }
    }

    private CompilerConfig loadConfiguration() {
        CompilerConfig config = ConfigLoader.load(configPath);
        return permissive ? config.withStrict(false) : config;
    }

    private Path resolveOutputDirectory(CompilerConfig config) {
        return outputDir != null ? outputDir : Paths.get(config.output().directory());
    }

    private void renderOutput(GeneratedOutput output, Path outputDirectory) {
        if (output.isEmpty()) {
            log.debug("Nothing to render");
            return;
        }
        OutputRenderer renderer = stdout ? new ConsoleRenderer() : new FileSystemRenderer();
        log.debug("Rendering with {}", renderer.getId());
        renderer.render(output, new RenderContext(outputDirectory.toString(), Map.of()));
    }
}
