package com.whitehall.core;

import com.whitehall.core.ast.SourceFile;
import com.whitehall.core.bridge.NativeBridgeCollector;
import com.whitehall.core.bridge.NativeFunction;
import com.whitehall.core.config.CompilerConfig;
import com.whitehall.core.diagnostic.CompileException;
import com.whitehall.core.diagnostic.Diagnostics;
import com.whitehall.core.emit.KotlinEmitter;
import com.whitehall.core.ir.LoweredFile;
import com.whitehall.core.lowering.FileLowering;
import com.whitehall.core.parser.WhitehallParser;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Compiles Whitehall source files to Kotlin Compose sources.
 *
 * <p>Pipeline: parse, lower (props, state, control flow), emit. Each call works on its own
 * state; the registry is read-only, so one instance may compile files on several threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Compiler compiler = new Compiler(CompilerConfig.defaults());
 * CompilationResult result = compiler.compile(source, "counter.wh");
 * if (result.isSuccess()) {
 *     result.files().forEach(f -> System.out.println(f.content()));
 * }
 * }</pre>
 */
public final class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerConfig config;
    private final ComponentRegistry registry;
    private final WhitehallParser parser = new WhitehallParser();
    private final KotlinEmitter emitter;

    public Compiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = ComponentRegistry.defaults().withComponents(config.componentSpecs());
        this.emitter = new KotlinEmitter(registry);
    }

    /**
     * Compiles one source file.
     *
     * <p>Never throws for problems in the source: fatal errors end up in the result's diagnostics
     * and suppress all output for the file.
     *
     * @param source file contents
     * @param fileName file name, used for diagnostics and to name bare markup
     * @return generated files and diagnostics
     */
    public CompilationResult compile(String source, String fileName) {
        Diagnostics diagnostics = new Diagnostics();
        try {
            SourceFile file = parser.parse(source, fileName);
            List<NativeFunction> nativeFunctions = NativeBridgeCollector.collect(file);

            FileLowering lowering = new FileLowering(registry, config.packageName(), config.isStrict());
            LoweredFile lowered = lowering.lower(file, diagnostics);
            if (diagnostics.hasErrors()) {
                log.warn("{}: {} error(s), no output written", fileName,
                    diagnostics.all().stream().filter(d -> d.isError()).count());
                return new CompilationResult(fileName, List.of(), diagnostics.all(), nativeFunctions);
            }

            List<GeneratedFile> files = emitter.emit(lowered, fileName);
            log.debug("Compiled {} into {} file(s)", fileName, files.size());
            return new CompilationResult(fileName, files, diagnostics.all(), nativeFunctions);
        } catch (CompileException e) {
            log.warn("{}", e.getMessage());
            diagnostics.report(e.diagnostic());
            return new CompilationResult(fileName, List.of(), diagnostics.all(), List.of());
        }
    }
}
