package com.whitehall.core.emit;

import com.whitehall.core.ast.Parameter;
import com.whitehall.core.ir.LoweredComposable;
import com.whitehall.core.ir.LoweredFile;
import com.whitehall.core.ir.StoreModel;
import com.whitehall.core.ir.UiNode;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.registry.ComponentSpec;
import com.whitehall.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Serializes a lowered file to Kotlin source files.
 *
 * <p>The main file holds the composables (main entry first, then helpers in source order) followed
 * by verbatim declarations; each store gets a companion file named after it. Imports are computed
 * from the emitted text, so every referenced symbol is imported exactly once and unused ones never
 * are.
 */
public final class KotlinEmitter {

    private static final Logger log = LoggerFactory.getLogger(KotlinEmitter.class);

    private final ExpressionPrinter printer = new ExpressionPrinter();
    private final ImportResolver importResolver;

    public KotlinEmitter(ComponentRegistry registry) {
        Map<String, String> componentImports = new LinkedHashMap<>();
        for (ComponentSpec spec : registry.all()) {
            if (spec.importPath() != null) {
                componentImports.put(spec.name(), spec.importPath());
            }
        }
        this.importResolver = new ImportResolver(componentImports);
    }

    /**
     * Emits all files for one lowered source file.
     *
     * @param file lowered file
     * @param sourceFile name of the {@code .wh} source, recorded on each generated file
     * @return generated files, main file first
     */
    public List<GeneratedFile> emit(LoweredFile file, String sourceFile) {
        String directory = file.packageName().isEmpty() ? "" : file.packageName().replace('.', '/') + "/";
        List<GeneratedFile> files = new ArrayList<>();
        if (file.hasMainContent()) {
            files.add(new GeneratedFile(directory + file.mainFileName() + ".kt", emitMain(file), sourceFile));
        }
        for (StoreModel store : file.stores()) {
            files.add(new GeneratedFile(directory + store.name() + ".kt", emitStore(store, file), sourceFile));
        }
        log.debug("Emitted {} file(s) for {}", files.size(), sourceFile);
        return files;
    }

    String emitMain(LoweredFile file) {
        CodeWriter body = new CodeWriter();
        boolean first = true;
        for (LoweredComposable composable : file.composables()) {
            if (!first) {
                body.blank();
            }
            first = false;
            writeComposable(body, composable);
        }
        for (String declaration : file.declarations()) {
            if (!first) {
                body.blank();
            }
            first = false;
            body.line(CodeWriter.dedent(declaration));
        }
        return assemble(file, body.toString());
    }

    String emitStore(StoreModel store, LoweredFile file) {
        CodeWriter w = new CodeWriter();
        writeStoreHeader(w, store);
        w.indent();

        List<Runnable> sections = new ArrayList<>();
        if (!store.fields().isEmpty()) {
            sections.add(() -> writeStateContainer(w, store));
            sections.add(() -> {
                w.line("private val " + store.backingFlow() + " = MutableStateFlow(" + store.stateClassName() + "())");
                w.line("val " + store.publicFlow() + ": StateFlow<" + store.stateClassName() + "> = "
                    + store.backingFlow() + ".asStateFlow()");
            });
            for (StoreModel.StateField field : store.fields()) {
                sections.add(() -> {
                    w.line("val " + field.name() + ": " + field.type());
                    w.indent().line("get() = " + store.backingFlow() + ".value." + field.name()).outdent();
                });
            }
        }
        for (StoreModel.ComputedProperty computed : store.computed()) {
            sections.add(() -> {
                w.line("val " + computed.name() + (computed.type() != null ? ": " + computed.type() : ""));
                w.indent().line("get() = " + printer.print(computed.expression())).outdent();
            });
        }
        if (!store.privateFields().isEmpty()) {
            sections.add(() -> {
                for (StoreModel.PrivateField field : store.privateFields()) {
                    w.line("private " + (field.mutable() ? "var " : "val ") + field.name()
                        + (field.type() != null ? ": " + field.type() : "")
                        + (field.initializer() != null ? " = " + printer.print(field.initializer()) : ""));
                }
            });
        }
        if (store.ownScope()) {
            sections.add(() -> w.line("private val scope = CoroutineScope(SupervisorJob() + Dispatchers.Main)"));
        }
        for (String init : store.initBlocks()) {
            sections.add(() -> writeBlock(w, "init", init));
        }
        for (StoreModel.UpdateMethod update : store.updates()) {
            sections.add(() -> {
                w.line("fun " + update.name() + "(value: " + update.type() + ") {");
                w.indent().line(store.backingFlow() + ".update { it.copy(" + update.field() + " = value) }").outdent();
                w.line("}");
            });
        }
        for (StoreModel.StoreMethod method : store.methods()) {
            sections.add(() -> {
                if (method.launched()) {
                    w.line(method.signature() + " {");
                    w.indent();
                    writeBlock(w, store.coroutineScope() + ".launch", method.body());
                    w.outdent();
                    w.line("}");
                } else {
                    writeBlock(w, method.signature(), method.body());
                }
            });
        }

        for (int i = 0; i < sections.size(); i++) {
            if (i > 0) {
                w.blank();
            }
            sections.get(i).run();
        }
        w.outdent();
        w.line("}");
        return assemble(file, w.toString());
    }

    private void writeStoreHeader(CodeWriter w, StoreModel store) {
        if (store.singleton()) {
            w.line("object " + store.name() + " {");
            return;
        }
        StringBuilder header = new StringBuilder();
        if (store.hilt()) {
            w.line("@HiltViewModel");
            header.append("class ").append(store.name()).append(" @Inject constructor");
            header.append(parameterList(store.constructorParameters()));
        } else {
            header.append("class ").append(store.name());
            if (store.constructorParameters() != null && !store.constructorParameters().isBlank()) {
                header.append(parameterList(store.constructorParameters()));
            }
        }
        w.line(header.append(" : ViewModel() {").toString());
    }

    private void writeStateContainer(CodeWriter w, StoreModel store) {
        w.line("data class " + store.stateClassName() + "(");
        w.indent();
        List<StoreModel.StateField> fields = store.fields();
        for (int i = 0; i < fields.size(); i++) {
            StoreModel.StateField field = fields.get(i);
            w.line("val " + field.name() + ": " + field.type() + " = " + printer.print(field.initializer())
                + (i < fields.size() - 1 ? "," : ""));
        }
        w.outdent();
        w.line(")");
    }

    private void writeComposable(CodeWriter w, LoweredComposable composable) {
        w.line("@Composable");
        w.line("fun " + composable.name() + parameters(composable.parameters()) + " {");
        w.indent();
        for (UiNode node : composable.body()) {
            w.line(printer.nodePrinter().print(node));
        }
        w.outdent();
        w.line("}");
    }

    private static void writeBlock(CodeWriter w, String head, String body) {
        String text = CodeWriter.dedent(body);
        if (text.isEmpty()) {
            w.line(head + " {}");
            return;
        }
        w.line(head + " {");
        w.indent().line(text).outdent();
        w.line("}");
    }

    private static String parameters(List<Parameter> parameters) {
        List<String> signatures = parameters.stream().map(Parameter::toSignature).toList();
        String inline = "(" + String.join(", ", signatures) + ")";
        if (inline.length() <= ExpressionPrinter.MAX_INLINE_LENGTH) {
            return inline;
        }
        return "(\n" + String.join(",\n", signatures.stream().map(ExpressionPrinter::indent).toList()) + "\n)";
    }

    private static String parameterList(String raw) {
        String text = raw == null ? "" : raw.strip();
        if (text.length() <= ExpressionPrinter.MAX_INLINE_LENGTH && !text.contains("\n")) {
            return "(" + text + ")";
        }
        return "(\n" + ExpressionPrinter.indent(CodeWriter.dedent(text)) + "\n)";
    }

    private String assemble(LoweredFile file, String body) {
        Set<String> excluded = new HashSet<>(file.declaredNames());
        for (String declared : file.imports()) {
            excluded.add(simpleName(declared));
        }
        Set<String> imports = new TreeSet<>(file.imports());
        imports.addAll(importResolver.resolve(body, excluded));

        StringBuilder sb = new StringBuilder();
        if (!file.packageName().isEmpty()) {
            sb.append("package ").append(file.packageName()).append("\n\n");
        }
        if (!imports.isEmpty()) {
            for (String path : imports) {
                sb.append("import ").append(path).append("\n");
            }
            sb.append("\n");
        }
        return sb.append(body).toString();
    }

    private static String simpleName(String importText) {
        int alias = importText.indexOf(" as ");
        if (alias >= 0) {
            return importText.substring(alias + 4).strip();
        }
        return importText.substring(importText.lastIndexOf('.') + 1);
    }
}
