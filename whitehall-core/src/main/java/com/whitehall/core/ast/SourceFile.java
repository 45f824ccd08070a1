package com.whitehall.core.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Parsed compilation unit: the ordered top-level declarations of one {@code .wh} file.
 *
 * @param fileName file name the source was read from
 * @param packageName package declared in the file, or null to use the configured one
 * @param declarations declarations in source order
 */
public record SourceFile(String fileName, String packageName, List<Declaration> declarations) {

    public SourceFile {
        Objects.requireNonNull(fileName, "fileName must not be null");
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
    }

    public List<ImportDeclaration> imports() {
        return ofType(ImportDeclaration.class);
    }

    public List<PropDeclaration> props() {
        return ofType(PropDeclaration.class);
    }

    public List<StateVar> stateVars() {
        return ofType(StateVar.class);
    }

    public List<FunctionDeclaration> functions() {
        return ofType(FunctionDeclaration.class);
    }

    public List<StoreClass> stores() {
        return ofType(StoreClass.class);
    }

    public List<DataClass> dataClasses() {
        return ofType(DataClass.class);
    }

    public List<LifecycleHook> lifecycleHooks() {
        return ofType(LifecycleHook.class);
    }

    /**
     * Composable entry points, main entry first and helpers after in source order.
     *
     * @return composable functions
     */
    public List<FunctionDeclaration> composables() {
        List<FunctionDeclaration> composables = functions().stream()
            .filter(FunctionDeclaration::isComposable)
            .toList();
        Optional<FunctionDeclaration> main = mainEntry();
        if (main.isEmpty()) {
            return composables;
        }
        return Stream.concat(
            Stream.of(main.get()),
            composables.stream().filter(f -> f != main.get())
        ).toList();
    }

    /**
     * The main entry point: the function synthesized from bare markup, otherwise the first
     * composable in source order.
     *
     * @return main entry, or empty when the file declares no composable
     */
    public Optional<FunctionDeclaration> mainEntry() {
        List<FunctionDeclaration> composables = functions().stream()
            .filter(FunctionDeclaration::isComposable)
            .toList();
        return composables.stream()
            .filter(FunctionDeclaration::synthesized)
            .findFirst()
            .or(() -> composables.stream().findFirst());
    }

    /**
     * Functions that are neither composable nor native signatures.
     *
     * @return plain functions in source order
     */
    public List<FunctionDeclaration> plainFunctions() {
        return functions().stream()
            .filter(f -> !f.isComposable() && f.hasBody())
            .toList();
    }

    /**
     * Looks up a store declared in this file.
     *
     * @param name store name
     * @return the store, or empty
     */
    public Optional<StoreClass> store(String name) {
        return stores().stream().filter(s -> s.name().equals(name)).findFirst();
    }

    private <T extends Declaration> List<T> ofType(Class<T> type) {
        return declarations.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }
}
