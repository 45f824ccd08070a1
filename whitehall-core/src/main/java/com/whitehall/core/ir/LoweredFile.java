package com.whitehall.core.ir;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything generated from one source file.
 *
 * @param packageName target package
 * @param mainFileName name of the main output file without extension
 * @param imports author imports, already resolved
 * @param composables entry points, main entry first
 * @param declarations verbatim file-level declarations (functions, properties, data classes)
 * @param stores store models, each emitted to its own file
 * @param declaredNames names declared in the file, never auto-imported
 */
public record LoweredFile(
    String packageName,
    String mainFileName,
    List<String> imports,
    List<LoweredComposable> composables,
    List<String> declarations,
    List<StoreModel> stores,
    Set<String> declaredNames
) {

    public LoweredFile {
        Objects.requireNonNull(packageName, "packageName must not be null");
        Objects.requireNonNull(mainFileName, "mainFileName must not be null");
        imports = imports != null ? List.copyOf(imports) : List.of();
        composables = composables != null ? List.copyOf(composables) : List.of();
        declarations = declarations != null ? List.copyOf(declarations) : List.of();
        stores = stores != null ? List.copyOf(stores) : List.of();
        declaredNames = declaredNames != null ? Set.copyOf(declaredNames) : Set.of();
    }

    /**
     * Whether the main file has any content besides the package line.
     *
     * @return true when composables or declarations exist
     */
    public boolean hasMainContent() {
        return !composables.isEmpty() || !declarations.isEmpty();
    }
}
