package com.whitehall.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.whitehall.core.registry.ChildrenMode;
import com.whitehall.core.registry.ComponentSpec;
import com.whitehall.core.registry.PropKind;
import com.whitehall.core.registry.PropSpec;
import com.whitehall.core.registry.ValueFormat;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration of a Whitehall project.
 *
 * <p>Loaded from {@code whitehall.yaml} in the project root.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * packageName: com.example.app
 * strict: true
 *
 * output:
 *   directory: build/generated/kotlin
 *   manifest: true
 *
 * components:
 *   - name: Badge
 *     import: androidx.compose.material3.Badge
 *     children: content
 *     props:
 *       - name: containerColor
 *         format: color
 *       - name: onClick
 *         kind: callback
 *         arity: 0
 * }</pre>
 *
 * @param packageName package of generated files when a source file declares none
 * @param strict true to reject unknown components and props, false to pass them through with a warning
 * @param output output settings
 * @param components extra component rows added to the built-in registry
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilerConfig(
    @JsonProperty("packageName") String packageName,
    @JsonProperty("strict") Boolean strict,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("components") List<ComponentDefinition> components
) {

    public static final String DEFAULT_PACKAGE = "com.example.app";

    public CompilerConfig {
        packageName = packageName != null && !packageName.isBlank() ? packageName : DEFAULT_PACKAGE;
        strict = strict != null ? strict : Boolean.TRUE;
        output = output != null ? output : OutputConfig.defaults();
        components = components != null ? List.copyOf(components) : List.of();
    }

    /**
     * Default configuration: strict mode, built-in components only.
     *
     * @return default configuration
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_PACKAGE, true, OutputConfig.defaults(), List.of());
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Returns a copy with a different strictness, such as from a command line flag.
     *
     * @param value new strictness
     * @return new configuration
     */
    public CompilerConfig withStrict(boolean value) {
        return new CompilerConfig(packageName, value, output, components);
    }

    /**
     * Converts the configured component rows to registry specs.
     *
     * @return component specs in configuration order
     * @throws IllegalArgumentException if a row names an unknown kind, format or children mode
     */
    public List<ComponentSpec> componentSpecs() {
        return components.stream().map(ComponentDefinition::toSpec).toList();
    }

    /**
     * Output settings.
     *
     * @param directory directory generated sources are written to
     * @param manifest true to write {@code ffi-manifest.json} when native functions are declared
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("manifest") Boolean manifest
    ) {
        public OutputConfig {
            directory = directory != null && !directory.isBlank() ? directory : "build/generated/whitehall";
            manifest = manifest != null ? manifest : Boolean.TRUE;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }

    /**
     * A component row.
     *
     * @param name tag name
     * @param importPath fully qualified import, or null for components that need none
     * @param children children mode name, {@code content} by default
     * @param props prop rows
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ComponentDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("import") String importPath,
        @JsonProperty("children") String children,
        @JsonProperty("props") List<PropDefinition> props
    ) {
        ComponentSpec toSpec() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Component definition without a name");
            }
            ChildrenMode mode = children != null ? ChildrenMode.valueOf(constantName(children)) : ChildrenMode.CONTENT;
            List<PropSpec> rows = props != null ? props.stream().map(PropDefinition::toSpec).toList() : List.of();
            return ComponentSpec.of(name, importPath, mode, rows);
        }
    }

    /**
     * A prop row.
     *
     * @param name prop name
     * @param kind prop kind name, {@code plain} by default
     * @param format value format name, {@code raw} by default
     * @param target argument name or modifier function, defaults to the prop name
     * @param arity callback parameter count
     * @param callback change callback argument of a binding
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PropDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("kind") String kind,
        @JsonProperty("format") String format,
        @JsonProperty("target") String target,
        @JsonProperty("arity") Integer arity,
        @JsonProperty("callback") String callback
    ) {
        PropSpec toSpec() {
            PropKind propKind = kind != null ? PropKind.valueOf(constantName(kind)) : PropKind.PLAIN;
            ValueFormat valueFormat = format != null ? ValueFormat.valueOf(constantName(format)) : ValueFormat.RAW;
            return new PropSpec(name, propKind, valueFormat, target, arity != null ? arity : 0, callback);
        }
    }

    private static String constantName(String value) {
        return value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    }
}
