package com.whitehall.core.renderer;

/**
 * Destination for generated Kotlin files.
 *
 * <p>The compiler core only produces {@link GeneratedOutput}; where it ends up is decided by the
 * caller choosing a renderer:
 * <pre>{@code
 * OutputRenderer renderer = new FileSystemRenderer();
 * renderer.render(new GeneratedOutput(result.files()), new RenderContext("build/generated/whitehall", Map.of()));
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the renderer identifier, such as {@code filesystem} or {@code console}.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes the generated files to the destination.
     *
     * @param output files to render
     * @param context output directory and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
