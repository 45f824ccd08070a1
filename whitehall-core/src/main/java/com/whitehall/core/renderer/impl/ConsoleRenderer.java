package com.whitehall.core.renderer.impl;

import com.whitehall.core.renderer.GeneratedFile;
import com.whitehall.core.renderer.GeneratedOutput;
import com.whitehall.core.renderer.OutputRenderer;
import com.whitehall.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints generated files to a stream, each preceded by a header line.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colored headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.showHeaders} - print file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        logger.debug("Printing {} files (colors: {}, headers: {})", output.files().size(), useColors, showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                String header = "// ---- " + file.relativePath() + " ----";
                out.println(useColors ? ANSI_CYAN + header + ANSI_RESET : header);
            }
            out.print(file.content());
            if (i < output.files().size() - 1) {
                out.println();
            }
        }
        out.flush();
    }
}
