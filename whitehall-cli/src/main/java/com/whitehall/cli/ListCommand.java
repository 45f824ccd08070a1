package com.whitehall.cli;

import com.whitehall.core.config.CompilerConfig;
import com.whitehall.core.config.ConfigLoader;
import com.whitehall.core.registry.ComponentRegistry;
import com.whitehall.core.registry.ComponentSpec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list the components known to the compiler.
 *
 * <p>Shows the built-in registry plus rows added in {@code whitehall.yaml}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * whitehall list components
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available components",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: components"
    )
    private String type;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: whitehall.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "components", "component" -> listComponents();
            default -> {
                log.error("Unknown type: {}. Use: components", type);
                yield 1;
            }
        };
    }

    private int listComponents() {
        CompilerConfig config = ConfigLoader.load(configPath);
        ComponentRegistry registry = ComponentRegistry.defaults().withComponents(config.componentSpecs());

        System.out.println("Available Components:");
        System.out.println();

        for (ComponentSpec spec : registry.all()) {
            System.out.printf("  • %s (%s)%n", spec.name(), spec.importPath() != null ? spec.importPath() : "no import");
            System.out.printf("    Children: %s%n", spec.children().name().toLowerCase(Locale.ROOT));
            if (!spec.props().isEmpty()) {
                System.out.printf("    Props: %s%n",
                    spec.props().keySet().stream().sorted().collect(Collectors.joining(", ")));
            }
            System.out.println();
        }

        return 0;
    }
}
