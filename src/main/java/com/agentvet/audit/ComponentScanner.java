package com.agentvet.audit;

import com.agentvet.component.Component;
import com.agentvet.component.ComponentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Discovers markdown component definitions below the per-kind directories
 * ({@code agents}, {@code commands}, {@code mcps}, ...) of a root and maps
 * each directory to its component type.
 */
@org.springframework.stereotype.Component
public class ComponentScanner {

    private static final Logger log = LoggerFactory.getLogger(ComponentScanner.class);

    static final Map<String, ComponentType> DIRECTORIES = Map.of(
            "agents", ComponentType.AGENT,
            "commands", ComponentType.COMMAND,
            "mcps", ComponentType.MCP,
            "settings", ComponentType.SETTING,
            "hooks", ComponentType.HOOK,
            "templates", ComponentType.TEMPLATE
    );

    private static final List<String> SCAN_ORDER =
            List.of("agents", "commands", "mcps", "settings", "hooks", "templates");

    public List<Component> scan(Path root) {
        List<Component> components = new ArrayList<>();
        for (String directory : SCAN_ORDER) {
            Path base = root.resolve(directory);
            if (!Files.isDirectory(base)) continue;

            List<Path> files;
            try (Stream<Path> walk = Files.walk(base)) {
                files = walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".md"))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to scan " + base, e);
            }

            ComponentType type = DIRECTORIES.get(directory);
            for (Path file : files) {
                components.add(read(file, type));
            }
        }
        log.info("Discovered {} components under {}", components.size(), root);
        return components;
    }

    private Component read(Path file, ComponentType type) {
        String path = file.normalize().toString().replace('\\', '/');
        try {
            // malformed UTF-8 decodes to U+FFFD so the structural encoding check can report it
            return new Component(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), path, type);
        } catch (IOException e) {
            // surfaces as missing-content findings for this document only
            log.warn("Could not read {}: {}", path, e.getMessage());
            return new Component(null, path, type);
        }
    }
}
