package com.agentvet.audit;

import com.agentvet.component.Component;
import com.agentvet.component.ComponentType;
import com.agentvet.component.FrontmatterParser;
import com.agentvet.config.AgentvetProperties;
import com.agentvet.validation.ValidatorResult;
import com.agentvet.validation.structural.StructuralValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentScannerTest {

    @TempDir
    Path root;

    private final ComponentScanner scanner = new ComponentScanner();

    private void write(String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void discoversMarkdownUnderKnownDirectories() throws Exception {
        write("commands/git/commit.md", "# Commit");
        write("agents/reviewer.md", "# Reviewer");
        write("agents/notes.txt", "not a component");
        write("docs/readme.md", "# Not scanned");
        write("hooks/pre.md", "# Hook");

        List<Component> components = scanner.scan(root);

        assertEquals(3, components.size());
        assertEquals(ComponentType.AGENT, components.get(0).type());
        assertTrue(components.get(0).path().endsWith("agents/reviewer.md"));
        assertEquals(ComponentType.COMMAND, components.get(1).type());
        assertTrue(components.get(1).path().endsWith("commands/git/commit.md"));
        assertEquals(ComponentType.HOOK, components.get(2).type());
        assertEquals("# Reviewer", components.get(0).content());
    }

    @Test
    void emptyRootYieldsNothing() {
        assertTrue(scanner.scan(root).isEmpty());
    }

    @Test
    void invalidUtf8IsDecodedForTheEncodingCheck() throws Exception {
        Path file = root.resolve("agents/broken.md");
        Files.createDirectories(file.getParent());
        byte[] header = "---\nname: broken\ndescription: Agent with a corrupted byte in its body text\n---\n# Body\n"
                .getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[header.length + 1];
        System.arraycopy(header, 0, content, 0, header.length);
        content[header.length] = (byte) 0xFF;
        Files.write(file, content);

        List<Component> components = scanner.scan(root);

        assertEquals(1, components.size());
        Component component = components.get(0);
        assertNotNull(component.content());
        assertTrue(component.content().indexOf('\uFFFD') >= 0);

        ValidatorResult result = new StructuralValidator(new AgentvetProperties(), new FrontmatterParser())
                .validate(component);
        assertTrue(result.hasError("STRUCT_E004"));
        assertFalse(result.hasError("STRUCT_E009"));
    }
}
