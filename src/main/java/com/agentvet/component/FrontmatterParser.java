package com.agentvet.component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into its YAML header (between leading {@code ---}
 * delimiters) and body.
 */
@Component
public class FrontmatterParser {

    private static final Pattern HEADER = Pattern.compile("\\A---\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)",
            Pattern.DOTALL);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public Frontmatter parse(String content) {
        if (content == null) {
            return new Frontmatter(Frontmatter.Status.MISSING, null, "", null);
        }
        Matcher matcher = HEADER.matcher(content);
        if (!matcher.find()) {
            return new Frontmatter(Frontmatter.Status.MISSING, null, content, null);
        }

        String body = content.substring(matcher.end());
        try {
            JsonNode node = YAML.readTree(matcher.group(1));
            if (node == null || !node.isObject()) {
                return new Frontmatter(Frontmatter.Status.NOT_AN_OBJECT, null, body, null);
            }
            return new Frontmatter(Frontmatter.Status.PARSED, (ObjectNode) node, body, null);
        } catch (JsonProcessingException e) {
            return new Frontmatter(Frontmatter.Status.MALFORMED, null, body, e.getOriginalMessage());
        }
    }
}
