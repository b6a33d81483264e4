package com.agentvet.component;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrontmatterParserTest {

    private final FrontmatterParser parser = new FrontmatterParser();

    @Test
    void parsesHeaderAndBody() {
        Frontmatter fm = parser.parse("---\nname: demo\ntools: [Read, Write]\n---\n# Body\ntext\n");

        assertTrue(fm.isParsed());
        assertEquals("demo", fm.text("name"));
        assertTrue(fm.field("tools").isArray());
        assertEquals("# Body\ntext\n", fm.body());
    }

    @Test
    void acceptsCrlfLineEndings() {
        Frontmatter fm = parser.parse("---\r\nname: demo\r\n---\r\nbody");

        assertTrue(fm.isParsed());
        assertEquals("demo", fm.text("name"));
        assertEquals("body", fm.body());
    }

    @Test
    void missingHeaderKeepsWholeDocumentAsBody() {
        Frontmatter fm = parser.parse("# Title\nno header here");

        assertEquals(Frontmatter.Status.MISSING, fm.status());
        assertEquals("# Title\nno header here", fm.body());
    }

    @Test
    void headerMustStartAtFirstLine() {
        Frontmatter fm = parser.parse("\n---\nname: demo\n---\nbody");

        assertEquals(Frontmatter.Status.MISSING, fm.status());
    }

    @Test
    void malformedYamlIsReportedWithParserMessage() {
        Frontmatter fm = parser.parse("---\nname: [unclosed\n---\nbody");

        assertEquals(Frontmatter.Status.MALFORMED, fm.status());
        assertNotNull(fm.error());
    }

    @Test
    void listHeaderIsNotAnObject() {
        Frontmatter fm = parser.parse("---\n- a\n- b\n---\nbody");

        assertEquals(Frontmatter.Status.NOT_AN_OBJECT, fm.status());
    }

    @Test
    void blankAndFalsyValuesCountAsMissing() {
        Frontmatter fm = parser.parse("---\nname: \"  \"\ntools: []\nenabled: false\ncount: 0\nmodel: opus\n---\n");

        assertTrue(fm.isMissing("name"));
        assertTrue(fm.isMissing("tools"));
        assertTrue(fm.isMissing("enabled"));
        assertTrue(fm.isMissing("count"));
        assertTrue(fm.isMissing("absent"));
        assertFalse(fm.isMissing("model"));
    }

    @Test
    void nullContentIsMissing() {
        Frontmatter fm = parser.parse(null);

        assertEquals(Frontmatter.Status.MISSING, fm.status());
        assertEquals("", fm.body());
    }
}
