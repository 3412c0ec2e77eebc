package org.dxworks.flaredoc.converter;

import org.dxworks.flaredoc.TestUtils.Fixture;
import org.dxworks.flaredoc.snippet.SnippetRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AsciidocConverterTest {

    @Test
    void convert_headingInBody() {
        Fixture fixture = new Fixture();
        assertEquals("=== Intro\n", fixture.convert("<h2>Intro</h2>"));
        assertTrue(fixture.warnings.messages.isEmpty());
    }

    @Test
    void convert_noteParagraph() {
        assertEquals("[NOTE]\n====\nCareful\n====\n", new Fixture().convert("<p class=\"note\">Careful</p>"));
    }

    @Test
    void convert_imageOpeningParagraphIsBlock() {
        assertEquals("\nimage::x.png[X]\n", new Fixture().fragment("<img src=\"img/x.png\" alt=\"X\"/>"));
    }

    @Test
    void convert_imageAfterTextIsInline() {
        String result = new Fixture().convert("<p>See <img src=\"img/x.png\" alt=\"X\"/> here</p>");

        assertEquals("See image:x.png[X] here\n", result);
    }

    @Test
    void convert_headerTable() {
        String result = new Fixture().convert("<table><tr><th>H</th></tr><tr><td>D</td></tr></table>");

        assertEquals("[%header]\n|===\n|H\n|D\n|===\n", result);
    }

    @Test
    void convert_adjacentParagraphsStaySeparate() {
        assertEquals("One\n\nTwo\n", new Fixture().convert("<p>One</p><p>Two</p>"));
    }

    @Test
    void convert_unsupportedTagWarnsAndContributesNothing() {
        Fixture fixture = new Fixture();

        assertEquals("before after\n", fixture.convert("<p>before <blink>x</blink>after</p>"));
        assertEquals(List.of("Unsupported tag <blink>"), fixture.warnings.messages);
    }

    @Test
    void convert_reportsWarningCount() {
        Fixture fixture = new Fixture();
        ConvertedDocument document = fixture.converter.convert("doc", null,
                FlareParser.contentRoot(FlareParser.parse("<body><blink/><marquee/></body>")));

        assertEquals(2, document.warnings());
    }

    @Test
    void convert_blankDocumentIsEmpty() {
        assertEquals("", new Fixture().convert("\n   \n"));
    }

    @Test
    void text_indentationAfterLineBreakIsRemoved() {
        assertEquals("a\nb", new Fixture().fragment("a\n      b"));
    }

    @Test
    void text_nonBreakingSpaceBecomesAttribute() {
        assertEquals("a{nbsp}b", new Fixture().fragment("a&#160;b"));
    }

    @Test
    void comment_singleLine() {
        assertEquals("// single\n", new Fixture().convert("<!-- single -->"));
    }

    @Test
    void comment_singleLineStartsOnFreshLine() {
        assertEquals("text\n// note\n", new Fixture().fragment("text<!-- note -->"));
    }

    @Test
    void comment_multiLine() {
        assertEquals("////\nfirst\nsecond\n////\n", new Fixture().convert("<!-- first\nsecond -->"));
    }

    @Test
    void cdata_warnsWhenNotBlank() {
        Fixture fixture = new Fixture();

        assertEquals("", fixture.fragment("<![CDATA[code]]>"));
        assertEquals(1, fixture.warnings.messages.size());
    }

    @Test
    void cdata_blankIsSilent() {
        Fixture fixture = new Fixture();

        fixture.fragment("<![CDATA[  ]]>");
        assertTrue(fixture.warnings.messages.isEmpty());
    }

    @Test
    void convert_contextIsFreshPerDocument() {
        Fixture fixture = new Fixture();

        fixture.convert("<p><img src=\"a/x.png\"/></p>");
        fixture.convert("<p><img src=\"b/y.png\"/></p>");
        assertTrue(fixture.warnings.messages.isEmpty());
    }

    @Test
    void convert_wrapsHandlerFailureWithDocumentLabel() {
        AsciidocConverter converter = new AsciidocConverter(
                new SnippetRegistry(List.of()),
                (label, message) -> {
                    throw new IllegalStateException("sink failed");
                });

        DocumentConversionException e = assertThrows(DocumentConversionException.class,
                () -> converter.convert("broken.htm", null,
                        FlareParser.contentRoot(FlareParser.parse("<body><blink/></body>"))));
        assertEquals("broken.htm", e.getDocumentLabel());
    }

    @Test
    void supportedTags_useNamespaceSeparatorAsUnderscore() {
        assertTrue(new Fixture().converter.supportedTags().containsAll(
                List.of("madcap_xref", "madcap_snippettext", "h6", "table", "li")));
    }
}
