package org.dxworks.flaredoc;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.flaredoc.converter.ConvertedDocument;
import org.dxworks.flaredoc.converter.DocumentConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppRunTest {

    private static final String MADCAP_HTML = "<html xmlns:MadCap=\"http://www.madcapsoftware.com/Schemas/MadCap.xsd\">";

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;

    @BeforeEach
    void createProject() throws IOException {
        input = tempDir.resolve("Content");
        output = tempDir.resolve("out");
        Files.createDirectories(input.resolve("Snippets"));
        Files.createDirectories(input.resolve("Topics"));
        Files.writeString(input.resolve("Snippets/Product.flsnp"),
                MADCAP_HTML + "<body><p>Flaredoc Pro</p></body></html>");
        Files.writeString(input.resolve("Topics/Intro.htm"),
                MADCAP_HTML + "<body><h1>Welcome</h1>\n"
                        + "<p>Use <MadCap:snippetText src=\"../Snippets/Product.flsnp\"/> today.</p>\n"
                        + "</body></html>");
        Files.writeString(input.resolve("Topics/notes.txt"), "not a Flare file");
    }

    @Test
    void run_convertsFolderMirroringLayout() throws IOException {
        int exitCode = App.run(input, output, FlaredocConfig.defaults());

        assertEquals(0, exitCode);
        assertEquals("== Welcome\n\nUse {Product} today.\n", Files.readString(output.resolve("Topics/Intro.adoc")));
        assertEquals("Flaredoc Pro\n", Files.readString(output.resolve("Snippets/Product.adoc")));
        assertFalse(Files.exists(output.resolve("Topics/notes.adoc")));
    }

    @Test
    void run_writesSnippetDefinitions() throws IOException {
        App.run(input, output, FlaredocConfig.defaults());

        assertEquals(":Product: pass:q[Flaredoc Pro]\n", Files.readString(output.resolve("snippets.adoc")));
    }

    @Test
    void run_knownSnippetsAreNotDefined() throws IOException {
        App.run(input, output, FlaredocConfig.with(List.of("Product"), false));

        assertFalse(Files.exists(output.resolve("snippets.adoc")));
        assertEquals("== Welcome\n\nUse {Product} today.\n", Files.readString(output.resolve("Topics/Intro.adoc")));
    }

    @Test
    void run_writesReport() throws IOException {
        App.run(input, output, FlaredocConfig.defaults());

        List<JsonNode> records = readReport();
        assertEquals(4, records.size());
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals(2, records.get(0).get("total_files").asInt());

        JsonNode snippet = records.get(1);
        assertEquals("document", snippet.get("kind").asText());
        assertEquals("snippet", snippet.get("documentType").asText());
        assertEquals("topic", records.get(2).get("documentType").asText());
        assertEquals(0, records.get(2).get("warnings").asInt());

        JsonNode done = records.get(3);
        assertEquals("done", done.get("kind").asText());
        assertEquals(2, done.get("files_converted").asInt());
        assertEquals(0, done.get("files_with_errors").asInt());
        assertEquals(1, done.get("snippet_definitions").asInt());
    }

    @Test
    void run_recordsFailingDocumentAndContinues() throws IOException {
        // not valid UTF-8
        Files.write(input.resolve("Topics/Broken.htm"), new byte[]{(byte) 0xC3, (byte) 0x28});

        int exitCode = App.run(input, output, FlaredocConfig.defaults());

        assertEquals(1, exitCode);
        assertTrue(Files.exists(output.resolve("Topics/Intro.adoc")));
        List<JsonNode> records = readReport();
        JsonNode error = records.stream()
                .filter(record -> record.get("kind").asText().equals("error"))
                .findFirst()
                .orElseThrow();
        assertTrue(error.get("file").asText().endsWith("Broken.htm"));
        JsonNode done = records.get(records.size() - 1);
        assertEquals(2, done.get("files_converted").asInt());
        assertEquals(1, done.get("files_with_errors").asInt());
    }

    @Test
    void run_missingSnippetGetsEmptyDefinition() throws IOException {
        Files.writeString(input.resolve("Topics/Other.htm"),
                MADCAP_HTML + "<body><p><MadCap:snippetText src=\"../Snippets/Gone.flsnp\"/></p></body></html>");

        assertEquals(0, App.run(input, output, FlaredocConfig.defaults()));

        String definitions = Files.readString(output.resolve("snippets.adoc"));
        assertTrue(definitions.contains(":Gone: pass:q[]\n"));
    }

    @Test
    void run_parallelProducesSameOutput() throws IOException {
        assertEquals(0, App.run(input, output, FlaredocConfig.with(List.of(), true)));

        assertEquals("== Welcome\n\nUse {Product} today.\n", Files.readString(output.resolve("Topics/Intro.adoc")));
        assertEquals(":Product: pass:q[Flaredoc Pro]\n", Files.readString(output.resolve("snippets.adoc")));
    }

    @Test
    void run_singleFileInput() throws IOException {
        assertEquals(0, App.run(input.resolve("Topics/Intro.htm"), output, FlaredocConfig.defaults()));

        assertTrue(Files.exists(output.resolve("Intro.adoc")));
        assertEquals(":Product: pass:q[Flaredoc Pro]\n", Files.readString(output.resolve("snippets.adoc")));
    }

    @Test
    void convertFile_handsBodyAndSourceFolderToConverter() throws IOException {
        Path file = input.resolve("Topics/Intro.htm");
        List<String> seen = new ArrayList<>();
        DocumentConverter converter = (label, sourceDirectory, root) -> {
            seen.add(label);
            seen.add(sourceDirectory.toString());
            seen.add(root.nodeName());
            return new ConvertedDocument("", 0);
        };

        App.convertFile(file, converter);

        assertEquals(List.of(file.toString(), file.toAbsolutePath().normalize().getParent().toString(), "body"), seen);
    }

    private List<JsonNode> readReport() throws IOException {
        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(output.resolve(App.REPORT_FILE_NAME), StandardCharsets.UTF_8)) {
            records.add(TestUtils.REPORT_MAPPER.readTree(line));
        }
        return records;
    }
}
