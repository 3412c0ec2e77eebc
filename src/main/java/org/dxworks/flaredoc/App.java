package org.dxworks.flaredoc;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConsoleWarningSink;
import org.dxworks.flaredoc.converter.ConvertedDocument;
import org.dxworks.flaredoc.converter.DocumentConverter;
import org.dxworks.flaredoc.converter.FlareParser;
import org.dxworks.flaredoc.model.DocumentConversion;
import org.dxworks.flaredoc.snippet.SnippetEntry;
import org.dxworks.flaredoc.snippet.SnippetRegistry;
import org.jsoup.nodes.Document;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String REPORT_FILE_NAME = "conversion-report.jsonl";

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar flaredoc.jar <input-folder> <output-folder>");
            System.err.println("  <input-folder>:  Flare project folder or a single topic/snippet file");
            System.err.println("  <output-folder>: Folder receiving the AsciiDoc files and the run report");
            System.err.println("Supported inputs: topics (.htm, .html), snippets (.flsnp)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        int exitCode = run(input, Paths.get(args[1]), FlaredocConfig.load());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Converts every Flare file under {@code input} into {@code outputDir}, mirroring the folder
     * layout, then writes the shared snippet definitions and the JSONL run report.
     *
     * @return 0 when every document converted, 1 when at least one failed
     */
    public static int run(Path input, Path outputDir, FlaredocConfig config) throws IOException {
        Files.createDirectories(outputDir);

        System.out.println("Starting conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        Path inputRoot = input.toAbsolutePath().normalize();
        if (!Files.isDirectory(inputRoot)) {
            inputRoot = inputRoot.getParent();
        }
        List<Path> files = collectSourceFiles(input);
        System.out.println("Found " + files.size() + " Flare files");

        SnippetRegistry snippets = new SnippetRegistry(config.getKnownSnippets());
        DocumentConverter converter = new AsciidocConverter(snippets, new ConsoleWarningSink(), config.getOutputExtension());

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        Path reportPath = outputDir.resolve(REPORT_FILE_NAME);
        Path sourceRoot = inputRoot;

        try (BufferedWriter writer = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeRecord(writer, runInfo);

            Stream<Path> stream = config.isParallel() ? files.parallelStream() : files.stream();
            stream.forEach(file -> {
                DocumentType type = DocumentTypeRegistry.detectType(file).orElseThrow();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting "
                            + type.getName() + ": " + file.getFileName());
                }

                try {
                    Path target = outputDir.resolve(sourceRoot.relativize(file))
                            .resolveSibling(DocumentTypeRegistry.outputFileName(file, config.getOutputExtension()));
                    ConvertedDocument converted = convertFile(file, converter);
                    if (target.getParent() != null) {
                        Files.createDirectories(target.getParent());
                    }
                    Files.writeString(target, converted.text(), StandardCharsets.UTF_8);

                    DocumentConversion record = new DocumentConversion();
                    record.filePath = file.toString();
                    record.documentType = type.getName();
                    record.outputPath = target.toString();
                    record.warnings = converted.warnings();
                    writeRecord(writer, record);

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    recordError(writer, file.toString(), type.getName(), e);
                    errorCount.incrementAndGet();
                }
            });

            int snippetCount = 0;
            try {
                snippetCount = writeSnippetDefinitions(snippets, converter, outputDir.resolve(config.getSnippetDefinitionsFile()));
            } catch (Exception e) {
                recordError(writer, config.getSnippetDefinitionsFile(), DocumentType.SNIPPET.getName(), e);
                errorCount.incrementAndGet();
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("snippet_definitions", snippetCount);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + outputDir.toAbsolutePath());
        System.out.println("=".repeat(60));

        return errorCount.get() > 0 ? 1 : 0;
    }

    public static ConvertedDocument convertFile(Path filePath, DocumentConverter converter) throws IOException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);
        Document document = FlareParser.parse(source);
        Path sourceDirectory = filePath.toAbsolutePath().normalize().getParent();
        return converter.convert(filePath.toString(), sourceDirectory, FlareParser.contentRoot(document));
    }

    /**
     * Renders the definitions of every inline snippet referenced during the run.
     *
     * @return number of definitions written; no file is written when there are none
     */
    static int writeSnippetDefinitions(SnippetRegistry snippets, DocumentConverter converter, Path target) throws IOException {
        String definitions = snippets.renderDefinitions(entry -> loadSnippet(entry, converter));
        if (definitions.isEmpty()) {
            return 0;
        }
        Files.writeString(target, definitions, StandardCharsets.UTF_8);
        return snippets.entries().size();
    }

    private static String loadSnippet(SnippetEntry entry, DocumentConverter converter) throws IOException {
        Path source = entry.getSource();
        if (source == null || !Files.isRegularFile(source)) {
            synchronized (System.err) {
                System.err.println("  Warning: snippet " + entry.getName() + " not found at " + entry.getPath());
            }
            return "";
        }
        return convertFile(source, converter).text();
    }

    private static List<Path> collectSourceFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        Path root = input.toAbsolutePath().normalize();

        if (Files.isDirectory(root)) {
            try (Stream<Path> stream = Files.walk(root)) {
                stream.filter(Files::isRegularFile)
                      .filter(DocumentTypeRegistry::isConvertible)
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(root) && DocumentTypeRegistry.isConvertible(root)) {
            files.add(root);
        }

        return files;
    }

    private static void recordError(BufferedWriter writer, String file, String documentType, Exception e) {
        Map<String, String> error = new HashMap<>();
        error.put("kind", "error");
        error.put("file", file);
        error.put("document_type", documentType);
        error.put("error", String.valueOf(e.getMessage()));

        try {
            writeRecord(writer, error);
        } catch (IOException ioException) {
            System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
        }

        synchronized (System.err) {
            System.err.println("  Error converting " + file + ": " + e.getMessage());
        }
    }

    private static void writeRecord(BufferedWriter writer, Object record) throws IOException {
        // documents may be converted in parallel
        synchronized (writer) {
            writer.write(MAPPER.writeValueAsString(record));
            writer.newLine();
            writer.flush();
        }
    }
}
