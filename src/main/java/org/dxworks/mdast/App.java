package org.dxworks.mdast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mdast.model.AstDocument;
import org.dxworks.mdast.model.AstNode;
import org.dxworks.mdast.walker.AstQueries;

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
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final MarkdownAst MARKDOWN_AST = new MarkdownAst();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar mdast.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a Markdown file or a directory of them");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Summary summary = run(input, Paths.get(args[1]), MdastConfig.load());

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + summary.converted + " files");
        if (summary.errors > 0) {
            System.out.println("Errors: " + summary.errors);
        }
        System.out.println("Output written to: " + summary.output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Converts every accepted file below {@code input} and writes one JSONL record per file,
     * framed by a {@code run} header and a {@code done} trailer.
     */
    public static Summary run(Path input, Path jsonlOutput, MdastConfig config) throws IOException {
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting Markdown conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectMarkdownFiles(input, config);
        System.out.println("Found " + files.size() + " Markdown files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    AstDocument document = convertFile(file, config.isIncludePlainText());
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(document));
                        writer.newLine();
                        writer.flush();
                    }
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getName());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        return new Summary(successCount.get(), errorCount.get(), jsonlOutput);
    }

    private static List<Path> collectMarkdownFiles(Path input, MdastConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(config::accepts)
                      .filter(p -> withinMaxLines(p, config.getMaxFileLines()))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (config.accepts(input) && withinMaxLines(input, config.getMaxFileLines())) {
                files.add(input);
            }
        }
        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | java.io.UncheckedIOException e) {
            // The conversion reports unreadable files
            return true;
        }
    }

    public static AstDocument convertFile(Path filePath, boolean includePlainText) throws IOException {
        String markdown = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (markdown.startsWith("\uFEFF")) {
            markdown = markdown.substring(1);
        }

        AstNode ast = MARKDOWN_AST.parse(markdown);
        AstDocument document = new AstDocument();
        document.filePath = filePath.toString();
        document.ast = ast;
        if (includePlainText) {
            document.text = AstQueries.toPlainText(ast);
        }
        return document;
    }

    public static final class Summary {
        public final int converted;
        public final int errors;
        public final Path output;

        Summary(int converted, int errors, Path output) {
            this.converted = converted;
            this.errors = errors;
            this.output = output;
        }
    }
}
