package org.dxworks.mdast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mdast.model.AstDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void run_WritesHeaderDocumentsAndTrailer() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("notes"));
        Files.writeString(input.resolve("a.md"), "# A\n\nSee [[b]].\n");
        Files.writeString(input.resolve("b.markdown"), "Text with #tag\n");
        Files.writeString(input.resolve("ignored.txt"), "not markdown");
        Path output = tempDir.resolve("out/result.jsonl");

        App.Summary summary = App.run(input, output, MdastConfig.with(100, null, true));

        assertEquals(2, summary.converted);
        assertEquals(0, summary.errors);

        List<JsonNode> records = readRecords(output);
        assertEquals(4, records.size());
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals(2, records.get(0).get("total_files").asInt());
        assertEquals("done", records.get(3).get("kind").asText());
        assertEquals(2, records.get(3).get("files_converted").asInt());

        for (JsonNode document : records.subList(1, 3)) {
            assertEquals("document", document.get("kind").asText());
            assertEquals("Document", document.get("ast").get("kind").asText());
            assertEquals("Generic", document.get("ast").get("type").asText());
            assertTrue(document.has("text"));
        }
    }

    @Test
    void run_SkipsFilesAboveLineLimit() throws Exception {
        Path file = tempDir.resolve("long.md");
        Files.writeString(file, "a\nb\nc\n");

        App.Summary summary = App.run(file, tempDir.resolve("out.jsonl"), MdastConfig.with(2, null, false));

        assertEquals(0, summary.converted);
        assertEquals(2, readRecords(tempDir.resolve("out.jsonl")).size());
    }

    @Test
    void convertFile_StripsBomAndOmitsTextByDefault() throws Exception {
        Path file = tempDir.resolve("bom.md");
        Files.writeString(file, "\uFEFF# Title\n", StandardCharsets.UTF_8);

        AstDocument document = App.convertFile(file, false);

        assertNull(document.text);
        assertEquals(0, document.ast.from);
        assertEquals(8, document.ast.to);
        JsonNode json = MAPPER.valueToTree(document);
        assertFalse(json.has("text"));
        assertEquals("Heading", json.get("ast").get("children").get(0).get("type").asText());
        assertEquals(1, json.get("ast").get("children").get(0).get("level").asInt());
    }

    private static List<JsonNode> readRecords(Path output) throws Exception {
        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                records.add(MAPPER.readTree(line));
            }
        }
        return records;
    }
}
