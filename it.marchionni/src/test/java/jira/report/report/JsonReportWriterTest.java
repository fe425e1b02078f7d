package jira.report.report;

import jira.report.fetcher.model.Issue;
import jira.report.fetcher.model.SubTask;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path tmp;

    @Test
    void dumpContainsEnrichedIssuesWithoutRawJson() throws Exception {
        Issue b = CsvReportWriterTest.issue("PROJ-2", "Bug", "Paolo");
        b.setAssigneeName("Alice");
        Issue a = CsvReportWriterTest.issue("PROJ-1", "Story", "Paolo");
        a.setSubTasks(List.of(new SubTask("Sub-task", "Docs", "Anna", "N/A")));

        Path file = tmp.resolve("report.json");
        new JsonReportWriter().write(List.of(b, a), file);

        JsonArray arr;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             JsonReader jr = Json.createReader(r)) {
            arr = jr.readArray();
        }
        assertEquals(2, arr.size());

        JsonObject first = arr.getJsonObject(0);
        assertEquals("PROJ-1", first.getString("key"));
        assertFalse(first.containsKey("data"));
        assertEquals("Docs", first.getJsonArray("subTasks").getJsonObject(0).getString("name"));

        assertEquals("Alice", arr.getJsonObject(1).getString("assigneeName"));
    }
}
