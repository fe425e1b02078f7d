package jira.report.report;

import jira.report.exceptions.ReportWriterException;
import jira.report.fetcher.model.Issue;
import jakarta.json.bind.Jsonb;
import jakarta.json.bind.JsonbBuilder;
import jakarta.json.bind.JsonbConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Scrive su file le issue elaborate in JSON formattato (senza il JSON grezzo).
 */
public class JsonReportWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    public void write(List<Issue> issues, Path file) throws ReportWriterException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             Jsonb jb = JsonbBuilder.create(new JsonbConfig().withFormatting(true))) {
            jb.toJson(CsvReportWriter.sortedByKey(issues), w);
            log.info("✅ Dump JSON salvato in {}", file);
        } catch (Exception e) {
            throw new ReportWriterException("Errore durante dump JSON in " + file, e);
        }
    }
}
