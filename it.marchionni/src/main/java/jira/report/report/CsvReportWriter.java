package jira.report.report;

import jira.report.exceptions.MalformedResponseException;
import jira.report.exceptions.ReportWriterException;
import jira.report.extract.ValueExtractor;
import jira.report.fetcher.model.Issue;
import jira.report.fetcher.model.SubTask;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Genera il CSV del report:
 *  - una riga per sotto-attività (una sola riga con "N/A" se non ce ne sono)
 *  - colonne: chiave, campi richiesti, sviluppatore, dati della sotto-attività
 *  - issue ordinate per chiave, perché i worker le consegnano in ordine sparso
 */
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    static final String[] SUBTASK_HEADERS = {
            "Developer", "Sub-task Type", "Sub-task Name", "Sub-task Assignee", "Sub-task Hours"
    };

    private final List<String> fieldNames;
    private final ValueExtractor extractor;

    /**
     * @param fieldNames nomi leggibili dei campi, nello stesso ordine degli id
     *                   memorizzati in ogni {@link Issue#getFields()}
     */
    public CsvReportWriter(List<String> fieldNames, ValueExtractor extractor) {
        this.fieldNames = List.copyOf(fieldNames);
        this.extractor  = Objects.requireNonNull(extractor);
    }

    public void write(List<Issue> issues, Path outputCsv) throws ReportWriterException {
        try (Writer w = Files.newBufferedWriter(outputCsv, StandardCharsets.UTF_8);
             CSVPrinter csv = new CSVPrinter(w, getCsvFormat())) {
            int rows = 0;
            for (Issue issue : sortedByKey(issues)) {
                rows += printIssue(csv, issue);
            }
            log.info("✅ Report CSV salvato in {} ({} righe)", outputCsv, rows);
        } catch (IOException e) {
            throw new ReportWriterException("Errore generazione CSV in " + outputCsv, e);
        } catch (MalformedResponseException e) {
            throw new ReportWriterException("Valore non rappresentabile nel CSV " + outputCsv, e);
        }
    }

    static List<Issue> sortedByKey(List<Issue> issues) {
        Comparator<String> byKey = Comparator.nullsLast(IssueKeys::compare);
        List<Issue> sorted = new ArrayList<>(issues);
        sorted.sort(Comparator.comparing(Issue::getKey, byKey));
        return sorted;
    }

    private CSVFormat getCsvFormat() {
        List<String> headers = new ArrayList<>();
        headers.add("Key");
        headers.addAll(fieldNames);
        headers.addAll(List.of(SUBTASK_HEADERS));
        return CSVFormat.DEFAULT.builder()
                .setHeader(headers.toArray(new String[0]))
                .build();
    }

    private int printIssue(CSVPrinter csv, Issue issue) throws IOException {
        List<String> base = new ArrayList<>();
        base.add(issue.getKey() == null ? ValueExtractor.NOT_AVAILABLE : issue.getKey());
        for (String fieldId : issue.getFields()) {
            base.add(extractor.extractField(issue.getData(), fieldId));
        }
        base.add(developerOf(issue));

        if (issue.getSubTasks().isEmpty()) {
            csv.printRecord(row(base, null));
            return 1;
        }
        for (SubTask st : issue.getSubTasks()) {
            csv.printRecord(row(base, st));
        }
        return issue.getSubTasks().size();
    }

    // per i bug vale lo sviluppatore del changelog, altrimenti l'assegnatario
    private String developerOf(Issue issue) {
        return issue.getAssigneeName() != null
                ? issue.getAssigneeName()
                : extractor.extractField(issue.getData(), "assignee");
    }

    private static List<String> row(List<String> base, SubTask st) {
        List<String> row = new ArrayList<>(base);
        if (st == null) {
            row.addAll(List.of(ValueExtractor.NOT_AVAILABLE, ValueExtractor.NOT_AVAILABLE,
                    ValueExtractor.NOT_AVAILABLE, ValueExtractor.NOT_AVAILABLE));
        } else {
            row.addAll(List.of(st.getType(), st.getName(), st.getAssigneeName(), st.getTotalHours()));
        }
        return row;
    }
}
