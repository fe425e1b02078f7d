package jira.report.fetcher;

import jira.report.exceptions.MalformedResponseException;
import jira.report.exceptions.TransportException;
import jira.report.extract.ChangelogScanner;
import jira.report.extract.IssueClassifier;
import jira.report.extract.ValueExtractor;
import jira.report.fetcher.model.Issue;
import jira.report.fetcher.model.SubTask;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Completa un'issue trovata dalla search: scarica il padre (con changelog),
 * poi ogni sotto-attività, e per i bug sostituisce l'assegnatario con lo
 * sviluppatore ricavato dal changelog.
 */
public class SubTaskAggregator {

    private static final Logger log = LoggerFactory.getLogger(SubTaskAggregator.class);

    private final IssueFetcher fetcher;
    private final ValueExtractor extractor;
    private final AtomicInteger totalRestCalls;

    public SubTaskAggregator(IssueFetcher fetcher, ValueExtractor extractor, AtomicInteger totalRestCalls) {
        this.fetcher        = Objects.requireNonNull(fetcher);
        this.extractor      = Objects.requireNonNull(extractor);
        this.totalRestCalls = Objects.requireNonNull(totalRestCalls);
    }

    public Issue aggregate(Issue issue) throws TransportException {
        String issueId = issue.getId();
        if (issueId == null) {
            throw new MalformedResponseException("Issue senza 'id' nella risposta della search");
        }

        totalRestCalls.incrementAndGet();
        JsonObject parent = fetcher.fetchIssue(issueId, true);

        List<SubTask> result = new ArrayList<>();
        for (String subTaskId : subTaskIds(parent)) {
            totalRestCalls.incrementAndGet();
            JsonObject subTaskIssue = fetcher.fetchIssue(subTaskId, false);
            result.add(new SubTask(
                    extractor.extractField(subTaskIssue, "issuetype"),
                    extractor.extractField(subTaskIssue, "summary"),
                    extractor.extractField(subTaskIssue, "assignee"),
                    extractor.extractField(subTaskIssue, "timetracking")));
        }
        issue.setSubTasks(result);

        String parentType = extractor.extractField(parent, "issuetype");
        if (IssueClassifier.isBug(parentType)) {
            issue.setAssigneeName(ChangelogScanner.developerOfRecord(parent));
            log.debug("{} è un {}: sviluppatore '{}'", issue.getKey(), parentType, issue.getAssigneeName());
        }
        return issue;
    }

    private static List<String> subTaskIds(JsonObject parent) {
        JsonObject fields = JsonResponses.asObject(parent.get("fields"), "issue.fields");
        JsonValue subtasks = fields.get("subtasks");
        if (subtasks == null || subtasks.getValueType() == JsonValue.ValueType.NULL) {
            // tipi di issue senza sotto-attività non espongono il campo
            return List.of();
        }
        if (subtasks.getValueType() != JsonValue.ValueType.ARRAY) {
            throw new MalformedResponseException("'fields.subtasks' non è un array");
        }
        List<String> ids = new ArrayList<>();
        for (JsonValue st : subtasks.asJsonArray()) {
            ids.add(JsonResponses.requireString(JsonResponses.asObject(st, "subtasks[]"), "id", "subtasks[]"));
        }
        return ids;
    }
}
