package jira.report.fetcher;

import jira.report.extract.ValueExtractor;
import jira.report.fetcher.model.Issue;
import jira.report.fetcher.model.SubTask;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static jira.report.fetcher.Issues.issue;
import static jira.report.fetcher.Issues.subTask;
import static jira.report.fetcher.Issues.subtaskRefs;
import static org.junit.jupiter.api.Assertions.*;

class SubTaskAggregatorTest {

    private final AtomicInteger calls = new AtomicInteger();

    private SubTaskAggregator aggregator(FakeCommunicator comm) {
        return new SubTaskAggregator(new IssueFetcher(comm), new ValueExtractor(), calls);
    }

    private static Issue found(String id, String key) {
        JsonObject data = Json.createObjectBuilder().add("id", id).add("key", key).build();
        return new Issue(data, List.of("summary"));
    }

    @Test
    void subTasksKeepParentOrder() throws Exception {
        FakeCommunicator comm = new FakeCommunicator()
                .respond("/rest/api/2/issue/10?expand=changelog",
                        issue("10", "PROJ-10", "Story", "Paolo", subtaskRefs("13", "11", "12")))
                .respond("/rest/api/2/issue/11", subTask("11", "PROJ-11", "Anna", "2h"))
                .respond("/rest/api/2/issue/12", subTask("12", "PROJ-12", "Luca", "1d"))
                .respond("/rest/api/2/issue/13", subTask("13", "PROJ-13", "Sara", "3h"));

        Issue result = aggregator(comm).aggregate(found("10", "PROJ-10"));

        List<SubTask> subTasks = result.getSubTasks();
        assertEquals(List.of("Sara", "Anna", "Luca"),
                List.of(subTasks.get(0).getAssigneeName(), subTasks.get(1).getAssigneeName(),
                        subTasks.get(2).getAssigneeName()));
        SubTask first = subTasks.get(0);
        assertEquals("Sub-task", first.getType());
        assertEquals("Work part PROJ-13", first.getName());
        assertEquals("3h", first.getTotalHours());
        assertEquals(4, calls.get());
        assertEquals(List.of("/rest/api/2/issue/10?expand=changelog", "/rest/api/2/issue/13",
                "/rest/api/2/issue/11", "/rest/api/2/issue/12"), comm.calls());
    }

    @Test
    void storyKeepsOriginalAssignee() throws Exception {
        FakeCommunicator comm = new FakeCommunicator().respond("/rest/api/2/issue/20?expand=changelog",
                issue("20", "PROJ-20", "Story", "Paolo", "[]"));

        Issue result = aggregator(comm).aggregate(found("20", "PROJ-20"));

        assertNull(result.getAssigneeName());
        assertTrue(result.getSubTasks().isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    void bugGetsDeveloperFromChangelog() throws Exception {
        FakeCommunicator comm = new FakeCommunicator().respond("/rest/api/2/issue/30?expand=changelog",
                issue("30", "PROJ-30", "Production Issue", "Paolo", "[]"));

        Issue result = aggregator(comm).aggregate(found("30", "PROJ-30"));

        assertEquals("Alice", result.getAssigneeName());
    }

    @Test
    void bugWithoutTransitionGetsEmptyDeveloper() throws Exception {
        String parent = "{\"id\":\"40\",\"key\":\"PROJ-40\",\"fields\":{\"issuetype\":{\"name\":\"bug\"},"
                + "\"subtasks\":[]},\"changelog\":{\"histories\":[]}}";
        FakeCommunicator comm = new FakeCommunicator().respond("/rest/api/2/issue/40?expand=changelog", parent);

        Issue result = aggregator(comm).aggregate(found("40", "PROJ-40"));

        assertEquals("", result.getAssigneeName());
    }

    @Test
    void missingSubTaskFailsTheIssue() {
        FakeCommunicator comm = new FakeCommunicator()
                .respond("/rest/api/2/issue/50?expand=changelog",
                        issue("50", "PROJ-50", "Task", "Paolo", subtaskRefs("51")))
                .fail("/rest/api/2/issue/51", 404);

        assertThrows(jira.report.exceptions.TransportException.class,
                () -> aggregator(comm).aggregate(found("50", "PROJ-50")));
        assertEquals(2, calls.get());
    }
}
