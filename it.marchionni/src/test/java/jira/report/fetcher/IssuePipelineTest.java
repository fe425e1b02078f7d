package jira.report.fetcher;

import jira.report.exceptions.PipelineException;
import jira.report.exceptions.TransportException;
import jira.report.extract.ValueExtractor;
import jira.report.fetcher.model.Issue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static jira.report.fetcher.Issues.issue;
import static jira.report.fetcher.Issues.subTask;
import static jira.report.fetcher.Issues.subtaskRefs;
import static org.junit.jupiter.api.Assertions.*;

class IssuePipelineTest {

    private static final String FIELDS = "["
            + "{\"id\":\"summary\",\"name\":\"Summary\",\"custom\":false},"
            + "{\"id\":\"issuetype\",\"name\":\"Issue Type\",\"custom\":false},"
            + "{\"id\":\"timetracking\",\"name\":\"Time tracking\",\"custom\":false},"
            + "{\"id\":\"customfield_10400\",\"name\":\"Severity\",\"custom\":true}]";

    private static FakeCommunicator tracker(int issues) {
        FakeCommunicator comm = new FakeCommunicator().respond(FieldCatalogResolver.FIELD_API, FIELDS);
        String[] keysAndIds = new String[issues * 2];
        for (int i = 0; i < issues; i++) {
            String id = String.valueOf(100 + i);
            String key = "PROJ-" + (i + 1);
            keysAndIds[2 * i] = key;
            keysAndIds[2 * i + 1] = id;
            String subId = String.valueOf(500 + i);
            comm.respond("/rest/api/2/issue/" + id + "?expand=changelog",
                    issue(id, key, i % 2 == 0 ? "Bug" : "Story", "Owner " + i, subtaskRefs(subId)));
            comm.respond("/rest/api/2/issue/" + subId, subTask(subId, key + "-sub", "Dev " + i, i + "h"));
        }
        return comm.respond(SearchRunner.SEARCH_API, Issues.searchResult(issues, keysAndIds));
    }

    @Test
    void everyIssueIsAggregatedConcurrently() throws Exception {
        FakeCommunicator comm = tracker(20);
        IssuePipeline pipeline = new IssuePipeline(comm, new ValueExtractor(), 4);
        List<Issue> out = new ArrayList<>();

        int count = pipeline.run("project = PROJ", List.of("Summary", "Severity"), out::add);

        assertEquals(20, count);
        assertEquals(20, out.size());
        assertEquals(40, pipeline.getTotalRestCalls());

        Map<String, Issue> byKey = out.stream().collect(Collectors.toMap(Issue::getKey, Function.identity()));
        assertEquals("Alice", byKey.get("PROJ-1").getAssigneeName());
        assertNull(byKey.get("PROJ-2").getAssigneeName());
        assertEquals("Dev 1", byKey.get("PROJ-2").getSubTasks().get(0).getAssigneeName());
        assertEquals(List.of("summary", "customfield_10400"), byKey.get("PROJ-3").getFields());
        assertEquals("summary,customfield_10400", comm.lastParams().get("fields"));
    }

    @Test
    void catalogIsResolvedBeforeTheSearch() throws Exception {
        FakeCommunicator comm = tracker(2);

        new IssuePipeline(comm, new ValueExtractor(), 2).run("project = PROJ", List.of("Summary"), i -> { });

        assertEquals(FieldCatalogResolver.FIELD_API, comm.calls().get(0));
        assertEquals(SearchRunner.SEARCH_API, comm.calls().get(1));
    }

    @Test
    void standardFieldNamesAreSearchedByTheirIds() throws Exception {
        FakeCommunicator comm = tracker(2);
        List<Issue> out = new ArrayList<>();

        new IssuePipeline(comm, new ValueExtractor(), 2)
                .run("project = PROJ", List.of("Issue Type", "Time tracking"), out::add);

        assertEquals("issuetype,timetracking", comm.lastParams().get("fields"));
        assertEquals(List.of("issuetype", "timetracking"), out.get(0).getFields());
    }

    @Test
    void oneFailedFetchAbortsTheRun() {
        FakeCommunicator comm = tracker(6).fail("/rest/api/2/issue/503", 500);
        IssuePipeline pipeline = new IssuePipeline(comm, new ValueExtractor(), 3);

        PipelineException e = assertThrows(PipelineException.class,
                () -> pipeline.run("project = PROJ", List.of("Summary"), i -> { }));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void failedSearchAbortsTheRun() {
        FakeCommunicator comm = tracker(1).fail(SearchRunner.SEARCH_API, 400);

        PipelineException e = assertThrows(PipelineException.class,
                () -> new IssuePipeline(comm, new ValueExtractor(), 2).run("bad jql", List.of(), i -> { }));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void workersMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new IssuePipeline(new FakeCommunicator(), new ValueExtractor(), 0));
    }
}
