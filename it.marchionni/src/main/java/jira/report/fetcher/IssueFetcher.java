package jira.report.fetcher;

import jira.report.exceptions.TransportException;
import jakarta.json.JsonObject;

import java.util.Objects;

public class IssueFetcher {

    static final String ISSUE_API = "/rest/api/2/issue/";
    static final String EXPAND_CHANGELOG = "?expand=changelog";

    private final Communicator communicator;

    public IssueFetcher(Communicator communicator) {
        this.communicator = Objects.requireNonNull(communicator);
    }

    /**
     * Scarica una singola issue. Nessun retry: l'errore arriva al chiamante.
     *
     * @param includeChangeLog se true aggiunge {@code ?expand=changelog}
     */
    public JsonObject fetchIssue(String id, boolean includeChangeLog) throws TransportException {
        String path = issuePath(id, includeChangeLog);
        byte[] body = communicator.createRequestAndGetResponse(path, null);
        return JsonResponses.readObject(body, path);
    }

    static String issuePath(String id, boolean includeChangeLog) {
        return includeChangeLog ? ISSUE_API + id + EXPAND_CHANGELOG : ISSUE_API + id;
    }
}
