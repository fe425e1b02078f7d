package jira.report.fetcher;

import jira.report.exceptions.TransportException;
import jira.report.fetcher.model.Issue;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Esegue una query JQL su {@code /rest/api/2/search} e mette le issue trovate
 * nel canale di uscita, nell'ordine della risposta.
 *
 * <p>Una sola pagina da {@value #MAX_RESULTS}: i risultati oltre questo
 * limite vengono persi (viene solo scritto un warning).</p>
 */
public class SearchRunner {

    private static final Logger log = LoggerFactory.getLogger(SearchRunner.class);

    static final String SEARCH_API = "/rest/api/2/search";
    static final int MAX_RESULTS = 1000;

    private final Communicator communicator;

    public SearchRunner(Communicator communicator) {
        this.communicator = Objects.requireNonNull(communicator);
    }

    /**
     * @param jql      filtro JQL
     * @param fieldIds id dei campi richiesti, passati anche a ogni {@link Issue}
     * @param channel  canale su cui consegnare le issue
     * @return numero di issue consegnate
     */
    public int search(String jql, List<String> fieldIds, BlockingQueue<Issue> channel)
            throws TransportException, InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("jql", jql);
        params.put("fields", String.join(",", fieldIds));
        params.put("maxResults", String.valueOf(MAX_RESULTS));

        byte[] body = communicator.createRequestAndGetResponse(SEARCH_API, params);
        JsonObject response = JsonResponses.readObject(body, SEARCH_API);

        int delivered = 0;
        for (JsonValue raw : JsonResponses.requireArray(response, "issues", SEARCH_API)) {
            channel.put(new Issue(JsonResponses.asObject(raw, SEARCH_API + " issues[]"), fieldIds));
            delivered++;
        }

        JsonValue total = response.get("total");
        if (total instanceof JsonNumber && ((JsonNumber) total).intValue() > delivered) {
            log.warn("⚠️ La query restituisce {} issue, elaborate solo le prime {}",
                    ((JsonNumber) total).intValue(), delivered);
        }
        log.info("→ {} issue trovate per \"{}\"", delivered, jql);
        return delivered;
    }
}
