package jira.report.fetcher;

import jira.report.exceptions.TransportException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link Communicator} basato su OkHttp. Il token è già codificato e viene
 * inviato così com'è dopo "Basic ".
 */
public class JiraCommunicator implements Communicator {

    private static final Logger log = LoggerFactory.getLogger(JiraCommunicator.class);

    private final OkHttpClient client;
    private final String baseUrl;
    private final String authToken;

    public JiraCommunicator(String baseUrl, String authToken) {
        this(new OkHttpClient(), baseUrl, authToken);
    }

    public JiraCommunicator(OkHttpClient client, String baseUrl, String authToken) {
        this.client    = Objects.requireNonNull(client);
        this.baseUrl   = Objects.requireNonNull(baseUrl);
        this.authToken = Objects.requireNonNull(authToken);
    }

    @Override
    public byte[] createRequestAndGetResponse(String apiPath, Map<String, String> params)
            throws TransportException {
        Request request = buildRequest(apiPath, params);
        log.debug("GET {}", request.url());

        try (Response resp = client.newCall(request).execute()) {
            validateResponse(request, resp);
            ResponseBody body = resp.body();
            return body == null ? new byte[0] : body.bytes();
        } catch (TransportException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException("Chiamata Jira fallita: " + request.url(), e);
        }
    }

    // ====================== METODI DI SUPPORTO ======================

    Request buildRequest(String apiPath, Map<String, String> params) throws TransportException {
        return new Request.Builder()
                .url(buildUrl(apiPath, params))
                .header("Authorization", "Basic " + authToken)
                .header("Accept", "application/json")
                .get()
                .build();
    }

    HttpUrl buildUrl(String apiPath, Map<String, String> params) throws TransportException {
        HttpUrl url = HttpUrl.parse(baseUrl + apiPath);
        if (url == null) {
            throw new TransportException("URL non valido: " + baseUrl + apiPath, -1);
        }
        if (params == null) {
            return url;
        }
        HttpUrl.Builder builder = url.newBuilder();
        // ordine delle chiavi stabile, come nella codifica form standard
        new TreeMap<>(params).forEach(builder::addQueryParameter);
        return builder.build();
    }

    private void validateResponse(Request request, Response resp) throws TransportException {
        if (!resp.isSuccessful()) {
            throw new TransportException("Jira API error: HTTP " + resp.code() + " - "
                    + resp.message() + " (" + request.url() + ")", resp.code());
        }
    }
}
