package jira.report.fetcher;

import jira.report.exceptions.TransportException;

import java.util.Map;

/**
 * Chiamate REST verso il tracker. Una chiamata = una GET.
 */
public interface Communicator {

    /**
     * Esegue la GET su {@code apiPath} e restituisce il body della risposta.
     *
     * @param apiPath path relativo all'URL base, es. {@code /rest/api/2/field}
     * @param params  parametri di query, {@code null} se il path è già completo
     * @throws TransportException errore di rete o risposta non 2xx
     */
    byte[] createRequestAndGetResponse(String apiPath, Map<String, String> params) throws TransportException;
}
