package jira.report.exceptions;

import java.io.IOException;

/**
 * Eccezione sollevata quando la chiamata REST verso Jira fallisce:
 * errore di rete oppure risposta con stato non 2xx.
 */
public class TransportException extends IOException {

    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /** Codice HTTP della risposta, -1 se la richiesta non è arrivata al server. */
    public int getStatusCode() {
        return statusCode;
    }
}
