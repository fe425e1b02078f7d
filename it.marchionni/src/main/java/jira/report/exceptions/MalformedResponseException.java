package jira.report.exceptions;

/**
 * Eccezione sollevata quando il JSON restituito da Jira non ha la forma attesa
 * (chiave mancante, tipo diverso da quello previsto).
 */
public class MalformedResponseException extends RuntimeException {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
