package jira.report.extract;

/**
 * Comportamento quando il campo {@code created} non è una data valida.
 */
public enum DateFailurePolicy {
    /** Interrompe l'estrazione con {@link jira.report.exceptions.MalformedResponseException}. */
    FAIL,
    /** Restituisce "N/A", come per un campo assente. */
    NOT_AVAILABLE
}
