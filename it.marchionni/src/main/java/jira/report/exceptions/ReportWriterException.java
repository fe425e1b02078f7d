package jira.report.exceptions;

/**
 * Eccezione sollevata in caso di errori nella scrittura del report (CSV o JSON).
 */
public class ReportWriterException extends Exception {
    public ReportWriterException(String message, Throwable cause) {
        super(message, cause);
    }
}
