package jira.report.exceptions;

/**
 * Eccezione sollevata quando una esecuzione della pipeline si interrompe.
 */
public class PipelineException extends Exception {
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
