package com.williamcallahan.procaudit.service.procedure;

/**
 * Signals a failure that aborts a whole parse pass, such as an unreadable included document.
 */
public class ProcedureParsingException extends IllegalStateException {

    /**
     * Creates a procedure parsing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public ProcedureParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
