package com.llmcouncil.common.exception;

/**
 * Raised inside a backend client when one provider call fails. Clients convert it into a
 * failed {@code ModelResponse} before anything reaches the orchestrator.
 */
public class BackendCallException extends CouncilException {
    private final String backendId;

    public BackendCallException(String backendId, String message) {
        super(ErrorKind.INTERNAL, "[" + backendId + "] " + message);
        this.backendId = backendId;
    }

    public BackendCallException(String backendId, String message, Throwable cause) {
        super(ErrorKind.INTERNAL, "[" + backendId + "] " + message, cause);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
