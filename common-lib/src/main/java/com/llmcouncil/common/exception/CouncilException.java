package com.llmcouncil.common.exception;

public class CouncilException extends RuntimeException {
    private final ErrorKind kind;

    public CouncilException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CouncilException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
